package com.pixelservices.invoke.models;

/**
 * Application error codes written into the {@code code} field of a JSON error envelope.
 */
public enum ErrorCode {
    AUTH_ERROR(1000, "AuthError"),
    PARAM_ERROR(2000, "ParamError"),
    BIZ_ERROR(3000, "BizError"),
    NET_ERROR(4000, "NetError"),
    DB_ERROR(5000, "DBError"),
    IO_ERROR(6000, "IOError"),
    OTHER_ERROR(7000, "OtherError");

    private final int code;
    private final String label;

    ErrorCode(int code, String label) {
        this.code = code;
        this.label = label;
    }

    public int getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }
}
