package com.pixelservices.invoke.models;

import org.json.JSONObject;

/**
 * Uniform JSON envelope: {@code {"code": .., "url": .., "desc": .., "data": ..}}.
 */
public record ResponseResult(int code, String url, String desc, Object data) {

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("code", code);
        json.put("url", url);
        json.put("desc", desc);
        Object wrapped = data == null ? null : JSONObject.wrap(data);
        json.put("data", wrapped == null ? JSONObject.NULL : wrapped);
        return json;
    }
}
