package com.pixelservices.invoke.components.fileserver;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;

public class FileServerUtility {

    /**
     * Resolves a request path under {@code root}. Returns null when the result would escape the root.
     */
    public static Path resolveUnderRoot(Path root, String requestPath) {
        String relative = requestPath == null ? "" : requestPath;
        while (relative.startsWith("/")) {
            relative = relative.substring(1);
        }
        while (relative.endsWith("/")) {
            relative = relative.substring(0, relative.length() - 1);
        }
        Path normalizedRoot = root.toAbsolutePath().normalize();
        try {
            Path resolved = normalizedRoot.resolve(relative).normalize();
            return resolved.startsWith(normalizedRoot) ? resolved : null;
        } catch (InvalidPathException e) {
            return null;
        }
    }

    public static String getContentType(String fileName) {
        String name = fileName.toLowerCase(Locale.ROOT);
        if (name.endsWith(".html") || name.endsWith(".htm")) return "text/html";
        if (name.endsWith(".js")) return "application/javascript";
        if (name.endsWith(".css")) return "text/css";
        if (name.endsWith(".txt")) return "text/plain";
        if (name.endsWith(".png")) return "image/png";
        if (name.endsWith(".jpg") || name.endsWith(".jpeg")) return "image/jpeg";
        if (name.endsWith(".svg")) return "image/svg+xml";
        if (name.endsWith(".gif")) return "image/gif";
        if (name.endsWith(".json")) return "application/json";
        if (name.endsWith(".xml")) return "application/xml";
        if (name.endsWith(".woff")) return "font/woff";
        if (name.endsWith(".woff2")) return "font/woff2";
        if (name.endsWith(".ttf")) return "font/ttf";
        if (name.endsWith(".ico")) return "image/x-icon";
        if (name.endsWith(".pdf")) return "application/pdf";
        if (name.endsWith(".zip")) return "application/zip";
        if (name.endsWith(".mp4")) return "video/mp4";
        if (name.endsWith(".mp3")) return "audio/mpeg";
        return "application/octet-stream";
    }
}
