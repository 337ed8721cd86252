package com.pixelservices.invoke.components;

import com.pixelservices.invoke.components.http.routing.RoutePrecedence;
import com.pixelservices.invoke.exceptions.ConfigurationException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Settings for one server instance, loadable from a JSON file of the form
 * <pre>{@code
 * {
 *   "servers": [
 *     {
 *       "domain": "localhost",
 *       "port": 8080,
 *       "read_timeout": 5,
 *       "write_timeout": 10,
 *       "max_header_bytes": 1048576,
 *       "shutdown_grace_period": 5,
 *       "static_files": { "static_dir": ".", "index_file": "index.html" },
 *       "routing": { "case_sensitive": false, "route_precedence": "SPECIFICITY" },
 *       "middleware": ["logging"]
 *     }
 *   ]
 * }
 * }</pre>
 * Durations are in seconds.
 */
public class ServerConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(ServerConfiguration.class);

    public static final String DEFAULT_FILE = "server_conf.json";

    private String domain = "localhost";
    private int port = 8080;
    private Duration readTimeout = Duration.ofSeconds(5);
    private Duration writeTimeout = Duration.ofSeconds(10);
    private int maxHeaderBytes = 1048576;
    private Duration shutdownGracePeriod = Duration.ofSeconds(5);
    private Path staticDir = Paths.get(".");
    private String indexFile = "index.html";
    private boolean caseSensitive = false;
    private RoutePrecedence routePrecedence = RoutePrecedence.SPECIFICITY;
    private List<String> middleware = List.of("logging");

    // ------------------ Loading ------------------ //

    /**
     * Loads every server entry from {@code file}, writing a file with one default entry first if
     * it does not exist.
     *
     * @throws ConfigurationException if the file cannot be read or written, or holds invalid values
     */
    public static List<ServerConfiguration> loadAll(Path file) {
        if (!Files.exists(file)) {
            logger.info("Config file {} not found, creating default config", file);
            writeDefault(file);
        }
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration file: " + file, e);
        }
        try {
            JSONObject root = new JSONObject(content);
            JSONArray servers = root.optJSONArray("servers");
            if (servers == null || servers.isEmpty()) {
                throw new ConfigurationException("No servers configured in " + file);
            }
            List<ServerConfiguration> configurations = new ArrayList<>();
            for (int i = 0; i < servers.length(); i++) {
                configurations.add(fromJson(servers.getJSONObject(i)));
            }
            return Collections.unmodifiableList(configurations);
        } catch (JSONException | IllegalArgumentException e) {
            throw new ConfigurationException("Invalid configuration file " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads the first server entry from {@code file}.
     */
    public static ServerConfiguration load(Path file) {
        return loadAll(file).get(0);
    }

    public static ServerConfiguration load() {
        return load(Paths.get(DEFAULT_FILE));
    }

    /**
     * Reads one server entry. Missing keys keep their defaults.
     */
    public static ServerConfiguration fromJson(JSONObject json) {
        ServerConfiguration config = new ServerConfiguration();
        config.domain = json.optString("domain", config.domain);
        config.port = json.optInt("port", config.port);
        if (json.has("read_timeout")) config.readTimeout = Duration.ofSeconds(json.getLong("read_timeout"));
        if (json.has("write_timeout")) config.writeTimeout = Duration.ofSeconds(json.getLong("write_timeout"));
        if (json.has("shutdown_grace_period")) config.shutdownGracePeriod = Duration.ofSeconds(json.getLong("shutdown_grace_period"));
        config.maxHeaderBytes = json.optInt("max_header_bytes", config.maxHeaderBytes);

        JSONObject staticFiles = json.optJSONObject("static_files");
        if (staticFiles != null) {
            config.staticDir = Paths.get(staticFiles.optString("static_dir", config.staticDir.toString()));
            config.indexFile = staticFiles.optString("index_file", config.indexFile);
        }

        JSONObject routing = json.optJSONObject("routing");
        if (routing != null) {
            config.caseSensitive = routing.optBoolean("case_sensitive", config.caseSensitive);
            if (routing.has("route_precedence")) {
                config.routePrecedence = RoutePrecedence.valueOf(routing.getString("route_precedence").toUpperCase(Locale.ROOT));
            }
        }
        JSONArray middleware = json.optJSONArray("middleware");
        if (middleware != null) {
            List<String> names = new ArrayList<>();
            for (int i = 0; i < middleware.length(); i++) {
                names.add(middleware.getString(i));
            }
            config.middleware = List.copyOf(names);
        }
        config.validate();
        return config;
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("domain", domain);
        json.put("port", port);
        json.put("read_timeout", readTimeout.getSeconds());
        json.put("write_timeout", writeTimeout.getSeconds());
        json.put("max_header_bytes", maxHeaderBytes);
        json.put("shutdown_grace_period", shutdownGracePeriod.getSeconds());
        json.put("static_files", new JSONObject()
                .put("static_dir", staticDir.toString())
                .put("index_file", indexFile));
        json.put("routing", new JSONObject()
                .put("case_sensitive", caseSensitive)
                .put("route_precedence", routePrecedence.name()));
        json.put("middleware", new JSONArray(middleware));
        return json;
    }

    /**
     * Copies the bundled {@code server_conf.json} to {@code file}, or writes one built from the
     * defaults if the resource is missing.
     */
    private static void writeDefault(Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (InputStream resourceStream = ServerConfiguration.class.getClassLoader().getResourceAsStream(DEFAULT_FILE)) {
                if (resourceStream != null) {
                    Files.copy(resourceStream, file);
                    return;
                }
            }
            JSONObject root = new JSONObject().put("servers", new JSONArray().put(new ServerConfiguration().toJson()));
            Files.writeString(file, root.toString(4), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to create default configuration file: " + file, e);
        }
    }

    private void validate() {
        if (port < 0 || port > 65535) {
            throw new ConfigurationException("Port out of range: " + port);
        }
        if (maxHeaderBytes <= 0) {
            throw new ConfigurationException("max_header_bytes must be positive: " + maxHeaderBytes);
        }
    }

    // ------------------ Fluent setters ------------------ //

    public ServerConfiguration setDomain(String domain) {
        this.domain = domain;
        return this;
    }

    public ServerConfiguration setPort(int port) {
        this.port = port;
        validate();
        return this;
    }

    public ServerConfiguration setReadTimeout(Duration readTimeout) {
        this.readTimeout = readTimeout;
        return this;
    }

    public ServerConfiguration setWriteTimeout(Duration writeTimeout) {
        this.writeTimeout = writeTimeout;
        return this;
    }

    public ServerConfiguration setMaxHeaderBytes(int maxHeaderBytes) {
        this.maxHeaderBytes = maxHeaderBytes;
        validate();
        return this;
    }

    public ServerConfiguration setShutdownGracePeriod(Duration shutdownGracePeriod) {
        this.shutdownGracePeriod = shutdownGracePeriod;
        return this;
    }

    public ServerConfiguration setStaticDir(Path staticDir) {
        this.staticDir = staticDir;
        return this;
    }

    public ServerConfiguration setIndexFile(String indexFile) {
        this.indexFile = indexFile;
        return this;
    }

    public ServerConfiguration setCaseSensitive(boolean caseSensitive) {
        this.caseSensitive = caseSensitive;
        return this;
    }

    public ServerConfiguration setRoutePrecedence(RoutePrecedence routePrecedence) {
        this.routePrecedence = routePrecedence;
        return this;
    }

    /**
     * Names of the middleware wrapped around the router, outermost first.
     */
    public ServerConfiguration setMiddleware(List<String> middleware) {
        this.middleware = List.copyOf(middleware);
        return this;
    }

    // ------------------ Getters ------------------ //

    public String getDomain() {
        return domain;
    }

    public int getPort() {
        return port;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public Duration getWriteTimeout() {
        return writeTimeout;
    }

    public int getMaxHeaderBytes() {
        return maxHeaderBytes;
    }

    public Duration getShutdownGracePeriod() {
        return shutdownGracePeriod;
    }

    public Path getStaticDir() {
        return staticDir;
    }

    public String getIndexFile() {
        return indexFile;
    }

    public boolean isCaseSensitive() {
        return caseSensitive;
    }

    public RoutePrecedence getRoutePrecedence() {
        return routePrecedence;
    }

    public List<String> getMiddleware() {
        return middleware;
    }
}
