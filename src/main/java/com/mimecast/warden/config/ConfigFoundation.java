package com.mimecast.warden.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * JSON5 file loader for configuration objects.
 *
 * <p>Gson reads leniently so comments and unquoted keys are accepted.
 */
public class ConfigFoundation extends BasicConfig {
    protected static final Logger log = LogManager.getLogger(ConfigFoundation.class);

    public ConfigFoundation() {
        super();
    }

    public ConfigFoundation(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new ConfigFoundation instance from a file.
     *
     * @param path Path to JSON5 file.
     * @throws IOException Unable to read or parse file.
     */
    public ConfigFoundation(Path path) throws IOException {
        super(readFile(path));
    }

    /**
     * Reads a JSON5 file into a map.
     *
     * @param path File path.
     * @return Map.
     * @throws IOException Unable to read or parse file.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> readFile(Path path) throws IOException {
        String content = Files.readString(path, StandardCharsets.UTF_8);
        try {
            Map<String, Object> map = new Gson().fromJson(content, Map.class);
            log.debug("Loaded configuration file: {}", path);
            return map;
        } catch (JsonParseException e) {
            throw new IOException("Invalid configuration file " + path + ": " + e.getMessage(), e);
        }
    }
}
