package com.mimecast.footer.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration foundation.
 *
 * <p>Map backed container with type safe accessors and defaults.
 * <p>Files are JSON5, read leniently through Gson so comments and unquoted keys are accepted.
 */
public class ConfigFoundation {
    private static final Logger log = LoggerFactory.getLogger(ConfigFoundation.class);

    /**
     * Configuration map.
     */
    protected final Map<String, Object> map;

    /**
     * Constructs a new empty ConfigFoundation instance.
     */
    public ConfigFoundation() {
        this.map = new HashMap<>();
    }

    /**
     * Constructs a new ConfigFoundation instance.
     *
     * @param map Configuration map.
     */
    public ConfigFoundation(Map<String, Object> map) {
        this.map = map != null ? map : new HashMap<>();
    }

    /**
     * Constructs a new ConfigFoundation instance from a JSON5 file.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read or parse file.
     */
    public ConfigFoundation(String path) throws IOException {
        this(readFile(Paths.get(path)));
    }

    /**
     * Reads a JSON5 file into a map.
     *
     * @param path Path to configuration file.
     * @return Configuration map.
     * @throws IOException Unable to read or parse file.
     */
    @SuppressWarnings("unchecked")
    private static Map<String, Object> readFile(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Map<String, Object> map = new Gson().fromJson(reader, Map.class);
            log.debug("Loaded configuration file: {}", path);
            return map != null ? map : new HashMap<>();
        } catch (JsonParseException e) {
            throw new IOException("Invalid configuration file " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Gets configuration map.
     *
     * @return Map.
     */
    public Map<String, Object> getMap() {
        return map;
    }

    /**
     * Has property.
     *
     * @param name Property name.
     * @return Boolean.
     */
    public boolean hasProperty(String name) {
        return map.containsKey(name);
    }

    /**
     * Gets string property.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return String.
     */
    public String getStringProperty(String name, String defaultValue) {
        Object value = map.get(name);
        return value != null ? String.valueOf(value) : defaultValue;
    }

    /**
     * Gets boolean property.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String name, boolean defaultValue) {
        Object value = map.get(name);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value != null ? Boolean.parseBoolean(String.valueOf(value)) : defaultValue;
    }
}
