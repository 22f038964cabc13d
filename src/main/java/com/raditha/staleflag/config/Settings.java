package com.raditha.staleflag.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.File;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Process-wide settings read from a YAML file, with command line overrides
 * applied through {@link #setProperty(String, Object)}.
 */
public class Settings {

    public static final String DEFAULT_CONFIG_FILE = "stale-flag.yml";
    public static final String BASE_PATH = "base_path";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static Map<String, Object> props = new HashMap<>();

    private Settings() {
        /* this is only a utility class */
    }

    /**
     * Load {@value #DEFAULT_CONFIG_FILE} from the working directory, or start empty
     * when there is none.
     */
    public static synchronized void loadConfigMap() throws IOException {
        File file = new File(DEFAULT_CONFIG_FILE);
        if (file.exists()) {
            loadConfigMap(file);
        } else {
            props = new HashMap<>();
        }
    }

    public static synchronized void loadConfigMap(File file) throws IOException {
        Map<String, Object> loaded = YAML.readValue(file, new TypeReference<Map<String, Object>>() {});
        props = loaded == null ? new HashMap<>() : new HashMap<>(loaded);
    }

    public static synchronized Object getProperty(String key) {
        return props.get(key);
    }

    public static synchronized void setProperty(String key, Object value) {
        props.put(key, value);
    }

    public static String getBasePath() {
        Object value = getProperty(BASE_PATH);
        return value == null ? "." : value.toString();
    }
}
