package org.permsync.main;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

public class Config {

    private Properties properties;
    private Map<String, String> environment;

    public Config(String path) throws IOException {
        this(loadProperties(path), System.getenv());
    }

    public Config(Properties properties, Map<String, String> environment) {
        this.properties = properties;
        this.environment = (environment == null) ? new HashMap<>() : environment;
    }

    private static Properties loadProperties(String path) throws IOException {
        Properties result = new Properties();

        try (InputStream is = new FileInputStream(path)) {
            result.load(is);
        }

        return result;
    }

    public Group readGroup(String prefix) {
        return new Group(prefix);
    }

    // Explicit mappings from upstream group name to access group name, keyed `mapping.<name>`.
    public Map<String, String> mappingOverrides() {
        Map<String, String> result = new HashMap<>();

        for (String key : properties.stringPropertyNames()) {
            if (key.startsWith("mapping.") && key.length() > "mapping.".length()) {
                String value = getString(key, null);

                if (value != null) {
                    result.put(key.substring("mapping.".length()), value.trim());
                }
            }
        }

        return result;
    }

    public String getString(String property) {
        String value = getString(property, null);

        if (value == null) {
            throw new RuntimeException("Missing property: " + property);
        }

        return value;
    }

    public long getLong(String property, long defaultValue) {
        String value = getString(property, "");

        if ("".equals(value)) {
            return defaultValue;
        } else {
            return Long.valueOf(value.trim());
        }
    }

    public boolean getBoolean(String property, boolean defaultValue) {
        String value = getString(property, "");

        if ("".equals(value)) {
            return defaultValue;
        } else {
            return Boolean.parseBoolean(value.trim());
        }
    }

    // A property that isn't in the file can still come from the environment:
    // `okta.token` is looked up as OKTA_TOKEN.
    public String getString(String property, String defaultValue) {
        String value = properties.getProperty(property);

        if (value == null || value.isEmpty()) {
            value = environment.get(environmentKey(property));
        }

        if (value == null || value.isEmpty()) {
            return defaultValue;
        }

        return value;
    }

    static String environmentKey(String property) {
        return property.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    public class Group {
        private String prefix;

        public Group(String prefix) {
            this.prefix = prefix;
        }

        public String getString(String name) {
            return Config.this.getString(prefix + "." + name);
        }

        public String getString(String name, String defaultValue) {
            return Config.this.getString(prefix + "." + name, defaultValue);
        }

        public long getLong(String name, long defaultValue) {
            return Config.this.getLong(prefix + "." + name, defaultValue);
        }

        public boolean getBoolean(String name, boolean defaultValue) {
            return Config.this.getBoolean(prefix + "." + name, defaultValue);
        }
    }

}
