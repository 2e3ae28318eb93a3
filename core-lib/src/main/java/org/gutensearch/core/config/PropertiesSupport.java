package org.gutensearch.core.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

/**
 * Helpers shared by the typed service configurations.
 *
 * <p>Properties are read from the classpath, then overlaid with environment variables.
 * Required keys fail fast with {@link IllegalStateException}.</p>
 */
public final class PropertiesSupport {
    private PropertiesSupport() {}

    public static Properties loadProperties(Class<?> anchor, String resourceName) {
        Properties properties = new Properties();
        try (InputStream in = anchor.getClassLoader().getResourceAsStream(resourceName)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + resourceName, e);
        }
        return properties;
    }

    public static void overlayEnvironment(Properties properties) {
        properties.putAll(System.getenv());
    }

    /**
     * Copies the value of an environment-style alias onto a property key when the alias is set.
     */
    public static void applyAlias(Properties properties, String alias, String key) {
        String value = trimToNull(properties.getProperty(alias));
        if (value != null) {
            properties.setProperty(key, value);
        }
    }

    public static String requireString(Properties properties, String key) {
        String value = trimToNull(properties.getProperty(key));
        if (value == null) {
            throw new IllegalStateException("Missing required configuration: " + key);
        }
        return value;
    }

    public static String optionalString(Properties properties, String key, String defaultValue) {
        String value = trimToNull(properties.getProperty(key));
        return value == null ? defaultValue : value;
    }

    public static int requireInt(Properties properties, String key) {
        return parseInt(key, requireString(properties, key));
    }

    public static int optionalInt(Properties properties, String key, int defaultValue) {
        String value = trimToNull(properties.getProperty(key));
        return value == null ? defaultValue : parseInt(key, value);
    }

    public static boolean optionalBoolean(Properties properties, String key, boolean defaultValue) {
        String value = trimToNull(properties.getProperty(key));
        return value == null ? defaultValue : Boolean.parseBoolean(value);
    }

    public static List<String> splitCsv(String csv) {
        return Arrays.stream(csv.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }

    public static List<Integer> splitCsvInts(String csv, List<Integer> defaultValue) {
        String trimmed = trimToNull(csv);
        if (trimmed == null) {
            return defaultValue;
        }

        List<Integer> parsed = splitCsv(trimmed).stream()
            .map(PropertiesSupport::parsePort)
            .toList();

        return parsed.isEmpty() ? defaultValue : parsed;
    }

    public static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static int parsePort(String value) {
        int port = parseInt("port list", value);
        if (port <= 0 || port > 65535) {
            throw new IllegalStateException("Port out of range: " + value);
        }
        return port;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for configuration '" + key + "': '" + value + "'", e);
        }
    }
}
