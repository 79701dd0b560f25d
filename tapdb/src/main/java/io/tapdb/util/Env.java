package io.tapdb.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Engine settings lookup. A key such as {@code TAPDB_DB_URL} is read from the
 * environment, then from the system property of the same name, then from the
 * dotted property form {@code tapdb.db.url}. Blank values count as unset.
 */
public final class Env {
    private static final Logger log = LoggerFactory.getLogger(Env.class);

    public static String get(String key, String defaultValue) {
        String value = firstNonBlank(System.getenv(key), System.getProperty(key), System.getProperty(propertyName(key)));
        return value != null ? value.trim() : defaultValue;
    }

    public static int getInt(String key, int defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric {}={}, using {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public static boolean getBool(String key, boolean defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        return "true".equalsIgnoreCase(value) || "1".equals(value) || "yes".equalsIgnoreCase(value);
    }

    /**
     * Enum constant named by the setting, case-insensitive.
     *
     * @throws IllegalArgumentException naming the key and the accepted values when unknown
     */
    public static <E extends Enum<E>> E getEnum(String key, Class<E> type, E defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Enum.valueOf(type, value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            String accepted = Arrays.stream(type.getEnumConstants()).map(Enum::name).collect(Collectors.joining(", "));
            throw new IllegalArgumentException(key + "=" + value + " is not one of " + accepted, e);
        }
    }

    /** {@code TAPDB_DB_URL} becomes {@code tapdb.db.url}. */
    static String propertyName(String key) {
        return key.toLowerCase(Locale.ROOT).replace('_', '.');
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    private Env() {}
}
