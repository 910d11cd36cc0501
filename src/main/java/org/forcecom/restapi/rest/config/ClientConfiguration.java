package org.forcecom.restapi.rest.config;

/**
 * Configuration interface for Force.com client settings.
 *
 * <p>Abstracts configuration sources (system properties, properties files, etc.)
 * to enable testability and flexibility.</p>
 *
 * <p><b>Configuration keys:</b> see {@link ClientConfigurationKeys}.</p>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * ClientConfiguration config = new SystemPropertyConfiguration();
 * String apiVersion = config.get(ClientConfigurationKeys.API_VERSION, "35.0");
 * }</pre>
 */
public interface ClientConfiguration {

    /**
     * Gets configuration value by key.
     *
     * @param key Configuration key
     * @return Configuration value or null if not found
     */
    String get(String key);

    /**
     * Gets configuration value by key with default fallback.
     *
     * @param key Configuration key
     * @param defaultValue Default value if key not found
     * @return Configuration value or default value
     */
    default String get(String key, String defaultValue) {
        String value = get(key);
        return value != null ? value : defaultValue;
    }

    /**
     * Gets a boolean value; anything other than {@code "true"} (ignoring case) is false.
     *
     * @param key Configuration key
     * @param defaultValue Default value if key not found
     * @return Parsed value or default value
     */
    default boolean getBoolean(String key, boolean defaultValue) {
        String value = get(key);
        return value != null ? Boolean.parseBoolean(value.trim()) : defaultValue;
    }

    /**
     * Gets an integer value.
     *
     * @param key Configuration key
     * @param defaultValue Default value if key not found
     * @return Parsed value or default value
     * @throws IllegalArgumentException If the value is not an integer
     */
    default int getInt(String key, int defaultValue) {
        String value = get(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Configuration key " + key + " is not an integer: " + value, e);
        }
    }

    /**
     * Checks if configuration key exists.
     *
     * @param key Configuration key
     * @return true if key exists, false otherwise
     */
    default boolean has(String key) {
        return get(key) != null;
    }
}
