package io.binana.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import java.util.function.UnaryOperator;

/**
 * Holds the exchange credentials.
 *
 * Sources:
 * - a properties file (binana.api_key=..., binana.api_secret=...)
 * - environment variables, named by upper-casing the key and replacing '.' with '_'
 *   (binana.api_key -> BINANA_API_KEY); they override file values
 *
 * Secret values are never logged; use {@link #getMasked(String)} for display.
 */
public class SecretsManager {
    private static final Logger log = LoggerFactory.getLogger(SecretsManager.class);

    public static final String API_KEY = "binana.api_key";
    public static final String API_SECRET = "binana.api_secret";

    private final Map<String, String> secrets = new HashMap<>();
    private final UnaryOperator<String> environment;
    private boolean loaded = false;

    public SecretsManager() {
        this(System::getenv);
    }

    /**
     * @param environment Environment variable lookup (returns null when unset)
     */
    public SecretsManager(UnaryOperator<String> environment) {
        this.environment = environment;
    }

    /**
     * Load secrets from a properties file, then apply environment overrides for the given keys.
     * A missing file is not an error: the environment is used alone.
     *
     * @param filePath Path to the secrets file
     * @param keys Keys that may be overridden from the environment
     * @throws IOException if the file exists but cannot be read
     */
    public void loadFromFile(Path filePath, String... keys) throws IOException {
        if (!Files.exists(filePath)) {
            log.warn("[SecretsManager] Secrets file not found: {}, using environment variables only", filePath);
        } else {
            Properties props = new Properties();
            try (InputStream input = Files.newInputStream(filePath)) {
                props.load(input);
            }
            for (String key : props.stringPropertyNames()) {
                String value = props.getProperty(key);
                if (value != null && !value.isBlank()) {
                    secrets.put(key, value.trim());
                }
            }
            log.info("[SecretsManager] Loaded {} secrets from {}", secrets.size(), filePath);
        }
        loadFromEnvironment(keys);
    }

    /**
     * Load secrets from environment variables only.
     *
     * @param keys Expected secret keys
     */
    public void loadFromEnvironment(String... keys) {
        for (String key : keys) {
            String envKey = envKey(key);
            String value = environment.apply(envKey);
            if (value != null && !value.isBlank()) {
                secrets.put(key, value.trim());
                log.info("[SecretsManager] Loaded '{}' from environment variable '{}'", key, envKey);
            }
        }
        loaded = true;
    }

    /**
     * @throws IllegalStateException if the secret is missing or nothing was loaded yet
     */
    public String getRequired(String key) {
        if (!loaded) {
            throw new IllegalStateException("SecretsManager not loaded. Call loadFromFile() or loadFromEnvironment() first.");
        }
        String value = secrets.get(key);
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("Required secret not found: " + key + " (set " + envKey(key) + ")");
        }
        return value;
    }

    public boolean has(String key) {
        String value = secrets.get(key);
        return value != null && !value.isBlank();
    }

    /**
     * First 4 characters and length, e.g. "abcd**** (64 chars)".
     */
    public String getMasked(String key) {
        String value = secrets.get(key);
        if (value == null || value.isBlank()) {
            return null;
        }
        if (value.length() <= 4) {
            return "****";
        }
        return String.format("%s**** (%d chars)", value.substring(0, 4), value.length());
    }

    /**
     * @throws IllegalStateException listing every missing key
     */
    public void validateRequired(String... requiredKeys) {
        if (!loaded) {
            throw new IllegalStateException("SecretsManager not loaded");
        }
        StringBuilder missing = new StringBuilder();
        for (String key : requiredKeys) {
            if (!has(key)) {
                if (missing.length() > 0) missing.append(", ");
                missing.append(key);
            }
        }
        if (missing.length() > 0) {
            throw new IllegalStateException("Missing required secrets: " + missing);
        }
    }

    static String envKey(String key) {
        return key.toUpperCase().replace(".", "_");
    }
}
