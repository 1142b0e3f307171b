package com.blockdsl.infra.config;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Configuration of the editor infrastructure: schema lookup caching, schema
 * fetch timeout and the definitions file used by the JSON store.
 *
 * <p>Values are resolved in increasing precedence:
 * <ol>
 *   <li>built-in defaults</li>
 *   <li>{@code editor.properties} (classpath root, then file system)</li>
 *   <li>environment variables {@code EDITOR_<PROPERTY_NAME>}</li>
 *   <li>explicit builder calls</li>
 * </ol>
 *
 * <p>Example environment variables:
 * <pre>
 * EDITOR_SCHEMA_CACHE_MAX_SIZE=5000
 * EDITOR_SCHEMA_CACHE_TTL_SECONDS=60
 * EDITOR_SCHEMA_FETCH_TIMEOUT_MS=2000
 * EDITOR_DEFINITIONS_FILE=/var/lib/editor/definitions.json
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * EditorConfig config = EditorConfig.loadDefault()
 *     .toBuilder()
 *     .schemaFetchTimeoutMs(1_000)
 *     .build();
 * }</pre>
 */
public final class EditorConfig {

    private static final Logger logger = Logger.getLogger(EditorConfig.class.getName());

    public static final String DEFAULT_PROPERTIES = "editor.properties";

    // ========================================================================
    // PROPERTY / ENVIRONMENT KEYS
    // ========================================================================

    static final String PROP_CACHE_ENABLED = "editor.schema.cache.enabled";
    static final String PROP_CACHE_MAX_SIZE = "editor.schema.cache.max.size";
    static final String PROP_CACHE_TTL_SECONDS = "editor.schema.cache.ttl.seconds";
    static final String PROP_FETCH_TIMEOUT_MS = "editor.schema.fetch.timeout.ms";
    static final String PROP_DEFINITIONS_FILE = "editor.definitions.file";

    private final boolean schemaCacheEnabled;
    private final long schemaCacheMaxSize;
    private final long schemaCacheTtlSeconds;
    private final long schemaFetchTimeoutMs;
    private final Path definitionsFile;

    private EditorConfig(Builder builder) {
        this.schemaCacheEnabled = builder.schemaCacheEnabled;
        this.schemaCacheMaxSize = builder.schemaCacheMaxSize;
        this.schemaCacheTtlSeconds = builder.schemaCacheTtlSeconds;
        this.schemaFetchTimeoutMs = builder.schemaFetchTimeoutMs;
        this.definitionsFile = builder.definitionsFile;
        validate();
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    /**
     * Defaults plus environment overrides, no properties file.
     */
    public static EditorConfig fromEnvironment() {
        return builder().build();
    }

    /**
     * Loads {@value #DEFAULT_PROPERTIES}; environment variables override its values.
     */
    public static EditorConfig loadDefault() {
        return loadFromProperties(DEFAULT_PROPERTIES);
    }

    /**
     * Loads configuration from a properties file, searched on the classpath
     * first and then on the file system. A missing file leaves the defaults in
     * place.
     *
     * @param propertiesPath classpath resource or file path
     */
    public static EditorConfig loadFromProperties(String propertiesPath) {
        return loadFromProperties(propertiesPath, System::getenv);
    }

    static EditorConfig loadFromProperties(String propertiesPath, Function<String, String> environment) {
        logger.fine("Loading editor configuration from: " + propertiesPath);
        Properties props = new Properties();

        try (InputStream is = EditorConfig.class.getClassLoader().getResourceAsStream(propertiesPath)) {
            if (is != null) {
                props.load(is);
                logger.fine("Loaded " + props.size() + " properties from classpath: " + propertiesPath);
            }
        } catch (IOException e) {
            logger.log(Level.FINE, "Could not load from classpath: " + propertiesPath, e);
        }

        if (props.isEmpty()) {
            try (InputStream fis = new FileInputStream(propertiesPath)) {
                props.load(fis);
                logger.fine("Loaded " + props.size() + " properties from file: " + propertiesPath);
            } catch (IOException e) {
                logger.fine("No editor properties at " + propertiesPath + ", using defaults");
            }
        }

        Builder builder = new Builder();
        builder.applyProperties(props);
        builder.applyEnvironment(environment);
        return builder.build();
    }

    public static Builder builder() {
        Builder builder = new Builder();
        builder.applyEnvironment(System::getenv);
        return builder;
    }

    /**
     * Builder initialized with this configuration's values. Environment
     * variables are not re-applied.
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.schemaCacheEnabled = this.schemaCacheEnabled;
        builder.schemaCacheMaxSize = this.schemaCacheMaxSize;
        builder.schemaCacheTtlSeconds = this.schemaCacheTtlSeconds;
        builder.schemaFetchTimeoutMs = this.schemaFetchTimeoutMs;
        builder.definitionsFile = this.definitionsFile;
        return builder;
    }

    // ========================================================================
    // GETTERS
    // ========================================================================

    public boolean isSchemaCacheEnabled() { return schemaCacheEnabled; }
    public long getSchemaCacheMaxSize() { return schemaCacheMaxSize; }
    public long getSchemaCacheTtlSeconds() { return schemaCacheTtlSeconds; }
    public Duration getSchemaCacheTtl() { return Duration.ofSeconds(schemaCacheTtlSeconds); }
    public long getSchemaFetchTimeoutMs() { return schemaFetchTimeoutMs; }
    public Duration getSchemaFetchTimeout() { return Duration.ofMillis(schemaFetchTimeoutMs); }
    public Path getDefinitionsFile() { return definitionsFile; }

    private void validate() {
        if (schemaCacheMaxSize <= 0) {
            throw new IllegalArgumentException("schemaCacheMaxSize must be positive: " + schemaCacheMaxSize);
        }
        if (schemaCacheTtlSeconds <= 0) {
            throw new IllegalArgumentException("schemaCacheTtlSeconds must be positive: " + schemaCacheTtlSeconds);
        }
        if (schemaFetchTimeoutMs <= 0) {
            throw new IllegalArgumentException("schemaFetchTimeoutMs must be positive: " + schemaFetchTimeoutMs);
        }
        if (definitionsFile == null) {
            throw new IllegalArgumentException("definitionsFile is required");
        }
    }

    @Override
    public String toString() {
        return String.format(
            "EditorConfig{schemaCache=%b, maxSize=%d, ttl=%ds, fetchTimeout=%dms, definitions=%s}",
            schemaCacheEnabled, schemaCacheMaxSize, schemaCacheTtlSeconds, schemaFetchTimeoutMs, definitionsFile);
    }

    public static class Builder {

        private boolean schemaCacheEnabled = true;
        private long schemaCacheMaxSize = 1_000;
        private long schemaCacheTtlSeconds = 300;
        private long schemaFetchTimeoutMs = 5_000;
        private Path definitionsFile = Path.of("definitions.json");

        private Builder() {
        }

        private void applyProperties(Properties props) {
            readBoolean(props.getProperty(PROP_CACHE_ENABLED), PROP_CACHE_ENABLED)
                .ifPresent(val -> this.schemaCacheEnabled = val);
            readLong(props.getProperty(PROP_CACHE_MAX_SIZE), PROP_CACHE_MAX_SIZE)
                .ifPresent(val -> this.schemaCacheMaxSize = val);
            readLong(props.getProperty(PROP_CACHE_TTL_SECONDS), PROP_CACHE_TTL_SECONDS)
                .ifPresent(val -> this.schemaCacheTtlSeconds = val);
            readLong(props.getProperty(PROP_FETCH_TIMEOUT_MS), PROP_FETCH_TIMEOUT_MS)
                .ifPresent(val -> this.schemaFetchTimeoutMs = val);
            readString(props.getProperty(PROP_DEFINITIONS_FILE))
                .ifPresent(val -> this.definitionsFile = Path.of(val));
        }

        private void applyEnvironment(Function<String, String> environment) {
            env(environment, PROP_CACHE_ENABLED).flatMap(val -> readBoolean(val, toEnvName(PROP_CACHE_ENABLED)))
                .ifPresent(val -> this.schemaCacheEnabled = val);
            env(environment, PROP_CACHE_MAX_SIZE).flatMap(val -> readLong(val, toEnvName(PROP_CACHE_MAX_SIZE)))
                .ifPresent(val -> this.schemaCacheMaxSize = val);
            env(environment, PROP_CACHE_TTL_SECONDS).flatMap(val -> readLong(val, toEnvName(PROP_CACHE_TTL_SECONDS)))
                .ifPresent(val -> this.schemaCacheTtlSeconds = val);
            env(environment, PROP_FETCH_TIMEOUT_MS).flatMap(val -> readLong(val, toEnvName(PROP_FETCH_TIMEOUT_MS)))
                .ifPresent(val -> this.schemaFetchTimeoutMs = val);
            env(environment, PROP_DEFINITIONS_FILE)
                .ifPresent(val -> this.definitionsFile = Path.of(val));
        }

        // ====================================================================
        // BUILDER METHODS
        // ====================================================================

        public Builder schemaCacheEnabled(boolean enabled) {
            this.schemaCacheEnabled = enabled;
            return this;
        }

        public Builder schemaCacheMaxSize(long maxSize) {
            this.schemaCacheMaxSize = maxSize;
            return this;
        }

        public Builder schemaCacheTtlSeconds(long seconds) {
            this.schemaCacheTtlSeconds = seconds;
            return this;
        }

        public Builder schemaFetchTimeoutMs(long timeoutMs) {
            this.schemaFetchTimeoutMs = timeoutMs;
            return this;
        }

        public Builder definitionsFile(Path file) {
            this.definitionsFile = file;
            return this;
        }

        public EditorConfig build() {
            return new EditorConfig(this);
        }

        // ====================================================================
        // VALUE HELPERS
        // ====================================================================

        /**
         * {@code editor.schema.cache.max.size} to {@code EDITOR_SCHEMA_CACHE_MAX_SIZE}.
         */
        static String toEnvName(String property) {
            return property.replace('.', '_').toUpperCase(Locale.ROOT);
        }

        private static Optional<String> env(Function<String, String> environment, String property) {
            String key = toEnvName(property);
            return readString(environment.apply(key)).map(val -> {
                logger.fine("Loaded env var: " + key + "=" + val);
                return val;
            });
        }

        private static Optional<String> readString(String raw) {
            if (raw == null || raw.trim().isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(raw.trim());
        }

        private static Optional<Long> readLong(String raw, String key) {
            return readString(raw).map(val -> {
                try {
                    return Long.parseLong(val);
                } catch (NumberFormatException e) {
                    logger.warning("Invalid long value for " + key + ": " + val);
                    return null;
                }
            });
        }

        private static Optional<Boolean> readBoolean(String raw, String key) {
            return readString(raw).map(val -> {
                String normalized = val.toLowerCase(Locale.ROOT);
                if ("true".equals(normalized) || "1".equals(normalized) || "yes".equals(normalized)) {
                    return Boolean.TRUE;
                }
                if ("false".equals(normalized) || "0".equals(normalized) || "no".equals(normalized)) {
                    return Boolean.FALSE;
                }
                logger.warning("Invalid boolean value for " + key + ": " + val);
                return null;
            });
        }
    }
}
