package io.chariot.core;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;

/**
 * Immutable configuration for a Chariot store.
 * <p>
 * Use the builder pattern to create custom configurations:
 * <pre>
 * ChariotConfiguration config = ChariotConfiguration.builder()
 *     .url("mem:foodtruck")
 *     .echo(true)
 *     .build();
 * </pre>
 * <p>
 * or load the {@code chariot.*} keys from a classpath properties resource with
 * {@link #load(String)}.
 *
 * @see io.chariot.session.Chariot
 */
public final class ChariotConfiguration {

    public static final String URL = "chariot.url";
    public static final String ECHO = "chariot.echo";
    public static final String CREATE_SCHEMA = "chariot.schema.create";
    public static final String COLOR = "chariot.sql.color";

    // Store connection string
    private final String url;

    // Statement logging
    private final boolean echo;

    // Create all tables when the store opens
    private final boolean createSchema;

    // ANSI coloring of printed SQL
    private final boolean colorOutput;

    private ChariotConfiguration(Builder builder) {
        this.url = builder.url;
        this.echo = builder.echo;
        this.createSchema = builder.createSchema;
        this.colorOutput = builder.colorOutput;
    }

    /**
     * Create a new builder for ChariotConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Configuration with every default.
     */
    public static ChariotConfiguration defaults() {
        return builder().build();
    }

    /**
     * Build a configuration from {@code chariot.*} properties. Missing keys keep their defaults.
     *
     * @param properties the properties to read
     * @return the configuration
     * @throws ChariotException when a boolean key holds something other than true or false
     */
    public static ChariotConfiguration fromProperties(Properties properties) {
        Builder builder = builder();
        String url = properties.getProperty(URL);
        if (url != null && !url.isBlank()) {
            builder.url(url.trim());
        }
        builder.echo(booleanProperty(properties, ECHO, builder.echo));
        builder.createSchema(booleanProperty(properties, CREATE_SCHEMA, builder.createSchema));
        builder.colorOutput(booleanProperty(properties, COLOR, builder.colorOutput));
        return builder.build();
    }

    /**
     * Load configuration from a classpath resource. A missing resource yields the defaults.
     *
     * @param resource the resource name, e.g. {@code chariot.properties}
     * @return the configuration
     */
    public static ChariotConfiguration load(String resource) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = ChariotConfiguration.class.getClassLoader();
        }
        Properties properties = new Properties();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                return defaults();
            }
            properties.load(in);
        } catch (IOException e) {
            throw new ChariotException("Failed to read configuration resource " + resource, e);
        }
        return fromProperties(properties);
    }

    private static boolean booleanProperty(Properties properties, String key, boolean defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "true" -> true;
            case "false" -> false;
            default -> throw new ChariotException("Invalid boolean for " + key + ": " + raw);
        };
    }

    /**
     * Get the store connection string.
     *
     * @return the url, e.g. {@code mem:} or {@code mem:foodtruck}
     */
    public String url() {
        return url;
    }

    /**
     * Check if every statement is logged.
     *
     * @return true if statement echo is enabled (default: false)
     */
    public boolean echo() {
        return echo;
    }

    /**
     * Check if all mapped tables are created when the store opens.
     *
     * @return true if schema creation is enabled (default: true)
     */
    public boolean createSchema() {
        return createSchema;
    }

    /**
     * Check if printed SQL carries ANSI colors.
     *
     * @return true if coloring is enabled (default: true)
     */
    public boolean colorOutput() {
        return colorOutput;
    }

    @Override
    public String toString() {
        return "ChariotConfiguration{url=" + url + ", echo=" + echo + ", createSchema=" + createSchema
                + ", colorOutput=" + colorOutput + "}";
    }

    /**
     * Builder for ChariotConfiguration.
     */
    public static final class Builder {
        private String url = "mem:";
        private boolean echo = false;
        private boolean createSchema = true;
        private boolean colorOutput = true;

        private Builder() {
        }

        /**
         * Set the store connection string.
         *
         * @param url the url
         * @return this builder
         */
        public Builder url(String url) {
            if (url == null || url.isBlank()) {
                throw new IllegalArgumentException("url required");
            }
            this.url = url;
            return this;
        }

        public Builder echo(boolean echo) {
            this.echo = echo;
            return this;
        }

        public Builder createSchema(boolean createSchema) {
            this.createSchema = createSchema;
            return this;
        }

        public Builder colorOutput(boolean colorOutput) {
            this.colorOutput = colorOutput;
            return this;
        }

        /**
         * Build the immutable configuration.
         *
         * @return a new ChariotConfiguration
         */
        public ChariotConfiguration build() {
            return new ChariotConfiguration(this);
        }
    }
}
