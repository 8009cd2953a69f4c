package net.kinvault.e2ee;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Properties;

/**
 * Immutable tuning knobs of the engine. Defaults match the values the protocol was designed around;
 * {@link #fromProperties(Properties)} overrides them from {@code e2ee.*} keys.
 */
public final class EngineConfig {
    public static final String DEFAULTS_RESOURCE = "/e2ee-defaults.properties";

    private final int maxSkip;
    private final int maxStoredMessageKeys;
    private final Duration messageKeyLifetime;
    private final Duration sessionLifetime;
    private final int sessionCacheCapacity;
    private final Duration sessionCacheTtl;
    private final Duration maintenanceInterval;
    private final Duration rotationInterval;
    private final int maxActiveKeys;
    private final Duration preRotationWarning;
    private final int oneTimePreKeyBatchSize;
    private final int minOneTimePreKeys;

    private EngineConfig(Builder builder) {
        this.maxSkip = positive(builder.maxSkip, "maxSkip");
        this.maxStoredMessageKeys = positive(builder.maxStoredMessageKeys, "maxStoredMessageKeys");
        this.messageKeyLifetime = builder.messageKeyLifetime;
        this.sessionLifetime = builder.sessionLifetime;
        this.sessionCacheCapacity = positive(builder.sessionCacheCapacity, "sessionCacheCapacity");
        this.sessionCacheTtl = builder.sessionCacheTtl;
        this.maintenanceInterval = builder.maintenanceInterval;
        this.rotationInterval = builder.rotationInterval;
        this.maxActiveKeys = positive(builder.maxActiveKeys, "maxActiveKeys");
        this.preRotationWarning = builder.preRotationWarning;
        this.oneTimePreKeyBatchSize = positive(builder.oneTimePreKeyBatchSize, "oneTimePreKeyBatchSize");
        this.minOneTimePreKeys = builder.minOneTimePreKeys;
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads a properties resource from the classpath on top of the built-in defaults.
     */
    public static EngineConfig fromResource(String resource) throws IOException {
        try (InputStream in = EngineConfig.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("Config resource not found: " + resource);
            }
            Properties properties = new Properties();
            properties.load(in);
            return fromProperties(properties);
        }
    }

    /**
     * Durations use ISO-8601 notation, e.g. {@code P7D} or {@code PT1H}.
     *
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static EngineConfig fromProperties(Properties properties) {
        Builder builder = builder();
        builder.maxSkip(intValue(properties, "e2ee.ratchet.max-skip", builder.maxSkip));
        builder.maxStoredMessageKeys(intValue(properties, "e2ee.ratchet.max-stored-message-keys", builder.maxStoredMessageKeys));
        builder.messageKeyLifetime(durationValue(properties, "e2ee.ratchet.message-key-lifetime", builder.messageKeyLifetime));
        builder.sessionLifetime(durationValue(properties, "e2ee.session.lifetime", builder.sessionLifetime));
        builder.sessionCacheCapacity(intValue(properties, "e2ee.session.cache-capacity", builder.sessionCacheCapacity));
        builder.sessionCacheTtl(durationValue(properties, "e2ee.session.cache-ttl", builder.sessionCacheTtl));
        builder.maintenanceInterval(durationValue(properties, "e2ee.maintenance.interval", builder.maintenanceInterval));
        builder.rotationInterval(durationValue(properties, "e2ee.rotation.interval", builder.rotationInterval));
        builder.maxActiveKeys(intValue(properties, "e2ee.rotation.max-active-keys", builder.maxActiveKeys));
        builder.preRotationWarning(durationValue(properties, "e2ee.rotation.warning-window", builder.preRotationWarning));
        builder.oneTimePreKeyBatchSize(intValue(properties, "e2ee.prekeys.batch-size", builder.oneTimePreKeyBatchSize));
        builder.minOneTimePreKeys(intValue(properties, "e2ee.prekeys.minimum", builder.minOneTimePreKeys));
        return builder.build();
    }

    private static int intValue(Properties properties, String key, int fallback) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    private static Duration durationValue(Properties properties, String key, Duration fallback) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Duration.parse(value.trim());
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid duration for " + key + ": " + value, e);
        }
    }

    private static int positive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
        return value;
    }

    public int getMaxSkip() {
        return maxSkip;
    }

    public int getMaxStoredMessageKeys() {
        return maxStoredMessageKeys;
    }

    public Duration getMessageKeyLifetime() {
        return messageKeyLifetime;
    }

    public Duration getSessionLifetime() {
        return sessionLifetime;
    }

    public int getSessionCacheCapacity() {
        return sessionCacheCapacity;
    }

    public Duration getSessionCacheTtl() {
        return sessionCacheTtl;
    }

    public Duration getMaintenanceInterval() {
        return maintenanceInterval;
    }

    public Duration getRotationInterval() {
        return rotationInterval;
    }

    public int getMaxActiveKeys() {
        return maxActiveKeys;
    }

    public Duration getPreRotationWarning() {
        return preRotationWarning;
    }

    public int getOneTimePreKeyBatchSize() {
        return oneTimePreKeyBatchSize;
    }

    public int getMinOneTimePreKeys() {
        return minOneTimePreKeys;
    }

    public static final class Builder {
        private int maxSkip = 1000;
        private int maxStoredMessageKeys = 2000;
        private Duration messageKeyLifetime = Duration.ofDays(7);
        private Duration sessionLifetime = Duration.ofDays(7);
        private int sessionCacheCapacity = 256;
        private Duration sessionCacheTtl = Duration.ofHours(1);
        private Duration maintenanceInterval = Duration.ofHours(1);
        private Duration rotationInterval = Duration.ofDays(30);
        private int maxActiveKeys = 3;
        private Duration preRotationWarning = Duration.ofDays(7);
        private int oneTimePreKeyBatchSize = 100;
        private int minOneTimePreKeys = 10;

        private Builder() {
        }

        public Builder maxSkip(int maxSkip) {
            this.maxSkip = maxSkip;
            return this;
        }

        public Builder maxStoredMessageKeys(int maxStoredMessageKeys) {
            this.maxStoredMessageKeys = maxStoredMessageKeys;
            return this;
        }

        public Builder messageKeyLifetime(Duration messageKeyLifetime) {
            this.messageKeyLifetime = messageKeyLifetime;
            return this;
        }

        public Builder sessionLifetime(Duration sessionLifetime) {
            this.sessionLifetime = sessionLifetime;
            return this;
        }

        public Builder sessionCacheCapacity(int sessionCacheCapacity) {
            this.sessionCacheCapacity = sessionCacheCapacity;
            return this;
        }

        public Builder sessionCacheTtl(Duration sessionCacheTtl) {
            this.sessionCacheTtl = sessionCacheTtl;
            return this;
        }

        public Builder maintenanceInterval(Duration maintenanceInterval) {
            this.maintenanceInterval = maintenanceInterval;
            return this;
        }

        public Builder rotationInterval(Duration rotationInterval) {
            this.rotationInterval = rotationInterval;
            return this;
        }

        public Builder maxActiveKeys(int maxActiveKeys) {
            this.maxActiveKeys = maxActiveKeys;
            return this;
        }

        public Builder preRotationWarning(Duration preRotationWarning) {
            this.preRotationWarning = preRotationWarning;
            return this;
        }

        public Builder oneTimePreKeyBatchSize(int oneTimePreKeyBatchSize) {
            this.oneTimePreKeyBatchSize = oneTimePreKeyBatchSize;
            return this;
        }

        public Builder minOneTimePreKeys(int minOneTimePreKeys) {
            this.minOneTimePreKeys = minOneTimePreKeys;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
