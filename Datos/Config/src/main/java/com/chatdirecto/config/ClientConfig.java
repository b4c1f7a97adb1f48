package com.chatdirecto.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Centralised configuration helper that reads the <code>properties/client.properties</code> file
 * from the classpath and exposes typed accessors for the feed, the synchronizers and logging.
 */
public final class ClientConfig {

    private static final Logger LOGGER = Logger.getLogger(ClientConfig.class.getName());
    private static final String CONFIG_PATH = "/properties/client.properties";

    private static volatile ClientConfig instance;

    private final Properties properties;

    private ClientConfig(Properties properties) {
        this.properties = properties;
    }

    public static ClientConfig getInstance() {
        ClientConfig local = instance;
        if (local == null) {
            synchronized (ClientConfig.class) {
                local = instance;
                if (local == null) {
                    local = new ClientConfig(loadProperties());
                    instance = local;
                }
            }
        }
        return local;
    }

    /**
     * Builds a configuration from explicit properties; missing keys fall back to the defaults.
     */
    public static ClientConfig fromProperties(Properties properties) {
        Properties copy = new Properties();
        copy.putAll(Objects.requireNonNull(properties, "properties"));
        return new ClientConfig(copy);
    }

    private static Properties loadProperties() {
        Properties loaded = new Properties();
        try (InputStream in = ClientConfig.class.getResourceAsStream(CONFIG_PATH)) {
            if (in == null) {
                throw new IllegalStateException("Configuration file not found at " + CONFIG_PATH);
            }
            loaded.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to load client configuration properties", e);
        }
        return loaded;
    }

    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public int getIntProperty(String key, int defaultValue) {
        return (int) getLongProperty(key, defaultValue);
    }

    public long getLongProperty(String key, long defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            LOGGER.log(Level.WARNING, "Invalid integer for {0}: {1}", new Object[]{key, raw});
            return defaultValue;
        }
    }

    public int getNotificationLimit() {
        return getIntProperty("notifications.limit", 20);
    }

    public int getSearchLimit() {
        return getIntProperty("search.limit", 10);
    }

    public String getMediaBucket() {
        return getProperty("media.bucket", "chat-media");
    }

    public long getMaxMediaBytes() {
        return getLongProperty("media.maxBytes", 50L * 1024 * 1024);
    }

    public long getReconnectInitialDelayMs() {
        return getLongProperty("feed.reconnect.initialDelayMs", 500);
    }

    public long getReconnectMaxDelayMs() {
        return Math.max(getReconnectInitialDelayMs(), getLongProperty("feed.reconnect.maxDelayMs", 30_000));
    }

    public long getLoopShutdownTimeoutMs() {
        return getLongProperty("loop.shutdownTimeoutMs", 5_000);
    }

    public Level getLogLevel() {
        String level = properties.getProperty("log.level");
        if (Objects.isNull(level)) {
            return Level.INFO;
        }
        try {
            return Level.parse(level.trim().toUpperCase());
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.WARNING, "Invalid log level {0}, defaulting to INFO", level);
            return Level.INFO;
        }
    }
}
