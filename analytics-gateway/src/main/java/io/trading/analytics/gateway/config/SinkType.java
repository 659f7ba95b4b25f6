package io.trading.analytics.gateway.config;

import java.util.Locale;

/**
 * Destinations for flushed records.
 */
public enum SinkType {
    LOG("log"),
    AERON("aeron");

    private final String configName;

    SinkType(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    public static SinkType fromString(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (SinkType type : values()) {
            if (type.configName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown sink: " + name);
    }
}
