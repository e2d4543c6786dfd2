package com.wordscout.discovery.ratelimit;

import com.wordscout.config.DiscoveryProperties;
import com.wordscout.config.InvalidConfigException;

public record RateLimiterSettings(int maxPerSecond, int maxPerHour, int maxPerDay) {
    public RateLimiterSettings {
        if (maxPerSecond < 1 || maxPerHour < 1 || maxPerDay < 1) {
            throw new InvalidConfigException(
                "rate limits must be positive: perSecond=" + maxPerSecond
                    + " perHour=" + maxPerHour + " perDay=" + maxPerDay
            );
        }
        if (maxPerDay < maxPerHour) {
            throw new InvalidConfigException(
                "daily limit " + maxPerDay + " is lower than hourly limit " + maxPerHour
            );
        }
    }

    public static RateLimiterSettings from(DiscoveryProperties.RateLimit properties) {
        return new RateLimiterSettings(
            properties.getMaxPerSecond(),
            properties.getMaxPerHour(),
            properties.getMaxPerDay()
        );
    }
}
