package com.delta.scraper.scrape.model;

public record FetchProfile(
    StealthLevel stealthLevel,
    Integer minDelayMs,
    Integer maxDelayMs,
    String userAgent
) {
    public FetchProfile {
        stealthLevel = stealthLevel == null ? StealthLevel.BASIC : stealthLevel;
    }

    public static FetchProfile defaults() {
        return new FetchProfile(StealthLevel.BASIC, null, null, null);
    }

    public static FetchProfile noDelay() {
        return new FetchProfile(StealthLevel.NONE, 0, 0, null);
    }
}
