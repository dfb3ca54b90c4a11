package com.delta.scraper.scrape.fetch;

import java.util.List;

public class DefenseDetectedException extends RuntimeException {
    private final String url;
    private final int attempts;
    private final int lastStatusCode;
    private final List<String> proxiesTried;

    public DefenseDetectedException(String url, int attempts, int lastStatusCode, List<String> proxiesTried, String message) {
        super(message);
        this.url = url;
        this.attempts = attempts;
        this.lastStatusCode = lastStatusCode;
        this.proxiesTried = proxiesTried == null ? List.of() : List.copyOf(proxiesTried);
    }

    public String getUrl() {
        return url;
    }

    public int getAttempts() {
        return attempts;
    }

    public int getLastStatusCode() {
        return lastStatusCode;
    }

    public List<String> getProxiesTried() {
        return proxiesTried;
    }
}
