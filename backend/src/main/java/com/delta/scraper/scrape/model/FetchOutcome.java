package com.delta.scraper.scrape.model;

public enum FetchOutcome {
    SUCCESS,
    TIMEOUT,
    REFUSED,
    DNS_FAILURE,
    NETWORK_ERROR,
    HTTP_ERROR,
    DEFENSE_DETECTED;

    /** Failures that happen before any response arrives, so the proxy is the likely culprit. */
    public boolean isConnectionLevel() {
        return this == TIMEOUT || this == REFUSED || this == DNS_FAILURE || this == NETWORK_ERROR;
    }

    public boolean isProxyFailure() {
        return isConnectionLevel() || this == DEFENSE_DETECTED;
    }
}
