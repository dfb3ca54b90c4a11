package com.delta.scraper.scrape.proxy;

public class NoProxyAvailableException extends RuntimeException {
    public NoProxyAvailableException(String message) {
        super(message);
    }
}
