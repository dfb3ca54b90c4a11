package com.delta.scraper.scrape.proxy;

public class InvalidProxyEndpointException extends IllegalArgumentException {
    private final String endpoint;

    public InvalidProxyEndpointException(String endpoint) {
        super("Invalid proxy endpoint: " + endpoint + " (expected host:port or http://host:port)");
        this.endpoint = endpoint;
    }

    public String getEndpoint() {
        return endpoint;
    }
}
