package com.delta.scraper.scrape.model;

public enum ProxyState {
    ACTIVE,
    COOLING_DOWN,
    BLACKLISTED
}
