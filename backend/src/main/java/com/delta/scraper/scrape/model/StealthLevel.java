package com.delta.scraper.scrape.model;

public enum StealthLevel {
    NONE,
    BASIC,
    STEALTH
}
