package com.delta.scraper.scrape.model;

/**
 * What a job does with a page whose fetch keeps hitting automated-traffic defenses
 * after every proxy rotation.
 */
public enum DefensePolicy {
    SKIP,
    ABORT
}
