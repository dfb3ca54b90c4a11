package com.delta.scraper.scrape.fetch;

import com.delta.scraper.scrape.model.RawDocument;

@FunctionalInterface
public interface DefenseDetector {
    boolean isDefenseResponse(RawDocument document);
}
