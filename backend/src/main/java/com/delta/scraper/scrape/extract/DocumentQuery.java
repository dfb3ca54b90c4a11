package com.delta.scraper.scrape.extract;

import com.delta.scraper.scrape.model.RawDocument;

public interface DocumentQuery {
    QueryableDocument open(RawDocument document);
}
