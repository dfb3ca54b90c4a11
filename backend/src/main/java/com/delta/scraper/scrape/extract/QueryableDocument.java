package com.delta.scraper.scrape.extract;

import com.delta.scraper.scrape.model.ExtractionKind;

import java.util.List;

/**
 * A parsed document, or a region of one, that selectors can be evaluated against.
 */
public interface QueryableDocument {
    /**
     * Returns every value the selector yields, in document order. An empty list means no match.
     *
     * @throws InvalidSelectorException when the selector cannot be parsed
     */
    List<String> select(String selector, ExtractionKind kind, String attribute);

    /**
     * Narrows the document to each region matching {@code selector}.
     */
    List<QueryableDocument> scope(String selector);

    String baseUrl();
}
