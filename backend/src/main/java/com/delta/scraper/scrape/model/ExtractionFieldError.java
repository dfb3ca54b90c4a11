package com.delta.scraper.scrape.model;

import java.util.List;

/**
 * A required field that no selector in its chain could fill. Attached to results, never thrown.
 */
public record ExtractionFieldError(
    String field,
    List<String> selectorsTried,
    String reason,
    String message
) {
    public static final String NO_MATCH = "no_match";
    public static final String EMPTY_COLLECTION = "empty_collection";
    public static final String EXTRACTION_ERROR = "extraction_error";

    public ExtractionFieldError {
        selectorsTried = selectorsTried == null ? List.of() : List.copyOf(selectorsTried);
    }
}
