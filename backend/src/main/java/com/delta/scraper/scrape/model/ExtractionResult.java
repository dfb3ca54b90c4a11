package com.delta.scraper.scrape.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One extracted record. Values keep template declaration order; optional misses are stored as {@code null}.
 */
public record ExtractionResult(
    Map<String, Object> values,
    List<ExtractionFieldError> fieldErrors,
    Map<String, String> selectorsUsed,
    double coverage
) {
    public ExtractionResult {
        values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
        fieldErrors = fieldErrors == null ? List.of() : List.copyOf(fieldErrors);
        selectorsUsed = selectorsUsed == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(selectorsUsed));
    }

    public boolean isPartial() {
        return coverage < 1.0;
    }

    public boolean hasValues() {
        for (Object value : values.values()) {
            if (value == null) {
                continue;
            }
            if (value instanceof List<?> list && list.isEmpty()) {
                continue;
            }
            return true;
        }
        return false;
    }
}
