package com.delta.scraper.scrape.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one orchestration cycle. The fetched document rides along only until pagination has
 * looked at it; stored results never carry it.
 */
public record PageResult(
    int chainIndex,
    int pageNumber,
    String url,
    boolean success,
    List<ExtractionResult> records,
    List<ExtractionFieldError> fieldErrors,
    String nextPageUrl,
    FetchMetadata fetch,
    String failureReason,
    String failureMessage,
    Instant processedAt,
    @JsonIgnore RawDocument document
) {
    public PageResult {
        records = records == null ? List.of() : List.copyOf(records);
        fieldErrors = fieldErrors == null ? List.of() : List.copyOf(fieldErrors);
    }

    public static PageResult extracted(
        int chainIndex,
        int pageNumber,
        String url,
        List<ExtractionResult> records,
        FetchMetadata fetch,
        RawDocument document
    ) {
        List<ExtractionFieldError> errors = new ArrayList<>();
        for (ExtractionResult record : records) {
            errors.addAll(record.fieldErrors());
        }
        return new PageResult(chainIndex, pageNumber, url, true, records, errors, null, fetch, null, null, Instant.now(), document);
    }

    public static PageResult failed(
        int chainIndex,
        int pageNumber,
        String url,
        String reason,
        String message,
        FetchMetadata fetch
    ) {
        return new PageResult(chainIndex, pageNumber, url, false, List.of(), List.of(), null, fetch, reason, message, Instant.now(), null);
    }

    public PageResult withNextPageUrl(String next) {
        return new PageResult(chainIndex, pageNumber, url, success, records, fieldErrors, next, fetch, failureReason, failureMessage, processedAt, document);
    }

    public PageResult withoutDocument() {
        return new PageResult(chainIndex, pageNumber, url, success, records, fieldErrors, nextPageUrl, fetch, failureReason, failureMessage, processedAt, null);
    }

    public PageResult asFailure(String reason, String message) {
        return new PageResult(chainIndex, pageNumber, url, false, records, fieldErrors, nextPageUrl, fetch, reason, message, processedAt, document);
    }

    public long completeRecordCount() {
        return records.stream().filter(record -> !record.isPartial()).count();
    }

    public long partialRecordCount() {
        return records.stream().filter(ExtractionResult::isPartial).count();
    }
}
