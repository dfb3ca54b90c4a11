package com.delta.scraper.scrape.extract;

import com.delta.scraper.scrape.model.ExtractionFieldError;
import com.delta.scraper.scrape.model.ExtractionKind;
import com.delta.scraper.scrape.model.ExtractionResult;
import com.delta.scraper.scrape.model.FieldSpec;
import com.delta.scraper.scrape.model.RawDocument;
import com.delta.scraper.scrape.model.Template;
import com.delta.scraper.scrape.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a fetched document into records by walking each field's selector chain. Field failures are
 * returned as {@link ExtractionFieldError}s on the record, never thrown.
 */
@Service
public class ExtractionEngine {
    private static final Logger log = LoggerFactory.getLogger(ExtractionEngine.class);

    private final DocumentQuery documentQuery;

    public ExtractionEngine(DocumentQuery documentQuery) {
        this.documentQuery = documentQuery;
    }

    /**
     * Extracts the whole document as a single record, ignoring the template's item selector.
     */
    public ExtractionResult extract(RawDocument document, Template template) {
        return extractRecord(documentQuery.open(document), template);
    }

    /**
     * Extracts one record per item container, or one record for the page when the template has no
     * item selector. A page with no matching containers yields an empty list.
     */
    public List<ExtractionResult> extractAll(RawDocument document, Template template) {
        QueryableDocument root = documentQuery.open(document);
        String itemSelector = template.itemSelector();
        if (itemSelector == null || itemSelector.isBlank()) {
            return List.of(extractRecord(root, template));
        }
        List<ExtractionResult> records = new ArrayList<>();
        for (QueryableDocument item : root.scope(itemSelector)) {
            records.add(extractRecord(item, template));
        }
        return records;
    }

    /**
     * Resolves the template's seed selector against the start page into absolute, de-duplicated URLs.
     */
    public List<String> discoverSeeds(RawDocument document, Template template) {
        if (!template.hasSeedDiscovery()) {
            return List.of();
        }
        QueryableDocument root = documentQuery.open(document);
        Set<String> seeds = new LinkedHashSet<>();
        for (String href : root.select(template.seedSelector(), ExtractionKind.ATTRIBUTE, "href")) {
            String resolved = UrlUtils.resolve(root.baseUrl(), href);
            if (resolved != null) {
                seeds.add(resolved);
            }
        }
        return new ArrayList<>(seeds);
    }

    /**
     * A page is aborted only under the abort-on-required-failure policy, and only when some record
     * lost every required field.
     */
    public static boolean shouldAbortPage(List<ExtractionResult> records, Template template) {
        if (!template.abortOnRequiredFailure() || !template.hasRequiredFields()) {
            return false;
        }
        for (ExtractionResult record : records) {
            if (record.coverage() == 0.0) {
                return true;
            }
        }
        return false;
    }

    ExtractionResult extractRecord(QueryableDocument scope, Template template) {
        Map<String, Object> values = new LinkedHashMap<>();
        Map<String, String> selectorsUsed = new LinkedHashMap<>();
        List<ExtractionFieldError> errors = new ArrayList<>();
        int requiredTotal = 0;
        int requiredMatched = 0;
        for (FieldSpec field : template.fields()) {
            FieldOutcome outcome = extractField(scope, field);
            if (field.countsTowardCoverage()) {
                requiredTotal++;
            }
            if (outcome.matched()) {
                values.put(field.name(), outcome.value());
                selectorsUsed.put(field.name(), outcome.selector());
                if (field.countsTowardCoverage()) {
                    requiredMatched++;
                }
                continue;
            }
            if (field.kind() == ExtractionKind.COLLECTION && !field.nonEmpty()) {
                values.put(field.name(), List.of());
                continue;
            }
            values.put(field.name(), null);
            if (field.countsTowardCoverage()) {
                errors.add(new ExtractionFieldError(field.name(), outcome.tried(), outcome.reason(), outcome.message()));
            }
        }
        double coverage = requiredTotal == 0 ? 1.0 : (double) requiredMatched / requiredTotal;
        return new ExtractionResult(values, errors, selectorsUsed, coverage);
    }

    private FieldOutcome extractField(QueryableDocument scope, FieldSpec field) {
        List<String> tried = new ArrayList<>();
        String lastError = null;
        for (String selector : field.selectorChain()) {
            tried.add(selector);
            try {
                List<String> raw = scope.select(selector, field.kind(), field.attribute());
                Object value = field.kind() == ExtractionKind.COLLECTION
                    ? PostProcessor.apply(raw, field.postProcessing(), scope.baseUrl())
                    : raw.isEmpty() ? null : PostProcessor.apply(raw.get(0), field.postProcessing(), scope.baseUrl());
                if (isMatch(value, field)) {
                    return new FieldOutcome(true, value, selector, tried, null, null);
                }
            } catch (RuntimeException e) {
                lastError = e.getMessage();
                log.debug("Selector {} failed for field {}: {}", selector, field.name(), e.getMessage());
            }
        }
        String reason;
        String message;
        if (lastError != null) {
            reason = ExtractionFieldError.EXTRACTION_ERROR;
            message = lastError;
        } else if (field.kind() == ExtractionKind.COLLECTION) {
            reason = ExtractionFieldError.EMPTY_COLLECTION;
            message = "No selector produced any entries for " + field.name();
        } else {
            reason = ExtractionFieldError.NO_MATCH;
            message = "No selector matched for " + field.name();
        }
        return new FieldOutcome(false, null, null, tried, reason, message);
    }

    private static boolean isMatch(Object value, FieldSpec field) {
        if (value == null) {
            return false;
        }
        if (value instanceof List<?> list) {
            return !list.isEmpty();
        }
        if (value instanceof String text && text.isEmpty()) {
            return field.allowEmpty();
        }
        return true;
    }

    private record FieldOutcome(
        boolean matched,
        Object value,
        String selector,
        List<String> tried,
        String reason,
        String message
    ) {
    }
}
