package com.delta.scraper.scrape.model;

import java.util.ArrayList;
import java.util.List;

/**
 * One field of a template.
 *
 * @param selector primary selector; {@code ::text}, {@code ::attr(name)} and {@code ::html} suffixes are honoured
 * @param fallbackSelectors tried in order when the primary selector yields nothing
 * @param allowEmpty accept a value that is empty after post-processing instead of treating it as no match
 * @param nonEmpty for {@link ExtractionKind#COLLECTION} fields, fail when the collection has no entries
 */
public record FieldSpec(
    String name,
    String selector,
    List<String> fallbackSelectors,
    ExtractionKind kind,
    String attribute,
    boolean required,
    boolean allowEmpty,
    boolean nonEmpty,
    List<PostProcessDirective> postProcessing
) {
    public FieldSpec {
        fallbackSelectors = fallbackSelectors == null ? List.of() : List.copyOf(fallbackSelectors);
        kind = kind == null ? ExtractionKind.TEXT : kind;
        postProcessing = postProcessing == null ? List.of() : List.copyOf(postProcessing);
    }

    public static FieldSpec text(String name, String selector, boolean required) {
        return new FieldSpec(name, selector, List.of(), ExtractionKind.TEXT, null, required, false, false, List.of());
    }

    public FieldSpec withFallbacks(List<String> fallbacks) {
        return new FieldSpec(name, selector, fallbacks, kind, attribute, required, allowEmpty, nonEmpty, postProcessing);
    }

    public FieldSpec withPostProcessing(List<PostProcessDirective> directives) {
        return new FieldSpec(name, selector, fallbackSelectors, kind, attribute, required, allowEmpty, nonEmpty, directives);
    }

    public List<String> selectorChain() {
        List<String> chain = new ArrayList<>();
        if (selector != null && !selector.isBlank()) {
            chain.add(selector);
        }
        for (String fallback : fallbackSelectors) {
            if (fallback != null && !fallback.isBlank()) {
                chain.add(fallback);
            }
        }
        return chain;
    }

    /** Whether a miss on this field counts against record coverage. */
    public boolean countsTowardCoverage() {
        if (!required) {
            return false;
        }
        return kind != ExtractionKind.COLLECTION || nonEmpty;
    }
}
