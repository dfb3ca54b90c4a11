package com.delta.scraper.scrape.model;

import java.util.List;

/**
 * Declarative extraction recipe. Jobs hold a reference to the instance loaded at submit time.
 *
 * @param itemSelector when set, every matching container yields one record; otherwise the page is one record
 * @param seedSelector when set, links matched on the start page become independent page chains
 */
public record Template(
    String name,
    List<FieldSpec> fields,
    String itemSelector,
    String seedSelector,
    PaginationSpec pagination,
    FetchProfile fetchProfile,
    boolean abortOnRequiredFailure
) {
    public Template {
        fields = fields == null ? List.of() : List.copyOf(fields);
        pagination = pagination == null ? PaginationSpec.none() : pagination;
        fetchProfile = fetchProfile == null ? FetchProfile.defaults() : fetchProfile;
    }

    public static Template of(String name, List<FieldSpec> fields, PaginationSpec pagination, FetchProfile fetchProfile) {
        return new Template(name, fields, null, null, pagination, fetchProfile, false);
    }

    public boolean hasRequiredFields() {
        return fields.stream().anyMatch(FieldSpec::countsTowardCoverage);
    }

    public boolean hasSeedDiscovery() {
        return seedSelector != null && !seedSelector.isBlank();
    }
}
