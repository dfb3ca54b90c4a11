package com.delta.scraper.scrape.job;

import com.delta.scraper.scrape.model.ExtractionKind;
import com.delta.scraper.scrape.model.FieldSpec;
import com.delta.scraper.scrape.model.PaginationSpec;
import com.delta.scraper.scrape.model.PaginationStrategy;
import com.delta.scraper.scrape.model.PostProcessDirective;
import com.delta.scraper.scrape.model.Template;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Structural checks run before a template is accepted. Selector syntax is not checked here; a broken
 * selector is handled at extraction time by falling through to the next one.
 */
public final class TemplateValidator {
    private TemplateValidator() {
    }

    public static List<String> validate(Template template) {
        List<String> problems = new ArrayList<>();
        if (template == null) {
            problems.add("template is missing");
            return problems;
        }
        if (template.name() == null || template.name().isBlank()) {
            problems.add("template name is blank");
        }
        if (template.fields().isEmpty()) {
            problems.add("template has no fields");
        }
        Set<String> names = new HashSet<>();
        for (FieldSpec field : template.fields()) {
            if (field.name() == null || field.name().isBlank()) {
                problems.add("field name is blank");
                continue;
            }
            if (!names.add(field.name())) {
                problems.add("duplicate field " + field.name());
            }
            if (field.selectorChain().isEmpty()) {
                problems.add("field " + field.name() + " has no selector");
            }
            if (field.kind() == ExtractionKind.ATTRIBUTE
                && (field.attribute() == null || field.attribute().isBlank())
                && field.selectorChain().stream().noneMatch(selector -> selector.contains("::attr("))) {
                problems.add("attribute field " + field.name() + " names no attribute");
            }
            for (PostProcessDirective directive : field.postProcessing()) {
                checkDirective(field.name(), directive, problems);
            }
        }
        checkPagination(template.pagination(), problems);
        if (template.fetchProfile().minDelayMs() != null
            && template.fetchProfile().maxDelayMs() != null
            && template.fetchProfile().minDelayMs() > template.fetchProfile().maxDelayMs()) {
            problems.add("fetch profile min delay exceeds max delay");
        }
        return problems;
    }

    private static void checkDirective(String field, PostProcessDirective directive, List<String> problems) {
        if (directive == null || directive.type() == null) {
            problems.add("field " + field + " has an empty post-processing directive");
            return;
        }
        if (directive.type() == PostProcessDirective.Type.REPLACE
            || directive.type() == PostProcessDirective.Type.REGEX_EXTRACT) {
            if (directive.argument() == null || directive.argument().isEmpty()) {
                problems.add("field " + field + " " + directive.type() + " needs a pattern");
                return;
            }
            try {
                Pattern.compile(directive.argument());
            } catch (PatternSyntaxException e) {
                problems.add("field " + field + " has an invalid pattern: " + e.getDescription());
            }
        }
    }

    private static void checkPagination(PaginationSpec pagination, List<String> problems) {
        PaginationStrategy strategy = pagination.effectiveStrategy();
        if (strategy == PaginationStrategy.NEXT_LINK
            && (pagination.nextSelector() == null || pagination.nextSelector().isBlank())) {
            problems.add("next-link pagination needs a next selector");
        }
        if (strategy == PaginationStrategy.PAGE_PARAMETER
            && (pagination.urlTemplate() == null || !pagination.urlTemplate().contains("{page}"))) {
            problems.add("page-parameter pagination needs a url template containing {page}");
        }
        if (pagination.similarityThreshold() != null
            && (pagination.similarityThreshold() < 0.0 || pagination.similarityThreshold() > 1.0)) {
            problems.add("similarity threshold must be between 0 and 1");
        }
        if (pagination.duplicateWindowSize() != null && pagination.duplicateWindowSize() < 1) {
            problems.add("duplicate window size must be positive");
        }
    }
}
