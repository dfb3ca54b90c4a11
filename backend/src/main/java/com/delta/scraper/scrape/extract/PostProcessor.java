package com.delta.scraper.scrape.extract;

import com.delta.scraper.scrape.model.PostProcessDirective;
import com.delta.scraper.scrape.util.UrlUtils;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies a field's post-processing directives in order. Values are strings, lists of strings once
 * split or collected, or {@link BigDecimal} after {@code NUMBER}. A directive that cannot produce a
 * value yields {@code null}, which the engine treats as no match.
 */
public final class PostProcessor {
    private static final Pattern NUMBER = Pattern.compile("-?\\d[\\d,]*(?:\\.\\d+)?|-?\\.\\d+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private PostProcessor() {
    }

    public static Object apply(Object value, List<PostProcessDirective> directives, String baseUrl) {
        Object current = value;
        if (directives == null) {
            return current;
        }
        for (PostProcessDirective directive : directives) {
            if (current == null) {
                return null;
            }
            current = applyOne(current, directive, baseUrl);
        }
        return current;
    }

    private static Object applyOne(Object value, PostProcessDirective directive, String baseUrl) {
        if (value instanceof List<?> list) {
            if (directive.type() == PostProcessDirective.Type.JOIN) {
                List<String> parts = new ArrayList<>();
                for (Object item : list) {
                    if (item != null) {
                        parts.add(item.toString());
                    }
                }
                return String.join(separator(directive, " "), parts);
            }
            List<Object> mapped = new ArrayList<>();
            for (Object item : list) {
                Object result = item == null ? null : applyOne(item, directive, baseUrl);
                if (result instanceof List<?> nested) {
                    mapped.addAll(nested);
                } else if (result != null) {
                    mapped.add(result);
                }
            }
            return mapped;
        }
        String text = value.toString();
        return switch (directive.type()) {
            case TRIM -> text.trim();
            case COLLAPSE_WHITESPACE -> WHITESPACE.matcher(text).replaceAll(" ").trim();
            case LOWERCASE -> text.toLowerCase(Locale.ROOT);
            case UPPERCASE -> text.toUpperCase(Locale.ROOT);
            case NUMBER -> toNumber(text);
            case NORMALIZE_URL -> UrlUtils.resolve(baseUrl, text);
            case REPLACE -> directive.argument() == null
                ? text
                : text.replaceAll(directive.argument(), directive.replacement() == null ? "" : directive.replacement());
            case REGEX_EXTRACT -> regexExtract(text, directive.argument());
            case SPLIT -> split(text, separator(directive, ","));
            case JOIN -> text;
        };
    }

    private static BigDecimal toNumber(String text) {
        Matcher matcher = NUMBER.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        try {
            return new BigDecimal(matcher.group().replace(",", ""));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String regexExtract(String text, String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            return text;
        }
        Matcher matcher = Pattern.compile(pattern).matcher(text);
        if (!matcher.find()) {
            return null;
        }
        return matcher.groupCount() > 0 && matcher.group(1) != null ? matcher.group(1) : matcher.group();
    }

    private static List<String> split(String text, String separator) {
        List<String> parts = new ArrayList<>();
        for (String part : text.split(Pattern.quote(separator))) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                parts.add(trimmed);
            }
        }
        return parts;
    }

    private static String separator(PostProcessDirective directive, String fallback) {
        return directive.argument() == null || directive.argument().isEmpty() ? fallback : directive.argument();
    }
}
