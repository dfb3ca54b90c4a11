package com.delta.scraper.scrape.model;

public record PostProcessDirective(
    Type type,
    String argument,
    String replacement
) {
    public enum Type {
        TRIM,
        COLLAPSE_WHITESPACE,
        LOWERCASE,
        UPPERCASE,
        NUMBER,
        NORMALIZE_URL,
        REPLACE,
        REGEX_EXTRACT,
        SPLIT,
        JOIN
    }

    public static PostProcessDirective of(Type type) {
        return new PostProcessDirective(type, null, null);
    }

    public static PostProcessDirective of(Type type, String argument) {
        return new PostProcessDirective(type, argument, null);
    }
}
