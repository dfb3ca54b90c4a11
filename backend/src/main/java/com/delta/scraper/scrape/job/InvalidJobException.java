package com.delta.scraper.scrape.job;

import java.util.List;

public class InvalidJobException extends RuntimeException {
    private final List<String> problems;

    public InvalidJobException(String message) {
        this(message, List.of(message));
    }

    public InvalidJobException(String message, List<String> problems) {
        super(message);
        this.problems = problems == null ? List.of() : List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
