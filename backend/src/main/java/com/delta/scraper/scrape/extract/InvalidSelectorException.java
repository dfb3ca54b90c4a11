package com.delta.scraper.scrape.extract;

public class InvalidSelectorException extends RuntimeException {
    public InvalidSelectorException(String selector, Throwable cause) {
        super("Invalid selector '" + selector + "': " + (cause == null ? "unparseable" : cause.getMessage()), cause);
    }
}
