package com.delta.scraper.scrape.job;

public class UnknownJobException extends RuntimeException {
    public UnknownJobException(String jobId) {
        super("Unknown job: " + jobId);
    }
}
