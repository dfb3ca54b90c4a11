package com.delta.scraper.scrape.job;

/**
 * Requested lifecycle operation is not allowed from the job's current status.
 */
public class JobStateException extends RuntimeException {
    public JobStateException(String message) {
        super(message);
    }
}
