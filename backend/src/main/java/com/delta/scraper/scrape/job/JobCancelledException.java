package com.delta.scraper.scrape.job;

/**
 * Unwinds a job's worker once its cancellation signal has been observed. Never surfaces to API callers.
 */
public class JobCancelledException extends RuntimeException {
    public JobCancelledException(String message) {
        super(message);
    }
}
