package com.delta.scraper.scrape.job;

public class JobAbortedException extends RuntimeException {
    private final String reasonCode;

    public JobAbortedException(String reasonCode, String message) {
        super(message);
        this.reasonCode = reasonCode;
    }

    public String getReasonCode() {
        return reasonCode;
    }
}
