package com.delta.scraper.scrape.job;

import com.delta.scraper.scrape.model.JobProgress;

/**
 * Receives progress after every page, in increasing page-count order per job. Called while the job's
 * state is locked, so implementations must return quickly.
 */
public interface ProgressSink {
    void onProgress(JobProgress progress);
}
