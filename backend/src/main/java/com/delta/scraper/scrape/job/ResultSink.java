package com.delta.scraper.scrape.job;

import com.delta.scraper.scrape.model.JobView;
import com.delta.scraper.scrape.model.PageResult;

import java.util.List;

/**
 * Takes ownership of a job's ordered page results once the job is terminal. Called exactly once per job.
 */
public interface ResultSink {
    void accept(JobView job, List<PageResult> pages);
}
