package com.delta.scraper.scrape.job;

import com.delta.scraper.config.ScraperProperties;
import com.delta.scraper.scrape.model.JobView;
import com.delta.scraper.scrape.model.PageResult;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps the results of the most recent jobs in memory, evicting the oldest beyond the retention limit.
 */
@Component
public class InMemoryResultSink implements ResultSink {
    private final int retention;
    private final Map<String, List<PageResult>> results;

    public InMemoryResultSink(ScraperProperties properties) {
        this.retention = properties.getJobs().getResultRetention();
        this.results = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, List<PageResult>> eldest) {
                return size() > retention;
            }
        };
    }

    @Override
    public synchronized void accept(JobView job, List<PageResult> pages) {
        results.put(job.id(), List.copyOf(pages));
    }

    public synchronized Optional<List<PageResult>> find(String jobId) {
        return Optional.ofNullable(results.get(jobId));
    }

    public synchronized int size() {
        return results.size();
    }
}
