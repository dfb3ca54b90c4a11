package com.delta.scraper.scrape.job;

import com.delta.scraper.scrape.model.JobProgress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingProgressSink implements ProgressSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingProgressSink.class);

    @Override
    public void onProgress(JobProgress progress) {
        if (progress.status().isTerminal()) {
            log.info(
                "Job {} {}: pages={} items={} failed={}",
                progress.jobId(),
                progress.status(),
                progress.pagesDone(),
                progress.itemsExtracted(),
                progress.itemsFailed()
            );
            return;
        }
        log.debug(
            "Job {} progress: pages={} items={} failed={} percent={}",
            progress.jobId(),
            progress.pagesDone(),
            progress.itemsExtracted(),
            progress.itemsFailed(),
            progress.percent()
        );
    }
}
