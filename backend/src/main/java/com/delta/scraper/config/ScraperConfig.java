package com.delta.scraper.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ScraperConfig {

    @Bean(name = "jobExecutor", destroyMethod = "shutdownNow")
    public ExecutorService jobExecutor(ScraperProperties properties) {
        return Executors.newFixedThreadPool(properties.getJobs().getMaxConcurrentJobs(), namedThreads("scrape-job"));
    }

    @Bean(name = "fetchExecutor", destroyMethod = "shutdownNow")
    public ExecutorService fetchExecutor(ScraperProperties properties) {
        int size = Math.max(2, properties.getJobs().getMaxConcurrentJobs() * properties.getJobs().getMaxConcurrentFetchesPerJob());
        return Executors.newFixedThreadPool(size, namedThreads("scrape-fetch"));
    }

    @Bean(name = "cancelWatchdog", destroyMethod = "shutdownNow")
    public ScheduledExecutorService cancelWatchdog() {
        return Executors.newSingleThreadScheduledExecutor(namedThreads("scrape-cancel-watchdog"));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
