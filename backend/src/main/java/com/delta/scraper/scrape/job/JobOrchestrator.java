package com.delta.scraper.scrape.job;

import com.delta.scraper.config.ScraperProperties;
import com.delta.scraper.scrape.extract.ExtractionEngine;
import com.delta.scraper.scrape.fetch.DefenseDetectedException;
import com.delta.scraper.scrape.fetch.FetchAttempt;
import com.delta.scraper.scrape.fetch.FetchExhaustedException;
import com.delta.scraper.scrape.fetch.FetchPipeline;
import com.delta.scraper.scrape.model.DefensePolicy;
import com.delta.scraper.scrape.model.ExtractionResult;
import com.delta.scraper.scrape.model.FetchMetadata;
import com.delta.scraper.scrape.model.JobProgress;
import com.delta.scraper.scrape.model.JobRequest;
import com.delta.scraper.scrape.model.JobStatus;
import com.delta.scraper.scrape.model.JobView;
import com.delta.scraper.scrape.model.PageResult;
import com.delta.scraper.scrape.model.Template;
import com.delta.scraper.scrape.pagination.PaginationController;
import com.delta.scraper.scrape.pagination.RecentRecordWindow;
import com.delta.scraper.scrape.proxy.NoProxyAvailableException;
import com.delta.scraper.scrape.util.ReasonCodes;
import com.delta.scraper.scrape.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Owns job lifecycle. Jobs run on a bounded executor; within a job each page chain is sequential,
 * and independent seed chains share a per-job fetch budget. Page-level failures are recorded as data,
 * while the consecutive-failure ceiling, an exhausted proxy pool and the abort defense policy end the job.
 */
@Service
public class JobOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(JobOrchestrator.class);

    private final TemplateSource templateSource;
    private final FetchPipeline fetchPipeline;
    private final ExtractionEngine extractionEngine;
    private final PaginationController paginationController;
    private final List<ProgressSink> progressSinks;
    private final ResultSink resultSink;
    private final ScraperProperties properties;
    private final ExecutorService jobExecutor;
    private final ExecutorService fetchExecutor;
    private final ScheduledExecutorService cancelWatchdog;
    private final Map<String, Job> jobs = new ConcurrentHashMap<>();

    public JobOrchestrator(
        TemplateSource templateSource,
        FetchPipeline fetchPipeline,
        ExtractionEngine extractionEngine,
        PaginationController paginationController,
        List<ProgressSink> progressSinks,
        ResultSink resultSink,
        ScraperProperties properties,
        @Qualifier("jobExecutor") ExecutorService jobExecutor,
        @Qualifier("fetchExecutor") ExecutorService fetchExecutor,
        @Qualifier("cancelWatchdog") ScheduledExecutorService cancelWatchdog
    ) {
        this.templateSource = templateSource;
        this.fetchPipeline = fetchPipeline;
        this.extractionEngine = extractionEngine;
        this.paginationController = paginationController;
        this.progressSinks = progressSinks == null ? List.of() : List.copyOf(progressSinks);
        this.resultSink = resultSink;
        this.properties = properties;
        this.jobExecutor = jobExecutor;
        this.fetchExecutor = fetchExecutor;
        this.cancelWatchdog = cancelWatchdog;
    }

    /**
     * Validates and enqueues a job without running it.
     *
     * @throws InvalidJobException when the template cannot be loaded or the URL is not an absolute http(s) URL
     */
    public JobView submit(JobRequest request) {
        if (request == null) {
            throw new InvalidJobException("job request is missing");
        }
        List<String> problems = new ArrayList<>();
        if (!UrlUtils.isHttpUrl(request.targetUrl())) {
            problems.add("target url is not an absolute http(s) url: " + request.targetUrl());
        }
        Template template = null;
        if (request.templateName() == null || request.templateName().isBlank()) {
            problems.add("template name is missing");
        } else {
            Optional<Template> found = templateSource.find(request.templateName());
            if (found.isEmpty()) {
                problems.add("unknown template: " + request.templateName());
            } else {
                template = found.get();
                problems.addAll(TemplateValidator.validate(template));
            }
        }
        if (!problems.isEmpty()) {
            throw new InvalidJobException("Invalid job: " + String.join("; ", problems), problems);
        }
        Job job = new Job(UUID.randomUUID().toString(), request, template);
        jobs.put(job.id(), job);
        job.transitionTo(JobStatus.QUEUED);
        log.info("Job {} queued: template={} url={}", job.id(), template.name(), request.targetUrl());
        return job.view();
    }

    /**
     * Hands a queued job to the job executor. The job turns {@code RUNNING} once a slot picks it up.
     * Starting a job that is already scheduled is a no-op.
     */
    public JobView start(String jobId) {
        Job job = require(jobId);
        JobStatus status = job.status();
        if (status != JobStatus.PENDING && status != JobStatus.QUEUED) {
            if (status == JobStatus.RUNNING || status == JobStatus.PAUSED) {
                return job.view();
            }
            throw new JobStateException("Job " + jobId + " cannot start from " + status);
        }
        if (!job.markScheduled()) {
            return job.view();
        }
        job.transitionTo(JobStatus.QUEUED);
        try {
            jobExecutor.submit(() -> runJob(job));
        } catch (RejectedExecutionException e) {
            job.terminate(JobStatus.FAILED, "executor rejected job: " + e.getMessage());
            finish(job);
            job.workerFinished();
            evictFinishedJobs();
        }
        return job.view();
    }

    public JobView submitAndStart(JobRequest request) {
        JobView submitted = submit(request);
        return start(submitted.id());
    }

    /**
     * Cancels a job. Queued jobs end immediately; running jobs end now and their workers unwind at the
     * next wait, keeping pages finished before this call. Cancelling a terminal job is a no-op.
     */
    public JobView cancel(String jobId) {
        Job job = require(jobId);
        boolean neverRan;
        synchronized (job) {
            JobStatus before = job.status();
            if (before.isTerminal()) {
                return job.view();
            }
            neverRan = before == JobStatus.PENDING || before == JobStatus.QUEUED;
            job.terminate(JobStatus.CANCELLED, ReasonCodes.CANCELLED);
            job.signal().cancel();
        }
        log.info("Job {} cancelled", jobId);
        if (neverRan) {
            finish(job);
            job.workerFinished();
            evictFinishedJobs();
        } else {
            scheduleWatchdog(job);
        }
        return job.view();
    }

    public JobView pause(String jobId) {
        Job job = require(jobId);
        if (!job.transitionTo(JobStatus.PAUSED)) {
            throw new JobStateException("Job " + jobId + " cannot pause from " + job.status());
        }
        log.info("Job {} paused", jobId);
        return job.view();
    }

    public JobView resume(String jobId) {
        Job job = require(jobId);
        if (job.status() != JobStatus.PAUSED || !job.transitionTo(JobStatus.RUNNING)) {
            throw new JobStateException("Job " + jobId + " cannot resume from " + job.status());
        }
        log.info("Job {} resumed", jobId);
        return job.view();
    }

    public JobStatus getStatus(String jobId) {
        return require(jobId).status();
    }

    public JobProgress getProgress(String jobId) {
        return require(jobId).progress();
    }

    public JobView getJob(String jobId) {
        return require(jobId).view();
    }

    /**
     * Pages recorded so far, ordered by chain and page number.
     */
    public List<PageResult> getResults(String jobId) {
        return require(jobId).results();
    }

    public List<JobView> listJobs(JobStatus filter) {
        List<Job> matching = new ArrayList<>();
        for (Job job : jobs.values()) {
            if (filter == null || job.status() == filter) {
                matching.add(job);
            }
        }
        matching.sort(Comparator.comparing(Job::createdAt));
        List<JobView> views = new ArrayList<>();
        for (Job job : matching) {
            views.add(job.view());
        }
        return views;
    }

    /**
     * Waits for a job's worker to unwind and returns the job's final view. Returns the current view
     * if the timeout elapses first.
     */
    public JobView awaitCompletion(String jobId, Duration timeout) {
        Job job = require(jobId);
        try {
            job.awaitWorker(timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return job.view();
    }

    /**
     * Forgets a terminal job whose worker has finished. Its results stay with the result sink.
     * Finished jobs beyond {@code scraper.jobs.finished-job-retention} are forgotten automatically,
     * oldest first.
     */
    public boolean purge(String jobId) {
        Job job = require(jobId);
        if (!job.status().isTerminal() || !job.isWorkerFinished()) {
            throw new JobStateException("Job " + jobId + " is still active");
        }
        return jobs.remove(jobId, job);
    }

    @PreDestroy
    public void shutdown() {
        for (Job job : jobs.values()) {
            if (!job.status().isTerminal()) {
                cancel(job.id());
            }
        }
    }

    private void runJob(Job job) {
        if (!job.transitionTo(JobStatus.RUNNING)) {
            // cancelled while queued; cancel() already delivered its results
            job.workerFinished();
            return;
        }
        Thread worker = Thread.currentThread();
        job.signal().register(worker);
        log.info("Job {} running: template={} url={}", job.id(), job.template().name(), job.request().targetUrl());
        try {
            executeChains(job);
            awaitIfPaused(job);
            if (job.template().hasRequiredFields() && job.failedValidationEverywhere()) {
                job.terminate(JobStatus.FAILED, ReasonCodes.REQUIRED_FIELDS_MISSING);
            } else {
                job.terminate(JobStatus.COMPLETED, null);
            }
        } catch (JobCancelledException e) {
            if (!job.status().isTerminal()) {
                job.terminate(JobStatus.CANCELLED, ReasonCodes.CANCELLED);
            }
        } catch (JobAbortedException e) {
            log.warn("Job {} aborted: {}", job.id(), e.getMessage());
            job.terminate(JobStatus.FAILED, e.getReasonCode() + ": " + e.getMessage());
        } catch (NoProxyAvailableException e) {
            log.warn("Job {} failed: {}", job.id(), e.getMessage());
            job.recordError(job.request().targetUrl(), ReasonCodes.NO_PROXY_AVAILABLE, e.getMessage());
            job.terminate(JobStatus.FAILED, ReasonCodes.NO_PROXY_AVAILABLE + ": " + e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Job {} failed unexpectedly", job.id(), e);
            job.terminate(JobStatus.FAILED, ReasonCodes.UNKNOWN + ": " + e.getMessage());
        } finally {
            job.signal().unregister(worker);
            Thread.interrupted();
            finish(job);
            job.workerFinished();
            evictFinishedJobs();
        }
    }

    private void executeChains(Job job) {
        Template template = job.template();
        Semaphore fetchBudget = new Semaphore(properties.getJobs().getMaxConcurrentFetchesPerJob());
        List<String> seeds = template.hasSeedDiscovery()
            ? discoverSeeds(job, fetchBudget)
            : List.of(job.request().targetUrl());
        Integer perChain = paginationController.estimatedTotalPages(template);
        job.setEstimatedTotalPages(perChain == null ? null : perChain * seeds.size());
        if (seeds.size() == 1) {
            runChain(job, 0, seeds.get(0), fetchBudget);
            return;
        }
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (int i = 0; i < seeds.size(); i++) {
            int chainIndex = i;
            String seed = seeds.get(i);
            futures.add(CompletableFuture.runAsync(
                () -> {
                    Thread chainWorker = Thread.currentThread();
                    job.signal().register(chainWorker);
                    try {
                        runChain(job, chainIndex, seed, fetchBudget);
                    } catch (RuntimeException e) {
                        // stop sibling chains; the first fatal error decides the outcome
                        job.signal().cancel();
                        throw e;
                    } finally {
                        job.signal().unregister(chainWorker);
                    }
                },
                fetchExecutor
            ));
        }
        RuntimeException fatal = null;
        for (CompletableFuture<Void> future : futures) {
            try {
                future.join();
            } catch (CompletionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                RuntimeException failure = cause instanceof RuntimeException runtime
                    ? runtime
                    : new IllegalStateException(cause);
                if (fatal == null || (fatal instanceof JobCancelledException && !(failure instanceof JobCancelledException))) {
                    fatal = failure;
                }
            }
        }
        if (fatal != null) {
            throw fatal;
        }
    }

    private List<String> discoverSeeds(Job job, Semaphore fetchBudget) {
        String startUrl = job.request().targetUrl();
        Template template = job.template();
        int attempts = 0;
        while (true) {
            job.signal().throwIfCancelled();
            attempts++;
            try {
                acquire(fetchBudget, job);
                try {
                    FetchAttempt attempt = fetchPipeline.fetch(startUrl, template.fetchProfile(), job.signal());
                    List<String> seeds = extractionEngine.discoverSeeds(attempt.document(), template);
                    log.info("Job {} discovered {} seed urls on {}", job.id(), seeds.size(), startUrl);
                    return seeds.isEmpty() ? List.of(startUrl) : seeds;
                } finally {
                    fetchBudget.release();
                }
            } catch (FetchExhaustedException | DefenseDetectedException e) {
                String reason = e instanceof FetchExhaustedException exhausted
                    ? exhausted.getReasonCode()
                    : ReasonCodes.DEFENSE_DETECTED;
                job.recordError(startUrl, reason, e.getMessage());
                if (attempts >= properties.getJobs().getMaxConsecutivePageFailures()) {
                    throw new JobAbortedException(reason, "Seed discovery failed on " + startUrl + ": " + e.getMessage());
                }
                job.signal().sleep(fetchPipeline.preRequestDelayMs(template.fetchProfile()));
            }
        }
    }

    private void runChain(Job job, int chainIndex, String startUrl, Semaphore fetchBudget) {
        Template template = job.template();
        RecentRecordWindow window = paginationController.newWindow(template);
        String url = startUrl;
        int pagesSoFar = 0;
        while (url != null) {
            awaitIfPaused(job);
            if (pagesSoFar > 0) {
                job.signal().sleep(fetchPipeline.preRequestDelayMs(template.fetchProfile()));
            }
            PageResult page = processPage(job, chainIndex, pagesSoFar + 1, url, fetchBudget);
            if (!page.success()) {
                int consecutive = job.registerPageFailure();
                boolean retrySameUrl = ReasonCodes.isRetryable(page.failureReason());
                log.warn(
                    "Job {} page {} failed ({}): {} [consecutive failures {}]",
                    job.id(),
                    url,
                    page.failureReason(),
                    page.failureMessage(),
                    consecutive
                );
                if (consecutive >= properties.getJobs().getMaxConsecutivePageFailures()) {
                    recordPage(job, page);
                    throw new JobAbortedException(
                        ReasonCodes.CONSECUTIVE_FAILURES,
                        consecutive + " consecutive page failures, last on " + url + " (" + page.failureReason() + ")"
                    );
                }
                if (ReasonCodes.DEFENSE_DETECTED.equals(page.failureReason())
                    && properties.getFetch().getOnDefenseDetected() == DefensePolicy.ABORT) {
                    recordPage(job, page);
                    throw new JobAbortedException(ReasonCodes.DEFENSE_DETECTED, page.failureMessage());
                }
                if (retrySameUrl) {
                    job.recordError(url, page.failureReason(), page.failureMessage() + " (retrying page)");
                    continue;
                }
                pagesSoFar++;
                String next = paginationController.nextUrl(page, template, pagesSoFar, null).orElse(null);
                recordPage(job, page.withNextPageUrl(next));
                url = next;
                continue;
            }
            job.resetConsecutiveFailures();
            pagesSoFar++;
            String next = paginationController.nextUrl(page, template, pagesSoFar, window).orElse(null);
            recordPage(job, page.withNextPageUrl(next));
            url = next;
        }
    }

    private PageResult processPage(Job job, int chainIndex, int pageNumber, String url, Semaphore fetchBudget) {
        Template template = job.template();
        acquire(fetchBudget, job);
        try {
            FetchAttempt attempt = fetchPipeline.fetch(url, template.fetchProfile(), job.signal());
            List<ExtractionResult> records;
            try {
                records = extractionEngine.extractAll(attempt.document(), template);
            } catch (RuntimeException e) {
                return PageResult.failed(chainIndex, pageNumber, url, ReasonCodes.EXTRACTION_FAILED, e.getMessage(), attempt.metadata());
            }
            PageResult page = PageResult.extracted(chainIndex, pageNumber, url, records, attempt.metadata(), attempt.document());
            if (ExtractionEngine.shouldAbortPage(records, template)) {
                return page.asFailure(ReasonCodes.REQUIRED_FIELDS_MISSING, "Every required field missing on " + url);
            }
            return page;
        } catch (FetchExhaustedException e) {
            FetchMetadata metadata = new FetchMetadata(e.getLastStatusCode(), null, e.getLastProxy(), e.getAttempts());
            return PageResult.failed(chainIndex, pageNumber, url, e.getReasonCode(), e.getMessage(), metadata);
        } catch (DefenseDetectedException e) {
            List<String> proxies = e.getProxiesTried();
            String lastProxy = proxies.isEmpty() ? null : proxies.get(proxies.size() - 1);
            FetchMetadata metadata = new FetchMetadata(e.getLastStatusCode(), null, lastProxy, e.getAttempts());
            return PageResult.failed(chainIndex, pageNumber, url, ReasonCodes.DEFENSE_DETECTED, e.getMessage(), metadata);
        } finally {
            fetchBudget.release();
        }
    }

    private void recordPage(Job job, PageResult page) {
        boolean validationFailed = job.template().hasRequiredFields()
            && (page.records().isEmpty() || page.records().stream().allMatch(ExtractionResult::isPartial));
        synchronized (job) {
            JobProgress progress = job.recordPage(page, validationFailed);
            if (progress != null) {
                emit(progress);
            }
        }
    }

    private void awaitIfPaused(Job job) {
        while (job.status() == JobStatus.PAUSED) {
            job.signal().sleep(properties.getJobs().getPauseCheckIntervalMs());
        }
        job.signal().throwIfCancelled();
    }

    private void acquire(Semaphore fetchBudget, Job job) {
        try {
            fetchBudget.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobCancelledException("interrupted waiting for fetch slot in job " + job.id());
        }
    }

    private void finish(Job job) {
        if (!job.markResultsDelivered()) {
            return;
        }
        try {
            resultSink.accept(job.view(), job.results());
        } catch (RuntimeException e) {
            log.warn("Result sink rejected results of job {}", job.id(), e);
        }
        synchronized (job) {
            emit(job.progress());
        }
    }

    private void evictFinishedJobs() {
        List<Job> finished = new ArrayList<>();
        for (Job job : jobs.values()) {
            if (job.status().isTerminal() && job.isWorkerFinished() && job.isResultsDelivered()) {
                finished.add(job);
            }
        }
        int excess = finished.size() - properties.getJobs().getFinishedJobRetention();
        if (excess <= 0) {
            return;
        }
        finished.sort(Comparator.comparing(Job::finishedAt, Comparator.nullsFirst(Comparator.naturalOrder())));
        for (Job job : finished.subList(0, excess)) {
            if (jobs.remove(job.id(), job)) {
                log.debug("Job {} evicted from memory; results remain with the result sink", job.id());
            }
        }
    }

    private void emit(JobProgress progress) {
        for (ProgressSink sink : progressSinks) {
            try {
                sink.onProgress(progress);
            } catch (RuntimeException e) {
                log.warn("Progress sink {} failed for job {}", sink.getClass().getSimpleName(), progress.jobId(), e);
            }
        }
    }

    private void scheduleWatchdog(Job job) {
        try {
            cancelWatchdog.schedule(
                () -> {
                    if (!job.isWorkerFinished()) {
                        int interrupted = job.signal().interruptWorkers();
                        log.warn("Job {} did not unwind within grace period; interrupted {} workers", job.id(), interrupted);
                    }
                },
                properties.getJobs().getCancelGracePeriodMs(),
                TimeUnit.MILLISECONDS
            );
        } catch (RejectedExecutionException e) {
            log.debug("Cancel watchdog unavailable for job {}", job.id());
        }
    }

    private Job require(String jobId) {
        Job job = jobId == null ? null : jobs.get(jobId);
        if (job == null) {
            throw new UnknownJobException(jobId);
        }
        return job;
    }
}
