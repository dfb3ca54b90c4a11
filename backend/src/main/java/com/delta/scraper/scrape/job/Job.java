package com.delta.scraper.scrape.job;

import com.delta.scraper.scrape.model.JobError;
import com.delta.scraper.scrape.model.JobProgress;
import com.delta.scraper.scrape.model.JobRequest;
import com.delta.scraper.scrape.model.JobStatus;
import com.delta.scraper.scrape.model.JobView;
import com.delta.scraper.scrape.model.PageResult;
import com.delta.scraper.scrape.model.Template;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Mutable state of one job. Every read and write goes through this object's monitor; only
 * {@link JobOrchestrator} holds references to it.
 */
final class Job {
    private static final int MAX_ERRORS = 200;

    private final String id;
    private final JobRequest request;
    private final Template template;
    private final CancellationSignal signal = new CancellationSignal();
    private final CountDownLatch workerDone = new CountDownLatch(1);
    private final Instant createdAt = Instant.now();
    private final List<PageResult> pages = new ArrayList<>();
    private final List<JobError> errors = new ArrayList<>();

    private JobStatus status = JobStatus.PENDING;
    private Instant startedAt;
    private Instant finishedAt;
    private String terminalReason;
    private Integer estimatedTotalPages;
    private int pagesDone;
    private int itemsExtracted;
    private int itemsFailed;
    private int consecutiveFailures;
    private int fetchedPages;
    private int validationFailedPages;
    private boolean scheduled;
    private boolean resultsDelivered;
    private Instant updatedAt = createdAt;

    Job(String id, JobRequest request, Template template) {
        this.id = id;
        this.request = request;
        this.template = template;
    }

    String id() {
        return id;
    }

    Template template() {
        return template;
    }

    JobRequest request() {
        return request;
    }

    CancellationSignal signal() {
        return signal;
    }

    synchronized JobStatus status() {
        return status;
    }

    synchronized boolean transitionTo(JobStatus next) {
        if (!status.canTransitionTo(next)) {
            return false;
        }
        status = next;
        Instant now = Instant.now();
        updatedAt = now;
        if (next == JobStatus.RUNNING && startedAt == null) {
            startedAt = now;
        }
        if (next.isTerminal()) {
            finishedAt = now;
        }
        return true;
    }

    synchronized boolean terminate(JobStatus terminal, String reason) {
        if (status == JobStatus.PAUSED && terminal != JobStatus.CANCELLED) {
            // a paused job only ends through running, except for cancellation
            transitionTo(JobStatus.RUNNING);
        }
        if (!transitionTo(terminal)) {
            return false;
        }
        terminalReason = reason;
        return true;
    }

    /**
     * Marks the job as handed to the scheduler. Returns {@code false} if it already was.
     */
    synchronized boolean markScheduled() {
        if (scheduled) {
            return false;
        }
        scheduled = true;
        return true;
    }

    synchronized boolean markResultsDelivered() {
        if (resultsDelivered) {
            return false;
        }
        resultsDelivered = true;
        return true;
    }

    synchronized boolean isResultsDelivered() {
        return resultsDelivered;
    }

    synchronized Instant finishedAt() {
        return finishedAt;
    }

    synchronized void setEstimatedTotalPages(Integer estimatedTotalPages) {
        this.estimatedTotalPages = estimatedTotalPages;
    }

    /**
     * Appends a finished page. Pages that finish after the job went terminal are dropped so a cancelled
     * or failed job keeps exactly what it had when that happened.
     *
     * @return the resulting progress, or {@code null} when the page was dropped
     */
    synchronized JobProgress recordPage(PageResult page, boolean requiredValidationFailed) {
        if (status.isTerminal()) {
            return null;
        }
        pages.add(page.withoutDocument());
        pagesDone++;
        if (page.document() != null || page.success()) {
            fetchedPages++;
            if (requiredValidationFailed) {
                validationFailedPages++;
            }
        }
        if (page.success()) {
            itemsExtracted += (int) page.completeRecordCount();
            itemsFailed += (int) page.partialRecordCount();
        } else {
            itemsFailed += Math.max(1, page.records().size());
            addError(page.url(), page.failureReason(), page.failureMessage());
        }
        updatedAt = Instant.now();
        return progress();
    }

    synchronized void recordError(String url, String reasonCode, String message) {
        addError(url, reasonCode, message);
    }

    synchronized int registerPageFailure() {
        consecutiveFailures++;
        return consecutiveFailures;
    }

    synchronized void resetConsecutiveFailures() {
        consecutiveFailures = 0;
    }

    /**
     * True when at least one page was fetched and every fetched page failed required-field validation.
     */
    synchronized boolean failedValidationEverywhere() {
        return fetchedPages > 0 && validationFailedPages == fetchedPages;
    }

    synchronized JobProgress progress() {
        Double percent = null;
        if (estimatedTotalPages != null) {
            percent = status == JobStatus.COMPLETED
                ? 1.0
                : Math.min(1.0, (double) pagesDone / Math.max(1, estimatedTotalPages));
        }
        return new JobProgress(id, pagesDone, itemsExtracted, itemsFailed, status, percent, estimatedTotalPages, updatedAt);
    }

    synchronized List<PageResult> results() {
        List<PageResult> ordered = new ArrayList<>(pages);
        ordered.sort(Comparator.comparingInt(PageResult::chainIndex).thenComparingInt(PageResult::pageNumber));
        return ordered;
    }

    synchronized JobView view() {
        return new JobView(
            id,
            request.name(),
            request.templateName(),
            request.targetUrl(),
            request.parameters(),
            status,
            progress(),
            createdAt,
            startedAt,
            finishedAt,
            terminalReason,
            List.copyOf(errors)
        );
    }

    Instant createdAt() {
        return createdAt;
    }

    void workerFinished() {
        workerDone.countDown();
    }

    boolean isWorkerFinished() {
        return workerDone.getCount() == 0;
    }

    boolean awaitWorker(Duration timeout) throws InterruptedException {
        return workerDone.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void addError(String url, String reasonCode, String message) {
        if (errors.size() >= MAX_ERRORS) {
            return;
        }
        errors.add(new JobError(Instant.now(), url, reasonCode, message));
    }
}
