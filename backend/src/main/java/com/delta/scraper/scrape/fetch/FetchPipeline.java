package com.delta.scraper.scrape.fetch;

import com.delta.scraper.config.ScraperProperties;
import com.delta.scraper.scrape.job.CancellationSignal;
import com.delta.scraper.scrape.job.JobCancelledException;
import com.delta.scraper.scrape.model.FetchOutcome;
import com.delta.scraper.scrape.model.FetchProfile;
import com.delta.scraper.scrape.model.ProxyState;
import com.delta.scraper.scrape.model.ProxyValidationResult;
import com.delta.scraper.scrape.model.RawDocument;
import com.delta.scraper.scrape.proxy.NoProxyAvailableException;
import com.delta.scraper.scrape.proxy.ProxyEntry;
import com.delta.scraper.scrape.proxy.ProxyPool;
import com.delta.scraper.scrape.util.ReasonCodes;
import com.delta.scraper.scrape.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Fetches one page: jittered pre-request delay, classification of each attempt, proxy rotation on
 * defense hits, backoff on transient failures. Every attempt is reported to the {@link ProxyPool} and
 * the proxy lease is always released before returning.
 */
@Service
public class FetchPipeline {
    private static final Logger log = LoggerFactory.getLogger(FetchPipeline.class);

    private final ProxyPool proxyPool;
    private final FetchCapability capability;
    private final DefenseDetector defenseDetector;
    private final ScraperProperties.Fetch settings;

    public FetchPipeline(
        ProxyPool proxyPool,
        FetchCapability capability,
        DefenseDetector defenseDetector,
        ScraperProperties properties
    ) {
        this.proxyPool = proxyPool;
        this.capability = capability;
        this.defenseDetector = defenseDetector;
        this.settings = properties.getFetch();
    }

    /**
     * Acquires a proxy for the URL's host (or goes direct when the pool is empty) and fetches.
     *
     * @throws NoProxyAvailableException when the pool has entries but none can be leased
     * @throws DefenseDetectedException when every rotation still hits a defense page
     * @throws FetchExhaustedException when retries run out or the status is not retryable
     * @throws JobCancelledException when the signal fires during a wait
     */
    public FetchAttempt fetch(String url, FetchProfile profile, CancellationSignal signal) {
        ProxyEntry proxy = proxyPool.hasEntries() ? proxyPool.acquire(UrlUtils.hostOf(url)) : null;
        return fetch(url, proxy, profile, signal);
    }

    /**
     * Fetches through an already leased proxy. The lease is owned by this call from here on.
     */
    public FetchAttempt fetch(String url, ProxyEntry initialProxy, FetchProfile profile, CancellationSignal signal) {
        FetchProfile effective = profile == null ? FetchProfile.defaults() : profile;
        CancellationSignal cancellation = signal == null ? CancellationSignal.none() : signal;
        String domain = UrlUtils.hostOf(url);
        boolean direct = initialProxy == null;
        ProxyEntry proxy = initialProxy;
        Set<String> burned = new LinkedHashSet<>();
        int attempt = 0;
        int transientRetries = 0;
        int defenseRetries = 0;
        try {
            cancellation.sleep(preRequestDelayMs(effective));
            while (true) {
                cancellation.throwIfCancelled();
                attempt++;
                FetchAttempt result = attemptOnce(url, proxy, effective, attempt, cancellation);
                if (proxy != null) {
                    proxyPool.report(proxy, result.outcome(), result.latency());
                }
                log.debug(
                    "Fetch attempt {} for {} via {}: {} (status {}, {}ms)",
                    attempt,
                    url,
                    proxy == null ? "direct" : proxy.endpoint(),
                    result.outcome(),
                    result.statusCode(),
                    result.latency().toMillis()
                );
                FetchOutcome outcome = result.outcome();
                if (outcome == FetchOutcome.SUCCESS) {
                    return result;
                }
                if (outcome == FetchOutcome.DEFENSE_DETECTED) {
                    if (proxy != null) {
                        burned.add(proxy.endpoint());
                    }
                    if (direct || defenseRetries >= settings.getMaxDefenseRetries()) {
                        throw defenseDetected(url, attempt, result.statusCode(), burned);
                    }
                    defenseRetries++;
                    ProxyEntry previous = proxy;
                    proxy = null;
                    proxyPool.release(previous);
                    try {
                        proxy = proxyPool.acquire(domain, burned);
                    } catch (NoProxyAvailableException e) {
                        throw defenseDetected(url, attempt, result.statusCode(), burned);
                    }
                    log.warn("Defense page at {} via {}; rotating to {}", url, previous.endpoint(), proxy.endpoint());
                    cancellation.sleep(preRequestDelayMs(effective));
                    continue;
                }
                String reasonCode = ReasonCodes.fromOutcome(outcome, result.statusCode());
                if (!ReasonCodes.isRetryable(reasonCode)) {
                    throw exhausted(reasonCode, result, attempt, "Non-retryable failure " + reasonCode + " for " + url);
                }
                if (transientRetries >= settings.getMaxRetries()) {
                    throw exhausted(
                        reasonCode,
                        result,
                        attempt,
                        "Gave up on " + url + " after " + attempt + " attempts (" + reasonCode + ")"
                    );
                }
                transientRetries++;
                cancellation.sleep(backoffDelayMs(transientRetries));
                if (outcome.isConnectionLevel() && !direct) {
                    ProxyEntry failed = proxy;
                    proxy = null;
                    proxy = reacquireAfterConnectionFailure(domain, failed);
                }
            }
        } finally {
            proxyPool.release(proxy);
        }
    }

    /**
     * Sends one request to {@code testUrl} through every pool entry, whatever its state, and feeds
     * each outcome back into the pool. No pre-request delay and no retries.
     *
     * @throws IllegalArgumentException when {@code testUrl} is not an absolute http(s) URL
     */
    public List<ProxyValidationResult> validateProxies(String testUrl) {
        if (!UrlUtils.isHttpUrl(testUrl)) {
            throw new IllegalArgumentException("test url is not an absolute http(s) url: " + testUrl);
        }
        FetchProfile profile = FetchProfile.noDelay();
        List<ProxyValidationResult> results = new ArrayList<>();
        for (ProxyEntry entry : proxyPool.entries()) {
            FetchAttempt result = attemptOnce(testUrl, entry, profile, 1, CancellationSignal.none());
            ProxyState stateAfter = proxyPool.reportValidation(entry, result.outcome(), result.latency());
            results.add(new ProxyValidationResult(
                entry.endpoint(),
                result.outcome() == FetchOutcome.SUCCESS,
                result.outcome(),
                result.statusCode(),
                result.latency().toMillis(),
                stateAfter
            ));
        }
        long healthy = results.stream().filter(ProxyValidationResult::healthy).count();
        log.info("Validated {} proxies against {}: {} healthy", results.size(), testUrl, healthy);
        return results;
    }

    private FetchAttempt attemptOnce(
        String url,
        ProxyEntry proxy,
        FetchProfile profile,
        int attempt,
        CancellationSignal cancellation
    ) {
        long startedAt = System.nanoTime();
        try {
            RawDocument document = capability.fetchRaw(url, proxy == null ? null : proxy.endpoint(), profile);
            Duration latency = document.latency().isZero()
                ? Duration.ofNanos(System.nanoTime() - startedAt)
                : document.latency();
            FetchOutcome outcome;
            if (defenseDetector.isDefenseResponse(document)) {
                outcome = FetchOutcome.DEFENSE_DETECTED;
            } else if (document.statusCode() >= 400) {
                outcome = FetchOutcome.HTTP_ERROR;
            } else {
                outcome = FetchOutcome.SUCCESS;
            }
            return new FetchAttempt(url, proxy, outcome, document.statusCode(), latency, document, null, attempt);
        } catch (NetworkFetchException e) {
            Duration latency = Duration.ofNanos(System.nanoTime() - startedAt);
            if (e.getKind() == NetworkFetchException.Kind.INTERRUPTED) {
                if (cancellation.isCancelled()) {
                    throw new JobCancelledException("cancelled during fetch of " + url);
                }
                // Stray interrupt without a cancel: count it as a plain network error.
                Thread.interrupted();
            }
            return new FetchAttempt(url, proxy, outcomeFor(e.getKind()), 0, latency, null, e.getMessage(), attempt);
        }
    }

    private ProxyEntry reacquireAfterConnectionFailure(String domain, ProxyEntry failed) {
        proxyPool.release(failed);
        try {
            return proxyPool.acquire(domain, Set.of(failed.endpoint()));
        } catch (NoProxyAvailableException e) {
            return proxyPool.acquire(domain);
        }
    }

    private static FetchOutcome outcomeFor(NetworkFetchException.Kind kind) {
        return switch (kind) {
            case TIMEOUT -> FetchOutcome.TIMEOUT;
            case REFUSED -> FetchOutcome.REFUSED;
            case DNS_FAILURE -> FetchOutcome.DNS_FAILURE;
            case IO, INTERRUPTED -> FetchOutcome.NETWORK_ERROR;
        };
    }

    /**
     * Delay drawn from the profile's range, falling back to the configured defaults. Also used by
     * the orchestrator between pages.
     */
    public long preRequestDelayMs(FetchProfile profile) {
        int min = profile.minDelayMs() == null ? settings.getDefaultMinDelayMs() : Math.max(0, profile.minDelayMs());
        int max = profile.maxDelayMs() == null ? settings.getDefaultMaxDelayMs() : Math.max(min, profile.maxDelayMs());
        if (max <= 0) {
            return 0;
        }
        if (max <= min) {
            return min;
        }
        return ThreadLocalRandom.current().nextLong(min, max + 1L);
    }

    long backoffDelayMs(int retry) {
        int baseDelayMs = settings.getRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return 0;
        }
        int maxDelayMs = settings.getRetryMaxDelayMs();
        long delay = (long) baseDelayMs * (1L << Math.min(20, Math.max(0, retry - 1)));
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        return (delay / 2) + jitter;
    }

    private FetchExhaustedException exhausted(String reasonCode, FetchAttempt last, int attempts, String message) {
        log.warn("{}{}", message, last.errorMessage() == null ? "" : ": " + last.errorMessage());
        return new FetchExhaustedException(reasonCode, last.url(), attempts, last.statusCode(), last.proxyEndpoint(), message);
    }

    private DefenseDetectedException defenseDetected(String url, int attempts, int statusCode, Set<String> burned) {
        List<String> tried = new ArrayList<>(burned);
        log.warn("Defense detected for {} after {} attempts across proxies {}", url, attempts, tried);
        return new DefenseDetectedException(
            url,
            attempts,
            statusCode,
            tried,
            "Automated-traffic defense detected for " + url + " after " + attempts + " attempts"
        );
    }
}
