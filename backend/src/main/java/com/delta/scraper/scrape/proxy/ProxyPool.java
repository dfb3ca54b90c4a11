package com.delta.scraper.scrape.proxy;

import com.delta.scraper.config.ScraperProperties;
import com.delta.scraper.scrape.model.FetchOutcome;
import com.delta.scraper.scrape.model.ProxyEntryView;
import com.delta.scraper.scrape.model.ProxyPoolStats;
import com.delta.scraper.scrape.model.ProxySelectionPolicy;
import com.delta.scraper.scrape.model.ProxyState;
import com.delta.scraper.scrape.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Shared, synchronized set of proxy endpoints. Entries are demoted to cooling-down or blacklisted by
 * {@link #report} and promoted back by a sweep that runs on every {@link #acquire}; the pool itself
 * never drops an entry.
 */
@Service
public class ProxyPool {
    private static final Logger log = LoggerFactory.getLogger(ProxyPool.class);
    private static final long WAIT_SLICE_MS = 50;

    private final ScraperProperties.Proxy settings;
    private final Clock clock;
    private final Object lock = new Object();
    private final List<ProxyEntry> entries = new ArrayList<>();
    private int roundRobinCursor;
    private long useSequence;

    public ProxyPool(ScraperProperties properties, Clock clock) {
        this.settings = properties.getProxy();
        this.clock = clock;
        for (String endpoint : settings.getEndpoints()) {
            try {
                add(endpoint);
            } catch (InvalidProxyEndpointException e) {
                log.warn("Skipping configured proxy: {}", e.getMessage());
            }
        }
    }

    public boolean hasEntries() {
        synchronized (lock) {
            return !entries.isEmpty();
        }
    }

    public ProxyEntry acquire(String domain) {
        return acquire(domain, Set.of());
    }

    /**
     * Reserves the best active entry for {@code domain}, skipping endpoints in {@code excludedEndpoints}.
     * Entries used for the same domain within the reuse interval are only chosen when nothing else is
     * free. Waits up to the configured acquire timeout when every active entry is fully leased.
     *
     * @throws NoProxyAvailableException when no eligible entry is active, or none frees up in time
     */
    public ProxyEntry acquire(String domain, Set<String> excludedEndpoints) {
        String normalizedDomain = normalizeDomain(domain);
        Set<String> excluded = excludedEndpoints == null ? Set.of() : excludedEndpoints;
        long deadlineNanos = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(settings.getAcquireTimeoutMs());
        synchronized (lock) {
            while (true) {
                Instant now = clock.instant();
                sweep(now);
                List<ProxyEntry> active = new ArrayList<>();
                for (ProxyEntry entry : entries) {
                    if (entry.state == ProxyState.ACTIVE && !excluded.contains(entry.endpoint())) {
                        active.add(entry);
                    }
                }
                if (active.isEmpty()) {
                    throw new NoProxyAvailableException(
                        "No active proxy available for " + normalizedDomain + " (" + entries.size() + " configured)"
                    );
                }
                List<ProxyEntry> free = new ArrayList<>();
                for (ProxyEntry entry : active) {
                    if (entry.leases < settings.getMaxLeasesPerProxy()) {
                        free.add(entry);
                    }
                }
                if (!free.isEmpty()) {
                    ProxyEntry chosen = select(free, normalizedDomain, now);
                    lease(chosen, normalizedDomain, now);
                    return chosen;
                }
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime());
                if (remainingMs <= 0) {
                    throw new NoProxyAvailableException(
                        "All " + active.size() + " active proxies are leased; gave up after "
                            + settings.getAcquireTimeoutMs() + "ms"
                    );
                }
                try {
                    lock.wait(Math.min(WAIT_SLICE_MS, remainingMs));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new NoProxyAvailableException("Interrupted while waiting for a proxy");
                }
            }
        }
    }

    public void release(ProxyEntry entry) {
        if (entry == null) {
            return;
        }
        synchronized (lock) {
            if (entry.leases > 0) {
                entry.leases--;
            }
            lock.notifyAll();
        }
    }

    /**
     * Records the outcome of one attempt. HTTP-level errors count in the proxy's favour: the proxy
     * carried the request and the target answered.
     */
    public void report(ProxyEntry entry, FetchOutcome outcome, Duration latency) {
        if (entry == null || outcome == null) {
            return;
        }
        synchronized (lock) {
            if (!entries.contains(entry)) {
                return;
            }
            double weight = settings.getRecencyWeight();
            if (!outcome.isProxyFailure()) {
                entry.successes++;
                entry.consecutiveFailures = 0;
                entry.cooldownStrikes = 0;
                entry.successEwma = weight + (1 - weight) * entry.successEwma;
                if (latency != null && !latency.isNegative() && !latency.isZero()) {
                    double sample = latency.toMillis();
                    entry.latencyEwmaMs = Double.isNaN(entry.latencyEwmaMs)
                        ? sample
                        : weight * sample + (1 - weight) * entry.latencyEwmaMs;
                }
                return;
            }
            entry.failures++;
            entry.consecutiveFailures++;
            entry.successEwma = (1 - weight) * entry.successEwma;
            if (entry.state == ProxyState.ACTIVE && entry.consecutiveFailures >= settings.getFailureThreshold()) {
                demote(entry, outcome);
            }
        }
    }

    /**
     * Records a health-check outcome. Besides the usual accounting, a successful check brings a
     * cooling-down or blacklisted entry straight back to active.
     */
    public ProxyState reportValidation(ProxyEntry entry, FetchOutcome outcome, Duration latency) {
        synchronized (lock) {
            report(entry, outcome, latency);
            if (outcome == FetchOutcome.SUCCESS && entry.state != ProxyState.ACTIVE && entries.contains(entry)) {
                log.info("Proxy {} passed validation; back to active from {}", entry.endpoint(), entry.state);
                entry.state = ProxyState.ACTIVE;
                entry.deadline = null;
                lock.notifyAll();
            }
            return entry.state;
        }
    }

    /**
     * Every entry regardless of state, in insertion order.
     */
    public List<ProxyEntry> entries() {
        synchronized (lock) {
            return List.copyOf(entries);
        }
    }

    public ProxyPoolStats stats() {
        synchronized (lock) {
            sweep(clock.instant());
            int active = 0;
            int coolingDown = 0;
            int blacklisted = 0;
            long successes = 0;
            long total = 0;
            List<ProxyEntryView> views = new ArrayList<>();
            for (ProxyEntry entry : entries) {
                switch (entry.state) {
                    case ACTIVE -> active++;
                    case COOLING_DOWN -> coolingDown++;
                    case BLACKLISTED -> blacklisted++;
                }
                successes += entry.successes;
                total += entry.successes + entry.failures;
                views.add(entry.view(settings.getDefaultLatencyMs()));
            }
            double rate = total == 0 ? 0.0 : (double) successes / total;
            return new ProxyPoolStats(entries.size(), active, coolingDown, blacklisted, rate, List.copyOf(views));
        }
    }

    /**
     * Adds an endpoint unless it is already present.
     *
     * @throws InvalidProxyEndpointException when the endpoint is not {@code host:port} or {@code http(s)://host:port}
     */
    public boolean add(String endpoint) {
        if (endpoint == null || endpoint.isBlank()) {
            return false;
        }
        if (UrlUtils.proxyUri(endpoint) == null) {
            throw new InvalidProxyEndpointException(endpoint.trim());
        }
        String normalized = endpoint.trim();
        synchronized (lock) {
            for (ProxyEntry entry : entries) {
                if (entry.endpoint().equals(normalized)) {
                    return false;
                }
            }
            entries.add(new ProxyEntry(normalized));
            lock.notifyAll();
            log.info("Proxy {} added to pool", normalized);
            return true;
        }
    }

    /**
     * Operator action. Outstanding leases on the removed entry are simply dropped when released.
     */
    public boolean remove(String endpoint) {
        if (endpoint == null) {
            return false;
        }
        synchronized (lock) {
            boolean removed = entries.removeIf(entry -> entry.endpoint().equals(endpoint.trim()));
            if (removed) {
                log.info("Proxy {} removed from pool", endpoint.trim());
            }
            return removed;
        }
    }

    public void resetStatistics() {
        synchronized (lock) {
            for (ProxyEntry entry : entries) {
                entry.resetStatistics();
            }
            lock.notifyAll();
        }
    }

    private ProxyEntry select(List<ProxyEntry> free, String domain, Instant now) {
        List<ProxyEntry> fresh = new ArrayList<>();
        for (ProxyEntry entry : free) {
            if (!entry.recentlyUsedFor(domain, now, settings.getDomainReuseIntervalMs())) {
                fresh.add(entry);
            }
        }
        if (fresh.isEmpty()) {
            // everything free was used for this domain just now; take whichever rested longest
            return free.stream()
                .min(Comparator.comparing(
                    (ProxyEntry entry) -> entry.lastUsedFor(domain),
                    Comparator.nullsFirst(Comparator.naturalOrder())
                ).thenComparingLong(entry -> entry.lastUsedSequence))
                .orElseThrow();
        }
        ProxySelectionPolicy policy = settings.getSelectionPolicy();
        return switch (policy) {
            case ROUND_ROBIN -> nextRoundRobin(fresh);
            case RANDOM -> fresh.get(ThreadLocalRandom.current().nextInt(fresh.size()));
            case PERFORMANCE -> bestPerforming(fresh);
        };
    }

    private ProxyEntry nextRoundRobin(List<ProxyEntry> candidates) {
        int size = entries.size();
        for (int offset = 0; offset < size; offset++) {
            ProxyEntry entry = entries.get((roundRobinCursor + offset) % size);
            if (candidates.contains(entry)) {
                roundRobinCursor = (roundRobinCursor + offset + 1) % size;
                return entry;
            }
        }
        return candidates.get(0);
    }

    private ProxyEntry bestPerforming(List<ProxyEntry> candidates) {
        int defaultLatency = settings.getDefaultLatencyMs();
        ProxyEntry best = null;
        for (ProxyEntry entry : candidates) {
            if (best == null) {
                best = entry;
                continue;
            }
            int cmp = Double.compare(entry.quality(defaultLatency), best.quality(defaultLatency));
            if (cmp > 0 || (cmp == 0 && entry.lastUsedSequence < best.lastUsedSequence)) {
                best = entry;
            }
        }
        return best;
    }

    private void lease(ProxyEntry entry, String domain, Instant now) {
        entry.leases++;
        entry.lastUsedAt = now;
        entry.lastUsedSequence = ++useSequence;
        if (domain != null) {
            entry.lastUsedByDomain.put(domain, now);
        }
    }

    private void demote(ProxyEntry entry, FetchOutcome outcome) {
        Instant now = clock.instant();
        entry.cooldownStrikes++;
        entry.consecutiveFailures = 0;
        if (entry.cooldownStrikes >= settings.getBlacklistAfterCooldowns()) {
            entry.state = ProxyState.BLACKLISTED;
            entry.deadline = now.plusSeconds(settings.getBlacklistSeconds());
            log.warn(
                "Proxy {} blacklisted until {} after {} cooldowns (last outcome {})",
                entry.endpoint(),
                entry.deadline,
                entry.cooldownStrikes,
                outcome
            );
        } else {
            entry.state = ProxyState.COOLING_DOWN;
            entry.deadline = now.plusSeconds(settings.getCooldownSeconds());
            log.warn(
                "Proxy {} cooling down until {} after {} consecutive failures (last outcome {})",
                entry.endpoint(),
                entry.deadline,
                settings.getFailureThreshold(),
                outcome
            );
        }
    }

    private void sweep(Instant now) {
        Instant reuseCutoff = now.minusMillis(settings.getDomainReuseIntervalMs());
        for (ProxyEntry entry : entries) {
            entry.forgetDomainsUsedBefore(reuseCutoff);
            if (entry.state != ProxyState.ACTIVE && entry.deadline != null && !entry.deadline.isAfter(now)) {
                log.info("Proxy {} back to active after {}", entry.endpoint(), entry.state);
                entry.state = ProxyState.ACTIVE;
                entry.deadline = null;
            }
        }
    }

    private String normalizeDomain(String domain) {
        if (domain == null || domain.isBlank()) {
            return null;
        }
        return domain.trim().toLowerCase(Locale.ROOT);
    }
}
