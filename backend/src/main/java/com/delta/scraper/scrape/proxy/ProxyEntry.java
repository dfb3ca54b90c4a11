package com.delta.scraper.scrape.proxy;

import com.delta.scraper.scrape.model.ProxyEntryView;
import com.delta.scraper.scrape.model.ProxyState;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Health record for one proxy endpoint. All mutable state is guarded by the owning pool's monitor;
 * callers outside the pool only ever see the endpoint.
 */
public final class ProxyEntry {
    private final String endpoint;

    long successes;
    long failures;
    int consecutiveFailures;
    int cooldownStrikes;
    double successEwma = 0.5;
    double latencyEwmaMs = Double.NaN;
    ProxyState state = ProxyState.ACTIVE;
    Instant deadline;
    Instant lastUsedAt;
    long lastUsedSequence;
    int leases;
    final Map<String, Instant> lastUsedByDomain = new HashMap<>();

    ProxyEntry(String endpoint) {
        this.endpoint = endpoint;
    }

    public String endpoint() {
        return endpoint;
    }

    double latencyOrDefault(int defaultLatencyMs) {
        return Double.isNaN(latencyEwmaMs) ? defaultLatencyMs : Math.max(1.0, latencyEwmaMs);
    }

    double quality(int defaultLatencyMs) {
        return successEwma / latencyOrDefault(defaultLatencyMs);
    }

    boolean recentlyUsedFor(String domain, Instant now, long reuseIntervalMs) {
        if (domain == null || reuseIntervalMs <= 0) {
            return false;
        }
        Instant last = lastUsedByDomain.get(domain);
        return last != null && last.plusMillis(reuseIntervalMs).isAfter(now);
    }

    void forgetDomainsUsedBefore(Instant cutoff) {
        lastUsedByDomain.values().removeIf(last -> !last.isAfter(cutoff));
    }

    Instant lastUsedFor(String domain) {
        return domain == null ? null : lastUsedByDomain.get(domain);
    }

    void resetStatistics() {
        successes = 0;
        failures = 0;
        consecutiveFailures = 0;
        cooldownStrikes = 0;
        successEwma = 0.5;
        latencyEwmaMs = Double.NaN;
        state = ProxyState.ACTIVE;
        deadline = null;
    }

    ProxyEntryView view(int defaultLatencyMs) {
        long total = successes + failures;
        return new ProxyEntryView(
            endpoint,
            state,
            successes,
            failures,
            consecutiveFailures,
            total == 0 ? 0.0 : (double) successes / total,
            latencyOrDefault(defaultLatencyMs),
            leases,
            lastUsedAt,
            deadline
        );
    }

    @Override
    public String toString() {
        return endpoint;
    }
}
