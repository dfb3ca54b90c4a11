package com.delta.scraper.scrape.pagination;

import com.delta.scraper.scrape.model.ExtractionResult;
import com.delta.scraper.scrape.util.HashUtils;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Rolling window of records seen on the recent pages of one page chain. A record counts as new unless
 * an identical record, or one whose field set is at least {@code similarityThreshold} Jaccard-similar,
 * is still in the window. Not thread-safe; each chain owns its window.
 */
public final class RecentRecordWindow {
    private final int capacity;
    private final double similarityThreshold;
    private final Deque<Seen> seen = new ArrayDeque<>();

    public RecentRecordWindow(int capacity, double similarityThreshold) {
        this.capacity = Math.max(1, capacity);
        this.similarityThreshold = similarityThreshold;
    }

    /**
     * Counts the records not already represented in the window, then adds all of them.
     */
    public int admit(List<ExtractionResult> records) {
        int fresh = 0;
        for (ExtractionResult record : records) {
            Seen candidate = Seen.of(record.values());
            if (!isKnown(candidate)) {
                fresh++;
            }
            seen.addLast(candidate);
            while (seen.size() > capacity) {
                seen.removeFirst();
            }
        }
        return fresh;
    }

    public int size() {
        return seen.size();
    }

    private boolean isKnown(Seen candidate) {
        for (Seen previous : seen) {
            if (previous.fingerprint().equals(candidate.fingerprint())) {
                return true;
            }
            if (jaccard(previous.features(), candidate.features()) >= similarityThreshold) {
                return true;
            }
        }
        return false;
    }

    static double jaccard(Set<String> left, Set<String> right) {
        if (left.isEmpty() && right.isEmpty()) {
            return 1.0;
        }
        Set<String> intersection = new HashSet<>(left);
        intersection.retainAll(right);
        Set<String> union = new HashSet<>(left);
        union.addAll(right);
        return (double) intersection.size() / union.size();
    }

    private record Seen(String fingerprint, Set<String> features) {
        static Seen of(Map<String, Object> values) {
            Set<String> features = new HashSet<>();
            for (Map.Entry<String, Object> entry : values.entrySet()) {
                features.add(entry.getKey() + "=" + Objects.toString(entry.getValue(), ""));
            }
            return new Seen(HashUtils.recordFingerprint(values), features);
        }
    }
}
