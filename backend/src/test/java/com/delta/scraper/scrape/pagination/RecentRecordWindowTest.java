package com.delta.scraper.scrape.pagination;

import com.delta.scraper.scrape.model.ExtractionResult;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class RecentRecordWindowTest {

    @Test
    void nearDuplicatesCountAsSeen() {
        RecentRecordWindow window = new RecentRecordWindow(10, 0.6);
        assertThat(window.admit(List.of(record("Boot", "10", "black", "42")))).isEqualTo(1);
        // three of five features shared: 0.6
        assertThat(window.admit(List.of(record("Boot", "10", "black", "43")))).isZero();
        assertThat(window.admit(List.of(record("Sandal", "20", "tan", "38")))).isEqualTo(1);
    }

    @Test
    void oldestRecordsLeaveTheWindow() {
        RecentRecordWindow window = new RecentRecordWindow(2, 1.0);
        window.admit(List.of(record("a", "1", "x", "1"), record("b", "2", "x", "1"), record("c", "3", "x", "1")));

        assertThat(window.size()).isEqualTo(2);
        assertThat(window.admit(List.of(record("a", "1", "x", "1")))).isEqualTo(1);
    }

    @Test
    void jaccardOfEmptySetsIsOne() {
        assertThat(RecentRecordWindow.jaccard(Set.of(), Set.of())).isEqualTo(1.0);
        assertThat(RecentRecordWindow.jaccard(Set.of("a", "b"), Set.of("b", "c"))).isEqualTo(1.0 / 3);
    }

    private static ExtractionResult record(String name, String price, String color, String size) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("name", name);
        values.put("price", price);
        values.put("color", color);
        values.put("size", size);
        return new ExtractionResult(values, List.of(), Map.of(), 1.0);
    }
}
