package com.delta.scraper.scrape.util;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HashUtilsTest {

    @Test
    void sha256MatchesKnownVector() {
        assertThat(HashUtils.sha256Hex("abc")).isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void recordFingerprintDistinguishesValuesAndNulls() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("title", "A");
        record.put("price", "10");
        Map<String, Object> copy = new LinkedHashMap<>(record);
        Map<String, Object> repriced = new LinkedHashMap<>(record);
        repriced.put("price", "11");
        Map<String, Object> missing = new LinkedHashMap<>(record);
        missing.put("price", null);
        Map<String, Object> blank = new LinkedHashMap<>(record);
        blank.put("price", "");

        assertThat(HashUtils.recordFingerprint(record)).isEqualTo(HashUtils.recordFingerprint(copy));
        assertThat(HashUtils.recordFingerprint(record)).isNotEqualTo(HashUtils.recordFingerprint(repriced));
        assertThat(HashUtils.recordFingerprint(missing)).isNotEqualTo(HashUtils.recordFingerprint(blank));
    }
}
