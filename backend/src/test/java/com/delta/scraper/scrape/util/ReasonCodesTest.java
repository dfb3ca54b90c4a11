package com.delta.scraper.scrape.util;

import com.delta.scraper.scrape.model.FetchOutcome;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReasonCodesTest {

    @Test
    void mapsHttpStatuses() {
        assertEquals(ReasonCodes.HTTP_401_403, ReasonCodes.fromHttpStatus(403));
        assertEquals(ReasonCodes.HTTP_404, ReasonCodes.fromHttpStatus(404));
        assertEquals(ReasonCodes.TIMEOUT, ReasonCodes.fromHttpStatus(408));
        assertEquals(ReasonCodes.HTTP_429_RATE_LIMIT, ReasonCodes.fromHttpStatus(429));
        assertEquals(ReasonCodes.HTTP_4XX, ReasonCodes.fromHttpStatus(410));
        assertEquals(ReasonCodes.HTTP_5XX, ReasonCodes.fromHttpStatus(502));
        assertEquals(ReasonCodes.UNKNOWN, ReasonCodes.fromHttpStatus(null));
    }

    @Test
    void mapsFetchOutcomes() {
        assertEquals(ReasonCodes.CONNECTION_REFUSED, ReasonCodes.fromOutcome(FetchOutcome.REFUSED, 0));
        assertEquals(ReasonCodes.DEFENSE_DETECTED, ReasonCodes.fromOutcome(FetchOutcome.DEFENSE_DETECTED, 403));
        assertEquals(ReasonCodes.HTTP_5XX, ReasonCodes.fromOutcome(FetchOutcome.HTTP_ERROR, 500));
    }

    @Test
    void onlyTransientReasonsAreRetryable() {
        assertTrue(ReasonCodes.isRetryable(ReasonCodes.TIMEOUT));
        assertTrue(ReasonCodes.isRetryable(ReasonCodes.HTTP_5XX));
        assertTrue(ReasonCodes.isRetryable(ReasonCodes.HTTP_429_RATE_LIMIT));
        assertFalse(ReasonCodes.isRetryable(ReasonCodes.HTTP_404));
        assertFalse(ReasonCodes.isRetryable(ReasonCodes.HTTP_401_403));
        assertFalse(ReasonCodes.isRetryable(ReasonCodes.DEFENSE_DETECTED));
        assertFalse(ReasonCodes.isRetryable(null));
    }
}
