package com.delta.scraper.scrape.fetch;

import com.delta.scraper.config.ScraperProperties;
import com.delta.scraper.scrape.job.CancellationSignal;
import com.delta.scraper.scrape.job.JobCancelledException;
import com.delta.scraper.scrape.model.FetchOutcome;
import com.delta.scraper.scrape.model.FetchProfile;
import com.delta.scraper.scrape.model.ProxyEntryView;
import com.delta.scraper.scrape.model.ProxySelectionPolicy;
import com.delta.scraper.scrape.model.ProxyState;
import com.delta.scraper.scrape.model.ProxyValidationResult;
import com.delta.scraper.scrape.model.RawDocument;
import com.delta.scraper.scrape.proxy.NoProxyAvailableException;
import com.delta.scraper.scrape.proxy.ProxyEntry;
import com.delta.scraper.scrape.proxy.ProxyPool;
import com.delta.scraper.scrape.util.ReasonCodes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FetchPipelineTest {
    private static final String URL = "https://shop.example/catalog?page=1";
    private static final FetchProfile PROFILE = FetchProfile.noDelay();

    @Mock
    private FetchCapability capability;

    private ScraperProperties properties;

    @BeforeEach
    void setUp() {
        properties = new ScraperProperties();
        properties.getFetch().setRetryBaseDelayMs(0);
        properties.getFetch().setMaxRetries(3);
        properties.getFetch().setMaxDefenseRetries(2);
        properties.getProxy().setSelectionPolicy(ProxySelectionPolicy.ROUND_ROBIN);
        properties.getProxy().setDomainReuseIntervalMs(0);
        properties.getProxy().setAcquireTimeoutMs(50);
    }

    @Test
    void defensePageRotatesToAnotherProxyAndPenalizesTheFirst() throws Exception {
        ProxyPool pool = pool("p1:3128", "p2:3128");
        when(capability.fetchRaw(eq(URL), eq("p1:3128"), any())).thenReturn(challenge());
        when(capability.fetchRaw(eq(URL), eq("p2:3128"), any())).thenReturn(ok("<html><h1>Catalog</h1></html>"));

        FetchAttempt attempt = pipeline(pool).fetch(URL, PROFILE, CancellationSignal.none());

        assertThat(attempt.isSuccess()).isTrue();
        assertThat(attempt.proxyEndpoint()).isEqualTo("p2:3128");
        assertThat(attempt.attemptNumber()).isEqualTo(2);
        assertThat(view(pool, "p1:3128").failures()).isEqualTo(1);
        assertThat(view(pool, "p2:3128").successes()).isEqualTo(1);
    }

    @Test
    void defenseOnEveryProxySurfacesAsDefenseDetected() throws Exception {
        ProxyPool pool = pool("p1:3128", "p2:3128");
        when(capability.fetchRaw(eq(URL), any(), any())).thenReturn(challenge());

        assertThatThrownBy(() -> pipeline(pool).fetch(URL, PROFILE, CancellationSignal.none()))
            .isInstanceOfSatisfying(DefenseDetectedException.class, e -> {
                assertThat(e.getProxiesTried()).containsExactly("p1:3128", "p2:3128");
                assertThat(e.getAttempts()).isEqualTo(2);
            });
        assertLeasesReleased(pool);
    }

    @Test
    void defenseWithoutProxiesFailsImmediately() throws Exception {
        ProxyPool pool = pool();
        when(capability.fetchRaw(eq(URL), isNull(), any())).thenReturn(RawDocument.of(URL, 429, "slow down"));

        assertThatThrownBy(() -> pipeline(pool).fetch(URL, PROFILE, CancellationSignal.none()))
            .isInstanceOf(DefenseDetectedException.class);
        verify(capability, times(1)).fetchRaw(any(), any(), any());
    }

    @Test
    void transientFailuresAreRetriedUntilSuccess() throws Exception {
        ProxyPool pool = pool();
        when(capability.fetchRaw(eq(URL), isNull(), any()))
            .thenThrow(new NetworkFetchException(NetworkFetchException.Kind.TIMEOUT, "read timed out"))
            .thenReturn(RawDocument.of(URL, 502, "bad gateway"))
            .thenReturn(ok("<html>fine</html>"));

        FetchAttempt attempt = pipeline(pool).fetch(URL, PROFILE, CancellationSignal.none());

        assertThat(attempt.isSuccess()).isTrue();
        assertThat(attempt.attemptNumber()).isEqualTo(3);
        assertThat(attempt.document().body()).contains("fine");
    }

    @Test
    void retryBudgetIsBounded() throws Exception {
        properties.getFetch().setMaxRetries(2);
        ProxyPool pool = pool();
        when(capability.fetchRaw(eq(URL), isNull(), any())).thenReturn(RawDocument.of(URL, 503, "unavailable"));

        assertThatThrownBy(() -> pipeline(pool).fetch(URL, PROFILE, CancellationSignal.none()))
            .isInstanceOfSatisfying(FetchExhaustedException.class, e -> {
                assertThat(e.getReasonCode()).isEqualTo(ReasonCodes.HTTP_5XX);
                assertThat(e.getAttempts()).isEqualTo(3);
                assertThat(e.getLastStatusCode()).isEqualTo(503);
            });
        verify(capability, times(3)).fetchRaw(any(), any(), any());
    }

    @Test
    void notFoundIsNotRetried() throws Exception {
        ProxyPool pool = pool("p1:3128");
        when(capability.fetchRaw(eq(URL), eq("p1:3128"), any())).thenReturn(RawDocument.of(URL, 404, "gone"));

        assertThatThrownBy(() -> pipeline(pool).fetch(URL, PROFILE, CancellationSignal.none()))
            .isInstanceOfSatisfying(FetchExhaustedException.class, e -> {
                assertThat(e.getReasonCode()).isEqualTo(ReasonCodes.HTTP_404);
                assertThat(e.getLastProxy()).isEqualTo("p1:3128");
            });
        verify(capability, times(1)).fetchRaw(any(), any(), any());
        assertThat(view(pool, "p1:3128").failures()).isZero();
        assertLeasesReleased(pool);
    }

    @Test
    void serverErrorRetriesOnSameProxy() throws Exception {
        ProxyPool pool = pool("p1:3128", "p2:3128");
        when(capability.fetchRaw(eq(URL), eq("p1:3128"), any()))
            .thenReturn(RawDocument.of(URL, 500, "oops"))
            .thenReturn(ok("<html>ok</html>"));

        FetchAttempt attempt = pipeline(pool).fetch(URL, PROFILE, CancellationSignal.none());

        assertThat(attempt.proxyEndpoint()).isEqualTo("p1:3128");
        verify(capability, never()).fetchRaw(any(), eq("p2:3128"), any());
    }

    @Test
    void connectionFailureMovesToAnotherProxy() throws Exception {
        ProxyPool pool = pool("p1:3128", "p2:3128");
        when(capability.fetchRaw(eq(URL), eq("p1:3128"), any()))
            .thenThrow(new NetworkFetchException(NetworkFetchException.Kind.REFUSED, "connection refused"));
        when(capability.fetchRaw(eq(URL), eq("p2:3128"), any())).thenReturn(ok("<html>ok</html>"));

        FetchAttempt attempt = pipeline(pool).fetch(URL, PROFILE, CancellationSignal.none());

        assertThat(attempt.proxyEndpoint()).isEqualTo("p2:3128");
        assertThat(view(pool, "p1:3128").consecutiveFailures()).isEqualTo(1);
        assertLeasesReleased(pool);
    }

    @Test
    void sidelinedPoolSurfacesNoProxyAvailable() {
        properties.getProxy().setFailureThreshold(1);
        ProxyPool pool = pool("p1:3128");
        pool.report(pool.acquire("shop.example"), FetchOutcome.TIMEOUT, Duration.ofMillis(5));

        assertThatThrownBy(() -> pipeline(pool).fetch(URL, PROFILE, CancellationSignal.none()))
            .isInstanceOf(NoProxyAvailableException.class);
    }

    @Test
    void cancelledSignalStopsBeforeFetching() throws Exception {
        ProxyPool pool = pool("p1:3128");
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();

        assertThatThrownBy(() -> pipeline(pool).fetch(URL, PROFILE, signal))
            .isInstanceOf(JobCancelledException.class);
        verify(capability, never()).fetchRaw(any(), any(), any());
        assertLeasesReleased(pool);
    }

    @Test
    void backoffGrowsExponentiallyAndIsCapped() {
        properties.getFetch().setRetryBaseDelayMs(100);
        properties.getFetch().setRetryMaxDelayMs(1000);
        FetchPipeline pipeline = pipeline(pool());

        assertThat(pipeline.backoffDelayMs(1)).isBetween(50L, 99L);
        assertThat(pipeline.backoffDelayMs(3)).isBetween(200L, 399L);
        assertThat(pipeline.backoffDelayMs(12)).isBetween(500L, 999L);
    }

    @Test
    void preRequestDelayFallsBackToConfiguredDefaults() {
        properties.getFetch().setDefaultMinDelayMs(40);
        properties.getFetch().setDefaultMaxDelayMs(60);
        FetchPipeline pipeline = pipeline(pool());

        assertThat(pipeline.preRequestDelayMs(FetchProfile.defaults())).isBetween(40L, 60L);
        assertThat(pipeline.preRequestDelayMs(FetchProfile.noDelay())).isZero();
    }

    @Test
    void validationChecksEveryProxyAndRevivesHealthySidelinedOnes() throws Exception {
        properties.getProxy().setFailureThreshold(1);
        ProxyPool pool = pool("p1:3128", "p2:3128", "p3:3128");
        ProxyEntry sidelined = pool.acquire("shop.example", Set.of("p1:3128", "p2:3128"));
        pool.report(sidelined, FetchOutcome.TIMEOUT, Duration.ofMillis(5));
        pool.release(sidelined);
        assertThat(view(pool, "p3:3128").state()).isEqualTo(ProxyState.COOLING_DOWN);

        String testUrl = "http://health.example/ip";
        when(capability.fetchRaw(eq(testUrl), eq("p1:3128"), any())).thenReturn(RawDocument.of(testUrl, 200, "{}"));
        when(capability.fetchRaw(eq(testUrl), eq("p2:3128"), any()))
            .thenThrow(new NetworkFetchException(NetworkFetchException.Kind.REFUSED, "connection refused"));
        when(capability.fetchRaw(eq(testUrl), eq("p3:3128"), any())).thenReturn(RawDocument.of(testUrl, 200, "{}"));

        List<ProxyValidationResult> results = pipeline(pool).validateProxies(testUrl);

        assertThat(results).extracting(ProxyValidationResult::endpoint)
            .containsExactly("p1:3128", "p2:3128", "p3:3128");
        assertThat(results).extracting(ProxyValidationResult::healthy).containsExactly(true, false, true);
        assertThat(results.get(1).outcome()).isEqualTo(FetchOutcome.REFUSED);
        assertThat(results.get(1).stateAfter()).isEqualTo(ProxyState.COOLING_DOWN);
        assertThat(results.get(2).stateAfter()).isEqualTo(ProxyState.ACTIVE);
        assertThat(view(pool, "p2:3128").failures()).isEqualTo(1);
        assertThat(view(pool, "p1:3128").successes()).isEqualTo(1);
        assertLeasesReleased(pool);
    }

    @Test
    void validationRejectsNonHttpTestUrl() {
        FetchPipeline pipeline = pipeline(pool("p1:3128"));
        assertThatThrownBy(() -> pipeline.validateProxies("ftp://health.example/"))
            .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(capability);
    }

    private FetchPipeline pipeline(ProxyPool pool) {
        return new FetchPipeline(pool, capability, new SignatureDefenseDetector(List.of("checking your browser")), properties);
    }

    private ProxyPool pool(String... endpoints) {
        properties.getProxy().setEndpoints(new ArrayList<>(List.of(endpoints)));
        return new ProxyPool(properties, Clock.systemUTC());
    }

    private static ProxyEntryView view(ProxyPool pool, String endpoint) {
        return pool.stats().entries().stream()
            .filter(entry -> entry.endpoint().equals(endpoint))
            .findFirst()
            .orElseThrow();
    }

    private static void assertLeasesReleased(ProxyPool pool) {
        assertThat(pool.stats().entries()).allSatisfy(entry -> assertThat(entry.leases()).isZero());
    }

    private static RawDocument ok(String body) {
        return RawDocument.of(URL, 200, body);
    }

    private static RawDocument challenge() {
        return new RawDocument(
            URL,
            URI.create(URL),
            403,
            "<html><title>Just a moment...</title>Checking your browser before accessing</html>",
            Map.of("server", List.of("cloudflare"), "cf-ray", List.of("8a1b2c3d")),
            Instant.now(),
            Duration.ofMillis(30)
        );
    }
}
