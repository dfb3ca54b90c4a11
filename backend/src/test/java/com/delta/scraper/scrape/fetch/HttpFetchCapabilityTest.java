package com.delta.scraper.scrape.fetch;

import com.delta.scraper.config.ScraperProperties;
import com.delta.scraper.scrape.model.FetchProfile;
import com.delta.scraper.scrape.model.RawDocument;
import com.delta.scraper.scrape.model.StealthLevel;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okio.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpFetchCapabilityTest {
    private MockWebServer server;

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
    }

    @Test
    void returnsBodyStatusAndHeaders() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "text/html")
            .setHeader("X-Trace", "abc")
            .setBody("<html><body>listing</body></html>"));
        server.start();

        ScraperProperties properties = properties();
        properties.setUserAgent("unit-test-agent/1.0");
        HttpFetchCapability capability = new HttpFetchCapability(properties);

        RawDocument document = capability.fetchRaw(server.url("/list").toString(), null, FetchProfile.noDelay());

        assertThat(document.statusCode()).isEqualTo(200);
        assertThat(document.body()).contains("listing");
        assertThat(document.header("x-trace")).isEqualTo("abc");
        assertThat(document.finalUrlOrRequested()).endsWith("/list");
        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getHeader("User-Agent")).isEqualTo("unit-test-agent/1.0");
        assertThat(request.getHeader("Sec-Fetch-Mode")).isNull();
    }

    @Test
    void bodyIsDecodedWithDeclaredCharset() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "text/html; charset=ISO-8859-1")
            .setBody(new Buffer().write("<h1>Caf\u00e9 cr\u00e8me</h1>".getBytes(StandardCharsets.ISO_8859_1))));
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "text/html")
            .setBody(new Buffer().write(
                "<html><head><meta charset=\"windows-1252\"></head><body>na\u00efve</body></html>"
                    .getBytes(Charset.forName("windows-1252")))));
        server.start();
        HttpFetchCapability capability = new HttpFetchCapability(properties());

        RawDocument declared = capability.fetchRaw(server.url("/latin").toString(), null, FetchProfile.noDelay());
        RawDocument sniffed = capability.fetchRaw(server.url("/meta").toString(), null, FetchProfile.noDelay());

        assertThat(declared.body()).contains("Caf\u00e9 cr\u00e8me");
        assertThat(sniffed.body()).contains("na\u00efve");
    }

    @Test
    void unusableCharsetFallsBackToUtf8() {
        byte[] body = "<p>ok</p>".getBytes(StandardCharsets.UTF_8);
        assertThat(HttpFetchCapability.charsetOf("text/html; charset=no-such-charset", body, "https://a.example/"))
            .isEqualTo(StandardCharsets.UTF_8);
        assertThat(HttpFetchCapability.charsetOf("application/json", body, "https://a.example/"))
            .isEqualTo(StandardCharsets.UTF_8);
    }

    @Test
    void errorStatusIsReturnedNotThrown() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));
        server.start();

        RawDocument document = new HttpFetchCapability(properties())
            .fetchRaw(server.url("/busy").toString(), null, FetchProfile.noDelay());

        assertThat(document.statusCode()).isEqualTo(503);
        assertThat(document.body()).isEqualTo("busy");
    }

    @Test
    void stealthProfileSendsBrowserHeaders() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(200).setBody("ok"));
        server.start();

        FetchProfile stealth = new FetchProfile(StealthLevel.STEALTH, 0, 0, null);
        new HttpFetchCapability(properties()).fetchRaw(server.url("/").toString(), null, stealth);

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getHeader("User-Agent")).startsWith("Mozilla/5.0");
        assertThat(request.getHeader("Sec-Fetch-Mode")).isEqualTo("navigate");
        assertThat(request.getHeader("Upgrade-Insecure-Requests")).isEqualTo("1");
    }

    @Test
    void routesThroughGivenProxy() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(200).setBody("via proxy"));
        server.start();

        String proxy = server.getHostName() + ":" + server.getPort();
        RawDocument document = new HttpFetchCapability(properties())
            .fetchRaw("http://catalog.invalid/items?page=2", proxy, FetchProfile.noDelay());

        assertThat(document.body()).isEqualTo("via proxy");
        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getRequestLine()).contains("catalog.invalid");
    }

    @Test
    void explicitUserAgentWins() {
        HttpFetchCapability capability = new HttpFetchCapability(properties());
        assertThat(capability.userAgentFor(new FetchProfile(StealthLevel.STEALTH, null, null, " custom/2 ")))
            .isEqualTo("custom/2");
        assertThat(capability.userAgentFor(FetchProfile.noDelay())).isEqualTo(properties().getUserAgent());
    }

    @Test
    void closedPortIsReportedAsNetworkFailure() throws Exception {
        server = new MockWebServer();
        server.start();
        String url = server.url("/gone").toString();
        server.shutdown();
        server = null;

        assertThatThrownBy(() -> new HttpFetchCapability(properties()).fetchRaw(url, null, FetchProfile.noDelay()))
            .isInstanceOfSatisfying(NetworkFetchException.class, e ->
                assertThat(e.getKind()).isIn(NetworkFetchException.Kind.REFUSED, NetworkFetchException.Kind.IO));
    }

    @Test
    void malformedUrlIsRejectedWithoutNetwork() {
        assertThatThrownBy(() -> new HttpFetchCapability(properties()).fetchRaw("not a url", null, FetchProfile.noDelay()))
            .isInstanceOf(NetworkFetchException.class)
            .hasMessageContaining("malformed");
    }

    @Test
    void unusableProxyEndpointIsANetworkFailure() {
        assertThatThrownBy(() -> new HttpFetchCapability(properties())
                .fetchRaw("https://shop.example/list", "bad proxy:80", FetchProfile.noDelay()))
            .isInstanceOfSatisfying(NetworkFetchException.class, e ->
                assertThat(e.getKind()).isEqualTo(NetworkFetchException.Kind.REFUSED))
            .hasMessageContaining("bad proxy:80");
    }

    @Test
    void proxyEndpointParsing() {
        InetSocketAddress plain = HttpFetchCapability.proxyAddress("10.0.0.5:3128");
        assertThat(plain.getHostString()).isEqualTo("10.0.0.5");
        assertThat(plain.getPort()).isEqualTo(3128);

        InetSocketAddress withScheme = HttpFetchCapability.proxyAddress("http://proxy.internal");
        assertThat(withScheme.getHostString()).isEqualTo("proxy.internal");
        assertThat(withScheme.getPort()).isEqualTo(8080);

        assertThatThrownBy(() -> HttpFetchCapability.proxyAddress("::::"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static ScraperProperties properties() {
        ScraperProperties properties = new ScraperProperties();
        properties.setRequestTimeoutSeconds(5);
        return properties;
    }
}
