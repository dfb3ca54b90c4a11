package com.delta.scraper.scrape.fetch;

import com.delta.scraper.config.ScraperProperties;
import com.delta.scraper.scrape.model.FetchProfile;
import com.delta.scraper.scrape.model.RawDocument;
import com.delta.scraper.scrape.model.StealthLevel;
import com.delta.scraper.scrape.util.UrlUtils;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Plain HTTP fetch capability on {@link HttpClient}. One client is cached per proxy address. Bodies are
 * decoded with the response's declared charset.
 */
@Component
public class HttpFetchCapability implements FetchCapability {
    private static final Logger log = LoggerFactory.getLogger(HttpFetchCapability.class);
    private static final String DIRECT = "direct";
    private static final List<String> BROWSER_USER_AGENTS = List.of(
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.4 Safari/605.1.15",
        "Mozilla/5.0 (X11; Linux x86_64; rv:125.0) Gecko/20100101 Firefox/125.0",
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:125.0) Gecko/20100101 Firefox/125.0"
    );

    private final ScraperProperties properties;
    private final Map<String, HttpClient> clients = new ConcurrentHashMap<>();

    public HttpFetchCapability(ScraperProperties properties) {
        this.properties = properties;
    }

    @Override
    public RawDocument fetchRaw(String url, String proxyAddress, FetchProfile profile) throws NetworkFetchException {
        URI uri = UrlUtils.safeUri(url);
        if (uri == null || uri.getHost() == null) {
            throw new NetworkFetchException(NetworkFetchException.Kind.IO, "URL missing host or malformed: " + url);
        }
        FetchProfile effective = profile == null ? FetchProfile.defaults() : profile;
        HttpClient client;
        try {
            client = clientFor(proxyAddress);
        } catch (IllegalArgumentException e) {
            // unusable proxy address; reported as a failure of that proxy
            throw new NetworkFetchException(NetworkFetchException.Kind.REFUSED, e.getMessage(), e);
        }
        HttpRequest request = buildRequest(uri, effective);
        Instant startedAt = Instant.now();
        try {
            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            byte[] responseBytes = response.body();
            String responseBody = responseBytes == null
                ? ""
                : new String(responseBytes, charsetOf(response.headers().firstValue("Content-Type").orElse(null), responseBytes, url));
            return new RawDocument(
                url,
                response.uri(),
                response.statusCode(),
                responseBody,
                response.headers().map(),
                Instant.now(),
                Duration.between(startedAt, Instant.now())
            );
        } catch (HttpConnectTimeoutException e) {
            throw new NetworkFetchException(NetworkFetchException.Kind.TIMEOUT, "connect timeout: " + e.getMessage(), e);
        } catch (HttpTimeoutException e) {
            throw new NetworkFetchException(NetworkFetchException.Kind.TIMEOUT, "request timeout: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new NetworkFetchException(classify(e), String.valueOf(e.getMessage()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NetworkFetchException(NetworkFetchException.Kind.INTERRUPTED, "interrupted", e);
        }
    }

    private HttpRequest buildRequest(URI uri, FetchProfile profile) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .header("User-Agent", userAgentFor(profile))
            .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
            .header("Accept-Language", "en-US,en;q=0.8");
        if (profile.stealthLevel() == StealthLevel.STEALTH) {
            builder
                .header("Upgrade-Insecure-Requests", "1")
                .header("Sec-Fetch-Dest", "document")
                .header("Sec-Fetch-Mode", "navigate")
                .header("Sec-Fetch-Site", "none")
                .header("Cache-Control", "max-age=0");
        }
        return builder.GET().build();
    }

    String userAgentFor(FetchProfile profile) {
        if (profile.userAgent() != null && !profile.userAgent().isBlank()) {
            return profile.userAgent().trim();
        }
        if (profile.stealthLevel() == StealthLevel.NONE) {
            return properties.getUserAgent();
        }
        return BROWSER_USER_AGENTS.get(ThreadLocalRandom.current().nextInt(BROWSER_USER_AGENTS.size()));
    }

    private HttpClient clientFor(String proxyAddress) {
        String key = proxyAddress == null || proxyAddress.isBlank() ? DIRECT : proxyAddress.trim();
        return clients.computeIfAbsent(key, this::newClient);
    }

    private HttpClient newClient(String key) {
        HttpClient.Builder builder = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1);
        if (!DIRECT.equals(key)) {
            builder.proxy(ProxySelector.of(proxyAddress(key)));
        }
        return builder.build();
    }

    static InetSocketAddress proxyAddress(String endpoint) {
        URI uri = UrlUtils.proxyUri(endpoint);
        if (uri == null) {
            throw new IllegalArgumentException("Invalid proxy endpoint: " + endpoint);
        }
        int port = uri.getPort() > 0 ? uri.getPort() : 8080;
        return InetSocketAddress.createUnresolved(uri.getHost(), port);
    }

    /**
     * Charset from the {@code Content-Type} header, else whatever Jsoup detects from a BOM or
     * {@code <meta charset>} in HTML bodies, else UTF-8.
     */
    static Charset charsetOf(String contentType, byte[] body, String url) {
        if (contentType != null && !contentType.isBlank()) {
            try {
                Charset declared = MediaType.parseMediaType(contentType).getCharset();
                if (declared != null) {
                    return declared;
                }
            } catch (IllegalArgumentException e) {
                log.debug("Ignoring unusable content type '{}' for {}: {}", contentType, url, e.getMessage());
            }
        }
        boolean html = contentType == null || contentType.toLowerCase(Locale.ROOT).contains("html");
        if (html && body.length > 0) {
            try {
                return Jsoup.parse(new ByteArrayInputStream(body), null, url).charset();
            } catch (IOException | IllegalArgumentException e) {
                log.debug("Charset detection failed for {}: {}", url, e.getMessage());
            }
        }
        return StandardCharsets.UTF_8;
    }

    private NetworkFetchException.Kind classify(IOException e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof UnknownHostException || current instanceof UnresolvedAddressException) {
                return NetworkFetchException.Kind.DNS_FAILURE;
            }
            if (current instanceof HttpTimeoutException) {
                return NetworkFetchException.Kind.TIMEOUT;
            }
            current = current.getCause();
        }
        if (e instanceof ConnectException) {
            return NetworkFetchException.Kind.REFUSED;
        }
        return NetworkFetchException.Kind.IO;
    }
}
