package com.delta.scraper.scrape.api;

import com.delta.scraper.config.ScraperProperties;
import com.delta.scraper.scrape.fetch.FetchPipeline;
import com.delta.scraper.scrape.model.ProxyPoolStats;
import com.delta.scraper.scrape.model.ProxyValidationResult;
import com.delta.scraper.scrape.proxy.ProxyPool;
import com.delta.scraper.scrape.util.UrlUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api/proxies")
public class ProxyController {
    private final ProxyPool proxyPool;
    private final FetchPipeline fetchPipeline;
    private final ScraperProperties properties;

    public ProxyController(ProxyPool proxyPool, FetchPipeline fetchPipeline, ScraperProperties properties) {
        this.proxyPool = proxyPool;
        this.fetchPipeline = fetchPipeline;
        this.properties = properties;
    }

    @GetMapping
    public ProxyPoolStats stats() {
        return proxyPool.stats();
    }

    @PostMapping
    public ProxyPoolStats add(@RequestBody ProxyApiRequest request) {
        if (request == null || request.endpoint() == null || request.endpoint().isBlank()) {
            throw new ResponseStatusException(BAD_REQUEST, "endpoint is required");
        }
        proxyPool.add(request.endpoint());
        return proxyPool.stats();
    }

    @DeleteMapping
    public ProxyPoolStats remove(@RequestParam("endpoint") String endpoint) {
        if (!proxyPool.remove(endpoint)) {
            throw new ResponseStatusException(NOT_FOUND, "Unknown proxy: " + endpoint);
        }
        return proxyPool.stats();
    }

    @PostMapping("/validate")
    public List<ProxyValidationResult> validate(@RequestBody(required = false) ProxyApiRequest request) {
        String testUrl = request == null || request.testUrl() == null || request.testUrl().isBlank()
            ? properties.getProxy().getValidationUrl()
            : request.testUrl().trim();
        if (!UrlUtils.isHttpUrl(testUrl)) {
            throw new ResponseStatusException(BAD_REQUEST, "testUrl must be an absolute http(s) url");
        }
        return fetchPipeline.validateProxies(testUrl);
    }

    @PostMapping("/reset")
    public ProxyPoolStats reset() {
        proxyPool.resetStatistics();
        return proxyPool.stats();
    }
}
