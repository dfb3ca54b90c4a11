package com.delta.scraper.config;

import com.delta.scraper.scrape.model.DefensePolicy;
import com.delta.scraper.scrape.model.ProxySelectionPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "scraper")
public class ScraperProperties {
    private static final String DEFAULT_USER_AGENT = "delta-scraper/0.1 (+contact)";

    private String userAgent;
    private int requestTimeoutSeconds = 30;
    private Jobs jobs = new Jobs();
    private Fetch fetch = new Fetch();
    private Proxy proxy = new Proxy();
    private Pagination pagination = new Pagination();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public Jobs getJobs() {
        return jobs;
    }

    public void setJobs(Jobs jobs) {
        this.jobs = jobs;
    }

    public Fetch getFetch() {
        return fetch;
    }

    public void setFetch(Fetch fetch) {
        this.fetch = fetch;
    }

    public Proxy getProxy() {
        return proxy;
    }

    public void setProxy(Proxy proxy) {
        this.proxy = proxy;
    }

    public Pagination getPagination() {
        return pagination;
    }

    public void setPagination(Pagination pagination) {
        this.pagination = pagination;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Jobs {
        private int maxConcurrentJobs = 3;
        private int maxConcurrentFetchesPerJob = 2;
        private int maxConsecutivePageFailures = 3;
        private int cancelGracePeriodMs = 5000;
        private int pauseCheckIntervalMs = 200;
        private int resultRetention = 100;
        private int finishedJobRetention = 100;

        public int getMaxConcurrentJobs() {
            return Math.max(1, maxConcurrentJobs);
        }

        public void setMaxConcurrentJobs(int maxConcurrentJobs) {
            this.maxConcurrentJobs = Math.max(1, maxConcurrentJobs);
        }

        public int getMaxConcurrentFetchesPerJob() {
            return Math.max(1, maxConcurrentFetchesPerJob);
        }

        public void setMaxConcurrentFetchesPerJob(int maxConcurrentFetchesPerJob) {
            this.maxConcurrentFetchesPerJob = Math.max(1, maxConcurrentFetchesPerJob);
        }

        public int getMaxConsecutivePageFailures() {
            return Math.max(1, maxConsecutivePageFailures);
        }

        public void setMaxConsecutivePageFailures(int maxConsecutivePageFailures) {
            this.maxConsecutivePageFailures = Math.max(1, maxConsecutivePageFailures);
        }

        public int getCancelGracePeriodMs() {
            return Math.max(1, cancelGracePeriodMs);
        }

        public void setCancelGracePeriodMs(int cancelGracePeriodMs) {
            this.cancelGracePeriodMs = Math.max(1, cancelGracePeriodMs);
        }

        public int getPauseCheckIntervalMs() {
            return Math.max(10, pauseCheckIntervalMs);
        }

        public void setPauseCheckIntervalMs(int pauseCheckIntervalMs) {
            this.pauseCheckIntervalMs = Math.max(10, pauseCheckIntervalMs);
        }

        public int getResultRetention() {
            return Math.max(1, resultRetention);
        }

        public void setResultRetention(int resultRetention) {
            this.resultRetention = Math.max(1, resultRetention);
        }

        public int getFinishedJobRetention() {
            return Math.max(1, finishedJobRetention);
        }

        public void setFinishedJobRetention(int finishedJobRetention) {
            this.finishedJobRetention = Math.max(1, finishedJobRetention);
        }
    }

    public static class Fetch {
        private int maxRetries = 3;
        private int retryBaseDelayMs = 500;
        private int retryMaxDelayMs = 10_000;
        private int maxDefenseRetries = 2;
        private int defaultMinDelayMs = 1000;
        private int defaultMaxDelayMs = 3000;
        private DefensePolicy onDefenseDetected = DefensePolicy.SKIP;
        private List<String> defenseMarkers = new ArrayList<>(List.of(
            "recaptcha",
            "g-recaptcha",
            "h-captcha",
            "captcha-container",
            "challenge-form",
            "cf-challenge",
            "captcha-image",
            "cf-browser-verification"
        ));

        public int getMaxRetries() {
            return Math.max(0, maxRetries);
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = Math.max(0, maxRetries);
        }

        public int getRetryBaseDelayMs() {
            return Math.max(0, retryBaseDelayMs);
        }

        public void setRetryBaseDelayMs(int retryBaseDelayMs) {
            this.retryBaseDelayMs = Math.max(0, retryBaseDelayMs);
        }

        public int getRetryMaxDelayMs() {
            return Math.max(0, retryMaxDelayMs);
        }

        public void setRetryMaxDelayMs(int retryMaxDelayMs) {
            this.retryMaxDelayMs = Math.max(0, retryMaxDelayMs);
        }

        public int getMaxDefenseRetries() {
            return Math.max(0, maxDefenseRetries);
        }

        public void setMaxDefenseRetries(int maxDefenseRetries) {
            this.maxDefenseRetries = Math.max(0, maxDefenseRetries);
        }

        public int getDefaultMinDelayMs() {
            return Math.max(0, defaultMinDelayMs);
        }

        public void setDefaultMinDelayMs(int defaultMinDelayMs) {
            this.defaultMinDelayMs = Math.max(0, defaultMinDelayMs);
        }

        public int getDefaultMaxDelayMs() {
            return Math.max(getDefaultMinDelayMs(), defaultMaxDelayMs);
        }

        public void setDefaultMaxDelayMs(int defaultMaxDelayMs) {
            this.defaultMaxDelayMs = Math.max(0, defaultMaxDelayMs);
        }

        public DefensePolicy getOnDefenseDetected() {
            return onDefenseDetected == null ? DefensePolicy.SKIP : onDefenseDetected;
        }

        public void setOnDefenseDetected(DefensePolicy onDefenseDetected) {
            this.onDefenseDetected = onDefenseDetected;
        }

        public List<String> getDefenseMarkers() {
            return defenseMarkers;
        }

        public void setDefenseMarkers(List<String> defenseMarkers) {
            this.defenseMarkers = defenseMarkers == null ? new ArrayList<>() : defenseMarkers;
        }
    }

    public static class Proxy {
        private List<String> endpoints = new ArrayList<>();
        private ProxySelectionPolicy selectionPolicy = ProxySelectionPolicy.PERFORMANCE;
        private int failureThreshold = 5;
        private int cooldownSeconds = 60;
        private int blacklistAfterCooldowns = 3;
        private int blacklistSeconds = 300;
        private int domainReuseIntervalMs = 2000;
        private int acquireTimeoutMs = 2000;
        private int maxLeasesPerProxy = 2;
        private int defaultLatencyMs = 1000;
        private double recencyWeight = 0.3;
        private String validationUrl = "http://httpbin.org/ip";

        public List<String> getEndpoints() {
            return endpoints;
        }

        public void setEndpoints(List<String> endpoints) {
            this.endpoints = endpoints == null ? new ArrayList<>() : endpoints;
        }

        public String getValidationUrl() {
            return validationUrl == null || validationUrl.isBlank() ? "http://httpbin.org/ip" : validationUrl.trim();
        }

        public void setValidationUrl(String validationUrl) {
            this.validationUrl = validationUrl;
        }

        public ProxySelectionPolicy getSelectionPolicy() {
            return selectionPolicy == null ? ProxySelectionPolicy.PERFORMANCE : selectionPolicy;
        }

        public void setSelectionPolicy(ProxySelectionPolicy selectionPolicy) {
            this.selectionPolicy = selectionPolicy;
        }

        public int getFailureThreshold() {
            return Math.max(1, failureThreshold);
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = Math.max(1, failureThreshold);
        }

        public int getCooldownSeconds() {
            return Math.max(1, cooldownSeconds);
        }

        public void setCooldownSeconds(int cooldownSeconds) {
            this.cooldownSeconds = Math.max(1, cooldownSeconds);
        }

        public int getBlacklistAfterCooldowns() {
            return Math.max(1, blacklistAfterCooldowns);
        }

        public void setBlacklistAfterCooldowns(int blacklistAfterCooldowns) {
            this.blacklistAfterCooldowns = Math.max(1, blacklistAfterCooldowns);
        }

        public int getBlacklistSeconds() {
            return Math.max(getCooldownSeconds(), blacklistSeconds);
        }

        public void setBlacklistSeconds(int blacklistSeconds) {
            this.blacklistSeconds = Math.max(1, blacklistSeconds);
        }

        public int getDomainReuseIntervalMs() {
            return Math.max(0, domainReuseIntervalMs);
        }

        public void setDomainReuseIntervalMs(int domainReuseIntervalMs) {
            this.domainReuseIntervalMs = Math.max(0, domainReuseIntervalMs);
        }

        public int getAcquireTimeoutMs() {
            return Math.max(0, acquireTimeoutMs);
        }

        public void setAcquireTimeoutMs(int acquireTimeoutMs) {
            this.acquireTimeoutMs = Math.max(0, acquireTimeoutMs);
        }

        public int getMaxLeasesPerProxy() {
            return Math.max(1, maxLeasesPerProxy);
        }

        public void setMaxLeasesPerProxy(int maxLeasesPerProxy) {
            this.maxLeasesPerProxy = Math.max(1, maxLeasesPerProxy);
        }

        public int getDefaultLatencyMs() {
            return Math.max(1, defaultLatencyMs);
        }

        public void setDefaultLatencyMs(int defaultLatencyMs) {
            this.defaultLatencyMs = Math.max(1, defaultLatencyMs);
        }

        public double getRecencyWeight() {
            return Math.max(0.01, Math.min(1.0, recencyWeight));
        }

        public void setRecencyWeight(double recencyWeight) {
            this.recencyWeight = recencyWeight;
        }
    }

    public static class Pagination {
        private int defaultMaxPages = 10;
        private int openEndedPageCap = 500;
        private int duplicateWindowSize = 50;
        private double similarityThreshold = 0.9;

        public int getDefaultMaxPages() {
            return Math.max(1, defaultMaxPages);
        }

        public void setDefaultMaxPages(int defaultMaxPages) {
            this.defaultMaxPages = Math.max(1, defaultMaxPages);
        }

        public int getOpenEndedPageCap() {
            return Math.max(1, openEndedPageCap);
        }

        public void setOpenEndedPageCap(int openEndedPageCap) {
            this.openEndedPageCap = Math.max(1, openEndedPageCap);
        }

        public int getDuplicateWindowSize() {
            return Math.max(1, duplicateWindowSize);
        }

        public void setDuplicateWindowSize(int duplicateWindowSize) {
            this.duplicateWindowSize = Math.max(1, duplicateWindowSize);
        }

        public double getSimilarityThreshold() {
            return Math.max(0.0, Math.min(1.0, similarityThreshold));
        }

        public void setSimilarityThreshold(double similarityThreshold) {
            this.similarityThreshold = similarityThreshold;
        }
    }
}
