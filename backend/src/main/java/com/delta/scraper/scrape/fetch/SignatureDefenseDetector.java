package com.delta.scraper.scrape.fetch;

import com.delta.scraper.config.ScraperProperties;
import com.delta.scraper.scrape.model.RawDocument;
import com.delta.scraper.scrape.util.UrlUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Signature-based defense check: known challenge markers in the body, rate limiting,
 * Cloudflare/Sucuri block pages, and redirects that land on a challenge or captcha path.
 */
@Component
public class SignatureDefenseDetector implements DefenseDetector {
    private final List<String> markers;

    @Autowired
    public SignatureDefenseDetector(ScraperProperties properties) {
        this(properties.getFetch().getDefenseMarkers());
    }

    public SignatureDefenseDetector(List<String> markers) {
        List<String> normalized = new ArrayList<>();
        if (markers != null) {
            for (String marker : markers) {
                if (marker != null && !marker.isBlank()) {
                    normalized.add(marker.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        this.markers = List.copyOf(normalized);
    }

    @Override
    public boolean isDefenseResponse(RawDocument document) {
        if (document == null) {
            return false;
        }
        int status = document.statusCode();
        if (status == 429) {
            return true;
        }
        String mitigated = document.header("cf-mitigated");
        if (mitigated != null && mitigated.toLowerCase(Locale.ROOT).contains("challenge")) {
            return true;
        }
        if ((status == 403 || status == 503) && hasBlockerSignature(document)) {
            return true;
        }
        if (redirectedToChallenge(document)) {
            return true;
        }
        String body = document.body().toLowerCase(Locale.ROOT);
        for (String marker : markers) {
            if (body.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    // only a redirect counts; a page whose own path mentions challenges is ordinary content
    private static boolean redirectedToChallenge(RawDocument document) {
        URI finalUri = document.finalUri();
        if (finalUri == null || finalUri.toString().equals(document.requestedUrl())) {
            return false;
        }
        URI requested = UrlUtils.safeUri(document.requestedUrl());
        if (requested != null
            && Objects.equals(requested.getRawPath(), finalUri.getRawPath())
            && Objects.equals(requested.getRawQuery(), finalUri.getRawQuery())) {
            return false;
        }
        String target = ((finalUri.getRawPath() == null ? "" : finalUri.getRawPath())
            + "?" + (finalUri.getRawQuery() == null ? "" : finalUri.getRawQuery())).toLowerCase(Locale.ROOT);
        return target.contains("challenge") || target.contains("captcha");
    }

    private boolean hasBlockerSignature(RawDocument document) {
        if (document.header("cf-ray") != null || document.header("x-sucuri-id") != null) {
            return true;
        }
        String server = document.header("server");
        if (server == null) {
            return false;
        }
        String lower = server.toLowerCase(Locale.ROOT);
        return lower.contains("cloudflare") || lower.contains("sucuri");
    }
}
