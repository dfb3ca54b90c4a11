package com.delta.scraper.scrape.fetch;

import com.delta.scraper.scrape.model.FetchProfile;
import com.delta.scraper.scrape.model.RawDocument;

/**
 * Executes a single request. Implementations own transport and fingerprinting; retry, delay and
 * classification happen in {@link FetchPipeline}.
 */
public interface FetchCapability {
    /**
     * @param proxyAddress {@code host:port} or {@code http://host:port}; {@code null} for a direct request
     */
    RawDocument fetchRaw(String url, String proxyAddress, FetchProfile profile) throws NetworkFetchException;
}
