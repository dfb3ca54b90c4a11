package com.delta.scraper.scrape.pagination;

import com.delta.scraper.config.ScraperProperties;
import com.delta.scraper.scrape.extract.DocumentQuery;
import com.delta.scraper.scrape.extract.QueryableDocument;
import com.delta.scraper.scrape.model.ExtractionKind;
import com.delta.scraper.scrape.model.PageResult;
import com.delta.scraper.scrape.model.PaginationSpec;
import com.delta.scraper.scrape.model.PaginationStrategy;
import com.delta.scraper.scrape.model.Template;
import com.delta.scraper.scrape.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class PaginationController {
    private static final Logger log = LoggerFactory.getLogger(PaginationController.class);
    private static final String PAGE_PLACEHOLDER = "{page}";

    private final DocumentQuery documentQuery;
    private final ScraperProperties.Pagination settings;

    public PaginationController(DocumentQuery documentQuery, ScraperProperties properties) {
        this.documentQuery = documentQuery;
        this.settings = properties.getPagination();
    }

    public Optional<String> nextUrl(PageResult page, Template template, int pagesSoFar) {
        return nextUrl(page, template, pagesSoFar, null);
    }

    /**
     * Decides where the chain goes after {@code page}. Stops at the page limit, when the page brought no
     * records the window has not already seen, or when no next location can be derived.
     *
     * @param window duplicate-detection window for this chain; {@code null} skips the check
     */
    public Optional<String> nextUrl(PageResult page, Template template, int pagesSoFar, RecentRecordWindow window) {
        PaginationSpec spec = template.pagination();
        if (pagesSoFar >= maxPages(template)) {
            return Optional.empty();
        }
        if (window != null && stopOnNoNewRecords(spec)) {
            int fresh = window.admit(page.records());
            if (fresh == 0) {
                log.debug("No new records on {}; stopping pagination", page.url());
                return Optional.empty();
            }
        }
        return switch (spec.effectiveStrategy()) {
            case NEXT_LINK -> followNextLink(page, spec);
            case PAGE_PARAMETER -> nextPageParameter(spec, pagesSoFar);
            case NONE -> Optional.empty();
        };
    }

    public int maxPages(Template template) {
        PaginationSpec spec = template.pagination();
        if (spec.effectiveStrategy() == PaginationStrategy.NONE) {
            return 1;
        }
        if (spec.maxPages() == null) {
            return settings.getDefaultMaxPages();
        }
        if (spec.isOpenEnded()) {
            return settings.getOpenEndedPageCap();
        }
        return spec.maxPages();
    }

    /**
     * Page count used for progress percentages, or {@code null} when pagination is open-ended.
     */
    public Integer estimatedTotalPages(Template template) {
        if (template.pagination().isOpenEnded()) {
            return null;
        }
        return maxPages(template);
    }

    public RecentRecordWindow newWindow(Template template) {
        PaginationSpec spec = template.pagination();
        int size = spec.duplicateWindowSize() == null ? settings.getDuplicateWindowSize() : spec.duplicateWindowSize();
        double threshold = spec.similarityThreshold() == null
            ? settings.getSimilarityThreshold()
            : Math.max(0.0, Math.min(1.0, spec.similarityThreshold()));
        return new RecentRecordWindow(size, threshold);
    }

    private boolean stopOnNoNewRecords(PaginationSpec spec) {
        return spec.stopOnNoNewRecords() == null || spec.stopOnNoNewRecords();
    }

    private Optional<String> followNextLink(PageResult page, PaginationSpec spec) {
        if (page.document() == null || spec.nextSelector() == null || spec.nextSelector().isBlank()) {
            return Optional.empty();
        }
        QueryableDocument document = documentQuery.open(page.document());
        for (String href : document.select(spec.nextSelector(), ExtractionKind.ATTRIBUTE, "href")) {
            String resolved = UrlUtils.resolve(document.baseUrl(), href);
            if (resolved != null && !resolved.equals(page.url())) {
                return Optional.of(resolved);
            }
        }
        return Optional.empty();
    }

    private Optional<String> nextPageParameter(PaginationSpec spec, int pagesSoFar) {
        String template = spec.urlTemplate();
        if (template == null || !template.contains(PAGE_PLACEHOLDER)) {
            return Optional.empty();
        }
        int startPage = spec.startPage() == null ? 1 : spec.startPage();
        String next = template.replace(PAGE_PLACEHOLDER, Integer.toString(startPage + pagesSoFar));
        return UrlUtils.isHttpUrl(next) ? Optional.of(next) : Optional.empty();
    }
}
