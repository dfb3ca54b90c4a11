package com.delta.scraper.scrape.extract;

import com.delta.scraper.scrape.model.ExtractionKind;
import com.delta.scraper.scrape.model.RawDocument;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jsoup.select.Selector;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * CSS selector queries backed by Jsoup. Selectors may end in {@code ::text}, {@code ::html} or
 * {@code ::attr(name)}, which override the field's extraction kind.
 */
@Component
public class JsoupDocumentQuery implements DocumentQuery {

    @Override
    public QueryableDocument open(RawDocument document) {
        String baseUrl = document.finalUrlOrRequested();
        Document parsed = Jsoup.parse(document.body(), baseUrl == null ? "" : baseUrl);
        return new JsoupRegion(parsed, baseUrl);
    }

    static ParsedSelector parse(String selector, ExtractionKind kind, String attribute) {
        String css = selector.trim();
        ExtractionKind effectiveKind = kind == null ? ExtractionKind.TEXT : kind;
        String effectiveAttribute = attribute;
        int idx = css.lastIndexOf("::");
        if (idx >= 0) {
            String suffix = css.substring(idx + 2).trim();
            String lower = suffix.toLowerCase(Locale.ROOT);
            if (lower.equals("text")) {
                effectiveKind = collectionAware(effectiveKind, ExtractionKind.TEXT);
                effectiveAttribute = null;
                css = css.substring(0, idx).trim();
            } else if (lower.equals("html")) {
                effectiveKind = collectionAware(effectiveKind, ExtractionKind.HTML);
                effectiveAttribute = null;
                css = css.substring(0, idx).trim();
            } else if (lower.startsWith("attr(") && lower.endsWith(")")) {
                effectiveKind = collectionAware(effectiveKind, ExtractionKind.ATTRIBUTE);
                effectiveAttribute = suffix.substring(5, suffix.length() - 1).trim();
                css = css.substring(0, idx).trim();
            }
        }
        return new ParsedSelector(css, effectiveKind, effectiveAttribute);
    }

    private static ExtractionKind collectionAware(ExtractionKind declared, ExtractionKind fromSuffix) {
        return declared == ExtractionKind.COLLECTION ? ExtractionKind.COLLECTION : fromSuffix;
    }

    record ParsedSelector(String css, ExtractionKind kind, String attribute) {
    }

    private static final class JsoupRegion implements QueryableDocument {
        private final Element root;
        private final String baseUrl;

        private JsoupRegion(Element root, String baseUrl) {
            this.root = root;
            this.baseUrl = baseUrl;
        }

        @Override
        public List<String> select(String selector, ExtractionKind kind, String attribute) {
            if (selector == null || selector.isBlank()) {
                return List.of();
            }
            ParsedSelector parsed = parse(selector, kind, attribute);
            List<String> values = new ArrayList<>();
            for (Element element : elements(parsed.css())) {
                String value = valueOf(element, parsed);
                if (value != null) {
                    values.add(value);
                }
            }
            return values;
        }

        @Override
        public List<QueryableDocument> scope(String selector) {
            List<QueryableDocument> regions = new ArrayList<>();
            for (Element element : elements(selector.trim())) {
                regions.add(new JsoupRegion(element, baseUrl));
            }
            return regions;
        }

        @Override
        public String baseUrl() {
            return baseUrl;
        }

        private Elements elements(String css) {
            if (css.isEmpty()) {
                return new Elements(root);
            }
            try {
                return root.select(css);
            } catch (Selector.SelectorParseException | IllegalArgumentException e) {
                throw new InvalidSelectorException(css, e);
            }
        }

        private String valueOf(Element element, ParsedSelector parsed) {
            String attribute = parsed.attribute();
            boolean wantsAttribute = parsed.kind() == ExtractionKind.ATTRIBUTE
                || (parsed.kind() == ExtractionKind.COLLECTION && attribute != null && !attribute.isBlank());
            if (wantsAttribute) {
                if (attribute == null || attribute.isBlank() || !element.hasAttr(attribute)) {
                    return null;
                }
                return element.attr(attribute);
            }
            if (parsed.kind() == ExtractionKind.HTML) {
                return element.html();
            }
            return element.text();
        }
    }
}
