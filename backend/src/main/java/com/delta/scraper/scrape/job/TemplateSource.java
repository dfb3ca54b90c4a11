package com.delta.scraper.scrape.job;

import com.delta.scraper.scrape.model.Template;

import java.util.Optional;

/**
 * Supplies fully resolved templates by name. Loading and versioning live behind this interface.
 */
public interface TemplateSource {
    Optional<Template> find(String name);
}
