package com.delta.scraper.scrape.job;

import com.delta.scraper.scrape.model.Template;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryTemplateSource implements TemplateSource {
    private final Map<String, Template> templates = new ConcurrentHashMap<>();

    @Override
    public Optional<Template> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(templates.get(name.trim()));
    }

    /**
     * Registers or replaces a template. Jobs already submitted keep the instance they were bound to.
     */
    public Template register(Template template) {
        List<String> problems = TemplateValidator.validate(template);
        if (!problems.isEmpty()) {
            throw new InvalidJobException("Invalid template: " + String.join("; ", problems), problems);
        }
        templates.put(template.name().trim(), template);
        return template;
    }

    public List<Template> list() {
        List<Template> all = new ArrayList<>(templates.values());
        all.sort(Comparator.comparing(Template::name));
        return all;
    }
}
