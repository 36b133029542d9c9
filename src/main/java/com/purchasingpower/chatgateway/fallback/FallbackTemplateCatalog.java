package com.purchasingpower.chatgateway.fallback;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Versioned, read-only table of fallback templates, loaded once at startup.
 *
 * <p>Construction fails unless every {@link ResponseFamily} has at least one
 * {@linkplain FallbackTemplate#isGeneric() generic} template, which is what lets
 * the generator promise a non-empty reply for any context.
 */
@Slf4j
public final class FallbackTemplateCatalog {

    private final String version;
    private final Map<ResponseFamily, List<FallbackTemplate>> byFamily;

    public FallbackTemplateCatalog(String version, List<FallbackTemplate> templates) {
        this.version = version;
        EnumMap<ResponseFamily, List<FallbackTemplate>> grouped = new EnumMap<>(ResponseFamily.class);
        for (FallbackTemplate template : templates) {
            grouped.computeIfAbsent(template.responseType(), f -> new ArrayList<>()).add(template);
        }
        for (ResponseFamily family : ResponseFamily.values()) {
            List<FallbackTemplate> members = grouped.getOrDefault(family, List.of());
            if (members.stream().noneMatch(FallbackTemplate::isGeneric)) {
                throw new IllegalStateException("Fallback family " + family + " has no generic template");
            }
            grouped.put(family, List.copyOf(members));
        }
        this.byFamily = Collections.unmodifiableMap(grouped);
    }

    public static FallbackTemplateCatalog load(InputStream in, ObjectMapper objectMapper) {
        try {
            CatalogDefinition definition = objectMapper.readValue(in, CatalogDefinition.class);
            FallbackTemplateCatalog catalog = new FallbackTemplateCatalog(definition.getVersion(), definition.getTemplates());
            log.info("Loaded fallback templates v{}: {} templates across {} families",
                    catalog.version, definition.getTemplates().size(), catalog.byFamily.size());
            return catalog;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read fallback template table", e);
        }
    }

    public String getVersion() {
        return version;
    }

    public List<FallbackTemplate> templatesFor(ResponseFamily family) {
        return byFamily.get(family);
    }

    @Data
    static class CatalogDefinition {
        private String version;
        private List<FallbackTemplate> templates = new ArrayList<>();
    }
}
