package com.shoplens.backend.crawling;

import com.shoplens.backend.config.CrawlingConfig;
import com.shoplens.backend.model.enums.JobKind;
import jakarta.annotation.PostConstruct;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import org.yaml.snakeyaml.Yaml;

/**
 * Service to load page selector configurations from YAML
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SelectorCatalogService {

    private final ResourceLoader resourceLoader;
    private final CrawlingConfig crawlingConfig;

    private final Map<JobKind, PageSelectors> catalog = new EnumMap<>(JobKind.class);

    @PostConstruct
    public void loadCatalog() {
        Resource resource = resourceLoader.getResource(crawlingConfig.getSelectorCatalog());
        try (InputStream inputStream = resource.getInputStream()) {
            Yaml yaml = new Yaml();
            Map<String, Object> data = yaml.load(inputStream);

            @SuppressWarnings("unchecked")
            Map<String, Object> pages = (Map<String, Object>) data.get("pages");

            catalog.clear();
            for (Map.Entry<String, Object> entry : pages.entrySet()) {
                JobKind kind = JobKind.fromName(entry.getKey());
                if (kind == null) {
                    log.warn("Unknown page kind in selector catalog: {}", entry.getKey());
                    continue;
                }
                @SuppressWarnings("unchecked")
                Map<String, Object> pageData = (Map<String, Object>) entry.getValue();
                catalog.put(kind, createSelectorsFromMap(kind, pageData));
                log.info("Loaded {} field selectors for {} pages", catalog.get(kind).getFields().size(), kind.getKey());
            }

        } catch (Exception e) {
            log.error("Error loading selector catalog from {}", crawlingConfig.getSelectorCatalog(), e);
            throw new IllegalStateException("Failed to load selector catalog", e);
        }
    }

    public PageSelectors getSelectors(JobKind kind) {
        PageSelectors selectors = catalog.get(kind);
        if (selectors == null) {
            throw new RetrievalException("No selectors configured for " + kind.getKey() + " pages");
        }
        return selectors;
    }

    public boolean hasSelectors(JobKind kind) {
        return catalog.containsKey(kind);
    }

    @SuppressWarnings("unchecked")
    private PageSelectors createSelectorsFromMap(JobKind kind, Map<String, Object> pageData) {
        PageSelectors page = new PageSelectors();
        page.setKind(kind);
        page.setErrorSelectors(stringList(pageData.get("errorSelectors")));
        page.setItemSelector((String) pageData.get("itemSelector"));

        Map<String, Object> fields = (Map<String, Object>) pageData.getOrDefault("fields", Map.of());
        List<FieldSelector> fieldSelectors = new ArrayList<>();
        for (Map.Entry<String, Object> entry : fields.entrySet()) {
            Map<String, Object> fieldData = (Map<String, Object>) entry.getValue();

            FieldSelector selector = new FieldSelector();
            selector.setField(entry.getKey());
            Object type = fieldData.get("type");
            if (type != null) {
                selector.setType(FieldSelector.ExtractType.valueOf(type.toString().toUpperCase(Locale.ROOT)));
            }
            selector.setSelectors(stringList(fieldData.get("selectors")));
            selector.setFallbackSelectors(stringList(fieldData.get("fallbackSelectors")));
            selector.setJsonLdPath((String) fieldData.get("jsonLd"));
            fieldSelectors.add(selector);
        }
        page.setFields(fieldSelectors);

        Map<String, Object> itemFields = (Map<String, Object>) pageData.getOrDefault("itemFields", Map.of());
        Map<String, List<String>> itemSelectors = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : itemFields.entrySet()) {
            itemSelectors.put(entry.getKey(), stringList(entry.getValue()));
        }
        page.setItemFields(itemSelectors);

        return page;
    }

    @SuppressWarnings("unchecked")
    private static List<String> stringList(Object value) {
        if (value == null) return new ArrayList<>();
        return new ArrayList<>((List<String>) value);
    }
}
