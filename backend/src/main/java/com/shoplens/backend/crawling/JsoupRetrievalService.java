package com.shoplens.backend.crawling;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shoplens.backend.config.CrawlingConfig;
import com.shoplens.backend.feedback.service.FeedbackService;
import com.shoplens.backend.model.enums.JobKind;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Default retrieval using JSoup and the selectors from crawler-selectors.yml.
 * Fields the feedback loop ranks as most reported get a second pass with
 * their fallback selectors.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class JsoupRetrievalService implements RetrievalService {

    private static final Pattern NUMBER = Pattern.compile("\\d[\\d,]*(?:\\.\\d+)?");
    private static final List<String> IGNORED_IMAGE_MARKERS = List.of("icon", "logo", "banner", "button");

    private final CrawlingConfig crawlingConfig;
    private final SelectorCatalogService selectorCatalogService;
    private final FeedbackService feedbackService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public HarvestedData retrieve(String sourceRef, JobKind kind) {
        log.info("Retrieving {} page: {}", kind.getKey(), sourceRef);
        Document doc = fetch(sourceRef);
        return extract(doc, sourceRef, kind);
    }

    /**
     * Extract all configured fields of a page that has already been fetched
     */
    public HarvestedData extract(Document doc, String sourceRef, JobKind kind) {
        PageSelectors page = selectorCatalogService.getSelectors(kind);

        for (String errorSelector : page.getErrorSelectors()) {
            if (!doc.select(errorSelector).isEmpty()) {
                throw new RetrievalException("Page reports an error or is unavailable: " + sourceRef);
            }
        }

        Set<String> priorityFields = loadPriorityFields();
        JsonNode product = findJsonLdProduct(doc);

        Map<String, Object> fields = new LinkedHashMap<>();
        for (FieldSelector selector : page.getFields()) {
            Object value = extractValue(doc, selector.getType(), selector.getSelectors());

            if (isAbsent(value) && product != null && selector.getJsonLdPath() != null) {
                value = fromJsonLd(product, selector);
            }

            if (isAbsent(value) && priorityFields.contains(selector.getField())
                    && !selector.getFallbackSelectors().isEmpty()) {
                value = extractValue(doc, selector.getType(), selector.getFallbackSelectors());
                if (!isAbsent(value)) {
                    log.info("Extracted priority field {} with fallback selectors", selector.getField());
                }
            }

            if (!isAbsent(value)) {
                fields.put(selector.getField(), value);
            }
        }

        List<Map<String, Object>> items = extractItems(doc, page);
        if (kind == JobKind.COLLECTION && !fields.containsKey("shop.product_count") && !items.isEmpty()) {
            fields.put("shop.product_count", items.size());
        }

        // A negative presence check alone does not count as harvesting the page
        boolean harvestedAnything = fields.values().stream().anyMatch(value -> !Boolean.FALSE.equals(value));
        if (!harvestedAnything && items.isEmpty()) {
            throw new RetrievalException("No fields could be harvested from " + sourceRef);
        }

        log.debug("Harvested {} fields and {} items from {}: {}", fields.size(), items.size(), sourceRef, fields.keySet());

        return HarvestedData.builder()
                .sourceRef(sourceRef)
                .kind(kind)
                .fields(fields)
                .items(items)
                .harvestedAt(LocalDateTime.now(clock))
                .build();
    }

    private Document fetch(String url) {
        // Fetch the page with simple retry/backoff
        int attempts = Math.max(1, crawlingConfig.getDefaultMaxRetries());
        for (int i = 0; i < attempts; i++) {
            try {
                return Jsoup.connect(url)
                        .userAgent(crawlingConfig.getDefaultHeaders().get("User-Agent"))
                        .timeout(crawlingConfig.getDefaultTimeout() * 1000)
                        .headers(crawlingConfig.getDefaultHeaders())
                        .get();
            } catch (IOException ex) {
                if (i == attempts - 1) {
                    log.error("Error fetching URL {}: {}", url, ex.getMessage());
                    throw new RetrievalException("Failed to fetch " + url + ": " + ex.getMessage(), ex);
                }
                log.debug("Fetch attempt {} for {} failed: {}", i + 1, url, ex.getMessage());
                try {
                    Thread.sleep((long) (crawlingConfig.getDefaultDelay() * 1000L * (i + 1)));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new RetrievalException("Interrupted while fetching " + url, e);
                }
            }
        }
        throw new RetrievalException("Failed to fetch " + url);
    }

    private Set<String> loadPriorityFields() {
        try {
            return new LinkedHashSet<>(feedbackService.priorityFields(crawlingConfig.getPriorityFieldLimit()));
        } catch (DataAccessException e) {
            log.warn("Failed to load priority fields, crawling without them: {}", e.getMessage());
            return Set.of();
        }
    }

    private Object extractValue(Document doc, FieldSelector.ExtractType type, List<String> selectors) {
        if (selectors == null || selectors.isEmpty()) {
            return null;
        }
        switch (type) {
            case NUMBER:
                return parseNumber(extractText(doc, selectors));
            case COUNT:
                int count = countMatches(doc, selectors);
                return count > 0 ? count : null;
            case EXISTS:
                for (String selector : selectors) {
                    if (!safeSelect(doc, selector).isEmpty()) {
                        return Boolean.TRUE;
                    }
                }
                return Boolean.FALSE;
            case TEXT:
            default:
                return extractText(doc, selectors);
        }
    }

    /**
     * Extract text using priority-based selectors
     */
    private String extractText(Element root, List<String> selectors) {
        for (String selector : selectors) {
            if ("title".equals(selector) && root instanceof Document) {
                String title = cleanTitle(((Document) root).title());
                if (!title.isEmpty()) return title;
                continue;
            }

            Elements elements = safeSelect(root, selector);
            if (elements.isEmpty()) continue;

            Element el = elements.first();
            if (el.hasAttr("content")) {
                String content = el.attr("content").trim();
                if (!content.isEmpty()) return content;
            }
            String text = el.text().trim();
            if (!text.isEmpty()) return text;
        }
        return null;
    }

    /**
     * Count distinct images (or elements, for non-image selectors) across
     * all selectors
     */
    private int countMatches(Document doc, List<String> selectors) {
        Set<String> seen = new LinkedHashSet<>();
        int plainElements = 0;
        for (String selector : selectors) {
            for (Element el : safeSelect(doc, selector)) {
                if (!"img".equals(el.tagName())) {
                    plainElements++;
                    continue;
                }
                String src = firstNonBlank(el.attr("src"), el.attr("data-src"), el.attr("data-original"));
                if (src == null) continue;
                String lower = src.toLowerCase(Locale.ROOT);
                if (IGNORED_IMAGE_MARKERS.stream().anyMatch(lower::contains)) continue;
                seen.add(src);
            }
        }
        return seen.size() + plainElements;
    }

    private List<Map<String, Object>> extractItems(Document doc, PageSelectors page) {
        List<Map<String, Object>> items = new ArrayList<>();
        if (page.getItemSelector() == null || page.getItemFields().isEmpty()) {
            return items;
        }
        for (Element itemElement : safeSelect(doc, page.getItemSelector())) {
            Map<String, Object> item = new LinkedHashMap<>();
            for (Map.Entry<String, List<String>> entry : page.getItemFields().entrySet()) {
                String text = extractText(itemElement, entry.getValue());
                if (text == null) continue;
                if (entry.getKey().contains("price")) {
                    BigDecimal price = parseNumber(text);
                    if (price != null) item.put(entry.getKey(), price);
                } else {
                    item.put(entry.getKey(), text);
                }
            }
            if (!item.isEmpty()) {
                items.add(item);
            }
        }
        return items;
    }

    private JsonNode findJsonLdProduct(Document doc) {
        for (Element script : doc.select("script[type=application/ld+json]")) {
            try {
                JsonNode product = findProductNode(objectMapper.readTree(script.data()));
                if (product != null) return product;
            } catch (IOException e) {
                log.debug("Skipping unparseable JSON-LD block: {}", e.getMessage());
            }
        }
        return null;
    }

    private JsonNode findProductNode(JsonNode node) {
        if (node == null) return null;
        if (node.isArray()) {
            for (JsonNode child : node) {
                JsonNode found = findProductNode(child);
                if (found != null) return found;
            }
            return null;
        }
        if (node.has("@graph")) {
            return findProductNode(node.get("@graph"));
        }
        JsonNode type = node.get("@type");
        if (type != null && type.asText("").equalsIgnoreCase("Product")) {
            return node;
        }
        return null;
    }

    private Object fromJsonLd(JsonNode product, FieldSelector selector) {
        JsonNode current = product;
        for (String part : selector.getJsonLdPath().split("\\.")) {
            if (current != null && current.isArray()) {
                current = current.size() > 0 ? current.get(0) : null;
            }
            current = current == null ? null : current.get(part);
        }
        if (current == null || current.isNull() || current.isContainerNode()) {
            return null;
        }
        String text = current.asText().trim();
        if (selector.getType() == FieldSelector.ExtractType.NUMBER) {
            return parseNumber(text);
        }
        return text.isEmpty() ? null : text;
    }

    private Elements safeSelect(Element root, String selector) {
        try {
            return root.select(selector);
        } catch (RuntimeException e) {
            log.debug("Invalid selector '{}': {}", selector, e.getMessage());
            return new Elements();
        }
    }

    static BigDecimal parseNumber(String text) {
        if (text == null) return null;
        Matcher matcher = NUMBER.matcher(text);
        if (!matcher.find()) return null;
        return new BigDecimal(matcher.group().replace(",", ""));
    }

    private static String cleanTitle(String title) {
        if (title == null) return "";
        String cleaned = title;
        int bar = indexOfAny(cleaned, '|', '｜');
        if (bar >= 0) {
            cleaned = cleaned.substring(0, bar);
        }
        return cleaned.replace("[Qoo10]", "").replace("Qoo10", "").trim();
    }

    private static int indexOfAny(String text, char first, char second) {
        int a = text.indexOf(first);
        int b = text.indexOf(second);
        if (a < 0) return b;
        if (b < 0) return a;
        return Math.min(a, b);
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) return value.trim();
        }
        return null;
    }

    private static boolean isAbsent(Object value) {
        return value == null || (value instanceof String && ((String) value).isBlank());
    }
}
