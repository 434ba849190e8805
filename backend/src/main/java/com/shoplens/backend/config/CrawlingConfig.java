package com.shoplens.backend.config;

import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "crawling")
@Data
public class CrawlingConfig {

    // Default configurations
    private double defaultDelay = 1.0;
    private int defaultMaxRetries = 3;
    private int defaultTimeout = 30;

    // How many priority fields the retriever asks the feedback loop for
    private int priorityFieldLimit = 10;

    private String selectorCatalog = "classpath:crawler-selectors.yml";

    // Default headers for HTTP requests
    private Map<String, String> defaultHeaders = Map.of(
            "User-Agent", "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
            "Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,image/webp,*/*;q=0.8",
            "Accept-Language", "ja,en-US;q=0.7,en;q=0.5"
    );
}
