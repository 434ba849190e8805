package com.shoplens.backend.crawling;

import java.util.List;
import lombok.Data;

/**
 * How one harvested field is located on a page, loaded from
 * crawler-selectors.yml.
 */
@Data
public class FieldSelector {

    public enum ExtractType {
        TEXT,   // first non-blank match, content attribute preferred
        NUMBER, // first match parsed as a number
        COUNT,  // number of distinct matched images or elements
        EXISTS  // whether anything matched at all
    }

    private String field;
    private ExtractType type = ExtractType.TEXT;
    private List<String> selectors = List.of();
    // Extra selectors tried only for fields users report often
    private List<String> fallbackSelectors = List.of();
    // Dotted path into a JSON-LD Product block, e.g. offers.price
    private String jsonLdPath;
}
