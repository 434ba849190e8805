package com.shoplens.backend.crawling;

import com.shoplens.backend.model.enums.JobKind;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;

/**
 * Selector configuration for one kind of page
 */
@Data
public class PageSelectors {

    private JobKind kind;
    private List<FieldSelector> fields = new ArrayList<>();

    // Selectors that identify an error or not-found page
    private List<String> errorSelectors = new ArrayList<>();

    // Collection pages only: one element per listed sub-record
    private String itemSelector;
    private Map<String, List<String>> itemFields = new LinkedHashMap<>();
}
