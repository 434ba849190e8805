package com.shoplens.backend.crawling;

import com.shoplens.backend.model.enums.JobKind;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Fields harvested from one page. Keys are dotted field paths such as
 * {@code price.sale_price}; for a collection page {@code items} holds one
 * field map per listed sub-record.
 */
@Value
@Builder
public class HarvestedData {
    String sourceRef;
    JobKind kind;
    Map<String, Object> fields;
    List<Map<String, Object>> items;
    LocalDateTime harvestedAt;

    public Map<String, Object> getFields() {
        return fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public List<Map<String, Object>> getItems() {
        return items == null ? List.of() : List.copyOf(items);
    }

    public Object get(String field) {
        return fields == null ? null : fields.get(field);
    }

    /**
     * A field counts as present when it exists and is not blank. Boolean
     * false and numeric zero are values, not absences.
     */
    public boolean hasValue(String field) {
        Object value = get(field);
        if (value == null) return false;
        if (value instanceof CharSequence) {
            return !value.toString().trim().isEmpty();
        }
        if (value instanceof Collection) {
            return !((Collection<?>) value).isEmpty();
        }
        return true;
    }
}
