package com.shoplens.backend.batch;

import java.time.LocalDateTime;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BatchAnalysis {
    String id;
    String name;
    // Submission order
    List<BatchEntry> entries;
    LocalDateTime createdAt;

    public List<BatchEntry> getEntries() {
        return entries == null ? List.of() : List.copyOf(entries);
    }
}
