package com.shoplens.backend.job.output;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ChecklistItem {

    public enum Status { COMPLETED, PENDING }

    String id;
    String category;
    String title;
    Status status;
    // True when the status was derived from harvested fields without review
    boolean autoChecked;
    // Harvested field the automatic check reads, null for manual items
    String backingField;
    String recommendation;
}
