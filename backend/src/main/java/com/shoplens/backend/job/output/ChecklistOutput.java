package com.shoplens.backend.job.output;

import com.shoplens.backend.model.enums.StageName;
import java.util.List;
import lombok.Value;

@Value
public class ChecklistOutput implements StageOutput {
    int completionRate;
    List<ChecklistItem> items;

    @Override
    public StageName getStage() {
        return StageName.EVALUATING_CHECKLIST;
    }

    public List<ChecklistItem> getItems() {
        return items == null ? List.of() : List.copyOf(items);
    }
}
