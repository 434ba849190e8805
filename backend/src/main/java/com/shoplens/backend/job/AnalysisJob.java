package com.shoplens.backend.job;

import com.shoplens.backend.job.output.AnalysisOutput;
import com.shoplens.backend.job.output.StageOutput;
import com.shoplens.backend.model.enums.JobKind;
import com.shoplens.backend.model.enums.JobStatus;
import com.shoplens.backend.model.enums.StageName;
import com.shoplens.backend.validation.ValidationReport;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable snapshot of an analysis job. The job store replaces the whole
 * snapshot on every write, so a reader always sees one committed state.
 */
@Value
@Builder(toBuilder = true)
public class AnalysisJob {
    String id;
    String sourceRef;
    JobKind kind;
    JobStatus status;
    JobProgress progress;
    // Ordered stages this job walks through, QUEUED first and COMPLETED last
    List<StageName> stagePlan;
    Map<StageName, StageOutput> stageOutputs;
    AnalysisOutput result;
    ValidationReport validation;
    String error;
    LocalDateTime createdAt;
    LocalDateTime updatedAt;

    public Map<StageName, StageOutput> getStageOutputs() {
        return stageOutputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(stageOutputs));
    }

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    public StageName getCurrentStage() {
        return progress.getStage();
    }

    /**
     * The stage that may be committed next, or null once the plan is
     * exhausted.
     */
    public StageName nextStage() {
        int index = stagePlan.indexOf(progress.getStage());
        if (index < 0 || index + 1 >= stagePlan.size()) {
            return null;
        }
        return stagePlan.get(index + 1);
    }

    public <T extends StageOutput> Optional<T> getOutput(StageName stage, Class<T> type) {
        StageOutput output = stageOutputs == null ? null : stageOutputs.get(stage);
        if (type.isInstance(output)) {
            return Optional.of(type.cast(output));
        }
        return Optional.empty();
    }
}
