package com.shoplens.backend.job;

import com.shoplens.backend.job.output.AnalysisOutput;
import com.shoplens.backend.job.output.StageOutput;
import com.shoplens.backend.model.enums.JobKind;
import com.shoplens.backend.model.enums.StageName;
import java.util.List;
import java.util.Optional;

/**
 * Authoritative state of every analysis job.
 * <p>
 * {@link #commitStage} is the only way progress advances and it accepts
 * only the immediate successor of the current stage. {@link #fail} and
 * {@link #complete} are terminal; calling either on a terminal job returns
 * the existing snapshot unchanged.
 */
public interface JobStore {

    String create(String sourceRef, JobKind kind);

    AnalysisJob get(String jobId);

    Optional<AnalysisJob> find(String jobId);

    /**
     * Snapshot of every job currently held, in no particular order.
     */
    List<AnalysisJob> list();

    AnalysisJob markRunning(String jobId);

    AnalysisJob commitStage(String jobId, StageName stage, StageOutput output, int percentage);

    AnalysisJob fail(String jobId, String error);

    AnalysisJob complete(String jobId, AnalysisOutput result);
}
