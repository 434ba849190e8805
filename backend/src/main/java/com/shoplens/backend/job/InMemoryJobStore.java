package com.shoplens.backend.job;

import com.shoplens.backend.job.output.AnalysisOutput;
import com.shoplens.backend.job.output.StageOutput;
import com.shoplens.backend.job.output.ValidationOutput;
import com.shoplens.backend.model.enums.JobKind;
import com.shoplens.backend.model.enums.JobStatus;
import com.shoplens.backend.model.enums.StageName;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Job store kept in memory for the lifetime of the process. Every write is
 * an atomic per-key replace of an immutable {@link AnalysisJob}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class InMemoryJobStore implements JobStore {

    private final StagePlanner stagePlanner;
    private final Clock clock;

    private final Map<String, AnalysisJob> jobs = new ConcurrentHashMap<>();

    @Override
    public String create(String sourceRef, JobKind kind) {
        String jobId = UUID.randomUUID().toString();
        LocalDateTime now = LocalDateTime.now(clock);

        AnalysisJob job = AnalysisJob.builder()
                .id(jobId)
                .sourceRef(sourceRef)
                .kind(kind)
                .status(JobStatus.QUEUED)
                .progress(new JobProgress(StageName.QUEUED, 0))
                .stagePlan(stagePlanner.planFor(kind))
                .stageOutputs(new LinkedHashMap<>())
                .createdAt(now)
                .updatedAt(now)
                .build();
        jobs.put(jobId, job);

        log.info("Created analysis job {} for {} ({})", jobId, sourceRef, kind.getKey());
        return jobId;
    }

    @Override
    public AnalysisJob get(String jobId) {
        return find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    @Override
    public Optional<AnalysisJob> find(String jobId) {
        if (jobId == null) return Optional.empty();
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public List<AnalysisJob> list() {
        return List.copyOf(jobs.values());
    }

    @Override
    public AnalysisJob markRunning(String jobId) {
        return update(jobId, job -> {
            if (job.getStatus() != JobStatus.QUEUED) {
                return job;
            }
            return job.toBuilder()
                    .status(JobStatus.RUNNING)
                    .updatedAt(LocalDateTime.now(clock))
                    .build();
        });
    }

    @Override
    public AnalysisJob commitStage(String jobId, StageName stage, StageOutput output, int percentage) {
        if (output == null || output.getStage() != stage) {
            throw new IllegalArgumentException("Output for stage " + stage.getKey() + " has the wrong shape");
        }
        if (percentage < 0 || percentage > 100) {
            throw new IllegalArgumentException("Progress percentage out of range: " + percentage);
        }

        return update(jobId, job -> {
            StageName current = job.getCurrentStage();
            if (job.isTerminal()) {
                throw new StaleStageException(jobId, stage, current, "job is " + job.getStatus().toJson());
            }
            if (stage == StageName.COMPLETED || stage != job.nextStage()) {
                throw new StaleStageException(jobId, stage, current, "not the next stage");
            }
            if (percentage < job.getProgress().getPercentage()) {
                throw new StaleStageException(jobId, stage, current, "progress would regress");
            }

            Map<StageName, StageOutput> outputs = new LinkedHashMap<>(job.getStageOutputs());
            outputs.put(stage, output);

            AnalysisJob.AnalysisJobBuilder next = job.toBuilder()
                    .status(JobStatus.RUNNING)
                    .progress(new JobProgress(stage, percentage))
                    .stageOutputs(outputs)
                    .updatedAt(LocalDateTime.now(clock));
            if (output instanceof ValidationOutput) {
                next.validation(((ValidationOutput) output).getReport());
            }
            return next.build();
        });
    }

    @Override
    public AnalysisJob fail(String jobId, String error) {
        return update(jobId, job -> {
            if (job.isTerminal()) {
                log.debug("Ignoring fail on terminal job {} ({})", jobId, job.getStatus().toJson());
                return job;
            }
            return job.toBuilder()
                    .status(JobStatus.FAILED)
                    .error(error == null || error.isBlank() ? "unknown error" : error)
                    .updatedAt(LocalDateTime.now(clock))
                    .build();
        });
    }

    @Override
    public AnalysisJob complete(String jobId, AnalysisOutput result) {
        return update(jobId, job -> {
            if (job.isTerminal()) {
                log.debug("Ignoring complete on terminal job {} ({})", jobId, job.getStatus().toJson());
                return job;
            }
            if (job.nextStage() != StageName.COMPLETED) {
                throw new StaleStageException(jobId, StageName.COMPLETED, job.getCurrentStage(), "stages still pending");
            }
            return job.toBuilder()
                    .status(JobStatus.COMPLETED)
                    .progress(new JobProgress(StageName.COMPLETED, 100))
                    .result(result)
                    .updatedAt(LocalDateTime.now(clock))
                    .build();
        });
    }

    private AnalysisJob update(String jobId, UnaryOperator<AnalysisJob> change) {
        AnalysisJob updated = jobs.computeIfPresent(jobId, (id, job) -> change.apply(job));
        if (updated == null) {
            throw new JobNotFoundException(jobId);
        }
        return updated;
    }
}
