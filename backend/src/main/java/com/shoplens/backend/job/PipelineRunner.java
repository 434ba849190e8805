package com.shoplens.backend.job;

import com.shoplens.backend.analysis.AnalysisEngine;
import com.shoplens.backend.analysis.ChecklistEvaluator;
import com.shoplens.backend.config.AnalysisProperties;
import com.shoplens.backend.crawling.HarvestedData;
import com.shoplens.backend.crawling.RetrievalService;
import com.shoplens.backend.job.output.AnalysisOutput;
import com.shoplens.backend.job.output.ChecklistOutput;
import com.shoplens.backend.job.output.CrawlOutput;
import com.shoplens.backend.job.output.StageOutput;
import com.shoplens.backend.job.output.ValidationOutput;
import com.shoplens.backend.model.enums.StageName;
import com.shoplens.backend.monitoring.service.PipelineMonitoringService;
import com.shoplens.backend.validation.ReconciliationValidator;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Drives a job through its stage plan. Each stage reads the committed
 * output of earlier stages, calls its collaborator on the stage executor
 * and commits the result through the job store. The first failure, the
 * job time budget running out or a cancellation request ends the job as
 * FAILED; nothing is retried.
 */
@Slf4j
@Service
public class PipelineRunner {

    private final JobStore jobStore;
    private final RetrievalService retrievalService;
    private final AnalysisEngine analysisEngine;
    private final ChecklistEvaluator checklistEvaluator;
    private final ReconciliationValidator reconciliationValidator;
    private final PipelineMonitoringService monitoringService;
    private final AnalysisProperties analysisProperties;
    private final Executor stageExecutor;

    private final Map<String, CancellationSignal> signals = new ConcurrentHashMap<>();

    public PipelineRunner(JobStore jobStore,
                          RetrievalService retrievalService,
                          AnalysisEngine analysisEngine,
                          ChecklistEvaluator checklistEvaluator,
                          ReconciliationValidator reconciliationValidator,
                          PipelineMonitoringService monitoringService,
                          AnalysisProperties analysisProperties,
                          @Qualifier("stageTaskExecutor") Executor stageExecutor) {
        this.jobStore = jobStore;
        this.retrievalService = retrievalService;
        this.analysisEngine = analysisEngine;
        this.checklistEvaluator = checklistEvaluator;
        this.reconciliationValidator = reconciliationValidator;
        this.monitoringService = monitoringService;
        this.analysisProperties = analysisProperties;
        this.stageExecutor = stageExecutor;
    }

    /**
     * Register the cancellation signal for a job before it is handed to the
     * worker pool, so a cancel request can land while the job is queued.
     */
    public CancellationSignal register(String jobId) {
        return signals.computeIfAbsent(jobId, id -> new CancellationSignal());
    }

    /**
     * Drop the cancellation signal of a job that will not run (any more).
     */
    public void unregister(String jobId) {
        signals.remove(jobId);
    }

    /**
     * Ask a running or queued job to stop before its next stage.
     *
     * @return false when the job is not (or no longer) running
     */
    public boolean requestCancel(String jobId) {
        CancellationSignal signal = signals.get(jobId);
        if (signal == null) {
            return false;
        }
        signal.cancel();
        log.info("Cancellation requested for job {}", jobId);
        return true;
    }

    @Async("pipelineTaskExecutor")
    public CompletableFuture<AnalysisJob> runAsync(String jobId) {
        return CompletableFuture.completedFuture(run(jobId));
    }

    public AnalysisJob run(String jobId) {
        CancellationSignal signal = register(jobId);
        long startedAt = System.nanoTime();
        long deadline = startedAt + analysisProperties.getJobTimeout().toNanos();

        try {
            AnalysisJob job = jobStore.markRunning(jobId);
            log.info("Starting pipeline for job {} ({}, {})", jobId, job.getKind().getKey(), job.getSourceRef());

            while (!job.isTerminal()) {
                StageName stage = job.nextStage();
                if (stage == null) {
                    return jobStore.fail(jobId, "Stage plan ended without a completed stage");
                }
                if (signal.isCancelled()) {
                    log.info("Job {} cancelled before stage {}", jobId, stage.getKey());
                    return jobStore.fail(jobId, "Cancelled before stage " + stage.getKey());
                }
                if (stage == StageName.COMPLETED) {
                    AnalysisJob completed = jobStore.complete(jobId, finalResult(job));
                    log.info("Job {} completed in {} ms", jobId, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt));
                    return completed;
                }
                job = runStage(job, stage, deadline);
            }
            return job;
        } catch (StaleStageException e) {
            log.error("Job {} rejected a stage commit: {}", jobId, e.getMessage());
            return jobStore.fail(jobId, "Internal error: " + e.getMessage());
        } catch (JobNotFoundException e) {
            log.error("Job {} disappeared from the store", jobId);
            throw e;
        } catch (RuntimeException e) {
            log.error("Unexpected error running job {}", jobId, e);
            return jobStore.fail(jobId, "Internal error: " + describe(e));
        } finally {
            unregister(jobId);
        }
    }

    private AnalysisJob runStage(AnalysisJob job, StageName stage, long deadline) {
        long stageStart = System.nanoTime();
        String failure;
        try {
            StageOutput output = execute(job, stage, deadline);
            AnalysisJob committed = jobStore.commitStage(job.getId(), stage, output, analysisProperties.weightOf(stage));
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - stageStart);
            monitoringService.recordStage(committed, stage, true, durationMs, null);
            log.debug("Job {} committed stage {} ({} ms)", job.getId(), stage.getKey(), durationMs);
            return committed;
        } catch (TimeoutException e) {
            failure = "Timed out after " + analysisProperties.getJobTimeout().toMillis() + " ms during stage " + stage.getKey();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            failure = "Stage " + stage.getKey() + " failed: " + describe(cause);
        } catch (RejectedExecutionException e) {
            failure = "Stage " + stage.getKey() + " could not be scheduled: " + describe(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure = "Interrupted during stage " + stage.getKey();
        }

        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - stageStart);
        log.error("Job {} failed at stage {}: {}", job.getId(), stage.getKey(), failure);
        monitoringService.recordStage(job, stage, false, durationMs, failure);
        return jobStore.fail(job.getId(), failure);
    }

    private StageOutput execute(AnalysisJob job, StageName stage, long deadline)
            throws TimeoutException, ExecutionException, InterruptedException {
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
            throw new TimeoutException();
        }

        CompletableFuture<StageOutput> future = CompletableFuture.supplyAsync(() -> invoke(job, stage), stageExecutor);
        try {
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private StageOutput invoke(AnalysisJob job, StageName stage) {
        StageOutput output;
        switch (stage) {
            case CRAWLING:
                HarvestedData harvested = retrievalService.retrieve(job.getSourceRef(), job.getKind());
                output = harvested == null ? null : new CrawlOutput(harvested);
                break;
            case ANALYZING:
                output = analysisEngine.analyze(job.getKind(), harvested(job));
                break;
            case EVALUATING_CHECKLIST:
                output = checklistEvaluator.evaluate(job.getKind(), harvested(job),
                        require(job, StageName.ANALYZING, AnalysisOutput.class));
                break;
            case VALIDATING:
                output = reconciliationValidator.validate(job.getKind(), harvested(job),
                        require(job, StageName.ANALYZING, AnalysisOutput.class),
                        require(job, StageName.EVALUATING_CHECKLIST, ChecklistOutput.class));
                break;
            default:
                throw new StageFailureException("Stage " + stage.getKey() + " has no collaborator");
        }
        if (output == null) {
            throw new StageFailureException("Stage " + stage.getKey() + " produced no output");
        }
        return output;
    }

    private static HarvestedData harvested(AnalysisJob job) {
        return require(job, StageName.CRAWLING, CrawlOutput.class).getData();
    }

    private static <T extends StageOutput> T require(AnalysisJob job, StageName stage, Class<T> type) {
        return job.getOutput(stage, type)
                .orElseThrow(() -> new StageFailureException("Missing " + stage.getKey() + " output"));
    }

    /**
     * The corrected result when the job was validated, the raw analysis
     * otherwise.
     */
    private static AnalysisOutput finalResult(AnalysisJob job) {
        return job.getOutput(StageName.VALIDATING, ValidationOutput.class)
                .map(ValidationOutput::getCorrectedResult)
                .orElseGet(() -> job.getOutput(StageName.ANALYZING, AnalysisOutput.class).orElse(null));
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }
}
