package com.shoplens.backend.monitoring.service;

import com.shoplens.backend.job.AnalysisJob;
import com.shoplens.backend.model.dto.StageSuccessRateDTO;
import com.shoplens.backend.model.enums.StageName;
import com.shoplens.backend.monitoring.entity.StageExecutionLog;
import com.shoplens.backend.monitoring.repository.StageExecutionLogRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/**
 * Records every stage outcome and reports per-stage success rates.
 * Recording is instrumentation: a storage error is logged and never reaches
 * the pipeline.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineMonitoringService {

    private static final int MAX_DETAIL_ROWS = 500;

    private final StageExecutionLogRepository stageExecutionLogRepository;
    private final Clock clock;

    public void recordStage(AnalysisJob job, StageName stage, boolean success, long durationMs, String errorMessage) {
        try {
            stageExecutionLogRepository.save(StageExecutionLog.builder()
                    .jobId(job.getId())
                    .sourceRef(job.getSourceRef())
                    .kind(job.getKind().getKey())
                    .stage(stage)
                    .success(success)
                    .durationMs(durationMs)
                    .errorMessage(errorMessage)
                    .recordedAt(LocalDateTime.now(clock))
                    .build());
        } catch (DataAccessException e) {
            log.error("Failed to record stage {} for job {}: {}", stage.getKey(), job.getId(), e.getMessage());
        }
    }

    /**
     * Success rates per stage over the last {@code days} days
     */
    public Map<String, Object> getSuccessRates(int days) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime since = now.minusDays(Math.max(1, days));

        List<StageSuccessRateDTO> stages = stageExecutionLogRepository.summarizeSince(since);

        long total = stages.stream().mapToLong(s -> s.getTotalCount() == null ? 0 : s.getTotalCount()).sum();
        long succeeded = stages.stream().mapToLong(s -> s.getSuccessCount() == null ? 0 : s.getSuccessCount()).sum();

        return Map.of(
                "days", Math.max(1, days),
                "stages", stages,
                "overall", Map.of(
                        "totalCount", total,
                        "successCount", succeeded,
                        "failureCount", total - succeeded,
                        "successRate", total > 0 ? (double) succeeded / total * 100 : 0.0
                ),
                "timestamp", now
        );
    }

    public List<StageExecutionLog> getStageDetails(StageName stage, int limit) {
        int size = Math.max(1, Math.min(limit, MAX_DETAIL_ROWS));
        return stageExecutionLogRepository.findByStageOrderByRecordedAtDesc(stage, PageRequest.of(0, size));
    }

    /**
     * Every recorded stage outcome of one job, in execution order
     */
    public List<StageExecutionLog> getJobHistory(String jobId) {
        return stageExecutionLogRepository.findByJobIdOrderByIdAsc(jobId);
    }
}
