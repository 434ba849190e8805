package com.shoplens.backend.batch;

import com.shoplens.backend.config.AnalysisProperties;
import com.shoplens.backend.job.AnalysisJob;
import com.shoplens.backend.job.AnalysisService;
import com.shoplens.backend.job.JobStore;
import com.shoplens.backend.job.SubmissionException;
import com.shoplens.backend.model.dto.AnalyzeResponseDTO;
import com.shoplens.backend.model.dto.BatchItemDTO;
import com.shoplens.backend.model.dto.BatchStatusDTO;
import com.shoplens.backend.model.enums.BatchStatus;
import com.shoplens.backend.model.enums.JobKind;
import com.shoplens.backend.model.enums.JobStatus;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Submits many URLs at once. Every URL becomes an ordinary analysis job on
 * the shared worker pool; the batch only remembers which jobs belong to it
 * and aggregates their state when asked.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchService {

    private final AnalysisService analysisService;
    private final JobStore jobStore;
    private final AnalysisProperties analysisProperties;
    private final Clock clock;

    private final Map<String, BatchAnalysis> batches = new ConcurrentHashMap<>();

    /**
     * A URL refused at submission is kept in the batch as a failed item;
     * the remaining URLs still run.
     */
    public BatchStatusDTO submit(List<String> urls, String name) {
        if (urls == null || urls.isEmpty()) {
            throw new SubmissionException("A batch needs at least one URL");
        }
        if (urls.size() > analysisProperties.getMaxBatchSize()) {
            throw new SubmissionException("A batch accepts at most " + analysisProperties.getMaxBatchSize()
                    + " URLs, got " + urls.size());
        }

        List<BatchEntry> entries = new ArrayList<>();
        for (String url : urls) {
            String sourceRef = url == null ? "" : url.trim();
            try {
                AnalyzeResponseDTO response = analysisService.submit(sourceRef);
                entries.add(new BatchEntry(sourceRef, response.getJobId(), null));
            } catch (SubmissionException e) {
                log.warn("Batch URL refused: {} ({})", sourceRef, e.getMessage());
                entries.add(new BatchEntry(sourceRef, null, e.getMessage()));
            }
        }

        BatchAnalysis batch = BatchAnalysis.builder()
                .id(UUID.randomUUID().toString())
                .name(name == null || name.isBlank() ? null : name.trim())
                .entries(entries)
                .createdAt(LocalDateTime.now(clock))
                .build();
        batches.put(batch.getId(), batch);

        log.info("Created batch {} with {} URLs ({} refused)", batch.getId(), entries.size(),
                entries.stream().filter(e -> e.getJobId() == null).count());
        return summarize(batch);
    }

    public BatchStatusDTO get(String batchId) {
        return summarize(find(batchId));
    }

    public List<BatchItemDTO> items(String batchId) {
        return find(batchId).getEntries().stream()
                .map(this::toItem)
                .collect(Collectors.toList());
    }

    private BatchAnalysis find(String batchId) {
        BatchAnalysis batch = batchId == null ? null : batches.get(batchId);
        if (batch == null) {
            throw new BatchNotFoundException(batchId);
        }
        return batch;
    }

    private BatchStatusDTO summarize(BatchAnalysis batch) {
        List<BatchItemDTO> items = batch.getEntries().stream()
                .map(this::toItem)
                .collect(Collectors.toList());

        int refused = 0;
        int queued = 0;
        int running = 0;
        int completed = 0;
        int failed = 0;
        long scoreSum = 0;
        for (BatchItemDTO item : items) {
            if (item.getJobId() == null) {
                refused++;
            }
            switch (item.getStatus()) {
                case QUEUED:
                    queued++;
                    break;
                case RUNNING:
                    running++;
                    break;
                case COMPLETED:
                    completed++;
                    if (item.getOverallScore() != null) {
                        scoreSum += item.getOverallScore();
                    }
                    break;
                default:
                    failed++;
            }
        }

        BatchStatus status;
        if (queued + running == 0) {
            status = BatchStatus.COMPLETED;
        } else if (queued == items.size() - refused) {
            status = BatchStatus.PENDING;
        } else {
            status = BatchStatus.PROCESSING;
        }

        return BatchStatusDTO.builder()
                .batchId(batch.getId())
                .name(batch.getName())
                .status(status)
                .totalCount(items.size())
                .pendingCount(queued + running)
                .completedCount(completed)
                .failedCount(failed)
                .averageScore(completed == 0 ? null : (double) scoreSum / completed)
                .createdAt(batch.getCreatedAt())
                .build();
    }

    private BatchItemDTO toItem(BatchEntry entry) {
        if (entry.getJobId() == null) {
            return BatchItemDTO.builder()
                    .sourceRef(entry.getSourceRef())
                    .kind(JobKind.fromUrl(entry.getSourceRef()))
                    .status(JobStatus.FAILED)
                    .error(entry.getRejection())
                    .build();
        }

        AnalysisJob job = jobStore.get(entry.getJobId());
        boolean completed = job.getStatus() == JobStatus.COMPLETED;
        return BatchItemDTO.builder()
                .sourceRef(job.getSourceRef())
                .jobId(job.getId())
                .kind(job.getKind())
                .status(job.getStatus())
                .overallScore(completed && job.getResult() != null ? job.getResult().getOverallScore() : null)
                .error(job.getStatus() == JobStatus.FAILED ? job.getError() : null)
                .build();
    }
}
