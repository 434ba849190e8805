package com.shoplens.backend.history;

import com.shoplens.backend.config.AnalysisProperties;
import com.shoplens.backend.job.AnalysisJob;
import com.shoplens.backend.job.JobStore;
import com.shoplens.backend.model.dto.JobStatusDTO;
import com.shoplens.backend.model.dto.ScoreTrendPointDTO;
import com.shoplens.backend.model.enums.JobKind;
import com.shoplens.backend.model.enums.JobStatus;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.IntSummaryStatistics;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Read-only views over past analysis jobs: a filtered newest-first listing
 * and the daily overall-score trend of one source.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisHistoryService {

    private static final Comparator<AnalysisJob> NEWEST_FIRST = Comparator
            .comparing(AnalysisJob::getCreatedAt, Comparator.reverseOrder())
            .thenComparing(AnalysisJob::getId);

    private final JobStore jobStore;
    private final AnalysisProperties analysisProperties;
    private final Clock clock;

    public List<JobStatusDTO> list(String sourceRef, JobKind kind, Integer limit, Integer offset) {
        String source = sourceRef == null || sourceRef.isBlank() ? null : sourceRef.trim();
        int size = clampLimit(limit);
        int skip = offset == null ? 0 : Math.max(0, offset);

        List<JobStatusDTO> page = jobStore.list().stream()
                .filter(job -> source == null || source.equals(job.getSourceRef()))
                .filter(job -> kind == null || kind == job.getKind())
                .sorted(NEWEST_FIRST)
                .skip(skip)
                .limit(size)
                .map(JobStatusDTO::from)
                .collect(Collectors.toList());

        log.debug("History query source={}, kind={}, limit={}, offset={} -> {} jobs", source, kind, size, skip, page.size());
        return page;
    }

    public JobStatusDTO get(String jobId) {
        return JobStatusDTO.from(jobStore.get(jobId));
    }

    /**
     * Average, highest and lowest overall score per day for completed jobs
     * of one source over the last {@code days} days, oldest day first.
     */
    public List<ScoreTrendPointDTO> scoreTrend(String sourceRef, int days) {
        if (sourceRef == null || sourceRef.isBlank()) {
            throw new IllegalArgumentException("sourceRef must not be blank");
        }
        String source = sourceRef.trim();
        LocalDateTime since = LocalDateTime.now(clock).minusDays(Math.max(1, days));

        Map<LocalDate, IntSummaryStatistics> byDay = jobStore.list().stream()
                .filter(job -> job.getStatus() == JobStatus.COMPLETED && job.getResult() != null)
                .filter(job -> source.equals(job.getSourceRef()))
                .filter(job -> !job.getCreatedAt().isBefore(since))
                .collect(Collectors.groupingBy(job -> job.getCreatedAt().toLocalDate(), TreeMap::new,
                        Collectors.summarizingInt(job -> job.getResult().getOverallScore())));

        List<ScoreTrendPointDTO> trend = new ArrayList<>();
        byDay.forEach((date, stats) -> trend.add(new ScoreTrendPointDTO(
                date, stats.getAverage(), stats.getMax(), stats.getMin(), stats.getCount())));
        return trend;
    }

    private int clampLimit(Integer limit) {
        int requested = limit == null ? analysisProperties.getDefaultHistoryLimit() : limit;
        return Math.max(1, Math.min(requested, analysisProperties.getMaxHistoryLimit()));
    }
}
