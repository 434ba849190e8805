package com.shoplens.backend.job;

import com.shoplens.backend.config.AnalysisProperties;
import com.shoplens.backend.model.dto.AnalyzeResponseDTO;
import com.shoplens.backend.model.dto.JobStatusDTO;
import com.shoplens.backend.model.enums.JobKind;
import com.shoplens.backend.model.enums.JobStatus;
import com.shoplens.backend.model.enums.ReportFormat;
import com.shoplens.backend.report.RenderedReport;
import com.shoplens.backend.report.ReportRenderer;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.concurrent.RejectedExecutionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for analysis jobs: validates submissions, hands jobs to the
 * pipeline runner and serves their state and reports.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisService {

    private final JobStore jobStore;
    private final PipelineRunner pipelineRunner;
    private final ReportRenderer reportRenderer;
    private final AnalysisProperties analysisProperties;

    public AnalyzeResponseDTO submit(String sourceRef) {
        String url = sourceRef == null ? "" : sourceRef.trim();
        validateUrl(url);

        JobKind kind = JobKind.fromUrl(url);
        if (kind == null) {
            throw new SubmissionException("Unsupported page: expected a product (/goods/) or shop (/shop/) URL");
        }

        String jobId = jobStore.create(url, kind);
        // Read before the pool sees the job; afterwards a fast run may already be terminal
        JobStatus status = jobStore.get(jobId).getStatus();
        pipelineRunner.register(jobId);
        try {
            pipelineRunner.runAsync(jobId);
        } catch (RejectedExecutionException e) {
            log.error("Worker pool rejected job {}: {}", jobId, e.getMessage());
            pipelineRunner.unregister(jobId);
            status = jobStore.fail(jobId, "Rejected: analysis worker pool is saturated").getStatus();
        }

        return new AnalyzeResponseDTO(jobId, status, kind);
    }

    public JobStatusDTO getStatus(String jobId) {
        return JobStatusDTO.from(jobStore.get(jobId));
    }

    public RenderedReport download(String jobId, String formatName) {
        AnalysisJob job = jobStore.get(jobId);

        ReportFormat format = ReportFormat.fromName(formatName == null ? "markdown" : formatName);
        if (format == null) {
            throw new IllegalArgumentException("Unsupported report format: " + formatName);
        }
        if (job.getStatus() != JobStatus.COMPLETED) {
            throw new JobNotReadyException(jobId, job.getStatus());
        }

        byte[] content = reportRenderer.render(job, format);
        String filename = "analysis-" + jobId + "." + format.getExtension();
        log.info("Rendered {} report for job {} ({} bytes)", format.getExtension(), jobId, content.length);
        return new RenderedReport(filename, format, content);
    }

    /**
     * Request cancellation. Takes effect before the job's next stage; a
     * terminal job is returned unchanged.
     */
    public JobStatusDTO cancel(String jobId) {
        AnalysisJob job = jobStore.get(jobId);
        if (!job.isTerminal() && !pipelineRunner.requestCancel(jobId)) {
            log.warn("Job {} has no active run to cancel", jobId);
        }
        return JobStatusDTO.from(jobStore.get(jobId));
    }

    private void validateUrl(String url) {
        if (url.isEmpty()) {
            throw new SubmissionException("sourceRef must not be blank");
        }

        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new SubmissionException("Malformed URL: " + url);
        }

        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new SubmissionException("URL must use http or https: " + url);
        }
        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            throw new SubmissionException("URL has no host: " + url);
        }

        if (!analysisProperties.getAllowedHosts().isEmpty() && !isAllowedHost(host.toLowerCase(Locale.ROOT))) {
            throw new SubmissionException("Unsupported host: " + host);
        }
    }

    private boolean isAllowedHost(String host) {
        for (String allowed : analysisProperties.getAllowedHosts()) {
            String candidate = allowed.toLowerCase(Locale.ROOT);
            if (host.equals(candidate) || host.endsWith("." + candidate)) {
                return true;
            }
        }
        return false;
    }
}
