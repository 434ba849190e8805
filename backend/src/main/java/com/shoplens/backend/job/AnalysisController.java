package com.shoplens.backend.job;

import com.shoplens.backend.model.dto.AnalyzeRequestDTO;
import com.shoplens.backend.model.dto.AnalyzeResponseDTO;
import com.shoplens.backend.model.dto.JobStatusDTO;
import com.shoplens.backend.report.RenderedReport;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for analysis jobs
 */
@RestController
@RequestMapping("/api/v1/analyze")
@RequiredArgsConstructor
@Slf4j
public class AnalysisController {

    private final AnalysisService analysisService;

    /**
     * Submit a page for analysis; the job runs in the background
     */
    @PostMapping
    public ResponseEntity<AnalyzeResponseDTO> submit(@Valid @RequestBody AnalyzeRequestDTO request) {
        log.info("Analysis requested for {}", request.getSourceRef());
        return ResponseEntity.accepted().body(analysisService.submit(request.getSourceRef()));
    }

    @GetMapping("/{jobId}")
    public ResponseEntity<JobStatusDTO> getStatus(@PathVariable String jobId) {
        return ResponseEntity.ok(analysisService.getStatus(jobId));
    }

    @GetMapping("/{jobId}/download")
    public ResponseEntity<byte[]> download(
            @PathVariable String jobId,
            @RequestParam(defaultValue = "markdown") String format) {

        RenderedReport report = analysisService.download(jobId, format);
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(report.getFormat().getMediaType() + ";charset=UTF-8"))
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(report.getFilename()).build().toString())
                .body(report.getContent());
    }

    @PostMapping("/{jobId}/cancel")
    public ResponseEntity<JobStatusDTO> cancel(@PathVariable String jobId) {
        return ResponseEntity.accepted().body(analysisService.cancel(jobId));
    }
}
