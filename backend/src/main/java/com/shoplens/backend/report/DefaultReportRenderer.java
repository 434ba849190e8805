package com.shoplens.backend.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shoplens.backend.job.AnalysisJob;
import com.shoplens.backend.job.output.AnalysisOutput;
import com.shoplens.backend.job.output.ChecklistItem;
import com.shoplens.backend.job.output.ChecklistOutput;
import com.shoplens.backend.model.enums.ReportFormat;
import com.shoplens.backend.model.enums.StageName;
import com.shoplens.backend.validation.FieldMismatch;
import com.shoplens.backend.validation.MissingItem;
import com.shoplens.backend.validation.ValidationReport;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
@RequiredArgsConstructor
public class DefaultReportRenderer implements ReportRenderer {

    private final ObjectMapper objectMapper;

    @Override
    public byte[] render(AnalysisJob job, ReportFormat format) {
        log.debug("Rendering job {} as {}", job.getId(), format.getExtension());
        if (format == ReportFormat.JSON) {
            return renderJson(job);
        }
        return renderMarkdown(job).getBytes(StandardCharsets.UTF_8);
    }

    private byte[] renderJson(AnalysisJob job) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("jobId", job.getId());
        document.put("sourceRef", job.getSourceRef());
        document.put("kind", job.getKind());
        document.put("result", job.getResult());
        job.getOutput(StageName.EVALUATING_CHECKLIST, ChecklistOutput.class)
                .ifPresent(checklist -> document.put("checklist", checklist));
        document.put("validation", job.getValidation());
        document.put("completedAt", job.getUpdatedAt());
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render report for job " + job.getId(), e);
        }
    }

    private String renderMarkdown(AnalysisJob job) {
        StringBuilder md = new StringBuilder();
        AnalysisOutput result = job.getResult();

        md.append("# Analysis report\n\n");
        md.append("- **Source:** ").append(job.getSourceRef()).append('\n');
        md.append("- **Kind:** ").append(job.getKind().getKey()).append('\n');
        md.append("- **Completed:** ").append(job.getUpdatedAt()).append("\n\n");

        if (result != null) {
            md.append("## Overall score: ").append(result.getOverallScore()).append("/100\n\n");
            md.append("| Section | Score |\n|---|---|\n");
            result.getSectionScores().forEach((section, score) ->
                    md.append("| ").append(section).append(" | ").append(score).append(" |\n"));
            md.append("\n## Fields\n\n| Field | Value |\n|---|---|\n");
            result.getResultFields().forEach((field, value) ->
                    md.append("| ").append(field).append(" | ").append(value == null ? "-" : value).append(" |\n"));
            md.append('\n');
        }

        job.getOutput(StageName.EVALUATING_CHECKLIST, ChecklistOutput.class).ifPresent(checklist -> {
            md.append("## Checklist (").append(checklist.getCompletionRate()).append("% complete)\n\n");
            for (ChecklistItem item : checklist.getItems()) {
                md.append(item.getStatus() == ChecklistItem.Status.COMPLETED ? "- [x] " : "- [ ] ")
                        .append(item.getId()).append(' ').append(item.getTitle());
                if (item.getRecommendation() != null) {
                    md.append(" (").append(item.getRecommendation()).append(')');
                }
                md.append('\n');
            }
            md.append('\n');
        });

        ValidationReport validation = job.getValidation();
        if (validation != null) {
            md.append("## Data validation\n\n");
            md.append("- **Score:** ").append(validation.getValidationScore())
                    .append(validation.isValid() ? " (valid)" : " (needs review)").append('\n');
            for (FieldMismatch mismatch : validation.getMismatches()) {
                md.append("- Corrected `").append(mismatch.getField()).append("`: report had ")
                        .append(mismatch.getReportValue()).append(", page shows ")
                        .append(mismatch.getCrawlerValue()).append('\n');
            }
            for (MissingItem missing : validation.getMissingItems()) {
                md.append("- Missing `").append(missing.getField()).append("` for checklist item ")
                        .append(missing.getChecklistItemId()).append('\n');
            }
        }
        return md.toString();
    }
}
