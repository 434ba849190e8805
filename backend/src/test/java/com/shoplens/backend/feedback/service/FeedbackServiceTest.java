package com.shoplens.backend.feedback.service;

import com.shoplens.backend.MutableClock;
import com.shoplens.backend.config.FeedbackProperties;
import com.shoplens.backend.feedback.ErrorReportNotFoundException;
import com.shoplens.backend.feedback.entity.ErrorReport;
import com.shoplens.backend.feedback.repository.ErrorReportRepository;
import com.shoplens.backend.model.dto.ErrorReportRequestDTO;
import com.shoplens.backend.model.dto.FieldPriorityStat;
import com.shoplens.backend.model.enums.IssueType;
import com.shoplens.backend.model.enums.ReportStatus;
import com.shoplens.backend.model.enums.Severity;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@DataJpaTest
class FeedbackServiceTest {

    @Autowired
    private ErrorReportRepository errorReportRepository;

    private MutableClock clock;
    private FeedbackDiagnostics diagnostics;
    private FeedbackService feedbackService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T09:00:00Z"));
        diagnostics = mock(FeedbackDiagnostics.class);
        feedbackService = new FeedbackService(errorReportRepository, new FeedbackProperties(), diagnostics, clock);
    }

    @Test
    void shouldStoreReportAsPending() {
        // WHEN
        Long id = feedbackService.submit(ErrorReportRequestDTO.builder()
                .analysisId("3f1c2b7e-0000-4000-8000-000000000001")
                .sourceRef("https://www.qoo10.jp/gmkt.inc/Goods/Goods.aspx?goodscode=1")
                .fieldName(" price.sale_price ")
                .issueType(IssueType.MISMATCH)
                .severity(Severity.HIGH)
                .crawlerValue("4562")
                .reportValue("4500")
                .build());

        // THEN
        ErrorReport stored = errorReportRepository.findById(id).orElseThrow();
        assertThat(stored.getFieldName()).isEqualTo("price.sale_price");
        assertThat(stored.getStatus()).isEqualTo(ReportStatus.PENDING);
        assertThat(stored.getCreatedAt()).isNotNull();
        verify(diagnostics).record(eq("error_report_submitted"), anyMap());
    }

    @Test
    void shouldRankFieldsByReportCount() {
        // GIVEN
        report("product_name");
        report("product_name");
        report("price.sale_price");
        report("product_name");

        // WHEN / THEN
        assertThat(feedbackService.priorityFields(2)).containsExactly("product_name", "price.sale_price");
        assertThat(feedbackService.priorityFields(1)).containsExactly("product_name");
    }

    @Test
    void shouldBreakCountTiesByMostRecentReport() {
        report("price.sale_price");
        report("product_name");
        report("price.sale_price");
        report("product_name");

        assertThat(feedbackService.priorityFields(10)).containsExactly("product_name", "price.sale_price");
    }

    @Test
    void shouldBreakFullTiesByFieldName() {
        ErrorReportRequestDTO first = request("shipping_info.free_shipping_threshold");
        ErrorReportRequestDTO second = request("coupon_info.has_coupon");
        feedbackService.submit(first);
        feedbackService.submit(second);

        assertThat(feedbackService.priorityFields(10))
                .containsExactly("coupon_info.has_coupon", "shipping_info.free_shipping_threshold");
    }

    @Test
    void shouldExposeCountsAndLastReportTime() {
        report("product_name");
        report("product_name");

        List<FieldPriorityStat> stats = feedbackService.priorityStats(5);

        assertThat(stats).hasSize(1);
        assertThat(stats.get(0).getReportCount()).isEqualTo(2L);
        assertThat(stats.get(0).getLastReportedAt()).isEqualTo(LocalDateTime.now(clock));
    }

    @Test
    void shouldReturnNothingForNonPositiveTopK() {
        report("product_name");

        assertThat(feedbackService.priorityFields(0)).isEmpty();
    }

    @Test
    void shouldQueryNewestFirstWithFilters() {
        // GIVEN
        Long older = report("product_name");
        report("price.sale_price");
        Long newer = report("product_name");
        feedbackService.updateStatus(older, ReportStatus.REVIEWED);

        // WHEN
        List<ErrorReport> byField = feedbackService.query("product_name", null, null);
        List<ErrorReport> pending = feedbackService.query("product_name", ReportStatus.PENDING, null);
        List<ErrorReport> all = feedbackService.query(null, null, null);

        // THEN
        assertThat(byField).extracting(ErrorReport::getId).containsExactly(newer, older);
        assertThat(pending).extracting(ErrorReport::getId).containsExactly(newer);
        assertThat(all).hasSize(3);
        verify(diagnostics, times(3)).record(eq("error_reports_queried"), anyMap());
    }

    @Test
    void shouldClampQueryLimit() {
        report("product_name");
        report("product_name");

        assertThat(feedbackService.query(null, null, 0)).hasSize(1);
        assertThat(feedbackService.query(null, null, 10_000)).hasSize(2);
    }

    @Test
    void shouldCountReviewedReportsInPriority() {
        Long first = report("images.detail_image_count");
        report("images.detail_image_count");
        report("product_name");
        feedbackService.updateStatus(first, ReportStatus.RESOLVED);

        assertThat(feedbackService.priorityFields(1)).containsExactly("images.detail_image_count");
        assertThat(feedbackService.shouldPrioritize("images.detail_image_count")).isTrue();
        assertThat(feedbackService.shouldPrioritize("reviews.rating")).isFalse();
    }

    @Test
    void shouldRejectStatusUpdateOfUnknownReport() {
        assertThatThrownBy(() -> feedbackService.updateStatus(999L, ReportStatus.REVIEWED))
                .isInstanceOf(ErrorReportNotFoundException.class);
    }

    private Long report(String fieldName) {
        clock.advance(Duration.ofMinutes(1));
        return feedbackService.submit(request(fieldName));
    }

    private static ErrorReportRequestDTO request(String fieldName) {
        return ErrorReportRequestDTO.builder()
                .fieldName(fieldName)
                .issueType(IssueType.MISMATCH)
                .severity(Severity.MEDIUM)
                .build();
    }
}
