package com.shoplens.backend.history;

import com.shoplens.backend.MutableClock;
import com.shoplens.backend.config.AnalysisProperties;
import com.shoplens.backend.crawling.HarvestedData;
import com.shoplens.backend.job.InMemoryJobStore;
import com.shoplens.backend.job.JobNotFoundException;
import com.shoplens.backend.job.StagePlanner;
import com.shoplens.backend.job.output.AnalysisOutput;
import com.shoplens.backend.job.output.ChecklistOutput;
import com.shoplens.backend.job.output.CrawlOutput;
import com.shoplens.backend.job.output.ValidationOutput;
import com.shoplens.backend.model.dto.JobStatusDTO;
import com.shoplens.backend.model.dto.ScoreTrendPointDTO;
import com.shoplens.backend.model.enums.JobKind;
import com.shoplens.backend.model.enums.JobStatus;
import com.shoplens.backend.model.enums.StageName;
import com.shoplens.backend.validation.ValidationReport;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalysisHistoryServiceTest {

    private static final String PRODUCT_URL = "https://www.qoo10.jp/gmkt.inc/Goods/Goods.aspx?goodscode=1";
    private static final String OTHER_PRODUCT_URL = "https://www.qoo10.jp/gmkt.inc/Goods/Goods.aspx?goodscode=2";
    private static final String SHOP_URL = "https://www.qoo10.jp/shop/sample-shop";

    private MutableClock clock;
    private AnalysisProperties properties;
    private InMemoryJobStore store;
    private AnalysisHistoryService historyService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T09:00:00Z"));
        properties = new AnalysisProperties();
        store = new InMemoryJobStore(new StagePlanner(properties), clock);
        historyService = new AnalysisHistoryService(store, properties, clock);
    }

    @Test
    void shouldListNewestFirstWithFilters() {
        // GIVEN
        String first = store.create(PRODUCT_URL, JobKind.SINGLE_ITEM);
        clock.advance(Duration.ofMinutes(1));
        String shop = store.create(SHOP_URL, JobKind.COLLECTION);
        clock.advance(Duration.ofMinutes(1));
        String second = store.create(PRODUCT_URL, JobKind.SINGLE_ITEM);

        // WHEN
        List<JobStatusDTO> all = historyService.list(null, null, null, null);
        List<JobStatusDTO> product = historyService.list(" " + PRODUCT_URL + " ", null, null, null);
        List<JobStatusDTO> collections = historyService.list(null, JobKind.COLLECTION, null, null);

        // THEN
        assertThat(all).extracting(JobStatusDTO::getJobId).containsExactly(second, shop, first);
        assertThat(product).extracting(JobStatusDTO::getJobId).containsExactly(second, first);
        assertThat(collections).extracting(JobStatusDTO::getJobId).containsExactly(shop);
    }

    @Test
    void shouldPageWithLimitAndOffset() {
        String first = store.create(PRODUCT_URL, JobKind.SINGLE_ITEM);
        clock.advance(Duration.ofMinutes(1));
        String second = store.create(PRODUCT_URL, JobKind.SINGLE_ITEM);
        clock.advance(Duration.ofMinutes(1));
        store.create(PRODUCT_URL, JobKind.SINGLE_ITEM);

        assertThat(historyService.list(null, null, 2, 1)).extracting(JobStatusDTO::getJobId)
                .containsExactly(second, first);
        assertThat(historyService.list(null, null, 0, null)).hasSize(1);
        assertThat(historyService.list(null, null, 10, 5)).isEmpty();
    }

    @Test
    void shouldGroupCompletedScoresPerDayOldestFirst() {
        // GIVEN a run outside the window, two runs on day one, one on day two
        completedJob(PRODUCT_URL, 10);
        clock.advance(Duration.ofDays(40));
        completedJob(PRODUCT_URL, 60);
        clock.advance(Duration.ofHours(1));
        completedJob(PRODUCT_URL, 80);
        completedJob(OTHER_PRODUCT_URL, 99);
        store.fail(store.create(PRODUCT_URL, JobKind.SINGLE_ITEM), "Stage crawling failed: HTTP 503");
        clock.advance(Duration.ofDays(1));
        completedJob(PRODUCT_URL, 90);

        // WHEN
        List<ScoreTrendPointDTO> trend = historyService.scoreTrend(PRODUCT_URL, 30);

        // THEN
        assertThat(trend).hasSize(2);
        ScoreTrendPointDTO dayOne = trend.get(0);
        assertThat(dayOne.getDate()).isEqualTo(LocalDate.of(2026, 4, 10));
        assertThat(dayOne.getAvgScore()).isEqualTo(70.0);
        assertThat(dayOne.getMaxScore()).isEqualTo(80);
        assertThat(dayOne.getMinScore()).isEqualTo(60);
        assertThat(dayOne.getCount()).isEqualTo(2L);
        assertThat(trend.get(1).getDate()).isEqualTo(LocalDate.of(2026, 4, 11));
        assertThat(trend.get(1).getCount()).isEqualTo(1L);
    }

    @Test
    void shouldRejectTrendWithoutSource() {
        assertThatThrownBy(() -> historyService.scoreTrend(" ", 30)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldReturnSingleJobOrNotFound() {
        String jobId = completedJob(PRODUCT_URL, 75);

        JobStatusDTO job = historyService.get(jobId);

        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getResult().getOverallScore()).isEqualTo(75);
        assertThatThrownBy(() -> historyService.get("missing")).isInstanceOf(JobNotFoundException.class);
    }

    private String completedJob(String url, int score) {
        String jobId = store.create(url, JobKind.SINGLE_ITEM);
        AnalysisOutput analysis = AnalysisOutput.builder().overallScore(score).resultFields(Map.of()).build();
        store.commitStage(jobId, StageName.CRAWLING, new CrawlOutput(HarvestedData.builder()
                .sourceRef(url)
                .kind(JobKind.SINGLE_ITEM)
                .fields(Map.of("product_name", "Serum"))
                .build()), 30);
        store.commitStage(jobId, StageName.ANALYZING, analysis, 55);
        store.commitStage(jobId, StageName.EVALUATING_CHECKLIST, new ChecklistOutput(100, List.of()), 75);
        store.commitStage(jobId, StageName.VALIDATING, new ValidationOutput(
                ValidationReport.builder().validationScore(100).valid(true).build(), analysis), 90);
        store.complete(jobId, analysis);
        return jobId;
    }
}
