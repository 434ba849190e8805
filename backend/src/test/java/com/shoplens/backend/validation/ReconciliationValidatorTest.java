package com.shoplens.backend.validation;

import com.shoplens.backend.config.AnalysisProperties;
import com.shoplens.backend.crawling.HarvestedData;
import com.shoplens.backend.job.output.AnalysisOutput;
import com.shoplens.backend.job.output.ChecklistItem;
import com.shoplens.backend.job.output.ChecklistOutput;
import com.shoplens.backend.job.output.ValidationOutput;
import com.shoplens.backend.model.enums.JobKind;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ReconciliationValidatorTest {

    private AnalysisProperties properties;
    private ReconciliationValidator validator;

    @BeforeEach
    void setUp() {
        properties = new AnalysisProperties();
        validator = new ReconciliationValidator(properties,
                Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void shouldCorrectDriftedSalePrice() {
        // GIVEN
        HarvestedData harvested = harvested(Map.of(
                "product_name", "Hydrating Serum 50ml",
                "price.sale_price", new BigDecimal("4562")));
        AnalysisOutput result = result(Map.of(
                "product_analysis.product_name", "Hydrating Serum 50ml",
                "product_analysis.price_analysis.sale_price", 4500));

        // WHEN
        ValidationOutput output = validator.validate(JobKind.SINGLE_ITEM, harvested, result, emptyChecklist());

        // THEN
        ValidationReport report = output.getReport();
        assertThat(report.getMismatches())
                .containsExactly(new FieldMismatch("price.sale_price", new BigDecimal("4562"), 4500));
        assertThat(report.getCorrectedFields()).containsExactly("price.sale_price");
        assertThat(report.getValidationScore()).isEqualTo(50);
        assertThat(report.isValid()).isFalse();
        assertThat(output.getCorrectedResult().get("product_analysis.price_analysis.sale_price"))
                .isEqualTo(new BigDecimal("4562"));
        assertThat(result.get("product_analysis.price_analysis.sale_price")).isEqualTo(4500);
    }

    @Test
    void shouldCorrectNonFiniteResultValueInsteadOfFailing() {
        // GIVEN
        HarvestedData harvested = harvested(Map.of("price.sale_price", new BigDecimal("4562")));
        AnalysisOutput result = result(Map.of("product_analysis.price_analysis.sale_price", Double.NaN));

        // WHEN
        ValidationOutput output = validator.validate(JobKind.SINGLE_ITEM, harvested, result, emptyChecklist());

        // THEN
        assertThat(output.getReport().getCorrectedFields()).containsExactly("price.sale_price");
        assertThat(output.getCorrectedResult().get("product_analysis.price_analysis.sale_price"))
                .isEqualTo(new BigDecimal("4562"));
    }

    @Test
    void shouldTreatFormattedNumbersAsEqual() {
        HarvestedData harvested = harvested(Map.of("price.sale_price", "4,562円"));
        AnalysisOutput result = result(Map.of("product_analysis.price_analysis.sale_price", "¥4562"));

        ValidationReport report = validator.validate(JobKind.SINGLE_ITEM, harvested, result, emptyChecklist()).getReport();

        assertThat(report.getMismatches()).isEmpty();
        assertThat(report.getValidationScore()).isEqualTo(100);
        assertThat(report.isValid()).isTrue();
    }

    @Test
    void shouldCompareTextAfterCollapsingWhitespace() {
        HarvestedData harvested = harvested(Map.of("product_name", "  Hydrating   Serum "));
        AnalysisOutput result = result(Map.of("product_analysis.product_name", "Hydrating Serum"));

        ValidationReport report = validator.validate(JobKind.SINGLE_ITEM, harvested, result, emptyChecklist()).getReport();

        assertThat(report.getMismatches()).isEmpty();
        assertThat(report.getComparedFieldCount()).isEqualTo(1);
    }

    @Test
    void shouldReportMissingAutoCheckedItemWithoutCountingMismatch() {
        // GIVEN
        HarvestedData harvested = harvested(Map.of("product_name", "Serum"));
        AnalysisOutput result = result(Map.of("product_analysis.product_name", "Serum"));
        ChecklistOutput checklist = new ChecklistOutput(0, List.of(
                ChecklistItem.builder()
                        .id("item_005")
                        .title("Shipping information set")
                        .status(ChecklistItem.Status.PENDING)
                        .autoChecked(true)
                        .backingField("shipping_info.free_shipping_threshold")
                        .build(),
                ChecklistItem.builder()
                        .id("item_006")
                        .title("Stock management set")
                        .status(ChecklistItem.Status.PENDING)
                        .autoChecked(false)
                        .build()));

        // WHEN
        ValidationReport report = validator.validate(JobKind.SINGLE_ITEM, harvested, result, checklist).getReport();

        // THEN
        assertThat(report.getMissingItems())
                .containsExactly(new MissingItem("shipping_info.free_shipping_threshold", "item_005"));
        assertThat(report.getMismatches()).isEmpty();
        assertThat(report.getValidationScore()).isEqualTo(100);
    }

    @Test
    void shouldScoreHundredWhenNothingComparable() {
        HarvestedData harvested = harvested(Map.of("description", "text only"));

        ValidationOutput output = validator.validate(JobKind.SINGLE_ITEM, harvested, result(Map.of()), emptyChecklist());

        assertThat(output.getReport().getValidationScore()).isEqualTo(100);
        assertThat(output.getReport().isValid()).isTrue();
        assertThat(output.getReport().getComparedFieldCount()).isZero();
    }

    @Test
    void shouldCountAbsentResultValueAsMismatch() {
        HarvestedData harvested = harvested(Map.of("reviews.review_count", 12));

        ValidationReport report = validator.validate(JobKind.SINGLE_ITEM, harvested, result(Map.of()), emptyChecklist()).getReport();

        assertThat(report.getMismatches()).extracting(FieldMismatch::getField).containsExactly("reviews.review_count");
        assertThat(report.getValidationScore()).isZero();
    }

    @Test
    void shouldHonourConfiguredThreshold() {
        properties.setValidationThreshold(50);
        HarvestedData harvested = harvested(Map.of(
                "product_name", "Serum",
                "price.sale_price", 4562));
        AnalysisOutput result = result(Map.of(
                "product_analysis.product_name", "Serum",
                "product_analysis.price_analysis.sale_price", 4500));

        ValidationReport report = validator.validate(JobKind.SINGLE_ITEM, harvested, result, emptyChecklist()).getReport();

        assertThat(report.getValidationScore()).isEqualTo(50);
        assertThat(report.isValid()).isTrue();
    }

    @Test
    void shouldUseCollectionCorrespondences() {
        HarvestedData harvested = HarvestedData.builder()
                .sourceRef("https://www.qoo10.jp/shop/sample")
                .kind(JobKind.COLLECTION)
                .fields(Map.of("shop_name", "Sample Shop", "shop.product_count", 42))
                .build();
        AnalysisOutput result = result(Map.of(
                "shop_analysis.shop_name", "Sample Shop",
                "shop_analysis.product_count", 40));

        ValidationOutput output = validator.validate(JobKind.COLLECTION, harvested, result, emptyChecklist());

        assertThat(output.getReport().getCorrectedFields()).containsExactly("shop.product_count");
        assertThat(output.getCorrectedResult().get("shop_analysis.product_count")).isEqualTo(42);
    }

    private static HarvestedData harvested(Map<String, Object> fields) {
        return HarvestedData.builder()
                .sourceRef("https://www.qoo10.jp/gmkt.inc/Goods/Goods.aspx?goodscode=1")
                .kind(JobKind.SINGLE_ITEM)
                .fields(new LinkedHashMap<>(fields))
                .build();
    }

    private static AnalysisOutput result(Map<String, Object> fields) {
        return AnalysisOutput.builder().overallScore(70).resultFields(new LinkedHashMap<>(fields)).build();
    }

    private static ChecklistOutput emptyChecklist() {
        return new ChecklistOutput(100, List.of());
    }
}
