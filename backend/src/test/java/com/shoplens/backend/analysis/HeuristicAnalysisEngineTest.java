package com.shoplens.backend.analysis;

import com.shoplens.backend.crawling.HarvestedData;
import com.shoplens.backend.job.output.AnalysisOutput;
import com.shoplens.backend.model.enums.JobKind;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HeuristicAnalysisEngineTest {

    private final HeuristicAnalysisEngine engine = new HeuristicAnalysisEngine();

    @Test
    void shouldDeriveDiscountAndPriceFields() {
        // GIVEN
        HarvestedData data = HarvestedData.builder()
                .sourceRef("https://www.qoo10.jp/gmkt.inc/Goods/Goods.aspx?goodscode=1")
                .kind(JobKind.SINGLE_ITEM)
                .fields(Map.of(
                        "product_name", "Hydrating moisture cream 50g for dry skin",
                        "price.sale_price", new BigDecimal("4562"),
                        "price.original_price", "5,980",
                        "reviews.review_count", 25,
                        "reviews.rating", new BigDecimal("4.6"),
                        "images.detail_image_count", 4))
                .build();

        // WHEN
        AnalysisOutput output = engine.analyze(JobKind.SINGLE_ITEM, data);

        // THEN
        assertThat(output.get("product_analysis.price_analysis.sale_price")).isEqualTo(new BigDecimal("4562"));
        assertThat(output.get("product_analysis.price_analysis.original_price")).isEqualTo(new BigDecimal("5980"));
        assertThat(output.get("product_analysis.price_analysis.discount_rate")).isEqualTo(23);
        assertThat(output.get("product_analysis.review_analysis.review_count")).isEqualTo(25);
        assertThat(output.getSectionScores())
                .containsEntry("seo_analysis", 80)
                .containsEntry("price_analysis", 90)
                .containsEntry("review_analysis", 65)
                .containsEntry("image_analysis", 70)
                .containsEntry("description_analysis", 0);
        assertThat(output.getOverallScore()).isEqualTo(61);
    }

    @Test
    void shouldDropImplausiblePrices() {
        HarvestedData data = HarvestedData.builder()
                .kind(JobKind.SINGLE_ITEM)
                .fields(Map.of("price.sale_price", new BigDecimal("12")))
                .build();

        AnalysisOutput output = engine.analyze(JobKind.SINGLE_ITEM, data);

        assertThat(output.get("product_analysis.price_analysis.sale_price")).isNull();
        assertThat(output.getSectionScores()).containsEntry("price_analysis", 0);
    }

    @Test
    void shouldAveragePricesOfListedItems() {
        HarvestedData data = HarvestedData.builder()
                .sourceRef("https://www.qoo10.jp/shop/example")
                .kind(JobKind.COLLECTION)
                .fields(Map.of("shop_name", "Example", "shop.product_count", 2))
                .items(List.of(
                        Map.of("name", "A", "price", new BigDecimal("1000")),
                        Map.of("name", "B", "price", new BigDecimal("2000")),
                        Map.of("name", "C")))
                .build();

        AnalysisOutput output = engine.analyze(JobKind.COLLECTION, data);

        assertThat(output.get("shop_analysis.average_price")).isEqualTo(new BigDecimal("1500"));
        assertThat(output.get("shop_analysis.product_count")).isEqualTo(2);
        assertThat(output.get("shop_analysis.has_coupon")).isEqualTo(false);
    }
}
