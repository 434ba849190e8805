package com.shoplens.backend.analysis;

import com.shoplens.backend.crawling.HarvestedData;
import com.shoplens.backend.job.output.ChecklistItem;
import com.shoplens.backend.job.output.ChecklistOutput;
import com.shoplens.backend.model.enums.JobKind;
import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DefaultChecklistEvaluatorTest {

    private final DefaultChecklistEvaluator evaluator = new DefaultChecklistEvaluator();

    @Test
    void shouldCompleteItemsBackedByHarvestedFields() {
        // GIVEN
        Map<String, Object> fields = new HashMap<>();
        fields.put("product_name", "Moisture cream 50g");
        fields.put("price.sale_price", new BigDecimal("4562"));
        fields.put("price.original_price", new BigDecimal("5980"));
        fields.put("images.detail_image_count", 5);
        fields.put("reviews.review_count", 3);
        fields.put("coupon_info.has_coupon", Boolean.FALSE);

        // WHEN
        ChecklistOutput output = evaluator.evaluate(JobKind.SINGLE_ITEM, single(fields), null);

        // THEN
        assertThat(status(output, "item_001")).isEqualTo(ChecklistItem.Status.COMPLETED);
        assertThat(status(output, "item_004")).isEqualTo(ChecklistItem.Status.COMPLETED);
        assertThat(status(output, "item_007")).isEqualTo(ChecklistItem.Status.COMPLETED);
        assertThat(status(output, "item_022")).isEqualTo(ChecklistItem.Status.COMPLETED);
        assertThat(status(output, "item_005")).isEqualTo(ChecklistItem.Status.PENDING);
        assertThat(status(output, "item_010")).isEqualTo(ChecklistItem.Status.PENDING);
        assertThat(status(output, "item_011")).isEqualTo(ChecklistItem.Status.PENDING);
        // 4 of 9
        assertThat(output.getCompletionRate()).isEqualTo(44);
    }

    @Test
    void shouldKeepManualItemsPending() {
        ChecklistOutput output = evaluator.evaluate(JobKind.SINGLE_ITEM, single(Map.of("product_name", "x")), null);

        ChecklistItem manual = item(output, "item_006");
        assertThat(manual.getStatus()).isEqualTo(ChecklistItem.Status.PENDING);
        assertThat(manual.isAutoChecked()).isFalse();
        assertThat(manual.getBackingField()).isNull();
        assertThat(manual.getRecommendation()).isNotBlank();
    }

    @Test
    void shouldNotCountDiscountWhenListPriceIsNotHigher() {
        ChecklistOutput output = evaluator.evaluate(JobKind.SINGLE_ITEM, single(Map.of(
                "price.sale_price", new BigDecimal("4500"),
                "price.original_price", "4,500")), null);

        assertThat(status(output, "item_022")).isEqualTo(ChecklistItem.Status.PENDING);
    }

    @Test
    void shouldUseCollectionRulesForShopPages() {
        HarvestedData data = HarvestedData.builder()
                .sourceRef("https://www.qoo10.jp/shop/example")
                .kind(JobKind.COLLECTION)
                .fields(Map.of("shop_name", "Example", "shop.product_count", 12, "coupon_info.has_coupon", true))
                .build();

        ChecklistOutput output = evaluator.evaluate(JobKind.COLLECTION, data, null);

        assertThat(output.getItems()).extracting(ChecklistItem::getId)
                .containsExactly("item_001", "item_003", "item_021", "item_012");
        assertThat(output.getCompletionRate()).isEqualTo(75);
    }

    private static HarvestedData single(Map<String, Object> fields) {
        return HarvestedData.builder()
                .sourceRef("https://www.qoo10.jp/gmkt.inc/Goods/Goods.aspx?goodscode=1")
                .kind(JobKind.SINGLE_ITEM)
                .fields(fields)
                .build();
    }

    private static ChecklistItem.Status status(ChecklistOutput output, String id) {
        return item(output, id).getStatus();
    }

    private static ChecklistItem item(ChecklistOutput output, String id) {
        return output.getItems().stream()
                .filter(i -> i.getId().equals(id))
                .findFirst()
                .orElseThrow();
    }
}
