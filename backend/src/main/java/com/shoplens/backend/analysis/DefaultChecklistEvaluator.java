package com.shoplens.backend.analysis;

import com.shoplens.backend.crawling.HarvestedData;
import com.shoplens.backend.job.output.AnalysisOutput;
import com.shoplens.backend.job.output.ChecklistItem;
import com.shoplens.backend.job.output.ChecklistOutput;
import com.shoplens.backend.model.enums.JobKind;
import com.shoplens.backend.validation.ValueNormalizer;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Small built-in checklist. Auto-checked items read one harvested field;
 * manual items always stay pending.
 */
@Service
@Slf4j
public class DefaultChecklistEvaluator implements ChecklistEvaluator {

    private static final String PREPARATION = "Sales preparation";
    private static final String OPTIMIZATION = "Listing optimization";
    private static final String PROMOTION = "Promotion";

    private static final List<Rule> SINGLE_ITEM_RULES = List.of(
            Rule.auto("item_001", PREPARATION, "Product registered", "product_name",
                    d -> d.hasValue("product_name"),
                    "Enter a descriptive product name"),
            Rule.auto("item_004", PREPARATION, "Price set", "price.sale_price",
                    d -> d.hasValue("price.sale_price"),
                    "Set the sale price and list price"),
            Rule.auto("item_005", PREPARATION, "Shipping information set", "shipping_info.free_shipping_threshold",
                    d -> d.hasValue("shipping_info.free_shipping_threshold"),
                    "Publish a free-shipping threshold"),
            Rule.manual("item_006", PREPARATION, "Stock management set",
                    "Confirm stock levels in the seller console"),
            Rule.auto("item_007", OPTIMIZATION, "Product page optimized", "images.detail_image_count",
                    d -> atLeast(d, "images.detail_image_count", 3),
                    "Add at least three detail images"),
            Rule.auto("item_010", OPTIMIZATION, "Customer reviews collected", "reviews.review_count",
                    d -> atLeast(d, "reviews.review_count", 10),
                    "Collect at least ten reviews"),
            Rule.auto("item_011", PROMOTION, "Promotion in use", "coupon_info.has_coupon",
                    d -> Boolean.TRUE.equals(d.get("coupon_info.has_coupon")),
                    "Offer a shop coupon or product discount"),
            Rule.auto("item_022", PROMOTION, "Product discount set", "price.original_price",
                    DefaultChecklistEvaluator::hasDiscount,
                    "Show the list price next to the discounted price"),
            Rule.manual("item_012", PROMOTION, "Advertising strategy planned",
                    "Review the available advertising products")
    );

    private static final List<Rule> COLLECTION_RULES = List.of(
            Rule.auto("item_001", PREPARATION, "Shop registered", "shop_name",
                    d -> d.hasValue("shop_name"),
                    "Complete the shop profile"),
            Rule.auto("item_003", PREPARATION, "Product lineup published", "shop.product_count",
                    d -> atLeast(d, "shop.product_count", 10),
                    "List at least ten products"),
            Rule.auto("item_021", PROMOTION, "Shop coupon set", "coupon_info.has_coupon",
                    d -> Boolean.TRUE.equals(d.get("coupon_info.has_coupon")),
                    "Issue a shop coupon"),
            Rule.manual("item_012", PROMOTION, "Advertising strategy planned",
                    "Review the available advertising products")
    );

    @Override
    public ChecklistOutput evaluate(JobKind kind, HarvestedData data, AnalysisOutput analysis) {
        List<Rule> rules = kind == JobKind.COLLECTION ? COLLECTION_RULES : SINGLE_ITEM_RULES;

        List<ChecklistItem> items = new ArrayList<>();
        int completed = 0;
        for (Rule rule : rules) {
            boolean done = rule.check != null && rule.check.test(data);
            if (done) completed++;
            items.add(ChecklistItem.builder()
                    .id(rule.id)
                    .category(rule.category)
                    .title(rule.title)
                    .status(done ? ChecklistItem.Status.COMPLETED : ChecklistItem.Status.PENDING)
                    .autoChecked(rule.check != null)
                    .backingField(rule.backingField)
                    .recommendation(done ? null : rule.recommendation)
                    .build());
        }

        int completionRate = (int) Math.round(100.0 * completed / rules.size());
        log.debug("Checklist for {}: {}/{} completed", data.getSourceRef(), completed, rules.size());
        return new ChecklistOutput(completionRate, items);
    }

    private static boolean atLeast(HarvestedData data, String field, int minimum) {
        BigDecimal value = ValueNormalizer.toNumber(data.get(field));
        return value != null && value.compareTo(BigDecimal.valueOf(minimum)) >= 0;
    }

    private static boolean hasDiscount(HarvestedData data) {
        BigDecimal original = ValueNormalizer.toNumber(data.get("price.original_price"));
        BigDecimal sale = ValueNormalizer.toNumber(data.get("price.sale_price"));
        return original != null && sale != null && original.compareTo(sale) > 0;
    }

    private static final class Rule {
        final String id;
        final String category;
        final String title;
        final String backingField;
        final Predicate<HarvestedData> check;
        final String recommendation;

        private Rule(String id, String category, String title, String backingField,
                     Predicate<HarvestedData> check, String recommendation) {
            this.id = id;
            this.category = category;
            this.title = title;
            this.backingField = backingField;
            this.check = check;
            this.recommendation = recommendation;
        }

        static Rule auto(String id, String category, String title, String backingField,
                         Predicate<HarvestedData> check, String recommendation) {
            return new Rule(id, category, title, backingField, check, recommendation);
        }

        static Rule manual(String id, String category, String title, String recommendation) {
            return new Rule(id, category, title, null, null, recommendation);
        }
    }
}
