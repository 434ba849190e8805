package com.shoplens.backend.analysis;

import com.shoplens.backend.crawling.HarvestedData;
import com.shoplens.backend.job.output.AnalysisOutput;
import com.shoplens.backend.model.enums.JobKind;
import com.shoplens.backend.validation.ValueNormalizer;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Default scoring: a handful of per-section heuristics averaged into an
 * overall score.
 */
@Service
@Slf4j
public class HeuristicAnalysisEngine implements AnalysisEngine {

    private static final BigDecimal MIN_PRICE = BigDecimal.valueOf(100);
    private static final BigDecimal MAX_PRICE = BigDecimal.valueOf(1_000_000);

    @Override
    public AnalysisOutput analyze(JobKind kind, HarvestedData data) {
        AnalysisOutput output = kind == JobKind.COLLECTION ? analyzeCollection(data) : analyzeSingleItem(data);
        log.info("Analyzed {} ({}): overall score {}", data.getSourceRef(), kind.getKey(), output.getOverallScore());
        return output;
    }

    private AnalysisOutput analyzeSingleItem(HarvestedData data) {
        Map<String, Object> fields = new LinkedHashMap<>();
        Map<String, Integer> sections = new LinkedHashMap<>();

        Object name = data.get("product_name");
        fields.put("product_analysis.product_name", name == null ? null : ValueNormalizer.toText(name));
        int nameLength = name == null ? 0 : name.toString().trim().length();
        sections.put("seo_analysis", nameLength >= 20 && nameLength <= 100 ? 80 : nameLength > 0 ? 50 : 0);

        BigDecimal sale = validPrice(data.get("price.sale_price"));
        BigDecimal original = validPrice(data.get("price.original_price"));
        int discount = 0;
        if (sale != null && original != null && original.compareTo(sale) > 0) {
            discount = original.subtract(sale)
                    .multiply(BigDecimal.valueOf(100))
                    .divide(original, 0, RoundingMode.DOWN)
                    .intValue();
        }
        fields.put("product_analysis.price_analysis.sale_price", sale);
        fields.put("product_analysis.price_analysis.original_price", original);
        fields.put("product_analysis.price_analysis.discount_rate", discount);
        sections.put("price_analysis", priceScore(sale, discount));

        BigDecimal reviewCount = ValueNormalizer.toNumber(data.get("reviews.review_count"));
        BigDecimal rating = ValueNormalizer.toNumber(data.get("reviews.rating"));
        fields.put("product_analysis.review_analysis.review_count", reviewCount == null ? null : reviewCount.intValue());
        fields.put("product_analysis.review_analysis.rating", rating);
        sections.put("review_analysis", reviewScore(rating, reviewCount == null ? 0 : reviewCount.intValue()));

        BigDecimal imageCount = ValueNormalizer.toNumber(data.get("images.detail_image_count"));
        int images = imageCount == null ? 0 : imageCount.intValue();
        fields.put("product_analysis.image_analysis.image_count", images);
        sections.put("image_analysis", images >= 5 ? 90 : images >= 3 ? 70 : images > 0 ? 40 : 0);

        Object description = data.get("description");
        int descriptionLength = description == null ? 0 : description.toString().trim().length();
        sections.put("description_analysis", descriptionLength >= 500 ? 80 : descriptionLength >= 200 ? 60 : descriptionLength > 0 ? 30 : 0);

        return AnalysisOutput.builder()
                .overallScore(average(sections))
                .sectionScores(sections)
                .resultFields(fields)
                .build();
    }

    private AnalysisOutput analyzeCollection(HarvestedData data) {
        Map<String, Object> fields = new LinkedHashMap<>();
        Map<String, Integer> sections = new LinkedHashMap<>();

        Object shopName = data.get("shop_name");
        fields.put("shop_analysis.shop_name", shopName == null ? null : ValueNormalizer.toText(shopName));
        fields.put("shop_analysis.level", data.get("shop.level"));
        sections.put("shop_info", shopName == null ? 0 : data.hasValue("shop.level") ? 80 : 60);

        BigDecimal productCount = ValueNormalizer.toNumber(data.get("shop.product_count"));
        int products = productCount == null ? 0 : productCount.intValue();
        fields.put("shop_analysis.product_count", productCount == null ? null : products);
        sections.put("product_lineup", products >= 50 ? 90 : products >= 10 ? 70 : products > 0 ? 40 : 0);

        List<BigDecimal> prices = data.getItems().stream()
                .map(item -> validPrice(item.get("price")))
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
        BigDecimal averagePrice = prices.isEmpty() ? null : prices.stream()
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .divide(BigDecimal.valueOf(prices.size()), 0, RoundingMode.HALF_UP);
        fields.put("shop_analysis.average_price", averagePrice);
        sections.put("pricing", prices.isEmpty() ? 0 : 70);

        boolean hasCoupon = Boolean.TRUE.equals(data.get("coupon_info.has_coupon"));
        fields.put("shop_analysis.has_coupon", hasCoupon);
        sections.put("promotion", hasCoupon ? 80 : 40);

        return AnalysisOutput.builder()
                .overallScore(average(sections))
                .sectionScores(sections)
                .resultFields(fields)
                .build();
    }

    private static BigDecimal validPrice(Object value) {
        BigDecimal price = ValueNormalizer.toNumber(value);
        if (price == null || price.compareTo(MIN_PRICE) < 0 || price.compareTo(MAX_PRICE) > 0) {
            return null;
        }
        return price.setScale(0, RoundingMode.HALF_UP);
    }

    private static int priceScore(BigDecimal sale, int discount) {
        if (sale == null) return 0;
        int score = 70;
        if (discount >= 10 && discount <= 30) {
            score += 20;
        } else if (discount > 30) {
            score -= 10;
        } else if (discount > 0) {
            score += 10;
        }
        // 9,800 rather than 10,000
        if (sale.remainder(BigDecimal.valueOf(1000)).compareTo(BigDecimal.valueOf(100)) < 0) {
            score += 10;
        }
        return Math.min(100, score);
    }

    private static int reviewScore(BigDecimal rating, int reviewCount) {
        int score = 0;
        double value = rating == null ? 0.0 : rating.doubleValue();
        if (value >= 4.5) score += 40;
        else if (value >= 4.0) score += 30;
        else if (value >= 3.5) score += 20;
        else if (value > 0) score += 10;

        if (reviewCount >= 50) score += 30;
        else if (reviewCount >= 20) score += 25;
        else if (reviewCount >= 10) score += 20;
        else if (reviewCount > 0) score += 10;
        return Math.min(100, score);
    }

    private static int average(Map<String, Integer> sections) {
        return (int) Math.round(sections.values().stream().mapToInt(Integer::intValue).average().orElse(0));
    }
}
