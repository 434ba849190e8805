package com.shoplens.backend.validation;

import com.shoplens.backend.model.enums.JobKind;
import java.util.List;
import lombok.Value;

/**
 * Fixed mapping from a harvested field to the result field that is expected
 * to carry the same value.
 */
@Value
public class FieldCorrespondence {

    public enum ValueType { NUMBER, TEXT }

    String harvestedField;
    String resultField;
    ValueType type;

    private static final List<FieldCorrespondence> SINGLE_ITEM = List.of(
            new FieldCorrespondence("product_name", "product_analysis.product_name", ValueType.TEXT),
            new FieldCorrespondence("price.sale_price", "product_analysis.price_analysis.sale_price", ValueType.NUMBER),
            new FieldCorrespondence("price.original_price", "product_analysis.price_analysis.original_price", ValueType.NUMBER),
            new FieldCorrespondence("reviews.review_count", "product_analysis.review_analysis.review_count", ValueType.NUMBER),
            new FieldCorrespondence("images.detail_image_count", "product_analysis.image_analysis.image_count", ValueType.NUMBER)
    );

    private static final List<FieldCorrespondence> COLLECTION = List.of(
            new FieldCorrespondence("shop_name", "shop_analysis.shop_name", ValueType.TEXT),
            new FieldCorrespondence("shop.product_count", "shop_analysis.product_count", ValueType.NUMBER)
    );

    public static List<FieldCorrespondence> forKind(JobKind kind) {
        return kind == JobKind.COLLECTION ? COLLECTION : SINGLE_ITEM;
    }
}
