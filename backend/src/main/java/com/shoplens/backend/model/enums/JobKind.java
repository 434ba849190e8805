package com.shoplens.backend.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import java.net.URI;
import java.util.Locale;
import lombok.Getter;

@Getter
public enum JobKind {
    SINGLE_ITEM("single-item"),
    COLLECTION("collection");

    private final String key;

    JobKind(String key) {
        this.key = key;
    }

    @JsonValue
    public String toJson() {
        return key;
    }

    /**
     * Detect the kind of page from its URL path. Product pages map to
     * single-item, storefront pages to collection.
     */
    public static JobKind fromUrl(String url) {
        if (url == null) return null;
        String path;
        try {
            path = URI.create(url.trim()).getPath();
        } catch (IllegalArgumentException e) {
            return null;
        }
        if (path == null) return null;

        String lower = path.toLowerCase(Locale.ROOT);
        if (lower.contains("/goods/goods.aspx") || lower.contains("/goods/") || lower.contains("/item/")) {
            return SINGLE_ITEM;
        }
        if (lower.contains("/shop/")) {
            return COLLECTION;
        }
        return null;
    }

    /**
     * Find JobKind by its key or enum name (case-insensitive)
     */
    public static JobKind fromName(String name) {
        if (name == null) return null;
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (JobKind kind : values()) {
            if (kind.key.equals(normalized)) {
                return kind;
            }
        }
        return null;
    }
}
