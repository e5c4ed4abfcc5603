package com.adlanda.citedsearch.repository;

import com.adlanda.citedsearch.model.Chunk;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Conjunction of metadata equality constraints.
 *
 * @param equalities Metadata key to required value
 */
public record MetadataFilter(Map<String, String> equalities) {

    private static final MetadataFilter NONE = new MetadataFilter(Map.of());

    public MetadataFilter {
        equalities = Collections.unmodifiableMap(new LinkedHashMap<>(equalities));
    }

    public static MetadataFilter none() {
        return NONE;
    }

    /**
     * Builds the search filter: {@code filename == fileFilter} and/or
     * {@code product_category == categoryFilter}. Null arguments add no constraint.
     */
    public static MetadataFilter of(String fileFilter, String categoryFilter) {
        Map<String, String> equalities = new LinkedHashMap<>();
        if (fileFilter != null) {
            equalities.put(Chunk.FILENAME, fileFilter);
        }
        if (categoryFilter != null) {
            equalities.put(Chunk.PRODUCT_CATEGORY, categoryFilter);
        }
        return equalities.isEmpty() ? NONE : new MetadataFilter(equalities);
    }

    public boolean isEmpty() {
        return equalities.isEmpty();
    }

    public boolean matches(Map<String, Object> metadata) {
        for (Map.Entry<String, String> equality : equalities.entrySet()) {
            Object value = metadata.get(equality.getKey());
            if (value == null || !Objects.equals(value.toString(), equality.getValue())) {
                return false;
            }
        }
        return true;
    }
}
