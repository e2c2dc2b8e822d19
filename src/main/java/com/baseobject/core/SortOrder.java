package com.baseobject.core;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Order of field names in a projected mapping.
 */
public enum SortOrder {

    NONE,
    ASCENDING,
    DESCENDING;

    /**
     * Returns the mapping rearranged in this order. {@link #NONE} keeps insertion order.
     */
    public Map<String, Object> arrange(Map<String, Object> mapping) {
        if (this == NONE) {
            return mapping;
        }
        Comparator<String> order = this == ASCENDING ? Comparator.naturalOrder() : Comparator.reverseOrder();
        Map<String, Object> arranged = new LinkedHashMap<>();
        mapping.entrySet().stream()
                .sorted(Map.Entry.comparingByKey(order))
                .forEach(entry -> arranged.put(entry.getKey(), entry.getValue()));
        return arranged;
    }
}
