package com.storefront.scraper.parser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * First-occurrence-wins de-duplication that keeps insertion order.
 */
public final class Dedup {

    private Dedup() {
    }

    /**
     * Entries whose key is {@code null} are never treated as duplicates of
     * each other.
     *
     * @param items input list
     * @param key   natural key extractor
     * @param <T>   element type
     * @param <K>   key type
     * @return a new list with one entry per distinct non-null key
     */
    public static <T, K> List<T> firstBy(final List<T> items, final Function<T, K> key) {
        Set<K> seen = new HashSet<>();
        List<T> out = new ArrayList<>(items.size());
        for (T item : items) {
            K k = key.apply(item);
            if (k == null || seen.add(k)) {
                out.add(item);
            }
        }
        return out;
    }
}
