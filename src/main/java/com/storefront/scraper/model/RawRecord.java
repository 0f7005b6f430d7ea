package com.storefront.scraper.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Loosely typed output of a category extractor, before normalisation.
 * <p>
 * A record is either {@link Structured} (named fields, as most heuristics
 * produce) or {@link Bare} (just a URL or a piece of text, as some fallback
 * strategies produce). Mappers resolve the two shapes once through
 * {@link #fold(Function, Function)}.
 * </p>
 */
public interface RawRecord {

    /**
     * @param structured mapping applied to a {@link Structured} record
     * @param bare       mapping applied to a {@link Bare} record
     * @param <T>        result type
     * @return the result of whichever mapping matches this record's shape
     */
    <T> T fold(Function<Structured, T> structured, Function<Bare, T> bare);

    static Structured of(final Map<String, ?> fields) {
        return new Structured(fields == null ? null : new LinkedHashMap<String, Object>(fields));
    }

    static Bare bare(final String value) {
        return new Bare(value);
    }

    /**
     * Field map, insertion ordered. Values are kept as produced; use
     * {@link #text(String)} to read them as strings.
     */
    record Structured(Map<String, Object> fields) implements RawRecord {

        public Structured {
            fields = fields == null
                    ? Map.of()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        /**
         * @param key field name
         * @return the field rendered as text, or {@code null} when absent
         */
        public String text(final String key) {
            Object v = fields.get(key);
            return v == null ? null : v.toString();
        }

        /**
         * @param key      field name
         * @param fallback value for a missing field
         * @return the field rendered as text, or {@code fallback}
         */
        public String text(final String key, final String fallback) {
            String v = text(key);
            return v == null ? fallback : v;
        }

        @Override
        public <T> T fold(final Function<Structured, T> structured, final Function<Bare, T> bare) {
            return structured.apply(this);
        }
    }

    /**
     * A record that is only a string (typically a URL).
     */
    record Bare(String value) implements RawRecord {

        @Override
        public <T> T fold(final Function<Structured, T> structured, final Function<Bare, T> bare) {
            return bare.apply(this);
        }
    }
}
