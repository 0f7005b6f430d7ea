package com.storefront.scraper.parser;

import org.apache.commons.lang3.StringUtils;

/**
 * URL helpers for links found on storefront pages.
 */
public final class StorefrontUrls {

    private StorefrontUrls() {
    }

    /**
     * Keeps an absolute {@code href} as-is, otherwise appends it to the base.
     * Base URLs carry no trailing slash and shop links are root-relative, so
     * plain concatenation is enough.
     *
     * @param baseUrl storefront root, e.g. {@code https://shop.example}
     * @param href    raw attribute value
     * @return absolute URL
     */
    public static String resolve(final String baseUrl, final String href) {
        if (StringUtils.startsWithIgnoreCase(href, "http")) {
            return href;
        }
        return baseUrl + StringUtils.defaultString(href);
    }

    /**
     * @param baseUrl storefront root
     * @param path    path starting with {@code /}
     * @return {@code baseUrl + path}
     */
    public static String join(final String baseUrl, final String path) {
        return StringUtils.removeEnd(baseUrl, "/") + path;
    }

    /**
     * Canonical base form: trimmed, {@code https://} added when no scheme is
     * given, trailing slashes removed.
     *
     * @param url user supplied storefront URL
     * @return e.g. {@code https://shop.example}
     */
    public static String normalizeBase(final String url) {
        String base = StringUtils.trimToEmpty(url);
        if (!StringUtils.startsWithIgnoreCase(base, "http://")
                && !StringUtils.startsWithIgnoreCase(base, "https://")) {
            base = "https://" + base;
        }
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base;
    }
}
