package com.storefront.scraper.model;

/**
 * @param type  {@code email}, {@code phone} or {@code ""}
 * @param value the matched text
 */
public record ContactDetail(String type, String value) {
}
