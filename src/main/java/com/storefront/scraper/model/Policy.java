package com.storefront.scraper.model;

/**
 * One store policy page.
 *
 * @param type    {@code privacy}, {@code refund}, {@code shipping} or {@code terms}
 * @param url     the page it was read from
 * @param content visible text of the page, one text node per line
 */
public record Policy(String type, String url, String content) {
}
