package com.storefront.scraper.service.fetch;

/**
 * A successful (HTTP 200) storefront response.
 *
 * @param url  the absolute URL that was requested
 * @param body response body decoded as text, never {@code null}
 */
public record FetchedPage(String url, String body) {
}
