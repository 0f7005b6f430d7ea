package com.storefront.scraper.service.fetch;

import reactor.core.publisher.Mono;

/**
 * Issues a GET against a storefront and reports either the page or nothing.
 * <p>
 * Implementations own timeouts and retries. The returned {@link Mono}
 * <strong>never errors</strong>: an unavailable page is an empty completion,
 * which callers treat as absence of data.
 * </p>
 */
@FunctionalInterface
public interface PageFetcher {

    /**
     * @param url absolute URL to GET
     * @return the page on HTTP 200, otherwise an empty {@link Mono}
     */
    Mono<FetchedPage> fetch(String url);

}
