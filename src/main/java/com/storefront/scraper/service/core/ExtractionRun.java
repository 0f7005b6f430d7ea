package com.storefront.scraper.service.core;

import com.storefront.scraper.parser.StorefrontUrls;
import com.storefront.scraper.service.fetch.FetchedPage;
import com.storefront.scraper.service.fetch.PageFetcher;
import lombok.Getter;
import reactor.core.publisher.Mono;

/**
 * State owned by one extraction run against one storefront.
 * <p>
 * Holds the base URL and a memoised homepage: the first subscriber to
 * {@link #homepage()} triggers the GET, every later subscriber in the same run
 * replays that result (including "unavailable"). A new run means a new
 * instance and a fresh fetch; nothing is shared across runs.
 * </p>
 */
public final class ExtractionRun {

    @Getter
    private final String baseUrl;

    private final PageFetcher fetcher;

    private final Mono<String> homepage;

    /**
     * @param baseUrl storefront root without trailing slash
     * @param fetcher fetch layer used for every request of this run
     */
    public ExtractionRun(final String baseUrl, final PageFetcher fetcher) {
        this.baseUrl = baseUrl;
        this.fetcher = fetcher;
        this.homepage = Mono.defer(() -> fetcher.fetch(baseUrl))
                .map(FetchedPage::body)
                .cache();
    }

    /**
     * @return homepage HTML, or empty when the homepage is unavailable
     */
    public Mono<String> homepage() {
        return homepage;
    }

    /**
     * @param path path below the base URL, starting with {@code /}
     * @return the page, or empty when unavailable
     */
    public Mono<FetchedPage> fetch(final String path) {
        return Mono.defer(() -> fetcher.fetch(StorefrontUrls.join(baseUrl, path)));
    }
}
