package com.storefront.scraper.service.core;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import reactor.core.publisher.Mono;

/**
 * A {@link CategoryExtractor} that only needs the storefront homepage.
 * The HTML comes from the run's memoised homepage, so any number of these
 * cost a single GET; each extractor parses its own {@link Document} because
 * Jsoup trees are mutable.
 *
 * @param <R> raw result type of the category
 */
public abstract class HomepageExtractor<R> extends CategoryExtractor<R> {

    @Override
    protected Mono<R> doExtract(final ExtractionRun run) {
        return run.homepage()
                .map(html -> parse(Jsoup.parse(html, run.getBaseUrl()), run.getBaseUrl()));
    }

    /**
     * @param homepage parsed homepage
     * @param baseUrl  storefront root, for resolving relative links
     * @return raw records for this category
     */
    protected abstract R parse(Document homepage, String baseUrl);
}
