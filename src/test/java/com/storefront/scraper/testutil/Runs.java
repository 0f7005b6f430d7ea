package com.storefront.scraper.testutil;

import com.storefront.scraper.service.core.ExtractionRun;

/** Shortcuts for building runs against the test storefront. */
public final class Runs {

    public static final String BASE = "https://shop.example";

    private Runs() {
    }

    public static ExtractionRun run(final StubPageFetcher fetcher) {
        return new ExtractionRun(BASE, fetcher);
    }

    public static ExtractionRun homepage(final String html) {
        return run(new StubPageFetcher().page(BASE, html));
    }
}
