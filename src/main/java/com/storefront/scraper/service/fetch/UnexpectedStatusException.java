package com.storefront.scraper.service.fetch;

import lombok.Getter;

/**
 * Signals a response whose status was anything but 200. Raised inside the
 * fetcher so the retry policy treats it like a transport failure.
 */
@Getter
public class UnexpectedStatusException extends RuntimeException {

    private final int status;

    public UnexpectedStatusException(final String url, final int status) {
        super("HTTP " + status + " for " + url);
        this.status = status;
    }
}
