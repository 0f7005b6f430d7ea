package com.storefront.scraper.service;

/**
 * The target could not be read as a storefront: no product catalog was
 * reachable, so the rest of the extraction is not trusted.
 */
public class StorefrontNotFoundException extends RuntimeException {

    public StorefrontNotFoundException(final String url) {
        super("Website not found or no products available: " + url);
    }
}
