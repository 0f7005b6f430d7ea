package com.storefront.scraper.model;

/**
 * @param platform lower-case platform key (e.g. {@code instagram}), {@code ""} if unknown
 * @param url      the profile link as found on the page
 */
public record SocialHandle(String platform, String url) {
}
