package com.storefront.scraper.model;

public record ImportantLink(String name, String url) {
}
