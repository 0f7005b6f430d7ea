package com.storefront.scraper.model;

public record Faq(String question, String answer) {
}
