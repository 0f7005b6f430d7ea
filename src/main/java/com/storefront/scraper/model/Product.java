package com.storefront.scraper.model;

/**
 * A product as seen either in the catalog feed or on the homepage.
 *
 * @param id          catalog id as text; {@code null} for hero products
 * @param title       display title, {@code ""} when unknown
 * @param url         absolute product page URL, {@code null} when it cannot be built
 * @param image       image URL, {@code null} when none was found
 * @param price       price of the first variant as text, {@code null} without variants
 * @param description raw {@code body_html} for catalog products, {@code null} for hero products
 */
public record Product(String id,
                      String title,
                      String url,
                      String image,
                      String price,
                      String description) {
}
