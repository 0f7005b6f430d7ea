package com.storefront.scraper.service.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.storefront.scraper.model.RawRecord;

import java.util.List;

/**
 * The eight raw category results of one run, before normalisation.
 *
 * @param productCatalog elements of the {@code products} array, verbatim
 * @param brandText      brand description, {@code null} when none was found
 */
public record RawInsights(String baseUrl,
                          List<JsonNode> productCatalog,
                          List<RawRecord> heroProducts,
                          List<RawRecord> policies,
                          List<RawRecord> faqs,
                          List<RawRecord> socialHandles,
                          List<RawRecord> contactDetails,
                          String brandText,
                          List<RawRecord> importantLinks) {
}
