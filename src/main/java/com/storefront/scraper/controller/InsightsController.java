package com.storefront.scraper.controller;

import com.storefront.scraper.dto.InsightsRequest;
import com.storefront.scraper.model.BrandInsights;
import com.storefront.scraper.service.BrandInsightsService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller exposing the storefront insights run.
 * <p>
 * Endpoint: <code>POST /api/insights</code><br>
 * Consumes: <code>application/json</code><br>
 * Produces: <code>application/json</code>
 * </p>
 *
 * <h3>Example Request</h3>
 * <pre>{@code
 * POST /api/insights
 * Content-Type: application/json
 *
 * { "website_url": "https://memy.co.in" }
 * }</pre>
 *
 * <h3>Example Response</h3>
 * <pre>{@code
 * {
 *   "product_catalog": [ { "id": "1", "title": "Tee", "url": "https://memy.co.in/products/tee", ... } ],
 *   "hero_products":   [ ... ],
 *   "policies":        [ { "type": "refund", "url": "...", "content": "..." } ],
 *   "faqs":            [ { "question": "...", "answer": "..." } ],
 *   "social_handles":  [ { "platform": "instagram", "url": "..." } ],
 *   "contact_details": [ { "type": "email", "value": "hi@memy.co.in" } ],
 *   "brand_text":      "...",
 *   "important_links": [ { "name": "Track order", "url": "..." } ]
 * }
 * }</pre>
 */
@RestController
@RequiredArgsConstructor
public class InsightsController {

    private final BrandInsightsService insightsService;

    @GetMapping(path = "/", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> root() {
        return Map.of("message", "Storefront insights fetcher is running.");
    }

    /**
     * Runs a full extraction for the given storefront.
     *
     * @param request the {@link InsightsRequest} holding {@code website_url}
     * @return the normalised {@link BrandInsights}
     */
    @PostMapping(path = "/api/insights",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public BrandInsights fetchInsights(@RequestBody @Validated final InsightsRequest request) {
        return insightsService.fetchInsights(request.websiteUrl());
    }
}
