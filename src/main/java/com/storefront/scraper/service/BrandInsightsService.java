package com.storefront.scraper.service;

import com.storefront.scraper.config.StorefrontProperties;
import com.storefront.scraper.model.BrandInsights;
import com.storefront.scraper.parser.StorefrontUrls;
import com.storefront.scraper.service.core.ExtractionEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Entry point used by the REST layer: normalises the URL, runs the
 * extraction engine within the configured deadline and rejects targets
 * that expose no product catalog.
 */
@Service
@Slf4j
public class BrandInsightsService {

    private final ExtractionEngine engine;

    private final Duration deadline;

    public BrandInsightsService(final ExtractionEngine engine, final StorefrontProperties props) {
        this.engine = engine;
        this.deadline = props.getExtraction().getDeadline();
    }

    /**
     * @param websiteUrl storefront URL as supplied by the client
     * @return the assembled insights
     * @throws StorefrontNotFoundException if the product catalog came back empty
     * @throws IllegalStateException       if the deadline elapsed
     */
    public BrandInsights fetchInsights(final String websiteUrl) {
        String baseUrl = StorefrontUrls.normalizeBase(websiteUrl);
        log.info("Fetching insights for {}", baseUrl);

        BrandInsights insights = engine.extract(baseUrl).block(deadline);

        if (insights == null || insights.productCatalog().isEmpty()) {
            log.error("No products found or website not accessible: {}", baseUrl);
            throw new StorefrontNotFoundException(baseUrl);
        }
        return insights;
    }
}
