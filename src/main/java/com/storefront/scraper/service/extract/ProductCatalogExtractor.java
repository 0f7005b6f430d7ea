package com.storefront.scraper.service.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storefront.scraper.service.core.CategoryExtractor;
import com.storefront.scraper.service.core.ExtractionRun;
import com.storefront.scraper.service.fetch.FetchedPage;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the storefront's public product feed at <code>/products.json</code>
 * and returns the elements of its {@code products} array untouched.
 * <p>
 * A missing feed, a body that is not JSON or a document without a
 * {@code products} array all yield an empty list.
 * </p>
 */
@Component
@Slf4j
public class ProductCatalogExtractor extends CategoryExtractor<List<JsonNode>> {

    static final String PRODUCTS_PATH = "/products.json";

    private final ObjectMapper mapper;

    public ProductCatalogExtractor(@Qualifier("scraperObjectMapper") final ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public String category() {
        return "product catalog";
    }

    @Override
    protected Mono<List<JsonNode>> doExtract(final ExtractionRun run) {
        return run.fetch(PRODUCTS_PATH).map(this::parseProducts);
    }

    @Override
    protected List<JsonNode> empty() {
        return List.of();
    }

    List<JsonNode> parseProducts(final FetchedPage page) {
        if (StringUtils.isBlank(page.body())) {
            log.warn("Empty product catalog body for {}", page.url());
            return List.of();
        }
        JsonNode products;
        try {
            products = mapper.readTree(page.body()).path("products");
        } catch (JsonProcessingException e) {
            log.error("Error parsing product catalog JSON for {}: {}", page.url(), e.getOriginalMessage());
            return List.of();
        }
        if (!products.isArray()) {
            log.warn("No products array in {}", page.url());
            return List.of();
        }
        List<JsonNode> out = new ArrayList<>(products.size());
        products.forEach(out::add);
        return out;
    }
}
