package com.storefront.scraper.service.extract;

import com.storefront.scraper.config.JacksonScraperConfig;
import com.storefront.scraper.testutil.Runs;
import com.storefront.scraper.testutil.StubPageFetcher;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import reactor.test.StepVerifier;

import java.util.List;

import static com.storefront.scraper.testutil.Runs.BASE;
import static org.assertj.core.api.Assertions.assertThat;

class ProductCatalogExtractorTest {

    private final ProductCatalogExtractor extractor =
            new ProductCatalogExtractor(JacksonScraperConfig.newScraperObjectMapper());

    @Test
    void returnsProductsArrayVerbatim() {
        StubPageFetcher fetcher = new StubPageFetcher().page(BASE + "/products.json",
                "{\"products\": [{\"id\": 1, \"title\": \"Tee\"}, {\"id\": 2, \"extra\": {\"a\": true}}]}");

        StepVerifier.create(extractor.extract(Runs.run(fetcher)))
                .assertNext(products -> {
                    assertThat(products).hasSize(2);
                    assertThat(products.get(0).path("title").asText()).isEqualTo("Tee");
                    assertThat(products.get(1).path("extra").path("a").asBoolean()).isTrue();
                })
                .verifyComplete();
    }

    @Test
    void keepsDecimalPricesAsWritten() {
        StubPageFetcher fetcher = new StubPageFetcher().page(BASE + "/products.json",
                "{\"products\": [{\"variants\": [{\"price\": 19.90}]}]}");

        StepVerifier.create(extractor.extract(Runs.run(fetcher)))
                .assertNext(products -> assertThat(products.get(0).at("/variants/0/price").asText())
                        .isEqualTo("19.90"))
                .verifyComplete();
    }

    @ParameterizedTest
    @ValueSource(strings = {"not json at all", "{\"items\": []}", "{\"products\": {\"id\": 1}}", "[1, 2]", ""})
    void malformedOrUnexpectedPayloadIsEmptyAndNotRetried(final String body) {
        StubPageFetcher fetcher = new StubPageFetcher().page(BASE + "/products.json", body);

        StepVerifier.create(extractor.extract(Runs.run(fetcher)))
                .expectNextMatches(List::isEmpty)
                .verifyComplete();

        assertThat(fetcher.timesRequested(BASE + "/products.json")).isEqualTo(1);
    }

    @Test
    void unavailableFeedIsEmpty() {
        StepVerifier.create(extractor.extract(Runs.run(new StubPageFetcher())))
                .expectNextMatches(List::isEmpty)
                .verifyComplete();
    }
}
