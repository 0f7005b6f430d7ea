package com.storefront.scraper.service;

import com.storefront.scraper.config.StorefrontProperties;
import com.storefront.scraper.model.BrandInsights;
import com.storefront.scraper.model.Product;
import com.storefront.scraper.service.core.ExtractionEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BrandInsightsServiceTest {

    @Mock
    private ExtractionEngine engine;

    private BrandInsightsService service;

    @BeforeEach
    void setUp() {
        StorefrontProperties props = new StorefrontProperties();
        props.getExtraction().setDeadline(Duration.ofMillis(200));
        service = new BrandInsightsService(engine, props);
    }

    @Test
    void normalizesUrlBeforeExtracting() {
        BrandInsights insights = insights(List.of(new Product("1", "Tee", "https://shop.example/products/tee", null, "1", "")));
        when(engine.extract("https://shop.example")).thenReturn(Mono.just(insights));

        assertThat(service.fetchInsights(" shop.example/ ")).isSameAs(insights);
        verify(engine).extract("https://shop.example");
    }

    @Test
    void emptyCatalogMeansNotAStorefront() {
        when(engine.extract("https://shop.example")).thenReturn(Mono.just(insights(List.of())));

        assertThatThrownBy(() -> service.fetchInsights("https://shop.example"))
                .isInstanceOf(StorefrontNotFoundException.class)
                .hasMessageContaining("https://shop.example");
    }

    @Test
    void noResultMeansNotAStorefront() {
        when(engine.extract("https://shop.example")).thenReturn(Mono.empty());

        assertThatThrownBy(() -> service.fetchInsights("https://shop.example"))
                .isInstanceOf(StorefrontNotFoundException.class);
    }

    @Test
    void deadlineBoundsTheWholeRun() {
        when(engine.extract("https://shop.example")).thenReturn(Mono.never());

        assertThatThrownBy(() -> service.fetchInsights("https://shop.example"))
                .isInstanceOf(IllegalStateException.class);
    }

    private static BrandInsights insights(final List<Product> catalog) {
        return new BrandInsights(catalog, List.of(), List.of(), List.of(), List.of(), List.of(), null, List.of());
    }
}
