package com.storefront.scraper.service.core;

import com.storefront.scraper.testutil.Runs;
import com.storefront.scraper.testutil.StubPageFetcher;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.function.Supplier;

class CategoryExtractorTest {

    private final ExtractionRun run = Runs.run(new StubPageFetcher());

    @Test
    void passesResultThrough() {
        StepVerifier.create(extractor(() -> Mono.just(List.of("a", "b"))).extract(run))
                .expectNext(List.of("a", "b"))
                .verifyComplete();
    }

    @Test
    void errorSignalBecomesEmptyResult() {
        StepVerifier.create(extractor(() -> Mono.error(new IllegalStateException("broken markup"))).extract(run))
                .expectNext(List.of())
                .verifyComplete();
    }

    @Test
    void exceptionThrownWhileAssemblingBecomesEmptyResult() {
        StepVerifier.create(extractor(() -> {
                    throw new NullPointerException("bug");
                }).extract(run))
                .expectNext(List.of())
                .verifyComplete();
    }

    @Test
    void emptyCompletionBecomesEmptyResult() {
        StepVerifier.create(extractor(Mono::empty).extract(run))
                .expectNext(List.of())
                .verifyComplete();
    }

    @Test
    void homepageParseFailureIsIsolated() {
        HomepageExtractor<List<String>> failing = new HomepageExtractor<>() {
            @Override
            public String category() {
                return "failing";
            }

            @Override
            protected List<String> empty() {
                return List.of();
            }

            @Override
            protected List<String> parse(final Document homepage, final String baseUrl) {
                throw new IllegalArgumentException("unexpected layout");
            }
        };

        StepVerifier.create(failing.extract(Runs.homepage("<html><body>hi</body></html>")))
                .expectNext(List.of())
                .verifyComplete();
    }

    private static CategoryExtractor<List<String>> extractor(final Supplier<Mono<List<String>>> body) {
        return new CategoryExtractor<>() {
            @Override
            public String category() {
                return "test";
            }

            @Override
            protected Mono<List<String>> doExtract(final ExtractionRun run) {
                return body.get();
            }

            @Override
            protected List<String> empty() {
                return List.of();
            }
        };
    }
}
