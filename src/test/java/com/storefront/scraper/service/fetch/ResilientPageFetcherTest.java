package com.storefront.scraper.service.fetch;

import com.storefront.scraper.config.Resilience4jConfig;
import com.storefront.scraper.config.StorefrontProperties;
import io.github.resilience4j.retry.Retry;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.ConnectException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;

class ResilientPageFetcherTest {

    private static final String URL = "https://shop.example/products.json";

    private static final Duration STEP = Duration.ofMillis(20);

    private final AtomicInteger calls = new AtomicInteger();

    private final Deque<Supplier<Mono<ClientResponse>>> responses = new ArrayDeque<>();

    private final List<Duration> waits = new ArrayList<>();

    @Test
    void returnsFirstOkResponseWithoutWaiting() {
        responses.add(() -> ok("{\"products\":[]}"));

        StepVerifier.create(fetcher(2).fetch(URL))
                .assertNext(page -> {
                    assertThat(page.url()).isEqualTo(URL);
                    assertThat(page.body()).isEqualTo("{\"products\":[]}");
                })
                .verifyComplete();

        assertThat(calls).hasValue(1);
        assertThat(waits).isEmpty();
    }

    @Test
    void retriesFailuresWithLinearBackoffThenReturnsOk() {
        responses.add(() -> status(HttpStatus.SERVICE_UNAVAILABLE));
        responses.add(() -> Mono.error(new ConnectException("Connection refused")));
        responses.add(() -> status(HttpStatus.NOT_FOUND));
        responses.add(() -> ok("<html>home</html>"));

        StepVerifier.create(fetcher(3).fetch(URL))
                .assertNext(page -> assertThat(page.body()).isEqualTo("<html>home</html>"))
                .verifyComplete();

        assertThat(calls).hasValue(4);
        assertThat(waits).containsExactly(STEP, STEP.multipliedBy(2), STEP.multipliedBy(3));
    }

    @Test
    void completesEmptyWhenEveryAttemptFails() {
        for (int i = 0; i < 5; i++) {
            responses.add(() -> status(HttpStatus.INTERNAL_SERVER_ERROR));
        }

        StepVerifier.create(fetcher(2).fetch(URL))
                .verifyComplete();

        assertThat(calls).hasValue(3);
        assertThat(waits).containsExactly(STEP, STEP.multipliedBy(2));
    }

    @Test
    void treatsRedirectStatusAsFailedAttempt() {
        responses.add(() -> status(HttpStatus.MOVED_PERMANENTLY));
        responses.add(() -> ok("moved"));

        StepVerifier.create(fetcher(2).fetch(URL))
                .assertNext(page -> assertThat(page.body()).isEqualTo("moved"))
                .verifyComplete();

        assertThat(calls).hasValue(2);
    }

    @Test
    void timesOutSlowAttempts() {
        responses.add(Mono::never);
        responses.add(Mono::never);

        StorefrontProperties props = new StorefrontProperties();
        props.getFetch().setTimeout(Duration.ofMillis(50));

        StepVerifier.create(fetcher(1, props).fetch(URL))
                .verifyComplete();

        assertThat(calls).hasValue(2);
    }

    @Test
    void emptyBodyIsAnEmptyPage() {
        responses.add(() -> Mono.just(ClientResponse.create(HttpStatus.OK).build()));

        StepVerifier.create(fetcher(0).fetch(URL))
                .assertNext(page -> assertThat(page.body()).isEmpty())
                .verifyComplete();
    }

    private ResilientPageFetcher fetcher(final int maxRetries) {
        StorefrontProperties props = new StorefrontProperties();
        props.getFetch().setTimeout(Duration.ofSeconds(2));
        return fetcher(maxRetries, props);
    }

    private ResilientPageFetcher fetcher(final int maxRetries, final StorefrontProperties props) {
        props.getFetch().setMaxRetries(maxRetries);
        props.getFetch().setBackoff(STEP);

        Retry retry = Retry.of("test", Resilience4jConfig.fetchRetryConfig(props.getFetch()));
        retry.getEventPublisher().onRetry(event -> waits.add(event.getWaitInterval()));

        WebClient client = WebClient.builder()
                .exchangeFunction(request -> {
                    calls.incrementAndGet();
                    Supplier<Mono<ClientResponse>> next = responses.poll();
                    return next == null ? status(HttpStatus.GONE) : next.get();
                })
                .build();
        return new ResilientPageFetcher(client, retry, props);
    }

    private static Mono<ClientResponse> ok(final String body) {
        return Mono.just(ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, "text/html; charset=utf-8")
                .body(body)
                .build());
    }

    private static Mono<ClientResponse> status(final HttpStatus status) {
        return Mono.just(ClientResponse.create(status).build());
    }
}
