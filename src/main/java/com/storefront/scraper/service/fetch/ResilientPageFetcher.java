package com.storefront.scraper.service.fetch;

import com.storefront.scraper.config.StorefrontProperties;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * <h2>ResilientPageFetcher</h2>
 *
 * <p>{@link PageFetcher} on top of {@link WebClient} with a bounded timeout per
 * attempt and the Resilience4j {@code storefrontFetch} retry around it.</p>
 *
 * <ul>
 *   <li>HTTP 200 is returned immediately.</li>
 *   <li>Any other status, a connection failure or a timeout is one failed
 *       attempt; the retry waits {@code n * backoff} before attempt n + 1.</li>
 *   <li>Once attempts are exhausted the result is an empty {@link Mono};
 *       the error is logged, never propagated.</li>
 * </ul>
 *
 * <p>The body is not interpreted here. A malformed JSON payload is a 200 like
 * any other and is handled by whichever extractor asked for it.</p>
 */
@Component
@Slf4j
public class ResilientPageFetcher implements PageFetcher {

    private final WebClient client;

    private final Retry retry;

    private final Duration timeout;

    public ResilientPageFetcher(final WebClient storefrontWebClient,
                                final Retry storefrontFetchRetry,
                                final StorefrontProperties props) {
        this.client = storefrontWebClient;
        this.retry = storefrontFetchRetry;
        this.timeout = props.getFetch().getTimeout();
    }

    @Override
    public Mono<FetchedPage> fetch(final String url) {
        return Mono.defer(() -> {
            AtomicInteger attempt = new AtomicInteger();
            int maxAttempts = retry.getRetryConfig().getMaxAttempts();

            return Mono.defer(() -> {
                        attempt.incrementAndGet();
                        return getOnce(url);
                    })
                    .timeout(timeout)
                    .doOnError(ex -> log.warn("GET {} failed (attempt {}/{}): {}",
                            url, attempt.get(), maxAttempts, ex.toString()))
                    .transformDeferred(RetryOperator.of(retry))
                    .onErrorResume(ex -> {
                        log.error("Failed to fetch {} after {} attempts.", url, attempt.get());
                        return Mono.empty();
                    });
        });
    }

    private Mono<FetchedPage> getOnce(final String url) {
        return client.get()
                .uri(URI.create(url))
                .exchangeToMono(rsp -> toPage(url, rsp));
    }

    private static Mono<FetchedPage> toPage(final String url, final ClientResponse rsp) {
        int code = rsp.statusCode().value();
        if (code != HttpStatus.OK.value()) {
            return rsp.releaseBody()
                    .then(Mono.error(new UnexpectedStatusException(url, code)));
        }
        return rsp.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> new FetchedPage(url, body));
    }
}
