package com.storefront.scraper.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * <h2>Resilience4j Configuration</h2>
 *
 * <p>
 * Defines the retry policy applied to every storefront GET. The policy is
 * built from {@link StorefrontProperties.Fetch} so timeouts, attempts and
 * backoff live in <code>application.yml</code> rather than in code.
 * </p>
 */
@Configuration
public class Resilience4jConfig {

    /** Name of the retry instance wrapped around storefront fetches. */
    public static final String STOREFRONT_FETCH = "storefrontFetch";

    /**
     * Creates the global {@link RetryRegistry} whose default configuration is
     * the storefront fetch policy.
     *
     * @param props bound storefront properties
     * @return a registry pre‐populated with the storefront retry configuration
     */
    @Bean
    public RetryRegistry retryRegistry(final StorefrontProperties props) {
        return RetryRegistry.of(fetchRetryConfig(props.getFetch()));
    }

    /**
     * Defines the named {@link Retry} used by the page fetcher.
     *
     * @param registry the global {@link RetryRegistry} to pull from
     * @return a {@link Retry} configured under the name "storefrontFetch"
     */
    @Bean
    public Retry storefrontFetchRetry(final RetryRegistry registry) {
        return registry.retry(STOREFRONT_FETCH);
    }

    /**
     * Linear backoff: the wait before retry n is {@code n * backoff}
     * (0.5s, 1.0s, 1.5s… with the defaults). Every exception counts as a
     * failed attempt; the fetcher turns non-200 statuses into exceptions
     * before they reach the retry.
     *
     * @param fetch fetch settings
     * @return retry configuration with {@code maxRetries + 1} total attempts
     */
    public static RetryConfig fetchRetryConfig(final StorefrontProperties.Fetch fetch) {
        Duration step = fetch.getBackoff();
        return RetryConfig.custom()
                .maxAttempts(fetch.getMaxRetries() + 1)
                .intervalFunction(IntervalFunction.of(step, previous -> previous + step.toMillis()))
                .build();
    }

}
