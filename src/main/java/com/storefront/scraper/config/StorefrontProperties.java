package com.storefront.scraper.config;

import lombok.Data;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

/**
 * Binds storefront scraping configuration from <code>application.yml</code>
 * under the <code>storefront</code> prefix.
 * <p>
 * Example YAML:
 * <pre>{@code
 * storefront:
 *   fetch:
 *     timeout: 8s
 *     max-retries: 2
 *     backoff: 500ms
 *   extraction:
 *     deadline: 60s
 * }</pre>
 */
@ConfigurationProperties(prefix = "storefront")
@Getter
@Setter
public class StorefrontProperties {

    /**
     * Outbound HTTP behaviour shared by every category extractor.
     */
    private Fetch fetch = new Fetch();

    /**
     * Settings applied by the orchestrator around one complete run.
     */
    private Extraction extraction = new Extraction();

    @Data
    public static class Fetch {

        /** Upper bound for a single GET attempt. */
        private Duration timeout = Duration.ofSeconds(8);

        /** Retries after the first attempt, so {@code maxRetries + 1} tries in total. */
        private int maxRetries = 2;

        /** Linear backoff step: the wait before retry n is {@code n * backoff}. */
        private Duration backoff = Duration.ofMillis(500);

        /** TCP connect timeout on the Netty client. */
        private Duration connectTimeout = Duration.ofSeconds(5);

        /** Largest response body buffered in memory (products.json can be big). */
        private DataSize maxInMemorySize = DataSize.ofMegabytes(10);

        /** Sent on every request; some storefront CDNs reject bare client UAs. */
        private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) "
                + "AppleWebKit/537.36 (KHTML, like Gecko) "
                + "Chrome/125.0.0.0 Safari/537.36";
    }

    @Data
    public static class Extraction {

        /** Wall-clock bound for the whole eight-way extraction. */
        private Duration deadline = Duration.ofSeconds(60);
    }
}
