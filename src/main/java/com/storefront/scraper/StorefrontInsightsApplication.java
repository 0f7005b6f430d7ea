package com.storefront.scraper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * The main entry point for the Storefront Insights scraper.
 *
 * <p>This Spring Boot application exposes a RESTful endpoint that takes a
 * storefront URL and returns a normalised snapshot of the brand:
 * <ul>
 *   <li>product catalog and homepage hero products,</li>
 *   <li>privacy / refund / shipping / terms policies,</li>
 *   <li>FAQs, social handles, contact details and important links,</li>
 *   <li>a short brand description.</li>
 * </ul>
 * It wires together a resilient {@code WebClient} fetch layer, eight
 * independent Jsoup heuristics and a normalisation mapper.</p>
 *
 * <p>Usage:
 * <pre>{@code
 *   // From the command line:
 *   mvn spring-boot:run
 *
 *   // Then:
 *   curl -X POST localhost:8080/api/insights \
 *        -H 'Content-Type: application/json' \
 *        -d '{"website_url": "https://memy.co.in"}'
 * }</pre>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class StorefrontInsightsApplication {

    /**
     * Bootstrap method to launch the Spring Boot application.
     *
     * @param args command-line arguments (ignored)
     */
    public static void main(final String[] args) {
        SpringApplication.run(StorefrontInsightsApplication.class, args);
    }
}
