package com.storefront.scraper.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

@Configuration
public class JacksonScraperConfig {

    /**
     * The MVC mapper, built from Boot's builder so {@code spring.jackson.*}
     * (snake_case names) still applies once a second mapper bean exists.
     *
     * @param builder auto-configured builder
     * @return ObjectMapper for REST responses
     */
    @Bean
    @Primary
    public ObjectMapper objectMapper(final Jackson2ObjectMapperBuilder builder) {
        return builder.build();
    }

    /**
     * A dedicated {@link ObjectMapper} for storefront payloads such as
     * <code>/products.json</code>.
     * <p>
     * • Has its own qualifier (<b>scraperObjectMapper</b>) so it never clashes with the
     * snake_case mapper that Spring Boot auto‑configures for MVC responses.<br>
     * • Keeps decimals exactly as written, so a variant price of {@code 19.90}
     * is later rendered as {@code "19.90"} and not {@code "19.9"}.
     *
     * @return ObjectMapper for scraped JSON
     */
    @Bean
    @Qualifier("scraperObjectMapper")
    public ObjectMapper scraperObjectMapper() {
        return newScraperObjectMapper();
    }

    /**
     * Factory shared with tests that build extractors without a Spring context.
     *
     * @return a fresh, fully configured mapper
     */
    public static ObjectMapper newScraperObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        mapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        mapper.configure(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES, false);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        return mapper;
    }

}
