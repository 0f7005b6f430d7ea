package com.storefront.scraper.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * Request payload for an insights run.
 *
 * @param websiteUrl storefront URL; scheme optional, e.g. {@code memy.co.in}
 *                   or {@code https://www.example.com}
 */
public record InsightsRequest(
        @JsonProperty("website_url")
        @NotBlank
        @Pattern(regexp = "^(https?://)?[\\da-zA-Z.-]+\\.[a-zA-Z.]{2,6}[/\\w .-]*/?$",
                message = "Invalid website_url format.")
        String websiteUrl
) {}
