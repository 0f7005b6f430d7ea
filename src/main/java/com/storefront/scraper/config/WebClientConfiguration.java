package com.storefront.scraper.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.logging.LogLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.HttpProtocol;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.transport.logging.AdvancedByteBufFormat;

import java.time.Duration;

@Configuration
@Slf4j
public class WebClientConfiguration {

    private static final int MAX_CONNECTIONS = 50;

    private static final Duration POOL_ACQUIRE_DELAY = Duration.ofSeconds(2);

    /**
     * The {@link WebClient} every storefront fetch goes through. Storefronts
     * answer with HTML as often as JSON, so the default Accept header takes
     * both; redirects are followed because most shops bounce the bare domain
     * to {@code www.} or a locale path.
     *
     * @param props bound storefront properties
     * @return a fully built client without base URL (each request is absolute)
     */
    @Bean
    public WebClient storefrontWebClient(final StorefrontProperties props) {
        StorefrontProperties.Fetch fetch = props.getFetch();

        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(cfg -> cfg.defaultCodecs()
                        .maxInMemorySize((int) fetch.getMaxInMemorySize().toBytes()))
                .build();

        ConnectionProvider pool = ConnectionProvider.builder("storefront-pool")
                .maxConnections(MAX_CONNECTIONS)
                .pendingAcquireTimeout(POOL_ACQUIRE_DELAY)
                .build();

        HttpClient httpClient = HttpClient.create(pool)
                .protocol(HttpProtocol.H2, HttpProtocol.HTTP11)  // try HTTP/2 multiplexing
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) fetch.getConnectTimeout().toMillis())
                .responseTimeout(fetch.getTimeout())
                .followRedirect(true)
                .compress(true)
                .wiretap("reactor.netty.http.client.HttpClient",
                        LogLevel.DEBUG, AdvancedByteBufFormat.TEXTUAL);

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeaders(h -> {
                    h.set(HttpHeaders.ACCEPT, "text/html,application/json;q=0.9,*/*;q=0.8");
                    h.set(HttpHeaders.ACCEPT_LANGUAGE, "en-US,en;q=0.5");
                    h.set(HttpHeaders.USER_AGENT, fetch.getUserAgent());
                })
                .filter(logRequest())
                .filter(logResponse())
                .exchangeStrategies(strategies)
                .build();
    }

    private static ExchangeFilterFunction logRequest() {
        return ExchangeFilterFunction.ofRequestProcessor(req -> {
            log.debug("--> {} {}", req.method(), req.url());
            return Mono.just(req);
        });
    }

    private static ExchangeFilterFunction logResponse() {
        return ExchangeFilterFunction.ofResponseProcessor(res -> {
            log.debug("<-- {}  {}", res.statusCode().value(), res.headers().asHttpHeaders().getContentType());
            return Mono.just(res);
        });
    }
}
