package com.storefront.scraper.service.extract;

import com.storefront.scraper.model.RawRecord;
import com.storefront.scraper.parser.HtmlText;
import com.storefront.scraper.service.core.CategoryExtractor;
import com.storefront.scraper.service.core.ExtractionRun;
import com.storefront.scraper.service.fetch.FetchedPage;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fetches the four standard policy pages one after the other. Every path is
 * attempted; a page that cannot be fetched simply has no entry, so a result
 * with fewer than four policies is normal.
 */
@Component
@Slf4j
public class PoliciesExtractor extends CategoryExtractor<List<RawRecord>> {

    /** Policy type → path, in request order. */
    static final Map<String, String> POLICY_PATHS;

    static {
        Map<String, String> paths = new LinkedHashMap<>();
        paths.put("privacy", "/policies/privacy-policy");
        paths.put("refund", "/policies/refund-policy");
        paths.put("shipping", "/policies/shipping-policy");
        paths.put("terms", "/policies/terms-of-service");
        POLICY_PATHS = Collections.unmodifiableMap(paths);
    }

    @Override
    public String category() {
        return "policies";
    }

    @Override
    protected List<RawRecord> empty() {
        return List.of();
    }

    @Override
    protected Mono<List<RawRecord>> doExtract(final ExtractionRun run) {
        return Flux.fromIterable(POLICY_PATHS.entrySet())
                .concatMap(e -> run.fetch(e.getValue())
                        .flatMap(page -> toPolicy(e.getKey(), page)))
                .collectList();
    }

    private Mono<RawRecord> toPolicy(final String type, final FetchedPage page) {
        return Mono.fromCallable(() -> {
                    Document doc = Jsoup.parse(page.body(), page.url());
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put("type", type);
                    row.put("url", page.url());
                    row.put("content", HtmlText.linesOf(doc.body()));
                    return (RawRecord) RawRecord.of(row);
                })
                .onErrorResume(ex -> {
                    log.error("Error parsing policy page {}: {}", page.url(), ex.toString());
                    return Mono.empty();
                });
    }
}
