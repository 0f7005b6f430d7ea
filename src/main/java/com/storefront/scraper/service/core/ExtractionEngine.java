package com.storefront.scraper.service.core;

import com.storefront.scraper.mapper.InsightsMapper;
import com.storefront.scraper.model.BrandInsights;
import com.storefront.scraper.service.extract.BrandTextExtractor;
import com.storefront.scraper.service.extract.ContactDetailsExtractor;
import com.storefront.scraper.service.extract.FaqExtractor;
import com.storefront.scraper.service.extract.HeroProductsExtractor;
import com.storefront.scraper.service.extract.ImportantLinksExtractor;
import com.storefront.scraper.service.extract.PoliciesExtractor;
import com.storefront.scraper.service.extract.ProductCatalogExtractor;
import com.storefront.scraper.service.extract.SocialHandlesExtractor;
import com.storefront.scraper.service.fetch.PageFetcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * <h2>ExtractionEngine</h2>
 *
 * <p>Runs the eight category extractors for one storefront concurrently and
 * joins them. Each extractor is subscribed at once; the result is assembled
 * only after all eight have emitted, in no particular completion order.</p>
 *
 * <p>The engine does not validate the URL and never errors for missing data:
 * an absent category is an empty list (or {@code null} brand text). Deciding
 * whether an empty catalog means "not a storefront" is left to the caller.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ExtractionEngine {

    private final PageFetcher fetcher;

    private final ProductCatalogExtractor catalog;

    private final HeroProductsExtractor heroProducts;

    private final PoliciesExtractor policies;

    private final FaqExtractor faqs;

    private final SocialHandlesExtractor socialHandles;

    private final ContactDetailsExtractor contactDetails;

    private final BrandTextExtractor brandText;

    private final ImportantLinksExtractor importantLinks;

    private final InsightsMapper mapper;

    /**
     * @param baseUrl storefront root (scheme + host, no trailing slash)
     * @return the raw records of every category
     */
    public Mono<RawInsights> extractRaw(final String baseUrl) {
        ExtractionRun run = new ExtractionRun(baseUrl, fetcher);

        return Mono.zip(
                        catalog.extract(run),
                        heroProducts.extract(run),
                        policies.extract(run),
                        faqs.extract(run),
                        socialHandles.extract(run),
                        contactDetails.extract(run),
                        brandText.extract(run),
                        importantLinks.extract(run))
                .map(t -> new RawInsights(baseUrl,
                        t.getT1(), t.getT2(), t.getT3(), t.getT4(),
                        t.getT5(), t.getT6(), t.getT7().orElse(null), t.getT8()))
                .doOnNext(raw -> log.info(
                        "Extracted {}: products={} hero={} policies={} faqs={} socials={} contacts={} links={} brandText={}",
                        baseUrl, raw.productCatalog().size(), raw.heroProducts().size(),
                        raw.policies().size(), raw.faqs().size(), raw.socialHandles().size(),
                        raw.contactDetails().size(), raw.importantLinks().size(),
                        raw.brandText() != null));
    }

    /**
     * @param baseUrl storefront root (scheme + host, no trailing slash)
     * @return the normalised aggregate
     */
    public Mono<BrandInsights> extract(final String baseUrl) {
        return extractRaw(baseUrl).map(mapper::toInsights);
    }
}
