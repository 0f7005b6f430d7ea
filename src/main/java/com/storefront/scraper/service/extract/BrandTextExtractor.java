package com.storefront.scraper.service.extract;

import com.storefront.scraper.parser.HeuristicChain;
import com.storefront.scraper.service.core.HomepageExtractor;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Short brand description taken from the homepage.
 * <p>
 * Tries, first hit wins: {@code #about}, {@code .about}, {@code #about-us},
 * {@code .about-us} (the element's visible text), then the {@code content}
 * of {@code <meta name="description">}. Nothing found means absent, not
 * {@code ""}.
 * </p>
 */
@Component
public class BrandTextExtractor extends HomepageExtractor<Optional<String>> {

    static final HeuristicChain<Document, String> BRAND_TEXT = HeuristicChain.<Document, String>builder()
            .then(doc -> textOf(doc.selectFirst("#about")))
            .then(doc -> textOf(doc.selectFirst(".about")))
            .then(doc -> textOf(doc.selectFirst("#about-us")))
            .then(doc -> textOf(doc.selectFirst(".about-us")))
            .then(BrandTextExtractor::metaDescription)
            .build();

    @Override
    public String category() {
        return "brand text";
    }

    @Override
    protected Optional<String> empty() {
        return Optional.empty();
    }

    @Override
    protected Optional<String> parse(final Document homepage, final String baseUrl) {
        return BRAND_TEXT.first(homepage);
    }

    private static Optional<String> textOf(final Element el) {
        return Optional.ofNullable(el).map(Element::text);
    }

    private static Optional<String> metaDescription(final Document doc) {
        Element meta = doc.selectFirst("meta[name=description]");
        if (meta == null || !meta.hasAttr("content")) {
            return Optional.empty();
        }
        return Optional.of(meta.attr("content"));
    }
}
