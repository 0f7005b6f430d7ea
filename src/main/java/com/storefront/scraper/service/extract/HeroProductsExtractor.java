package com.storefront.scraper.service.extract;

import com.storefront.scraper.model.RawRecord;
import com.storefront.scraper.parser.Dedup;
import com.storefront.scraper.parser.HeuristicChain;
import com.storefront.scraper.parser.StorefrontUrls;
import com.storefront.scraper.service.core.HomepageExtractor;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * <h2>Hero products</h2>
 * <p>Products featured on the homepage: every anchor whose {@code href}
 * contains <code>/products/</code>.</p>
 * <ul>
 *   <li><strong>title</strong> – the anchor's visible text;</li>
 *   <li><strong>url</strong> – absolute href kept, relative href appended to the base;</li>
 *   <li><strong>image</strong> – first hit of {@link #IMAGE_LOOKUP}:
 *       an {@code img} inside the anchor, an {@code img} anywhere inside the
 *       anchor's parent, or the anchor's next sibling when that is an {@code img}.</li>
 * </ul>
 * <p>Entries are de-duplicated by URL, first occurrence wins.</p>
 */
@Component
public class HeroProductsExtractor extends HomepageExtractor<List<RawRecord>> {

    static final String PRODUCT_PATH_MARKER = "/products/";

    static final HeuristicChain<Element, String> IMAGE_LOOKUP = HeuristicChain.<Element, String>builder()
            .then(a -> srcOf(a.selectFirst("img[src]")))
            .then(a -> Optional.ofNullable(a.parent()).flatMap(p -> srcOf(p.selectFirst("img[src]"))))
            .then(a -> Optional.ofNullable(a.nextElementSibling())
                    .filter(sibling -> "img".equals(sibling.normalName()))
                    .flatMap(HeroProductsExtractor::srcOf))
            .build();

    @Override
    public String category() {
        return "hero products";
    }

    @Override
    protected List<RawRecord> empty() {
        return List.of();
    }

    @Override
    protected List<RawRecord> parse(final Document homepage, final String baseUrl) {
        List<RawRecord.Structured> found = new ArrayList<>();
        for (Element a : homepage.select("a[href]")) {
            String href = a.attr("href");
            if (!href.contains(PRODUCT_PATH_MARKER)) {
                continue;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("title", a.text());
            row.put("url", StorefrontUrls.resolve(baseUrl, href));
            row.put("image", IMAGE_LOOKUP.first(a).orElse(null));
            found.add(RawRecord.of(row));
        }
        return List.copyOf(Dedup.firstBy(found, r -> r.text("url")));
    }

    private static Optional<String> srcOf(final Element img) {
        if (img == null || !img.hasAttr("src")) {
            return Optional.empty();
        }
        return Optional.of(img.attr("src"));
    }
}
