package com.storefront.scraper.mapper;

import com.fasterxml.jackson.databind.JsonNode;
import com.storefront.scraper.model.BrandInsights;
import com.storefront.scraper.model.ContactDetail;
import com.storefront.scraper.model.Faq;
import com.storefront.scraper.model.ImportantLink;
import com.storefront.scraper.model.Policy;
import com.storefront.scraper.model.Product;
import com.storefront.scraper.model.RawRecord;
import com.storefront.scraper.model.SocialHandle;
import com.storefront.scraper.parser.Dedup;
import com.storefront.scraper.parser.HeuristicChain;
import com.storefront.scraper.service.core.RawInsights;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * <h2>Insights mapper</h2>
 *
 * <p>Turns raw extractor output into the canonical entities. Every method is
 * a pure, total function:</p>
 * <ul>
 *   <li>{@code null} lists and {@code null} entries are skipped;</li>
 *   <li>missing fields default to {@code ""} (required text) or
 *       {@code null} (optional values);</li>
 *   <li>{@link RawRecord.Bare} entries become a record whose only populated
 *       field is the bare string;</li>
 *   <li>duplicates by natural key are dropped, first occurrence wins,
 *       order is preserved.</li>
 * </ul>
 */
@Component
public class InsightsMapper {

    /**
     * Catalog image lookup: {@code image.src}, then the first {@code images[]}
     * entry with a {@code src}, then the image referenced by a variant's
     * {@code image_id}.
     */
    static final HeuristicChain<JsonNode, String> CATALOG_IMAGE = HeuristicChain.<JsonNode, String>builder()
            .then(p -> text(p.path("image").path("src")))
            .then(p -> firstImageSrc(p.path("images")))
            .then(InsightsMapper::variantImageSrc)
            .build();

    public BrandInsights toInsights(final RawInsights raw) {
        return new BrandInsights(
                mapProducts(raw.productCatalog(), raw.baseUrl()),
                mapHeroProducts(raw.heroProducts()),
                mapPolicies(raw.policies()),
                mapFaqs(raw.faqs()),
                mapSocialHandles(raw.socialHandles()),
                mapContactDetails(raw.contactDetails()),
                raw.brandText(),
                mapImportantLinks(raw.importantLinks()));
    }

    /**
     * @param products elements of the {@code products.json} array
     * @param baseUrl  storefront root used to build product URLs
     * @return catalog products, unique by URL
     */
    public List<Product> mapProducts(final List<JsonNode> products, final String baseUrl) {
        List<Product> out = new ArrayList<>();
        for (JsonNode p : nonNull(products)) {
            String handle = text(p.path("handle")).orElse(null);
            out.add(new Product(
                    text(p.path("id")).orElse(""),
                    text(p.path("title")).orElse(""),
                    handle != null ? baseUrl + "/products/" + handle : null,
                    CATALOG_IMAGE.first(p).orElse(null),
                    firstVariantPrice(p.path("variants")),
                    text(p.path("body_html")).orElse("")));
        }
        return Dedup.firstBy(out, Product::url);
    }

    public List<Product> mapHeroProducts(final List<RawRecord> raw) {
        return Dedup.firstBy(map(raw, r -> r.fold(
                s -> new Product(null, s.text("title", ""), s.text("url"), s.text("image"), null, null),
                b -> new Product(null, "", b.value(), null, null, null))), Product::url);
    }

    public List<Policy> mapPolicies(final List<RawRecord> raw) {
        return Dedup.firstBy(map(raw, r -> r.fold(
                s -> new Policy(s.text("type", ""), s.text("url"), s.text("content")),
                b -> new Policy("", b.value(), null))), p -> StringUtils.trimToNull(p.type()));
    }

    public List<Faq> mapFaqs(final List<RawRecord> raw) {
        return map(raw, r -> r.fold(
                s -> new Faq(s.text("question", ""), s.text("answer", "")),
                b -> new Faq(b.value(), "")));
    }

    public List<SocialHandle> mapSocialHandles(final List<RawRecord> raw) {
        return Dedup.firstBy(map(raw, r -> r.fold(
                s -> new SocialHandle(s.text("platform", ""), s.text("url", "")),
                b -> new SocialHandle("", b.value()))), SocialHandle::url);
    }

    public List<ContactDetail> mapContactDetails(final List<RawRecord> raw) {
        return Dedup.firstBy(map(raw, r -> r.fold(
                s -> new ContactDetail(s.text("type", ""), s.text("value", "")),
                b -> new ContactDetail("", b.value()))), c -> c);
    }

    public List<ImportantLink> mapImportantLinks(final List<RawRecord> raw) {
        return Dedup.firstBy(map(raw, r -> r.fold(
                s -> new ImportantLink(s.text("name", ""), s.text("url", "")),
                b -> new ImportantLink("", b.value()))), ImportantLink::url);
    }

    /* ------------------------------------------------------------------ */
    /* helpers                                                            */
    /* ------------------------------------------------------------------ */

    private static <T> List<T> map(final List<RawRecord> raw, final Function<RawRecord, T> fn) {
        List<T> out = new ArrayList<>();
        for (RawRecord r : nonNull(raw)) {
            out.add(fn.apply(r));
        }
        return out;
    }

    private static <T> List<T> nonNull(final List<T> list) {
        if (list == null) {
            return List.of();
        }
        return list.stream().filter(Objects::nonNull).toList();
    }

    /** Scalar node as text; missing, null, container or empty → empty. */
    private static Optional<String> text(final JsonNode node) {
        if (node == null || !node.isValueNode() || node.isNull()) {
            return Optional.empty();
        }
        return Optional.of(node.asText()).filter(s -> !s.isEmpty());
    }

    private static Optional<String> firstImageSrc(final JsonNode images) {
        for (JsonNode img : images) {
            Optional<String> src = text(img.path("src"));
            if (src.isPresent()) {
                return src;
            }
        }
        return Optional.empty();
    }

    private static Optional<String> variantImageSrc(final JsonNode product) {
        JsonNode images = product.path("images");
        for (JsonNode variant : product.path("variants")) {
            Optional<String> imageId = text(variant.path("image_id"));
            if (imageId.isEmpty()) {
                continue;
            }
            for (JsonNode img : images) {
                if (imageId.equals(text(img.path("id")))) {
                    Optional<String> src = text(img.path("src"));
                    if (src.isPresent()) {
                        return src;
                    }
                }
            }
        }
        return Optional.empty();
    }

    /** Price of the first variant; {@code null} without variants, {@code ""} without a price. */
    private static String firstVariantPrice(final JsonNode variants) {
        if (!variants.isArray() || variants.isEmpty()) {
            return null;
        }
        return text(variants.get(0).path("price")).orElse("");
    }
}
