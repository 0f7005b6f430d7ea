package com.storefront.scraper.service.extract;

import com.storefront.scraper.model.RawRecord;
import com.storefront.scraper.service.core.CategoryExtractor;
import com.storefront.scraper.service.core.ExtractionRun;
import com.storefront.scraper.service.fetch.FetchedPage;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * <h2>FAQs</h2>
 *
 * <p>Walks {@link #FAQ_PATHS} in order and stops at the first page that both
 * loads and yields at least one question; later paths are never requested.</p>
 *
 * <p>On a page, three markup conventions are read and their results
 * concatenated (a page can match several):</p>
 * <ol>
 *   <li><strong>FAQ blocks</strong> – elements with class {@code faq} or
 *       {@code faq-item}; question is the first {@code h2/h3/h4/strong}
 *       inside, answer the first {@code p/div} inside. Both must exist.</li>
 *   <li><strong>Disclosure widgets</strong> – {@code <details>} with a
 *       {@code <summary>}; the answer is the details text minus the
 *       question.</li>
 *   <li><strong>Heading + paragraph</strong> – an {@code h2}/{@code h3} whose
 *       next sibling element is a {@code p}.</li>
 * </ol>
 */
@Component
@Slf4j
public class FaqExtractor extends CategoryExtractor<List<RawRecord>> {

    static final List<String> FAQ_PATHS = List.of("/pages/faq", "/pages/faqs", "/faq", "/faqs");

    private final List<Function<Document, List<RawRecord>>> pageStrategies =
            List.of(FaqExtractor::fromFaqBlocks, FaqExtractor::fromDetails, FaqExtractor::fromHeadings);

    @Override
    public String category() {
        return "faqs";
    }

    @Override
    protected List<RawRecord> empty() {
        return List.of();
    }

    @Override
    protected Mono<List<RawRecord>> doExtract(final ExtractionRun run) {
        return Flux.fromIterable(FAQ_PATHS)
                .concatMap(path -> run.fetch(path).map(this::parsePage))
                .filter(faqs -> !faqs.isEmpty())
                .next();
    }

    /**
     * Applies every page strategy. A page that cannot be parsed counts as a
     * page without FAQs so the fallback moves on to the next path.
     */
    List<RawRecord> parsePage(final FetchedPage page) {
        try {
            Document doc = Jsoup.parse(page.body(), page.url());
            List<RawRecord> faqs = new ArrayList<>();
            for (Function<Document, List<RawRecord>> strategy : pageStrategies) {
                faqs.addAll(strategy.apply(doc));
            }
            return faqs;
        } catch (RuntimeException ex) {
            log.error("Error parsing FAQ page {}: {}", page.url(), ex.toString());
            return List.of();
        }
    }

    static List<RawRecord> fromFaqBlocks(final Document doc) {
        List<RawRecord> out = new ArrayList<>();
        for (Element item : doc.select(".faq, .faq-item")) {
            Element q = firstDescendant(item, "h2, h3, h4, strong");
            Element a = firstDescendant(item, "p, div");
            if (q != null && a != null) {
                out.add(faq(q.text(), a.text()));
            }
        }
        return out;
    }

    static List<RawRecord> fromDetails(final Document doc) {
        List<RawRecord> out = new ArrayList<>();
        for (Element details : doc.select("details")) {
            Element summary = firstDescendant(details, "summary");
            if (summary != null) {
                String question = summary.text();
                String answer = StringUtils.replaceOnce(details.text(), question, "").trim();
                out.add(faq(question, answer));
            }
        }
        return out;
    }

    static List<RawRecord> fromHeadings(final Document doc) {
        List<RawRecord> out = new ArrayList<>();
        for (Element heading : doc.select("h2, h3")) {
            Element next = heading.nextElementSibling();
            if (next != null && "p".equals(next.normalName())) {
                out.add(faq(heading.text(), next.text()));
            }
        }
        return out;
    }

    /** First match strictly below {@code root}, in document order. */
    private static Element firstDescendant(final Element root, final String cssQuery) {
        for (Element el : root.select(cssQuery)) {
            if (el != root) {
                return el;
            }
        }
        return null;
    }

    private static RawRecord faq(final String question, final String answer) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("question", question);
        row.put("answer", answer);
        return RawRecord.of(row);
    }
}
