package com.storefront.scraper.service.extract;

import com.storefront.scraper.model.RawRecord;
import com.storefront.scraper.parser.Dedup;
import com.storefront.scraper.parser.StorefrontUrls;
import com.storefront.scraper.service.core.HomepageExtractor;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Homepage links whose visible text mentions ordering, tracking, contact,
 * blog, FAQ, help or support (case-insensitive substring). De-duplicated by
 * resolved URL.
 */
@Component
public class ImportantLinksExtractor extends HomepageExtractor<List<RawRecord>> {

    static final List<String> KEYWORDS = List.of("order", "track", "contact", "blog", "faq", "help", "support");

    @Override
    public String category() {
        return "important links";
    }

    @Override
    protected List<RawRecord> empty() {
        return List.of();
    }

    @Override
    protected List<RawRecord> parse(final Document homepage, final String baseUrl) {
        List<RawRecord.Structured> links = new ArrayList<>();
        for (Element a : homepage.select("a[href]")) {
            String name = a.text();
            String lower = name.toLowerCase(Locale.ROOT);
            if (KEYWORDS.stream().anyMatch(lower::contains)) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("name", name);
                row.put("url", StorefrontUrls.resolve(baseUrl, a.attr("href")));
                links.add(RawRecord.of(row));
            }
        }
        return List.copyOf(Dedup.firstBy(links, r -> r.text("url")));
    }
}
