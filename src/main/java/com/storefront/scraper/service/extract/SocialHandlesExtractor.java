package com.storefront.scraper.service.extract;

import com.storefront.scraper.model.RawRecord;
import com.storefront.scraper.parser.Dedup;
import com.storefront.scraper.service.core.HomepageExtractor;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Social profile links on the homepage. An href matches a platform when it
 * contains the platform's domain as a plain substring; every platform is
 * tested against every href. Results are de-duplicated by URL.
 * <p>
 * Substring matching can misfire on redirect/tracking links that carry
 * another platform's domain in a query parameter. That is accepted.
 * </p>
 */
@Component
public class SocialHandlesExtractor extends HomepageExtractor<List<RawRecord>> {

    /** Platform → domain substring, in match order. */
    static final Map<String, String> PLATFORM_DOMAINS;

    static {
        Map<String, String> domains = new LinkedHashMap<>();
        domains.put("instagram", "instagram.com");
        domains.put("facebook", "facebook.com");
        domains.put("twitter", "twitter.com");
        domains.put("tiktok", "tiktok.com");
        domains.put("youtube", "youtube.com");
        domains.put("pinterest", "pinterest.com");
        domains.put("linkedin", "linkedin.com");
        PLATFORM_DOMAINS = Collections.unmodifiableMap(domains);
    }

    @Override
    public String category() {
        return "social handles";
    }

    @Override
    protected List<RawRecord> empty() {
        return List.of();
    }

    @Override
    protected List<RawRecord> parse(final Document homepage, final String baseUrl) {
        List<RawRecord.Structured> handles = new ArrayList<>();
        for (Element a : homepage.select("a[href]")) {
            String href = a.attr("href");
            PLATFORM_DOMAINS.forEach((platform, domain) -> {
                if (href.contains(domain)) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put("platform", platform);
                    row.put("url", href);
                    handles.add(RawRecord.of(row));
                }
            });
        }
        return List.copyOf(Dedup.firstBy(handles, r -> r.text("url")));
    }
}
