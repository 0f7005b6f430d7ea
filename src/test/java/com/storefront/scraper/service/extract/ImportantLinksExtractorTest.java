package com.storefront.scraper.service.extract;

import com.storefront.scraper.model.RawRecord;
import com.storefront.scraper.testutil.Runs;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.storefront.scraper.testutil.Runs.BASE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class ImportantLinksExtractorTest {

    private final ImportantLinksExtractor extractor = new ImportantLinksExtractor();

    @Test
    void keepsKeywordLinksResolvedAgainstBase() {
        String html = """
                <nav>
                  <a href="/pages/track">Track Your ORDER</a>
                  <a href="https://blog.shop.example/">Our Blog</a>
                  <a href="/pages/contact">Contact us</a>
                  <a href="/collections/all">Shop all</a>
                  <a href="/pages/track">Order tracking</a>
                </nav>
                """;

        List<RawRecord> links = extractor.extract(Runs.homepage(html)).block();

        assertThat(links).extracting(r -> text(r, "name"), r -> text(r, "url"))
                .containsExactly(
                        tuple("Track Your ORDER", BASE + "/pages/track"),
                        tuple("Our Blog", "https://blog.shop.example/"),
                        tuple("Contact us", BASE + "/pages/contact"));
    }

    @Test
    void matchesOnVisibleTextNotHref() {
        String html = "<a href=\"/pages/help\">Assistance</a><a href=\"/x\">Help centre</a>";

        List<RawRecord> links = extractor.extract(Runs.homepage(html)).block();

        assertThat(links).extracting(r -> text(r, "url")).containsExactly(BASE + "/x");
    }

    private static String text(final RawRecord r, final String key) {
        return ((RawRecord.Structured) r).text(key);
    }
}
