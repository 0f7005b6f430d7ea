package com.storefront.scraper.parser;

import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HtmlTextTest {

    @Test
    void skipsInvisibleAndBlankText() {
        var doc = Jsoup.parse("""
                <html><head><title>Shop</title><style>.a{}</style></head>
                <body>
                  <p>  Hello  </p>
                  <script>var a = 1;</script>
                  <noscript>Enable JS</noscript>
                  <div><span>Nested</span> tail</div>
                </body></html>
                """);

        assertThat(HtmlText.strippedStrings(doc.body())).containsExactly("Hello", "Nested", "tail");
        assertThat(HtmlText.strippedStrings(doc)).containsExactly("Shop", "Hello", "Nested", "tail");
    }

    @Test
    void linesJoinsWithNewline() {
        var doc = Jsoup.parse("<h1>Terms</h1><p>One</p><p>Two</p>");

        assertThat(HtmlText.linesOf(doc.body())).isEqualTo("Terms\nOne\nTwo");
    }

    @Test
    void nullRootIsEmpty() {
        assertThat(HtmlText.strippedStrings(null)).isEmpty();
        assertThat(HtmlText.linesOf(null)).isEmpty();
    }
}
