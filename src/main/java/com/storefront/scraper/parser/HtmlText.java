package com.storefront.scraper.parser;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Text helpers over Jsoup trees.
 */
public final class HtmlText {

    /** Elements whose text is never rendered. */
    private static final Set<String> INVISIBLE = Set.of("script", "style", "noscript", "template");

    private HtmlText() {
    }

    /**
     * Every non-blank text node under {@code root}, trimmed, in document
     * order. Text inside {@code script}, {@code style}, {@code noscript} and
     * {@code template} is skipped.
     *
     * @param root subtree to walk; {@code null} yields an empty list
     * @return the stripped strings
     */
    public static List<String> strippedStrings(final Element root) {
        List<String> out = new ArrayList<>();
        if (root == null) {
            return out;
        }
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(final Node node, final int depth) {
                if (node instanceof TextNode text && !insideInvisible(text)) {
                    String s = text.text().trim();
                    if (!s.isEmpty()) {
                        out.add(s);
                    }
                }
            }
        }, root);
        return out;
    }

    /**
     * @param root subtree to render
     * @return visible text, one text node per line
     */
    public static String linesOf(final Element root) {
        return String.join("\n", strippedStrings(root));
    }

    private static boolean insideInvisible(final TextNode text) {
        for (Node p = text.parent(); p != null; p = p.parent()) {
            if (p instanceof Element el && INVISIBLE.contains(el.normalName())) {
                return true;
            }
        }
        return false;
    }
}
