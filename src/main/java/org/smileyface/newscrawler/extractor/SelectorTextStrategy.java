package org.smileyface.newscrawler.extractor;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.smileyface.newscrawler.util.CrawlerUtils;

import java.util.List;

/**
 * Reads the text of the first element matching a CSS selector that has non-empty text.
 * <p>
 * Elements matching any of the strip selectors are removed from a copy of the matched element before
 * its text is taken (captions, summaries). Line breaks are collapsed into single spaces.
 */
public final class SelectorTextStrategy implements FieldStrategy {

    private final String selector;
    private final List<String> stripSelectors;

    public SelectorTextStrategy(String selector) {
        this(selector, List.of());
    }

    public SelectorTextStrategy(String selector, List<String> stripSelectors) {
        if (selector == null || selector.isBlank()) {
            throw new IllegalArgumentException("selector must not be null/blank");
        }
        this.selector = selector.trim();
        this.stripSelectors = stripSelectors == null ? List.of() : List.copyOf(stripSelectors);
    }

    public String getSelector() {
        return selector;
    }

    @Override
    public String extract(Document document) {
        if (document == null) return null;
        for (Element el : document.select(selector)) {
            String text = textOf(el);
            if (text != null && !text.isEmpty()) {
                return text;
            }
        }
        return null;
    }

    private String textOf(Element el) {
        Element target = el;
        if (!stripSelectors.isEmpty()) {
            target = el.clone();
            for (String strip : stripSelectors) {
                if (strip == null || strip.isBlank()) continue;
                target.select(strip).remove();
            }
        }
        return CrawlerUtils.flattenLines(target.text());
    }

    @Override
    public String describe() {
        return "text(" + selector + ")";
    }
}
