package org.smileyface.newscrawler.extractor;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Reads an attribute value of the first element matching a CSS selector that carries a non-empty value.
 */
public final class SelectorAttributeStrategy implements FieldStrategy {

    private final String selector;
    private final String attribute;

    public SelectorAttributeStrategy(String selector, String attribute) {
        if (selector == null || selector.isBlank()) {
            throw new IllegalArgumentException("selector must not be null/blank");
        }
        if (attribute == null || attribute.isBlank()) {
            throw new IllegalArgumentException("attribute must not be null/blank");
        }
        this.selector = selector.trim();
        this.attribute = attribute.trim();
    }

    @Override
    public String extract(Document document) {
        if (document == null) return null;
        for (Element el : document.select(selector)) {
            String value = el.attr(attribute).trim();
            if (!value.isEmpty()) {
                return value;
            }
        }
        return null;
    }

    @Override
    public String describe() {
        return "attr(" + selector + "@" + attribute + ")";
    }
}
