package org.smileyface.newscrawler.extractor;

import org.jsoup.nodes.Document;

import java.util.List;

/**
 * Ordered fallback of {@link FieldStrategy strategies} for one field. The first non-empty value wins;
 * when none yields a value the sentinel is returned.
 */
public final class FieldExtractionChain {

    private final String field;
    private final List<FieldStrategy> strategies;
    private final String sentinel;

    public FieldExtractionChain(String field, List<FieldStrategy> strategies, String sentinel) {
        this.field = field;
        this.strategies = strategies == null ? List.of() : List.copyOf(strategies);
        this.sentinel = sentinel;
    }

    public FieldResult apply(Document document) {
        for (FieldStrategy strategy : strategies) {
            String value = strategy.extract(document);
            if (value != null && !value.isBlank()) {
                return new FieldResult(value, strategy.describe());
            }
        }
        return FieldResult.sentinel(sentinel);
    }

    public String getField() {
        return field;
    }

    public List<FieldStrategy> getStrategies() {
        return strategies;
    }
}
