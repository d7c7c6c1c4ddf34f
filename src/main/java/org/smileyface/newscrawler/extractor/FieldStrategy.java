package org.smileyface.newscrawler.extractor;

import org.jsoup.nodes.Document;

/**
 * One way of reading a field from an article page.
 */
public interface FieldStrategy {

    /**
     * @param document parsed article page
     * @return the trimmed raw value, or null when this strategy finds nothing non-empty
     */
    String extract(Document document);

    /**
     * Short label used in logs and in {@link FieldResult#strategy()}.
     */
    String describe();
}
