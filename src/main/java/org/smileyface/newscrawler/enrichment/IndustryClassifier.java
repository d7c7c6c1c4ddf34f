package org.smileyface.newscrawler.enrichment;

import java.util.List;

/**
 * Assigns an industry to each headline. Implementations wrap an external model and are supplied as beans.
 */
public interface IndustryClassifier {

    /**
     * @param titles headlines, in order
     * @return one label per headline, in the same order
     */
    List<IndustryLabel> classify(List<String> titles);
}
