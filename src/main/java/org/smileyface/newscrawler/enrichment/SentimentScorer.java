package org.smileyface.newscrawler.enrichment;

import java.util.List;

/**
 * Scores the sentiment of short texts. Implementations wrap an external model and are supplied as beans.
 */
public interface SentimentScorer {

    /**
     * @param texts texts to score, in order
     * @return one score per text, in the same order
     */
    List<Double> score(List<String> texts);
}
