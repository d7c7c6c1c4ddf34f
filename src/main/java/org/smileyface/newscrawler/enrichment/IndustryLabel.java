package org.smileyface.newscrawler.enrichment;

/**
 * Industry assigned to a headline, with the classifier's confidence in [0, 1].
 */
public record IndustryLabel(String label, double confidence) {
}
