package org.smileyface.newscrawler.extractor;

/**
 * Value of one article field.
 *
 * @param value    the extracted value, or the configured sentinel when every strategy came up empty
 * @param strategy description of the strategy that produced the value; null for a sentinel
 */
public record FieldResult(String value, String strategy) {

    public static FieldResult sentinel(String value) {
        return new FieldResult(value, null);
    }

    public boolean isSentinel() {
        return strategy == null;
    }
}
