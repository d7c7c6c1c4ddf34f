package org.smileyface.newscrawler.extractor;

import org.smileyface.newscrawler.model.ArticleRecord;

/**
 * Either an extracted {@link ArticleRecord} or an {@link ExtractFailure}.
 */
public final class ExtractResult {

    private final ArticleRecord record;
    private final ExtractFailure failure;

    private ExtractResult(ArticleRecord record, ExtractFailure failure) {
        this.record = record;
        this.failure = failure;
    }

    public static ExtractResult success(ArticleRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record must not be null");
        }
        return new ExtractResult(record, null);
    }

    public static ExtractResult failure(ExtractFailure.Kind kind, String url, String message) {
        return new ExtractResult(null, new ExtractFailure(kind, url, message));
    }

    public boolean isSuccess() {
        return record != null;
    }

    /** The article, or null when extraction failed. */
    public ArticleRecord getRecord() {
        return record;
    }

    /** The failure, or null when extraction succeeded. */
    public ExtractFailure getFailure() {
        return failure;
    }

    @Override
    public String toString() {
        return isSuccess() ? "ExtractResult{success " + record.getUrl() + "}" : "ExtractResult{" + failure + "}";
    }
}
