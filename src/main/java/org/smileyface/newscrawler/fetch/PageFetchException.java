package org.smileyface.newscrawler.fetch;

/**
 * A single page could not be fetched: connection failure, timeout or an HTTP error status.
 */
public class PageFetchException extends Exception {

    private final String url;
    private final int httpStatus;

    public PageFetchException(String url, int httpStatus, String message) {
        super(message);
        this.url = url;
        this.httpStatus = httpStatus;
    }

    public PageFetchException(String url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.httpStatus = -1;
    }

    public String getUrl() {
        return url;
    }

    /** HTTP status of the response, or -1 when no response was received. */
    public int getHttpStatus() {
        return httpStatus;
    }
}
