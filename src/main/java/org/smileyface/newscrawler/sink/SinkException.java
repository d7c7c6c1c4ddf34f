package org.smileyface.newscrawler.sink;

/**
 * The sink could not store or read records. Duplicate keys are not reported this way.
 */
public class SinkException extends Exception {

    public SinkException(String message) {
        super(message);
    }

    public SinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
