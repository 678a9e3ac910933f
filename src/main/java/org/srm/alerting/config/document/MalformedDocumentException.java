package org.srm.alerting.config.document;

/**
 * Thrown when an alerting document cannot be loaded: the bytes are not well-formed XML
 * or the root element is not an {@code AlertingConfig}.
 */
public class MalformedDocumentException extends RuntimeException {

    public MalformedDocumentException(String message) {
        super(message);
    }

    public MalformedDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
