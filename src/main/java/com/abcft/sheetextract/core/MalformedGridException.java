package com.abcft.sheetextract.core;

/**
 * Signals that a cell grid handed over by the caller is inconsistent, e.g. its bounds are inverted.
 */
public class MalformedGridException extends IllegalArgumentException {

    public MalformedGridException(String message) {
        super(message);
    }

    public MalformedGridException(String message, Throwable cause) {
        super(message, cause);
    }

}
