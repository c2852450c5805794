package com.swaprouter.codec;

/**
 * Raised when a binary payload cannot be encoded or decoded.
 */
public class CodecException extends RuntimeException {

    public CodecException(String message) {
        super(message);
    }

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
