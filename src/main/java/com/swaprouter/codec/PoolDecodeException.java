package com.swaprouter.codec;

/**
 * A pool payload that does not decode into a usable {@link com.swaprouter.model.Pool}.
 * Such a payload must never reach the registry.
 */
public class PoolDecodeException extends CodecException {

    public PoolDecodeException(String message) {
        super(message);
    }

    public PoolDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
