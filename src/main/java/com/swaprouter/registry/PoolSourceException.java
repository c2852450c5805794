package com.swaprouter.registry;

/**
 * The pool source could not deliver a usable pool set. No registry is created when this is raised.
 */
public class PoolSourceException extends RuntimeException {

    public PoolSourceException(String message) {
        super(message);
    }

    public PoolSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
