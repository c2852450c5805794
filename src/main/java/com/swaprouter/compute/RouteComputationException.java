package com.swaprouter.compute;

/**
 * A route computation did not produce a result: the worker failed, was cancelled after
 * the timeout, or could not be scheduled because the worker pool was saturated.
 */
public class RouteComputationException extends RuntimeException {

    public RouteComputationException(String message) {
        super(message);
    }

    public RouteComputationException(String message, Throwable cause) {
        super(message, cause);
    }
}
