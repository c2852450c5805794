package com.swaprouter.service;

/**
 * A route query that cannot be answered from its parameters, such as an unknown token.
 */
public class InvalidRouteRequestException extends RuntimeException {

    public InvalidRouteRequestException(String message) {
        super(message);
    }
}
