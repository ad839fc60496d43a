package com.servicetracker.irita.lookup;

/**
 * Thrown when a service request's details cannot be fetched or decoded.
 */
public class RequestLookupException extends RuntimeException {

    public RequestLookupException(String message) {
        super(message);
    }

    public RequestLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
