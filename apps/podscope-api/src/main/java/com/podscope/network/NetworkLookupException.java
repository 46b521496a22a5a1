package com.podscope.network;

/**
 * Failure while resolving a network against the registry.
 */
public class NetworkLookupException extends RuntimeException {

    public NetworkLookupException(String message) {
        super(message);
    }

    public NetworkLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
