package com.podscope.network;

public class NoSuchNetworkException extends NetworkLookupException {

    public NoSuchNetworkException(String reference) {
        super("network not found: " + reference);
    }

    public NoSuchNetworkException(String reference, Throwable cause) {
        super("network not found: " + reference, cause);
    }
}
