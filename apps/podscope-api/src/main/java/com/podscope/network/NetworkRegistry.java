package com.podscope.network;

public interface NetworkRegistry {

    /**
     * Resolves a user supplied network reference to the registry entry it names.
     *
     * @throws NoSuchNetworkException when no network matches the reference
     * @throws NetworkLookupException when the registry could not be queried
     */
    Network resolve(String reference);
}
