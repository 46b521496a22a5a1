package com.podscope.network;

/**
 * A network as known by the registry. {@code name} is the canonical name pods report when attached.
 */
public record Network(String id, String name) {
}
