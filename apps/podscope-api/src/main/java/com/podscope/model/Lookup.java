package com.podscope.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of a read against the pod model: either a value or the reason the read failed.
 * Predicates treat a failed lookup as "no match" instead of raising.
 */
public record Lookup<T>(T value, String failure) {

    public Lookup {
        if ((value == null) == (failure == null)) {
            throw new IllegalArgumentException("a lookup carries either a value or a failure");
        }
    }

    public static <T> Lookup<T> of(T value) {
        return new Lookup<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> Lookup<T> failed(String reason) {
        return new Lookup<>(null, Objects.requireNonNull(reason, "reason"));
    }

    public boolean isFailed() {
        return failure != null;
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }
}
