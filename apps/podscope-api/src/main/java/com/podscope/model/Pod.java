package com.podscope.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of a pod as seen by the filter predicates.
 *
 * <p>Accessors that may need to reach the runtime return a {@link Lookup}; implementations must not
 * throw from them. The plain accessors are expected to be cheap and always available.
 */
public interface Pod {
    String id();

    String name();

    /**
     * Creation instant, or {@code null} when the runtime has not recorded one.
     */
    Instant created();

    Map<String, String> labels();

    Lookup<List<String>> containerIds();

    Lookup<List<ContainerHandle>> containers();

    /**
     * States of the child containers, in the same order as {@link #containers()}.
     */
    Lookup<List<ContainerStatus>> containerStatuses();

    /**
     * Aggregate status derived from the child containers, e.g. {@code Running} or {@code Degraded}.
     */
    Lookup<String> status();

    /**
     * The container that owns the shared network namespace of the pod.
     */
    Lookup<ContainerHandle> infraContainer();
}
