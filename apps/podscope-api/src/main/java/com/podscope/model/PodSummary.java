package com.podscope.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record PodSummary(
        String id,
        String name,
        String status,
        Instant created,
        Map<String, String> labels,
        List<ContainerState> containers
) {
    public static record ContainerState(
            String id,
            String name,
            String state
    ) {
    }
}
