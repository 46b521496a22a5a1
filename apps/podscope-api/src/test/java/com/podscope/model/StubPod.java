package com.podscope.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Hand-written pod for tests. Every lookup succeeds unless told otherwise.
 */
public class StubPod implements Pod {

    private final String id;
    private final String name;
    private Instant created;
    private Map<String, String> labels = Map.of();
    private Lookup<List<ContainerHandle>> containers = Lookup.of(List.of());
    private Lookup<List<ContainerStatus>> statuses = Lookup.of(List.of());
    private Lookup<String> status;
    private Lookup<ContainerHandle> infra = Lookup.failed("pod has no infra container");

    public StubPod(String id, String name) {
        this.id = id;
        this.name = name;
    }

    public static StubPod pod(String id, String name) {
        return new StubPod(id, name);
    }

    /**
     * A pod whose every fallible lookup fails.
     */
    public static StubPod broken(String id, String name) {
        StubPod pod = new StubPod(id, name);
        pod.containers = Lookup.failed("runtime unavailable");
        pod.statuses = Lookup.failed("runtime unavailable");
        pod.status = Lookup.failed("runtime unavailable");
        pod.infra = Lookup.failed("runtime unavailable");
        return pod;
    }

    public StubPod created(Instant created) {
        this.created = created;
        return this;
    }

    public StubPod labels(Map<String, String> labels) {
        this.labels = labels;
        return this;
    }

    public StubPod containers(ContainerHandle... containers) {
        this.containers = Lookup.of(List.of(containers));
        return this;
    }

    public StubPod containersFail(String reason) {
        this.containers = Lookup.failed(reason);
        return this;
    }

    public StubPod statuses(ContainerStatus... statuses) {
        this.statuses = Lookup.of(List.of(statuses));
        return this;
    }

    public StubPod statusesFail(String reason) {
        this.statuses = Lookup.failed(reason);
        return this;
    }

    public StubPod status(String status) {
        this.status = Lookup.of(status);
        return this;
    }

    public StubPod statusFail(String reason) {
        this.status = Lookup.failed(reason);
        return this;
    }

    public StubPod infra(String... networks) {
        this.infra = Lookup.of(StubContainer.of("infra0", "infra", networks));
        return this;
    }

    public StubPod infra(ContainerHandle infra) {
        this.infra = Lookup.of(infra);
        return this;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Instant created() {
        return created;
    }

    @Override
    public Map<String, String> labels() {
        return labels;
    }

    @Override
    public Lookup<List<String>> containerIds() {
        if (containers.isFailed()) {
            return Lookup.failed(containers.failure());
        }
        return Lookup.of(containers.value().stream().map(ContainerHandle::id).toList());
    }

    @Override
    public Lookup<List<ContainerHandle>> containers() {
        return containers;
    }

    @Override
    public Lookup<List<ContainerStatus>> containerStatuses() {
        return statuses;
    }

    @Override
    public Lookup<String> status() {
        if (status != null) {
            return status;
        }
        return statuses.isFailed() ? Lookup.failed(statuses.failure()) : Lookup.of(PodStates.derive(statuses.value()));
    }

    @Override
    public Lookup<ContainerHandle> infraContainer() {
        return infra;
    }

    public record StubContainer(String id, String name, Lookup<List<String>> networks) implements ContainerHandle {

        public static StubContainer of(String id, String name, String... networks) {
            return new StubContainer(id, name, Lookup.of(List.of(networks)));
        }

        public static StubContainer withoutNetworks(String id, String name, String reason) {
            return new StubContainer(id, name, Lookup.failed(reason));
        }
    }
}
