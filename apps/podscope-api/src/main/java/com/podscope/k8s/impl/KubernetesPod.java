package com.podscope.k8s.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.podscope.model.ContainerHandle;
import com.podscope.model.ContainerStatus;
import com.podscope.model.Lookup;
import com.podscope.model.Pod;
import com.podscope.model.PodStates;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerState;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Pod} view over a Kubernetes pod. The pod sandbox plays the part of the infra container and
 * its networks come from the Multus annotations.
 */
public class KubernetesPod implements Pod {

    private static final Logger LOGGER = LoggerFactory.getLogger(KubernetesPod.class);

    static final String NETWORK_STATUS_ANNOTATION = "k8s.v1.cni.cncf.io/network-status";
    static final String NETWORKS_ANNOTATION = "k8s.v1.cni.cncf.io/networks";
    static final String HOST_NETWORK = "host";
    static final String SANDBOX_NAME = "POD";

    private final io.fabric8.kubernetes.api.model.Pod pod;
    private final ObjectMapper mapper;
    private final Instant created;

    public KubernetesPod(io.fabric8.kubernetes.api.model.Pod pod, ObjectMapper mapper) {
        this.pod = pod;
        this.mapper = mapper;
        this.created = parseInstant(pod.getMetadata() != null ? pod.getMetadata().getCreationTimestamp() : null);
    }

    @Override
    public String id() {
        return Optional.ofNullable(pod.getMetadata()).map(meta -> meta.getUid()).orElse("");
    }

    @Override
    public String name() {
        return Optional.ofNullable(pod.getMetadata()).map(meta -> meta.getName()).orElse("");
    }

    public String namespace() {
        return Optional.ofNullable(pod.getMetadata()).map(meta -> meta.getNamespace()).orElse("");
    }

    @Override
    public Instant created() {
        return created;
    }

    @Override
    public Map<String, String> labels() {
        return safeMap(pod.getMetadata() != null ? pod.getMetadata().getLabels() : null);
    }

    @Override
    public Lookup<List<String>> containerIds() {
        Lookup<List<ContainerHandle>> containers = containers();
        if (containers.isFailed()) {
            return Lookup.failed(containers.failure());
        }
        return Lookup.of(containers.value().stream()
                .map(ContainerHandle::id)
                .filter(id -> !id.isEmpty())
                .toList());
    }

    @Override
    public Lookup<List<ContainerHandle>> containers() {
        if (pod.getSpec() == null || pod.getSpec().getContainers() == null) {
            return Lookup.failed("pod " + name() + " has no container spec");
        }
        Map<String, io.fabric8.kubernetes.api.model.ContainerStatus> statuses = statusesByName();
        List<ContainerHandle> containers = new ArrayList<>();
        for (Container container : pod.getSpec().getContainers()) {
            io.fabric8.kubernetes.api.model.ContainerStatus status = statuses.get(container.getName());
            String id = status != null ? stripRuntimeScheme(status.getContainerID()) : "";
            containers.add(new SharedNetworkContainer(id, container.getName()));
        }
        return Lookup.of(List.copyOf(containers));
    }

    @Override
    public Lookup<List<ContainerStatus>> containerStatuses() {
        if (pod.getSpec() == null || pod.getSpec().getContainers() == null) {
            return Lookup.failed("pod " + name() + " has no container spec");
        }
        Map<String, io.fabric8.kubernetes.api.model.ContainerStatus> statuses = statusesByName();
        return Lookup.of(pod.getSpec().getContainers().stream()
                .map(container -> toContainerStatus(statuses.get(container.getName())))
                .toList());
    }

    @Override
    public Lookup<String> status() {
        Lookup<List<ContainerStatus>> statuses = containerStatuses();
        if (statuses.isFailed()) {
            return Lookup.failed(statuses.failure());
        }
        return Lookup.of(PodStates.derive(statuses.value()));
    }

    @Override
    public Lookup<ContainerHandle> infraContainer() {
        boolean hostNetwork = pod.getSpec() != null && Boolean.TRUE.equals(pod.getSpec().getHostNetwork());
        String podIp = pod.getStatus() != null ? pod.getStatus().getPodIP() : null;
        if (!hostNetwork && (podIp == null || podIp.isBlank())) {
            return Lookup.failed("sandbox of pod " + name() + " is not running");
        }
        return Lookup.of(new SharedNetworkContainer(id(), SANDBOX_NAME));
    }

    Lookup<List<String>> attachedNetworks() {
        if (pod.getSpec() != null && Boolean.TRUE.equals(pod.getSpec().getHostNetwork())) {
            return Lookup.of(List.of(HOST_NETWORK));
        }
        Map<String, String> annotations = safeMap(pod.getMetadata() != null ? pod.getMetadata().getAnnotations() : null);
        try {
            String networkStatus = annotations.get(NETWORK_STATUS_ANNOTATION);
            if (networkStatus != null && !networkStatus.isBlank()) {
                return Lookup.of(namesFromNetworkStatus(networkStatus));
            }
            String networks = annotations.get(NETWORKS_ANNOTATION);
            if (networks != null && !networks.isBlank()) {
                return Lookup.of(namesFromSelection(networks, namespace()));
            }
            return Lookup.of(List.of());
        } catch (JsonProcessingException e) {
            LOGGER.debug("Unreadable network annotation on pod {}/{}: {}", namespace(), name(), e.getOriginalMessage());
            return Lookup.failed("unreadable network annotation: " + e.getOriginalMessage());
        }
    }

    private List<String> namesFromNetworkStatus(String value) throws JsonProcessingException {
        List<String> names = new ArrayList<>();
        for (JsonNode entry : mapper.readTree(value)) {
            String name = entry.path("name").asText("");
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return List.copyOf(names);
    }

    /**
     * Reads the network selection annotation, either {@code a, ns/b@eth1} or its JSON form, and
     * returns {@code namespace/name} references.
     */
    private List<String> namesFromSelection(String value, String podNamespace) throws JsonProcessingException {
        List<String> names = new ArrayList<>();
        String trimmed = value.trim();
        if (trimmed.startsWith("[")) {
            for (JsonNode entry : mapper.readTree(trimmed)) {
                String name = entry.path("name").asText("");
                if (!name.isEmpty()) {
                    String namespace = entry.path("namespace").asText(podNamespace);
                    names.add(canonicalName(name, namespace));
                }
            }
            return List.copyOf(names);
        }
        Arrays.stream(trimmed.split(","))
                .map(String::trim)
                .filter(item -> !item.isEmpty())
                .map(item -> item.contains("@") ? item.substring(0, item.indexOf('@')) : item)
                .map(item -> canonicalName(item, podNamespace))
                .forEach(names::add);
        return List.copyOf(names);
    }

    static String canonicalName(String reference, String defaultNamespace) {
        return reference.contains("/") ? reference : defaultNamespace + "/" + reference;
    }

    static String stripRuntimeScheme(String containerId) {
        if (containerId == null) {
            return "";
        }
        int scheme = containerId.indexOf("://");
        return scheme < 0 ? containerId : containerId.substring(scheme + 3);
    }

    static ContainerStatus toContainerStatus(io.fabric8.kubernetes.api.model.ContainerStatus status) {
        if (status == null || status.getState() == null) {
            return ContainerStatus.CONFIGURED;
        }
        ContainerState state = status.getState();
        if (state.getRunning() != null) {
            return ContainerStatus.RUNNING;
        }
        if (state.getTerminated() != null) {
            return ContainerStatus.EXITED;
        }
        if (state.getWaiting() != null) {
            boolean ranBefore = status.getLastState() != null && status.getLastState().getTerminated() != null;
            return ranBefore ? ContainerStatus.EXITED : ContainerStatus.CREATED;
        }
        return ContainerStatus.UNKNOWN;
    }

    private Map<String, io.fabric8.kubernetes.api.model.ContainerStatus> statusesByName() {
        Map<String, io.fabric8.kubernetes.api.model.ContainerStatus> byName = new HashMap<>();
        if (pod.getStatus() != null && pod.getStatus().getContainerStatuses() != null) {
            for (io.fabric8.kubernetes.api.model.ContainerStatus status : pod.getStatus().getContainerStatuses()) {
                byName.put(status.getName(), status);
            }
        }
        return byName;
    }

    private Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException ex) {
            LOGGER.debug("Unable to parse creation timestamp {}: {}", value, ex.getMessage());
            return null;
        }
    }

    private Map<String, String> safeMap(Map<String, String> input) {
        return input == null ? Map.of() : Map.copyOf(input);
    }

    /**
     * Containers of a Kubernetes pod all live in the sandbox network namespace.
     */
    private final class SharedNetworkContainer implements ContainerHandle {

        private final String id;
        private final String name;

        SharedNetworkContainer(String id, String name) {
            this.id = id;
            this.name = name;
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
        public Lookup<List<String>> networks() {
            return attachedNetworks();
        }
    }
}
