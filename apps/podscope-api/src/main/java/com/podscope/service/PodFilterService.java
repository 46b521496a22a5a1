package com.podscope.service;

import com.podscope.filter.InvalidFilterException;
import com.podscope.filter.PodFilters;
import com.podscope.k8s.PodInventory;
import com.podscope.model.ContainerHandle;
import com.podscope.model.ContainerStatus;
import com.podscope.model.Lookup;
import com.podscope.model.Pod;
import com.podscope.model.PodSummary;
import com.podscope.network.NetworkRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.stream.Stream;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Applies {@code key=value} filter expressions to a set of pods. Values given for the same key are
 * OR-combined by the compiled predicate, different keys are AND-combined here.
 */
@ApplicationScoped
public class PodFilterService {

    private static final Logger LOGGER = Logger.getLogger("SERVICE.PodFilterService");

    @Inject
    PodFilters filters;

    @Inject
    PodInventory inventory;

    @ConfigProperty(name = "podscope.scan.parallel", defaultValue = "false")
    boolean parallelScan;

    /**
     * Groups {@code key=value} expressions by key, keeping the order in which keys and values were
     * given.
     *
     * @throws InvalidFilterException when an expression has no {@code =}
     */
    public static Map<String, List<String>> parse(Collection<String> expressions) {
        Map<String, List<String>> grouped = new LinkedHashMap<>();
        if (expressions == null) {
            return grouped;
        }
        for (String expression : expressions) {
            int separator = expression == null ? -1 : expression.indexOf('=');
            if (separator < 0) {
                throw new InvalidFilterException(
                        "filter input must be in the form of filter=value: " + expression + " is invalid");
            }
            grouped.computeIfAbsent(expression.substring(0, separator), key -> new ArrayList<>())
                    .add(expression.substring(separator + 1));
        }
        return grouped;
    }

    /**
     * Compiles every family before any pod is looked at, so a bad request fails as a whole.
     */
    public Predicate<Pod> compileAll(Map<String, List<String>> request, NetworkRegistry networks) {
        Predicate<Pod> combined = pod -> true;
        for (Map.Entry<String, List<String>> entry : request.entrySet()) {
            combined = combined.and(filters.compile(entry.getKey(), entry.getValue(), networks));
        }
        return combined;
    }

    public List<Pod> select(Collection<? extends Pod> pods, Predicate<Pod> predicate) {
        Stream<? extends Pod> stream = parallelScan ? pods.parallelStream() : pods.stream();
        return stream.filter(predicate).map(Pod.class::cast).toList();
    }

    public List<PodSummary> list(String namespace, List<String> expressions) {
        String requestId = UUID.randomUUID().toString();
        Map<String, List<String>> request = parse(expressions);
        Predicate<Pod> predicate = compileAll(request, inventory.networks(namespace));

        Instant start = Instant.now();
        LOGGER.infov("[COMM-START] requestId={0} target=PodInventory ns={1} filters={2}", requestId, namespace, request);
        List<? extends Pod> pods = inventory.listPods(namespace);
        List<Pod> selected = select(pods, predicate);
        LOGGER.infov(
                "[COMM-END] requestId={0} target=PodInventory durationMs={1} scanned={2} matched={3}",
                requestId,
                Duration.between(start, Instant.now()).toMillis(),
                pods.size(),
                selected.size());

        return selected.stream()
                .map(PodFilterService::summarize)
                .sorted(Comparator.comparing(PodSummary::name, Comparator.nullsLast(String::compareTo)))
                .toList();
    }

    static PodSummary summarize(Pod pod) {
        List<ContainerHandle> containers = pod.containers().toOptional().orElse(List.of());
        List<ContainerStatus> states = pod.containerStatuses().toOptional().orElse(List.of());
        List<PodSummary.ContainerState> containerStates = new ArrayList<>(containers.size());
        for (int i = 0; i < containers.size(); i++) {
            ContainerHandle container = containers.get(i);
            String state = i < states.size() ? states.get(i).label() : ContainerStatus.UNKNOWN.label();
            containerStates.add(new PodSummary.ContainerState(container.id(), container.name(), state));
        }
        Lookup<String> status = pod.status();
        return new PodSummary(
                pod.id(),
                pod.name(),
                status.isFailed() ? "Unknown" : status.value(),
                pod.created(),
                pod.labels() == null ? Map.of() : Map.copyOf(pod.labels()),
                List.copyOf(containerStates));
    }
}
