package com.podscope.filter;

import com.podscope.filter.support.LabelFilters;
import com.podscope.filter.support.Regexes;
import com.podscope.filter.support.UntilTimestamps;
import com.podscope.model.ContainerHandle;
import com.podscope.model.ContainerStatus;
import com.podscope.model.Lookup;
import com.podscope.model.Pod;
import com.podscope.network.NetworkRegistry;
import com.podscope.network.NoSuchNetworkException;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Compiles a filter request ({@code family} plus values) into a predicate over pods.
 *
 * <p>Values of one request are OR-combined. Problems with the request itself (unknown family, value
 * outside the family vocabulary, registry failure while resolving networks) are thrown at compile
 * time. Problems reading a pod while the predicate runs never escape: the pod simply does not match.
 */
@ApplicationScoped
public class PodFilters {

    private static final Logger LOGGER = Logger.getLogger("FILTER.PodFilters");

    static final List<String> CONTAINER_STATUSES = List.of("created", "running", "paused", "stopped", "exited", "unknown");

    static final List<String> POD_STATUSES = List.of("stopped", "running", "paused", "exited", "dead", "created", "degraded");

    /**
     * Older releases looked at the first container only for {@code ctr-names}.
     */
    @ConfigProperty(name = "podscope.filter.ctr-names.first-container-only", defaultValue = "false")
    boolean ctrNamesFirstContainerOnly;

    Clock clock = Clock.systemDefaultZone();

    @PostConstruct
    void init() {
        LOGGER.infov(
                "[INIT] PodFilters listo. families={0} ctrNamesFirstContainerOnly={1}",
                FilterFamily.keys(),
                ctrNamesFirstContainerOnly);
    }

    /**
     * @param filter name of the filter family, e.g. {@code status}
     * @param values values of the request, OR-combined
     * @param networks registry used to resolve {@code network} values; ignored by other families
     * @throws InvalidFilterException when the family is unknown or a value is outside its vocabulary
     * @throws com.podscope.network.NetworkLookupException when the registry fails for a reason other
     *     than an unknown network
     */
    public Predicate<Pod> compile(String filter, List<String> values, NetworkRegistry networks) {
        FilterFamily family = FilterFamily.fromKey(filter)
                .orElseThrow(() -> new InvalidFilterException("invalid filter: " + filter));
        List<String> wanted = List.copyOf(Objects.requireNonNull(values, "values"));
        LOGGER.debugv("[COMPILE] filter={0} values={1}", family.key(), wanted);
        return switch (family) {
            case ID -> byId(wanted);
            case NAME -> byName(wanted);
            case CTR_IDS -> byContainerIds(wanted);
            case CTR_NAMES -> byContainerNames(wanted);
            case CTR_NUMBER -> byContainerNumber(wanted);
            case CTR_STATUS -> byContainerStatus(wanted);
            case STATUS -> byPodStatus(wanted);
            case LABEL -> pod -> LabelFilters.matches(wanted, pod.labels());
            case UNTIL -> byUntil(wanted);
            case NETWORK -> byNetwork(wanted, networks);
        };
    }

    private Predicate<Pod> byId(List<String> wanted) {
        List<Predicate<String>> matchers = identifierMatchers(wanted);
        return pod -> matchesAny(pod.id(), matchers);
    }

    private Predicate<Pod> byName(List<String> wanted) {
        List<Pattern> patterns = Regexes.compileAll(wanted);
        return pod -> Regexes.matchesAny(pod.name(), patterns);
    }

    private Predicate<Pod> byContainerIds(List<String> wanted) {
        List<Predicate<String>> matchers = identifierMatchers(wanted);
        return pod -> {
            Lookup<List<String>> ids = pod.containerIds();
            if (ids.isFailed()) {
                return false;
            }
            return ids.value().stream().anyMatch(id -> matchesAny(id, matchers));
        };
    }

    private Predicate<Pod> byContainerNames(List<String> wanted) {
        List<Pattern> patterns = Regexes.compileAll(wanted);
        boolean firstOnly = ctrNamesFirstContainerOnly;
        return pod -> {
            Lookup<List<ContainerHandle>> containers = pod.containers();
            if (containers.isFailed() || containers.value().isEmpty()) {
                return false;
            }
            if (firstOnly) {
                return Regexes.matchesAny(containers.value().get(0).name(), patterns);
            }
            return containers.value().stream()
                    .anyMatch(container -> Regexes.matchesAny(container.name(), patterns));
        };
    }

    private Predicate<Pod> byContainerNumber(List<String> wanted) {
        return pod -> {
            Lookup<List<ContainerHandle>> containers = pod.containers();
            if (containers.isFailed()) {
                return false;
            }
            int count = containers.value().size();
            for (String value : wanted) {
                try {
                    if (Integer.parseInt(value) == count) {
                        return true;
                    }
                } catch (NumberFormatException e) {
                    LOGGER.tracev("[CTR-NUMBER] ignoring non numeric value {0}", value);
                }
            }
            return false;
        };
    }

    private Predicate<Pod> byContainerStatus(List<String> wanted) {
        for (String value : wanted) {
            if (!CONTAINER_STATUSES.contains(value)) {
                throw new InvalidFilterException(value + " is not a valid status");
            }
        }
        Set<String> states = new LinkedHashSet<>();
        for (String value : wanted) {
            states.add("stopped".equals(value) ? ContainerStatus.EXITED.label() : value);
        }
        Set<String> normalized = Set.copyOf(states);
        return pod -> {
            Lookup<List<ContainerStatus>> statuses = pod.containerStatuses();
            if (statuses.isFailed()) {
                return false;
            }
            return statuses.value().stream()
                    .map(PodFilters::normalizeContainerState)
                    .anyMatch(normalized::contains);
        };
    }

    private Predicate<Pod> byPodStatus(List<String> wanted) {
        for (String value : wanted) {
            if (!POD_STATUSES.contains(value)) {
                throw new InvalidFilterException(value + " is not a valid pod status");
            }
        }
        return pod -> {
            Lookup<String> status = pod.status();
            if (status.isFailed()) {
                return false;
            }
            return wanted.contains(status.value().toLowerCase(Locale.ROOT));
        };
    }

    /**
     * The threshold is recomputed on every evaluation, so a relative value such as {@code 10m}
     * follows the clock while the predicate is in use.
     */
    private Predicate<Pod> byUntil(List<String> wanted) {
        Clock evaluationClock = clock;
        return pod -> {
            Instant created = pod.created();
            if (created == null) {
                return false;
            }
            try {
                return created.isBefore(UntilTimestamps.compute(wanted, evaluationClock));
            } catch (IllegalArgumentException e) {
                LOGGER.debugv("[UNTIL] pod={0} reason={1}", pod.id(), e.getMessage());
                return false;
            }
        };
    }

    private Predicate<Pod> byNetwork(List<String> wanted, NetworkRegistry networks) {
        Objects.requireNonNull(networks, "a network registry is required for the network filter");
        Set<String> names = new LinkedHashSet<>();
        for (String value : wanted) {
            try {
                names.add(networks.resolve(value).name());
            } catch (NoSuchNetworkException e) {
                LOGGER.debugv("[NETWORK] skipping unknown network {0}", value);
            }
        }
        Set<String> canonical = Set.copyOf(names);
        return pod -> {
            if (canonical.isEmpty()) {
                return false;
            }
            Lookup<ContainerHandle> infra = pod.infraContainer();
            if (infra.isFailed()) {
                return false;
            }
            Lookup<List<String>> attached = infra.value().networks();
            if (attached.isFailed() || attached.value().isEmpty()) {
                return false;
            }
            return attached.value().stream().anyMatch(canonical::contains);
        };
    }

    private static List<Predicate<String>> identifierMatchers(List<String> wanted) {
        return wanted.stream().map(Regexes::identifierMatcher).toList();
    }

    private static boolean matchesAny(String candidate, List<Predicate<String>> matchers) {
        for (Predicate<String> matcher : matchers) {
            if (matcher.test(candidate)) {
                return true;
            }
        }
        return false;
    }

    static String normalizeContainerState(ContainerStatus status) {
        return switch (status) {
            case CONFIGURED -> ContainerStatus.CREATED.label();
            case STOPPED -> ContainerStatus.EXITED.label();
            default -> status.label();
        };
    }
}
