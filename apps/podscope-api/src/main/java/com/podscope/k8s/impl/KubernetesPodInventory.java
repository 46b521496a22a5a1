package com.podscope.k8s.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.podscope.k8s.PodInventory;
import com.podscope.network.NetworkRegistry;
import io.fabric8.kubernetes.client.KubernetesClient;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@ApplicationScoped
public class KubernetesPodInventory implements PodInventory {

    private static final Logger LOGGER = LoggerFactory.getLogger(KubernetesPodInventory.class);

    private final KubernetesClient client;
    private final ObjectMapper mapper;

    @ConfigProperty(name = "podscope.namespace.default", defaultValue = "default")
    String defaultNamespace;

    @Inject
    public KubernetesPodInventory(KubernetesClient client, ObjectMapper mapper) {
        this.client = client;
        this.mapper = mapper;
    }

    @Override
    public List<KubernetesPod> listPods(String namespace) {
        var podList = (namespace == null || namespace.isBlank())
                ? client.pods().inAnyNamespace().list()
                : client.pods().inNamespace(namespace).list();
        List<KubernetesPod> pods = Optional.ofNullable(podList)
                .map(list -> list.getItems())
                .orElse(List.of())
                .stream()
                .map(pod -> new KubernetesPod(pod, mapper))
                .toList();
        LOGGER.debug("Listed {} pods in namespace {}", pods.size(), namespace == null || namespace.isBlank() ? "<all>" : namespace);
        return pods;
    }

    @Override
    public NetworkRegistry networks(String namespace) {
        String target = namespace == null || namespace.isBlank() ? defaultNamespace : namespace;
        return new KubernetesNetworkRegistry(client, target);
    }
}
