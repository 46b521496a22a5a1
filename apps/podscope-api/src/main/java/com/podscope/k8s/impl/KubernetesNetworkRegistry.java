package com.podscope.k8s.impl;

import com.podscope.network.Network;
import com.podscope.network.NetworkLookupException;
import com.podscope.network.NetworkRegistry;
import com.podscope.network.NoSuchNetworkException;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves networks against the Multus {@code NetworkAttachmentDefinition} resources of a
 * namespace. A reference is either {@code name} (looked up in the registry namespace) or
 * {@code namespace/name}; the canonical name is always {@code namespace/name}. {@code host} names
 * the node network used by host-network pods.
 */
public class KubernetesNetworkRegistry implements NetworkRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(KubernetesNetworkRegistry.class);

    static final ResourceDefinitionContext NETWORK_ATTACHMENT_DEFINITION = new ResourceDefinitionContext.Builder()
            .withGroup("k8s.cni.cncf.io")
            .withVersion("v1")
            .withKind("NetworkAttachmentDefinition")
            .withPlural("network-attachment-definitions")
            .withNamespaced(true)
            .build();

    private final KubernetesClient client;
    private final String namespace;

    public KubernetesNetworkRegistry(KubernetesClient client, String namespace) {
        this.client = client;
        this.namespace = namespace;
    }

    @Override
    public Network resolve(String reference) {
        String trimmed = reference == null ? "" : reference.trim();
        if (trimmed.isEmpty()) {
            throw new NoSuchNetworkException(String.valueOf(reference));
        }
        if (KubernetesPod.HOST_NETWORK.equals(trimmed)) {
            return new Network(KubernetesPod.HOST_NETWORK, KubernetesPod.HOST_NETWORK);
        }
        String canonical = KubernetesPod.canonicalName(trimmed, namespace);
        int separator = canonical.indexOf('/');
        String targetNamespace = canonical.substring(0, separator);
        String name = canonical.substring(separator + 1);
        try {
            GenericKubernetesResource definition = client.genericKubernetesResources(NETWORK_ATTACHMENT_DEFINITION)
                    .inNamespace(targetNamespace)
                    .withName(name)
                    .get();
            if (definition == null) {
                throw new NoSuchNetworkException(trimmed);
            }
            String id = Optional.ofNullable(definition.getMetadata()).map(meta -> meta.getUid()).orElse(canonical);
            return new Network(id, canonical);
        } catch (KubernetesClientException e) {
            if (e.getCode() == 404) {
                throw new NoSuchNetworkException(trimmed, e);
            }
            LOGGER.warn("Failed to inspect network {} in namespace {}: {}", name, targetNamespace, e.getMessage());
            throw new NetworkLookupException("unable to inspect network " + trimmed + ": " + e.getMessage(), e);
        }
    }
}
