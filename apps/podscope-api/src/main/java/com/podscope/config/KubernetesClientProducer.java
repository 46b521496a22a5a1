package com.podscope.config;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@ApplicationScoped
public class KubernetesClientProducer {

    private static final Logger LOGGER = LoggerFactory.getLogger(KubernetesClientProducer.class);

    @ConfigProperty(name = "podscope.kubernetes.master-url")
    Optional<String> masterUrl;

    @ConfigProperty(name = "podscope.kubernetes.request-timeout-ms", defaultValue = "10000")
    int requestTimeoutMs;

    @Produces
    @ApplicationScoped
    public KubernetesClient kubernetesClient() {
        // kubeconfig, in-cluster service account or environment, whichever is found first
        Config config = Config.autoConfigure(null);
        masterUrl.map(String::trim)
                .filter(value -> !value.isEmpty())
                .ifPresent(config::setMasterUrl);
        config.setRequestTimeout(requestTimeoutMs);
        LOGGER.info("Kubernetes client targeting {} (namespace {})", config.getMasterUrl(), config.getNamespace());
        return new KubernetesClientBuilder().withConfig(config).build();
    }

    void close(@Disposes KubernetesClient client) {
        client.close();
    }
}
