package com.podscope.api;

import com.podscope.filter.FilterFamily;
import com.podscope.filter.InvalidFilterException;
import com.podscope.model.PodSummary;
import com.podscope.network.NetworkLookupException;
import com.podscope.service.PodFilterService;
import jakarta.annotation.PostConstruct;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

@Path("/v1/pods")
@Produces(MediaType.APPLICATION_JSON)
public class PodResource {

    private static final Logger LOGGER = Logger.getLogger("API.PodResource");

    @Inject
    PodFilterService service;

    @ConfigProperty(name = "podscope.namespace.default", defaultValue = "default")
    String defaultNamespace;

    @PostConstruct
    void init() {
        LOGGER.infov(
                "[INIT] PodResource listo. service={0}, defaultNamespace={1}",
                service != null ? service.getClass().getSimpleName() : "<null>",
                defaultNamespace);
    }

    @GET
    public List<PodSummary> pods(@QueryParam("ns") String namespace,
            @QueryParam("filter") List<String> filters) {
        String requestId = UUID.randomUUID().toString();
        String ns = namespace == null || namespace.isBlank() ? defaultNamespace : namespace;
        List<String> expressions = filters == null ? List.of() : filters;
        try {
            List<PodSummary> pods = service.list(ns, expressions);
            LOGGER.infov("[FILTER-SUCCESS] requestId={0} ns={1} filters={2} matched={3}",
                    requestId, ns, expressions, pods.size());
            return pods;
        } catch (InvalidFilterException e) {
            LOGGER.warnv("[FILTER-ERROR] requestId={0} ns={1} filters={2} reason={3}",
                    requestId, ns, expressions, e.getMessage());
            throw failure(Response.Status.BAD_REQUEST, e.getMessage(), requestId, e);
        } catch (NetworkLookupException e) {
            LOGGER.errorf(e, "[COMM-ERROR] requestId=%s target=NetworkRegistry ns=%s", requestId, ns);
            throw failure(Response.Status.BAD_GATEWAY, e.getMessage(), requestId, e);
        }
    }

    @GET
    @Path("/filters")
    public List<String> filters() {
        return FilterFamily.keys();
    }

    private WebApplicationException failure(Response.Status status, String message, String requestId, Exception cause) {
        Response response = Response.status(status)
                .entity(Map.of(
                        "mensaje", message,
                        "requestId", requestId))
                .type(MediaType.APPLICATION_JSON)
                .build();
        return new WebApplicationException(cause, response);
    }
}
