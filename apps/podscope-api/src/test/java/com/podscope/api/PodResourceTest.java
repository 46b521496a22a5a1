package com.podscope.api;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItems;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.notNullValue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doReturn;

import com.podscope.k8s.PodInventory;
import com.podscope.model.ContainerStatus;
import com.podscope.model.StubPod;
import com.podscope.model.StubPod.StubContainer;
import com.podscope.network.Network;
import com.podscope.network.NetworkLookupException;
import com.podscope.network.NetworkRegistry;
import com.podscope.network.NoSuchNetworkException;
import io.quarkus.test.InjectMock;
import io.quarkus.test.junit.QuarkusTest;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

@QuarkusTest
class PodResourceTest {

    @InjectMock
    PodInventory inventory;

    @BeforeEach
    void installInventory() {
        NetworkRegistry registry = reference -> {
            if ("broken".equals(reference)) {
                throw new NetworkLookupException("registry unavailable");
            }
            if ("ghost".equals(reference)) {
                throw new NoSuchNetworkException(reference);
            }
            return new Network(reference, "shop/" + reference);
        };
        List<StubPod> pods = List.of(
                StubPod.pod("aaaa", "web-1")
                        .created(Instant.parse("2024-01-01T00:00:00Z"))
                        .labels(Map.of("app", "web"))
                        .containers(StubContainer.of("c1", "app"))
                        .statuses(ContainerStatus.RUNNING)
                        .infra("shop/macvlan"),
                StubPod.pod("bbbb", "web-2")
                        .labels(Map.of("app", "web"))
                        .containers(StubContainer.of("c2", "app"))
                        .statuses(ContainerStatus.EXITED),
                StubPod.pod("cccc", "db-0")
                        .labels(Map.of("app", "db"))
                        .containers(StubContainer.of("c3", "postgres"))
                        .statuses(ContainerStatus.RUNNING));

        doReturn(pods).when(inventory).listPods(anyString());
        doReturn(registry).when(inventory).networks(anyString());
    }

    @Test
    void listsEveryPodWithoutFilters() {
        given()
                .when().get("/v1/pods?ns=shop")
                .then()
                .statusCode(200)
                .body("name", contains("db-0", "web-1", "web-2"));
    }

    @Test
    void combinesFiltersAcrossFamilies() {
        given()
                .queryParam("ns", "shop")
                .queryParam("filter", "label=app=web", "status=running")
                .when().get("/v1/pods")
                .then()
                .statusCode(200)
                .body("$", hasSize(1))
                .body("[0].name", equalTo("web-1"))
                .body("[0].status", equalTo("Running"))
                .body("[0].created", notNullValue())
                .body("[0].containers[0].state", equalTo("running"));
    }

    @Test
    void unknownNetworksAreIgnored() {
        given()
                .queryParam("filter", "network=ghost", "network=macvlan")
                .when().get("/v1/pods")
                .then()
                .statusCode(200)
                .body("name", contains("web-1"));
    }

    @Test
    void unknownFamilyIsBadRequest() {
        given()
                .queryParam("filter", "bogus=1")
                .when().get("/v1/pods")
                .then()
                .statusCode(400)
                .body("mensaje", equalTo("invalid filter: bogus"))
                .body("requestId", notNullValue());
    }

    @Test
    void statusOutsideVocabularyIsBadRequest() {
        given()
                .queryParam("filter", "status=unknown")
                .when().get("/v1/pods")
                .then()
                .statusCode(400)
                .body("mensaje", equalTo("unknown is not a valid pod status"));
    }

    @Test
    void malformedExpressionIsBadRequest() {
        given()
                .queryParam("filter", "running")
                .when().get("/v1/pods")
                .then()
                .statusCode(400);
    }

    @Test
    void registryFailureIsBadGateway() {
        given()
                .queryParam("filter", "network=broken")
                .when().get("/v1/pods")
                .then()
                .statusCode(502)
                .body("mensaje", equalTo("registry unavailable"));
    }

    @Test
    void listsFilterFamilies() {
        given()
                .when().get("/v1/pods/filters")
                .then()
                .statusCode(200)
                .body("$", hasSize(10))
                .body("$", hasItems("id", "ctr-status", "until", "network"));
    }
}
