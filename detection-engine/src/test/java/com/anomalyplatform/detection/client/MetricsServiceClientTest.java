package com.anomalyplatform.detection.client;

import com.anomalyplatform.common.exception.DataSourceUnavailableException;
import com.anomalyplatform.common.model.EntityType;
import com.anomalyplatform.common.model.MetricName;
import com.anomalyplatform.common.model.SeasonPhase;
import com.anomalyplatform.common.trace.TraceContextUtil;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicReference;

import static com.anomalyplatform.detection.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class MetricsServiceClientTest {

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    private MetricsServiceClient client(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
            .baseUrl("http://metrics.test")
            .exchangeFunction(request -> {
                lastRequest.set(request);
                return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
            })
            .build();
        return new MetricsServiceClient(webClient);
    }

    @Test
    @DisplayName("history is requested with window and granularity and carries the run id")
    void history() {
        String body = """
            {"snapshots": [
              {"timestamp": "2024-02-28T08:00:00Z", "values": {"performance": 78.5, "load": 61}},
              {"timestamp": "2024-02-29T08:00:00Z", "values": {"performance": 81.0}}
            ]}""";

        StepVerifier.create(TraceContextUtil.withRunId(
                client(HttpStatus.OK, body).get(EntityType.PLAYER, "p1", WINDOW), "run-42"))
            .assertNext(h -> {
                assertEquals(2, h.size());
                assertEquals(78.5, h.snapshots().get(0).value(MetricName.PERFORMANCE).getAsDouble(), 1e-9);
                assertEquals(61.0, h.snapshots().get(0).value(MetricName.LOAD).getAsDouble(), 1e-9);
            })
            .verifyComplete();

        ClientRequest request = lastRequest.get();
        String uri = request.url().toString();
        assertTrue(uri.startsWith("http://metrics.test/api/v1/metrics/player/p1/history?"), uri);
        assertTrue(uri.contains("granularity=daily"), uri);
        assertTrue(uri.contains("from=2024-01-31T08:00:00Z"), uri);
        assertEquals("run-42", request.headers().getFirst(MetricsServiceClient.RUN_ID_HEADER));
    }

    @Test
    void currentData() {
        String body = """
            {"entity": {"type": "player", "id": "p1", "name": "Jordan Reyes"},
             "teamId": "t1", "teamName": "Wolves",
             "snapshot": {"timestamp": "2024-03-01T08:00:00Z", "values": {"performance": 96}}}""";

        StepVerifier.create(client(HttpStatus.OK, body).get(EntityType.PLAYER, "p1"))
            .assertNext(c -> {
                assertEquals("Jordan Reyes", c.entity().name());
                assertEquals("t1", c.teamId());
                assertEquals(NOW, c.snapshot().timestamp());
            })
            .verifyComplete();
        assertEquals("unknown", lastRequest.get().headers().getFirst(MetricsServiceClient.RUN_ID_HEADER));
    }

    @Test
    void context() {
        StepVerifier.create(client(HttpStatus.OK, "{\"seasonPhase\": \"playoffs\"}").build(EntityType.TEAM, "t1"))
            .assertNext(ctx -> {
                assertEquals(SeasonPhase.PLAYOFFS, ctx.seasonPhase());
                assertNull(ctx.teamState());
            })
            .verifyComplete();
        assertTrue(lastRequest.get().url().getPath().endsWith("/api/v1/metrics/team/t1/context"));
    }

    @Test
    @DisplayName("404 means no data")
    void notFoundIsEmpty() {
        StepVerifier.create(client(HttpStatus.NOT_FOUND, "{}").get(EntityType.PLAYER, "p1"))
            .verifyComplete();
    }

    @Test
    @DisplayName("other failures surface as DataSourceUnavailableException")
    void serverErrorIsUnavailable() {
        StepVerifier.create(client(HttpStatus.BAD_GATEWAY, "{}").get(EntityType.PLAYER, "p1", WINDOW))
            .expectErrorSatisfies(e -> {
                assertInstanceOf(DataSourceUnavailableException.class, e);
                assertTrue(e.getMessage().contains("historical-data"), e.getMessage());
            })
            .verify();
    }
}
