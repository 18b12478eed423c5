package com.anomalyplatform.detection.client;

import com.anomalyplatform.common.exception.DataSourceUnavailableException;
import com.anomalyplatform.common.model.CurrentData;
import com.anomalyplatform.common.model.DetectionContext;
import com.anomalyplatform.common.model.EntityType;
import com.anomalyplatform.common.model.HistoricalData;
import com.anomalyplatform.common.model.TimeWindow;
import com.anomalyplatform.common.trace.TraceContextUtil;
import com.anomalyplatform.detection.provider.ContextProvider;
import com.anomalyplatform.detection.provider.CurrentDataProvider;
import com.anomalyplatform.detection.provider.HistoricalDataProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * Reads history, latest snapshot and context of an entity from the metrics service.
 *
 * <p>A 404 means "no data" and completes empty. Any other failure surfaces as
 * {@link DataSourceUnavailableException}; the orchestrator turns it into a degradation.
 * The run id travels as {@code X-Run-Id}.
 */
public class MetricsServiceClient implements HistoricalDataProvider, CurrentDataProvider, ContextProvider {

    private static final Logger log = LoggerFactory.getLogger(MetricsServiceClient.class);

    static final String BASE_PATH = "/api/v1/metrics/{entityType}/{entityId}";
    static final String RUN_ID_HEADER = "X-Run-Id";

    private final WebClient metricsClient;

    public MetricsServiceClient(WebClient metricsClient) {
        this.metricsClient = metricsClient;
    }

    @Override
    public Mono<HistoricalData> get(EntityType entityType, String entityId, TimeWindow window) {
        return Mono.deferContextual(ctx -> metricsClient.get()
                .uri(uri -> uri.path(BASE_PATH + "/history")
                    .queryParam("from", window.start())
                    .queryParam("to", window.end())
                    .queryParam("granularity", window.granularity().key())
                    .build(entityType.key(), entityId))
                .header(RUN_ID_HEADER, TraceContextUtil.getRunId(ctx))
                .retrieve()
                .bodyToMono(HistoricalData.class)
                .doOnNext(h -> log.debug("[MetricsClient] history entity={}:{} snapshots={}",
                    entityType.key(), entityId, h.size())))
            .onErrorResume(e -> notFoundOrFail(e, "historical-data", entityType, entityId));
    }

    @Override
    public Mono<CurrentData> get(EntityType entityType, String entityId) {
        return Mono.deferContextual(ctx -> metricsClient.get()
                .uri(BASE_PATH + "/current", entityType.key(), entityId)
                .header(RUN_ID_HEADER, TraceContextUtil.getRunId(ctx))
                .retrieve()
                .bodyToMono(CurrentData.class))
            .onErrorResume(e -> notFoundOrFail(e, "current-data", entityType, entityId));
    }

    @Override
    public Mono<DetectionContext> build(EntityType entityType, String entityId) {
        return Mono.deferContextual(ctx -> metricsClient.get()
                .uri(BASE_PATH + "/context", entityType.key(), entityId)
                .header(RUN_ID_HEADER, TraceContextUtil.getRunId(ctx))
                .retrieve()
                .bodyToMono(DetectionContext.class))
            .onErrorResume(e -> notFoundOrFail(e, "context", entityType, entityId));
    }

    private static <T> Mono<T> notFoundOrFail(Throwable e, String source, EntityType type, String id) {
        if (e instanceof WebClientResponseException.NotFound) {
            log.debug("[MetricsClient] {} not found for entity={}:{}", source, type.key(), id);
            return Mono.empty();
        }
        return Mono.error(new DataSourceUnavailableException(source, type.key() + ":" + id, e));
    }
}
