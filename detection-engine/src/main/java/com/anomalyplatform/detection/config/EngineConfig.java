package com.anomalyplatform.detection.config;

import com.anomalyplatform.common.alert.AlertType;
import com.anomalyplatform.common.alert.Severity;
import com.anomalyplatform.common.config.AlertThreshold;
import com.anomalyplatform.common.config.DetectionConfig;
import com.anomalyplatform.common.config.DetectorKind;
import com.anomalyplatform.common.config.DetectorSettings;
import com.anomalyplatform.common.config.SensitivityLevel;
import com.anomalyplatform.common.config.SuppressionRule;
import com.anomalyplatform.common.exception.ConfigurationException;
import com.anomalyplatform.common.model.SeasonPhase;
import com.anomalyplatform.detection.client.MetricsServiceClient;
import com.anomalyplatform.detection.provider.ClusterCenterProvider;
import com.anomalyplatform.detection.provider.HistoricalAlertStore;
import com.anomalyplatform.detection.provider.StaticClusterCenterProvider;
import com.anomalyplatform.detection.scoring.ClusterAssigner;
import com.anomalyplatform.detection.scoring.ClusterModel;
import com.anomalyplatform.detection.scoring.EuclideanClusterModel;
import com.anomalyplatform.detection.scoring.ExpectedTrendModel;
import com.anomalyplatform.detection.scoring.PatternComparator;
import com.anomalyplatform.detection.scoring.PatternScorer;
import com.anomalyplatform.detection.scoring.SeasonPhaseExpectedTrendModel;
import com.anomalyplatform.detection.scoring.WeightedMeanPatternScorer;
import com.anomalyplatform.detection.store.InMemoryHistoricalAlertStore;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeUnit;

@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Value("${services.metrics.base-url}")
    private String metricsUrl;

    @Value("${anomaly.detection.sensitivity:medium}")
    private String sensitivity;

    @Value("${anomaly.detection.disabled-detectors:}")
    private List<String> disabledDetectors;

    @Value("${anomaly.detection.min-confidence:60}")
    private double minConfidence;

    @Value("${anomaly.detection.max-false-positive-probability:40}")
    private double maxFalsePositiveProbability;

    @Value("${anomaly.detection.max-alerts:20}")
    private int maxAlerts;

    @Value("${anomaly.detection.related-alert-window:48h}")
    private Duration relatedAlertWindow;

    @Value("${anomaly.detection.suppression-lookback:24h}")
    private Duration suppressionLookback;

    @Value("${anomaly.detection.high-stakes-phases:playoffs}")
    private List<String> highStakesPhases;

    @Value("${anomaly.detection.cluster-distance-threshold:15}")
    private double clusterDistanceThreshold;

    @Value("${anomaly.detection.fetch-timeout:5s}")
    private Duration fetchTimeout;

    @Value("${anomaly.detection.default-window-days:30}")
    private int defaultWindowDays;

    @Value("${anomaly.clusters.location:classpath:cluster-centers.json}")
    private String clusterCentersLocation;

    /** Built and validated once; an invalid configuration stops the application. */
    @Bean
    public DetectionConfig detectionConfig() {
        DetectionConfig.Builder b = DetectionConfig.defaultBuilder()
            .sensitivity(SensitivityLevel.fromKey(sensitivity))
            .minConfidence(minConfidence)
            .maxFalsePositiveProbability(maxFalsePositiveProbability)
            .maxAlerts(maxAlerts)
            .relatedAlertWindow(relatedAlertWindow)
            .highStakesPhases(phases(highStakesPhases))
            .clusterDistanceThreshold(clusterDistanceThreshold)
            .fetchTimeout(fetchTimeout)
            .defaultWindowDays(defaultWindowDays)
            .alertThreshold(new AlertThreshold(AlertType.STATISTICAL_OUTLIER, 70,
                Severity.MEDIUM,
                List.of(SuppressionRule.recentSimilarAlert(suppressionLookback, "Avoid alert fatigue"))));
        for (String name : disabledDetectors) {
            if (name.isBlank()) continue;
            b.detector(detectorKind(name), DetectorSettings.disabled());
        }
        DetectionConfig config = b.build();
        log.info("[EngineConfig] detection config loaded: {}", config);
        return config;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /** Netty-level timeouts back the per-fetch Reactor timeout of a detection run. */
    @Bean
    public WebClient metricsClient(WebClient.Builder builder) {
        int timeoutMillis = (int) fetchTimeout.toMillis();
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutMillis)
            .responseTimeout(fetchTimeout)
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(timeoutMillis, TimeUnit.MILLISECONDS)));
        return builder
            .baseUrl(metricsUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .build();
    }

    @Bean
    public MetricsServiceClient metricsServiceClient(WebClient metricsClient) {
        return new MetricsServiceClient(metricsClient);
    }

    @Bean
    public HistoricalAlertStore historicalAlertStore(Clock clock) {
        return new InMemoryHistoricalAlertStore(clock);
    }

    @Bean
    public ClusterCenterProvider clusterCenterProvider(ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        Resource resource = resourceLoader.getResource(clusterCentersLocation);
        return StaticClusterCenterProvider.fromResource(resource, objectMapper);
    }

    @Bean
    public PatternScorer patternScorer(DetectionConfig detectionConfig) {
        return new WeightedMeanPatternScorer(detectionConfig.monitoredMetrics());
    }

    @Bean
    public PatternComparator patternComparator(PatternScorer patternScorer) {
        return new PatternComparator(patternScorer);
    }

    @Bean
    public ClusterModel clusterModel() {
        return new EuclideanClusterModel();
    }

    @Bean
    public ClusterAssigner clusterAssigner(ClusterModel clusterModel) {
        return new ClusterAssigner(clusterModel);
    }

    @Bean
    public ExpectedTrendModel expectedTrendModel() {
        return new SeasonPhaseExpectedTrendModel();
    }

    // ── parsing helpers ──────────────────────────────────────────────────────

    private static Set<SeasonPhase> phases(List<String> keys) {
        Set<SeasonPhase> out = EnumSet.noneOf(SeasonPhase.class);
        for (String key : keys) {
            if (!key.isBlank()) out.add(SeasonPhase.fromKey(key));
        }
        return out;
    }

    private static DetectorKind detectorKind(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (DetectorKind kind : DetectorKind.values()) {
            if (kind.detectorName().equals(normalized) || kind.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return kind;
            }
        }
        throw new ConfigurationException(List.of("unknown detector " + name));
    }
}
