package com.anomalyplatform.detection.provider;

import com.anomalyplatform.common.exception.ConfigurationException;
import com.anomalyplatform.detection.model.ClusterCenters;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.InputStream;

/**
 * Serves one cluster-center artifact loaded at startup. A {@code null} artifact disables
 * cluster detection.
 */
public class StaticClusterCenterProvider implements ClusterCenterProvider {

    private static final Logger log = LoggerFactory.getLogger(StaticClusterCenterProvider.class);

    private final ClusterCenters centers;

    public StaticClusterCenterProvider(ClusterCenters centers) {
        this.centers = centers;
    }

    /**
     * Reads a JSON artifact ({@code version}, {@code dimensions}, {@code centers}).
     *
     * @throws ConfigurationException when the resource exists but cannot be parsed
     */
    public static StaticClusterCenterProvider fromResource(Resource resource, ObjectMapper mapper) {
        if (resource == null || !resource.exists()) {
            log.info("[ClusterCenters] no artifact found, cluster detection disabled");
            return new StaticClusterCenterProvider(null);
        }
        try (InputStream in = resource.getInputStream()) {
            ClusterCenters loaded = mapper.readValue(in, ClusterCenters.class);
            log.info("[ClusterCenters] loaded version={} dimensions={} centers={}",
                loaded.version(), loaded.dimensions().size(), loaded.centers().size());
            return new StaticClusterCenterProvider(loaded);
        } catch (IOException | IllegalArgumentException e) {
            throw new ConfigurationException("Invalid cluster-center artifact " + resource.getDescription()
                + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Mono<ClusterCenters> current() {
        return Mono.justOrEmpty(centers);
    }
}
