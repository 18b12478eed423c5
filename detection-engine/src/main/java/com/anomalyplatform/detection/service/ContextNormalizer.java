package com.anomalyplatform.detection.service;

import com.anomalyplatform.common.model.DetectionContext;
import com.anomalyplatform.common.model.EntityRef;
import com.anomalyplatform.common.model.EntityType;
import com.anomalyplatform.common.model.PlayerState;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Substitutes documented defaults for missing context fields and reports which ones
 * were missing. A context with missing fields still runs; its alerts lose 5 confidence
 * points.
 */
@Component
public class ContextNormalizer {

    public record NormalizedContext(DetectionContext context, List<String> missingFields) {

        public NormalizedContext {
            missingFields = List.copyOf(missingFields);
        }

        public boolean isDegraded() {
            return !missingFields.isEmpty();
        }
    }

    /**
     * @param raw context as delivered by the provider; {@code null} counts as every field missing
     */
    public NormalizedContext normalize(DetectionContext raw, EntityRef entity) {
        if (raw == null) {
            return new NormalizedContext(forEntity(DetectionContext.defaults(), entity), List.of("context"));
        }
        return new NormalizedContext(forEntity(raw.withDefaults(), entity), raw.missingFields());
    }

    private static DetectionContext forEntity(DetectionContext ctx, EntityRef entity) {
        PlayerState player = ctx.playerState();
        if (entity.type() != EntityType.PLAYER || player.playerId() != null) {
            return ctx;
        }
        PlayerState owned = new PlayerState(entity.id(), player.wellness(), player.motivation(),
            player.fatigue(), player.injuryStatus(), player.lifeStressors(), player.recentChanges());
        return new DetectionContext(ctx.seasonPhase(), ctx.recentEvents(), ctx.environmentalFactors(),
            ctx.teamState(), owned, ctx.workloadContext());
    }
}
