package com.anomalyplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only situational input for one detection run.
 *
 * <p>Every field is optional on the wire. {@link #withDefaults()} substitutes the
 * documented defaults and {@link #missingFields()} reports which ones were absent, so a
 * partially populated context lowers confidence instead of failing the run.
 *
 * <ul>
 *   <li>seasonPhase:          {@link SeasonPhase#REGULAR}</li>
 *   <li>recentEvents:         empty</li>
 *   <li>environmentalFactors: empty</li>
 *   <li>teamState:            {@link TeamState#neutral()}</li>
 *   <li>playerState:          {@link PlayerState#neutral(String)} with no player id</li>
 *   <li>workloadContext:      {@link WorkloadContext#neutral()}</li>
 * </ul>
 */
public record DetectionContext(
    @JsonProperty("seasonPhase") SeasonPhase seasonPhase,
    @JsonProperty("recentEvents") List<ContextEvent> recentEvents,
    @JsonProperty("environmentalFactors") List<EnvironmentalFactor> environmentalFactors,
    @JsonProperty("teamState") TeamState teamState,
    @JsonProperty("playerState") PlayerState playerState,
    @JsonProperty("workloadContext") WorkloadContext workloadContext
) {

    public static DetectionContext defaults() {
        return new DetectionContext(SeasonPhase.REGULAR, List.of(), List.of(),
            TeamState.neutral(), PlayerState.neutral(null), WorkloadContext.neutral());
    }

    public static DetectionContext forPhase(SeasonPhase phase) {
        return new DetectionContext(phase, List.of(), List.of(),
            TeamState.neutral(), PlayerState.neutral(null), WorkloadContext.neutral());
    }

    /** Names of the fields that are {@code null} and would fall back to a default. */
    public List<String> missingFields() {
        List<String> missing = new ArrayList<>();
        if (seasonPhase == null)          missing.add("seasonPhase");
        if (recentEvents == null)         missing.add("recentEvents");
        if (environmentalFactors == null) missing.add("environmentalFactors");
        if (teamState == null)            missing.add("teamState");
        if (playerState == null)          missing.add("playerState");
        if (workloadContext == null)      missing.add("workloadContext");
        return missing;
    }

    public DetectionContext withDefaults() {
        return new DetectionContext(
            seasonPhase != null ? seasonPhase : SeasonPhase.REGULAR,
            recentEvents != null ? List.copyOf(recentEvents) : List.of(),
            environmentalFactors != null ? List.copyOf(environmentalFactors) : List.of(),
            teamState != null ? teamState : TeamState.neutral(),
            playerState != null ? playerState : PlayerState.neutral(null),
            workloadContext != null ? workloadContext : WorkloadContext.neutral());
    }
}
