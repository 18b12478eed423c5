package com.anomalyplatform.common.alert;

import java.util.List;

public record ImpactAssessment(
    Impact immediate,
    Impact shortTerm,
    Impact longTerm,
    List<CascadingEffect> cascadingEffects,
    List<StakeholderImpact> stakeholderImpact
) {
    public ImpactAssessment {
        cascadingEffects = cascadingEffects == null ? List.of() : List.copyOf(cascadingEffects);
        stakeholderImpact = stakeholderImpact == null ? List.of() : List.copyOf(stakeholderImpact);
    }
}
