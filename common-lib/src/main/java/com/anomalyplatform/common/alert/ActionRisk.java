package com.anomalyplatform.common.alert;

import java.util.List;

public record ActionRisk(
    ImpactLevel riskLevel,
    List<String> riskFactors,
    List<String> mitigation,
    List<String> consequences
) {
    public ActionRisk {
        riskFactors = riskFactors == null ? List.of() : List.copyOf(riskFactors);
        mitigation = mitigation == null ? List.of() : List.copyOf(mitigation);
        consequences = consequences == null ? List.of() : List.copyOf(consequences);
    }
}
