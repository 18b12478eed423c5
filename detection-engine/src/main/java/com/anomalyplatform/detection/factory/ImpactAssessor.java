package com.anomalyplatform.detection.factory;

import com.anomalyplatform.common.alert.CascadingEffect;
import com.anomalyplatform.common.alert.Impact;
import com.anomalyplatform.common.alert.ImpactAssessment;
import com.anomalyplatform.common.alert.ImpactScope;
import com.anomalyplatform.common.alert.ImpactSeverity;
import com.anomalyplatform.common.alert.QuantifiedImpact;
import com.anomalyplatform.common.alert.StakeholderImpact;
import com.anomalyplatform.common.model.DetectionContext;
import com.anomalyplatform.common.model.EntityRef;
import com.anomalyplatform.common.model.EntityType;
import com.anomalyplatform.common.model.MetricName;
import com.anomalyplatform.detection.model.RawFinding;

import java.util.List;

/**
 * Immediate, short-term and long-term impact of a finding, scaled by its percentage
 * deviation.
 *
 * <pre>
 *   |dev| &gt; 50 high, &gt; 25 moderate, else low     (immediate severity)
 *   performance change   |dev| · 0.5 / 0.3 / 0.1
 *   injury risk change   load metrics |dev| · 0.3 / 0.2 / 0.1, otherwise 5 / 3 / 1
 * </pre>
 */
final class ImpactAssessor {

    static final double FATIGUED_TEAM_LEVEL = 70.0;
    static final double LOW_CHEMISTRY_LEVEL = 70.0;

    private ImpactAssessor() {}

    static ImpactAssessment assess(RawFinding f, DetectionContext ctx, EntityRef entity) {
        double dev = Math.abs(f.deviationPercentage());
        if (!Double.isFinite(dev)) dev = 0.0;
        boolean load = f.metricKey().contains(MetricName.LOAD.key());
        String metric = f.metricKey();

        ImpactSeverity immediateSeverity = dev > 50 ? ImpactSeverity.HIGH
            : dev > 25 ? ImpactSeverity.MODERATE
            : ImpactSeverity.LOW;
        ImpactScope ownScope = entity.type() == EntityType.TEAM ? ImpactScope.TEAM : ImpactScope.INDIVIDUAL;
        boolean fatiguedTeam = ctx.teamState() != null && ctx.teamState().fatigue() > FATIGUED_TEAM_LEVEL;
        boolean lowChemistry = ctx.teamState() != null && ctx.teamState().chemistry() < LOW_CHEMISTRY_LEVEL;

        Impact immediate = new Impact(immediateSeverity, ownScope,
            "Immediate impact on " + metric,
            new QuantifiedImpact(dev * 0.5, load ? dev * 0.3 : 5, 0, 0, "1-3 days"));
        Impact shortTerm = new Impact(
            immediateSeverity == ImpactSeverity.HIGH ? ImpactSeverity.MODERATE : ImpactSeverity.LOW,
            fatiguedTeam ? ImpactScope.TEAM : ownScope,
            "Short-term implications for performance and health",
            new QuantifiedImpact(dev * 0.3, load ? dev * 0.2 : 3, 5, 500, "1-2 weeks"));
        Impact longTerm = new Impact(ImpactSeverity.LOW, ownScope,
            "Long-term adaptation or chronic issues",
            new QuantifiedImpact(dev * 0.1, load ? dev * 0.1 : 1, 2, 1000, "1-3 months"));

        List<CascadingEffect> cascading = List.of(
            new CascadingEffect("Team dynamic disruption", lowChemistry ? 60 : 30, "1-2 weeks", true));

        String subject = entity.type() == EntityType.TEAM ? "team" : "player";
        List<StakeholderImpact> stakeholders = List.of(
            new StakeholderImpact(subject, "performance", Math.min(100, dev),
                "Direct impact on " + subject + " " + metric),
            new StakeholderImpact("coach", "operational", Math.min(100, dev * 0.5),
                "Requires coaching attention and plan adjustment"));

        return new ImpactAssessment(immediate, shortTerm, longTerm, cascading, stakeholders);
    }
}
