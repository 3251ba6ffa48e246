package com.example.prr.service;

import com.example.prr.model.AvailabilityTier;
import com.example.prr.model.BusinessImpact;
import org.springframework.stereotype.Service;

/**
 * Assigns an availability tier from business impact and graph structure.
 * <p>
 * Rule table:
 * <pre>
 * business impact | base tier | with SPOF and critical path
 * critical        | tier1     | tier1
 * high            | tier2     | tier2
 * medium          | tier3     | tier2
 * low             | tier4     | tier3
 * </pre>
 * The escalation column applies when the graph has at least one single point of failure
 * and at least one critical path.
 */
@Service
public class TierClassifier {

    /**
     * @param tier          assigned tier
     * @param justification deterministic explanation quoting the inputs and the target
     */
    public record TierDecision(AvailabilityTier tier, String justification) {}

    public TierDecision classify(BusinessImpact businessImpact, int spofCount, int criticalPathCount) {
        if (businessImpact == null) {
            throw new IllegalArgumentException("businessImpact is required");
        }
        AvailabilityTier base = switch (businessImpact) {
            case CRITICAL -> AvailabilityTier.TIER1;
            case HIGH -> AvailabilityTier.TIER2;
            case MEDIUM -> AvailabilityTier.TIER3;
            case LOW -> AvailabilityTier.TIER4;
        };
        boolean structuralRisk = spofCount > 0 && criticalPathCount > 0;
        boolean escalate = structuralRisk && base.level() >= AvailabilityTier.TIER3.level();
        AvailabilityTier tier = escalate ? AvailabilityTier.ofLevel(base.level() - 1) : base;

        StringBuilder justification = new StringBuilder()
                .append("Business impact '").append(businessImpact.wireValue()).append("' (")
                .append(businessImpact.label()).append(") maps to ").append(base.label()).append(". ")
                .append("The architecture has ").append(spofCount).append(" single point(s) of failure and ")
                .append(criticalPathCount).append(" critical path(s)");
        if (escalate) {
            justification.append(", so the tier is raised to ").append(tier.label());
        }
        justification.append(". ")
                .append(tier.label()).append(" targets ").append(tier.target())
                .append(" availability (about ").append(tier.yearlyDowntime()).append(" of downtime per year).");
        return new TierDecision(tier, justification.toString());
    }
}
