package com.delta.siteaudit.generation.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Validated artifact content. Instances are only built from output that passed schema
 * validation, so every component is present.
 */
@JsonPropertyOrder({
    "visibility_summary",
    "ai_interpretation",
    "decision_readiness_audit",
    "decision_coverage_score",
    "ai_requirements_before",
    "ai_requirements_after",
    "why_ai_chooses_others",
    "what_ai_needs",
    "packages",
    "business_impact",
    "appendix"
})
public record AuditArtifactPayload(
    VisibilitySummary visibilitySummary,
    AiInterpretation aiInterpretation,
    List<ReadinessItem> decisionReadinessAudit,
    CoverageScore decisionCoverageScore,
    List<RequirementBefore> aiRequirementsBefore,
    List<RequirementAfter> aiRequirementsAfter,
    List<CompetitorReason> whyAiChoosesOthers,
    List<ContentNeed> whatAiNeeds,
    PackageOptions packages,
    BusinessImpact businessImpact,
    Appendix appendix
) {
    public AuditArtifactPayload {
        decisionReadinessAudit = List.copyOf(decisionReadinessAudit);
        aiRequirementsBefore = List.copyOf(aiRequirementsBefore);
        aiRequirementsAfter = List.copyOf(aiRequirementsAfter);
        whyAiChoosesOthers = List.copyOf(whyAiChoosesOthers);
        whatAiNeeds = List.copyOf(whatAiNeeds);
    }

    public AuditArtifactPayload withDerived(CoverageScore coverage, AiInterpretation interpretation, Appendix newAppendix) {
        return new AuditArtifactPayload(
            visibilitySummary,
            interpretation,
            decisionReadinessAudit,
            coverage,
            aiRequirementsBefore,
            aiRequirementsAfter,
            whyAiChoosesOthers,
            whatAiNeeds,
            packages,
            businessImpact,
            newAppendix
        );
    }
}
