package com.delta.siteaudit.generation.service;

import com.delta.siteaudit.generation.model.AiInterpretation;
import com.delta.siteaudit.generation.model.Appendix;
import com.delta.siteaudit.generation.model.AuditArtifactPayload;
import com.delta.siteaudit.generation.model.CoverageScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Overwrites every derived value in a payload with one computed from its source: the coverage
 * breakdown from the readiness items, page counts and sampled URLs from the sample.
 */
@Component
public class ArtifactReconciler {
    private static final Logger log = LoggerFactory.getLogger(ArtifactReconciler.class);

    public AuditArtifactPayload reconcile(AuditArtifactPayload payload, SampledPages sample) {
        CoverageScore coverage = CoverageScore.of(payload.decisionReadinessAudit());
        if (payload.decisionCoverageScore() != null && !payload.decisionCoverageScore().equals(coverage)) {
            log.debug("Replacing supplied coverage {} with derived {}", payload.decisionCoverageScore(), coverage);
        }
        int targetPages = sample.target().size();
        int comparisonPages = sample.comparisonPageCount();
        AiInterpretation interpretation = payload.aiInterpretation().withBasedOnPages(targetPages);
        Appendix appendix = new Appendix(
            sample.allUrls(),
            dataLimitations(targetPages, comparisonPages, sample.comparisons().size()),
            targetPages,
            comparisonPages
        );
        return payload.withDerived(coverage, interpretation, appendix);
    }

    private static String dataLimitations(int targetPages, int comparisonPages, int comparisonSites) {
        StringBuilder text = new StringBuilder()
            .append("Based on ").append(targetPages).append(" sampled page(s) from the target site");
        if (comparisonSites > 0) {
            text.append(" and ").append(comparisonPages).append(" page(s) from ")
                .append(comparisonSites).append(" comparison site(s)");
        }
        text.append(". Content rendered only by JavaScript, gated content and off-site mentions were not analyzed.");
        return text.toString();
    }
}
