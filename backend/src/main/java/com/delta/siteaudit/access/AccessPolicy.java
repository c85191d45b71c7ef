package com.delta.siteaudit.access;

import com.delta.siteaudit.generation.schema.ArtifactSchema;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-tier allow-lists. Construction fails unless every tier is listed, every path names a
 * known section, and each tier's list covers every path of the tiers below it.
 */
public final class AccessPolicy {
    private static final List<String> ANONYMOUS_PATHS = List.of(
        ArtifactSchema.VISIBILITY_SUMMARY,
        "ai_interpretation.summary",
        "ai_interpretation.confidence",
        ArtifactSchema.DECISION_COVERAGE_SCORE
    );

    private static final List<String> REGISTERED_PATHS = List.of(
        ArtifactSchema.VISIBILITY_SUMMARY,
        ArtifactSchema.AI_INTERPRETATION,
        "decision_readiness_audit[].element_name",
        "decision_readiness_audit[].status",
        ArtifactSchema.DECISION_COVERAGE_SCORE,
        "why_ai_chooses_others[].how_llms_decide",
        "what_ai_needs[].content_type",
        "what_ai_needs[].status",
        "appendix.pages_analyzed_target",
        "appendix.pages_analyzed_competitors"
    );

    private final Map<AccessTier, List<String>> allowLists;
    private final Map<AccessTier, Projection> projections;

    public AccessPolicy(Map<AccessTier, List<String>> allowLists) {
        Map<AccessTier, List<String>> copy = new EnumMap<>(AccessTier.class);
        for (AccessTier tier : AccessTier.values()) {
            List<String> paths = allowLists.get(tier);
            if (paths == null) {
                throw new IllegalArgumentException("No allow-list for tier " + tier);
            }
            copy.put(tier, List.copyOf(paths));
        }
        validateSections(copy);
        validateMonotone(copy);
        this.allowLists = Collections.unmodifiableMap(copy);
        Map<AccessTier, Projection> compiled = new EnumMap<>(AccessTier.class);
        copy.forEach((tier, paths) -> compiled.put(tier, Projection.compile(paths)));
        this.projections = compiled;
    }

    public static AccessPolicy defaults() {
        Map<AccessTier, List<String>> lists = new LinkedHashMap<>();
        lists.put(AccessTier.ANONYMOUS, ANONYMOUS_PATHS);
        lists.put(AccessTier.REGISTERED, REGISTERED_PATHS);
        lists.put(AccessTier.ENTITLED, ArtifactSchema.sectionNames());
        return new AccessPolicy(lists);
    }

    public List<String> allowList(AccessTier tier) {
        return allowLists.get(tier);
    }

    /** True when the tier sees the whole section, not just parts of it. */
    public boolean seesWholeSection(AccessTier tier, String section) {
        return projections.get(tier).coversWhole(section);
    }

    Projection projection(AccessTier tier) {
        return projections.get(tier);
    }

    private static void validateSections(Map<AccessTier, List<String>> lists) {
        Set<String> known = Set.copyOf(ArtifactSchema.sectionNames());
        lists.forEach((tier, paths) -> {
            for (String path : paths) {
                if (!known.contains(AllowPath.section(path))) {
                    throw new IllegalArgumentException("Tier " + tier + " allows unknown section in path " + path);
                }
            }
        });
    }

    private static void validateMonotone(Map<AccessTier, List<String>> lists) {
        AccessTier[] tiers = AccessTier.values();
        for (int lower = 0; lower < tiers.length; lower++) {
            for (int higher = lower + 1; higher < tiers.length; higher++) {
                List<String> higherPaths = lists.get(tiers[higher]);
                for (String path : lists.get(tiers[lower])) {
                    boolean covered = higherPaths.stream().anyMatch(candidate -> AllowPath.covers(candidate, path));
                    if (!covered) {
                        throw new IllegalArgumentException(
                            "Tier " + tiers[higher] + " does not cover " + path + " allowed for " + tiers[lower]
                        );
                    }
                }
            }
        }
    }
}
