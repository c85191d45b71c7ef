package com.delta.siteaudit.access;

import com.delta.siteaudit.generation.schema.ArtifactSchema;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds redacted views by copying allow-listed paths out of the artifact. The input is
 * never modified, and the same input always yields the same output.
 */
@Component
public class AccessGate {
    private final AccessPolicy policy;

    public AccessGate(AccessPolicy policy) {
        this.policy = policy;
    }

    public AccessView view(JsonNode artifact, AccessTier tier) {
        List<String> redacted = new ArrayList<>();
        if (artifact != null && artifact.isObject()) {
            for (String section : ArtifactSchema.sectionNames()) {
                if (artifact.has(section) && !policy.seesWholeSection(tier, section)) {
                    redacted.add(section);
                }
            }
        }
        return new AccessView(tier, redacted, policy.projection(tier).applyToRoot(artifact));
    }
}
