package com.delta.siteaudit.access;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

public record ArtifactViewResponse(
    AccessTier accessState,
    List<String> redactedSectionIds,
    boolean canUnlock,
    int artifactVersion,
    ObjectNode view
) {
}
