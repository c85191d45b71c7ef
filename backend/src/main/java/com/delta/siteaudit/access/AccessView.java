package com.delta.siteaudit.access;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * A tier's projection of one artifact. Built per read and never stored.
 */
public record AccessView(AccessTier tier, List<String> redactedSectionIds, ObjectNode view) {

    public AccessView {
        redactedSectionIds = List.copyOf(redactedSectionIds);
    }
}
