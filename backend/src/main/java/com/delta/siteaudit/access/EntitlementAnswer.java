package com.delta.siteaudit.access;

/**
 * What the entitlement collaborator knows about a caller with respect to one job.
 */
public record EntitlementAnswer(boolean identified, boolean blanketGrant, boolean jobGrant) {

    public static EntitlementAnswer unknownCaller() {
        return new EntitlementAnswer(false, false, false);
    }
}
