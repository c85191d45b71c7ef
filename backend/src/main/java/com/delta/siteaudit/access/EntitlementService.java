package com.delta.siteaudit.access;

public interface EntitlementService {

    /**
     * Current entitlement of {@code caller} for {@code jobId}. Never cached by callers.
     *
     * @throws EntitlementUnknownException when the backing store cannot answer
     */
    EntitlementAnswer lookup(CallerIdentity caller, String jobId);
}
