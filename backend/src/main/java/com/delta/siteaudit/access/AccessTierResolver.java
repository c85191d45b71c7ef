package com.delta.siteaudit.access;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Blanket grant, then a grant for this job, then a known caller, then anonymous. A failed
 * lookup resolves to ANONYMOUS so a read never fails and never over-shares.
 */
@Component
public class AccessTierResolver {
    private static final Logger log = LoggerFactory.getLogger(AccessTierResolver.class);

    private final EntitlementService entitlementService;

    public AccessTierResolver(EntitlementService entitlementService) {
        this.entitlementService = entitlementService;
    }

    public AccessTier resolve(CallerIdentity caller, String jobId) {
        return resolveAnswer(caller, jobId).tier();
    }

    public Resolution resolveAnswer(CallerIdentity caller, String jobId) {
        if (caller == null || caller.isAnonymous()) {
            return new Resolution(AccessTier.ANONYMOUS, false);
        }
        EntitlementAnswer answer;
        try {
            answer = entitlementService.lookup(caller, jobId);
        } catch (EntitlementUnknownException e) {
            log.warn("Entitlement unknown for job {}; serving anonymous view: {}", jobId, e.getMessage());
            return new Resolution(AccessTier.ANONYMOUS, false);
        } catch (RuntimeException e) {
            log.error("Entitlement lookup failed for job {}; serving anonymous view", jobId, e);
            return new Resolution(AccessTier.ANONYMOUS, false);
        }
        if (answer == null) {
            return new Resolution(AccessTier.ANONYMOUS, false);
        }
        if (answer.blanketGrant() || answer.jobGrant()) {
            return new Resolution(AccessTier.ENTITLED, true);
        }
        return new Resolution(answer.identified() ? AccessTier.REGISTERED : AccessTier.ANONYMOUS, answer.identified());
    }

    public record Resolution(AccessTier tier, boolean identified) {

        /** An identified caller who could gain access by acquiring a grant. */
        public boolean canUnlock() {
            return identified && tier != AccessTier.ENTITLED;
        }
    }
}
