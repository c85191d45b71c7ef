package com.delta.siteaudit.access;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class AccessTierResolverTest {
    private final EntitlementService entitlements = mock(EntitlementService.class);
    private final AccessTierResolver resolver = new AccessTierResolver(entitlements);
    private final CallerIdentity caller = CallerIdentity.fromHeader("caller-1");

    @Test
    void anonymousCallerNeverTriggersALookup() {
        assertThat(resolver.resolve(CallerIdentity.anonymous(), "job-1")).isEqualTo(AccessTier.ANONYMOUS);
        assertThat(resolver.resolve(CallerIdentity.fromHeader("  "), "job-1")).isEqualTo(AccessTier.ANONYMOUS);
        verifyNoInteractions(entitlements);
    }

    @Test
    void blanketOrJobGrantMeansEntitled() {
        when(entitlements.lookup(caller, "job-1")).thenReturn(new EntitlementAnswer(true, true, false));
        when(entitlements.lookup(caller, "job-2")).thenReturn(new EntitlementAnswer(true, false, true));

        assertThat(resolver.resolve(caller, "job-1")).isEqualTo(AccessTier.ENTITLED);
        assertThat(resolver.resolve(caller, "job-2")).isEqualTo(AccessTier.ENTITLED);
        assertThat(resolver.resolveAnswer(caller, "job-2").canUnlock()).isFalse();
    }

    @Test
    void knownCallerWithoutGrantIsRegisteredAndCanUnlock() {
        when(entitlements.lookup(caller, "job-1")).thenReturn(new EntitlementAnswer(true, false, false));

        AccessTierResolver.Resolution resolution = resolver.resolveAnswer(caller, "job-1");

        assertThat(resolution.tier()).isEqualTo(AccessTier.REGISTERED);
        assertThat(resolution.canUnlock()).isTrue();
    }

    @Test
    void unknownCallerIsAnonymous() {
        when(entitlements.lookup(caller, "job-1")).thenReturn(EntitlementAnswer.unknownCaller());

        assertThat(resolver.resolveAnswer(caller, "job-1").tier()).isEqualTo(AccessTier.ANONYMOUS);
        assertThat(resolver.resolveAnswer(caller, "job-1").canUnlock()).isFalse();
    }

    @Test
    void failedLookupFallsBackToAnonymous() {
        when(entitlements.lookup(any(CallerIdentity.class), anyString()))
            .thenThrow(new EntitlementUnknownException("store down", new RuntimeException("timeout")));

        assertThat(resolver.resolve(caller, "job-1")).isEqualTo(AccessTier.ANONYMOUS);
    }

    @Test
    void unexpectedLookupErrorFallsBackToAnonymous() {
        when(entitlements.lookup(caller, "job-1")).thenThrow(new IllegalStateException("pool exhausted"));

        AccessTierResolver.Resolution resolution = resolver.resolveAnswer(caller, "job-1");

        assertThat(resolution.tier()).isEqualTo(AccessTier.ANONYMOUS);
        assertThat(resolution.canUnlock()).isFalse();
    }

    @Test
    void missingAnswerIsTreatedAsAnonymous() {
        when(entitlements.lookup(caller, "job-1")).thenReturn(null);

        assertThat(resolver.resolve(caller, "job-1")).isEqualTo(AccessTier.ANONYMOUS);
    }

    @Test
    void callerTokenIsNeverPrinted() {
        assertThat(caller.toString()).doesNotContain("caller-1");
    }
}
