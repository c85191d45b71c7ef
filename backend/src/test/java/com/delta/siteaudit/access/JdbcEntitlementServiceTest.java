package com.delta.siteaudit.access;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
class JdbcEntitlementServiceTest {

    @Autowired
    private JdbcEntitlementService service;

    @Test
    void unknownCallerHasNothing() {
        EntitlementAnswer answer = service.lookup(CallerIdentity.fromHeader("nobody-" + UUID.randomUUID()), "job-1");
        assertFalse(answer.identified());
        assertFalse(answer.blanketGrant());
        assertFalse(answer.jobGrant());
    }

    @Test
    void jobGrantAppliesOnlyToThatJob() {
        String caller = newCaller();
        service.grantForJob(caller, "job-a");

        assertTrue(service.lookup(CallerIdentity.fromHeader(caller), "job-a").jobGrant());
        assertFalse(service.lookup(CallerIdentity.fromHeader(caller), "job-b").jobGrant());
    }

    @Test
    void expiredBlanketGrantIsIgnored() {
        String caller = newCaller();
        service.grantBlanket(caller, Instant.now().minus(Duration.ofHours(1)));
        assertFalse(service.lookup(CallerIdentity.fromHeader(caller), "job-a").blanketGrant());

        service.grantBlanket(caller, Instant.now().plus(Duration.ofHours(1)));
        assertTrue(service.lookup(CallerIdentity.fromHeader(caller), "job-a").blanketGrant());
    }

    @Test
    void revokeDeactivatesEveryGrant() {
        String caller = newCaller();
        service.grantBlanket(caller, null);
        service.grantForJob(caller, "job-a");

        assertEquals(2, service.revokeAll(caller));

        EntitlementAnswer answer = service.lookup(CallerIdentity.fromHeader(caller), "job-a");
        assertTrue(answer.identified());
        assertFalse(answer.blanketGrant());
        assertFalse(answer.jobGrant());
    }

    private String newCaller() {
        String caller = "caller-" + UUID.randomUUID();
        service.registerCaller(caller);
        return caller;
    }
}
