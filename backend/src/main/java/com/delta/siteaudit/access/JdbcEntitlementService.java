package com.delta.siteaudit.access;

import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Instant;

/**
 * Reads grants written by the payment integration and callers known to the identity service.
 * The write methods exist for that integration and for tests.
 */
@Service
public class JdbcEntitlementService implements EntitlementService {
    static final String GRANT_BLANKET = "BLANKET";
    static final String GRANT_JOB = "JOB";

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcEntitlementService(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public EntitlementAnswer lookup(CallerIdentity caller, String jobId) {
        if (caller == null || caller.isAnonymous()) {
            return EntitlementAnswer.unknownCaller();
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("callerId", caller.token())
            .addValue("jobId", jobId)
            .addValue("blanket", GRANT_BLANKET)
            .addValue("job", GRANT_JOB)
            .addValue("now", Timestamp.from(Instant.now()));
        try {
            Integer registered = jdbc.queryForObject(
                "SELECT COUNT(*) FROM registered_callers WHERE caller_id = :callerId",
                params,
                Integer.class
            );
            Integer blanket = jdbc.queryForObject(
                """
                    SELECT COUNT(*)
                    FROM entitlement_grants
                    WHERE caller_id = :callerId
                      AND grant_type = :blanket
                      AND active = TRUE
                      AND (expires_at IS NULL OR expires_at > :now)
                    """,
                params,
                Integer.class
            );
            Integer specific = jdbc.queryForObject(
                """
                    SELECT COUNT(*)
                    FROM entitlement_grants
                    WHERE caller_id = :callerId
                      AND grant_type = :job
                      AND job_id = :jobId
                      AND active = TRUE
                      AND (expires_at IS NULL OR expires_at > :now)
                    """,
                params,
                Integer.class
            );
            return new EntitlementAnswer(positive(registered), positive(blanket), positive(specific));
        } catch (DataAccessException e) {
            throw new EntitlementUnknownException("Entitlement lookup failed", e);
        }
    }

    public void registerCaller(String callerId) {
        jdbc.update(
            """
                INSERT INTO registered_callers (caller_id, created_at)
                SELECT :callerId, :now
                WHERE NOT EXISTS (SELECT 1 FROM registered_callers WHERE caller_id = :callerId)
                """,
            new MapSqlParameterSource()
                .addValue("callerId", callerId)
                .addValue("now", Timestamp.from(Instant.now()))
        );
    }

    public void grantBlanket(String callerId, Instant expiresAt) {
        insertGrant(callerId, null, GRANT_BLANKET, expiresAt);
    }

    public void grantForJob(String callerId, String jobId) {
        insertGrant(callerId, jobId, GRANT_JOB, null);
    }

    public int revokeAll(String callerId) {
        return jdbc.update(
            "UPDATE entitlement_grants SET active = FALSE WHERE caller_id = :callerId AND active = TRUE",
            new MapSqlParameterSource("callerId", callerId)
        );
    }

    private void insertGrant(String callerId, String jobId, String grantType, Instant expiresAt) {
        jdbc.update(
            """
                INSERT INTO entitlement_grants (caller_id, job_id, grant_type, active, expires_at, created_at)
                VALUES (:callerId, :jobId, :grantType, TRUE, :expiresAt, :now)
                """,
            new MapSqlParameterSource()
                .addValue("callerId", callerId)
                .addValue("jobId", jobId)
                .addValue("grantType", grantType)
                .addValue("expiresAt", expiresAt == null ? null : Timestamp.from(expiresAt))
                .addValue("now", Timestamp.from(Instant.now()))
        );
    }

    private static boolean positive(Integer count) {
        return count != null && count > 0;
    }
}
