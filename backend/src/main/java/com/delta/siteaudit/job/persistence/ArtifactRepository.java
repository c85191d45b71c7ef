package com.delta.siteaudit.job.persistence;

import com.delta.siteaudit.job.model.ClaimedJob;
import com.delta.siteaudit.job.model.StoredArtifact;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only artifact versions. Rows are never updated.
 */
@Repository
public class ArtifactRepository {
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public ArtifactRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    @Transactional
    public StoredArtifact insert(
        ClaimedJob claimed,
        String schemaVersion,
        String payloadJson,
        List<String> sampledUrls,
        String model,
        int attempts
    ) {
        Integer current = jdbc.queryForObject(
            """
                SELECT COALESCE(MAX(version), 0)
                FROM audit_artifacts
                WHERE job_id = :jobId
                """,
            new MapSqlParameterSource("jobId", claimed.jobId()),
            Integer.class
        );
        int version = (current == null ? 0 : current) + 1;
        Instant now = Instant.now();
        jdbc.update(
            """
                INSERT INTO audit_artifacts (
                    job_id, version, run_number, schema_version, payload, sampled_urls, model, attempts, created_at
                )
                VALUES (
                    :jobId, :version, :runNumber, :schemaVersion, :payload, :sampledUrls, :model, :attempts, :now
                )
                """,
            new MapSqlParameterSource()
                .addValue("jobId", claimed.jobId())
                .addValue("version", version)
                .addValue("runNumber", claimed.runNumber())
                .addValue("schemaVersion", schemaVersion)
                .addValue("payload", payloadJson)
                .addValue("sampledUrls", writeList(sampledUrls))
                .addValue("model", model)
                .addValue("attempts", attempts)
                .addValue("now", Timestamp.from(now))
        );
        return new StoredArtifact(
            claimed.jobId(),
            version,
            claimed.runNumber(),
            schemaVersion,
            payloadJson,
            List.copyOf(sampledUrls),
            model,
            attempts,
            now
        );
    }

    public Optional<StoredArtifact> findLatest(String jobId) {
        List<StoredArtifact> rows = jdbc.query(
            """
                SELECT job_id, version, run_number, schema_version, payload, sampled_urls, model, attempts, created_at
                FROM audit_artifacts
                WHERE job_id = :jobId
                ORDER BY version DESC
                LIMIT 1
                """,
            new MapSqlParameterSource("jobId", jobId),
            (rs, rowNum) -> new StoredArtifact(
                rs.getString("job_id"),
                rs.getInt("version"),
                rs.getInt("run_number"),
                rs.getString("schema_version"),
                rs.getString("payload"),
                readList(rs.getString("sampled_urls")),
                rs.getString("model"),
                rs.getInt("attempts"),
                rs.getTimestamp("created_at").toInstant()
            )
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public int countVersions(String jobId) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM audit_artifacts WHERE job_id = :jobId",
            new MapSqlParameterSource("jobId", jobId),
            Integer.class
        );
        return count == null ? 0 : count;
    }

    private String writeList(List<String> values) {
        try {
            return objectMapper.writeValueAsString(values == null ? List.of() : values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize sampled urls", e);
        }
    }

    private List<String> readList(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt sampled_urls column", e);
        }
    }
}
