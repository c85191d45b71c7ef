package com.delta.siteaudit.access;

import com.delta.siteaudit.job.model.AuditJob;
import com.delta.siteaudit.job.model.StoredArtifact;
import com.delta.siteaudit.job.persistence.ArtifactRepository;
import com.delta.siteaudit.job.service.ArtifactNotReadyException;
import com.delta.siteaudit.job.service.AuditJobService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Serves the latest artifact version of a job, redacted for the caller's current tier.
 * Entitlement is resolved on every call.
 */
@Service
public class ArtifactViewService {
    private static final Logger log = LoggerFactory.getLogger(ArtifactViewService.class);

    private final AuditJobService jobService;
    private final ArtifactRepository artifactRepository;
    private final AccessTierResolver tierResolver;
    private final AccessGate accessGate;
    private final ObjectMapper objectMapper;

    public ArtifactViewService(
        AuditJobService jobService,
        ArtifactRepository artifactRepository,
        AccessTierResolver tierResolver,
        AccessGate accessGate,
        ObjectMapper objectMapper
    ) {
        this.jobService = jobService;
        this.artifactRepository = artifactRepository;
        this.tierResolver = tierResolver;
        this.accessGate = accessGate;
        this.objectMapper = objectMapper;
    }

    public ArtifactViewResponse getView(String jobId, CallerIdentity caller) {
        StoredArtifact artifact = latestArtifact(jobId);
        AccessTierResolver.Resolution resolution = tierResolver.resolveAnswer(caller, jobId);
        AccessView view = accessGate.view(readPayload(artifact), resolution.tier());
        log.debug("Serving artifact v{} of job {} at tier {}", artifact.version(), jobId, resolution.tier());
        return new ArtifactViewResponse(
            resolution.tier(),
            view.redactedSectionIds(),
            resolution.canUnlock(),
            artifact.version(),
            view.view()
        );
    }

    public StoredArtifact latestArtifact(String jobId) {
        AuditJob job = jobService.getJob(jobId);
        return artifactRepository.findLatest(jobId)
            .orElseThrow(() -> new ArtifactNotReadyException(jobId, job.status()));
    }

    private JsonNode readPayload(StoredArtifact artifact) {
        try {
            return objectMapper.readTree(artifact.payloadJson());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored artifact " + artifact.jobId() + " v" + artifact.version() + " is corrupt", e);
        }
    }
}
