package com.delta.siteaudit.render;

import com.delta.siteaudit.access.AccessTier;
import com.delta.siteaudit.access.AccessTierResolver;
import com.delta.siteaudit.access.ArtifactViewService;
import com.delta.siteaudit.access.CallerIdentity;
import com.delta.siteaudit.job.model.StoredArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

@Service
public class ArtifactExportService {
    private static final Logger log = LoggerFactory.getLogger(ArtifactExportService.class);

    private final ArtifactViewService viewService;
    private final AccessTierResolver tierResolver;
    private final ObjectProvider<DocumentRenderer> rendererProvider;

    public ArtifactExportService(
        ArtifactViewService viewService,
        AccessTierResolver tierResolver,
        ObjectProvider<DocumentRenderer> rendererProvider
    ) {
        this.viewService = viewService;
        this.tierResolver = tierResolver;
        this.rendererProvider = rendererProvider;
    }

    public RenderedDocument export(String jobId, CallerIdentity caller) {
        StoredArtifact artifact = viewService.latestArtifact(jobId);
        if (tierResolver.resolve(caller, jobId) != AccessTier.ENTITLED) {
            throw new NotEntitledException(jobId);
        }
        DocumentRenderer renderer = rendererProvider.getIfAvailable();
        if (renderer == null) {
            throw new RendererUnavailableException();
        }
        log.info("Rendering artifact v{} of job {}", artifact.version(), jobId);
        return renderer.render(artifact);
    }
}
