package com.delta.siteaudit.render;

import com.delta.siteaudit.job.model.StoredArtifact;

/**
 * Turns a complete, unredacted artifact into a document. Implementations never see who asked
 * for it; access is decided before they are called.
 */
public interface DocumentRenderer {

    RenderedDocument render(StoredArtifact artifact);
}
