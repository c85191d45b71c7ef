package com.delta.siteaudit.generation.client;

/**
 * One blocking text-generation call. Implementations apply their own timeout and any transport
 * retry; a call that cannot produce a response throws {@link GenerationCallException}.
 */
public interface GenerationClient {

    GenerationResponse complete(GenerationRequest request);
}
