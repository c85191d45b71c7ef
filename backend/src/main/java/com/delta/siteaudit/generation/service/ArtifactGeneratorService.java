package com.delta.siteaudit.generation.service;

import com.delta.siteaudit.config.AuditProperties;
import com.delta.siteaudit.generation.client.GenerationClient;
import com.delta.siteaudit.generation.client.GenerationRequest;
import com.delta.siteaudit.generation.client.GenerationResponse;
import com.delta.siteaudit.generation.model.AuditArtifactPayload;
import com.delta.siteaudit.generation.schema.ArtifactSchema;
import com.delta.siteaudit.generation.schema.SchemaValidator;
import com.delta.siteaudit.generation.schema.SchemaViolation;
import com.delta.siteaudit.generation.schema.ViolationKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Produces a schema-valid artifact from sampled pages. Attempts run strictly in sequence,
 * at most {@code audit.generation.max-attempts} of them; each attempt after the first is built
 * from the previous attempt's violations.
 */
@Service
public class ArtifactGeneratorService {
    private static final Logger log = LoggerFactory.getLogger(ArtifactGeneratorService.class);

    private final AuditProperties.Generation properties;
    private final GenerationClient generationClient;
    private final PromptComposer promptComposer;
    private final ArtifactOutputParser outputParser;
    private final ArtifactReconciler reconciler;
    private final ObjectMapper objectMapper;

    public ArtifactGeneratorService(
        AuditProperties properties,
        GenerationClient generationClient,
        PromptComposer promptComposer,
        ArtifactOutputParser outputParser,
        ArtifactReconciler reconciler,
        ObjectMapper objectMapper
    ) {
        this.properties = properties.getGeneration();
        this.generationClient = generationClient;
        this.promptComposer = promptComposer;
        this.outputParser = outputParser;
        this.reconciler = reconciler;
        this.objectMapper = objectMapper;
    }

    public GeneratedArtifact generate(SampledPages sample, GenerationContext context) {
        int maxAttempts = properties.getMaxAttempts();
        String previousOutput = null;
        List<SchemaViolation> violations = List.of();

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            GenerationRequest request = attempt == 1
                ? promptComposer.initial(sample, context)
                : promptComposer.repair(sample, context, previousOutput, violations, attempt);
            GenerationResponse response = generationClient.complete(request);
            ParsedOutput parsed = outputParser.parse(response);

            if (parsed.isValid()) {
                try {
                    AuditArtifactPayload payload = outputParser.toPayload(parsed.tree());
                    return assemble(payload, sample, response.model(), attempt);
                } catch (JsonProcessingException e) {
                    parsed = new ParsedOutput(null, List.of(
                        new SchemaViolation("$", ViolationKind.MALFORMED, e.getOriginalMessage())
                    ));
                }
            }

            violations = parsed.violations();
            previousOutput = response.content();
            log.info(
                "Generation attempt {}/{} for {} rejected with {} violation(s): {}",
                attempt,
                maxAttempts,
                context.targetDomain(),
                violations.size(),
                violations.stream().limit(5).map(SchemaViolation::describe).toList()
            );
        }
        throw new SchemaValidationException(violations, maxAttempts);
    }

    private GeneratedArtifact assemble(AuditArtifactPayload payload, SampledPages sample, String model, int attempts) {
        AuditArtifactPayload reconciled = reconciler.reconcile(payload, sample);
        JsonNode tree = objectMapper.valueToTree(reconciled);
        List<SchemaViolation> storedViolations = SchemaValidator.validate(tree, ArtifactSchema.STORED);
        if (!storedViolations.isEmpty()) {
            throw new IllegalStateException("Reconciled artifact does not satisfy the stored schema: "
                + storedViolations.stream().map(SchemaViolation::describe).toList());
        }
        try {
            return new GeneratedArtifact(
                reconciled,
                objectMapper.writeValueAsString(tree),
                sample.allUrls(),
                model,
                attempts
            );
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize artifact", e);
        }
    }
}
