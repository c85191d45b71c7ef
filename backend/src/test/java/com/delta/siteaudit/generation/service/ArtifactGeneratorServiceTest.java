package com.delta.siteaudit.generation.service;

import com.delta.siteaudit.config.AuditProperties;
import com.delta.siteaudit.crawl.model.CrawledPage;
import com.delta.siteaudit.generation.ArtifactFixtures;
import com.delta.siteaudit.generation.client.GenerationCallException;
import com.delta.siteaudit.generation.client.GenerationClient;
import com.delta.siteaudit.generation.client.GenerationRequest;
import com.delta.siteaudit.generation.client.GenerationResponse;
import com.delta.siteaudit.generation.schema.ArtifactSchema;
import com.delta.siteaudit.generation.schema.SchemaValidator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArtifactGeneratorServiceTest {
    private AuditProperties properties;
    private ScriptedClient client;
    private SampledPages sample;
    private GenerationContext context;

    @BeforeEach
    void setUp() {
        properties = new AuditProperties();
        properties.getGeneration().setMaxAttempts(2);
        client = new ScriptedClient();
        List<CrawledPage> target = List.of(
            ArtifactFixtures.page("acme.example", true, "https://acme.example/", 0, 120),
            ArtifactFixtures.page("acme.example", true, "https://acme.example/pricing", 1, 80)
        );
        List<CrawledPage> rival = List.of(
            ArtifactFixtures.page("rival.example", false, "https://rival.example/", 0, 200)
        );
        sample = new SampledPages(target, Map.of("rival.example", rival));
        context = new GenerationContext(
            "acme.example",
            List.of("rival.example"),
            "en-US",
            "Plumbing in Springfield",
            SiteSignalSummary.of(List.of(target.get(0), target.get(1), rival.get(0)))
        );
    }

    @Test
    void validFirstAttemptIsReconciledAndStoredSchemaValid() throws Exception {
        ObjectNode generated = ArtifactFixtures.generatedTree();
        generated.putObject("decision_coverage_score").put("present", 18).put("weak", 0).put("missing", 0).put("total", 18);
        client.respond(ArtifactFixtures.json(generated), "stop");

        GeneratedArtifact artifact = service().generate(sample, context);

        assertThat(client.requests).hasSize(1);
        assertThat(artifact.attempts()).isEqualTo(1);
        assertThat(artifact.model()).isEqualTo("test-model");
        assertThat(artifact.sampledUrls()).containsExactly(
            "https://acme.example/",
            "https://acme.example/pricing",
            "https://rival.example/"
        );

        JsonNode stored = ArtifactFixtures.MAPPER.readTree(artifact.payloadJson());
        assertThat(SchemaValidator.validate(stored, ArtifactSchema.STORED)).isEmpty();
        assertThat(stored.path("decision_coverage_score").path("present").asInt()).isEqualTo(4);
        assertThat(stored.path("decision_coverage_score").path("total").asInt()).isEqualTo(12);
        assertThat(stored.path("ai_interpretation").path("based_on_pages").asInt()).isEqualTo(2);
        assertThat(stored.path("appendix").path("pages_analyzed_target").asInt()).isEqualTo(2);
        assertThat(stored.path("appendix").path("pages_analyzed_competitors").asInt()).isEqualTo(1);
    }

    @Test
    void repairPromptNamesTheMissingFieldAndSecondAttemptSucceeds() {
        ObjectNode broken = ArtifactFixtures.generatedTree();
        broken.remove("business_impact");
        client.respond(ArtifactFixtures.json(broken), "stop");
        client.respond(ArtifactFixtures.json(ArtifactFixtures.generatedTree()), "stop");

        GeneratedArtifact artifact = service().generate(sample, context);

        assertThat(artifact.attempts()).isEqualTo(2);
        assertThat(client.requests).hasSize(2);
        GenerationRequest repair = client.requests.get(1);
        assertThat(repair.attempt()).isEqualTo(2);
        assertThat(repair.userPrompt())
            .contains("- business_impact [MISSING]")
            .contains("### Previous response")
            .contains("Plumbing in Springfield");
        assertThat(client.requests.get(0).userPrompt()).doesNotContain("Previous attempt was rejected");
    }

    @Test
    void givesUpAfterMaxAttemptsAndNamesTheFailingFields() {
        ObjectNode broken = ArtifactFixtures.generatedTree();
        broken.remove("packages");
        ((ObjectNode) broken.get("visibility_summary")).put("gemini_label", "Great");
        for (int i = 0; i < 5; i++) {
            client.respond(ArtifactFixtures.json(broken), "stop");
        }

        assertThatThrownBy(() -> service().generate(sample, context))
            .isInstanceOf(SchemaValidationException.class)
            .hasMessageContaining("packages")
            .hasMessageContaining("visibility_summary.gemini_label")
            .satisfies(error -> assertThat(((SchemaValidationException) error).getAttempts()).isEqualTo(2));
        assertThat(client.requests).hasSize(2);
    }

    @Test
    void singleAttemptConfigurationNeverRepairs() {
        properties.getGeneration().setMaxAttempts(1);
        client.respond("not json at all", "stop");

        assertThatThrownBy(() -> service().generate(sample, context)).isInstanceOf(SchemaValidationException.class);
        assertThat(client.requests).hasSize(1);
    }

    @Test
    void transportFailurePropagatesWithoutFurtherAttempts() {
        client.fail(new GenerationCallException("Generation endpoint returned HTTP 401", 401));

        assertThatThrownBy(() -> service().generate(sample, context)).isInstanceOf(GenerationCallException.class);
        assertThat(client.requests).hasSize(1);
    }

    private ArtifactGeneratorService service() {
        return new ArtifactGeneratorService(
            properties,
            client,
            new PromptComposer(properties, ArtifactFixtures.MAPPER),
            new ArtifactOutputParser(ArtifactFixtures.MAPPER),
            new ArtifactReconciler(),
            ArtifactFixtures.MAPPER
        );
    }

    private static final class ScriptedClient implements GenerationClient {
        private final Deque<Object> script = new ArrayDeque<>();
        private final List<GenerationRequest> requests = new ArrayList<>();

        void respond(String content, String finishReason) {
            script.add(new GenerationResponse(content, finishReason, "test-model"));
        }

        void fail(RuntimeException error) {
            script.add(error);
        }

        @Override
        public GenerationResponse complete(GenerationRequest request) {
            requests.add(request);
            Object next = script.poll();
            if (next instanceof RuntimeException error) {
                throw error;
            }
            if (next == null) {
                throw new IllegalStateException("no scripted response for attempt " + request.attempt());
            }
            return (GenerationResponse) next;
        }
    }
}
