package com.delta.siteaudit.generation.schema;

import com.delta.siteaudit.generation.ArtifactFixtures;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class SchemaValidatorTest {

    @Test
    void acceptsWellFormedGeneratedAndStoredDocuments() {
        assertThat(SchemaValidator.validate(ArtifactFixtures.generatedTree(), ArtifactSchema.GENERATED)).isEmpty();
        assertThat(SchemaValidator.validate(ArtifactFixtures.storedTree(), ArtifactSchema.STORED)).isEmpty();
    }

    @Test
    void generatedDocumentIsNotAStoredOne() {
        List<SchemaViolation> violations = SchemaValidator.validate(ArtifactFixtures.generatedTree(), ArtifactSchema.STORED);

        assertThat(violations)
            .extracting(SchemaViolation::path)
            .contains("decision_coverage_score", "appendix", "ai_interpretation.based_on_pages");
    }

    @Test
    void reportsEveryViolationWithItsPath() {
        ObjectNode tree = ArtifactFixtures.generatedTree();
        tree.remove("business_impact");
        ((ObjectNode) tree.get("visibility_summary")).put("chatgpt_visibility_percent", 140);
        ((ObjectNode) tree.get("visibility_summary")).put("gemini_label", "Excellent");
        ((ObjectNode) tree.get("ai_interpretation")).put("summary", "  ");
        ((ArrayNode) tree.get("decision_readiness_audit")).remove(0);
        ((ObjectNode) tree.get("decision_readiness_audit").get(0)).put("status", 3);

        List<SchemaViolation> violations = SchemaValidator.validate(tree, ArtifactSchema.GENERATED);

        assertThat(violations)
            .extracting(SchemaViolation::path, SchemaViolation::kind)
            .containsExactlyInAnyOrder(
                tuple("business_impact", ViolationKind.MISSING),
                tuple("visibility_summary.chatgpt_visibility_percent", ViolationKind.OUT_OF_RANGE),
                tuple("visibility_summary.gemini_label", ViolationKind.INVALID_ENUM),
                tuple("ai_interpretation.summary", ViolationKind.EMPTY),
                tuple("decision_readiness_audit", ViolationKind.TOO_FEW_ITEMS),
                tuple("decision_readiness_audit[0].status", ViolationKind.INVALID_ENUM)
            );
    }

    @Test
    void optionalFieldsMayBeAbsentButNotWrong() {
        ObjectNode tree = ArtifactFixtures.generatedTree();
        ((ObjectNode) tree.get("ai_interpretation")).remove("detected_signals");
        assertThat(SchemaValidator.validate(tree, ArtifactSchema.GENERATED)).isEmpty();

        ((ObjectNode) tree.get("ai_interpretation")).put("detected_signals", "pricing");
        assertThat(SchemaValidator.validate(tree, ArtifactSchema.GENERATED))
            .extracting(SchemaViolation::path, SchemaViolation::kind)
            .containsExactly(tuple("ai_interpretation.detected_signals", ViolationKind.WRONG_TYPE));
    }

    @Test
    void rejectsNonObjectDocument() {
        List<SchemaViolation> violations = SchemaValidator.validate(
            ArtifactFixtures.MAPPER.createArrayNode(),
            ArtifactSchema.GENERATED
        );

        assertThat(violations).extracting(SchemaViolation::path).containsExactly("$");
    }

    @Test
    void generatorSchemaLeavesOutPipelineOwnedSections() {
        assertThat(ArtifactSchema.GENERATED.field("decision_coverage_score")).isNull();
        assertThat(ArtifactSchema.GENERATED.field("appendix")).isNull();
        assertThat(ArtifactSchema.sectionNames()).hasSize(11).startsWith("visibility_summary").endsWith("appendix");
        assertThat(ArtifactSchema.describe(ArtifactSchema.GENERATED))
            .contains("decision_readiness_audit[].status: one of present | weak | missing")
            .doesNotContain("appendix");
    }
}
