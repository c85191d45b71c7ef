package com.delta.siteaudit.generation.service;

import com.delta.siteaudit.generation.client.GenerationResponse;
import com.delta.siteaudit.generation.model.AuditArtifactPayload;
import com.delta.siteaudit.generation.schema.ArtifactSchema;
import com.delta.siteaudit.generation.schema.SchemaValidator;
import com.delta.siteaudit.generation.schema.SchemaViolation;
import com.delta.siteaudit.generation.schema.ViolationKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw generated text into a JSON tree and checks it against the generator schema.
 * Nothing downstream sees generated output that has not passed through here.
 */
@Component
public class ArtifactOutputParser {
    private final ObjectMapper objectMapper;
    private final ObjectReader lenientReader;

    public ArtifactOutputParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.lenientReader = objectMapper.reader()
            .with(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .with(JsonReadFeature.ALLOW_JAVA_COMMENTS);
    }

    public ParsedOutput parse(GenerationResponse response) {
        List<SchemaViolation> violations = new ArrayList<>();
        if (response.isTruncated()) {
            violations.add(new SchemaViolation("$", ViolationKind.TRUNCATED,
                "output was cut off before it finished; respond more concisely"));
        }
        String json = extractJson(response.content());
        if (json == null) {
            violations.add(new SchemaViolation("$", ViolationKind.MALFORMED, "response contained no JSON object"));
            return new ParsedOutput(null, violations);
        }
        JsonNode tree;
        try {
            tree = lenientReader.readTree(json);
        } catch (JsonProcessingException e) {
            violations.add(new SchemaViolation("$", ViolationKind.MALFORMED,
                "response was not valid JSON: " + e.getOriginalMessage()));
            return new ParsedOutput(null, violations);
        }
        violations.addAll(SchemaValidator.validate(tree, ArtifactSchema.GENERATED));
        return new ParsedOutput(tree, violations);
    }

    /** Maps a tree that already passed {@link #parse}. */
    public AuditArtifactPayload toPayload(JsonNode validTree) throws JsonProcessingException {
        return objectMapper.treeToValue(validTree, AuditArtifactPayload.class);
    }

    static String extractJson(String content) {
        if (content == null || content.isBlank()) {
            return null;
        }
        String text = content.trim();
        if (text.startsWith("```")) {
            int firstNewline = text.indexOf('\n');
            text = firstNewline < 0 ? "" : text.substring(firstNewline + 1);
            int fence = text.lastIndexOf("```");
            if (fence >= 0) {
                text = text.substring(0, fence);
            }
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0) {
            return null;
        }
        return end > start ? text.substring(start, end + 1) : text.substring(start);
    }
}
