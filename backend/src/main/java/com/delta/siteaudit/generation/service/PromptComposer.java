package com.delta.siteaudit.generation.service;

import com.delta.siteaudit.config.AuditProperties;
import com.delta.siteaudit.crawl.model.CrawledPage;
import com.delta.siteaudit.generation.client.GenerationRequest;
import com.delta.siteaudit.generation.schema.ArtifactSchema;
import com.delta.siteaudit.generation.schema.SchemaViolation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Builds generation requests. A repair request is the original request plus an explicit list
 * of the previous attempt's violations and that attempt's output.
 */
@Component
public class PromptComposer {
    private static final int MAX_PREVIOUS_OUTPUT_CHARS = 60_000;

    private final AuditProperties.Sampling sampling;
    private final ObjectMapper objectMapper;

    public PromptComposer(AuditProperties properties, ObjectMapper objectMapper) {
        this.sampling = properties.getSampling();
        this.objectMapper = objectMapper;
    }

    public GenerationRequest initial(SampledPages sample, GenerationContext context) {
        return new GenerationRequest(systemPrompt(), basePrompt(sample, context), 1);
    }

    public GenerationRequest repair(
        SampledPages sample,
        GenerationContext context,
        String previousOutput,
        List<SchemaViolation> violations,
        int attempt
    ) {
        StringBuilder prompt = new StringBuilder(basePrompt(sample, context));
        prompt.append("\n\n## Previous attempt was rejected\n");
        prompt.append("Your previous response failed validation. Fix every field listed below and return the ")
            .append("complete JSON object again, keeping valid fields as they were.\n");
        for (SchemaViolation violation : violations) {
            prompt.append("- ").append(violation.path()).append(" [").append(violation.kind()).append("]: ")
                .append(violation.detail()).append('\n');
        }
        prompt.append("\n### Previous response\n");
        prompt.append(truncate(previousOutput == null ? "" : previousOutput, MAX_PREVIOUS_OUTPUT_CHARS));
        return new GenerationRequest(systemPrompt(), prompt.toString(), attempt);
    }

    private String systemPrompt() {
        return "You are an analyst assessing how well a business website lets AI assistants understand, "
            + "compare and recommend it. Respond with a single JSON object and nothing else.";
    }

    private String basePrompt(SampledPages sample, GenerationContext context) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("## Target\n").append(context.targetDomain()).append('\n');
        prompt.append("Locale: ").append(context.locale()).append('\n');
        if (context.businessContext() != null && !context.businessContext().isBlank()) {
            prompt.append("Business context: ").append(context.businessContext().trim()).append('\n');
        }
        if (!context.comparisonDomains().isEmpty()) {
            prompt.append("Comparison sites: ").append(String.join(", ", context.comparisonDomains())).append('\n');
        }
        prompt.append("\n## Site signals\n").append(toJson(context.signals())).append('\n');

        prompt.append("\n## Target pages\n");
        appendPages(prompt, sample.target());
        for (Map.Entry<String, List<CrawledPage>> entry : sample.comparisons().entrySet()) {
            prompt.append("\n## Comparison site ").append(entry.getKey()).append('\n');
            appendPages(prompt, entry.getValue());
        }

        prompt.append("\n## Output format\n");
        prompt.append("Return one JSON object with exactly these fields. Counts and appendix are computed ")
            .append("separately, do not include them.\n");
        prompt.append(ArtifactSchema.describe(ArtifactSchema.GENERATED));
        return prompt.toString();
    }

    private void appendPages(StringBuilder prompt, List<CrawledPage> pages) {
        for (CrawledPage page : pages) {
            prompt.append("### ").append(page.url()).append(" (tier ").append(page.priorityTier()).append(")\n");
            if (page.title() != null && !page.title().isBlank()) {
                prompt.append("Title: ").append(page.title()).append('\n');
            }
            if (page.metaDescription() != null && !page.metaDescription().isBlank()) {
                prompt.append("Description: ").append(page.metaDescription()).append('\n');
            }
            prompt.append(truncate(page.extractedText() == null ? "" : page.extractedText(), sampling.getExcerptChars()))
                .append("\n\n");
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize prompt context", e);
        }
    }

    private static String truncate(String value, int maxChars) {
        return value.length() <= maxChars ? value : value.substring(0, maxChars) + " ...";
    }
}
