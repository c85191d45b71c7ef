package com.delta.siteaudit.generation.schema;

import com.delta.siteaudit.generation.model.Confidence;
import com.delta.siteaudit.generation.model.ContentStatus;
import com.delta.siteaudit.generation.model.ReadinessStatus;
import com.delta.siteaudit.generation.model.RequirementCategory;
import com.delta.siteaudit.generation.model.RequirementStatus;
import com.delta.siteaudit.generation.model.SchemaValue;
import com.delta.siteaudit.generation.model.Severity;
import com.delta.siteaudit.generation.model.VisibilityLabel;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.delta.siteaudit.generation.schema.FieldSpec.array;
import static com.delta.siteaudit.generation.schema.FieldSpec.enumeration;
import static com.delta.siteaudit.generation.schema.FieldSpec.integer;
import static com.delta.siteaudit.generation.schema.FieldSpec.object;
import static com.delta.siteaudit.generation.schema.FieldSpec.string;
import static com.delta.siteaudit.generation.schema.FieldSpec.stringArray;

/**
 * The fixed artifact schema. {@link #STORED} is what every persisted artifact satisfies;
 * {@link #GENERATED} is the subset requested from the generation call, which leaves out the
 * sections and counts the pipeline computes itself.
 */
public final class ArtifactSchema {
    public static final String VERSION = "2";

    public static final String VISIBILITY_SUMMARY = "visibility_summary";
    public static final String AI_INTERPRETATION = "ai_interpretation";
    public static final String DECISION_READINESS_AUDIT = "decision_readiness_audit";
    public static final String DECISION_COVERAGE_SCORE = "decision_coverage_score";
    public static final String AI_REQUIREMENTS_BEFORE = "ai_requirements_before";
    public static final String AI_REQUIREMENTS_AFTER = "ai_requirements_after";
    public static final String WHY_AI_CHOOSES_OTHERS = "why_ai_chooses_others";
    public static final String WHAT_AI_NEEDS = "what_ai_needs";
    public static final String PACKAGES = "packages";
    public static final String BUSINESS_IMPACT = "business_impact";
    public static final String APPENDIX = "appendix";

    /** Sections the pipeline writes; never requested from the generator. */
    public static final Set<String> PIPELINE_OWNED = Set.of(DECISION_COVERAGE_SCORE, APPENDIX);

    public static final FieldSpec STORED = build(false);
    public static final FieldSpec GENERATED = build(true);

    private ArtifactSchema() {
    }

    /** Top-level section names in schema order. */
    public static List<String> sectionNames() {
        return STORED.fields().stream().map(FieldSpec::name).toList();
    }

    private static FieldSpec build(boolean forGenerator) {
        FieldSpec basedOnPages = integer("based_on_pages", 0, 1000);
        List<FieldSpec> sections = new ArrayList<>(List.of(
            object(VISIBILITY_SUMMARY,
                integer("chatgpt_visibility_percent", 0, 100),
                integer("gemini_visibility_percent", 0, 100),
                integer("perplexity_visibility_percent", 0, 100),
                enumeration("chatgpt_label", SchemaValue.valuesOf(VisibilityLabel.class)),
                enumeration("gemini_label", SchemaValue.valuesOf(VisibilityLabel.class)),
                enumeration("perplexity_label", SchemaValue.valuesOf(VisibilityLabel.class)),
                string("headline")
            ),
            object(AI_INTERPRETATION,
                string("summary"),
                enumeration("confidence", SchemaValue.valuesOf(Confidence.class)),
                forGenerator ? basedOnPages.optional() : basedOnPages,
                stringArray("detected_signals", 0, 8).optional(),
                array("missing_elements", 4, 6, object("item",
                    string("key"),
                    string("label"),
                    string("impact"),
                    enumeration("severity", SchemaValue.valuesOf(Severity.class))
                ))
            ),
            array(DECISION_READINESS_AUDIT, 12, 18, object("item",
                string("element_name"),
                enumeration("status", SchemaValue.valuesOf(ReadinessStatus.class)),
                string("what_ai_requires"),
                string("what_we_found"),
                string("impact_on_recommendation")
            )),
            object(DECISION_COVERAGE_SCORE,
                integer("present", 0, 18),
                integer("weak", 0, 18),
                integer("missing", 0, 18),
                integer("total", 0, 18)
            ),
            array(AI_REQUIREMENTS_BEFORE, 10, 20, object("item",
                string("requirement_name"),
                enumeration("category", SchemaValue.valuesOf(RequirementCategory.class)),
                string("why_ai_needs_this"),
                enumeration("current_status", SchemaValue.valuesOf(RequirementStatus.class)),
                string("impact_if_missing")
            )),
            array(AI_REQUIREMENTS_AFTER, 10, 20, object("item",
                string("requirement_name"),
                enumeration("category", SchemaValue.valuesOf(RequirementCategory.class)),
                string("what_must_be_built"),
                string("ai_outcome_unlocked")
            )),
            array(WHY_AI_CHOOSES_OTHERS, 1, 5, object("item",
                string("how_llms_decide"),
                string("what_we_found_on_your_site"),
                string("what_ai_does_instead"),
                string("what_must_be_built")
            )),
            array(WHAT_AI_NEEDS, 1, 8, object("item",
                string("content_type"),
                string("what_it_unlocks"),
                enumeration("status", SchemaValue.valuesOf(ContentStatus.class)),
                string("what_we_saw")
            )),
            object(PACKAGES,
                pagePackage("entry"),
                pagePackage("recommendation"),
                pagePackage("authority")
            ),
            object(BUSINESS_IMPACT,
                string("cost_of_invisibility"),
                string("why_visibility_compounds"),
                string("why_waiting_hurts"),
                string("recommended_option"),
                string("closing_line")
            ),
            object(APPENDIX,
                stringArray("sampled_urls", 0, 200),
                string("data_limitations"),
                integer("pages_analyzed_target", 0, 1000),
                integer("pages_analyzed_competitors", 0, 1000)
            )
        ));
        if (forGenerator) {
            sections.removeIf(section -> PIPELINE_OWNED.contains(section.name()));
        }
        return object("$", sections.toArray(new FieldSpec[0]));
    }

    private static FieldSpec pagePackage(String name) {
        return object(name,
            string("package_name"),
            integer("pages", 1, 500),
            string("purpose"),
            stringArray("what_ai_can_do", 1, 4),
            stringArray("pages_to_build", 0, 40).optional()
        );
    }

    /**
     * Plain-text outline of a schema, one line per field, used to tell the generator what
     * shape to produce.
     */
    public static String describe(FieldSpec spec) {
        StringBuilder out = new StringBuilder();
        for (FieldSpec field : spec.fields()) {
            describe(field, field.name(), out);
        }
        return out.toString();
    }

    private static void describe(FieldSpec spec, String path, StringBuilder out) {
        String optional = spec.required() ? "" : " (optional)";
        switch (spec.type()) {
            case STRING -> out.append(path).append(": string").append(optional).append('\n');
            case INTEGER -> out.append(path).append(": integer ")
                .append(spec.min()).append("..").append(spec.max()).append(optional).append('\n');
            case ENUM -> out.append(path).append(": one of ")
                .append(String.join(" | ", spec.allowedValues())).append(optional).append('\n');
            case OBJECT -> {
                out.append(path).append(": object").append(optional).append('\n');
                for (FieldSpec field : spec.fields()) {
                    describe(field, path + "." + field.name(), out);
                }
            }
            case ARRAY -> {
                FieldSpec items = spec.items();
                String itemType = items.type() == FieldType.OBJECT ? "objects" : "strings";
                out.append(path).append(": array of ").append(spec.min()).append("..").append(spec.max())
                    .append(' ').append(itemType).append(optional).append('\n');
                if (items.type() == FieldType.OBJECT) {
                    for (FieldSpec field : items.fields()) {
                        describe(field, path + "[]." + field.name(), out);
                    }
                }
            }
        }
    }
}
