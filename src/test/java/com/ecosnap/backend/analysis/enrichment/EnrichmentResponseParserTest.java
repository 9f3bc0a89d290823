package com.ecosnap.backend.analysis.enrichment;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnrichmentResponseParserTest {

    private final EnrichmentResponseParser parser = new EnrichmentResponseParser(new ObjectMapper());

    @Test
    void fenced_json_with_prose_should_be_parsed() {
        String text = """
                Here is the analysis you asked for:
                ```json
                {"sub_scores":{"packaging":72,"carbon":64.6},"insights":["Compostable bowl keeps waste low"]}
                ```
                Let me know if you need more.
                """;

        EnrichmentPayload p = parser.parse(text);

        assertThat(p.subScores()).containsEntry("packaging", 72).containsEntry("carbon", 65);
        assertThat(p.insights()).containsExactly("Compostable bowl keeps waste low");
        assertThat(p.recommendations()).isNull();
        assertThat(p.acceptedFields()).isEqualTo(3);
    }

    @Test
    void trailing_commas_and_bom_should_be_repaired() {
        String text = "\uFEFF{\"recommendations\":[\"Buy in bulk\",],\"impact_summary\":\"Moderate impact\",}";

        EnrichmentPayload p = parser.parse(text);

        assertThat(p.recommendations()).containsExactly("Buy in bulk");
        assertThat(p.impactSummary()).isEqualTo("Moderate impact");
    }

    @Test
    void out_of_range_or_non_numeric_scores_should_be_dropped_individually() {
        String text = "{\"sub_scores\":{\"packaging\":140,\"carbon\":\"80\",\"materials\":-3,\"health\":55}}";

        EnrichmentPayload p = parser.parse(text);

        assertThat(p.subScores()).containsOnlyKeys("health");
        assertThat(p.subScores()).containsEntry("health", 55);
    }

    @Test
    void unknown_score_names_should_be_ignored() {
        String text = "{\"sub_scores\":{\"water\":90,\"materials\":70}}";

        assertThat(parser.parse(text).subScores()).containsOnlyKeys("materials");
    }

    @Test
    void mixed_type_list_should_drop_whole_field() {
        String text = "{\"insights\":[\"ok\", 3],\"impactSummary\":\"Fine\"}";

        EnrichmentPayload p = parser.parse(text);

        assertThat(p.insights()).isNull();
        assertThat(p.impactSummary()).isEqualTo("Fine");
    }

    @Test
    void empty_certifications_array_should_count_as_valid_field() {
        EnrichmentPayload p = parser.parse("{\"certifications\":[]}");

        assertThat(p.certifications()).isEmpty();
        assertThat(p.acceptedFields()).isEqualTo(1);
    }

    @Test
    void empty_insights_array_should_be_treated_as_absent() {
        assertThatThrownBy(() -> parser.parse("{\"insights\":[]}"))
                .isInstanceOf(SchemaValidationException.class)
                .hasMessage("NO_VALID_SCHEMA_FIELD");
    }

    @Test
    void long_text_lists_should_be_capped() {
        StringBuilder sb = new StringBuilder("{\"insights\":[");
        for (int i = 0; i < 20; i++) {
            if (i > 0) sb.append(',');
            sb.append("\"insight ").append(i).append('"');
        }
        sb.append("]}");

        EnrichmentPayload p = parser.parse(sb.toString());

        assertThat(p.insights()).hasSize(EnrichmentResponseParser.MAX_TEXT_ITEMS);
    }

    @Test
    void non_json_output_should_throw_schema_error() {
        assertThatThrownBy(() -> parser.parse("I'm sorry, I cannot help with that."))
                .isInstanceOf(SchemaValidationException.class)
                .satisfies(e -> assertThat(((SchemaValidationException) e).getCode())
                        .isEqualTo(SchemaValidationException.CODE))
                .hasMessage("NO_JSON_IN_MODEL_OUTPUT");
    }

    @Test
    void truncated_json_should_throw_schema_error() {
        assertThatThrownBy(() -> parser.parse("{\"sub_scores\":{\"packaging\":7"))
                .isInstanceOf(SchemaValidationException.class)
                .hasMessage("MODEL_OUTPUT_NOT_JSON");
    }

    @Test
    void blank_output_should_throw_schema_error() {
        assertThatThrownBy(() -> parser.parse("  "))
                .isInstanceOf(SchemaValidationException.class)
                .hasMessage("EMPTY_MODEL_OUTPUT");
    }

    @Test
    void json_without_any_known_field_should_throw_schema_error() {
        assertThatThrownBy(() -> parser.parse("{\"answer\":42}"))
                .isInstanceOf(SchemaValidationException.class)
                .hasMessage("NO_VALID_SCHEMA_FIELD");
    }

    @Test
    void extract_should_skip_braces_inside_strings() {
        String s = "prefix {\"a\":\"has } brace\",\"b\":[1,2]} suffix {\"c\":1}";

        assertThat(EnrichmentResponseParser.extractFirstJsonPayload(s))
                .isEqualTo("{\"a\":\"has } brace\",\"b\":[1,2]}");
    }

    @Test
    void remove_trailing_commas_should_not_touch_string_content() {
        String s = "{\"a\":\"x,}\",\"b\":[1,2,],}";

        assertThat(EnrichmentResponseParser.removeTrailingCommas(s)).isEqualTo("{\"a\":\"x,}\",\"b\":[1,2]}");
    }
}
