package com.aegis.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ValidationJson")
class ValidationJsonTest {

    private final ValidationEngine engine = ValidationEngine.builder(TestSchemas.registry()).build();

    private static JsonNode tree(String json) throws JsonProcessingException {
        return ValidationJson.objectMapper().readTree(json);
    }

    @Nested
    @DisplayName("readRawInput")
    class ReadRawInput {

        @Test
        @DisplayName("objects become maps and arrays become lists")
        void nested() {
            Map<String, Object> raw = ValidationJson.readRawInput(
                    "{\"assembly_id\":\"AS-1\",\"parts\":[{\"part_id\":\"P-1\",\"count\":2}]}");

            assertThat(raw).containsKeys("assembly_id", "parts");
            assertThat(raw.get("parts")).isInstanceOf(List.class);
            assertThat(((List<?>) raw.get("parts")).get(0)).isInstanceOf(Map.class);
        }

        @Test
        @DisplayName("malformed JSON and non-objects are rejected")
        void rejects() {
            assertThatThrownBy(() -> ValidationJson.readRawInput("{"))
                    .isInstanceOf(ValidationJson.ValidationJsonException.class)
                    .hasCauseInstanceOf(JsonProcessingException.class);
            assertThatThrownBy(() -> ValidationJson.readRawInput("[1, 2]"))
                    .isInstanceOf(ValidationJson.ValidationJsonException.class)
                    .hasMessage("Raw input must be a JSON object");
        }
    }

    @Nested
    @DisplayName("writing")
    class Writing {

        @Test
        @DisplayName("report lists path, kind, message and context in order")
        void report() throws Exception {
            var raw = TestSchemas.with(TestSchemas.part("X"), "weight", 150.0);
            var report = engine.validate(TestSchemas.PART, raw).errors();

            JsonNode violations = tree(ValidationJson.writeReport(report)).get("violations");

            assertThat(violations.size()).isEqualTo(2);
            assertThat(violations.get(0).get("path").asText()).isEqualTo("part_id");
            assertThat(violations.get(1).get("kind").asText()).isEqualTo("range_error");
            assertThat(violations.get(1).get("message").asText())
                    .isEqualTo("Input should be less than or equal to 100.0");
            assertThat(violations.get(1).get("context").get("value").asDouble()).isEqualTo(150.0);
        }

        @Test
        @DisplayName("record writes tags and ISO timestamps")
        void record() throws Exception {
            var raw = TestSchemas.with(TestSchemas.part("P-1"), "made_at", "2024-02-01T10:30:00");
            var record = engine.validate(TestSchemas.PART, raw).orElseThrow();

            JsonNode json = tree(ValidationJson.writeRecord(record));

            assertThat(json.get("grade").asText()).isEqualTo("standard");
            assertThat(json.get("made_at").asText()).isEqualTo("2024-02-01T10:30:00Z");
            assertThat(json.get("active").asBoolean()).isTrue();
        }

        @Test
        @DisplayName("result carries kind and validity")
        void result() throws Exception {
            var ok = engine.validate(TestSchemas.ASSEMBLY, TestSchemas.assembly(TestSchemas.part("P-1")));
            var failed = engine.validate(TestSchemas.PART, TestSchemas.part("X"));

            JsonNode okJson = tree(ValidationJson.writeResult(ok));
            JsonNode failedJson = tree(ValidationJson.writeResult(failed));

            assertThat(okJson.get("recordKind").asText()).isEqualTo("assembly");
            assertThat(okJson.get("record").get("parts").get(0).get("part_id").asText()).isEqualTo("P-1");
            assertThat(failedJson.get("valid").asBoolean()).isFalse();
            assertThat(failedJson.get("violations").size()).isEqualTo(1);
        }
    }
}
