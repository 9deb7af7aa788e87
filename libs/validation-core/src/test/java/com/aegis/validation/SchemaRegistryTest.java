package com.aegis.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SchemaRegistry")
class SchemaRegistryTest {

    @Nested
    @DisplayName("define / lookup")
    class DefineLookup {

        @Test
        @DisplayName("lookup returns the defined schema")
        void lookupDefined() {
            var registry = TestSchemas.registry();

            assertThat(registry.lookup(TestSchemas.PART).kind()).isEqualTo(TestSchemas.PART);
            assertThat(registry.kinds()).containsExactlyInAnyOrder(TestSchemas.PART, TestSchemas.ASSEMBLY);
            assertThat(registry.size()).isEqualTo(2);
            assertThat(registry.isDefined("nope")).isFalse();
        }

        @Test
        @DisplayName("unknown kind throws with the kind in the message")
        void unknownKind() {
            var registry = new SchemaRegistry();

            assertThatThrownBy(() -> registry.lookup("starship"))
                    .isInstanceOf(UnknownRecordKindException.class)
                    .hasMessage("Unknown record kind 'starship'")
                    .extracting(e -> ((UnknownRecordKindException) e).recordKind())
                    .isEqualTo("starship");
        }

        @Test
        @DisplayName("a kind cannot be defined twice")
        void redefinitionFails() {
            var registry = TestSchemas.registry();

            assertThatThrownBy(() -> registry.define(TestSchemas.partSchema()))
                    .isInstanceOf(SchemaDefinitionException.class)
                    .hasMessageContaining("already defined");
        }

        @Test
        @DisplayName("nested kinds must be defined first")
        void nestedKindMustExist() {
            var registry = new SchemaRegistry();

            assertThatThrownBy(() -> registry.define(TestSchemas.assemblySchema()))
                    .isInstanceOf(SchemaDefinitionException.class)
                    .hasMessageContaining("undefined record kind 'part'");
            assertThat(registry.isDefined(TestSchemas.ASSEMBLY)).isFalse();
        }

        @Test
        @DisplayName("a schema may embed its own kind")
        void selfReference() {
            var registry = new SchemaRegistry();
            var node = RecordSchema.builder("node")
                    .field(FieldDeclaration.string("label"))
                    .field(FieldDeclaration.records("children", "node").asOptional())
                    .build();

            registry.define(node);

            assertThat(registry.isDefined("node")).isTrue();
        }
    }

    @Nested
    @DisplayName("schema definition errors")
    class DefinitionErrors {

        @Test
        @DisplayName("constraint must apply to the field type")
        void inapplicableConstraint() {
            assertThatThrownBy(() -> FieldDeclaration.string("name").range(1, 2))
                    .isInstanceOf(SchemaDefinitionException.class)
                    .hasMessageContaining("numeric-range");
        }

        @Test
        @DisplayName("duplicate field names are rejected")
        void duplicateFields() {
            var builder = RecordSchema.builder("dup")
                    .field(FieldDeclaration.string("a"))
                    .field(FieldDeclaration.integer("a"));

            assertThatThrownBy(builder::build)
                    .isInstanceOf(SchemaDefinitionException.class)
                    .hasMessageContaining("duplicate field 'a'");
        }

        @Test
        @DisplayName("a schema needs at least one field")
        void emptySchema() {
            assertThatThrownBy(() -> RecordSchema.builder("empty").build())
                    .isInstanceOf(SchemaDefinitionException.class);
        }

        @Test
        @DisplayName("enum-tag fields get set membership over every tag")
        void enumTagMembership() {
            var field = FieldDeclaration.enumTag("grade", TestSchemas.Grade.class);

            assertThat(field.constraints()).containsExactly(Constraint.oneOf(List.of("standard", "premium")));
        }
    }
}
