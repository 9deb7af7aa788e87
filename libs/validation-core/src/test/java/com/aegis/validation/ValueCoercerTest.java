package com.aegis.validation;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ValueCoercer")
class ValueCoercerTest {

    private final ValueCoercer lax = new ValueCoercer(CoercionMode.LAX);
    private final ValueCoercer strict = new ValueCoercer(CoercionMode.STRICT);

    private static final FieldDeclaration INTEGER = FieldDeclaration.integer("n");
    private static final FieldDeclaration FLOAT = FieldDeclaration.number("x");
    private static final FieldDeclaration BOOLEAN = FieldDeclaration.bool("b");
    private static final FieldDeclaration TIMESTAMP = FieldDeclaration.timestamp("t");
    private static final FieldDeclaration GRADE = FieldDeclaration.enumTag("grade", TestSchemas.Grade.class);

    private static final OffsetDateTime MAINTENANCE = OffsetDateTime.of(2024, 2, 1, 10, 30, 0, 0, ZoneOffset.UTC);

    @Nested
    @DisplayName("integer")
    class Integers {

        @Test
        @DisplayName("whole numbers become Long in both modes")
        void wholeNumbers() {
            assertThat(lax.coerce(INTEGER, 6).value()).isEqualTo(6L);
            assertThat(strict.coerce(INTEGER, 6).value()).isEqualTo(6L);
        }

        @Test
        @DisplayName("lax mode accepts integral floats and numeric text")
        void laxCoercion() {
            assertThat(lax.coerce(INTEGER, 42.0).value()).isEqualTo(42L);
            assertThat(lax.coerce(INTEGER, " 17 ").value()).isEqualTo(17L);
            assertThat(lax.coerce(INTEGER, new BigDecimal("3.000")).value()).isEqualTo(3L);
        }

        @Test
        @DisplayName("fractional values are never integers")
        void fractional() {
            assertThat(lax.coerce(INTEGER, 42.5).error()).endsWith("got a number with a fractional part");
        }

        @Test
        @DisplayName("NaN and infinities are type errors, not exceptions")
        void nonFinite() {
            assertThat(lax.coerce(INTEGER, Double.NaN).error()).isEqualTo("Input should be a finite number");
            assertThat(lax.coerce(INTEGER, Double.POSITIVE_INFINITY).succeeded()).isFalse();
            assertThat(lax.coerce(INTEGER, Float.NEGATIVE_INFINITY).succeeded()).isFalse();
        }

        @Test
        @DisplayName("huge values are out of range, not exceptions")
        void hugeValues() {
            assertThat(lax.coerce(INTEGER, "1e999999999").succeeded()).isFalse();
            assertThat(lax.coerce(INTEGER, 1e300).succeeded()).isFalse();
            assertThat(lax.coerce(INTEGER, new BigDecimal("1e999999999")).error())
                    .endsWith("the number is out of range");
            assertThat(lax.coerce(INTEGER, "99999999999999999999").error())
                    .endsWith("the number is out of range");
        }

        @Test
        @DisplayName("only plain decimal text is an integer")
        void decimalTextOnly() {
            assertThat(lax.coerce(INTEGER, "1e3").succeeded()).isFalse();
            assertThat(lax.coerce(INTEGER, "0x10").succeeded()).isFalse();
            assertThat(lax.coerce(INTEGER, "-7").value()).isEqualTo(-7L);
            assertThat(lax.coerce(INTEGER, "42.00").value()).isEqualTo(42L);
        }

        @Test
        @DisplayName("booleans are not integers")
        void booleans() {
            assertThat(lax.coerce(INTEGER, true).succeeded()).isFalse();
        }

        @Test
        @DisplayName("strict mode rejects text")
        void strictText() {
            assertThat(strict.coerce(INTEGER, "17").error()).isEqualTo("Input should be a valid integer");
        }
    }

    @Nested
    @DisplayName("float")
    class Floats {

        @Test
        @DisplayName("any number widens to Double")
        void numbers() {
            assertThat(strict.coerce(FLOAT, 5).value()).isEqualTo(5.0);
        }

        @Test
        @DisplayName("text parses only in lax mode")
        void text() {
            assertThat(lax.coerce(FLOAT, "7.5").value()).isEqualTo(7.5);
            assertThat(strict.coerce(FLOAT, "7.5").succeeded()).isFalse();
            assertThat(lax.coerce(FLOAT, "high").succeeded()).isFalse();
        }

        @Test
        @DisplayName("hex literals and Java type suffixes are not numbers")
        void decimalTextOnly() {
            assertThat(lax.coerce(FLOAT, "0x1p3").succeeded()).isFalse();
            assertThat(lax.coerce(FLOAT, "1d").succeeded()).isFalse();
            assertThat(lax.coerce(FLOAT, "2f").succeeded()).isFalse();
            assertThat(lax.coerce(FLOAT, "-.5").value()).isEqualTo(-0.5);
            assertThat(lax.coerce(FLOAT, "2.5e1").value()).isEqualTo(25.0);
        }
    }

    @Nested
    @DisplayName("boolean")
    class Booleans {

        @Test
        @DisplayName("lax mode reads common words and 0/1")
        void laxWords() {
            assertThat(lax.coerce(BOOLEAN, "Yes").value()).isEqualTo(true);
            assertThat(lax.coerce(BOOLEAN, "off").value()).isEqualTo(false);
            assertThat(lax.coerce(BOOLEAN, 0).value()).isEqualTo(false);
            assertThat(lax.coerce(BOOLEAN, 2).succeeded()).isFalse();
        }

        @Test
        @DisplayName("strict mode accepts only booleans")
        void strictOnly() {
            assertThat(strict.coerce(BOOLEAN, "true").succeeded()).isFalse();
            assertThat(strict.coerce(BOOLEAN, Boolean.TRUE).value()).isEqualTo(true);
        }
    }

    @Nested
    @DisplayName("timestamp")
    class Timestamps {

        @Test
        @DisplayName("naive text is read as UTC")
        void naive() {
            assertThat(lax.coerce(TIMESTAMP, "2024-02-01T10:30:00").value()).isEqualTo(MAINTENANCE);
            assertThat(lax.coerce(TIMESTAMP, "2024-02-01 10:30:00").value()).isEqualTo(MAINTENANCE);
        }

        @Test
        @DisplayName("offsets are normalized to UTC")
        void offset() {
            assertThat(lax.coerce(TIMESTAMP, "2024-02-01T12:30:00+02:00").value()).isEqualTo(MAINTENANCE);
            assertThat(lax.coerce(TIMESTAMP, "2024-02-01T10:30:00Z").value()).isEqualTo(MAINTENANCE);
        }

        @Test
        @DisplayName("a bare date is midnight UTC")
        void dateOnly() {
            assertThat(lax.coerce(TIMESTAMP, "2024-02-01").value())
                    .isEqualTo(OffsetDateTime.of(2024, 2, 1, 0, 0, 0, 0, ZoneOffset.UTC));
        }

        @Test
        @DisplayName("java.time values are accepted")
        void javaTime() {
            assertThat(strict.coerce(TIMESTAMP, MAINTENANCE.toInstant()).value()).isEqualTo(MAINTENANCE);
            assertThat(strict.coerce(TIMESTAMP, Instant.EPOCH).value())
                    .isEqualTo(OffsetDateTime.of(1970, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC));
        }

        @Test
        @DisplayName("unparseable text is a type error")
        void unparseable() {
            assertThat(lax.coerce(TIMESTAMP, "yesterday").error()).contains("'yesterday'");
            assertThat(lax.coerce(TIMESTAMP, 1_700_000_000L).succeeded()).isFalse();
        }
    }

    @Nested
    @DisplayName("enum tag")
    class EnumTags {

        @Test
        @DisplayName("constants become their tag; text passes through for membership")
        void tags() {
            assertThat(lax.coerce(GRADE, TestSchemas.Grade.PREMIUM).value()).isEqualTo("premium");
            assertThat(lax.coerce(GRADE, "gold").value()).isEqualTo("gold");
            assertThat(lax.coerce(GRADE, 5).succeeded()).isFalse();
        }

        @Test
        @DisplayName("resolveTag maps a tag to its constant")
        void resolve() {
            assertThat(ValueCoercer.resolveTag(GRADE, "standard")).isEqualTo(TestSchemas.Grade.STANDARD);
        }
    }
}
