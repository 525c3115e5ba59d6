package io.shortcode.core.parse;

import static org.assertj.core.api.Assertions.assertThat;

import io.shortcode.core.model.Literal;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Tests for {@link LiteralParser}. */
class LiteralParserTest {

    private static Literal parse(String text) {
        return LiteralParser.parse(text).orElseThrow(() -> new AssertionError("not a literal: " + text));
    }

    @Nested
    @DisplayName("Booleans")
    class Booleans {

        @Test
        void trueAndFalse() {
            assertThat(parse("true")).isEqualTo(Literal.of(true));
            assertThat(parse("false")).isEqualTo(Literal.of(false));
        }

        @Test
        void booleanPrefixMatchesAndLeavesRemainder() {
            Cursor cursor = new Cursor("trueish", 0);

            assertThat(LiteralParser.literal(cursor)).isEqualTo(Literal.Bool.TRUE);
            assertThat(cursor.pos()).isEqualTo(4);
            assertThat(LiteralParser.parse("trueish")).isEmpty();
        }

        @Test
        void booleansAreCaseSensitive() {
            assertThat(LiteralParser.parse("True")).isEmpty();
            assertThat(LiteralParser.parse("FALSE")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Strings")
    class Strings {

        @Test
        void allThreeDelimiters() {
            assertThat(parse("\"double\"")).isEqualTo(Literal.of("double"));
            assertThat(parse("'single'")).isEqualTo(Literal.of("single"));
            assertThat(parse("`backtick`")).isEqualTo(Literal.of("backtick"));
        }

        @Test
        void otherDelimitersAreOrdinaryContent() {
            assertThat(parse("\"it's `fine`\"")).isEqualTo(Literal.of("it's `fine`"));
            assertThat(parse("'say \"hi\"'")).isEqualTo(Literal.of("say \"hi\""));
        }

        @Test
        void noEscapeSequences() {
            assertThat(parse("\"a\\nb\\\"")).isEqualTo(Literal.of("a\\nb\\"));
        }

        @Test
        void contentMaySpanLines() {
            assertThat(parse("`line one\nline two`")).isEqualTo(Literal.of("line one\nline two"));
        }

        @Test
        void emptyString() {
            assertThat(parse("''")).isEqualTo(Literal.of(""));
        }

        @Test
        void unterminatedStringIsNotALiteral() {
            assertThat(LiteralParser.parse("\"open")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Numbers")
    class Numbers {

        @Test
        void integers() {
            assertThat(parse("0")).isEqualTo(Literal.of(0));
            assertThat(parse("42")).isEqualTo(Literal.of(42));
            assertThat(parse("-7")).isEqualTo(Literal.of(-7));
            assertThat(parse("-0")).isEqualTo(Literal.of(0));
        }

        @Test
        void floatsWinOverIntegersForTheLongerMatch() {
            assertThat(parse("1.5")).isEqualTo(Literal.of(1.5));
            assertThat(parse("-0.25")).isEqualTo(Literal.of(-0.25));
            assertThat(parse("0.0")).isInstanceOf(Literal.Float.class);
        }

        @ParameterizedTest
        @ValueSource(strings = {"01", "00", "-01", "01.5", "1.", ".5", "-", "1e3", "+1", "1.2.3"})
        void malformedNumbersAreNotLiterals(String text) {
            assertThat(LiteralParser.parse(text)).isEmpty();
        }

        @Test
        void leadingZeroMatchesOnlyTheZero() {
            Cursor cursor = new Cursor("01", 0);

            assertThat(LiteralParser.literal(cursor)).isEqualTo(Literal.of(0));
            assertThat(cursor.pos()).isEqualTo(1);
        }

        @Test
        void longBoundsAreAccepted() {
            assertThat(parse("9223372036854775807")).isEqualTo(Literal.of(Long.MAX_VALUE));
            assertThat(parse("-9223372036854775808")).isEqualTo(Literal.of(Long.MIN_VALUE));
        }

        @Test
        void integerOverflowFailsTheLiteral() {
            Cursor cursor = new Cursor("9223372036854775808", 0);

            assertThat(LiteralParser.literal(cursor)).isNull();
            assertThat(cursor.pos()).isZero();
        }

        @Test
        void floatOverflowFailsTheLiteral() {
            String huge = "1" + "0".repeat(400) + ".0";

            assertThat(LiteralParser.parse(huge)).isEmpty();
        }

        @Test
        void largeFloatWithinRangeIsAccepted() {
            assertThat(parse("12345678901234567890.5")).isInstanceOf(Literal.Float.class);
        }
    }

    @Nested
    @DisplayName("Arrays")
    class Arrays {

        @Test
        void trailingCommaIsAccepted() {
            Literal expected = Literal.of(Literal.of(1), Literal.of(2), Literal.of(3));

            assertThat(parse("[1, 2, 3,]")).isEqualTo(expected);
            assertThat(parse("[1, 2, 3]")).isEqualTo(expected);
        }

        @Test
        void emptyArray() {
            assertThat(parse("[]")).isEqualTo(new Literal.Array(List.of()));
            assertThat(parse("[ \n ]")).isEqualTo(new Literal.Array(List.of()));
        }

        @Test
        void heterogeneousAndNested() {
            Literal literal = parse("[true, \"a\", -1, 2.5, [[], ['x']]]");

            assertThat(literal)
                    .isEqualTo(Literal.of(
                            Literal.of(true),
                            Literal.of("a"),
                            Literal.of(-1),
                            Literal.of(2.5),
                            Literal.of(new Literal.Array(List.of()), Literal.of(Literal.of("x")))));
        }

        @Test
        void whitespaceIsInsignificant() {
            assertThat(parse("[\t1 ,\r\n 2\n,\n]")).isEqualTo(Literal.of(Literal.of(1), Literal.of(2)));
        }

        @ParameterizedTest
        @ValueSource(strings = {"[", "[1", "[1,,]", "[,]", "[1 2]", "[01]", "[1,2,,]", "[1]]"})
        void malformedArraysAreNotLiterals(String text) {
            assertThat(LiteralParser.parse(text)).isEmpty();
        }

        @Test
        void nestingBeyondLimitFailsWithoutStackOverflow() {
            int depth = LiteralParser.MAX_ARRAY_DEPTH + 1;
            String deep = "[".repeat(depth) + "]".repeat(depth);

            assertThat(LiteralParser.parse(deep)).isEmpty();
        }

        @Test
        void nestingAtLimitIsAccepted() {
            int depth = LiteralParser.MAX_ARRAY_DEPTH;
            String deep = "[".repeat(depth) + "]".repeat(depth);

            assertThat(LiteralParser.parse(deep)).isPresent();
        }
    }

    @Test
    void failedAlternativeRestoresCursor() {
        Cursor cursor = new Cursor("[1, 2", 0);

        assertThat(LiteralParser.literal(cursor)).isNull();
        assertThat(cursor.pos()).isZero();
    }

    @Test
    void surroundingWhitespaceIsNotPartOfALiteral() {
        assertThat(LiteralParser.parse(" 1")).isEmpty();
        assertThat(LiteralParser.parse("1 ")).isEmpty();
    }
}
