package com.pipesql.lexer;

import com.pipesql.diagnostic.Span;
import com.pipesql.exception.CompilationFailedException;
import com.pipesql.exception.ErrorKind;
import com.pipesql.test.TestBase;
import com.pipesql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static com.pipesql.lexer.TokenKind.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Lexer")
@Tag("lexer")
@TestCategories.Unit
public class LexerTest extends TestBase {

    private static Token single(String source) {
        List<Token> tokens = Lexer.tokenize(source);
        assertThat(tokens).hasSize(1);
        return tokens.get(0);
    }

    @Nested
    @DisplayName("Pipelines")
    class Pipelines {

        @Test
        @DisplayName("tokens carry kinds and exact spans")
        void simplePipeline() {
            List<Token> tokens = Lexer.tokenize("from t | take 10");

            assertThat(tokens).extracting(Token::kind).containsExactly(IDENT, IDENT, PIPE, IDENT, INTEGER);
            assertThat(tokens.get(1).span()).isEqualTo(new Span(5, 6));
            assertThat(tokens.get(4).value()).isEqualTo("10");
        }

        @Test
        @DisplayName("new lines are tokens and comments are dropped")
        void newLinesAndComments() {
            List<Token> tokens = Lexer.tokenize("from t # the table\nselect a");

            assertThat(tokens).extracting(Token::kind).containsExactly(IDENT, IDENT, NEW_LINE, IDENT, IDENT);
        }

        @Test
        @DisplayName("a trailing backslash joins lines")
        void lineContinuation() {
            List<Token> tokens = Lexer.tokenize("from t\n\\ select a");

            assertThat(tokens).extracting(Token::kind).containsExactly(IDENT, IDENT, IDENT, IDENT);
        }

        @Test
        @DisplayName("keywords, booleans and null")
        void keywords() {
            assertThat(Lexer.tokenize("let x = null && true"))
                .extracting(Token::kind)
                .containsExactly(LET, IDENT, ASSIGN, NULL, AND, BOOLEAN);
        }
    }

    @Nested
    @DisplayName("Literals")
    class Literals {

        @ParameterizedTest(name = "{0}")
        @CsvSource({
            "1_000,   INTEGER, 1000",
            "0x1f,    INTEGER, 31",
            "0b101,   INTEGER, 5",
            "2.5,     FLOAT,   2.5",
            "1e3,     FLOAT,   1e3"
        })
        @DisplayName("numbers are normalized")
        void numbers(String source, TokenKind kind, String value) {
            Token token = single(source);

            assertThat(token.kind()).isEqualTo(kind);
            assertThat(token.value()).isEqualTo(value);
        }

        @Test
        @DisplayName("strings are unescaped")
        void strings() {
            assertThat(single("'it\\'s'").value()).isEqualTo("it's");
            assertThat(single("\"a\\nb\"").value()).isEqualTo("a\nb");
            assertThat(single("r\"a\\nb\"").value()).isEqualTo("a\\nb");
            assertThat(single("''").value()).isEmpty();
            assertThat(single("\"\"\"say \"hi\"\"\"\"").value()).isEqualTo("say \"hi\"");
        }

        @Test
        @DisplayName("dates, times and timestamps")
        void datesAndTimes() {
            assertThat(single("@2024-01-31").kind()).isEqualTo(DATE);
            assertThat(single("@12:30:00").kind()).isEqualTo(TIME);
            assertThat(single("@2024-01-31T12:30").kind()).isEqualTo(TIMESTAMP);
            assertThat(single("@2024-01-31").value()).isEqualTo("2024-01-31");
        }

        @Test
        @DisplayName("a number followed by a unit is an interval")
        void intervals() {
            Token token = single("10days");

            assertThat(token.kind()).isEqualTo(VALUE_AND_UNIT);
            assertThat(token.value()).isEqualTo("10");
            assertThat(token.unit()).isEqualTo("days");
        }

        @Test
        @DisplayName("quoted identifiers and parameters")
        void identsAndParams() {
            assertThat(single("`my col`").kind()).isEqualTo(IDENT);
            assertThat(single("`my col`").value()).isEqualTo("my col");
            assertThat(single("$1").kind()).isEqualTo(PARAM);
            assertThat(single("$name").value()).isEqualTo("name");
        }
    }

    @Nested
    @DisplayName("Operators")
    class Operators {

        @Test
        @DisplayName("two character operators win over one character ones")
        void twoCharacter() {
            assertThat(Lexer.tokenize("a == b != c ?? d // e ** f ~= g"))
                .extracting(Token::kind)
                .containsExactly(IDENT, EQ, IDENT, NE, IDENT, COALESCE, IDENT, DIV_INT, IDENT, POW, IDENT,
                                 REGEX_SEARCH, IDENT);
        }

        @Test
        @DisplayName("ranges record whether they bind to their neighbours")
        void ranges() {
            Token bound = Lexer.tokenize("1..5").get(1);
            Token open = Lexer.tokenize("5 .. ").get(1);

            assertThat(bound.kind()).isEqualTo(RANGE);
            assertThat(bound.bindLeft()).isTrue();
            assertThat(bound.bindRight()).isTrue();
            assertThat(open.bindLeft()).isFalse();
            assertThat(open.bindRight()).isFalse();
        }
    }

    @Nested
    @DisplayName("Interpolated strings")
    class Interpolation {

        @Test
        @DisplayName("s-strings split into text and tokenized expressions")
        void sString() {
            Token token = single("s\"UPPER({name})\"");

            assertThat(token.kind()).isEqualTo(INTERPOLATION);
            assertThat(token.value()).isEqualTo("s");
            assertThat(token.parts()).hasSize(3);
            assertThat(token.parts().get(0)).isEqualTo(new InterpolationPart.Text("UPPER("));
            InterpolationPart.Expression expr = (InterpolationPart.Expression) token.parts().get(1);
            assertThat(expr.tokens()).extracting(Token::value).containsExactly("name");
            assertThat(expr.span()).isEqualTo(new Span(9, 13));
        }

        @Test
        @DisplayName("doubled braces are literal")
        void escapedBraces() {
            Token token = single("f\"{{x}}\"");

            assertThat(token.parts()).containsExactly(new InterpolationPart.Text("{x}"));
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("every malformed token is reported")
        void accumulates() {
            assertThatThrownBy(() -> Lexer.tokenize("from t | filter a ^ b ; c"))
                .isInstanceOfSatisfying(CompilationFailedException.class, e -> {
                    assertThat(e.errors()).hasSize(2);
                    assertThat(e.errors().get(0).kind()).isEqualTo(ErrorKind.LEX);
                    assertThat(e.errors().get(0).span()).isEqualTo(new Span(18, 19));
                    assertThat(e.errors().get(0).reason()).isEqualTo("Unexpected character `^`");
                });
        }

        @Test
        void unterminatedString() {
            assertThatThrownBy(() -> Lexer.tokenize("from 'abc"))
                .isInstanceOf(CompilationFailedException.class)
                .hasMessageContaining("Unterminated string literal");
        }

        @Test
        void invalidDate() {
            assertThatThrownBy(() -> Lexer.tokenize("@2024-13"))
                .isInstanceOf(CompilationFailedException.class)
                .hasMessageContaining("Invalid date or time literal");
        }
    }
}
