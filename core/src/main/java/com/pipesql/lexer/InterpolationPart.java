package com.pipesql.lexer;

import com.pipesql.diagnostic.Span;

import java.util.List;
import java.util.Objects;

/**
 * One piece of an interpolated string body: either literal text or a
 * tokenized {@code {...}} sub-expression.
 */
public sealed interface InterpolationPart {

    record Text(String text) implements InterpolationPart {
        public Text {
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    /**
     * @param tokens tokens of the braced expression, with absolute spans
     * @param span span of the expression text inside the braces
     * @param format optional format suffix after {@code :}, or null
     */
    record Expression(List<Token> tokens, Span span, String format) implements InterpolationPart {
        public Expression {
            tokens = List.copyOf(tokens);
            Objects.requireNonNull(span, "span must not be null");
        }
    }
}
