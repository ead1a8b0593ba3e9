package com.pipesql.parser;

import com.pipesql.diagnostic.Span;
import com.pipesql.exception.ParseException;
import com.pipesql.lexer.TokenKind;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.InputMismatchException;
import org.antlr.v4.runtime.NoViableAltException;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.Vocabulary;
import org.antlr.v4.runtime.misc.IntervalSet;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects syntax errors reported by the generated parser as {@link ParseException}s
 * with spans and readable messages.
 */
final class ParseErrorListener extends BaseErrorListener {

    private static final int MAX_EXPECTED = 6;

    private final List<ParseException> errors = new ArrayList<>();
    private final int sourceLength;

    ParseErrorListener(int sourceLength) {
        this.sourceLength = sourceLength;
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                            int line, int charPositionInLine, String msg,
                            RecognitionException e) {
        Token offending = offendingSymbol instanceof Token t ? t : null;
        Span span = spanOf(offending);
        String found = describe(offending);

        String reason = offending != null && offending.getType() == Token.EOF
            ? "Unexpected end of input"
            : "Unexpected " + found;
        ParseException error = new ParseException(reason, span);

        if (recognizer instanceof Parser parser && (e == null || e instanceof InputMismatchException
                || e instanceof NoViableAltException)) {
            IntervalSet expected = e != null ? e.getExpectedTokens() : parser.getExpectedTokens();
            if (expected != null && !expected.isNil() && expected.size() <= MAX_EXPECTED) {
                error.withHint("expected " + expected.toList().stream()
                    .map(type -> expectedName(parser.getVocabulary(), type))
                    .collect(Collectors.joining(", ")));
            }
        }
        errors.add(error);
    }

    List<ParseException> errors() {
        return errors;
    }

    boolean hasErrors() {
        return !errors.isEmpty();
    }

    private Span spanOf(Token token) {
        if (token == null) {
            return null;
        }
        if (token.getType() == Token.EOF) {
            int at = Math.min(Math.max(token.getStartIndex(), 0), sourceLength);
            return new Span(at, at);
        }
        int start = Math.max(token.getStartIndex(), 0);
        return new Span(start, Math.max(start, token.getStopIndex() + 1));
    }

    private static String expectedName(Vocabulary vocabulary, int type) {
        if (type == Token.EOF) {
            return "end of input";
        }
        String name = vocabulary.getSymbolicName(type);
        for (TokenKind kind : TokenKind.values()) {
            if (kind.name().equals(name)) {
                return kind.description();
            }
        }
        return vocabulary.getDisplayName(type);
    }

    private static String describe(Token token) {
        if (token == null) {
            return "token";
        }
        if (token instanceof LexedToken lexed) {
            return switch (lexed.lexed().kind()) {
                case NEW_LINE -> "new line";
                case IDENT -> "`" + lexed.lexed().value() + "`";
                case STRING -> "string";
                case INTERPOLATION -> "interpolated string";
                default -> "`" + lexed.lexed().kind().description() + "`";
            };
        }
        return "`" + token.getText() + "`";
    }
}
