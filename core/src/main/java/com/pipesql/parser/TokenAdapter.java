package com.pipesql.parser;

import com.pipesql.lexer.Token;
import com.pipesql.lexer.TokenKind;
import org.antlr.v4.runtime.ListTokenSource;
import org.antlr.v4.runtime.TokenSource;
import org.antlr.v4.runtime.Vocabulary;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Adapts tokens of the hand-written lexer to an ANTLR token source.
 *
 * <p>Token types are matched by name: every {@link TokenKind} has a token of the
 * same symbolic name in the grammar's {@code tokens} block.
 */
final class TokenAdapter {

    private static final Map<TokenKind, Integer> TOKEN_TYPES = new EnumMap<>(TokenKind.class);

    static {
        Vocabulary vocabulary = PipeBaseParser.VOCABULARY;
        for (TokenKind kind : TokenKind.values()) {
            for (int type = 1; type <= vocabulary.getMaxTokenType(); type++) {
                if (kind.name().equals(vocabulary.getSymbolicName(type))) {
                    TOKEN_TYPES.put(kind, type);
                    break;
                }
            }
            if (!TOKEN_TYPES.containsKey(kind)) {
                throw new IllegalStateException("Grammar has no token for " + kind);
            }
        }
    }

    private TokenAdapter() {
    }

    static int tokenType(TokenKind kind) {
        return TOKEN_TYPES.get(kind);
    }

    /**
     * Builds a token source over the given tokens.
     *
     * @param tokens lexer output
     * @param source full source text, used to compute line and column positions
     */
    static TokenSource adapt(List<Token> tokens, String source) {
        int[] lineStarts = lineStarts(source);
        List<org.antlr.v4.runtime.Token> adapted = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            LexedToken t = new LexedToken(tokenType(token.kind()), token);
            t.setStartIndex(token.span().start());
            t.setStopIndex(token.span().end() - 1);
            int line = lineOf(lineStarts, token.span().start());
            t.setLine(line + 1);
            t.setCharPositionInLine(token.span().start() - lineStarts[line]);
            t.setTokenIndex(adapted.size());
            adapted.add(t);
        }
        return new ListTokenSource(adapted, "query");
    }

    private static int[] lineStarts(String source) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    private static int lineOf(int[] lineStarts, int offset) {
        int line = 0;
        while (line + 1 < lineStarts.length && lineStarts[line + 1] <= offset) {
            line++;
        }
        return line;
    }
}
