package com.pipesql.parser;

import com.pipesql.lexer.Token;
import org.antlr.v4.runtime.CommonToken;

/**
 * ANTLR token that keeps a reference to the lexer token it was adapted from, so the
 * AST builder can read decoded values, units and interpolation parts.
 */
final class LexedToken extends CommonToken {

    private final transient Token source;

    LexedToken(int type, Token source) {
        super(type, source.value());
        this.source = source;
    }

    Token lexed() {
        return source;
    }
}
