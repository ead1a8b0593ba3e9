package com.pipesql.lexer;

/**
 * Kinds of lexical units.
 */
public enum TokenKind {
    NEW_LINE("new line"),

    IDENT("identifier"),
    LET("let"),
    INTO("into"),
    CASE("case"),
    PRQL("prql"),
    MODULE("module"),
    FUNC("func"),
    INTERNAL("internal"),

    NULL("null"),
    BOOLEAN("boolean"),
    INTEGER("integer"),
    FLOAT("float"),
    STRING("string"),
    DATE("date"),
    TIME("time"),
    TIMESTAMP("timestamp"),
    VALUE_AND_UNIT("interval"),
    PARAM("parameter"),
    INTERPOLATION("interpolated string"),
    RANGE(".."),

    ARROW_THIN("->"),
    ARROW_FAT("=>"),
    EQ("=="),
    NE("!="),
    GTE(">="),
    LTE("<="),
    REGEX_SEARCH("~="),
    AND("&&"),
    OR("||"),
    COALESCE("??"),
    DIV_INT("//"),
    POW("**"),
    ANNOTATE("@"),

    PLUS("+"),
    MINUS("-"),
    STAR("*"),
    SLASH("/"),
    PERCENT("%"),
    LPAREN("("),
    RPAREN(")"),
    LBRACKET("["),
    RBRACKET("]"),
    LBRACE("{"),
    RBRACE("}"),
    COMMA(","),
    DOT("."),
    COLON(":"),
    PIPE("|"),
    GT(">"),
    LT("<"),
    ASSIGN("="),
    BANG("!");

    private final String description;

    TokenKind(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    /**
     * Returns the keyword kind for a word, or null when the word is not a keyword.
     */
    public static TokenKind keyword(String word) {
        return switch (word) {
            case "let" -> LET;
            case "into" -> INTO;
            case "case" -> CASE;
            case "prql" -> PRQL;
            case "module" -> MODULE;
            case "func" -> FUNC;
            case "internal" -> INTERNAL;
            default -> null;
        };
    }
}
