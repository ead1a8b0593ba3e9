package com.pipesql.sql.gen;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Pretty-prints SQL text.
 *
 * <p>Every clause keyword starts a line and its content is indented below it.
 * Sub-queries in parentheses are indented as blocks. Layout depends only on the
 * sequence of tokens, never on the whitespace of the input, so formatting
 * formatted SQL again leaves it unchanged:
 * <pre>
 *   SELECT
 *     salary
 *   FROM
 *     employees
 *   WHERE
 *     has_dog
 * </pre>
 */
public final class SqlFormatter {

    private static final int INDENT = 2;

    private static final Set<String> SIMPLE_CLAUSES = Set.of("FROM", "WHERE", "HAVING", "LIMIT", "OFFSET");

    private static final Set<String> LIST_CLAUSES = Set.of("SELECT", "FROM", "GROUP BY", "ORDER BY");

    private static final Set<String> SET_OPERATORS = Set.of("UNION", "EXCEPT", "INTERSECT");

    private static final Set<String> JOIN_SIDES = Set.of("LEFT", "RIGHT", "FULL", "INNER", "CROSS");

    /** Parenthesized sub-queries with at most this many tokens stay on one line. */
    private static final int INLINE_SUBQUERY_TOKENS = 3;

    record Token(String text, boolean spaceBefore) {
        String upper() {
            return text.toUpperCase(Locale.ROOT);
        }

        boolean isComment() {
            return text.startsWith("--");
        }
    }

    private SqlFormatter() {}

    public static String format(String sql) {
        return new Layout(tokenize(sql)).render();
    }

    // ==================== Tokens ====================

    static List<Token> tokenize(String sql) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int n = sql.length();
        boolean space = false;
        while (i < n) {
            char c = sql.charAt(i);
            if (Character.isWhitespace(c)) {
                space = true;
                i++;
                continue;
            }
            int start = i;
            if (c == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
                while (i < n && sql.charAt(i) != '\n') {
                    i++;
                }
                tokens.add(new Token(sql.substring(start, i).stripTrailing(), space));
            } else if (c == '(' || c == ')' || c == ',') {
                i++;
                tokens.add(new Token(String.valueOf(c), space));
            } else {
                while (i < n) {
                    char d = sql.charAt(i);
                    if (Character.isWhitespace(d) || d == '(' || d == ')' || d == ',') {
                        break;
                    }
                    if (d == '\'' || d == '"' || d == '`') {
                        i = skipQuoted(sql, i);
                    } else {
                        i++;
                    }
                }
                tokens.add(new Token(sql.substring(start, i), space));
            }
            space = false;
        }
        return tokens;
    }

    /** Returns the index after the quoted section starting at {@code start}; doubled quotes are escapes. */
    private static int skipQuoted(String sql, int start) {
        char quote = sql.charAt(start);
        int i = start + 1;
        while (i < sql.length()) {
            if (sql.charAt(i) == quote) {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return i;
    }

    // ==================== Layout ====================

    /** A parenthesized sub-query laid out as an indented block. */
    private static final class Block {
        final int indent;
        final int parenIndent;
        String clause;
        int depth;

        Block(int indent, int parenIndent) {
            this.indent = indent;
            this.parenIndent = parenIndent;
        }
    }

    private static final class Layout {
        private final List<Token> tokens;
        private final List<String> lines = new ArrayList<>();
        private final Deque<Block> blocks = new ArrayDeque<>();
        private StringBuilder line = new StringBuilder();
        private int lineIndent;
        private int pos;

        Layout(List<Token> tokens) {
            this.tokens = tokens;
            blocks.push(new Block(0, 0));
        }

        String render() {
            while (pos < tokens.size()) {
                step();
            }
            flush();
            return lines.isEmpty() ? "" : String.join("\n", lines) + "\n";
        }

        private void step() {
            Token token = tokens.get(pos);
            Block block = blocks.peek();

            if (token.isComment()) {
                flush();
                if (!lines.isEmpty() && !lines.get(lines.size() - 1).isEmpty()) {
                    lines.add("");
                }
                lines.add(" ".repeat(block.indent) + token.text());
                pos++;
                return;
            }
            if (block.depth > 0) {
                if (token.text().equals("(")) {
                    block.depth++;
                } else if (token.text().equals(")")) {
                    block.depth--;
                }
                append(token);
                pos++;
                return;
            }

            String upper = token.upper();
            if (upper.equals("SELECT")) {
                clause(block, "SELECT", 1);
                appendModifiers();
                newLine(block.indent + INDENT);
            } else if (SIMPLE_CLAUSES.contains(upper)) {
                clause(block, upper, 1);
                newLine(block.indent + INDENT);
            } else if ((upper.equals("GROUP") || upper.equals("ORDER")) && nextIs(1, "BY")) {
                clause(block, upper + " BY", 2);
                newLine(block.indent + INDENT);
            } else if (upper.equals("FETCH")) {
                clause(block, "FETCH", nextIs(1, "NEXT") || nextIs(1, "FIRST") ? 2 : 1);
                newLine(block.indent + INDENT);
            } else if (upper.equals("WITH")) {
                clause(block, "WITH", nextIs(1, "RECURSIVE") ? 2 : 1);
            } else if (SET_OPERATORS.contains(upper)) {
                clause(block, null, nextIs(1, "ALL") || nextIs(1, "DISTINCT") ? 2 : 1);
            } else if (joinLength() > 0) {
                newLine(block.indent + INDENT);
                appendTokens(joinLength());
            } else if (upper.equals(",")) {
                append(token);
                pos++;
                if (LIST_CLAUSES.contains(block.clause)) {
                    newLine(block.indent + INDENT);
                } else if ("WITH".equals(block.clause)) {
                    newLine(block.indent);
                }
            } else if (upper.equals("(")) {
                append(token);
                pos++;
                if (opensBlock()) {
                    blocks.push(new Block(lineIndent + INDENT, lineIndent));
                } else {
                    block.depth++;
                }
            } else if (upper.equals(")") && blocks.size() > 1) {
                blocks.pop();
                newLine(block.parenIndent);
                append(token);
                pos++;
            } else {
                append(token);
                pos++;
            }
        }

        /** Starts a clause on a new line with its keyword made of the next {@code length} tokens. */
        private void clause(Block block, String name, int length) {
            newLine(block.indent);
            block.clause = name;
            appendTokens(length);
        }

        /** Keeps {@code DISTINCT [ON (..)]} and {@code TOP (..)} on the line of SELECT. */
        private void appendModifiers() {
            while (pos < tokens.size()) {
                String upper = tokens.get(pos).upper();
                if (upper.equals("DISTINCT")) {
                    appendTokens(1);
                    if (nextIs(0, "ON")) {
                        appendTokens(1);
                        appendGroup();
                    }
                } else if (upper.equals("TOP")) {
                    appendTokens(1);
                    appendGroup();
                } else {
                    return;
                }
            }
        }

        private void appendGroup() {
            if (!nextIs(0, "(")) {
                return;
            }
            int end = matchingParen(pos);
            appendTokens(end - pos + 1);
        }

        private boolean opensBlock() {
            if (!nextIs(0, "SELECT") && !nextIs(0, "WITH")) {
                return false;
            }
            int end = matchingParen(pos - 1);
            return end - pos > INLINE_SUBQUERY_TOKENS;
        }

        /** Index of the parenthesis closing the one at {@code open}, or the last token. */
        private int matchingParen(int open) {
            int depth = 0;
            for (int i = open; i < tokens.size(); i++) {
                String text = tokens.get(i).text();
                if (text.equals("(")) {
                    depth++;
                } else if (text.equals(")") && --depth == 0) {
                    return i;
                }
            }
            return tokens.size() - 1;
        }

        private int joinLength() {
            if (nextIs(0, "JOIN")) {
                return 1;
            }
            if (pos < tokens.size() && JOIN_SIDES.contains(tokens.get(pos).upper())) {
                if (nextIs(1, "JOIN")) {
                    return 2;
                }
                if (nextIs(1, "OUTER") && nextIs(2, "JOIN")) {
                    return 3;
                }
            }
            return 0;
        }

        private boolean nextIs(int offset, String text) {
            int i = pos + offset;
            return i < tokens.size() && tokens.get(i).upper().equals(text);
        }

        private void appendTokens(int count) {
            for (int i = 0; i < count && pos < tokens.size(); i++) {
                append(tokens.get(pos++));
            }
        }

        private void append(Token token) {
            if (line.length() > 0 && token.spaceBefore()) {
                line.append(' ');
            }
            line.append(token.text());
        }

        private void newLine(int indent) {
            flush();
            lineIndent = indent;
        }

        private void flush() {
            if (line.length() > 0) {
                lines.add(" ".repeat(lineIndent) + line);
                line = new StringBuilder();
            }
        }
    }
}
