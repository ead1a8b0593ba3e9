package com.pipesql.lexer;

import com.pipesql.diagnostic.Span;
import com.pipesql.exception.CompilationFailedException;
import com.pipesql.exception.LexException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns source text into tokens.
 *
 * <p>The lexer never stops at the first problem: every malformed token is
 * recorded as a {@link LexException} spanning the offending text and scanning
 * resumes after it. When any error was recorded, {@link #tokenize()} throws a
 * {@link CompilationFailedException} carrying all of them.
 *
 * <p>Comments are dropped. A line starting with {@code \} continues the previous
 * line, so the preceding new line tokens are removed.
 */
public final class Lexer {

    private static final Logger logger = LoggerFactory.getLogger(Lexer.class);

    private static final Set<String> INTERVAL_UNITS = Set.of(
        "microseconds", "milliseconds", "seconds", "minutes", "hours",
        "days", "weeks", "months", "years");

    private static final Pattern DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
    private static final Pattern TIME = Pattern.compile(
        "\\d{2}:\\d{2}(:\\d{2}(\\.\\d+)?)?(Z|[+-]\\d{2}(:?\\d{2})?)?");
    private static final Pattern TIMESTAMP = Pattern.compile(
        "\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}(:\\d{2}(\\.\\d+)?)?(Z|[+-]\\d{2}(:?\\d{2})?)?");

    private final String source;
    private final int offset;
    private final List<Token> tokens = new ArrayList<>();
    private final List<LexException> errors = new ArrayList<>();
    private int pos;

    public Lexer(String source) {
        this(source, 0);
    }

    private Lexer(String source, int offset) {
        this.source = source;
        this.offset = offset;
    }

    /**
     * Tokenizes the whole source.
     *
     * @param source the source text
     * @return the tokens, without comments
     * @throws CompilationFailedException if any token was malformed
     */
    public static List<Token> tokenize(String source) {
        return new Lexer(source).tokenize();
    }

    public List<Token> tokenize() {
        run();
        if (!errors.isEmpty()) {
            logger.debug("Lexing failed with {} error(s)", errors.size());
            throw new CompilationFailedException(errors);
        }
        logger.debug("Lexed {} tokens", tokens.size());
        return List.copyOf(tokens);
    }

    private void run() {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\r') {
                pos++;
            } else if (c == '\n') {
                tokens.add(Token.of(TokenKind.NEW_LINE, "\n", span(pos, pos + 1)));
                pos++;
            } else if (c == '#') {
                skipComment();
            } else if (c == '\\') {
                lineContinuation();
            } else if (c == '@') {
                annotationOrDate();
            } else if (c == '`') {
                quotedIdent();
            } else if (c == '$') {
                param();
            } else if (Character.isDigit(c)) {
                number();
            } else if (c == '"' || c == '\'') {
                string(pos, false);
            } else if (Character.isLetter(c) || c == '_') {
                identOrPrefixedString();
            } else if (!operator(c)) {
                error("Unexpected character `" + c + "`", pos, pos + 1);
                pos++;
            }
        }
    }

    private void skipComment() {
        while (pos < source.length() && source.charAt(pos) != '\n') {
            pos++;
        }
    }

    private void lineContinuation() {
        int next = pos + 1;
        boolean wraps = next >= source.length() || Character.isWhitespace(source.charAt(next));
        if (!wraps) {
            error("Unexpected character `\\`", pos, pos + 1);
            pos++;
            return;
        }
        while (!tokens.isEmpty() && tokens.get(tokens.size() - 1).kind() == TokenKind.NEW_LINE) {
            tokens.remove(tokens.size() - 1);
        }
        pos++;
    }

    private void annotationOrDate() {
        int start = pos;
        if (peek(1) == '{') {
            tokens.add(Token.control(TokenKind.ANNOTATE, span(start, start + 1)));
            pos++;
            return;
        }
        int end = start + 1;
        while (end < source.length() && isDateChar(source.charAt(end))) {
            if (source.startsWith("..", end)) {
                break;
            }
            end++;
        }
        String text = source.substring(start + 1, end);
        TokenKind kind = null;
        if (matches(TIMESTAMP, text)) {
            kind = TokenKind.TIMESTAMP;
        } else if (matches(DATE, text)) {
            kind = TokenKind.DATE;
        } else if (matches(TIME, text)) {
            kind = TokenKind.TIME;
        }
        if (kind == null) {
            error("Invalid date or time literal `@" + text + "`", start, Math.max(end, start + 1));
        } else {
            tokens.add(Token.of(kind, text, span(start, end)));
        }
        pos = Math.max(end, start + 1);
    }

    private static boolean isDateChar(char c) {
        return Character.isDigit(c) || c == '-' || c == ':' || c == '.' || c == 'T' || c == 'Z' || c == '+';
    }

    private static boolean matches(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        return m.matches();
    }

    private void quotedIdent() {
        int start = pos;
        int close = source.indexOf('`', start + 1);
        int newline = source.indexOf('\n', start + 1);
        if (close < 0 || (newline >= 0 && newline < close)) {
            error("Unterminated quoted identifier", start, newline >= 0 ? newline : source.length());
            pos = newline >= 0 ? newline : source.length();
            return;
        }
        tokens.add(Token.of(TokenKind.IDENT, source.substring(start + 1, close), span(start, close + 1)));
        pos = close + 1;
    }

    private void param() {
        int start = pos;
        int end = start + 1;
        while (end < source.length()
            && (Character.isLetterOrDigit(source.charAt(end)) || source.charAt(end) == '_')) {
            end++;
        }
        if (end == start + 1) {
            error("Expected a parameter name after `$`", start, start + 1);
            pos = start + 1;
            return;
        }
        tokens.add(Token.of(TokenKind.PARAM, source.substring(start + 1, end), span(start, end)));
        pos = end;
    }

    private void number() {
        int start = pos;
        if (source.charAt(pos) == '0' && (peek(1) == 'x' || peek(1) == 'b' || peek(1) == 'o')) {
            radixNumber(start);
            return;
        }

        StringBuilder text = new StringBuilder();
        boolean isFloat = false;
        pos = digits(pos, text);
        if (peek(0) == '.' && Character.isDigit(peek(1))) {
            isFloat = true;
            text.append('.');
            pos = digits(pos + 1, text);
        }
        if ((peek(0) == 'e' || peek(0) == 'E')
            && (Character.isDigit(peek(1))
                || ((peek(1) == '+' || peek(1) == '-') && Character.isDigit(peek(2))))) {
            isFloat = true;
            text.append('e');
            pos++;
            if (peek(0) == '+' || peek(0) == '-') {
                text.append(peek(0));
                pos++;
            }
            pos = digits(pos, text);
        }

        if (!isFloat && Character.isLetter(peek(0))) {
            int unitEnd = pos;
            while (unitEnd < source.length() && Character.isLetter(source.charAt(unitEnd))) {
                unitEnd++;
            }
            String unit = source.substring(pos, unitEnd);
            if (INTERVAL_UNITS.contains(unit)) {
                tokens.add(Token.valueAndUnit(text.toString(), unit, span(start, unitEnd)));
                pos = unitEnd;
                return;
            }
        }

        if (isFloat) {
            tokens.add(Token.of(TokenKind.FLOAT, text.toString(), span(start, pos)));
            return;
        }
        try {
            long value = Long.parseLong(text.toString());
            tokens.add(Token.of(TokenKind.INTEGER, Long.toString(value), span(start, pos)));
        } catch (NumberFormatException e) {
            error("Integer literal `" + text + "` is out of range", start, pos);
        }
    }

    private int digits(int from, StringBuilder out) {
        int i = from;
        while (i < source.length() && (Character.isDigit(source.charAt(i)) || source.charAt(i) == '_')) {
            if (source.charAt(i) != '_') {
                out.append(source.charAt(i));
            }
            i++;
        }
        return i;
    }

    private void radixNumber(int start) {
        char prefix = source.charAt(start + 1);
        int radix = switch (prefix) {
            case 'x' -> 16;
            case 'b' -> 2;
            default -> 8;
        };
        StringBuilder text = new StringBuilder();
        int i = start + 2;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '_') {
                i++;
            } else if (Character.digit(c, radix) >= 0) {
                text.append(c);
                i++;
            } else {
                break;
            }
        }
        pos = i;
        try {
            long value = Long.parseLong(text.toString(), radix);
            tokens.add(Token.of(TokenKind.INTEGER, Long.toString(value), span(start, i)));
        } catch (NumberFormatException e) {
            error("Invalid integer literal `" + source.substring(start, i) + "`", start, i);
        }
    }

    private void identOrPrefixedString() {
        int start = pos;
        int end = start;
        while (end < source.length()
            && (Character.isLetterOrDigit(source.charAt(end)) || source.charAt(end) == '_')) {
            end++;
        }
        String word = source.substring(start, end);
        char next = end < source.length() ? source.charAt(end) : '\0';

        if ((next == '"' || next == '\'') && word.length() == 1) {
            char prefix = word.charAt(0);
            if (prefix == 's' || prefix == 'f') {
                interpolation(start, end, prefix);
                return;
            }
            if (prefix == 'r') {
                pos = end;
                string(start, true);
                return;
            }
        }

        pos = end;
        TokenKind keyword = TokenKind.keyword(word);
        if (keyword != null) {
            tokens.add(Token.of(keyword, word, span(start, end)));
        } else if (word.equals("null")) {
            tokens.add(Token.of(TokenKind.NULL, word, span(start, end)));
        } else if (word.equals("true") || word.equals("false")) {
            tokens.add(Token.of(TokenKind.BOOLEAN, word, span(start, end)));
        } else {
            tokens.add(Token.of(TokenKind.IDENT, word, span(start, end)));
        }
    }

    /**
     * Reads a string literal starting at {@link #pos}. The token span starts at
     * {@code tokenStart} so that prefixes such as {@code r} are covered.
     */
    private void string(int tokenStart, boolean raw) {
        String content = readQuoted(tokenStart, !raw);
        if (content != null) {
            tokens.add(Token.of(TokenKind.STRING, content, span(tokenStart, pos)));
        }
    }

    /**
     * Reads a quoted body at {@link #pos}, leaving {@link #pos} after the closing
     * quotes. Returns null and records an error when the string is unterminated.
     */
    private String readQuoted(int tokenStart, boolean escapes) {
        char quote = source.charAt(pos);
        int run = runLength(pos, quote);
        if (run == 2) {
            pos += 2;
            return "";
        }
        pos += run;

        StringBuilder content = new StringBuilder();
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == quote) {
                int closing = runLength(pos, quote);
                if (closing >= run) {
                    content.append(String.valueOf(quote).repeat(closing - run));
                    pos += closing;
                    return content.toString();
                }
                content.append(String.valueOf(quote).repeat(closing));
                pos += closing;
            } else if (c == '\\' && escapes) {
                escape(content, quote);
            } else {
                content.append(c);
                pos++;
            }
        }
        error("Unterminated string literal", tokenStart, source.length());
        return null;
    }

    private int runLength(int from, char quote) {
        int i = from;
        while (i < source.length() && source.charAt(i) == quote) {
            i++;
        }
        return i - from;
    }

    private void escape(StringBuilder content, char quote) {
        int start = pos;
        char next = peek(1);
        pos += 2;
        switch (next) {
            case 'n' -> content.append('\n');
            case 'r' -> content.append('\r');
            case 't' -> content.append('\t');
            case '\\' -> content.append('\\');
            case '\'', '"' -> content.append(next);
            case 'x' -> {
                String hex = source.substring(pos, Math.min(pos + 2, source.length()));
                if (hex.length() == 2 && hex.chars().allMatch(ch -> Character.digit(ch, 16) >= 0)) {
                    content.append((char) Integer.parseInt(hex, 16));
                    pos += 2;
                } else {
                    error("Invalid escape sequence `\\x" + hex + "`", start, pos);
                }
            }
            case 'u' -> {
                int close = source.indexOf('}', pos);
                if (peek(0) == '{' && close > pos + 1 && close - pos <= 7) {
                    String hex = source.substring(pos + 1, close);
                    try {
                        content.appendCodePoint(Integer.parseInt(hex, 16));
                    } catch (IllegalArgumentException e) {
                        error("Invalid unicode escape `\\u{" + hex + "}`", start, close + 1);
                    }
                    pos = close + 1;
                } else {
                    error("Invalid unicode escape", start, pos);
                }
            }
            default -> {
                if (next == quote) {
                    content.append(next);
                } else {
                    error("Invalid escape sequence `\\" + next + "`", start, Math.min(pos, source.length()));
                }
            }
        }
    }

    private void interpolation(int start, int quoteStart, char prefix) {
        pos = quoteStart;
        int bodyStart = pos + runLength(pos, source.charAt(pos));
        String body = readQuoted(start, false);
        if (body == null) {
            return;
        }
        List<InterpolationPart> parts = interpolationParts(body, bodyStart);
        if (parts != null) {
            tokens.add(Token.interpolation(prefix, parts, span(start, pos)));
        }
    }

    private List<InterpolationPart> interpolationParts(String body, int bodyStart) {
        List<InterpolationPart> parts = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c == '{' && i + 1 < body.length() && body.charAt(i + 1) == '{') {
                text.append('{');
                i += 2;
            } else if (c == '}' && i + 1 < body.length() && body.charAt(i + 1) == '}') {
                text.append('}');
                i += 2;
            } else if (c == '{') {
                int close = matchingBrace(body, i);
                if (close < 0) {
                    error("Unterminated interpolation", bodyStart + i, bodyStart + body.length());
                    return null;
                }
                if (!text.isEmpty()) {
                    parts.add(new InterpolationPart.Text(text.toString()));
                    text.setLength(0);
                }
                parts.add(interpolatedExpression(body.substring(i + 1, close), bodyStart + i + 1));
                i = close + 1;
            } else {
                text.append(c);
                i++;
            }
        }
        if (!text.isEmpty()) {
            parts.add(new InterpolationPart.Text(text.toString()));
        }
        return parts;
    }

    private static int matchingBrace(String body, int open) {
        int depth = 0;
        for (int i = open; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private InterpolationPart interpolatedExpression(String inner, int absoluteStart) {
        String expr = inner;
        String format = null;
        int depth = 0;
        for (int i = 0; i < inner.length(); i++) {
            char c = inner.charAt(i);
            if (c == '(' || c == '{' || c == '[') {
                depth++;
            } else if (c == ')' || c == '}' || c == ']') {
                depth--;
            } else if (c == ':' && depth == 0) {
                expr = inner.substring(0, i);
                format = inner.substring(i + 1);
                break;
            }
        }
        int exprStart = offset + absoluteStart;
        Lexer sub = new Lexer(expr, exprStart);
        sub.run();
        errors.addAll(sub.errors);
        Span exprSpan = new Span(exprStart, exprStart + expr.length());
        return new InterpolationPart.Expression(sub.tokens, exprSpan, format);
    }

    private boolean operator(char c) {
        int start = pos;
        char next = peek(1);
        TokenKind two = switch ("" + c + next) {
            case "->" -> TokenKind.ARROW_THIN;
            case "=>" -> TokenKind.ARROW_FAT;
            case "==" -> TokenKind.EQ;
            case "!=" -> TokenKind.NE;
            case ">=" -> TokenKind.GTE;
            case "<=" -> TokenKind.LTE;
            case "~=" -> TokenKind.REGEX_SEARCH;
            case "&&" -> TokenKind.AND;
            case "||" -> TokenKind.OR;
            case "??" -> TokenKind.COALESCE;
            case "//" -> TokenKind.DIV_INT;
            case "**" -> TokenKind.POW;
            default -> null;
        };
        if (two != null) {
            tokens.add(Token.control(two, span(start, start + 2)));
            pos += 2;
            return true;
        }
        if (c == '.' && next == '.') {
            boolean bindLeft = start > 0 && !Character.isWhitespace(source.charAt(start - 1));
            boolean bindRight = start + 2 < source.length() && !Character.isWhitespace(source.charAt(start + 2));
            tokens.add(Token.range(bindLeft, bindRight, span(start, start + 2)));
            pos += 2;
            return true;
        }
        TokenKind one = switch (c) {
            case '+' -> TokenKind.PLUS;
            case '-' -> TokenKind.MINUS;
            case '*' -> TokenKind.STAR;
            case '/' -> TokenKind.SLASH;
            case '%' -> TokenKind.PERCENT;
            case '(' -> TokenKind.LPAREN;
            case ')' -> TokenKind.RPAREN;
            case '[' -> TokenKind.LBRACKET;
            case ']' -> TokenKind.RBRACKET;
            case '{' -> TokenKind.LBRACE;
            case '}' -> TokenKind.RBRACE;
            case ',' -> TokenKind.COMMA;
            case '.' -> TokenKind.DOT;
            case ':' -> TokenKind.COLON;
            case '|' -> TokenKind.PIPE;
            case '>' -> TokenKind.GT;
            case '<' -> TokenKind.LT;
            case '=' -> TokenKind.ASSIGN;
            case '!' -> TokenKind.BANG;
            default -> null;
        };
        if (one == null) {
            return false;
        }
        tokens.add(Token.control(one, span(start, start + 1)));
        pos++;
        return true;
    }

    private char peek(int ahead) {
        int i = pos + ahead;
        return i < source.length() ? source.charAt(i) : '\0';
    }

    private Span span(int start, int end) {
        return new Span(start + offset, end + offset);
    }

    private void error(String reason, int start, int end) {
        errors.add(new LexException(reason, span(start, end)));
    }
}
