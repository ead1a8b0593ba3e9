package com.pipesql.diagnostic;

/**
 * Zero-based line and column coordinates of a span's start and end.
 */
public record SourceLocation(int startLine, int startColumn, int endLine, int endColumn) {

    /**
     * Computes the location of a span within the given source text.
     */
    public static SourceLocation of(String source, Span span) {
        int[] start = lineAndColumn(source, span.start());
        int[] end = lineAndColumn(source, span.end());
        return new SourceLocation(start[0], start[1], end[0], end[1]);
    }

    private static int[] lineAndColumn(String source, int offset) {
        int line = 0;
        int column = 0;
        int limit = Math.min(offset, source.length());
        for (int i = 0; i < limit; i++) {
            if (source.charAt(i) == '\n') {
                line++;
                column = 0;
            } else {
                column++;
            }
        }
        return new int[] {line, column};
    }
}
