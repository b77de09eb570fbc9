package com.vidnyan.pyguard.domain.syntax;

/**
 * Source range of a syntax node.
 * Lines are 1-based, columns are 0-based character offsets within the line.
 */
public record Span(
    int line,
    int column,
    int endLine,
    int endColumn
) {

    public static Span of(int line, int column, int endLine, int endColumn) {
        return new Span(line, column, endLine, endColumn);
    }

    /**
     * Span running from the start of {@code first} to the end of {@code last}.
     */
    public static Span between(Span first, Span last) {
        return new Span(first.line, first.column, last.endLine, last.endColumn);
    }

    /**
     * Number of source lines covered, inclusive.
     */
    public int lineCount() {
        return endLine - line + 1;
    }

    public String format() {
        return line + ":" + column;
    }
}
