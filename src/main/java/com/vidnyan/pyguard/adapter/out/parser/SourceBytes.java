package com.vidnyan.pyguard.adapter.out.parser;

import com.vidnyan.pyguard.domain.syntax.Span;
import org.treesitter.TSNode;
import org.treesitter.TSPoint;

import java.nio.charset.StandardCharsets;

/**
 * UTF-8 view of a source file. Tree-sitter reports byte offsets; this class turns
 * them back into text and into character-based {@link Span}s.
 */
final class SourceBytes {

    private final byte[] bytes;
    private final boolean singleByte;
    private final int[] lineStarts;

    SourceBytes(String source) {
        this.bytes = source.getBytes(StandardCharsets.UTF_8);
        this.singleByte = bytes.length == source.length();
        int lines = 1;
        for (byte b : bytes) {
            if (b == '\n') {
                lines++;
            }
        }
        this.lineStarts = new int[lines];
        int line = 1;
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] == '\n') {
                lineStarts[line++] = i + 1;
            }
        }
    }

    String text(TSNode node) {
        return text(node.getStartByte(), node.getEndByte());
    }

    String text(int startByte, int endByte) {
        if (endByte <= startByte) {
            return "";
        }
        return new String(bytes, startByte, endByte - startByte, StandardCharsets.UTF_8);
    }

    Span span(TSNode node) {
        TSPoint start = node.getStartPoint();
        TSPoint end = node.getEndPoint();
        return Span.of(start.getRow() + 1, column(start), end.getRow() + 1, column(end));
    }

    private int column(TSPoint point) {
        int row = point.getRow();
        if (singleByte || row >= lineStarts.length) {
            return point.getColumn();
        }
        int lineStart = lineStarts[row];
        int length = Math.min(point.getColumn(), bytes.length - lineStart);
        return new String(bytes, lineStart, length, StandardCharsets.UTF_8).length();
    }
}
