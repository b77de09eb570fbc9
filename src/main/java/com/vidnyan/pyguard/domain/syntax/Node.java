package com.vidnyan.pyguard.domain.syntax;

import java.util.List;

/**
 * A node of the parsed Python syntax tree.
 * Implementations are immutable records declared in {@link Ast}.
 */
public interface Node {

    NodeKind kind();

    Span span();

    /**
     * Direct child nodes in source order.
     */
    List<Node> children();

    default int line() {
        return span().line();
    }

    default int column() {
        return span().column();
    }
}
