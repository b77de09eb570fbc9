package com.vidnyan.pyguard.adapter.out.parser;

import com.vidnyan.pyguard.domain.syntax.Ast;
import com.vidnyan.pyguard.domain.syntax.Span;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

/**
 * Parses Python source with the tree-sitter-python grammar and maps the result onto {@link Ast}.
 * Tree-sitter recovers from errors instead of failing; any ERROR or MISSING node in the tree
 * is raised here as a {@link PythonSyntaxException}.
 */
public final class TreeSitterPythonParser {

    private static final ThreadLocal<TSParser> PARSER = ThreadLocal.withInitial(() -> {
        TSParser parser = new TSParser();
        if (!parser.setLanguage(new TreeSitterPython())) {
            throw new IllegalStateException("tree-sitter-python grammar is incompatible with the tree-sitter runtime");
        }
        return parser;
    });

    private TreeSitterPythonParser() {
    }

    public static Ast.Module parseModule(String source) {
        TSTree tree = PARSER.get().parseString(null, source);
        TSNode root = tree.getRootNode();
        SourceBytes bytes = new SourceBytes(source);
        if (root.hasError()) {
            TSNode bad = firstError(root);
            Span at = bytes.span(bad);
            String message = bad.isMissing() ? "expected '" + bad.getType() + "'" : "invalid syntax";
            throw new PythonSyntaxException(message, at.line(), at.column());
        }
        return new TreeSitterAstMapper(bytes).module(root);
    }

    private static TSNode firstError(TSNode node) {
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            if ("ERROR".equals(child.getType()) || child.isMissing()) {
                return child;
            }
            if (child.hasError()) {
                return firstError(child);
            }
        }
        return node;
    }
}
