package com.vidnyan.pyguard.domain.syntax;

/**
 * Parsed source file. Built once per invocation and never mutated.
 */
public record SyntaxTree(
    Ast.Module module,
    int lineCount
) {
}
