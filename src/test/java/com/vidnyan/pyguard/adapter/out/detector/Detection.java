package com.vidnyan.pyguard.adapter.out.detector;

import com.vidnyan.pyguard.adapter.out.parser.TreeSitterPythonParser;
import com.vidnyan.pyguard.domain.model.Finding;
import com.vidnyan.pyguard.domain.model.SourceFile;
import com.vidnyan.pyguard.domain.rule.RuleRegistry;
import com.vidnyan.pyguard.domain.syntax.Ast;
import com.vidnyan.pyguard.domain.syntax.SyntaxTree;
import com.vidnyan.pyguard.domain.traversal.ContextTrackingWalker;
import com.vidnyan.pyguard.domain.traversal.ScanResult;

import java.util.List;
import java.util.Optional;

/**
 * Runs every rule catalog over a Python snippet.
 */
final class Detection {

    static final RuleRegistry REGISTRY = RuleRegistry.fromCatalogs(List.of(
            new RuntimeRules(), new PerformanceRules(), new ComplexityRules(), new SecurityRules(),
            new OrganizationRules(), new ResourceRules(), new GotchaRules()));

    private Detection() {
    }

    static ScanResult scan(String source) {
        Ast.Module module = TreeSitterPythonParser.parseModule(source);
        SyntaxTree tree = new SyntaxTree(module, SourceFile.countLines(source));
        return new ContextTrackingWalker(REGISTRY).scan(tree, source.lines().toList());
    }

    static List<Finding> findings(String source) {
        ScanResult result = scan(source);
        if (result.hasFaults()) {
            throw new AssertionError("rule faults: " + result.faults());
        }
        return result.findings();
    }

    static List<String> codes(String source) {
        return findings(source).stream().map(Finding::code).toList();
    }

    static boolean has(String source, String code) {
        return codes(source).contains(code);
    }

    static long count(String source, String code) {
        return codes(source).stream().filter(code::equals).count();
    }

    static Optional<Finding> first(String source, String code) {
        return findings(source).stream().filter(f -> f.code().equals(code)).findFirst();
    }
}
