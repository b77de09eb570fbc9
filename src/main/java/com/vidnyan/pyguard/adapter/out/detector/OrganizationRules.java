package com.vidnyan.pyguard.adapter.out.detector;

import com.vidnyan.pyguard.domain.model.Finding;
import com.vidnyan.pyguard.domain.rule.Rule;
import com.vidnyan.pyguard.domain.rule.RuleCatalog;
import com.vidnyan.pyguard.domain.rule.RuleDescriptor;
import com.vidnyan.pyguard.domain.syntax.Ast;
import com.vidnyan.pyguard.domain.syntax.Node;
import com.vidnyan.pyguard.domain.syntax.NodeKind;
import com.vidnyan.pyguard.domain.traversal.FrameKind;
import com.vidnyan.pyguard.domain.traversal.TraversalContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.vidnyan.pyguard.domain.model.Category.ORGANIZATION;
import static com.vidnyan.pyguard.domain.model.Severity.HIGH;
import static com.vidnyan.pyguard.domain.model.Severity.LOW;
import static com.vidnyan.pyguard.domain.model.Severity.MEDIUM;

@Component
@Order(5)
public class OrganizationRules implements RuleCatalog {

    static final RuleDescriptor LOCAL_IMPORT =
            RuleDescriptor.of("O001", "local-import", ORGANIZATION, LOW, "Import inside function");
    static final RuleDescriptor DUPLICATE_IMPORT =
            RuleDescriptor.of("O002", "duplicate-import", ORGANIZATION, LOW, "Duplicate import");
    static final RuleDescriptor WILDCARD_IMPORT =
            RuleDescriptor.of("O003", "wildcard-import", ORGANIZATION, HIGH, "Wildcard import");
    static final RuleDescriptor GOD_CLASS =
            RuleDescriptor.of("O004", "god-class", ORGANIZATION, MEDIUM, "Class with too many methods");
    static final RuleDescriptor LEFTOVER_DEBUGGER =
            RuleDescriptor.of("O005", "leftover-debugger", ORGANIZATION, MEDIUM, "Debugger left in code");

    static final int MAX_METHODS = 20;

    private static final Set<String> DEBUGGER_MODULES = Set.of("pdb", "ipdb", "pudb");

    private static final Set<String> DEBUGGER_CALLS = Set.of(
            "breakpoint", "pdb.set_trace", "ipdb.set_trace", "pudb.set_trace", "pdb.post_mortem");

    private static final Set<NodeKind> IMPORTS = Set.of(NodeKind.IMPORT, NodeKind.IMPORT_FROM);

    @Override
    public List<Rule> rules() {
        return List.of(
                Rule.of(LOCAL_IMPORT, IMPORTS, OrganizationRules::localImport),
                Rule.of(DUPLICATE_IMPORT, IMPORTS, OrganizationRules::duplicateImport),
                Rule.of(WILDCARD_IMPORT, Set.of(NodeKind.IMPORT_FROM), OrganizationRules::wildcardImport),
                Rule.of(GOD_CLASS, Set.of(NodeKind.CLASS_DEF), OrganizationRules::godClass),
                Rule.of(LEFTOVER_DEBUGGER, Set.of(NodeKind.CALL, NodeKind.IMPORT), OrganizationRules::leftoverDebugger)
        );
    }

    private static Optional<Finding> localImport(Node node, TraversalContext ctx) {
        if (!ctx.isInFunction()) {
            return Optional.empty();
        }
        return LOCAL_IMPORT.report(node, ctx,
                "Import of " + imported(node) + " inside a function",
                "Move the import to the top of the module unless it breaks an import cycle");
    }

    /**
     * Top-level imports only; conditional imports under try/if legitimately repeat names.
     */
    private static Optional<Finding> duplicateImport(Node node, TraversalContext ctx) {
        if (!ctx.isDirectlyIn(FrameKind.MODULE)) {
            return Optional.empty();
        }
        for (String key : importKeys(node)) {
            if (!ctx.module().markOnce("import:" + key)) {
                return DUPLICATE_IMPORT.report(node, ctx,
                        "'" + key + "' is imported more than once",
                        "Remove the repeated import");
            }
        }
        return Optional.empty();
    }

    private static List<String> importKeys(Node node) {
        if (node instanceof Ast.Import statement) {
            return statement.names().stream()
                    .map(alias -> alias.asName() == null ? alias.name() : alias.name() + " as " + alias.asName())
                    .toList();
        }
        Ast.ImportFrom statement = (Ast.ImportFrom) node;
        String source = ".".repeat(statement.level()) + (statement.module() == null ? "" : statement.module());
        return statement.names().stream()
                .map(alias -> source + "." + alias.name() + (alias.asName() == null ? "" : " as " + alias.asName()))
                .toList();
    }

    private static Optional<Finding> wildcardImport(Node node, TraversalContext ctx) {
        Ast.ImportFrom statement = (Ast.ImportFrom) node;
        if (!statement.isWildcard()) {
            return Optional.empty();
        }
        return WILDCARD_IMPORT.report(node, ctx,
                "'from " + statement.module() + " import *' pollutes the namespace and hides where names come from",
                "Import the names you use explicitly, or import the module itself");
    }

    private static Optional<Finding> godClass(Node node, TraversalContext ctx) {
        Ast.ClassDef cls = (Ast.ClassDef) node;
        long methods = cls.body().stream().filter(Ast.FunctionDef.class::isInstance).count();
        if (methods <= MAX_METHODS) {
            return Optional.empty();
        }
        return GOD_CLASS.report(node, ctx,
                "Class '" + cls.name() + "' defines " + methods + " methods (limit " + MAX_METHODS + ")",
                "Split responsibilities into smaller collaborating classes");
    }

    private static Optional<Finding> leftoverDebugger(Node node, TraversalContext ctx) {
        if (node instanceof Ast.Call call) {
            String callee = AstQueries.calleeName(call).orElse("");
            if (!DEBUGGER_CALLS.contains(callee)) {
                return Optional.empty();
            }
            return LEFTOVER_DEBUGGER.report(node, ctx,
                    callee + "() halts execution in a debugger",
                    "Remove the breakpoint before committing");
        }
        for (Ast.Alias alias : ((Ast.Import) node).names()) {
            if (DEBUGGER_MODULES.contains(alias.name())) {
                return LEFTOVER_DEBUGGER.report(node, ctx,
                        "Debugger module '" + alias.name() + "' imported",
                        "Remove the debugger import before committing");
            }
        }
        return Optional.empty();
    }

    private static String imported(Node node) {
        if (node instanceof Ast.ImportFrom statement) {
            return statement.module() == null ? "a relative module" : "'" + statement.module() + "'";
        }
        return "'" + String.join("', '", ((Ast.Import) node).names().stream().map(Ast.Alias::name).toList()) + "'";
    }
}
