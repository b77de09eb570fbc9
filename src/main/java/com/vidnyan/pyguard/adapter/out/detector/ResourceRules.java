package com.vidnyan.pyguard.adapter.out.detector;

import com.vidnyan.pyguard.domain.model.Finding;
import com.vidnyan.pyguard.domain.rule.Rule;
import com.vidnyan.pyguard.domain.rule.RuleCatalog;
import com.vidnyan.pyguard.domain.rule.RuleDescriptor;
import com.vidnyan.pyguard.domain.syntax.Ast;
import com.vidnyan.pyguard.domain.syntax.Node;
import com.vidnyan.pyguard.domain.syntax.NodeKind;
import com.vidnyan.pyguard.domain.traversal.TraversalContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.vidnyan.pyguard.domain.model.Category.RESOURCE;
import static com.vidnyan.pyguard.domain.model.Severity.MEDIUM;

/**
 * Files, connections and network calls that leak or hang, and service
 * entry points that let failures escape unhandled.
 */
@Component
@Order(6)
public class ResourceRules implements RuleCatalog {

    static final RuleDescriptor OPEN_WITHOUT_CONTEXT_MANAGER =
            RuleDescriptor.of("M001", "open-without-context-manager", RESOURCE, MEDIUM, "open() outside with");
    static final RuleDescriptor DB_OPERATION_WITHOUT_GUARD =
            RuleDescriptor.of("M002", "db-operation-without-guard", RESOURCE, MEDIUM, "Database call without error handling");
    static final RuleDescriptor ENTER_NOT_RETURNING_SELF =
            RuleDescriptor.of("M003", "enter-not-returning-self", RESOURCE, MEDIUM, "__enter__ does not return self");
    static final RuleDescriptor REQUEST_WITHOUT_TIMEOUT =
            RuleDescriptor.of("M004", "request-without-timeout", RESOURCE, MEDIUM, "HTTP request without timeout");
    static final RuleDescriptor ENDPOINT_WITHOUT_ERROR_HANDLING =
            RuleDescriptor.of("M005", "endpoint-without-error-handling", RESOURCE, MEDIUM, "Endpoint without error handling");

    static final Set<String> DB_METHODS = Set.of(
            "execute", "executemany", "query", "filter", "commit", "rollback", "save", "create",
            "insert", "update", "delete", "fetchone", "fetchall", "fetchmany", "bulk_create",
            "insert_one", "insert_many", "update_one", "update_many", "delete_one", "delete_many");

    static final Set<String> ROUTE_DECORATORS = Set.of(
            "route", "get", "post", "put", "delete", "patch", "api_route", "websocket");

    private static final Set<String> HTTP_CLIENTS = Set.of("requests", "httpx");

    private static final Set<String> HTTP_METHODS = Set.of(
            "get", "post", "put", "delete", "patch", "head", "options", "request", "stream");

    private static final Set<String> OPENERS = Set.of("open", "io.open", "codecs.open");

    private static final Set<String> ENTER_METHODS = Set.of("__enter__", "__aenter__");

    @Override
    public List<Rule> rules() {
        return List.of(
                Rule.of(OPEN_WITHOUT_CONTEXT_MANAGER, Set.of(NodeKind.CALL), ResourceRules::openWithoutContextManager),
                Rule.of(DB_OPERATION_WITHOUT_GUARD, Set.of(NodeKind.CALL), ResourceRules::dbOperationWithoutGuard),
                Rule.of(ENTER_NOT_RETURNING_SELF, Set.of(NodeKind.RETURN), ResourceRules::enterNotReturningSelf),
                Rule.of(REQUEST_WITHOUT_TIMEOUT, Set.of(NodeKind.CALL), ResourceRules::requestWithoutTimeout),
                Rule.of(ENDPOINT_WITHOUT_ERROR_HANDLING,
                        Set.of(NodeKind.FUNCTION_DEF, NodeKind.ASYNC_FUNCTION_DEF, NodeKind.TRY),
                        RuntimeRules::markTry, ResourceRules::endpointWithoutErrorHandling)
        );
    }

    /**
     * {@code open(...)} is fine as a {@code with} item or when handed straight to
     * {@code ExitStack.enter_context}.
     */
    private static Optional<Finding> openWithoutContextManager(Node node, TraversalContext ctx) {
        Ast.Call call = (Ast.Call) node;
        if (!AstQueries.callsAny(call, OPENERS)) {
            return Optional.empty();
        }
        Node parent = ctx.parent().orElse(null);
        if (parent instanceof Ast.WithItem item && item.contextExpr() == node) {
            return Optional.empty();
        }
        if (parent instanceof Ast.Call outer && "enter_context".equals(AstQueries.methodName(outer))) {
            return Optional.empty();
        }
        return OPEN_WITHOUT_CONTEXT_MANAGER.report(node, ctx,
                "File opened without a context manager may never be closed",
                "Use 'with open(...) as f:' so the file is closed on every path");
    }

    private static Optional<Finding> dbOperationWithoutGuard(Node node, TraversalContext ctx) {
        String method = AstQueries.methodName((Ast.Call) node);
        if (method == null || !DB_METHODS.contains(method) || !ctx.isInFunction() || ctx.isGuarded()) {
            return Optional.empty();
        }
        return DB_OPERATION_WITHOUT_GUARD.report(node, ctx,
                "database operation ." + method + "() runs outside any try block",
                "Wrap the call in try/except, roll back on failure and log the error");
    }

    private static Optional<Finding> enterNotReturningSelf(Node node, TraversalContext ctx) {
        boolean inEnter = ctx.nearestDef()
                .map(frame -> ((Ast.FunctionDef) frame.node()).name())
                .map(ENTER_METHODS::contains)
                .orElse(false);
        Node value = ((Ast.Return) node).value();
        if (!inEnter || AstQueries.isNameOf(value, "self")) {
            return Optional.empty();
        }
        return ENTER_NOT_RETURNING_SELF.report(node, ctx,
                "__enter__ returns " + returned(value)
                        + ", so 'with obj as x' binds something other than the object",
                "Return self from __enter__ unless a different handle is intended");
    }

    private static String returned(Node value) {
        if (value == null) {
            return "None";
        }
        return value instanceof Ast.Constant constant ? constant.value() : AstQueries.describe(value);
    }

    private static Optional<Finding> requestWithoutTimeout(Node node, TraversalContext ctx) {
        Ast.Call call = (Ast.Call) node;
        String client = AstQueries.receiverName(call);
        if (client == null || !HTTP_CLIENTS.contains(client) || !HTTP_METHODS.contains(AstQueries.methodName(call))) {
            return Optional.empty();
        }
        boolean forwardsKwargs = call.keywords().stream().anyMatch(keyword -> keyword.arg() == null);
        if (forwardsKwargs || AstQueries.keyword(call, "timeout").isPresent()) {
            return Optional.empty();
        }
        return REQUEST_WITHOUT_TIMEOUT.report(node, ctx,
                client + "." + AstQueries.methodName(call) + "() without timeout= can hang forever",
                "Pass an explicit timeout, for example timeout=10");
    }

    // ---------------------------------------------------------------- M005

    private static Optional<Finding> endpointWithoutErrorHandling(Node node, TraversalContext ctx) {
        if (!(node instanceof Ast.FunctionDef function) || !isEndpoint(function)) {
            return Optional.empty();
        }
        boolean guarded = ctx.nearestDef().map(frame -> frame.isMarked(RuntimeRules.CONTAINS_TRY)).orElse(false);
        if (guarded) {
            return Optional.empty();
        }
        return ENDPOINT_WITHOUT_ERROR_HANDLING.report(node, ctx,
                "API endpoint '" + function.name() + "' has no try/except around its work",
                "Catch expected failures and map them to proper HTTP error responses");
    }

    static boolean isEndpoint(Ast.FunctionDef function) {
        for (Ast.Decorator decorator : function.decorators()) {
            Node expression = decorator.expression();
            if (expression instanceof Ast.Call call) {
                expression = call.func();
            }
            if (expression instanceof Ast.Attribute attribute && ROUTE_DECORATORS.contains(attribute.attr())) {
                return true;
            }
        }
        return false;
    }
}
