package com.vidnyan.pyguard.adapter.out.detector;

import com.vidnyan.pyguard.domain.model.Finding;
import com.vidnyan.pyguard.domain.rule.Rule;
import com.vidnyan.pyguard.domain.rule.RuleCatalog;
import com.vidnyan.pyguard.domain.rule.RuleDescriptor;
import com.vidnyan.pyguard.domain.syntax.Ast;
import com.vidnyan.pyguard.domain.syntax.Ast.ConstantType;
import com.vidnyan.pyguard.domain.syntax.Node;
import com.vidnyan.pyguard.domain.syntax.NodeKind;
import com.vidnyan.pyguard.domain.traversal.TraversalContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import static com.vidnyan.pyguard.domain.model.Category.SECURITY;
import static com.vidnyan.pyguard.domain.model.Severity.CRITICAL;
import static com.vidnyan.pyguard.domain.model.Severity.HIGH;
import static com.vidnyan.pyguard.domain.model.Severity.MEDIUM;

/**
 * Injection, secrets, weak cryptography and unsafe library defaults.
 */
@Component
@Order(4)
public class SecurityRules implements RuleCatalog {

    static final RuleDescriptor INJECTION_HEURISTIC =
            RuleDescriptor.of("S001", "injection-heuristic", SECURITY, CRITICAL, "Query built from formatted string");
    static final RuleDescriptor COMMAND_INJECTION =
            RuleDescriptor.of("S002", "command-injection", SECURITY, CRITICAL, "Shell command injection");
    static final RuleDescriptor HARDCODED_SECRET =
            RuleDescriptor.of("S003", "hardcoded-secret", SECURITY, HIGH, "Hardcoded secret");
    static final RuleDescriptor WEAK_HASH =
            RuleDescriptor.of("S004", "weak-hash", SECURITY, MEDIUM, "Weak hash algorithm");
    static final RuleDescriptor UNSAFE_DESERIALIZATION =
            RuleDescriptor.of("S005", "unsafe-deserialization", SECURITY, HIGH, "Unsafe deserialization");
    static final RuleDescriptor TLS_VERIFICATION_DISABLED =
            RuleDescriptor.of("S006", "tls-verification-disabled", SECURITY, HIGH, "TLS verification disabled");
    static final RuleDescriptor WEAK_RANDOM =
            RuleDescriptor.of("S007", "weak-random", SECURITY, MEDIUM, "Non-cryptographic random for secrets");
    static final RuleDescriptor INSECURE_TEMPFILE =
            RuleDescriptor.of("S008", "insecure-tempfile", SECURITY, MEDIUM, "Insecure temporary file");
    static final RuleDescriptor DEBUG_MODE_ENABLED =
            RuleDescriptor.of("S009", "debug-mode-enabled", SECURITY, MEDIUM, "Debug mode enabled");

    static final Set<String> EXECUTE_METHODS = Set.of(
            "execute", "executemany", "executescript", "raw", "mogrify", "query");

    private static final Set<String> SUBPROCESS_CALLS = Set.of(
            "subprocess.run", "subprocess.call", "subprocess.check_call", "subprocess.check_output",
            "subprocess.Popen", "subprocess.getoutput", "subprocess.getstatusoutput");

    private static final Set<String> SHELL_CALLS = Set.of("os.system", "os.popen");

    private static final Set<String> SECRET_WORDS = Set.of(
            "password", "passwd", "pwd", "secret", "api_key", "apikey", "token", "access_key",
            "private_key", "auth_key", "credential");

    private static final Set<String> PLACEHOLDER_MARKERS = Set.of(
            "todo", "changeme", "change-me", "change_me", "your", "example", "placeholder", "xxx",
            "<", "${", "{{", "dummy", "fixme", "replace");

    private static final Set<String> WEAK_HASHES = Set.of("md5", "sha1");

    private static final Set<String> UNSAFE_LOADERS = Set.of(
            "pickle.load", "pickle.loads", "cPickle.load", "cPickle.loads", "dill.load", "dill.loads",
            "marshal.load", "marshal.loads", "shelve.open");

    private static final Set<String> YAML_SAFE_LOADERS = Set.of("SafeLoader", "CSafeLoader", "BaseLoader");

    private static final Set<String> SENSITIVE_WORDS = Set.of(
            "token", "secret", "password", "key", "salt", "nonce", "otp", "session", "csrf", "auth");

    private static final int MIN_SECRET_LENGTH = 4;

    @Override
    public List<Rule> rules() {
        Set<NodeKind> calls = Set.of(NodeKind.CALL);
        Set<NodeKind> assignments = Set.of(NodeKind.ASSIGN, NodeKind.ANN_ASSIGN);
        return List.of(
                Rule.of(INJECTION_HEURISTIC, calls, SecurityRules::injectionHeuristic),
                Rule.of(COMMAND_INJECTION, calls, SecurityRules::commandInjection),
                Rule.of(HARDCODED_SECRET, assignments, SecurityRules::hardcodedSecret),
                Rule.of(WEAK_HASH, calls, SecurityRules::weakHash),
                Rule.of(UNSAFE_DESERIALIZATION, calls, SecurityRules::unsafeDeserialization),
                Rule.of(TLS_VERIFICATION_DISABLED, Set.of(NodeKind.KEYWORD), SecurityRules::tlsVerificationDisabled),
                Rule.of(WEAK_RANDOM, assignments, SecurityRules::weakRandom),
                Rule.of(INSECURE_TEMPFILE, calls, SecurityRules::insecureTempfile),
                Rule.of(DEBUG_MODE_ENABLED, calls, SecurityRules::debugModeEnabled)
        );
    }

    /**
     * Execute-like call whose query is assembled at run time instead of being a
     * static literal with parameter placeholders.
     */
    private static Optional<Finding> injectionHeuristic(Node node, TraversalContext ctx) {
        Ast.Call call = (Ast.Call) node;
        String method = AstQueries.methodName(call);
        Node query = AstQueries.firstArgument(call);
        if (method == null || !EXECUTE_METHODS.contains(method) || query == null || !AstQueries.isDynamicString(query)) {
            return Optional.empty();
        }
        return INJECTION_HEURISTIC.report(node, ctx,
                "Query passed to ." + method + "() is built by string formatting",
                "Use parameterized queries: cursor.execute(\"... WHERE id = %s\", (user_id,))");
    }

    private static Optional<Finding> commandInjection(Node node, TraversalContext ctx) {
        Ast.Call call = (Ast.Call) node;
        String callee = AstQueries.calleeName(call).orElse("");
        if (SUBPROCESS_CALLS.contains(callee)) {
            boolean shell = AstQueries.keyword(call, "shell")
                    .map(keyword -> AstQueries.isConstant(keyword.value(), ConstantType.TRUE))
                    .orElse(false);
            if (!shell) {
                return Optional.empty();
            }
            return COMMAND_INJECTION.report(node, ctx,
                    callee + "() with shell=True passes the command through the shell",
                    "Pass the command as an argument list without shell=True, or quote input with shlex.quote");
        }
        Node command = AstQueries.firstArgument(call);
        if (!SHELL_CALLS.contains(callee) || command == null
                || !(AstQueries.isDynamicString(command) || command instanceof Ast.Name)) {
            return Optional.empty();
        }
        return COMMAND_INJECTION.report(node, ctx,
                callee + "() runs a command assembled at run time",
                "Use subprocess.run([...]) with an argument list");
    }

    // ---------------------------------------------------------------- S003

    private static Optional<Finding> hardcodedSecret(Node node, TraversalContext ctx) {
        for (Node target : targets(node)) {
            String name = targetName(target);
            if (name == null || !isSecretName(name)) {
                continue;
            }
            Node value = value(node);
            if (value instanceof Ast.Constant constant && constant.isString() && !isPlaceholder(constant.value())) {
                return HARDCODED_SECRET.report(node, ctx,
                        "'" + name + "' is assigned a hardcoded secret",
                        "Load it from the environment (os.environ[...]) or a secrets manager");
            }
        }
        return Optional.empty();
    }

    static boolean isSecretName(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return SECRET_WORDS.stream().anyMatch(lower::contains);
    }

    static boolean isPlaceholder(String value) {
        String lower = value.strip().toLowerCase(Locale.ROOT);
        return lower.length() < MIN_SECRET_LENGTH || PLACEHOLDER_MARKERS.stream().anyMatch(lower::contains);
    }

    private static Optional<Finding> weakHash(Node node, TraversalContext ctx) {
        Ast.Call call = (Ast.Call) node;
        String callee = AstQueries.calleeName(call).orElse("");
        String algorithm = null;
        if (callee.startsWith("hashlib.") && WEAK_HASHES.contains(callee.substring("hashlib.".length()))) {
            algorithm = callee.substring("hashlib.".length());
        } else if (callee.equals("hashlib.new") && AstQueries.firstArgument(call) instanceof Ast.Constant name
                && name.isString() && WEAK_HASHES.contains(name.value().toLowerCase(Locale.ROOT))) {
            algorithm = name.value().toLowerCase(Locale.ROOT);
        }
        if (algorithm == null) {
            return Optional.empty();
        }
        return WEAK_HASH.report(node, ctx,
                algorithm.toUpperCase(Locale.ROOT) + " is broken for security purposes",
                "Use hashlib.sha256 or stronger; for passwords use bcrypt, scrypt or argon2");
    }

    private static Optional<Finding> unsafeDeserialization(Node node, TraversalContext ctx) {
        Ast.Call call = (Ast.Call) node;
        String callee = AstQueries.calleeName(call).orElse("");
        if (UNSAFE_LOADERS.contains(callee)) {
            return UNSAFE_DESERIALIZATION.report(node, ctx,
                    callee + "() can execute arbitrary code from untrusted data",
                    "Use json or another data-only format for untrusted input");
        }
        if (!callee.equals("yaml.load") || hasSafeYamlLoader(call)) {
            return Optional.empty();
        }
        return UNSAFE_DESERIALIZATION.report(node, ctx,
                "yaml.load() without a safe loader can construct arbitrary objects",
                "Use yaml.safe_load() or pass Loader=yaml.SafeLoader");
    }

    private static boolean hasSafeYamlLoader(Ast.Call call) {
        Node loader = AstQueries.keyword(call, "Loader").map(Ast.Keyword::value)
                .orElse(call.args().size() > 1 ? call.args().get(1) : null);
        if (loader == null) {
            return false;
        }
        String name = AstQueries.dottedName(loader).orElse("");
        return YAML_SAFE_LOADERS.stream().anyMatch(name::endsWith);
    }

    private static Optional<Finding> tlsVerificationDisabled(Node node, TraversalContext ctx) {
        Ast.Keyword keyword = (Ast.Keyword) node;
        if (!"verify".equals(keyword.arg()) || !AstQueries.isConstant(keyword.value(), ConstantType.FALSE)) {
            return Optional.empty();
        }
        return TLS_VERIFICATION_DISABLED.report(node, ctx,
                "verify=False disables TLS certificate verification",
                "Keep verification on; point verify= at a CA bundle for private certificates");
    }

    // ---------------------------------------------------------------- S007

    private static Optional<Finding> weakRandom(Node node, TraversalContext ctx) {
        Node value = value(node);
        if (!(value instanceof Ast.Call call)
                || !AstQueries.calleeName(call).map(name -> name.startsWith("random.")).orElse(false)) {
            return Optional.empty();
        }
        for (Node target : targets(node)) {
            String name = targetName(target);
            if (name != null && isSensitiveName(name)) {
                return WEAK_RANDOM.report(node, ctx,
                        "'" + name + "' is generated with the predictable random module",
                        "Use the secrets module (secrets.token_hex, secrets.randbelow) for security values");
            }
        }
        return Optional.empty();
    }

    static boolean isSensitiveName(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return SENSITIVE_WORDS.stream().anyMatch(lower::contains);
    }

    private static Optional<Finding> insecureTempfile(Node node, TraversalContext ctx) {
        if (!AstQueries.callsAny((Ast.Call) node, Set.of("tempfile.mktemp", "mktemp"))) {
            return Optional.empty();
        }
        return INSECURE_TEMPFILE.report(node, ctx,
                "tempfile.mktemp() returns a name another process can claim before you open it",
                "Use tempfile.mkstemp() or tempfile.NamedTemporaryFile()");
    }

    private static Optional<Finding> debugModeEnabled(Node node, TraversalContext ctx) {
        Ast.Call call = (Ast.Call) node;
        boolean debug = "run".equals(AstQueries.methodName(call)) && AstQueries.keyword(call, "debug")
                .map(keyword -> AstQueries.isConstant(keyword.value(), ConstantType.TRUE))
                .orElse(false);
        if (!debug) {
            return Optional.empty();
        }
        return DEBUG_MODE_ENABLED.report(node, ctx,
                "Application started with debug=True exposes an interactive debugger",
                "Read the debug flag from configuration and keep it off in production");
    }

    // --------------------------------------------------------------- helpers

    private static List<Node> targets(Node assignment) {
        if (assignment instanceof Ast.Assign assign) {
            return assign.targets();
        }
        return List.of(((Ast.AnnAssign) assignment).target());
    }

    private static Node value(Node assignment) {
        if (assignment instanceof Ast.Assign assign) {
            return assign.value();
        }
        return ((Ast.AnnAssign) assignment).value();
    }

    /**
     * {@code name} for plain names, {@code attr} for {@code obj.attr} targets.
     */
    private static String targetName(Node target) {
        if (target instanceof Ast.Name name) {
            return name.id();
        }
        if (target instanceof Ast.Attribute attribute) {
            return attribute.attr();
        }
        return null;
    }
}
