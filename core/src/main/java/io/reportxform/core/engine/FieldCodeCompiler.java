package io.reportxform.core.engine;

import io.reportxform.core.config.ReportXformConfig;
import io.reportxform.core.error.FieldCodeException;
import io.reportxform.core.error.ReportXformException;
import io.reportxform.core.error.SandboxViolationException;
import io.reportxform.core.model.ExpressionNode;
import io.reportxform.core.model.FieldCode;
import io.reportxform.core.model.SandboxResult;
import io.reportxform.core.parse.FieldCodeParser;
import io.reportxform.core.spi.CompilationListener;
import io.reportxform.core.translate.ExpressionGenerator;
import io.reportxform.core.translate.ExpressionOptimizer;
import io.reportxform.core.translate.SandboxPolicy;
import io.reportxform.core.translate.SandboxRules;
import io.reportxform.core.translate.SandboxValidator;
import io.reportxform.core.translate.TreeSimplifier;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles field codes into report expressions.
 *
 * <p>Per field code: parse, simplify the tree, generate text, check the sandbox rules, optimize
 * the text. Under {@link SandboxPolicy#REPORT} sandbox findings ride along in the result; under
 * {@link SandboxPolicy#REJECT} a violation fails the field code.
 *
 * <p>{@link #compileAll(List)} isolates failures: one bad field code yields one FAILED result and
 * the batch carries on.
 *
 * <p>Thread-safe: every collaborator is stateless.
 */
public final class FieldCodeCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(FieldCodeCompiler.class);

    private final FieldCodeParser parser;
    private final TreeSimplifier simplifier;
    private final ExpressionGenerator generator;
    private final SandboxValidator sandbox;
    private final ExpressionOptimizer optimizer;
    private final SandboxPolicy policy;
    private final CompilationListener listener;

    /** Creates a compiler with the default configuration and no listener. */
    public FieldCodeCompiler() {
        this(ReportXformConfig.defaults());
    }

    public FieldCodeCompiler(ReportXformConfig config) {
        this(config, CompilationListener.NOOP);
    }

    /**
     * Creates a compiler from configuration. The sandbox rules come from
     * {@link ReportXformConfig#sandboxRulesPath()} when set, else from the bundled defaults.
     *
     * @throws io.reportxform.core.error.ConfigLoadException if the rule file cannot be loaded
     */
    public FieldCodeCompiler(ReportXformConfig config, CompilationListener listener) {
        this(
                new FieldCodeParser(config.maxNestingDepth()),
                new SandboxValidator(
                        config.sandboxRulesPath() != null
                                ? SandboxRules.load(config.sandboxRulesPath())
                                : SandboxRules.defaults()),
                config.sandboxPolicy(),
                listener);
    }

    public FieldCodeCompiler(
            FieldCodeParser parser, SandboxValidator sandbox, SandboxPolicy policy, CompilationListener listener) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.sandbox = Objects.requireNonNull(sandbox, "sandbox must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.listener = listener != null ? listener : CompilationListener.NOOP;
        this.simplifier = new TreeSimplifier();
        this.generator = new ExpressionGenerator();
        this.optimizer = new ExpressionOptimizer();
    }

    /**
     * Compiles one field code. Never throws for compile or sandbox errors; those come back as a
     * FAILED result.
     */
    public FieldCodeResult compile(FieldCode fieldCode) {
        Objects.requireNonNull(fieldCode, "fieldCode must not be null");
        long start = System.nanoTime();
        try {
            FieldCodeResult result = doCompile(fieldCode);
            notifyCompiled(fieldCode, result.expression(), System.nanoTime() - start);
            return result;
        } catch (FieldCodeException | SandboxViolationException e) {
            LOG.warn("Field code '{}' failed to compile: {}", fieldCode.id(), e.getMessage());
            notifyFailed(fieldCode, e);
            return FieldCodeResult.failed(fieldCode, e);
        }
    }

    /**
     * Compiles one field code and returns the expression text.
     *
     * @throws FieldCodeException         if the field code cannot be compiled
     * @throws SandboxViolationException  if the expression is rejected by policy
     */
    public String compileOrThrow(FieldCode fieldCode) {
        Objects.requireNonNull(fieldCode, "fieldCode must not be null");
        return doCompile(fieldCode).expression();
    }

    /** Compiles every field code, one result per input in input order. */
    public List<FieldCodeResult> compileAll(List<FieldCode> fieldCodes) {
        Objects.requireNonNull(fieldCodes, "fieldCodes must not be null");
        List<FieldCodeResult> results = new ArrayList<>(fieldCodes.size());
        int failed = 0;
        for (FieldCode fieldCode : fieldCodes) {
            FieldCodeResult result = compile(fieldCode);
            if (result.isFailed()) {
                failed++;
            }
            results.add(result);
        }
        LOG.info("Compiled {} field codes ({} succeeded, {} failed)", fieldCodes.size(), fieldCodes.size() - failed, failed);
        return results;
    }

    /**
     * Translates a bare expression (for example {@code Sum(Amount)}) through the same stages.
     *
     * @throws io.reportxform.core.error.ExpressionSyntaxException if the text is malformed
     * @throws SandboxViolationException if the expression is rejected by policy
     */
    public String compileExpression(String text) {
        ExpressionNode tree = simplifier.simplify(parser.parseExpression(text));
        return finish(null, tree).expression();
    }

    public SandboxPolicy policy() {
        return policy;
    }

    public ExpressionGenerator generator() {
        return generator;
    }

    private FieldCodeResult doCompile(FieldCode fieldCode) {
        ExpressionNode tree = simplifier.simplify(parser.parse(fieldCode));
        Compiled compiled = finish(fieldCode.id(), tree);
        LOG.debug("Compiled field code '{}': {} -> {}", fieldCode.id(), fieldCode.rawText(), compiled.expression());
        return FieldCodeResult.success(fieldCode, tree, compiled.expression(), compiled.sandbox());
    }

    private Compiled finish(String fieldCodeId, ExpressionNode tree) {
        String generated = generator.generate(tree);
        SandboxResult findings = sandbox.validate(generated);
        if (!findings.valid()) {
            boolean rejected = policy == SandboxPolicy.REJECT;
            notifySandboxViolation(fieldCodeId, generated, findings.violations(), rejected);
            if (rejected) {
                throw new SandboxViolationException(generated, findings.violations(), fieldCodeId);
            }
        }
        return new Compiled(optimizer.optimize(generated), findings);
    }

    private record Compiled(String expression, SandboxResult sandbox) {}

    // --- Listener notifications (exceptions are logged, never propagated) ---

    private void notifyCompiled(FieldCode fieldCode, String expression, long durationNanos) {
        try {
            listener.onCompiled(new CompilationListener.CompiledEvent(
                    fieldCode.id(), fieldCode.category(), expression, durationNanos));
        } catch (RuntimeException e) {
            LOG.warn("CompilationListener.onCompiled failed", e);
        }
    }

    private void notifyFailed(FieldCode fieldCode, ReportXformException error) {
        try {
            listener.onFailed(new CompilationListener.FailedEvent(
                    fieldCode.id(), fieldCode.category(), error.getClass().getSimpleName(), error.getMessage()));
        } catch (RuntimeException e) {
            LOG.warn("CompilationListener.onFailed failed", e);
        }
    }

    private void notifySandboxViolation(String fieldCodeId, String expression, List<String> violations, boolean rejected) {
        try {
            listener.onSandboxViolation(
                    new CompilationListener.SandboxViolationEvent(fieldCodeId, expression, violations, rejected));
        } catch (RuntimeException e) {
            LOG.warn("CompilationListener.onSandboxViolation failed", e);
        }
    }
}
