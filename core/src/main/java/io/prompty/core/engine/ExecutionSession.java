package io.prompty.core.engine;

import io.prompty.core.error.CircularIncludeException;
import io.prompty.core.error.ExecutionCancelledException;
import io.prompty.core.error.ResourceLimitException;
import io.prompty.core.expr.ExpressionEvaluator;
import io.prompty.core.model.Position;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import org.slf4j.MDC;

/**
 * Mutable state of one top-level execution: cancellation, deadline, include chain and the errors
 * the throw strategy has already committed to propagating. Confined to the executing thread.
 */
final class ExecutionSession {

    /** MDC key holding the name of the template being rendered. */
    static final String MDC_TEMPLATE = "prompty.template";

    private final PromptyEngine engine;
    private final CancellationToken token;
    private final long deadlineNanos;
    private final ExpressionEvaluator evaluator;
    private final List<String> includeChain = new ArrayList<>();
    private final Set<Throwable> propagating = Collections.newSetFromMap(new IdentityHashMap<>());
    private int depth;
    private Position currentPosition = Position.NONE;

    ExecutionSession(PromptyEngine engine, CancellationToken token) {
        this.engine = engine;
        this.token = token;
        ResourceLimits limits = engine.options().limits();
        this.deadlineNanos = System.nanoTime() + limits.executionTimeout().toNanos();
        this.evaluator = new ExpressionEvaluator(engine.functions(), limits.functionTimeout());
    }

    PromptyEngine engine() {
        return engine;
    }

    ResourceLimits limits() {
        return engine.options().limits();
    }

    CancellationToken cancellationToken() {
        return token;
    }

    ExpressionEvaluator evaluator() {
        return evaluator;
    }

    /** Aborts if the caller cancelled or the execution deadline passed. */
    void checkpoint(Position position, String tagName) {
        if (token.isCancelled()) {
            throw new ExecutionCancelledException("execution cancelled", position, tagName);
        }
        if (System.nanoTime() - deadlineNanos > 0) {
            throw new ResourceLimitException(
                    ResourceLimitException.Limit.EXECUTION_TIMEOUT,
                    "execution timeout exceeded: " + limits().executionTimeout().toMillis() + "ms",
                    position,
                    tagName);
        }
    }

    /** Renders the top-level template. Its name, if any, starts the include chain. */
    String run(Template template, ExecutionContext context) {
        template.name().ifPresent(includeChain::add);
        return renderWithMdc(template, context.bind(this), BlockOverrides.NONE);
    }

    String renderIncluded(Template template, ExecutionContext context) {
        return renderWithMdc(template, context, BlockOverrides.NONE);
    }

    /** Renders the parent of an extending template with the blocks collected so far. */
    String renderExtended(Template parent, ExecutionContext context, BlockOverrides overrides) {
        return renderWithMdc(parent, context, overrides);
    }

    private String renderWithMdc(Template template, ExecutionContext context, BlockOverrides overrides) {
        String previous = MDC.get(MDC_TEMPLATE);
        template.name().ifPresent(name -> MDC.put(MDC_TEMPLATE, name));
        try {
            return new Executor(this, overrides).renderTemplate(template.nodes(), context);
        } finally {
            if (previous == null) {
                MDC.remove(MDC_TEMPLATE);
            } else {
                MDC.put(MDC_TEMPLATE, previous);
            }
        }
    }

    /** Checks depth and cycles, then descends into {@code templateName} (an include or an extends parent). */
    void enterInclude(String templateName, Position position, String tagName) {
        if (includeChain.contains(templateName)) {
            List<String> cycle = new ArrayList<>(includeChain.subList(includeChain.indexOf(templateName), includeChain.size()));
            cycle.add(templateName);
            throw new CircularIncludeException(cycle, position, tagName);
        }
        if (depth + 1 > limits().maxDepth()) {
            throw new ResourceLimitException(
                    ResourceLimitException.Limit.DEPTH,
                    String.format(
                            "include depth exceeded: %d > %d including %s", depth + 1, limits().maxDepth(), templateName),
                    position,
                    tagName);
        }
        depth++;
        includeChain.add(templateName);
    }

    void exitInclude() {
        depth--;
        includeChain.remove(includeChain.size() - 1);
    }

    /** Records the tag whose resolver is about to run, for errors raised by built-in resolvers. */
    void enterTag(Position position) {
        this.currentPosition = position;
    }

    Position currentPosition() {
        return currentPosition;
    }

    int depth() {
        return depth;
    }

    void markPropagating(Throwable error) {
        propagating.add(error);
    }

    boolean isPropagating(Throwable error) {
        return propagating.contains(error);
    }
}
