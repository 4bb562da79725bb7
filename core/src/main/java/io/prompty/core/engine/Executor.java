package io.prompty.core.engine;

import io.prompty.core.error.ExpressionException;
import io.prompty.core.error.ResolverException;
import io.prompty.core.error.ResourceLimitException;
import io.prompty.core.error.TemplateExecutionException;
import io.prompty.core.expr.CompiledExpression;
import io.prompty.core.expr.Values;
import io.prompty.core.model.AttributeNames;
import io.prompty.core.model.Attributes;
import io.prompty.core.model.BlockNode;
import io.prompty.core.model.ConditionalBranch;
import io.prompty.core.model.ConditionalNode;
import io.prompty.core.model.ExtendsNode;
import io.prompty.core.model.LoopNode;
import io.prompty.core.model.Node;
import io.prompty.core.model.ParentNode;
import io.prompty.core.model.Position;
import io.prompty.core.model.RawNode;
import io.prompty.core.model.SwitchCase;
import io.prompty.core.model.SwitchNode;
import io.prompty.core.model.TagNames;
import io.prompty.core.model.TagNode;
import io.prompty.core.model.TextNode;
import io.prompty.core.spi.Resolver;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Depth-first walk over a template's nodes, producing output text.
 *
 * <p>
 * Failures of a single tag (an unknown tag, a resolver error, an expression error) are recovered
 * according to the tag's error strategy. Fatal errors and errors the throw strategy has already
 * committed to are rethrown untouched, so an enclosing tag never recovers them a second time.
 *
 * <p>
 * A template that starts with {@code prompty.extends} renders as its parent, with its root blocks
 * replacing the parent's blocks of the same name. Inside an override, {@code prompty.parent}
 * renders the definition it replaced.
 */
final class Executor {

    private static final Logger LOG = LoggerFactory.getLogger(Executor.class);

    private final ExecutionSession session;
    private final EngineOptions options;
    private final BlockOverrides overrides;
    private final Deque<BlockFrame> activeBlocks = new ArrayDeque<>();

    Executor(ExecutionSession session, BlockOverrides overrides) {
        this.session = session;
        this.options = session.engine().options();
        this.overrides = overrides;
    }

    /** Renders the root nodes of a template, following its extends declaration if it has one. */
    String renderTemplate(List<Node> nodes, ExecutionContext context) {
        for (Node node : nodes) {
            if (node instanceof ExtendsNode extendsNode) {
                return renderExtends(extendsNode, nodes, context);
            }
        }
        return render(nodes, context);
    }

    String render(List<Node> nodes, ExecutionContext context) {
        OutputBuffer out = new OutputBuffer(session.limits().maxOutputBytes());
        for (Node node : nodes) {
            out.append(renderNode(node, context), node.position());
        }
        return out.toString();
    }

    private String renderNode(Node node, ExecutionContext context) {
        if (node instanceof TextNode text) {
            return text.text();
        }
        if (node instanceof RawNode raw) {
            return raw.text();
        }
        if (node instanceof TagNode tag) {
            return renderTag(tag, context);
        }
        if (node instanceof ConditionalNode conditional) {
            return renderConditional(conditional, context);
        }
        if (node instanceof LoopNode loop) {
            return renderLoop(loop, context);
        }
        if (node instanceof SwitchNode switchNode) {
            return renderSwitch(switchNode, context);
        }
        if (node instanceof BlockNode block) {
            return renderBlock(block, context);
        }
        if (node instanceof ParentNode) {
            return renderParent(context);
        }
        if (node instanceof ExtendsNode) {
            // consumed by renderTemplate
            return "";
        }
        throw new IllegalStateException("unsupported node type: " + node.getClass().getName());
    }

    private String renderTag(TagNode tag, ExecutionContext context) {
        session.checkpoint(tag.position(), tag.name());
        Optional<Resolver> resolver = session.engine().resolvers().get(tag.name());
        if (resolver.isEmpty()) {
            return recover(
                    new ResolverException("unknown tag: " + tag.name(), tag.position(), tag.name()),
                    tag.attributes(),
                    tag.rawSource(),
                    context);
        }
        Attributes attributes = tag.attributes();
        if (!tag.selfClosing()) {
            attributes = attributes.with(AttributeNames.CONTENT, render(tag.children(), context));
        }
        try {
            return invoke(resolver.get(), tag, attributes, context);
        } catch (TemplateExecutionException e) {
            if (e.isFatal() || session.isPropagating(e)) {
                throw e;
            }
            return recover(e, tag.attributes(), tag.rawSource(), context);
        }
    }

    private String invoke(Resolver resolver, TagNode tag, Attributes attributes, ExecutionContext context) {
        try {
            resolver.validate(attributes);
        } catch (TemplateExecutionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ResolverException(
                    "invalid attributes for " + tag.name() + ": " + e.getMessage(), e, tag.position(), tag.name());
        }
        session.enterTag(tag.position());
        long start = System.nanoTime();
        String result;
        try {
            result = resolver.resolve(context, attributes);
        } catch (TemplateExecutionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ResolverException(tag.name() + ": " + e.getMessage(), e, tag.position(), tag.name());
        }
        long elapsed = System.nanoTime() - start;
        long budget = session.limits().resolverTimeout().toNanos();
        if (!(resolver instanceof IncludeResolver) && elapsed > budget) {
            throw new ResourceLimitException(
                    ResourceLimitException.Limit.RESOLVER_TIMEOUT,
                    String.format(
                            "resolver %s exceeded timeout: %dms > %dms",
                            tag.name(), elapsed / 1_000_000, budget / 1_000_000),
                    tag.position(),
                    tag.name());
        }
        return result == null ? "" : result;
    }

    private String renderConditional(ConditionalNode conditional, ExecutionContext context) {
        List<Node> chosen = null;
        try {
            for (ConditionalBranch branch : conditional.branches()) {
                if (branch.isFallback() || test(branch.condition(), context, branch.position(), TagNames.IF)) {
                    chosen = branch.body();
                    break;
                }
            }
        } catch (TemplateExecutionException e) {
            if (e.isFatal() || session.isPropagating(e)) {
                throw e;
            }
            return recover(e, conditional.attributes(), conditional.rawSource(), context);
        }
        return chosen == null ? "" : render(chosen, context);
    }

    private String renderLoop(LoopNode loop, ExecutionContext context) {
        List<Object> items;
        try {
            items = collection(loop, context);
        } catch (TemplateExecutionException e) {
            if (session.isPropagating(e)) {
                throw e;
            }
            return recover(e, loop.attributes(), loop.rawSource(), context);
        }
        int ceiling = session.limits().maxLoopIterations();
        int userLimit = loop.userLimit().orElse(Integer.MAX_VALUE);
        OutputBuffer out = new OutputBuffer(session.limits().maxOutputBytes());
        for (int i = 0; i < items.size(); i++) {
            if (i >= userLimit) {
                break;
            }
            if (i >= ceiling) {
                throw new ResourceLimitException(
                        ResourceLimitException.Limit.LOOP_ITERATIONS,
                        String.format("loop iterations exceeded: %d over %s", ceiling, loop.collectionPath()),
                        loop.position(),
                        TagNames.FOR);
            }
            session.checkpoint(loop.position(), TagNames.FOR);
            Map<String, Object> scope = new HashMap<>();
            scope.put(loop.item(), items.get(i));
            if (loop.index() != null) {
                scope.put(loop.index(), i);
            }
            out.append(render(loop.body(), context.child(scope)), loop.position());
        }
        return out.toString();
    }

    private List<Object> collection(LoopNode loop, ExecutionContext context) {
        Object value = context.get(loop.collectionPath())
                .orElseThrow(() -> new ResolverException(
                        "collection path not found: " + loop.collectionPath(), loop.position(), TagNames.FOR));
        if (value instanceof Map<?, ?> map) {
            List<Object> entries = new ArrayList<>(map.size());
            Values.stringKeys(map).forEach((key, entryValue) -> {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("key", key);
                entry.put("value", entryValue);
                entries.add(entry);
            });
            return entries;
        }
        return Values.asList(value)
                .orElseThrow(() -> new ResolverException(
                        "value at " + loop.collectionPath() + " is not iterable: " + Values.typeName(value),
                        loop.position(),
                        TagNames.FOR));
    }

    private String renderSwitch(SwitchNode node, ExecutionContext context) {
        List<Node> chosen = null;
        try {
            Object subject = evaluate(node.expression(), context, node.position(), TagNames.SWITCH);
            String subjectText = Values.toText(subject);
            for (SwitchCase candidate : node.cases()) {
                boolean matches = candidate.value() != null
                        ? candidate.value().equals(subjectText)
                        : test(candidate.condition(), context, candidate.position(), TagNames.CASE);
                if (matches) {
                    chosen = candidate.body();
                    break;
                }
            }
        } catch (TemplateExecutionException e) {
            if (e.isFatal() || session.isPropagating(e)) {
                throw e;
            }
            return recover(e, node.attributes(), node.rawSource(), context);
        }
        if (chosen == null) {
            chosen = node.fallback().orElse(List.of());
        }
        return render(chosen, context);
    }

    private String renderExtends(ExtendsNode node, List<Node> nodes, ExecutionContext context) {
        session.checkpoint(node.position(), TagNames.EXTENDS);
        Optional<Template> parent = session.engine().templates().get(node.template());
        if (parent.isEmpty()) {
            return recover(
                    new ResolverException("template not found: " + node.template(), node.position(), TagNames.EXTENDS),
                    node.attributes(),
                    node.rawSource(),
                    context);
        }
        session.enterInclude(node.template(), node.position(), TagNames.EXTENDS);
        try {
            return session.renderExtended(parent.get(), context, overrides.extendWith(nodes));
        } finally {
            session.exitInclude();
        }
    }

    private String renderBlock(BlockNode block, ExecutionContext context) {
        boolean active = activeBlocks.stream().anyMatch(frame -> frame.name().equals(block.name()));
        // a block re-entered from inside its own override keeps its default body
        List<List<Node>> definitions = active ? List.of(block.body()) : overrides.definitionsOf(block);
        return renderDefinition(new BlockFrame(block.name(), definitions, 0), context);
    }

    private String renderParent(ExecutionContext context) {
        BlockFrame frame = activeBlocks.peek();
        if (frame == null || !frame.hasNext()) {
            return "";
        }
        return renderDefinition(frame.next(), context);
    }

    private String renderDefinition(BlockFrame frame, ExecutionContext context) {
        activeBlocks.push(frame);
        try {
            return render(frame.current(), context);
        } finally {
            activeBlocks.pop();
        }
    }

    /** One definition of a named block being rendered; {@code level} 0 is the most derived. */
    private record BlockFrame(String name, List<List<Node>> definitions, int level) {

        List<Node> current() {
            return definitions.get(level);
        }

        boolean hasNext() {
            return level + 1 < definitions.size();
        }

        BlockFrame next() {
            return new BlockFrame(name, definitions, level + 1);
        }
    }

    private boolean test(CompiledExpression expression, ExecutionContext context, Position position, String tagName) {
        return Values.isTruthy(evaluate(expression, context, position, tagName));
    }

    private Object evaluate(CompiledExpression expression, ExecutionContext context, Position position, String tagName) {
        try {
            return session.evaluator().evaluate(expression, context);
        } catch (ExpressionException e) {
            throw e.at(position, tagName);
        } catch (ResourceLimitException e) {
            if (e.position().isKnown()) {
                throw e;
            }
            throw new ResourceLimitException(e.limit(), e.detail(), position, tagName);
        }
    }

    /** Applies the tag's error strategy to a non-fatal failure. */
    private String recover(
            TemplateExecutionException error, Attributes attributes, String rawSource, ExecutionContext context) {
        ErrorStrategy strategy = strategyFor(attributes, context);
        switch (strategy) {
            case DEFAULT:
                return attributes.getOrDefault(AttributeNames.DEFAULT, "");
            case REMOVE:
                return "";
            case KEEP_RAW:
                return rawSource;
            case LOG:
                options.errorLogger()
                        .warn(
                                "Template error recovered: tag={}, line={}, column={}, error={}",
                                error.tagName(),
                                error.position().line(),
                                error.position().column(),
                                error.detail());
                return "";
            case THROW:
            default:
                session.markPropagating(error);
                throw error;
        }
    }

    private ErrorStrategy strategyFor(Attributes attributes, ExecutionContext context) {
        Optional<String> onError = attributes.get(AttributeNames.ON_ERROR);
        if (onError.isPresent()) {
            Optional<ErrorStrategy> explicit = ErrorStrategy.fromAttribute(onError.get());
            if (explicit.isPresent()) {
                return explicit.get();
            }
            LOG.warn("Ignoring unknown onerror value: value={}", onError.get());
        }
        return context.errorStrategy().orElse(options.defaultErrorStrategy());
    }
}
