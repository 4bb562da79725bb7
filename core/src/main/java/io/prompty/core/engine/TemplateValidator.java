package io.prompty.core.engine;

import io.prompty.core.error.TemplateParseException;
import io.prompty.core.expr.CompiledExpression;
import io.prompty.core.model.AttributeNames;
import io.prompty.core.model.Attributes;
import io.prompty.core.model.BlockNode;
import io.prompty.core.model.ConditionalBranch;
import io.prompty.core.model.ConditionalNode;
import io.prompty.core.model.ExtendsNode;
import io.prompty.core.model.LoopNode;
import io.prompty.core.model.Node;
import io.prompty.core.model.Position;
import io.prompty.core.model.Severity;
import io.prompty.core.model.SwitchCase;
import io.prompty.core.model.SwitchNode;
import io.prompty.core.model.TagNames;
import io.prompty.core.model.TagNode;
import io.prompty.core.model.ValidationIssue;
import io.prompty.core.model.ValidationResult;
import io.prompty.core.spi.Resolver;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Static checks over a template: everything short of executing it. */
final class TemplateValidator {

    private final PromptyEngine engine;
    private final List<ValidationIssue> issues = new ArrayList<>();

    TemplateValidator(PromptyEngine engine) {
        this.engine = engine;
    }

    ValidationResult validate(String source) {
        List<Node> nodes;
        try {
            nodes = engine.parser().parse(source);
        } catch (TemplateParseException e) {
            issues.add(new ValidationIssue(Severity.ERROR, e.detail(), e.position()));
            return new ValidationResult(issues);
        }
        nodes.forEach(this::visit);
        return new ValidationResult(issues);
    }

    private void visit(Node node) {
        if (node instanceof TagNode tag) {
            checkTag(tag);
            tag.children().forEach(this::visit);
        } else if (node instanceof ConditionalNode conditional) {
            checkOnError(conditional.attributes(), conditional.position());
            for (ConditionalBranch branch : conditional.branches()) {
                if (!branch.isFallback()) {
                    checkFunctions(branch.condition(), branch.position());
                }
                branch.body().forEach(this::visit);
            }
        } else if (node instanceof LoopNode loop) {
            checkOnError(loop.attributes(), loop.position());
            loop.body().forEach(this::visit);
        } else if (node instanceof SwitchNode switchNode) {
            checkOnError(switchNode.attributes(), switchNode.position());
            checkFunctions(switchNode.expression(), switchNode.position());
            for (SwitchCase candidate : switchNode.cases()) {
                if (candidate.condition() != null) {
                    checkFunctions(candidate.condition(), candidate.position());
                }
                candidate.body().forEach(this::visit);
            }
            switchNode.fallback().ifPresent(body -> body.forEach(this::visit));
        } else if (node instanceof BlockNode block) {
            block.body().forEach(this::visit);
        } else if (node instanceof ExtendsNode extendsNode) {
            checkOnError(extendsNode.attributes(), extendsNode.position());
            if (!engine.templates().has(extendsNode.template())) {
                issues.add(new ValidationIssue(
                        Severity.WARNING,
                        "parent template not registered: " + extendsNode.template(),
                        extendsNode.position()));
            }
        }
    }

    private void checkTag(TagNode tag) {
        checkOnError(tag.attributes(), tag.position());
        Optional<Resolver> resolver = engine.resolvers().get(tag.name());
        if (resolver.isEmpty()) {
            boolean recovered = tag.attributes()
                    .get(AttributeNames.ON_ERROR)
                    .flatMap(ErrorStrategy::fromAttribute)
                    .filter(s -> s != ErrorStrategy.THROW)
                    .isPresent();
            if (recovered) {
                issues.add(new ValidationIssue(
                        Severity.INFO,
                        "unknown tag: " + tag.name() + " (falls back to onerror="
                                + tag.attributes().getOrDefault(AttributeNames.ON_ERROR, "") + ")",
                        tag.position()));
            } else {
                issues.add(new ValidationIssue(Severity.WARNING, "unknown tag: " + tag.name(), tag.position()));
            }
            return;
        }
        try {
            resolver.get().validate(tag.attributes());
        } catch (RuntimeException e) {
            issues.add(new ValidationIssue(
                    Severity.ERROR, "invalid attributes for " + tag.name() + ": " + e.getMessage(), tag.position()));
            return;
        }
        if (tag.name().equals(TagNames.INCLUDE)) {
            String target = tag.attributes().getOrDefault(AttributeNames.TEMPLATE, "");
            if (!engine.templates().has(target)) {
                issues.add(new ValidationIssue(
                        Severity.WARNING, "included template not registered: " + target, tag.position()));
            }
        }
    }

    private void checkOnError(Attributes attributes, Position position) {
        attributes.get(AttributeNames.ON_ERROR).ifPresent(value -> {
            if (ErrorStrategy.fromAttribute(value).isEmpty()) {
                issues.add(new ValidationIssue(
                        Severity.ERROR,
                        "invalid onerror value: " + value
                                + " (expected one of throw, default, remove, keepraw, log)",
                        position));
            }
        });
    }

    private void checkFunctions(CompiledExpression expression, Position position) {
        for (String function : expression.functionNames()) {
            if (!engine.functions().has(function)) {
                issues.add(new ValidationIssue(Severity.WARNING, "unknown function: " + function, position));
            }
        }
    }
}
