package io.prompty.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import io.prompty.core.model.Position;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Structure of the exception hierarchy: abstract roots, phases and fatality. */
class ExceptionHierarchyTest {

    private static final Position AT = new Position(12, 2, 5);

    // --- Hierarchy structure ---

    @Test
    void promptyExceptionIsAbstractRoot() {
        assertThat(PromptyException.class).isAbstract();
        assertThat(PromptyException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void parseAndExecutionBasesAreAbstract() {
        assertThat(TemplateParseException.class).isAbstract();
        assertThat(TemplateExecutionException.class).isAbstract();
        assertThat(TemplateParseException.class.getSuperclass()).isEqualTo(PromptyException.class);
        assertThat(TemplateExecutionException.class.getSuperclass()).isEqualTo(PromptyException.class);
    }

    // --- Parse phase ---

    @Test
    void lexExceptionCarriesPositionAndSource() {
        var ex = new LexException("unterminated tag", AT, "{~t a=");

        assertThat(ex).isInstanceOf(TemplateParseException.class);
        assertThat(ex.phase()).isEqualTo(PromptyException.Phase.PARSE);
        assertThat(ex.detail()).isEqualTo("unterminated tag");
        assertThat(ex.source()).isEqualTo("{~t a=");
        assertThat(ex.getMessage()).isEqualTo("unterminated tag at line 2, column 5");
    }

    @Test
    void parseExceptionCarriesKindAndCause() {
        var cause = new IllegalStateException("boom");
        var ex = new ParseException(ParseException.Kind.INVALID_EXPRESSION, "bad eval", cause, AT, "x");

        assertThat(ex.kind()).isEqualTo(ParseException.Kind.INVALID_EXPRESSION);
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.phase()).isEqualTo(PromptyException.Phase.PARSE);
    }

    // --- Execution phase ---

    @Test
    void recoverableExecutionErrors() {
        var resolver = new ResolverException("failed", AT, "prompty.var");
        var expression = new ExpressionException(ExpressionException.Kind.TYPE_MISMATCH, "cannot compare");

        assertThat(resolver.isFatal()).isFalse();
        assertThat(resolver.tagName()).isEqualTo("prompty.var");
        assertThat(resolver.phase()).isEqualTo(PromptyException.Phase.EXECUTION);
        assertThat(expression.isFatal()).isFalse();
        assertThat(expression.position().isKnown()).isFalse();
        assertThat(expression.getMessage()).isEqualTo("cannot compare");
    }

    @Test
    void expressionErrorIsReanchoredAtTag() {
        var original = new ExpressionException(ExpressionException.Kind.UNKNOWN_FUNCTION, "unknown function: f");
        var anchored = original.at(AT, "prompty.if");

        assertThat(anchored.kind()).isEqualTo(ExpressionException.Kind.UNKNOWN_FUNCTION);
        assertThat(anchored.position()).isEqualTo(AT);
        assertThat(anchored.tagName()).isEqualTo("prompty.if");
        assertThat(anchored.getMessage()).endsWith("at line 2, column 5");
    }

    @Test
    void fatalExecutionErrors() {
        assertThat(new ResourceLimitException(ResourceLimitException.Limit.DEPTH, "too deep", AT, "prompty.include")
                        .isFatal())
                .isTrue();
        assertThat(new ExecutionCancelledException("cancelled", AT, null).isFatal()).isTrue();
        var cycle = new CircularIncludeException(List.of("a", "b", "a"), AT, "prompty.include");
        assertThat(cycle.isFatal()).isTrue();
        assertThat(cycle.detail()).isEqualTo("circular include: a -> b -> a");
    }

    // --- Registration ---

    @Test
    void registrationExceptionHasNoPosition() {
        var ex = new RegistrationException("resolver already registered: echo", "echo");

        assertThat(ex.phase()).isEqualTo(PromptyException.Phase.REGISTRATION);
        assertThat(ex.name()).isEqualTo("echo");
        assertThat(ex.position()).isEqualTo(Position.NONE);
        assertThat(ex.getMessage()).isEqualTo("resolver already registered: echo");
    }
}
