package io.prompty.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.prompty.core.error.ResolverException;
import io.prompty.core.error.ResourceLimitException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.slf4j.LoggerFactory;

/**
 * The five error strategies applied to a missing variable with {@code default="N/A"}, plus
 * strategy inheritance and the fatal errors no strategy may swallow.
 */
@DisplayName("ErrorStrategy")
class ErrorStrategyTest {

    private static final String ERROR_LOGGER = "test.prompty.errors";

    private PromptyEngine engine;
    private Logger errorLogger;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() {
        errorLogger = (Logger) LoggerFactory.getLogger(ERROR_LOGGER);
        appender = new ListAppender<>();
        appender.start();
        errorLogger.addAppender(appender);
        engine = new PromptyEngine(EngineOptions.builder()
                .errorLogger(LoggerFactory.getLogger(ERROR_LOGGER))
                .build());
    }

    @AfterEach
    void tearDown() {
        errorLogger.detachAppender(appender);
        appender.stop();
    }

    private static String missing(String strategy) {
        return "{~prompty.var name=\"missing\" onerror=\"" + strategy + "\" default=\"N/A\" /~}";
    }

    @Test
    @DisplayName("throw → execution aborts with the resolver error")
    void throwAborts() {
        assertThatThrownBy(() -> engine.execute(CancellationToken.none(), missing("throw"), Map.of()))
                .isInstanceOf(ResolverException.class)
                .hasMessageContaining("variable not found: missing");
        assertThat(appender.list).isEmpty();
    }

    @Test
    @DisplayName("default → default attribute")
    void defaultUsesAttribute() {
        assertThat(engine.execute(CancellationToken.none(), missing("default"), Map.of())).isEqualTo("N/A");
    }

    @Test
    @DisplayName("remove → empty output")
    void removeEmitsNothing() {
        assertThat(engine.execute(CancellationToken.none(), "[" + missing("remove") + "]", Map.of()))
                .isEqualTo("[]");
    }

    @Test
    @DisplayName("keepraw → original tag source")
    void keepRawEmitsSource() {
        String tag = missing("keepraw");
        assertThat(engine.execute(CancellationToken.none(), "a " + tag + " b", Map.of()))
                .isEqualTo("a " + tag + " b");
    }

    @Test
    @DisplayName("log → empty output and exactly one log entry")
    void logRecordsOneEntry() {
        String output = engine.execute(CancellationToken.none(), missing("log"), Map.of());

        assertThat(output).isEmpty();
        assertThat(appender.list).hasSize(1);
        ILoggingEvent event = appender.list.get(0);
        assertThat(event.getLevel()).isEqualTo(Level.WARN);
        assertThat(event.getFormattedMessage())
                .contains("tag=prompty.var")
                .contains("line=1")
                .contains("variable not found: missing");
    }

    @ParameterizedTest
    @ValueSource(strings = {"THROW", "Default", "REMOVE"})
    void strategyNamesAreCaseInsensitive(String name) {
        assertThat(ErrorStrategy.fromAttribute(name)).isPresent();
    }

    @Test
    void defaultAttributeWithoutOnErrorIsUsedDirectly() {
        assertThat(engine.execute(
                        CancellationToken.none(), "{~prompty.var name=\"missing\" default=\"fallback\" /~}", Map.of()))
                .isEqualTo("fallback");
    }

    @Test
    void engineDefaultStrategyApplies() {
        PromptyEngine lenient = new PromptyEngine(EngineOptions.builder()
                .defaultErrorStrategy(ErrorStrategy.REMOVE)
                .build());
        assertThat(lenient.execute(CancellationToken.none(), "a{~prompty.var name=\"x\" /~}b", Map.of()))
                .isEqualTo("ab");
    }

    @Test
    void contextStrategyOverridesEngineDefault() {
        Template template = engine.parse("a{~unknown.tag /~}b");
        ExecutionContext context = ExecutionContext.of(Map.of(), ErrorStrategy.KEEP_RAW);
        assertThat(template.executeWithContext(CancellationToken.none(), context)).isEqualTo("a{~unknown.tag /~}b");
    }

    @Test
    void tagStrategyOverridesContextStrategy() {
        Template template = engine.parse("a{~unknown.tag onerror=\"remove\" /~}b");
        ExecutionContext context = ExecutionContext.of(Map.of(), ErrorStrategy.KEEP_RAW);
        assertThat(template.executeWithContext(CancellationToken.none(), context)).isEqualTo("ab");
    }

    @Test
    void unknownOnErrorValueFallsBackToDefaultStrategy() {
        assertThatThrownBy(() -> engine.execute(
                        CancellationToken.none(), "{~unknown.tag onerror=\"shrug\" /~}", Map.of()))
                .isInstanceOf(ResolverException.class);
    }

    @Test
    @DisplayName("An error the inner tag throws is not recovered by an outer block")
    void thrownErrorIsNotRecoveredByEnclosingTag() {
        engine.registerResolver(new EchoResolver("wrap", "wrapped"));
        String source = "{~wrap onerror=\"remove\"~}{~prompty.var name=\"missing\" onerror=\"throw\" /~}{~/wrap~}";
        assertThatThrownBy(() -> engine.execute(CancellationToken.none(), source, Map.of()))
                .isInstanceOf(ResolverException.class)
                .hasMessageContaining("missing");
    }

    @Test
    @DisplayName("An unrecognized onerror value falls back to the engine default and is logged")
    void unknownOnErrorUsesEngineDefault() {
        Logger executorLogger = (Logger) LoggerFactory.getLogger(Executor.class);
        ListAppender<ILoggingEvent> warnings = new ListAppender<>();
        warnings.start();
        executorLogger.addAppender(warnings);
        try {
            PromptyEngine lenient = new PromptyEngine(EngineOptions.builder()
                    .defaultErrorStrategy(ErrorStrategy.REMOVE)
                    .build());
            String source = "[{~custom.nope onerror=\"bogus\" /~}]";

            assertThat(lenient.execute(CancellationToken.none(), source, Map.of())).isEqualTo("[]");
            assertThatThrownBy(() -> engine.execute(CancellationToken.none(), source, Map.of()))
                    .isInstanceOf(ResolverException.class)
                    .hasMessageContaining("unknown tag: custom.nope");
            assertThat(warnings.list)
                    .extracting(ILoggingEvent::getFormattedMessage)
                    .contains("Ignoring unknown onerror value: value=bogus");
            assertThat(warnings.list).allMatch(event -> event.getLevel() == Level.WARN);
        } finally {
            executorLogger.detachAppender(warnings);
            warnings.stop();
        }
    }

    @Test
    void resourceLimitsAreNeverSwallowed() {
        PromptyEngine tight = new PromptyEngine(EngineOptions.builder()
                .limits(ResourceLimits.DEFAULT.withMaxLoopIterations(1))
                .build());
        String source = "{~prompty.for item=\"x\" in=\"items\" onerror=\"remove\"~}.{~/prompty.for~}";
        assertThatThrownBy(() -> tight.execute(CancellationToken.none(), source, Map.of("items", List.of(1, 2))))
                .isInstanceOf(ResourceLimitException.class);
    }
}
