package io.prompty.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.prompty.core.error.ResourceLimitException;
import io.prompty.core.error.ResourceLimitException.Limit;
import io.prompty.core.model.Attributes;
import io.prompty.core.spi.Resolver;
import io.prompty.core.spi.TemplateFunction;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Resource limits")
class ResourceLimitTest {

    private static PromptyEngine engine(ResourceLimits limits) {
        return new PromptyEngine(EngineOptions.builder().limits(limits).build());
    }

    private static Limit limitOf(Throwable e) {
        return ((ResourceLimitException) e).limit();
    }

    @Test
    void outputSizeIsCountedInUtf8Bytes() {
        PromptyEngine engine = engine(ResourceLimits.DEFAULT.withMaxOutputBytes(4));
        // "é" is two bytes
        assertThat(engine.execute(CancellationToken.none(), "éé", Map.of())).isEqualTo("éé");
        assertThatThrownBy(() -> engine.execute(CancellationToken.none(), "ééa", Map.of()))
                .isInstanceOf(ResourceLimitException.class)
                .satisfies(e -> assertThat(limitOf(e)).isEqualTo(Limit.OUTPUT_SIZE));
    }

    @Test
    void outputLimitAppliesToVariableExpansion() {
        PromptyEngine engine = engine(ResourceLimits.DEFAULT.withMaxOutputBytes(10));
        assertThatThrownBy(() -> engine.execute(
                        CancellationToken.none(),
                        "{~prompty.var name=\"big\" onerror=\"remove\" /~}",
                        Map.of("big", "x".repeat(11))))
                .isInstanceOf(ResourceLimitException.class);
    }

    @Test
    void slowFunctionExceedsFunctionTimeout() {
        PromptyEngine engine = engine(ResourceLimits.DEFAULT.withFunctionTimeout(Duration.ofMillis(5)));
        engine.registerFunction(TemplateFunction.of("slow", 0, 0, args -> {
            sleep(40);
            return true;
        }));
        assertThatThrownBy(() -> engine.execute(
                        CancellationToken.none(), "{~prompty.if eval=\"slow()\"~}x{~/prompty.if~}", Map.of()))
                .isInstanceOf(ResourceLimitException.class)
                .hasMessageContaining("slow")
                .satisfies(e -> {
                    assertThat(limitOf(e)).isEqualTo(Limit.FUNCTION_TIMEOUT);
                    assertThat(((ResourceLimitException) e).position().isKnown()).isTrue();
                });
    }

    @Test
    void slowResolverExceedsResolverTimeout() {
        PromptyEngine engine = engine(ResourceLimits.DEFAULT.withResolverTimeout(Duration.ofMillis(5)));
        engine.registerResolver(new SleepingResolver(40));
        assertThatThrownBy(() -> engine.execute(CancellationToken.none(), "{~sleep /~}", Map.of()))
                .isInstanceOf(ResourceLimitException.class)
                .satisfies(e -> assertThat(limitOf(e)).isEqualTo(Limit.RESOLVER_TIMEOUT));
    }

    @Test
    void executionDeadlineIsCheckedBetweenTags() {
        PromptyEngine engine = engine(ResourceLimits.DEFAULT.withExecutionTimeout(Duration.ofMillis(10)));
        engine.registerResolver(new SleepingResolver(40));
        assertThatThrownBy(() -> engine.execute(CancellationToken.none(), "{~sleep /~}{~sleep /~}", Map.of()))
                .isInstanceOf(ResourceLimitException.class)
                .satisfies(e -> assertThat(limitOf(e)).isEqualTo(Limit.EXECUTION_TIMEOUT));
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private static final class SleepingResolver implements Resolver {

        private final long millis;

        SleepingResolver(long millis) {
            this.millis = millis;
        }

        @Override
        public String tagName() {
            return "sleep";
        }

        @Override
        public String resolve(ExecutionContext context, Attributes attributes) {
            sleep(millis);
            return "z";
        }
    }
}
