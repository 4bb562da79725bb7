package io.prompty.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class ResourceLimitsTest {

    @Test
    void defaults() {
        ResourceLimits limits = ResourceLimits.DEFAULT;
        assertThat(limits.maxDepth()).isEqualTo(10);
        assertThat(limits.maxLoopIterations()).isEqualTo(10_000);
        assertThat(limits.maxOutputBytes()).isEqualTo(10L * 1024 * 1024);
        assertThat(limits.executionTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(limits.resolverTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(limits.functionTimeout()).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void withersReplaceOneField() {
        ResourceLimits limits = ResourceLimits.DEFAULT.withMaxDepth(3).withFunctionTimeout(Duration.ofMillis(50));
        assertThat(limits.maxDepth()).isEqualTo(3);
        assertThat(limits.functionTimeout()).isEqualTo(Duration.ofMillis(50));
        assertThat(limits.maxLoopIterations()).isEqualTo(ResourceLimits.DEFAULT_MAX_LOOP_ITERATIONS);
    }

    @Test
    void nonPositiveValuesAreRejected() {
        assertThatThrownBy(() -> ResourceLimits.DEFAULT.withMaxDepth(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxDepth must be positive, got: 0");
        assertThatThrownBy(() -> ResourceLimits.DEFAULT.withResolverTimeout(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("resolverTimeout");
    }

    @Test
    void engineOptionsBuilderDefaults() {
        EngineOptions options = EngineOptions.builder().maxDepth(4).build();
        assertThat(options.defaultErrorStrategy()).isEqualTo(ErrorStrategy.THROW);
        assertThat(options.limits().maxDepth()).isEqualTo(4);
        assertThat(options.errorLogger().getName()).isEqualTo(EngineOptions.DEFAULT_ERROR_LOGGER);
        assertThat(options.toBuilder().build()).isEqualTo(options);
    }
}
