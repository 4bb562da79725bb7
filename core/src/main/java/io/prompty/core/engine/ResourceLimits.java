package io.prompty.core.engine;

import java.time.Duration;
import java.util.Objects;

/**
 * Resource limits enforced on every execution. Breaching any of them raises a
 * {@link io.prompty.core.error.ResourceLimitException}, whatever the error strategy.
 *
 * <p>
 * Immutable and thread-safe.
 *
 * @param maxDepth          maximum include nesting depth (default: 10)
 * @param maxLoopIterations maximum iterations of a single loop, independent of its {@code limit}
 *                          attribute (default: 10,000)
 * @param maxOutputBytes    maximum UTF-8 size of rendered output (default: 10MB)
 * @param executionTimeout  wall-clock budget for one top-level execution (default: 30s)
 * @param resolverTimeout   wall-clock budget for one resolver call (default: 5s)
 * @param functionTimeout   wall-clock budget for one function call (default: 1s)
 */
public record ResourceLimits(
        int maxDepth,
        int maxLoopIterations,
        long maxOutputBytes,
        Duration executionTimeout,
        Duration resolverTimeout,
        Duration functionTimeout) {

    public static final int DEFAULT_MAX_DEPTH = 10;
    public static final int DEFAULT_MAX_LOOP_ITERATIONS = 10_000;
    public static final long DEFAULT_MAX_OUTPUT_BYTES = 10L * 1024 * 1024;

    /** Default limits: depth 10, 10,000 iterations, 10MB output, 30s / 5s / 1s timeouts. */
    public static final ResourceLimits DEFAULT = new ResourceLimits(
            DEFAULT_MAX_DEPTH,
            DEFAULT_MAX_LOOP_ITERATIONS,
            DEFAULT_MAX_OUTPUT_BYTES,
            Duration.ofSeconds(30),
            Duration.ofSeconds(5),
            Duration.ofSeconds(1));

    public ResourceLimits {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
        }
        if (maxLoopIterations <= 0) {
            throw new IllegalArgumentException("maxLoopIterations must be positive, got: " + maxLoopIterations);
        }
        if (maxOutputBytes <= 0) {
            throw new IllegalArgumentException("maxOutputBytes must be positive, got: " + maxOutputBytes);
        }
        requirePositive(executionTimeout, "executionTimeout");
        requirePositive(resolverTimeout, "resolverTimeout");
        requirePositive(functionTimeout, "functionTimeout");
    }

    public ResourceLimits withMaxDepth(int value) {
        return new ResourceLimits(value, maxLoopIterations, maxOutputBytes, executionTimeout, resolverTimeout, functionTimeout);
    }

    public ResourceLimits withMaxLoopIterations(int value) {
        return new ResourceLimits(maxDepth, value, maxOutputBytes, executionTimeout, resolverTimeout, functionTimeout);
    }

    public ResourceLimits withMaxOutputBytes(long value) {
        return new ResourceLimits(maxDepth, maxLoopIterations, value, executionTimeout, resolverTimeout, functionTimeout);
    }

    public ResourceLimits withExecutionTimeout(Duration value) {
        return new ResourceLimits(maxDepth, maxLoopIterations, maxOutputBytes, value, resolverTimeout, functionTimeout);
    }

    public ResourceLimits withResolverTimeout(Duration value) {
        return new ResourceLimits(maxDepth, maxLoopIterations, maxOutputBytes, executionTimeout, value, functionTimeout);
    }

    public ResourceLimits withFunctionTimeout(Duration value) {
        return new ResourceLimits(maxDepth, maxLoopIterations, maxOutputBytes, executionTimeout, resolverTimeout, value);
    }

    private static void requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive, got: " + value);
        }
    }
}
