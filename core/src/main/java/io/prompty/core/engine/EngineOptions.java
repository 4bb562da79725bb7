package io.prompty.core.engine;

import io.prompty.core.parse.Delimiters;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration of a {@link PromptyEngine}. Every field has a default; use {@link #builder()} to
 * override some of them.
 *
 * @param delimiters           tag delimiters (default {@code {~} / {@code ~}})
 * @param defaultErrorStrategy strategy used when neither the tag nor the context chooses one
 *                             (default {@link ErrorStrategy#THROW})
 * @param limits               resource limits
 * @param errorLogger          sink for errors recovered by {@link ErrorStrategy#LOG}
 * @param environment          variable lookup used by {@code prompty.env} (default
 *                             {@code System::getenv})
 */
public record EngineOptions(
        Delimiters delimiters,
        ErrorStrategy defaultErrorStrategy,
        ResourceLimits limits,
        Logger errorLogger,
        Function<String, String> environment) {

    /** Name of the default logging sink. */
    public static final String DEFAULT_ERROR_LOGGER = "io.prompty.errors";

    public static final EngineOptions DEFAULT = builder().build();

    public EngineOptions {
        Objects.requireNonNull(delimiters, "delimiters must not be null");
        Objects.requireNonNull(defaultErrorStrategy, "defaultErrorStrategy must not be null");
        Objects.requireNonNull(limits, "limits must not be null");
        Objects.requireNonNull(errorLogger, "errorLogger must not be null");
        Objects.requireNonNull(environment, "environment must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns a builder initialised from these options. */
    public Builder toBuilder() {
        return new Builder()
                .delimiters(delimiters)
                .defaultErrorStrategy(defaultErrorStrategy)
                .limits(limits)
                .errorLogger(errorLogger)
                .environment(environment);
    }

    /** Builder for {@link EngineOptions}. */
    public static final class Builder {
        private Delimiters delimiters = Delimiters.DEFAULT;
        private ErrorStrategy defaultErrorStrategy = ErrorStrategy.THROW;
        private ResourceLimits limits = ResourceLimits.DEFAULT;
        private Logger errorLogger;
        private Function<String, String> environment = System::getenv;

        Builder() {}

        public Builder delimiters(Delimiters delimiters) {
            this.delimiters = delimiters;
            return this;
        }

        public Builder delimiters(String open, String close) {
            return delimiters(new Delimiters(open, close));
        }

        public Builder defaultErrorStrategy(ErrorStrategy strategy) {
            this.defaultErrorStrategy = strategy;
            return this;
        }

        public Builder limits(ResourceLimits limits) {
            this.limits = limits;
            return this;
        }

        /** Shortcut for replacing only the include depth limit. */
        public Builder maxDepth(int maxDepth) {
            this.limits = limits.withMaxDepth(maxDepth);
            return this;
        }

        public Builder errorLogger(Logger errorLogger) {
            this.errorLogger = errorLogger;
            return this;
        }

        public Builder environment(Function<String, String> environment) {
            this.environment = environment;
            return this;
        }

        public EngineOptions build() {
            Logger sink = errorLogger != null ? errorLogger : LoggerFactory.getLogger(DEFAULT_ERROR_LOGGER);
            return new EngineOptions(delimiters, defaultErrorStrategy, limits, sink, environment);
        }
    }
}
