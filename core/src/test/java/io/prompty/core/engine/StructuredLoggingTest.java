package io.prompty.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.prompty.core.model.Attributes;
import io.prompty.core.spi.Resolver;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/** Log output and MDC propagation during registration and rendering. */
@DisplayName("StructuredLoggingTest")
class StructuredLoggingTest {

    private ListAppender<ILoggingEvent> logAppender;
    private Logger registryLogger;

    @BeforeEach
    void setUp() {
        registryLogger = (Logger) LoggerFactory.getLogger(NamedRegistry.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        registryLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        registryLogger.detachAppender(logAppender);
        logAppender.stop();
        MDC.clear();
    }

    @Test
    @DisplayName("Registration logs one INFO entry with kind and name")
    void registrationIsLogged() {
        PromptyEngine engine = new PromptyEngine();
        engine.registerResolver(new EchoResolver("echo", "x"));

        assertThat(logAppender.list)
                .filteredOn(e -> e.getLevel() == Level.INFO)
                .extracting(ILoggingEvent::getFormattedMessage)
                .containsExactly("Registered resolver: name=echo");
    }

    @Test
    @DisplayName("Named templates are visible in the MDC while they render")
    void templateNameIsInMdcDuringRendering() {
        PromptyEngine engine = new PromptyEngine();
        List<String> seen = new ArrayList<>();
        engine.registerResolver(new Resolver() {
            @Override
            public String tagName() {
                return "spy";
            }

            @Override
            public String resolve(ExecutionContext context, Attributes attributes) {
                seen.add(MDC.get(ExecutionSession.MDC_TEMPLATE));
                return "";
            }
        });
        engine.registerTemplate("inner", "{~spy /~}");
        engine.registerTemplate("outer", "{~spy /~}{~prompty.include template=\"inner\" /~}{~spy /~}");

        MDC.put(ExecutionSession.MDC_TEMPLATE, "caller");
        engine.executeTemplate(CancellationToken.none(), "outer", Map.of());

        assertThat(seen).containsExactly("outer", "inner", "outer");
        assertThat(MDC.get(ExecutionSession.MDC_TEMPLATE)).isEqualTo("caller");
    }
}
