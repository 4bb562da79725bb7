package io.prompty.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.prompty.core.error.ExpressionException;
import io.prompty.core.error.ResolverException;
import io.prompty.core.error.ResourceLimitException;
import io.prompty.core.model.AttributeNames;
import io.prompty.core.model.Attributes;
import io.prompty.core.spi.Resolver;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** End-to-end rendering through {@link PromptyEngine}: text, variables and control flow. */
@DisplayName("Executor")
class ExecutorTest {

    private PromptyEngine engine;

    @BeforeEach
    void setUp() {
        engine = new PromptyEngine();
    }

    private String render(String source, Map<String, ?> data) {
        return engine.parse(source).execute(data);
    }

    @Nested
    @DisplayName("Concrete scenarios")
    class Scenarios {

        @Test
        void variableSubstitution() {
            assertThat(render("Hello, {~prompty.var name=\"user\" /~}!", Map.of("user", "Alice")))
                    .isEqualTo("Hello, Alice!");
        }

        @Test
        void elseBranchWhenConditionFalse() {
            String source = "{~prompty.if eval=\"n>0\"~}pos{~prompty.else~}non-pos{~/prompty.if~}";
            assertThat(render(source, Map.of("n", -1))).isEqualTo("non-pos");
        }

        @Test
        void loopLimitStopsSilently() {
            String source = "{~prompty.for item=\"x\" in=\"items\" limit=\"2\"~}{~prompty.var name=\"x\"/~}"
                    + "{~/prompty.for~}";
            assertThat(render(source, Map.of("items", List.of(1, 2, 3)))).isEqualTo("12");
        }

        @Test
        void defaultStrategyUsesDefaultAttribute() {
            assertThat(render("{~prompty.var name=\"missing\" onerror=\"default\" default=\"N/A\" /~}", Map.of()))
                    .isEqualTo("N/A");
        }
    }

    @Nested
    @DisplayName("Text fidelity")
    class Fidelity {

        @Test
        void plainTextIsUnchanged() {
            String source = "no tags here\n  just ~} and } and {\n";
            assertThat(render(source, Map.of())).isEqualTo(source);
        }

        @Test
        void rawBlockEmitsBodyVerbatim() {
            String source = "a{~prompty.raw~}{~prompty.var name=\"x\" /~} {~not.closed{~/prompty.raw~}b";
            assertThat(render(source, Map.of("x", "ignored")))
                    .isEqualTo("a{~prompty.var name=\"x\" /~} {~not.closedb");
        }

        @Test
        void commentNeverAppears() {
            String source = "a{~prompty.comment~}secret {~prompty.var name=\"x\" /~}{~/prompty.comment~}b";
            assertThat(render(source, Map.of("x", "1"))).isEqualTo("ab");
        }

        @Test
        void escapedOpenDelimiterIsLiteral() {
            assertThat(render("\\{~prompty.var name=\"x\" /~}", Map.of("x", "1")))
                    .isEqualTo("{~prompty.var name=\"x\" /~}");
        }

        @Test
        void renderingIsDeterministic() {
            Template template = engine.parse("{~prompty.for item=\"e\" in=\"m\"~}{~prompty.var name=\"e.key\" /~}="
                    + "{~prompty.var name=\"e.value\" /~};{~/prompty.for~}");
            Map<String, Object> data = Map.of("m", Map.of("b", 2, "a", 1, "c", 3));
            String first = template.execute(data);
            assertThat(template.execute(data)).isEqualTo(first).isEqualTo("a=1;b=2;c=3;");
        }
    }

    @Nested
    @DisplayName("Conditionals")
    class Conditionals {

        private static final String CHAIN = "{~prompty.if eval=\"n > 10\"~}big"
                + "{~prompty.elseif eval=\"n > 0\"~}small"
                + "{~prompty.elseif eval=\"n > 5\"~}unreachable"
                + "{~/prompty.if~}";

        @Test
        void firstTrueBranchWins() {
            assertThat(render(CHAIN, Map.of("n", 20))).isEqualTo("big");
            assertThat(render(CHAIN, Map.of("n", 7))).isEqualTo("small");
        }

        @Test
        void noBranchAndNoElseRendersNothing() {
            assertThat(render(CHAIN, Map.of("n", -3))).isEmpty();
        }

        @Test
        void functionsAndLogicInConditions() {
            String source = "{~prompty.if eval=\"len(items) > 1 && hasPrefix(name, 'Al')\"~}yes{~prompty.else~}no"
                    + "{~/prompty.if~}";
            assertThat(render(source, Map.of("items", List.of(1, 2), "name", "Alice")))
                    .isEqualTo("yes");
            assertThat(render(source, Map.of("items", List.of(1), "name", "Alice")))
                    .isEqualTo("no");
        }

        @Test
        void typeMismatchIsThrownByDefault() {
            assertThatThrownBy(() -> render("{~prompty.if eval=\"n > 'a'\"~}x{~/prompty.if~}", Map.of("n", 1)))
                    .isInstanceOf(ExpressionException.class)
                    .hasMessageContaining("cannot compare");
        }

        @Test
        void conditionalHonoursOnError() {
            assertThat(render(
                            "{~prompty.if eval=\"n > 'a'\" onerror=\"remove\"~}x{~/prompty.if~}done",
                            Map.of("n", 1)))
                    .isEqualTo("done");
        }
    }

    @Nested
    @DisplayName("Switch")
    class Switches {

        @Test
        void firstMatchingCaseWins() {
            String source = "{~prompty.switch eval=\"n\"~}"
                    + "{~prompty.case eval=\"n > 1\"~}first{~/prompty.case~}"
                    + "{~prompty.case value=\"5\"~}second{~/prompty.case~}"
                    + "{~prompty.casedefault~}other{~/prompty.casedefault~}"
                    + "{~/prompty.switch~}";
            assertThat(render(source, Map.of("n", 5))).isEqualTo("first");
        }

        @Test
        void valueCaseComparesRenderedText() {
            String source = "{~prompty.switch eval=\"role\"~}\n"
                    + "  {~prompty.case value=\"admin\"~}A{~/prompty.case~}\n"
                    + "  {~prompty.case value=\"user\"~}U{~/prompty.case~}\n"
                    + "{~/prompty.switch~}";
            assertThat(render(source, Map.of("role", "user"))).isEqualTo("U");
        }

        @Test
        void defaultWhenNothingMatches() {
            String source = "{~prompty.switch eval=\"role\"~}{~prompty.case value=\"admin\"~}A{~/prompty.case~}"
                    + "{~prompty.casedefault~}guest{~/prompty.casedefault~}{~/prompty.switch~}";
            assertThat(render(source, Map.of("role", "visitor"))).isEqualTo("guest");
        }
    }

    @Nested
    @DisplayName("Loops")
    class Loops {

        @Test
        void indexIsBound() {
            String source = "{~prompty.for item=\"x\" index=\"i\" in=\"items\"~}{~prompty.var name=\"i\" /~}:"
                    + "{~prompty.var name=\"x\" /~} {~/prompty.for~}";
            assertThat(render(source, Map.of("items", List.of("a", "b")))).isEqualTo("0:a 1:b ");
        }

        @Test
        void mappingIteratesInKeyOrder() {
            Map<String, Object> m = new LinkedHashMap<>();
            for (String key : List.of("e", "c", "a", "d", "b")) {
                m.put(key, key.toUpperCase());
            }
            String source = "{~prompty.for item=\"e\" in=\"m\"~}{~prompty.var name=\"e.key\" /~}{~/prompty.for~}";
            Template template = engine.parse(source);
            assertThat(template.execute(Map.of("m", m))).isEqualTo("abcde");
            assertThat(template.execute(Map.of("m", m))).isEqualTo("abcde");
        }

        @Test
        void loopVariablesShadowOuterScope() {
            String source = "{~prompty.for item=\"x\" in=\"items\"~}{~prompty.var name=\"x\" /~}{~/prompty.for~}"
                    + "{~prompty.var name=\"x\" /~}";
            assertThat(render(source, Map.of("x", "outer", "items", List.of("in")))).isEqualTo("inouter");
        }

        @Test
        void ceilingRaisesResourceLimitEvenWithHigherUserLimit() {
            PromptyEngine small = new PromptyEngine(EngineOptions.builder()
                    .limits(ResourceLimits.DEFAULT.withMaxLoopIterations(3))
                    .build());
            Template template = small.parse(
                    "{~prompty.for item=\"x\" in=\"items\" limit=\"10\"~}.{~/prompty.for~}");

            assertThatThrownBy(() -> template.execute(Map.of("items", List.of(1, 2, 3, 4, 5))))
                    .isInstanceOf(ResourceLimitException.class)
                    .satisfies(e -> assertThat(((ResourceLimitException) e).limit())
                            .isEqualTo(ResourceLimitException.Limit.LOOP_ITERATIONS));
        }

        @Test
        void missingCollectionFollowsStrategy() {
            assertThatThrownBy(() -> render("{~prompty.for item=\"x\" in=\"nope\"~}.{~/prompty.for~}", Map.of()))
                    .isInstanceOf(ResolverException.class)
                    .hasMessageContaining("collection path not found: nope");
            assertThat(render("{~prompty.for item=\"x\" in=\"nope\" onerror=\"remove\"~}.{~/prompty.for~}!", Map.of()))
                    .isEqualTo("!");
        }
    }

    @Nested
    @DisplayName("Custom resolvers")
    class CustomResolvers {

        @Test
        void blockTagReceivesRenderedContent() {
            engine.registerResolver(new Resolver() {
                @Override
                public String tagName() {
                    return "shout";
                }

                @Override
                public String resolve(ExecutionContext context, Attributes attributes) {
                    return attributes.getOrDefault(AttributeNames.CONTENT, "").toUpperCase();
                }
            });
            assertThat(render("{~shout~}hi {~prompty.var name=\"n\" /~}{~/shout~}", Map.of("n", "bob")))
                    .isEqualTo("HI BOB");
        }

        @Test
        void resolverRegisteredAfterParseIsUsed() {
            Template template = engine.parse("[{~late /~}]");
            engine.registerResolver(new EchoResolver("late", "bound"));
            assertThat(template.execute(Map.of())).isEqualTo("[bound]");
        }

        @Test
        void unknownTagThrowsByDefault() {
            assertThatThrownBy(() -> render("{~nobody /~}", Map.of()))
                    .isInstanceOf(ResolverException.class)
                    .hasMessageContaining("unknown tag: nobody")
                    .hasMessageContaining("line 1, column 1");
        }

        @Test
        void resolverCanSetContextValues() {
            engine.registerResolver(new Resolver() {
                @Override
                public String tagName() {
                    return "remember";
                }

                @Override
                public String resolve(ExecutionContext context, Attributes attributes) {
                    context.set("memo", attributes.getOrDefault("value", ""));
                    return "";
                }
            });
            ExecutionContext context = ExecutionContext.empty();
            engine.parse("{~remember value=\"kept\" /~}").executeWithContext(CancellationToken.none(), context);
            assertThat(context.getString("memo")).contains("kept");
        }
    }
}
