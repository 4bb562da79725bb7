package io.prompty.core.engine.builtin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.prompty.core.spi.TemplateFunction;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

@DisplayName("Built-in functions")
class BuiltinFunctionsTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-15T10:30:00Z"), ZoneOffset.UTC);

    private static final Map<String, TemplateFunction> FUNCTIONS = BuiltinFunctions.all(CLOCK).stream()
            .collect(Collectors.toMap(TemplateFunction::name, Function.identity()));

    private static Object call(String name, Object... args) {
        TemplateFunction function = FUNCTIONS.get(name);
        assertThat(function).as("function %s", name).isNotNull();
        assertThat(function.acceptsArgumentCount(args.length)).as("arity of %s", name).isTrue();
        return function.apply(Arrays.asList(args));
    }

    @Test
    void namesAreUnique() {
        assertThat(BuiltinFunctions.all(CLOCK)).hasSize(FUNCTIONS.size());
    }

    static Stream<Arguments> stringCases() {
        return Stream.of(
                Arguments.of("upper", new Object[] {"abc"}, "ABC"),
                Arguments.of("lower", new Object[] {"AbC"}, "abc"),
                Arguments.of("trim", new Object[] {"  x \n"}, "x"),
                Arguments.of("trimPrefix", new Object[] {"prefix-body", "prefix-"}, "body"),
                Arguments.of("trimSuffix", new Object[] {"file.txt", ".txt"}, "file"),
                Arguments.of("trimSuffix", new Object[] {"file.txt", ".md"}, "file.txt"),
                Arguments.of("hasPrefix", new Object[] {"hello", "he"}, true),
                Arguments.of("hasSuffix", new Object[] {"hello", "lo"}, true),
                Arguments.of("contains", new Object[] {"hello", "ell"}, true),
                Arguments.of("replace", new Object[] {"a-b-c", "-", "+"}, "a+b+c"),
                Arguments.of("split", new Object[] {"a,b,,c", ","}, List.of("a", "b", "", "c")),
                Arguments.of("join", new Object[] {List.of("a", 1, true), "/"}, "a/1/true"));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("stringCases")
    void stringFunctions(String name, Object[] args, Object expected) {
        assertThat(call(name, args)).isEqualTo(expected);
    }

    @Nested
    class Collections {

        @Test
        void lengthCountsCodePointsAndElements() {
            assertThat(call("len", "héllo")).isEqualTo(5);
            assertThat(call("len", List.of(1, 2))).isEqualTo(2);
            assertThat(call("len", Map.of("a", 1))).isEqualTo(1);
            assertThat(call("len", (Object) null)).isEqualTo(0);
            assertThatThrownBy(() -> call("len", 42)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void firstLastKeysValues() {
            assertThat(call("first", List.of("a", "b"))).isEqualTo("a");
            assertThat(call("last", List.of("a", "b"))).isEqualTo("b");
            assertThat(call("first", List.of())).isNull();
            assertThat(call("keys", Map.of("b", 2, "a", 1))).isEqualTo(List.of("a", "b"));
            assertThat(call("values", Map.of("b", 2, "a", 1))).isEqualTo(List.of(1, 2));
            assertThat(call("has", Map.of("a", 1), "a")).isEqualTo(true);
        }
    }

    @Nested
    class Types {

        @Test
        void conversions() {
            assertThat(call("toString", 3.0)).isEqualTo("3");
            assertThat(call("toInt", "42")).isEqualTo(42L);
            assertThat(call("toInt", 3.9)).isEqualTo(3L);
            assertThat(call("toFloat", "2.5")).isEqualTo(2.5);
            assertThat(call("toBool", "yes")).isEqualTo(true);
            assertThat(call("toBool", 0)).isEqualTo(false);
            assertThatThrownBy(() -> call("toInt", "abc"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("cannot convert 'abc'");
            assertThatThrownBy(() -> call("toBool", "maybe")).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void inspection() {
            assertThat(call("typeOf", List.of())).isEqualTo("list");
            assertThat(call("isNil", (Object) null)).isEqualTo(true);
            assertThat(call("isEmpty", "")).isEqualTo(true);
            assertThat(call("isEmpty", List.of(1))).isEqualTo(false);
        }

        @Test
        void defaultAndCoalesce() {
            assertThat(call("default", "", "fallback")).isEqualTo("fallback");
            assertThat(call("default", "set", "fallback")).isEqualTo("set");
            assertThat(call("coalesce", null, "", "third", "fourth")).isEqualTo("third");
            assertThat(call("coalesce", (Object) null)).isNull();
        }
    }

    @Nested
    @DisplayName("Date and time")
    class DateTime {

        @Test
        void nowReadsTheClock() {
            assertThat(call("now")).isEqualTo(ZonedDateTime.of(2024, 3, 15, 10, 30, 0, 0, ZoneOffset.UTC));
        }

        @Test
        void formatWithPatternAndDefault() {
            Object now = call("now");
            assertThat(call("formatDate", now, "yyyy-MM-dd")).isEqualTo("2024-03-15");
            assertThat(call("formatDate", now)).isEqualTo("2024-03-15T10:30:00Z");
        }

        @Test
        void parsesCommonFormats() {
            ZonedDateTime expected = ZonedDateTime.of(2024, 3, 15, 0, 0, 0, 0, ZoneOffset.UTC);
            assertThat(call("parseDate", "2024-03-15")).isEqualTo(expected);
            assertThat(call("parseDate", "03/15/2024")).isEqualTo(expected);
            assertThat(call("parseDate", "Mar 15, 2024")).isEqualTo(expected);
            assertThat(call("parseDate", "15.03.2024", "dd.MM.yyyy")).isEqualTo(expected);
            assertThatThrownBy(() -> call("parseDate", "not a date"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("invalid time format: not a date");
        }

        @Test
        void arithmeticAndParts() {
            Object now = call("now");
            Object later = call("addDays", now, 3);
            assertThat(call("diffDays", now, later)).isEqualTo(3L);
            assertThat(call("addHours", now, -1)).isEqualTo(ZonedDateTime.of(2024, 3, 15, 9, 30, 0, 0, ZoneOffset.UTC));
            assertThat(call("addMinutes", "2024-03-15T10:30:00Z", 30))
                    .isEqualTo(ZonedDateTime.of(2024, 3, 15, 11, 0, 0, 0, ZoneOffset.UTC));
            assertThat(call("year", now)).isEqualTo(2024);
            assertThat(call("month", now)).isEqualTo(3);
            assertThat(call("day", now)).isEqualTo(15);
            assertThat(call("weekday", now)).isEqualTo("Friday");
            assertThat(call("isAfter", later, now)).isEqualTo(true);
            assertThat(call("isBefore", later, now)).isEqualTo(false);
        }

        @Test
        void epochSecondsAreTimes() {
            assertThat(call("year", 0L)).isEqualTo(1970);
        }
    }
}
