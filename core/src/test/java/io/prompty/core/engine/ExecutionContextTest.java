package io.prompty.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ExecutionContextTest {

    private final ExecutionContext root = ExecutionContext.of(Map.of(
            "user", Map.of("name", "Ann", "tags", List.of("a", "b")),
            "count", 3));

    @Test
    void dottedPathsWalkMapsAndLists() {
        assertThat(root.get("user.name")).contains("Ann");
        assertThat(root.get("user.tags.1")).contains("b");
        assertThat(root.get("user.tags.9")).isEmpty();
        assertThat(root.get("user.missing.deeper")).isEmpty();
        assertThat(root.getString("count")).contains("3");
    }

    @Test
    void childFallsThroughToParent() {
        ExecutionContext child = root.child(Map.of("local", true));
        assertThat(child.get("local")).contains(true);
        assertThat(child.get("user.name")).contains("Ann");
        assertThat(child.parent()).containsSame(root);
    }

    @Test
    void localBindingShadowsWholeParentPath() {
        ExecutionContext child = root.child(Map.of("user", Map.of("id", 7)));
        assertThat(child.get("user.id")).contains(7);
        assertThat(child.get("user.name")).isEmpty();
    }

    @Test
    void isolatedChildSeesOnlyItsOwnData() {
        ExecutionContext isolated = root.isolatedChild(Map.of("x", 1));
        assertThat(isolated.has("x")).isTrue();
        assertThat(isolated.has("count")).isFalse();
        assertThat(isolated.parent()).isEmpty();
    }

    @Test
    void nullIsAbsent() {
        Map<String, Object> data = new HashMap<>();
        data.put("gone", null);
        ExecutionContext context = ExecutionContext.of(data);
        assertThat(context.has("gone")).isFalse();
        assertThat(context.getOrDefault("gone", "fallback")).isEqualTo("fallback");
    }

    @Test
    void setNeverTouchesParent() {
        ExecutionContext child = root.child(Map.of());
        child.set("count", 99);
        assertThat(child.get("count")).contains(99);
        assertThat(root.get("count")).contains(3);
    }

    @Test
    void callerMapIsCopied() {
        Map<String, Object> data = new HashMap<>(Map.of("k", "v"));
        ExecutionContext context = ExecutionContext.of(data);
        data.put("k", "changed");
        assertThat(context.get("k")).contains("v");
    }

    @Test
    void snapshotAndKeysMergeScopes() {
        ExecutionContext child = root.child(Map.of("count", 4, "extra", "e"));
        assertThat(child.keys()).containsExactly("count", "extra", "user");
        assertThat(child.snapshot()).containsEntry("count", 4).containsKey("user");
    }

    @Test
    void errorStrategyIsInheritedAndOverridable() {
        ExecutionContext strict = ExecutionContext.of(Map.of(), ErrorStrategy.LOG);
        assertThat(strict.child(Map.of()).errorStrategy()).contains(ErrorStrategy.LOG);
        assertThat(strict.withErrorStrategy(ErrorStrategy.REMOVE).errorStrategy()).contains(ErrorStrategy.REMOVE);
        assertThat(ExecutionContext.empty().errorStrategy()).isEmpty();
    }

    @Test
    void unboundContextHasNoCancellation() {
        assertThat(root.cancellationToken()).isSameAs(CancellationToken.none());
    }
}
