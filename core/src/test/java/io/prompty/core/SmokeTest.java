package io.prompty.core;

import static org.assertj.core.api.Assertions.assertThat;

import io.prompty.core.engine.CancellationToken;
import io.prompty.core.engine.PromptyEngine;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Parses and executes the smallest useful template through the public entry point. */
class SmokeTest {

    @Test
    void engineRendersATemplate() {
        String output = new PromptyEngine()
                .execute(CancellationToken.none(), "Hello, {~prompty.var name=\"user\" /~}!", Map.of("user", "Alice"));
        assertThat(output).as("engine renders a variable").isEqualTo("Hello, Alice!");
    }
}
