package io.prompty.core.engine;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.prompty.core.model.Node;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A parsed template. Immutable after parsing; one instance can be executed any number of times,
 * concurrently, against different data.
 *
 * <p>
 * Execution errors are thrown as subclasses of
 * {@link io.prompty.core.error.TemplateExecutionException}.
 */
public final class Template {

    private static final Logger LOG = LoggerFactory.getLogger(Template.class);

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final String name;
    private final String source;
    private final List<Node> nodes;
    private final PromptyEngine engine;

    Template(String name, String source, List<Node> nodes, PromptyEngine engine) {
        this.name = name;
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.nodes = List.copyOf(nodes);
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    /** The registry name, or empty for anonymous templates. */
    public Optional<String> name() {
        return Optional.ofNullable(name);
    }

    public String source() {
        return source;
    }

    /** Root nodes of the parsed tree. */
    public List<Node> nodes() {
        return nodes;
    }

    public String execute(Map<String, ?> data) {
        return execute(CancellationToken.none(), data);
    }

    public String execute(CancellationToken token, Map<String, ?> data) {
        Objects.requireNonNull(data, "data must not be null");
        return executeWithContext(token, ExecutionContext.of(data));
    }

    /**
     * Executes against a Jackson tree. The root must be an object; {@code null} or a missing node
     * means no data.
     */
    public String execute(CancellationToken token, JsonNode data) {
        if (data == null || data.isNull() || data.isMissingNode()) {
            return execute(token, Map.of());
        }
        if (!data.isObject()) {
            throw new IllegalArgumentException("data must be a JSON object, got: " + data.getNodeType());
        }
        return execute(token, JSON.convertValue(data, MAP_TYPE));
    }

    /** Executes against a caller-built context. Values set by resolvers remain visible in it. */
    public String executeWithContext(CancellationToken token, ExecutionContext context) {
        Objects.requireNonNull(token, "token must not be null");
        Objects.requireNonNull(context, "context must not be null");
        long start = System.nanoTime();
        String output = new ExecutionSession(engine, token).run(this, context);
        if (LOG.isDebugEnabled()) {
            LOG.debug(
                    "Executed template: name={}, outputChars={}, durationUs={}",
                    name,
                    output.length(),
                    (System.nanoTime() - start) / 1000);
        }
        return output;
    }

    @Override
    public String toString() {
        return "Template[" + (name != null ? name : "<anonymous>") + ", nodes=" + nodes.size() + "]";
    }
}
