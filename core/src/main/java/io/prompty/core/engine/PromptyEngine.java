package io.prompty.core.engine;

import io.prompty.core.engine.builtin.BuiltinFunctions;
import io.prompty.core.engine.builtin.EnvResolver;
import io.prompty.core.engine.builtin.VarResolver;
import io.prompty.core.error.RegistrationException;
import io.prompty.core.model.Node;
import io.prompty.core.model.ValidationResult;
import io.prompty.core.parse.TemplateParser;
import io.prompty.core.spi.Resolver;
import io.prompty.core.spi.TemplateFunction;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the templating engine. Owns the resolver, function and template registries and
 * the options every parse and execution uses.
 *
 * <p>
 * Thread-safe: templates parsed by one engine can be executed concurrently, and registration can
 * happen while executions run. Each execution must use its own {@link ExecutionContext}.
 *
 * <p>
 * Registration methods come in two forms: {@code registerX} throws a
 * {@link RegistrationException} on a name collision or reserved name, {@code tryRegisterX}
 * returns {@code false} instead. The first registration of a name always wins.
 */
public final class PromptyEngine {

    private static final Logger LOG = LoggerFactory.getLogger(PromptyEngine.class);

    private final EngineOptions options;
    private final TemplateParser parser;
    private final ResolverRegistry resolvers = new ResolverRegistry();
    private final FunctionRegistry functions = new FunctionRegistry();
    private final TemplateRegistry templates = new TemplateRegistry();

    /** Creates an engine with {@link EngineOptions#DEFAULT}. */
    public PromptyEngine() {
        this(EngineOptions.DEFAULT);
    }

    public PromptyEngine(EngineOptions options) {
        this(options, Clock.systemUTC());
    }

    /** Creates an engine whose {@code now()} function reads {@code clock}. */
    public PromptyEngine(EngineOptions options, Clock clock) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
        this.parser = new TemplateParser(options.delimiters());
        resolvers.registerBuiltin(new VarResolver());
        resolvers.registerBuiltin(new IncludeResolver());
        resolvers.registerBuiltin(new EnvResolver(options.environment()));
        BuiltinFunctions.all(clock).forEach(functions::registerBuiltin);
        LOG.info(
                "Engine created: delimiters={}{}, defaultErrorStrategy={}, maxDepth={}, functions={}",
                options.delimiters().open(),
                options.delimiters().close(),
                options.defaultErrorStrategy().attributeValue(),
                options.limits().maxDepth(),
                functions.size());
    }

    // --- parsing and execution ---

    /**
     * Parses an anonymous template.
     *
     * @throws io.prompty.core.error.TemplateParseException if the source is malformed
     */
    public Template parse(String source) {
        return parse(null, source);
    }

    /** Parses a template carrying {@code name} without registering it. */
    public Template parse(String name, String source) {
        Objects.requireNonNull(source, "source must not be null");
        List<Node> nodes = parser.parse(source);
        return new Template(name, source, nodes, this);
    }

    /** Parses and executes {@code source} in one step. */
    public String execute(CancellationToken token, String source, Map<String, ?> data) {
        return parse(source).execute(token, data);
    }

    /**
     * Executes a registered template.
     *
     * @throws IllegalArgumentException if no template is registered under {@code name}
     */
    public String executeTemplate(CancellationToken token, String name, Map<String, ?> data) {
        Template template = templates.get(name)
                .orElseThrow(() -> new IllegalArgumentException("No template registered with name: '" + name + "'"));
        return template.execute(token, data);
    }

    /** Checks source for problems without executing it. */
    public ValidationResult validate(String source) {
        Objects.requireNonNull(source, "source must not be null");
        return new TemplateValidator(this).validate(source);
    }

    // --- resolvers ---

    public void registerResolver(Resolver resolver) {
        resolvers.register(resolver);
    }

    public boolean tryRegisterResolver(Resolver resolver) {
        return resolvers.tryRegister(resolver);
    }

    public boolean unregisterResolver(String tagName) {
        return resolvers.unregister(tagName);
    }

    public boolean hasResolver(String tagName) {
        return resolvers.has(tagName);
    }

    public List<String> listResolvers() {
        return resolvers.names();
    }

    public int resolverCount() {
        return resolvers.size();
    }

    // --- functions ---

    public void registerFunction(TemplateFunction function) {
        functions.register(function);
    }

    public boolean tryRegisterFunction(TemplateFunction function) {
        return functions.tryRegister(function);
    }

    public boolean unregisterFunction(String name) {
        return functions.unregister(name);
    }

    public boolean hasFunction(String name) {
        return functions.has(name);
    }

    public List<String> listFunctions() {
        return functions.names();
    }

    public int functionCount() {
        return functions.size();
    }

    // --- templates ---

    /**
     * Parses {@code source} and registers it under {@code name}.
     *
     * @throws io.prompty.core.error.TemplateParseException if the source is malformed
     * @throws RegistrationException if the name is taken or reserved
     */
    public Template registerTemplate(String name, String source) {
        Template template = parse(name, source);
        templates.register(name, template);
        return template;
    }

    /** Like {@link #registerTemplate} but reports a name collision by returning {@code false}. */
    public boolean tryRegisterTemplate(String name, String source) {
        return templates.tryRegister(name, parse(name, source));
    }

    public boolean unregisterTemplate(String name) {
        return templates.unregister(name);
    }

    public boolean hasTemplate(String name) {
        return templates.has(name);
    }

    public List<String> listTemplates() {
        return templates.names();
    }

    public int templateCount() {
        return templates.size();
    }

    public EngineOptions options() {
        return options;
    }

    ResolverRegistry resolvers() {
        return resolvers;
    }

    FunctionRegistry functions() {
        return functions;
    }

    TemplateRegistry templates() {
        return templates;
    }

    TemplateParser parser() {
        return parser;
    }
}
