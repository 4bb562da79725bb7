package io.prompty.core.parse;

import io.prompty.core.error.ExpressionException;
import io.prompty.core.error.ParseException;
import io.prompty.core.expr.CompiledExpression;
import io.prompty.core.model.AttributeNames;
import io.prompty.core.model.Attributes;
import io.prompty.core.model.BlockNode;
import io.prompty.core.model.ConditionalBranch;
import io.prompty.core.model.ConditionalNode;
import io.prompty.core.model.ExtendsNode;
import io.prompty.core.model.LoopNode;
import io.prompty.core.model.Node;
import io.prompty.core.model.ParentNode;
import io.prompty.core.model.Position;
import io.prompty.core.model.RawNode;
import io.prompty.core.model.SwitchCase;
import io.prompty.core.model.SwitchNode;
import io.prompty.core.model.TagNames;
import io.prompty.core.model.TagNode;
import io.prompty.core.model.TextNode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the node tree of a template from its source. Structural rules (balanced tags, branch
 * ordering, required attributes, expression syntax) are checked here, so a successfully parsed
 * tree is always executable.
 *
 * <p>
 * Tags outside the built-in control families are kept as {@link TagNode}s and bound to
 * resolvers only at execution time. Comment blocks are dropped.
 *
 * <p>
 * Inheritance tags are checked structurally: {@code prompty.extends} must be the first tag of the
 * template and appear once, block names are unique per template, and {@code prompty.parent} only
 * appears inside a {@code prompty.block}.
 *
 * <p>
 * Thread-safe: each {@link #parse} call uses its own cursor.
 */
public final class TemplateParser {

    private static final Logger LOG = LoggerFactory.getLogger(TemplateParser.class);

    private static final Set<String> CONDITIONAL_SEPARATORS = Set.of(TagNames.ELSEIF, TagNames.ELSE);

    private final Delimiters delimiters;

    public TemplateParser(Delimiters delimiters) {
        this.delimiters = Objects.requireNonNull(delimiters, "delimiters must not be null");
    }

    /**
     * Parses {@code source} into its root nodes.
     *
     * @throws io.prompty.core.error.LexException   if the source cannot be tokenized
     * @throws ParseException if the token stream is structurally invalid
     */
    public List<Node> parse(String source) {
        Objects.requireNonNull(source, "source must not be null");
        long start = System.nanoTime();
        List<Token> tokens = Lexer.tokenize(source, delimiters);
        List<Node> nodes = new Cursor(source, tokens).parseRoot();
        if (LOG.isDebugEnabled()) {
            LOG.debug(
                    "Parsed template: tokens={}, nodes={}, durationUs={}",
                    tokens.size(),
                    nodes.size(),
                    (System.nanoTime() - start) / 1000);
        }
        return nodes;
    }

    /** An opening tag with its attributes already consumed. */
    private record OpenTag(String name, Attributes attributes, boolean selfClosing, Position position) {}

    /** A parsed body and the token or tag that ended it. */
    private record Body(List<Node> nodes, OpenTag separator, Token close) {}

    private static final class Cursor {

        private final String source;
        private final List<Token> tokens;
        private final Set<String> blockNames = new HashSet<>();
        private int pos;
        private int blockNesting;
        private boolean extendsSeen;

        Cursor(String source, List<Token> tokens) {
            this.source = source;
            this.tokens = tokens;
        }

        List<Node> parseRoot() {
            List<Node> nodes = new ArrayList<>();
            while (peek().kind() != TokenKind.EOF) {
                Token token = peek();
                if (token.kind() == TokenKind.TAG_CLOSE) {
                    throw error(
                            ParseException.Kind.UNEXPECTED_TOKEN,
                            "unexpected closing tag " + token.lexeme() + " with no matching open tag",
                            token.position());
                }
                if (token.kind() == TokenKind.TAG_OPEN && token.lexeme().equals(TagNames.EXTENDS)) {
                    advance();
                    nodes.add(parseExtends(readOpenTag(token), nodes));
                    continue;
                }
                parseNode(nodes);
            }
            return nodes;
        }

        private ExtendsNode parseExtends(OpenTag tag, List<Node> preceding) {
            if (extendsSeen) {
                throw error(
                        ParseException.Kind.INHERITANCE,
                        "only one " + TagNames.EXTENDS + " allowed per template",
                        tag.position());
            }
            boolean first = preceding.stream().allMatch(n -> n instanceof TextNode text && text.text().isBlank());
            if (!first) {
                throw notFirst(tag);
            }
            requireSelfClosing(tag);
            String template = requireAttribute(tag, AttributeNames.TEMPLATE);
            if (template.isBlank()) {
                throw error(
                        ParseException.Kind.INVALID_ATTRIBUTE,
                        TagNames.EXTENDS + " requires a non-empty template",
                        tag.position());
            }
            extendsSeen = true;
            return new ExtendsNode(template, tag.attributes(), rawSince(tag, previousEnd()), tag.position());
        }

        private BlockNode parseBlock(OpenTag tag) {
            requireBlock(tag);
            String name = requireAttribute(tag, AttributeNames.NAME);
            if (!blockNames.add(name)) {
                throw error(ParseException.Kind.INHERITANCE, "duplicate block name: " + name, tag.position());
            }
            blockNesting++;
            Body body = parseBody(tag, Set.of());
            blockNesting--;
            return new BlockNode(name, body.nodes(), rawSince(tag, body.close().end()), tag.position());
        }

        private ParentNode parseParent(OpenTag tag) {
            if (blockNesting == 0) {
                throw error(
                        ParseException.Kind.INHERITANCE,
                        TagNames.PARENT + " can only be used inside " + TagNames.BLOCK,
                        tag.position());
            }
            requireSelfClosing(tag);
            return new ParentNode(tag.position());
        }

        private ParseException notFirst(OpenTag tag) {
            return error(
                    ParseException.Kind.INHERITANCE,
                    TagNames.EXTENDS + " must be the first tag in the template",
                    tag.position());
        }

        /**
         * Parses nodes until the close tag of {@code owner}, or until one of {@code separators}
         * opens at this nesting level.
         */
        private Body parseBody(OpenTag owner, Set<String> separators) {
            List<Node> nodes = new ArrayList<>();
            while (true) {
                Token token = peek();
                switch (token.kind()) {
                    case EOF:
                        throw error(
                                ParseException.Kind.UNCLOSED_TAG,
                                "tag " + owner.name() + " is not closed",
                                owner.position());
                    case TAG_CLOSE:
                        if (!token.lexeme().equals(owner.name())) {
                            throw error(
                                    ParseException.Kind.MISMATCHED_TAG,
                                    "closing tag " + token.lexeme() + " does not match open tag " + owner.name()
                                            + " at " + owner.position(),
                                    token.position());
                        }
                        advance();
                        return new Body(nodes, null, token);
                    case TAG_OPEN:
                        if (separators.contains(token.lexeme())) {
                            advance();
                            OpenTag separator = readOpenTag(token);
                            return new Body(nodes, separator, null);
                        }
                        parseNode(nodes);
                        break;
                    default:
                        parseNode(nodes);
                        break;
                }
            }
        }

        private void parseNode(List<Node> out) {
            Token token = advance();
            switch (token.kind()) {
                case TEXT:
                    out.add(new TextNode(token.lexeme(), token.position()));
                    return;
                case TAG_OPEN:
                    Node node = parseTag(token);
                    if (node != null) {
                        out.add(node);
                    }
                    return;
                default:
                    throw error(
                            ParseException.Kind.UNEXPECTED_TOKEN,
                            "unexpected " + describe(token),
                            token.position());
            }
        }

        private Node parseTag(Token openToken) {
            OpenTag tag = readOpenTag(openToken);
            switch (tag.name()) {
                case TagNames.IF:
                    return parseConditional(tag);
                case TagNames.FOR:
                    return parseLoop(tag);
                case TagNames.SWITCH:
                    return parseSwitch(tag);
                case TagNames.RAW:
                    return parseLiteral(tag, true);
                case TagNames.COMMENT:
                    parseLiteral(tag, false);
                    return null;
                case TagNames.BLOCK:
                    return parseBlock(tag);
                case TagNames.PARENT:
                    return parseParent(tag);
                case TagNames.EXTENDS:
                    throw notFirst(tag);
                case TagNames.ELSEIF:
                case TagNames.ELSE:
                    throw error(
                            ParseException.Kind.CONDITIONAL_ORDER,
                            tag.name() + " outside of " + TagNames.IF,
                            tag.position());
                case TagNames.CASE:
                case TagNames.CASE_DEFAULT:
                    throw error(
                            ParseException.Kind.SWITCH_ORDER,
                            tag.name() + " outside of " + TagNames.SWITCH,
                            tag.position());
                default:
                    if (tag.selfClosing()) {
                        return new TagNode(
                                tag.name(), tag.attributes(), List.of(), true, rawSince(tag, previousEnd()), tag.position());
                    }
                    Body body = parseBody(tag, Set.of());
                    return new TagNode(
                            tag.name(), tag.attributes(), body.nodes(), false, rawSince(tag, body.close().end()),
                            tag.position());
            }
        }

        private ConditionalNode parseConditional(OpenTag ifTag) {
            requireBlock(ifTag);
            List<ConditionalBranch> branches = new ArrayList<>();
            OpenTag current = ifTag;
            while (true) {
                CompiledExpression condition = null;
                if (current.name().equals(TagNames.ELSE)) {
                    if (current.attributes().has(AttributeNames.EVAL)) {
                        throw error(
                                ParseException.Kind.INVALID_ATTRIBUTE,
                                TagNames.ELSE + " must not have an eval attribute",
                                current.position());
                    }
                } else {
                    condition = compile(current, requireAttribute(current, AttributeNames.EVAL));
                }
                Body body = parseBody(ifTag, CONDITIONAL_SEPARATORS);
                branches.add(new ConditionalBranch(condition, body.nodes(), current.position()));
                if (body.close() != null) {
                    return new ConditionalNode(
                            branches, ifTag.attributes(), rawSince(ifTag, body.close().end()), ifTag.position());
                }
                OpenTag next = body.separator();
                if (current.name().equals(TagNames.ELSE)) {
                    throw error(
                            ParseException.Kind.CONDITIONAL_ORDER,
                            TagNames.ELSE + " must be the last branch of " + TagNames.IF + ", found " + next.name(),
                            next.position());
                }
                current = next;
            }
        }

        private LoopNode parseLoop(OpenTag tag) {
            requireBlock(tag);
            String item = requireAttribute(tag, AttributeNames.ITEM);
            String collection = requireAttribute(tag, AttributeNames.IN);
            String index = tag.attributes().get(AttributeNames.INDEX).orElse(null);
            int limit = -1;
            if (tag.attributes().has(AttributeNames.LIMIT)) {
                String raw = tag.attributes().getOrDefault(AttributeNames.LIMIT, "").trim();
                try {
                    limit = Integer.parseInt(raw);
                } catch (NumberFormatException e) {
                    throw error(
                            ParseException.Kind.INVALID_ATTRIBUTE,
                            "limit must be a non-negative integer, got: " + raw,
                            e,
                            tag.position());
                }
                if (limit < 0) {
                    throw error(
                            ParseException.Kind.INVALID_ATTRIBUTE,
                            "limit must be a non-negative integer, got: " + raw,
                            tag.position());
                }
            }
            Body body = parseBody(tag, Set.of());
            return new LoopNode(
                    item,
                    index,
                    collection,
                    limit,
                    body.nodes(),
                    tag.attributes(),
                    rawSince(tag, body.close().end()),
                    tag.position());
        }

        private SwitchNode parseSwitch(OpenTag tag) {
            requireBlock(tag);
            CompiledExpression expression = compile(tag, requireAttribute(tag, AttributeNames.EVAL));
            List<SwitchCase> cases = new ArrayList<>();
            List<Node> defaultBody = null;
            while (true) {
                Token token = advance();
                switch (token.kind()) {
                    case EOF:
                        throw error(ParseException.Kind.UNCLOSED_TAG, "tag " + tag.name() + " is not closed", tag.position());
                    case TEXT:
                        if (!token.lexeme().isBlank()) {
                            throw error(
                                    ParseException.Kind.UNEXPECTED_TOKEN,
                                    "unexpected text inside " + TagNames.SWITCH,
                                    token.position());
                        }
                        break;
                    case TAG_CLOSE:
                        if (!token.lexeme().equals(tag.name())) {
                            throw error(
                                    ParseException.Kind.MISMATCHED_TAG,
                                    "closing tag " + token.lexeme() + " does not match open tag " + tag.name(),
                                    token.position());
                        }
                        return new SwitchNode(
                                expression, cases, defaultBody, tag.attributes(), rawSince(tag, token.end()),
                                tag.position());
                    case TAG_OPEN:
                        OpenTag child = readOpenTag(token);
                        if (child.name().equals(TagNames.COMMENT)) {
                            parseLiteral(child, false);
                        } else if (child.name().equals(TagNames.CASE)) {
                            if (defaultBody != null) {
                                throw error(
                                        ParseException.Kind.SWITCH_ORDER,
                                        "default case must be last in switch",
                                        child.position());
                            }
                            cases.add(parseCase(child));
                        } else if (child.name().equals(TagNames.CASE_DEFAULT)) {
                            if (defaultBody != null) {
                                throw error(
                                        ParseException.Kind.SWITCH_ORDER,
                                        "only one default case allowed in switch",
                                        child.position());
                            }
                            defaultBody = child.selfClosing() ? List.of() : parseBody(child, Set.of()).nodes();
                        } else {
                            throw error(
                                    ParseException.Kind.UNEXPECTED_TOKEN,
                                    "unexpected tag " + child.name() + " inside " + TagNames.SWITCH
                                            + ", expected " + TagNames.CASE + " or " + TagNames.CASE_DEFAULT,
                                    child.position());
                        }
                        break;
                    default:
                        throw error(ParseException.Kind.UNEXPECTED_TOKEN, "unexpected " + describe(token), token.position());
                }
            }
        }

        private SwitchCase parseCase(OpenTag tag) {
            boolean hasValue = tag.attributes().has(AttributeNames.VALUE);
            boolean hasEval = tag.attributes().has(AttributeNames.EVAL);
            if (hasValue && hasEval) {
                throw error(
                        ParseException.Kind.AMBIGUOUS_CASE,
                        TagNames.CASE + " must not have both value and eval",
                        tag.position());
            }
            if (!hasValue && !hasEval) {
                throw error(
                        ParseException.Kind.MISSING_ATTRIBUTE,
                        TagNames.CASE + " requires a value or eval attribute",
                        tag.position());
            }
            List<Node> body = tag.selfClosing() ? List.of() : parseBody(tag, Set.of()).nodes();
            if (hasValue) {
                return new SwitchCase(tag.attributes().getOrDefault(AttributeNames.VALUE, ""), null, body, tag.position());
            }
            return new SwitchCase(null, compile(tag, tag.attributes().getOrDefault(AttributeNames.EVAL, "")), body, tag.position());
        }

        private RawNode parseLiteral(OpenTag tag, boolean keep) {
            if (tag.selfClosing()) {
                return keep ? new RawNode("", tag.position()) : null;
            }
            Token body = advance();
            if (body.kind() != TokenKind.LITERAL_BODY) {
                throw error(ParseException.Kind.UNEXPECTED_TOKEN, "unexpected " + describe(body), body.position());
            }
            Token close = advance();
            if (close.kind() != TokenKind.TAG_CLOSE) {
                throw error(ParseException.Kind.UNCLOSED_TAG, "tag " + tag.name() + " is not closed", tag.position());
            }
            return keep ? new RawNode(body.lexeme(), body.position()) : null;
        }

        private OpenTag readOpenTag(Token openToken) {
            Map<String, String> attributes = new LinkedHashMap<>();
            while (true) {
                Token token = advance();
                switch (token.kind()) {
                    case ATTRIBUTE_KEY:
                        Token value = advance();
                        if (value.kind() != TokenKind.ATTRIBUTE_VALUE) {
                            throw error(
                                    ParseException.Kind.UNEXPECTED_TOKEN,
                                    "expected value for attribute " + token.lexeme(),
                                    value.position());
                        }
                        if (attributes.containsKey(token.lexeme())) {
                            throw error(
                                    ParseException.Kind.INVALID_ATTRIBUTE,
                                    "duplicate attribute " + token.lexeme() + " on " + openToken.lexeme(),
                                    token.position());
                        }
                        attributes.put(token.lexeme(), value.lexeme());
                        break;
                    case TAG_END:
                        return new OpenTag(openToken.lexeme(), Attributes.of(attributes), false, openToken.position());
                    case SELF_CLOSE:
                        return new OpenTag(openToken.lexeme(), Attributes.of(attributes), true, openToken.position());
                    default:
                        throw error(
                                ParseException.Kind.UNEXPECTED_TOKEN,
                                "unexpected " + describe(token) + " in tag " + openToken.lexeme(),
                                token.position());
                }
            }
        }

        private void requireBlock(OpenTag tag) {
            if (tag.selfClosing()) {
                throw error(
                        ParseException.Kind.UNEXPECTED_TOKEN,
                        tag.name() + " must be a block tag with a matching close tag",
                        tag.position());
            }
        }

        private void requireSelfClosing(OpenTag tag) {
            if (!tag.selfClosing()) {
                throw error(
                        ParseException.Kind.UNEXPECTED_TOKEN,
                        tag.name() + " must be self-closing",
                        tag.position());
            }
        }

        private String requireAttribute(OpenTag tag, String name) {
            return tag.attributes()
                    .get(name)
                    .orElseThrow(() -> error(
                            ParseException.Kind.MISSING_ATTRIBUTE,
                            tag.name() + " requires attribute " + name,
                            tag.position()));
        }

        private CompiledExpression compile(OpenTag tag, String text) {
            try {
                return CompiledExpression.compile(text);
            } catch (ExpressionException e) {
                throw error(
                        ParseException.Kind.INVALID_EXPRESSION,
                        "invalid expression in " + tag.name() + ": " + e.detail(),
                        e,
                        tag.position());
            }
        }

        private String rawSince(OpenTag tag, int end) {
            return source.substring(tag.position().offset(), end);
        }

        private int previousEnd() {
            return tokens.get(pos - 1).end();
        }

        private Token peek() {
            return tokens.get(pos);
        }

        private Token advance() {
            Token token = tokens.get(pos);
            if (token.kind() != TokenKind.EOF) {
                pos++;
            }
            return token;
        }

        private static String describe(Token token) {
            return switch (token.kind()) {
                case EOF -> "end of input";
                case TAG_CLOSE -> "closing tag " + token.lexeme();
                case TAG_OPEN -> "tag " + token.lexeme();
                default -> token.kind().name().toLowerCase() + " '" + token.lexeme() + "'";
            };
        }

        private ParseException error(ParseException.Kind kind, String detail, Position position) {
            return new ParseException(kind, detail, position, snippet(position));
        }

        private ParseException error(ParseException.Kind kind, String detail, Throwable cause, Position position) {
            return new ParseException(kind, detail, cause, position, snippet(position));
        }

        private String snippet(Position position) {
            if (!position.isKnown()) {
                return null;
            }
            int start = position.offset();
            return source.substring(start, Math.min(source.length(), start + 40));
        }
    }
}
