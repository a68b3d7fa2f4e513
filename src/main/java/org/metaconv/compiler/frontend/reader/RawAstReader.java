package org.metaconv.compiler.frontend.reader;

import com.fasterxml.jackson.databind.JsonNode;
import org.metaconv.compiler.frontend.ast.AstNode;
import org.metaconv.compiler.frontend.ast.RawKind;
import org.metaconv.compiler.frontend.ast.RawNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts the PPI tree JSON emitted by the upstream field extractor into {@link RawNode}s.
 * <p>
 * Each JSON node carries {@code class} (the PPI class name), an optional {@code content}, optional
 * {@code children} and, depending on the class, {@code string_value} or {@code structure_bounds}.
 * Whitespace, comments and POD are dropped. This class is stateless and thread-safe.
 */
public class RawAstReader {

    private static final Map<String, RawKind> CLASS_KINDS = Map.ofEntries(
            Map.entry("PPI::Document", RawKind.DOCUMENT),
            Map.entry("PPI::Document::Fragment", RawKind.DOCUMENT),
            Map.entry("PPI::Statement", RawKind.STATEMENT),
            Map.entry("PPI::Statement::Break", RawKind.STATEMENT),
            Map.entry("PPI::Statement::Variable", RawKind.STATEMENT),
            Map.entry("PPI::Statement::Null", RawKind.STATEMENT),
            Map.entry("PPI::Statement::Expression", RawKind.EXPRESSION),
            Map.entry("PPI::Statement::Compound", RawKind.COMPOUND),
            Map.entry("PPI::Structure::List", RawKind.LIST),
            Map.entry("PPI::Structure::Subscript", RawKind.SUBSCRIPT),
            Map.entry("PPI::Structure::Block", RawKind.BLOCK),
            Map.entry("PPI::Structure::Constructor", RawKind.CONSTRUCTOR),
            Map.entry("PPI::Structure::Condition", RawKind.CONDITION),
            Map.entry("PPI::Token::Word", RawKind.WORD),
            Map.entry("PPI::Token::Symbol", RawKind.SYMBOL),
            Map.entry("PPI::Token::ArrayIndex", RawKind.SYMBOL),
            Map.entry("PPI::Token::Magic", RawKind.MAGIC),
            Map.entry("PPI::Token::Cast", RawKind.CAST),
            Map.entry("PPI::Token::Operator", RawKind.OPERATOR),
            Map.entry("PPI::Token::Number", RawKind.NUMBER),
            Map.entry("PPI::Token::Number::Float", RawKind.NUMBER),
            Map.entry("PPI::Token::Number::Hex", RawKind.NUMBER),
            Map.entry("PPI::Token::Number::Octal", RawKind.NUMBER),
            Map.entry("PPI::Token::Number::Binary", RawKind.NUMBER),
            Map.entry("PPI::Token::Number::Exp", RawKind.NUMBER),
            Map.entry("PPI::Token::Quote::Double", RawKind.QUOTE_DOUBLE),
            Map.entry("PPI::Token::Quote::Interpolate", RawKind.QUOTE_DOUBLE),
            Map.entry("PPI::Token::Quote::Single", RawKind.QUOTE_SINGLE),
            Map.entry("PPI::Token::Quote::Literal", RawKind.QUOTE_SINGLE),
            Map.entry("PPI::Token::Regexp::Match", RawKind.REGEX_MATCH),
            Map.entry("PPI::Token::Regexp::Substitute", RawKind.REGEX_SUBSTITUTE),
            Map.entry("PPI::Token::Regexp::Transliterate", RawKind.TRANSLITERATE),
            Map.entry("PPI::Token::Structure", RawKind.STRUCTURE)
    );

    private static final List<String> IGNORED_CLASSES = List.of(
            "PPI::Token::Whitespace", "PPI::Token::Comment", "PPI::Token::Pod", "PPI::Token::End");

    /**
     * Reads one expression tree.
     *
     * @param json The tree root, normally a {@code PPI::Document}.
     * @return The raw tree.
     * @throws ParseInputException if the JSON is not a well-formed PPI tree.
     */
    public RawNode read(JsonNode json) throws ParseInputException {
        if (json == null || json.isNull() || json.isMissingNode()) {
            throw new ParseInputException("Missing AST");
        }
        AstNode node = readNode(json, "$");
        if (node == null) {
            throw new ParseInputException("AST root is whitespace or a comment");
        }
        return (RawNode) node;
    }

    private RawNode readNode(JsonNode json, String path) throws ParseInputException {
        if (!json.isObject()) {
            throw new ParseInputException("Expected an object at " + path + " but found " + json.getNodeType());
        }
        JsonNode classNode = json.get("class");
        if (classNode == null || !classNode.isTextual()) {
            throw new ParseInputException("Node at " + path + " has no class");
        }
        String className = classNode.asText();
        if (IGNORED_CLASSES.contains(className)) {
            return null;
        }
        RawKind kind = CLASS_KINDS.get(className);
        if (kind == null) {
            throw new ParseInputException("Unknown PPI class " + className + " at " + path);
        }

        List<AstNode> children = new ArrayList<>();
        JsonNode childrenNode = json.get("children");
        if (childrenNode != null && !childrenNode.isNull()) {
            if (!childrenNode.isArray()) {
                throw new ParseInputException("children of " + className + " at " + path + " is not an array");
            }
            for (int i = 0; i < childrenNode.size(); i++) {
                RawNode child = readNode(childrenNode.get(i), path + ".children[" + i + "]");
                if (child != null) {
                    children.add(child);
                }
            }
        }
        if (kind.isToken() && !children.isEmpty()) {
            throw new ParseInputException("Token " + className + " at " + path + " has children");
        }
        return new RawNode(kind, content(kind, json, path), children);
    }

    private String content(RawKind kind, JsonNode json, String path) throws ParseInputException {
        String content = json.path("content").asText("");
        switch (kind) {
            case QUOTE_DOUBLE, QUOTE_SINGLE -> {
                JsonNode stringValue = json.get("string_value");
                return stringValue != null && stringValue.isTextual() ? stringValue.asText() : unquote(content, path);
            }
            case LIST, SUBSCRIPT, BLOCK, CONSTRUCTOR, CONDITION -> {
                String bounds = json.path("structure_bounds").asText(content);
                return bounds.isEmpty() ? defaultOpening(kind) : bounds.substring(0, 1);
            }
            case WORD, SYMBOL, MAGIC, CAST, OPERATOR, NUMBER, REGEX_MATCH, REGEX_SUBSTITUTE, TRANSLITERATE -> {
                if (content.isEmpty()) {
                    throw new ParseInputException(kind + " token at " + path + " has no content");
                }
                return content;
            }
            default -> {
                return content;
            }
        }
    }

    private static String defaultOpening(RawKind kind) {
        return switch (kind) {
            case LIST, CONDITION -> "(";
            case BLOCK -> "{";
            default -> "";
        };
    }

    /**
     * Strips quote delimiters from {@code "..."}, {@code '...'}, {@code qq{...}} and {@code q{...}}.
     */
    static String unquote(String quoted, String path) throws ParseInputException {
        String body = quoted;
        if (body.startsWith("qq")) {
            body = body.substring(2);
        } else if (body.startsWith("q")) {
            body = body.substring(1);
        }
        if (body.length() < 2) {
            throw new ParseInputException("Malformed quote " + quoted + " at " + path);
        }
        return body.substring(1, body.length() - 1);
    }
}
