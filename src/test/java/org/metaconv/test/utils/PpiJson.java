package org.metaconv.test.utils;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.metaconv.compiler.api.UsageSite;
import org.metaconv.compiler.frontend.ast.AstNode;
import org.metaconv.compiler.frontend.ast.RawNode;

/**
 * Renders raw trees as the PPI JSON the upstream field extractor writes, so reader and end-to-end tests can
 * start from {@link PpiTrees} instead of hand-written JSON.
 */
public final class PpiJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private PpiJson() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static ObjectNode toJson(RawNode node) {
        return toJson(node, false);
    }

    /**
     * @param withWhitespace Inserts a {@code PPI::Token::Whitespace} between sibling nodes, as PPI does.
     */
    public static ObjectNode toJson(RawNode node, boolean withWhitespace) {
        ObjectNode json = MAPPER.createObjectNode();
        json.put("class", className(node));
        switch (node.kind()) {
            case QUOTE_DOUBLE -> {
                json.put("content", "\"" + node.content() + "\"");
                json.put("string_value", node.content());
            }
            case QUOTE_SINGLE -> {
                json.put("content", "'" + node.content() + "'");
                json.put("string_value", node.content());
            }
            case LIST, SUBSCRIPT, BLOCK, CONSTRUCTOR, CONDITION -> json.put("structure_bounds", bounds(node.content()));
            default -> {
                if (!node.content().isEmpty()) {
                    json.put("content", node.content());
                }
            }
        }
        if (!node.kind().isToken()) {
            ArrayNode children = json.putArray("children");
            for (int i = 0; i < node.children().size(); i++) {
                AstNode child = node.children().get(i);
                if (!(child instanceof RawNode raw)) {
                    throw new IllegalArgumentException("Only raw trees can be rendered: " + child);
                }
                if (withWhitespace && i > 0) {
                    children.add(whitespace());
                }
                children.add(toJson(raw, withWhitespace));
            }
        }
        return json;
    }

    /**
     * One corpus record in the camel-case layout.
     */
    public static ObjectNode record(String expressionType, String originalText, RawNode ast, UsageSite usage) {
        ObjectNode json = MAPPER.createObjectNode();
        json.put("expressionType", expressionType);
        json.put("originalText", originalText);
        json.set("parsedAst", ast != null ? toJson(ast, true) : null);
        if (usage != null) {
            ObjectNode site = json.putObject("usage");
            site.put("module", usage.module());
            site.put("table", usage.table());
            site.put("tag", usage.tag());
        }
        return json;
    }

    public static ObjectNode whitespace() {
        ObjectNode json = MAPPER.createObjectNode();
        json.put("class", "PPI::Token::Whitespace");
        json.put("content", " ");
        return json;
    }

    private static String bounds(String open) {
        return switch (open) {
            case "[" -> "[ ... ]";
            case "{" -> "{ ... }";
            default -> "( ... )";
        };
    }

    private static String className(RawNode node) {
        return switch (node.kind()) {
            case DOCUMENT -> "PPI::Document";
            case STATEMENT -> "PPI::Statement";
            case EXPRESSION -> "PPI::Statement::Expression";
            case COMPOUND -> "PPI::Statement::Compound";
            case LIST -> "PPI::Structure::List";
            case SUBSCRIPT -> "PPI::Structure::Subscript";
            case BLOCK -> "PPI::Structure::Block";
            case CONSTRUCTOR -> "PPI::Structure::Constructor";
            case CONDITION -> "PPI::Structure::Condition";
            case WORD -> "PPI::Token::Word";
            case SYMBOL -> "PPI::Token::Symbol";
            case MAGIC -> "PPI::Token::Magic";
            case CAST -> "PPI::Token::Cast";
            case OPERATOR -> "PPI::Token::Operator";
            case NUMBER -> node.content().contains(".") ? "PPI::Token::Number::Float" : "PPI::Token::Number";
            case QUOTE_DOUBLE -> "PPI::Token::Quote::Double";
            case QUOTE_SINGLE -> "PPI::Token::Quote::Single";
            case REGEX_MATCH -> "PPI::Token::Regexp::Match";
            case REGEX_SUBSTITUTE -> "PPI::Token::Regexp::Substitute";
            case TRANSLITERATE -> "PPI::Token::Regexp::Transliterate";
            case STRUCTURE -> "PPI::Token::Structure";
            case ARGUMENTS -> throw new IllegalArgumentException("ARGUMENTS nodes never come from PPI");
        };
    }
}
