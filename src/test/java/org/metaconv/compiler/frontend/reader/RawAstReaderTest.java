package org.metaconv.compiler.frontend.reader;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.metaconv.compiler.frontend.ast.RawKind;
import org.metaconv.compiler.frontend.ast.RawNode;
import org.metaconv.test.utils.PpiJson;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.metaconv.test.utils.PpiTrees.*;

/**
 * Tests for the {@link RawAstReader}, reading PPI JSON into raw trees.
 */
@Tag("unit")
class RawAstReaderTest {

    private final RawAstReader reader = new RawAstReader();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void read_roundTripsTreesWithWhitespace() throws Exception {
        RawNode tree = sprintfMillimetres();

        RawNode read = reader.read(PpiJson.toJson(tree, true));

        assertThat(read).isEqualTo(tree);
    }

    @Test
    void read_handwrittenDocument() throws Exception {
        JsonNode json = mapper.readTree("""
                {"class": "PPI::Document", "children": [
                  {"class": "PPI::Statement", "children": [
                    {"class": "PPI::Token::Symbol", "content": "$val"},
                    {"class": "PPI::Token::Whitespace", "content": " "},
                    {"class": "PPI::Token::Operator", "content": "*"},
                    {"class": "PPI::Token::Comment", "content": "# scale"},
                    {"class": "PPI::Token::Number::Float", "content": "2.5"}
                  ]}
                ]}
                """);

        RawNode read = reader.read(json);

        assertThat(read).isEqualTo(statement(sym("$val"), op("*"), num("2.5")));
    }

    @Test
    void read_quotesWithoutStringValue_areUnquoted() throws Exception {
        JsonNode json = mapper.readTree("""
                {"class": "PPI::Statement", "children": [
                  {"class": "PPI::Token::Quote::Double", "content": "\\"%d mm\\""},
                  {"class": "PPI::Token::Quote::Single", "content": "'n/a'"},
                  {"class": "PPI::Token::Quote::Interpolate", "content": "qq{$val}"},
                  {"class": "PPI::Token::Quote::Literal", "content": "q(x)"}
                ]}
                """);

        RawNode read = reader.read(json);

        assertThat(read).isEqualTo(stmt(dq("%d mm"), sq("n/a"), dq("$val"), sq("x")));
    }

    @Test
    void read_structuresTakeTheirOpeningBracket() throws Exception {
        JsonNode json = mapper.readTree("""
                {"class": "PPI::Statement", "children": [
                  {"class": "PPI::Token::Symbol", "content": "$val"},
                  {"class": "PPI::Structure::Subscript", "structure_bounds": "[ ... ]", "children": [
                    {"class": "PPI::Statement::Expression", "children": [
                      {"class": "PPI::Token::Number", "content": "1"}
                    ]}
                  ]},
                  {"class": "PPI::Structure::List", "children": []}
                ]}
                """);

        RawNode read = reader.read(json);

        assertThat(read).isEqualTo(stmt(sym("$val"), subscript("[", expr(num("1"))), list()));
    }

    @Test
    void read_unknownClass_fails() throws Exception {
        JsonNode json = mapper.readTree("""
                {"class": "PPI::Statement", "children": [{"class": "PPI::Token::HereDoc", "content": "<<EOF"}]}
                """);

        assertThatThrownBy(() -> reader.read(json))
                .isInstanceOf(ParseInputException.class)
                .hasMessageContaining("PPI::Token::HereDoc")
                .hasMessageContaining("$.children[0]");
    }

    @Test
    void read_malformedNodes_fail() throws Exception {
        assertThatThrownBy(() -> reader.read(NullNode.getInstance()))
                .isInstanceOf(ParseInputException.class)
                .hasMessage("Missing AST");
        assertThatThrownBy(() -> reader.read(mapper.readTree("[1, 2]")))
                .isInstanceOf(ParseInputException.class)
                .hasMessageContaining("Expected an object");
        assertThatThrownBy(() -> reader.read(mapper.readTree("{\"content\": \"$val\"}")))
                .isInstanceOf(ParseInputException.class)
                .hasMessageContaining("has no class");
        assertThatThrownBy(() -> reader.read(mapper.readTree("{\"class\": \"PPI::Token::Symbol\"}")))
                .isInstanceOf(ParseInputException.class)
                .hasMessageContaining("has no content");
        assertThatThrownBy(() -> reader.read(mapper.readTree(
                "{\"class\": \"PPI::Document\", \"children\": {\"class\": \"PPI::Statement\"}}")))
                .isInstanceOf(ParseInputException.class)
                .hasMessageContaining("is not an array");
        assertThatThrownBy(() -> reader.read(mapper.readTree(
                "{\"class\": \"PPI::Token::Whitespace\", \"content\": \" \"}")))
                .isInstanceOf(ParseInputException.class)
                .hasMessageContaining("whitespace");
    }

    @Test
    void read_tokenWithChildren_fails() throws Exception {
        JsonNode json = mapper.readTree("""
                {"class": "PPI::Token::Word", "content": "int",
                 "children": [{"class": "PPI::Token::Symbol", "content": "$val"}]}
                """);

        assertThatThrownBy(() -> reader.read(json))
                .isInstanceOf(ParseInputException.class)
                .hasMessageContaining("has children");
    }

    @Test
    void read_compoundStatements_areKeptRaw() throws Exception {
        JsonNode json = mapper.readTree("""
                {"class": "PPI::Statement::Compound", "children": [
                  {"class": "PPI::Token::Word", "content": "if"},
                  {"class": "PPI::Structure::Condition", "children": []},
                  {"class": "PPI::Structure::Block", "children": []}
                ]}
                """);

        RawNode read = reader.read(json);

        assertThat(read.kind()).isEqualTo(RawKind.COMPOUND);
        assertThat(read.children().stream().map(c -> ((RawNode) c).content()).toList()).containsExactly("if", "(", "{");
    }
}
