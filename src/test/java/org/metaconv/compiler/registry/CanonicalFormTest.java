package org.metaconv.compiler.registry;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.metaconv.compiler.frontend.ast.BinaryOp;
import org.metaconv.compiler.frontend.ast.FunctionCall;
import org.metaconv.compiler.frontend.ast.Literal;
import org.metaconv.compiler.frontend.ast.StringConcat;
import org.metaconv.compiler.frontend.ast.Symbol;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the {@link CanonicalForm} used as the deduplication key.
 */
@Tag("unit")
class CanonicalFormTest {

    @Test
    void of_rendersSExpression() {
        String form = CanonicalForm.of(new BinaryOp("*", Symbol.value(), Literal.number("25")));

        assertEquals("(BinaryOp \"*\" (Symbol VALUE \"val\" 0) (Literal NUMBER \"25\" \"\"))", form);
    }

    @Test
    void of_equalTreesGiveEqualForms() {
        FunctionCall a = new FunctionCall("int", List.of(new BinaryOp("/", Symbol.value(), Literal.number("8"))));
        FunctionCall b = new FunctionCall("int", List.of(new BinaryOp("/", Symbol.value(), Literal.number("8"))));

        assertEquals(CanonicalForm.of(a), CanonicalForm.of(b));
    }

    @Test
    void of_distinguishesKindsAndShapes() {
        assertNotEquals(CanonicalForm.of(Literal.number("1")), CanonicalForm.of(Literal.string("1")));
        assertNotEquals(
                CanonicalForm.of(new StringConcat(List.of(Symbol.value(), Literal.string("a")))),
                CanonicalForm.of(new BinaryOp(".", Symbol.value(), Literal.string("a"))));
        assertNotEquals(CanonicalForm.of(Symbol.element(0)), CanonicalForm.of(Symbol.element(1)));
    }

    @Test
    void of_quotesTextUnambiguously() {
        assertEquals("(Literal STRING \"a\\\"b\" \"\")", CanonicalForm.of(Literal.string("a\"b")));
        assertNotEquals(CanonicalForm.of(Literal.string("a\\")), CanonicalForm.of(Literal.string("a\\\\")));
    }

    @Test
    void quote_escapesBackslashBeforeQuote() {
        assertEquals("\"\\\\\\\"\"", CanonicalForm.quote("\\\""));
    }
}
