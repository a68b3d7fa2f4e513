package org.metaconv.compiler.frontend.normalize.passes;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.metaconv.compiler.frontend.ast.BinaryOp;
import org.metaconv.compiler.frontend.ast.ConditionalAssignment;
import org.metaconv.compiler.frontend.ast.FunctionCall;
import org.metaconv.compiler.frontend.ast.Literal;
import org.metaconv.compiler.frontend.ast.NormalizedNode;
import org.metaconv.compiler.frontend.ast.PostfixConditional;
import org.metaconv.compiler.frontend.ast.RawNode;
import org.metaconv.compiler.frontend.ast.SafeDivision;
import org.metaconv.compiler.frontend.ast.Symbol;
import org.metaconv.compiler.frontend.ast.Ternary;
import org.metaconv.compiler.frontend.normalize.PrecedenceTier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.metaconv.test.utils.PpiTrees.*;

/**
 * Tests for the conditional and statement-level passes.
 */
@Tag("unit")
class ConditionalPassesTest {

    private static final Literal ZERO = Literal.number("0");
    private static final Literal ONE = Literal.number("1");
    private static final NormalizedNode RECIPROCAL = new BinaryOp("/", ONE, Symbol.value());
    private static final Literal YES = Literal.string("yes");
    private static final Literal NO = Literal.string("no");

    private final SafeDivisionPass safeDivision = new SafeDivisionPass();
    private final TernaryPass ternary = new TernaryPass();
    private final LogicalWordPass logicalWords = new LogicalWordPass();
    private final PostfixConditionalPass postfix = new PostfixConditionalPass();
    private final ConditionalAssignmentPass assignment = new ConditionalAssignmentPass();

    @Test
    void tiers() {
        assertThat(safeDivision.tier()).isEqualTo(PrecedenceTier.MEDIUM);
        assertThat(ternary.tier()).isEqualTo(PrecedenceTier.MEDIUM);
        assertThat(logicalWords.tier()).isEqualTo(PrecedenceTier.LOW);
        assertThat(postfix.tier()).isEqualTo(PrecedenceTier.LOW);
        assertThat(assignment.tier()).isEqualTo(PrecedenceTier.LOW);
    }

    @Test
    void safeDivision_guardIdiom() {
        RawNode result = (RawNode) safeDivision.apply(stmt(Symbol.value(), op("?"), RECIPROCAL, op(":"), ZERO));

        assertThat(result).isEqualTo(stmt(new SafeDivision(ONE, Symbol.value())));
    }

    @Test
    void safeDivision_requiresGuardToBeTheDivisor() {
        RawNode otherDivisor = stmt(Symbol.value(), op("?"), new BinaryOp("/", ONE, Symbol.element(0)), op(":"), ZERO);
        RawNode otherElse = stmt(Symbol.value(), op("?"), RECIPROCAL, op(":"), ONE);
        RawNode multiplication = stmt(Symbol.value(), op("?"), new BinaryOp("*", ONE, Symbol.value()), op(":"), ZERO);

        assertThat(safeDivision.apply(otherDivisor)).isSameAs(otherDivisor);
        assertThat(safeDivision.apply(otherElse)).isSameAs(otherElse);
        assertThat(safeDivision.apply(multiplication)).isSameAs(multiplication);
    }

    @Test
    void safeDivision_zeroThatStartsAnotherConditional_isLeftToTernary() {
        RawNode run = stmt(Symbol.value(), op("?"), RECIPROCAL, op(":"), ZERO, op("?"), YES, op(":"), NO);

        assertThat(safeDivision.apply(run)).isSameAs(run);
    }

    @Test
    void ternary_simple() {
        RawNode result = (RawNode) ternary.apply(stmt(Symbol.value(), op("?"), YES, op(":"), NO));

        assertThat(result).isEqualTo(stmt(new Ternary(Symbol.value(), YES, NO)));
    }

    @Test
    void ternary_isRightAssociative() {
        Symbol first = Symbol.element(0);
        Symbol second = Symbol.element(1);

        RawNode result = (RawNode) ternary.apply(stmt(first, op("?"), YES, op(":"), second, op("?"), NO, op(":"),
                ZERO));

        assertThat(result).isEqualTo(stmt(new Ternary(first, YES, new Ternary(second, NO, ZERO))));
    }

    @Test
    void ternary_incomplete_isLeftAlone() {
        RawNode run = stmt(Symbol.value(), op("?"), YES);

        assertThat(ternary.apply(run)).isSameAs(run);
    }

    @Test
    void logicalWords_andBindsTighterThanOr() {
        Symbol a = Symbol.element(0);
        Symbol b = Symbol.element(1);
        Symbol c = Symbol.element(2);

        RawNode result = (RawNode) logicalWords.apply(stmt(a, op("or"), b, op("and"), c));

        assertThat(result).isEqualTo(stmt(new BinaryOp("||", a, new BinaryOp("&&", b, c))));
    }

    @Test
    void logicalWords_notAndXor() {
        RawNode negation = (RawNode) logicalWords.apply(stmt(op("not"), Symbol.value()));
        RawNode exclusive = (RawNode) logicalWords.apply(stmt(Symbol.value(), op("xor"), ONE));

        assertThat(negation).isEqualTo(stmt(new FunctionCall("not", List.of(Symbol.value()))));
        assertThat(exclusive).isEqualTo(stmt(new BinaryOp("xor", Symbol.value(), ONE)));
    }

    @Test
    void logicalWords_foldOnlyTheSegmentAfterTheModifier() {
        RawNode result = (RawNode) logicalWords.apply(stmt(YES, word("if"), Symbol.element(0), op("and"),
                Symbol.element(1)));

        assertThat(result).isEqualTo(stmt(YES, word("if"),
                new BinaryOp("&&", Symbol.element(0), Symbol.element(1))));
    }

    @Test
    void logicalWords_danglingOperator_isLeftAlone() {
        RawNode run = stmt(Symbol.value(), op("and"));

        assertThat(logicalWords.apply(run)).isSameAs(run);
    }

    @Test
    void postfix_ifAndUnless() {
        RawNode when = (RawNode) postfix.apply(stmt(YES, word("if"), Symbol.value()));
        RawNode unless = (RawNode) postfix.apply(stmt(YES, word("unless"), Symbol.value()));

        assertThat(when).isEqualTo(stmt(new PostfixConditional(YES, Symbol.value(), false)));
        assertThat(unless).isEqualTo(stmt(new PostfixConditional(YES, Symbol.value(), true)));
    }

    @Test
    void postfix_otherModifiers_areLeftAlone() {
        RawNode loop = stmt(YES, word("while"), Symbol.value());
        RawNode longer = stmt(YES, word("if"), Symbol.value(), op("and"), ONE);

        assertThat(postfix.apply(loop)).isSameAs(loop);
        assertThat(postfix.apply(longer)).isSameAs(longer);
    }

    @Test
    void conditionalAssignment_compoundOperator() {
        NormalizedNode condition = new BinaryOp(">", Symbol.value(), Literal.number("180"));
        RawNode document = doc(stmt(condition, op("and"), Symbol.value(), op("-="), Literal.number("360")),
                Symbol.value());

        assertThat(assignment.apply(document)).isEqualTo(new ConditionalAssignment(condition, Symbol.value(), "-",
                Literal.number("360"), Symbol.value()));
    }

    @Test
    void conditionalAssignment_plainAssignment() {
        RawNode document = doc(stmt(Symbol.value(), op("and"), Symbol.value(), op("="), ONE),
                new BinaryOp("*", Symbol.value(), Literal.number("2")));

        ConditionalAssignment result = (ConditionalAssignment) assignment.apply(document);

        assertThat(result.operator()).isEqualTo("=");
        assertThat(result.value()).isEqualTo(ONE);
        assertThat(result.result()).isEqualTo(new BinaryOp("*", Symbol.value(), Literal.number("2")));
    }

    @Test
    void conditionalAssignment_otherShapes_areLeftAlone() {
        RawNode element = doc(stmt(ONE, op("and"), Symbol.element(0), op("-="), ONE), Symbol.value());
        RawNode orGuard = doc(stmt(ONE, op("or"), Symbol.value(), op("-="), ONE), Symbol.value());
        RawNode notAssignment = doc(stmt(ONE, op("and"), Symbol.value(), op("=="), ONE), Symbol.value());
        RawNode single = doc(stmt(ONE, op("and"), Symbol.value(), op("-="), ONE));

        assertThat(assignment.apply(element)).isSameAs(element);
        assertThat(assignment.apply(orGuard)).isSameAs(orGuard);
        assertThat(assignment.apply(notAssignment)).isSameAs(notAssignment);
        assertThat(assignment.apply(single)).isSameAs(single);
    }
}
