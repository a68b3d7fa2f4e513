package org.metaconv.compiler.frontend.normalize.passes;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.metaconv.compiler.frontend.ast.FormattedPrint;
import org.metaconv.compiler.frontend.ast.FunctionCall;
import org.metaconv.compiler.frontend.ast.Literal;
import org.metaconv.compiler.frontend.ast.RawNode;
import org.metaconv.compiler.frontend.ast.Symbol;
import org.metaconv.compiler.frontend.normalize.PrecedenceTier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.metaconv.test.utils.PpiTrees.*;

@Tag("unit")
class ListOperatorPassTest {

    private static final Literal SPACE = Literal.string(" ");

    private final ListOperatorPass pass = new ListOperatorPass();

    @Test
    void tier_isLow() {
        assertThat(pass.tier()).isEqualTo(PrecedenceTier.LOW);
    }

    @Test
    void listOperator_takesTheWholeCommaList() {
        RawNode result = (RawNode) pass.apply(stmt(word("join"), SPACE, op(","), Symbol.valueList()));

        assertThat(result).isEqualTo(stmt(new FunctionCall("join", List.of(SPACE, Symbol.valueList()))));
    }

    @Test
    void listOperator_endsAtStatementModifier() {
        RawNode result = (RawNode) pass.apply(stmt(word("join"), SPACE, op(","), Symbol.valueList(),
                word("if"), Symbol.value()));

        assertThat(result).isEqualTo(stmt(new FunctionCall("join", List.of(SPACE, Symbol.valueList())),
                word("if"), Symbol.value()));
    }

    @Test
    void listOperator_endsAtWordOperator() {
        RawNode result = (RawNode) pass.apply(stmt(word("split"), Literal.regex(",", ""), op(","), Symbol.value(),
                op("or"), Literal.string("none")));

        assertThat(result).isEqualTo(stmt(new FunctionCall("split", List.of(Literal.regex(",", ""), Symbol.value())),
                op("or"), Literal.string("none")));
    }

    @Test
    void sprintfWithoutParentheses_becomesFormattedPrint() {
        RawNode result = (RawNode) pass.apply(stmt(word("sprintf"), Literal.string("%x"), op(","), Symbol.value()));

        assertThat(result).isEqualTo(stmt(new FormattedPrint(Literal.string("%x"), List.of(Symbol.value()))));
    }

    @Test
    void incompleteList_isLeftAlone() {
        RawNode trailingOperator = stmt(word("join"), SPACE, op("+"));
        RawNode noItems = stmt(word("join"), op(","));

        assertThat(pass.apply(trailingOperator)).isSameAs(trailingOperator);
        assertThat(pass.apply(noItems)).isSameAs(noItems);
    }
}
