package org.metaconv.compiler.frontend.normalize;

import org.metaconv.compiler.frontend.normalize.passes.ArgumentListPass;
import org.metaconv.compiler.frontend.normalize.passes.BinaryOperatorPass;
import org.metaconv.compiler.frontend.normalize.passes.ConditionalAssignmentPass;
import org.metaconv.compiler.frontend.normalize.passes.FormattedPrintPass;
import org.metaconv.compiler.frontend.normalize.passes.FunctionCallPass;
import org.metaconv.compiler.frontend.normalize.passes.ListOperatorPass;
import org.metaconv.compiler.frontend.normalize.passes.LogicalWordPass;
import org.metaconv.compiler.frontend.normalize.passes.PostfixConditionalPass;
import org.metaconv.compiler.frontend.normalize.passes.SafeDivisionPass;
import org.metaconv.compiler.frontend.normalize.passes.StringConcatPass;
import org.metaconv.compiler.frontend.normalize.passes.StringRepeatPass;
import org.metaconv.compiler.frontend.normalize.passes.TermPass;
import org.metaconv.compiler.frontend.normalize.passes.TernaryPass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Holds the normalizer passes in declaration order.
 * <p>
 * Declaration order only decides the order among passes of the same tier; the
 * {@link AstNormalizer} sorts by tier. Passes are listed here by the construct they handle,
 * not by when they run.
 */
public final class NormalizerPassRegistry {

    private final List<NormalizerPass> passes = new ArrayList<>();

    /**
     * Appends a pass.
     * @param pass The pass to register.
     */
    public void register(NormalizerPass pass) {
        passes.add(pass);
    }

    /**
     * @return The passes in declaration order.
     */
    public List<NormalizerPass> passes() {
        return Collections.unmodifiableList(passes);
    }

    /**
     * Creates a registry with the built-in passes.
     * @return A registry with all default passes registered.
     */
    public static NormalizerPassRegistry initializeWithDefaults() {
        NormalizerPassRegistry registry = new NormalizerPassRegistry();
        // terms and calls
        registry.register(new TermPass());
        registry.register(new FormattedPrintPass());
        registry.register(new FunctionCallPass());
        registry.register(new ListOperatorPass());
        // operators
        registry.register(new StringRepeatPass());
        registry.register(new StringConcatPass());
        registry.register(new BinaryOperatorPass());
        registry.register(new SafeDivisionPass());
        registry.register(new TernaryPass());
        registry.register(new LogicalWordPass());
        // statements
        registry.register(new PostfixConditionalPass());
        registry.register(new ConditionalAssignmentPass());
        registry.register(new ArgumentListPass());
        return registry;
    }
}
