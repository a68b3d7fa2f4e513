package org.metaconv.compiler.backend.emit;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.metaconv.compiler.api.CompilationResult;
import org.metaconv.compiler.api.ExpressionContext;
import org.metaconv.compiler.api.FunctionSpec;
import org.metaconv.compiler.frontend.ast.Literal;
import org.metaconv.compiler.frontend.ast.Symbol;
import org.metaconv.compiler.registry.FunctionRegistry;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ModuleEmitterTest {

    @Test
    void emit_wrapsFunctionsInAUtilityClass() {
        FunctionRegistry registry = new FunctionRegistry();
        String value = registry.resolveOrFallback(
                new FunctionSpec("$val", ExpressionContext.VALUE_TRANSFORM, Symbol.value())).name();
        String print = registry.resolveOrFallback(
                new FunctionSpec("'n/a'", ExpressionContext.DISPLAY_FORMAT, Literal.string("n/a"))).name();
        CompilationResult result = registry.finish();

        String source = new ModuleEmitter("com.example.tags", "Expressions").emit(result);

        assertThat(source)
                .startsWith("// Generated by metaconv. Do not edit.\npackage com.example.tags;\n\n")
                .contains("import org.metaconv.runtime.TagValue;\n")
                .contains("public final class Expressions {\n\n    private Expressions() {\n    }\n")
                .contains("public static TagValue " + value + "(TagValue val)")
                .contains("public static String " + print + "(TagValue val)")
                .endsWith("}\n");
        // functions are emitted in name order
        assertThat(source.indexOf(print)).isLessThan(source.indexOf(value));
    }

    @Test
    void emit_defaultPackage_hasNoPackageDeclaration() {
        ModuleEmitter emitter = new ModuleEmitter("", "Expressions");

        String source = emitter.emit(new FunctionRegistry().finish());

        assertThat(source).doesNotContain("package ");
        assertThat(emitter.qualifiedClassName()).isEqualTo("Expressions");
        assertThat(new ModuleEmitter().qualifiedClassName()).isEqualTo("org.metaconv.generated.TagExpressions");
    }
}
