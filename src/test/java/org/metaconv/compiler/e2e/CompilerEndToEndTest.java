package org.metaconv.compiler.e2e;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.metaconv.compiler.ExpressionCompiler;
import org.metaconv.compiler.api.CompilationResult;
import org.metaconv.compiler.api.ExpressionContext;
import org.metaconv.compiler.api.ExpressionRecord;
import org.metaconv.compiler.backend.emit.ModuleEmitter;
import org.metaconv.compiler.backend.verify.GeneratedSourceCompiler;
import org.metaconv.compiler.frontend.ast.RawNode;
import org.metaconv.compiler.registry.ManualImplementations;
import org.metaconv.config.CompilerOptions;
import org.metaconv.runtime.EvalContext;
import org.metaconv.runtime.ExpressionException;
import org.metaconv.runtime.TagValue;
import org.metaconv.test.utils.PpiJson;
import org.metaconv.test.utils.PpiTrees;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.metaconv.compiler.api.ExpressionContext.BOOLEAN_GATE;
import static org.metaconv.compiler.api.ExpressionContext.DISPLAY_FORMAT;
import static org.metaconv.compiler.api.ExpressionContext.VALUE_TRANSFORM;
import static org.metaconv.test.utils.PpiTrees.dq;
import static org.metaconv.test.utils.PpiTrees.list;
import static org.metaconv.test.utils.PpiTrees.expr;
import static org.metaconv.test.utils.PpiTrees.num;
import static org.metaconv.test.utils.PpiTrees.op;
import static org.metaconv.test.utils.PpiTrees.statement;
import static org.metaconv.test.utils.PpiTrees.sym;
import static org.metaconv.test.utils.PpiTrees.word;

/**
 * Compiles a small corpus, emits the module, compiles it with the system Java compiler and calls the
 * generated functions through reflection.
 */
@Tag("integration")
class CompilerEndToEndTest {

    private static final String CONCAT = "\"a\" . \"b\" . \"c\"";
    private static final String SCALE = "$val * 25";
    private static final String SCALE_COMPACT = "$val*25";
    private static final String MODEL_CHECK = "$count == 582";
    private static final String RECIPROCAL = "$val ? 1/$val : 0";
    private static final String WRAP = "$val > 180 and $val -= 360; $val";
    private static final String FOCAL = "sprintf(\"%.1f mm\",$val)";
    private static final String UNKNOWN = "foo($val)";
    private static final String TIMESTAMP = "ConvertTimeStamp($val)";

    @TempDir
    static Path workDirectory;

    private static CompilationResult result;
    private static GeneratedSourceCompiler sourceCompiler;
    private static Class<?> module;

    @BeforeAll
    static void compileCorpus() throws Exception {
        List<ExpressionRecord> records = List.of(
                record(DISPLAY_FORMAT, CONCAT, statement(dq("a"), op("."), dq("b"), op("."), dq("c")), false),
                record(VALUE_TRANSFORM, SCALE, PpiTrees.valTimes25(), true),
                record(VALUE_TRANSFORM, SCALE_COMPACT, PpiTrees.valTimes25(), false),
                record(BOOLEAN_GATE, MODEL_CHECK, statement(sym("$count"), op("=="), num("582")), true),
                record(VALUE_TRANSFORM, RECIPROCAL, PpiTrees.guardedReciprocal(), true),
                record(VALUE_TRANSFORM, WRAP, PpiTrees.wrapAngle(), true),
                record(DISPLAY_FORMAT, FOCAL, PpiTrees.sprintfMillimetres(), false),
                record(VALUE_TRANSFORM, UNKNOWN, statement(word("foo"), list(expr(sym("$val")))), false),
                record(DISPLAY_FORMAT, UNKNOWN, statement(word("foo"), list(expr(sym("$val")))), false),
                record(BOOLEAN_GATE, UNKNOWN, statement(word("foo"), list(expr(sym("$val")))), false),
                record(VALUE_TRANSFORM, TIMESTAMP, statement(word("ConvertTimeStamp"), list(expr(sym("$val")))), false));

        ManualImplementations manual = ManualImplementations.builder()
                .put(VALUE_TRANSFORM, TIMESTAMP, ManualConversions.class.getName() + ".timeStamp")
                .build();
        CompilerOptions options = CompilerOptions.defaults().withParallelism(1).withManualImplementations(manual);
        result = new ExpressionCompiler(options).compile(records);
        ModuleEmitter emitter = new ModuleEmitter("org.metaconv.generated.e2e", "CorpusExpressions");
        Path testClasses = Path.of(ManualConversions.class.getProtectionDomain().getCodeSource().getLocation().toURI());
        sourceCompiler = new GeneratedSourceCompiler(workDirectory, List.of(testClasses));
        module = sourceCompiler.compileAndLoad(emitter.qualifiedClassName(), emitter.emit(result));
    }

    @AfterAll
    static void closeModule() throws Exception {
        sourceCompiler.close();
    }

    private static ExpressionRecord record(ExpressionContext context, String text, RawNode tree, boolean whitespace) {
        return new ExpressionRecord(context, text, PpiJson.toJson(tree, whitespace), null);
    }

    private static Method function(String text, ExpressionContext context) throws NoSuchMethodException {
        String name = result.functionFor(text, context);
        assertThat(name).as("function for %s", text).isNotNull();
        return context == BOOLEAN_GATE
                ? module.getMethod(name, TagValue.class, EvalContext.class)
                : module.getMethod(name, TagValue.class);
    }

    private static Object call(String text, ExpressionContext context, TagValue val) throws Exception {
        return function(text, context).invoke(null, val);
    }

    private static boolean condition(String text, EvalContext ctx) throws Exception {
        return (Boolean) function(text, BOOLEAN_GATE).invoke(null, TagValue.undef(), ctx);
    }

    @Test
    void concatenation_isOneFunction() throws Exception {
        assertThat(call(CONCAT, DISPLAY_FORMAT, TagValue.undef())).isEqualTo("abc");
    }

    @Test
    void valueTransform_scalesNumbersAndRejectsText() throws Exception {
        assertThat(((TagValue) call(SCALE, VALUE_TRANSFORM, TagValue.of(4L))).asString()).isEqualTo("100");

        assertThatThrownBy(() -> call(SCALE, VALUE_TRANSFORM, TagValue.of("abc")))
                .isInstanceOf(InvocationTargetException.class)
                .hasCauseInstanceOf(ExpressionException.class);
    }

    @Test
    void whitespaceVariants_callTheSameFunction() {
        String name = result.functionFor(SCALE, VALUE_TRANSFORM);

        assertThat(result.functionFor(SCALE_COMPACT, VALUE_TRANSFORM)).isEqualTo(name);
        assertThat(module.getDeclaredMethods()).filteredOn(m -> m.getName().equals(name)).hasSize(1);
    }

    @Test
    void booleanGate_readsContextFields() throws Exception {
        assertThat(condition(MODEL_CHECK, EvalContext.builder().put("count", 582).build())).isTrue();
        assertThat(condition(MODEL_CHECK, EvalContext.builder().put("count", 581).build())).isFalse();
        assertThat(condition(MODEL_CHECK, EvalContext.empty())).isFalse();
    }

    @Test
    void guardedDivision_neverDividesByZero() throws Exception {
        assertThat(((TagValue) call(RECIPROCAL, VALUE_TRANSFORM, TagValue.of(0L))).asString()).isEqualTo("0");
        assertThat(((TagValue) call(RECIPROCAL, VALUE_TRANSFORM, TagValue.of(2L))).asString()).isEqualTo("0.5");
    }

    @Test
    void conditionalAssignment_returnsUpdatedValue() throws Exception {
        assertThat(((TagValue) call(WRAP, VALUE_TRANSFORM, TagValue.of(200L))).asString()).isEqualTo("-160");
        assertThat(((TagValue) call(WRAP, VALUE_TRANSFORM, TagValue.of(90L))).asString()).isEqualTo("90");
    }

    @Test
    void displayFormat_fallsBackToRawValue() throws Exception {
        assertThat(call(FOCAL, DISPLAY_FORMAT, TagValue.of(3.14159))).isEqualTo("3.1 mm");
        assertThat(call(FOCAL, DISPLAY_FORMAT, TagValue.of("n/a"))).isEqualTo("n/a");
    }

    @Test
    void fallbackStub_throwsNotImplemented() {
        assertThatThrownBy(() -> call(UNKNOWN, VALUE_TRANSFORM, TagValue.of(1L)))
                .isInstanceOf(InvocationTargetException.class)
                .cause()
                .isInstanceOf(ExpressionException.class)
                .hasMessage("not implemented: foo($val)");
    }

    @Test
    void displayFallbackStub_showsRawValue() throws Exception {
        assertThat(call(UNKNOWN, DISPLAY_FORMAT, TagValue.of("raw text"))).isEqualTo("raw text");
        assertThat(call(UNKNOWN, DISPLAY_FORMAT, TagValue.of(42L))).isEqualTo("42");
    }

    @Test
    void conditionFallbackStub_neverMatches() throws Exception {
        assertThat(condition(UNKNOWN, EvalContext.builder().put("count", 582).build())).isFalse();
        assertThat(condition(UNKNOWN, EvalContext.empty())).isFalse();
    }

    @Test
    void manualImplementation_servesUntranslatableExpression() throws Exception {
        assertThat(((TagValue) call(TIMESTAMP, VALUE_TRANSFORM, TagValue.of("12 30 05"))).asString())
                .isEqualTo("12:30:05Z");
        assertThat(result.report().stats(VALUE_TRANSFORM).manual()).isEqualTo(1);
        assertThat(result.report().fallbacks()).extracting(f -> f.originalText()).doesNotContain(TIMESTAMP);
    }
}
