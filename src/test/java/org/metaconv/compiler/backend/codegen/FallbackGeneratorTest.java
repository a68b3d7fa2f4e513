package org.metaconv.compiler.backend.codegen;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.metaconv.compiler.api.ExpressionContext;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class FallbackGeneratorTest {

    private final FallbackGenerator generator = new FallbackGenerator();

    @Test
    void valueTransformStub_throws() {
        String source = generator.generate(ExpressionContext.VALUE_TRANSFORM, "value_1", "$val =~ s/a/b/",
                "unsupported");

        assertEquals("""
                    // $val =~ s/a/b/
                    // fallback: unsupported
                    public static TagValue value_1(TagValue val) throws ExpressionException {
                        throw new ExpressionException("not implemented: $val =~ s/a/b/");
                    }
                """, source);
    }

    @Test
    void displayFormatStub_showsRawValue() {
        String source = generator.generate(ExpressionContext.DISPLAY_FORMAT, "print_1", "foo($val)", "no foo");

        assertTrue(source.contains("public static String print_1(TagValue val) {\n"));
        assertTrue(source.contains("        return val.asString();\n"));
    }

    @Test
    void booleanGateStub_neverMatches() {
        String source = generator.generate(ExpressionContext.BOOLEAN_GATE, "condition_1", "$$self{X} eq 'y'",
                "reason");

        assertTrue(source.contains("public static boolean condition_1(TagValue val, EvalContext ctx) {\n"));
        assertTrue(source.contains("        return false;\n"));
    }

    @Test
    void reasonAndTextAreCommentSafe() {
        String source = generator.generate(ExpressionContext.DISPLAY_FORMAT, "print_1", "\"a\"\n.\"b\"",
                "line one\nline two");

        assertTrue(source.startsWith("    // \"a\" .\"b\"\n    // fallback: line one line two\n"));
    }

    @Test
    void stubMessage_isAValidStringLiteral() {
        String source = generator.generate(ExpressionContext.VALUE_TRANSFORM, "value_1", "\"$val\\n\"", "r");

        assertTrue(source.contains("throw new ExpressionException(\"not implemented: \\\"$val\\\\n\\\"\");"));
    }

    @Test
    void delegate_callsTheManualImplementation() {
        String source = generator.delegate(ExpressionContext.DISPLAY_FORMAT, "print_1",
                "$val =~ /^(inf|undef)$/ ? $val : \"$val m\"", "com.example.Conversions.gpsAltitude");

        assertEquals("""
                    // $val =~ /^(inf|undef)$/ ? $val : "$val m"
                    // manual implementation
                    public static String print_1(TagValue val) {
                        return com.example.Conversions.gpsAltitude(val);
                    }
                """, source);
    }

    @Test
    void delegate_passesTheContextToConditions() {
        String source = generator.delegate(ExpressionContext.BOOLEAN_GATE, "condition_1", "Image::ExifTool::IsCanon()",
                "com.example.Conditions.isCanon");

        assertTrue(source.contains("        return com.example.Conditions.isCanon(val, ctx);\n"));
    }
}
