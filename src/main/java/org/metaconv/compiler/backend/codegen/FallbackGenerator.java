package org.metaconv.compiler.backend.codegen;

import org.metaconv.compiler.api.ExpressionContext;

/**
 * Generates functions for expressions that could not be parsed, normalized or translated: either a
 * delegate to a hand-written implementation or a stub. A value transform stub fails, a display
 * stub shows the raw value and a condition stub never matches.
 */
public class FallbackGenerator {

    /**
     * @param context The calling convention.
     * @param name The function name.
     * @param originalText The Perl text.
     * @param reason Why no real function exists; written into the comment above the stub.
     * @return The stub source, indented for a class body and ending with a newline.
     */
    public String generate(ExpressionContext context, String name, String originalText, String reason) {
        StringBuilder sb = new StringBuilder();
        sb.append(JavaSourceGenerator.INDENT).append("// ").append(JavaLiterals.commentSafe(originalText)).append('\n');
        sb.append(JavaSourceGenerator.INDENT).append("// fallback: ").append(JavaLiterals.commentSafe(reason)).append('\n');
        sb.append(JavaSourceGenerator.INDENT).append(JavaSourceGenerator.signature(context, name)).append(" {\n");
        switch (context) {
            case VALUE_TRANSFORM -> JavaSourceGenerator.line(sb, 2, "throw new ExpressionException("
                    + JavaLiterals.quote("not implemented: " + originalText) + ");");
            case DISPLAY_FORMAT -> JavaSourceGenerator.line(sb, 2, "return " + ExpressionEmitter.VALUE + ".asString();");
            case BOOLEAN_GATE -> JavaSourceGenerator.line(sb, 2, "return false;");
        }
        sb.append(JavaSourceGenerator.INDENT).append("}\n");
        return sb.toString();
    }

    /**
     * @param context The calling convention, which the target method shares.
     * @param name The function name.
     * @param originalText The Perl text.
     * @param method The fully qualified static method implementing the expression.
     * @return The delegating function, indented for a class body and ending with a newline.
     */
    public String delegate(ExpressionContext context, String name, String originalText, String method) {
        StringBuilder sb = new StringBuilder();
        sb.append(JavaSourceGenerator.INDENT).append("// ").append(JavaLiterals.commentSafe(originalText)).append('\n');
        sb.append(JavaSourceGenerator.INDENT).append("// manual implementation").append('\n');
        sb.append(JavaSourceGenerator.INDENT).append(JavaSourceGenerator.signature(context, name)).append(" {\n");
        String arguments = context == ExpressionContext.BOOLEAN_GATE
                ? ExpressionEmitter.VALUE + ", " + ExpressionEmitter.CONTEXT
                : ExpressionEmitter.VALUE;
        JavaSourceGenerator.line(sb, 2, "return " + method + "(" + arguments + ");");
        sb.append(JavaSourceGenerator.INDENT).append("}\n");
        return sb.toString();
    }
}
