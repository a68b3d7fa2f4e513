package org.metaconv.compiler.backend.codegen;

import org.metaconv.compiler.api.ExpressionContext;
import org.metaconv.compiler.api.UnsupportedConstructException;
import org.metaconv.compiler.frontend.ast.NormalizedNode;

import java.util.List;

/**
 * Generates the Java source of one static function from a normalized tree.
 * <p>
 * The calling convention depends on the context:
 * <ul>
 *     <li>{@code VALUE_TRANSFORM}: {@code public static TagValue name(TagValue val) throws ExpressionException}</li>
 *     <li>{@code DISPLAY_FORMAT}: {@code public static String name(TagValue val)}; evaluation errors display the raw value</li>
 *     <li>{@code BOOLEAN_GATE}: {@code public static boolean name(TagValue val, EvalContext ctx)}; evaluation errors yield {@code false}</li>
 * </ul>
 * Generated functions refer to {@code TagValue}, {@code Builtins}, {@code EvalContext} and
 * {@code ExpressionException} by simple name; the enclosing module imports them.
 */
public class JavaSourceGenerator {

    static final String INDENT = "    ";

    /**
     * @param tree The normalized expression.
     * @param context The calling convention.
     * @param name The function name.
     * @return The function source, indented for a class body and ending with a newline.
     * @throws UnsupportedConstructException if the tree uses a construct without a Java translation.
     */
    public String generate(NormalizedNode tree, ExpressionContext context, String name)
            throws UnsupportedConstructException {
        return generate(tree, context, name, null);
    }

    /**
     * As {@link #generate(NormalizedNode, ExpressionContext, String)}, with the Perl text placed in a
     * comment above the function.
     */
    public String generate(NormalizedNode tree, ExpressionContext context, String name, String originalText)
            throws UnsupportedConstructException {
        ExpressionEmitter emitter = new ExpressionEmitter(context);
        String expression = emitter.emitRoot(tree);
        List<String> prelude = emitter.prelude();

        StringBuilder sb = new StringBuilder();
        if (originalText != null) {
            sb.append(INDENT).append("// ").append(JavaLiterals.commentSafe(originalText)).append('\n');
        }
        sb.append(INDENT).append(signature(context, name)).append(" {\n");
        switch (context) {
            case VALUE_TRANSFORM -> {
                appendStatements(sb, prelude, 2);
                line(sb, 2, "return " + expression + ";");
            }
            case DISPLAY_FORMAT -> {
                line(sb, 2, "try {");
                appendStatements(sb, prelude, 3);
                line(sb, 3, "return Builtins.stringify(" + expression + ");");
                line(sb, 2, "} catch (Exception e) {");
                line(sb, 3, "return " + ExpressionEmitter.VALUE + ".asString();");
                line(sb, 2, "}");
            }
            case BOOLEAN_GATE -> {
                line(sb, 2, "try {");
                appendStatements(sb, prelude, 3);
                line(sb, 3, "return " + expression + ".isTrue();");
                line(sb, 2, "} catch (Exception e) {");
                line(sb, 3, "return false;");
                line(sb, 2, "}");
            }
        }
        sb.append(INDENT).append("}\n");
        return sb.toString();
    }

    /**
     * @return The method header for a function of the given context, without the opening brace.
     */
    static String signature(ExpressionContext context, String name) {
        String value = "TagValue " + ExpressionEmitter.VALUE;
        return switch (context) {
            case VALUE_TRANSFORM -> "public static TagValue " + name + "(" + value + ") throws ExpressionException";
            case DISPLAY_FORMAT -> "public static String " + name + "(" + value + ")";
            case BOOLEAN_GATE -> "public static boolean " + name + "(" + value + ", EvalContext "
                    + ExpressionEmitter.CONTEXT + ")";
        };
    }

    private static void appendStatements(StringBuilder sb, List<String> statements, int level) {
        for (String statement : statements) {
            line(sb, level, statement);
        }
    }

    static void line(StringBuilder sb, int level, String text) {
        sb.append(INDENT.repeat(level)).append(text).append('\n');
    }
}
