package org.metaconv.compiler.backend.emit;

import org.metaconv.compiler.api.CompilationResult;
import org.metaconv.compiler.api.GeneratedFunction;

/**
 * Assembles all functions of a run into one Java compilation unit: a final utility class with a
 * private constructor that imports the runtime library.
 */
public class ModuleEmitter {

    public static final String DEFAULT_PACKAGE = "org.metaconv.generated";
    public static final String DEFAULT_CLASS = "TagExpressions";

    private final String packageName;
    private final String className;

    public ModuleEmitter() {
        this(DEFAULT_PACKAGE, DEFAULT_CLASS);
    }

    public ModuleEmitter(String packageName, String className) {
        this.packageName = packageName;
        this.className = className;
    }

    public String qualifiedClassName() {
        return packageName.isEmpty() ? className : packageName + "." + className;
    }

    public String className() {
        return className;
    }

    public String packageName() {
        return packageName;
    }

    /**
     * @param result The drained registry.
     * @return The module source.
     */
    public String emit(CompilationResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("// Generated by metaconv. Do not edit.\n");
        if (!packageName.isEmpty()) {
            sb.append("package ").append(packageName).append(";\n\n");
        }
        sb.append("import org.metaconv.runtime.Builtins;\n");
        sb.append("import org.metaconv.runtime.EvalContext;\n");
        sb.append("import org.metaconv.runtime.ExpressionException;\n");
        sb.append("import org.metaconv.runtime.TagValue;\n\n");
        sb.append("@SuppressWarnings(\"unused\")\n");
        sb.append("public final class ").append(className).append(" {\n\n");
        sb.append("    private ").append(className).append("() {\n");
        sb.append("    }\n");
        for (GeneratedFunction function : result.functions()) {
            sb.append('\n').append(function.source());
        }
        sb.append("}\n");
        return sb.toString();
    }
}
