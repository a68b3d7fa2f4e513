package org.metaconv.compiler.backend.codegen;

import java.util.Map;
import java.util.Optional;

/**
 * Maps Perl builtins to their {@code Builtins} runtime methods.
 *
 * @param method The runtime method name.
 * @param minArgs The fewest arguments accepted.
 * @param maxArgs The most arguments accepted, or -1 for a trailing list.
 * @param listFrom The first argument evaluated in list context, or -1 if all are scalars.
 * @param returnsList Whether the call yields a list.
 */
public record BuiltinMapping(String method, int minArgs, int maxArgs, int listFrom, boolean returnsList) {

    private static final Map<String, BuiltinMapping> TABLE = Map.ofEntries(
            Map.entry("not", unary("not")),
            Map.entry("defined", unary("defined")),
            Map.entry("length", unary("length")),
            Map.entry("uc", unary("uc")),
            Map.entry("lc", unary("lc")),
            Map.entry("ucfirst", unary("ucfirst")),
            Map.entry("lcfirst", unary("lcfirst")),
            Map.entry("ord", unary("ord")),
            Map.entry("chr", unary("chr")),
            Map.entry("int", unary("toInt")),
            Map.entry("abs", unary("abs")),
            Map.entry("sqrt", unary("sqrt")),
            Map.entry("log", unary("log")),
            Map.entry("exp", unary("exp")),
            Map.entry("sin", unary("sin")),
            Map.entry("cos", unary("cos")),
            Map.entry("hex", unary("hex")),
            Map.entry("oct", unary("oct")),
            Map.entry("atan2", new BuiltinMapping("atan2", 2, 2, -1, false)),
            Map.entry("substr", new BuiltinMapping("substr", 2, 3, -1, false)),
            Map.entry("index", new BuiltinMapping("index", 2, 3, -1, false)),
            Map.entry("join", new BuiltinMapping("join", 1, -1, 1, false)),
            Map.entry("pack", new BuiltinMapping("pack", 1, -1, 1, false)),
            Map.entry("unpack", new BuiltinMapping("unpack", 2, 2, -1, true)),
            Map.entry("split", new BuiltinMapping("split", 2, 3, -1, true))
    );

    private static BuiltinMapping unary(String method) {
        return new BuiltinMapping(method, 1, 1, -1, false);
    }

    /**
     * @param perlName The function name as written in Perl.
     * @return The mapping, or empty for functions without a runtime counterpart.
     */
    public static Optional<BuiltinMapping> lookup(String perlName) {
        return Optional.ofNullable(TABLE.get(perlName));
    }

    public boolean accepts(int argCount) {
        return argCount >= minArgs && (maxArgs < 0 || argCount <= maxArgs);
    }
}
