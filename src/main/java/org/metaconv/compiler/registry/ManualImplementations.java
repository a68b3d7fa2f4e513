package org.metaconv.compiler.registry;

import com.typesafe.config.Config;
import org.metaconv.compiler.api.ExpressionContext;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Hand-written Java implementations for expressions the generator cannot translate.
 * <p>
 * Entries are matched on the exact Perl text within a context; no normalization takes place, so
 * formatting variants of one expression need one entry each. A referenced method must be
 * {@code public static} with the calling convention of its context, since the emitted function
 * only delegates to it.
 */
public final class ManualImplementations {

    private static final Pattern QUALIFIED_METHOD = Pattern.compile(
            "[A-Za-z_$][\\w$]*(\\.[A-Za-z_$][\\w$]*)+");
    private static final ManualImplementations NONE = new ManualImplementations(Map.of());

    private final Map<Key, String> methods;

    private ManualImplementations(Map<Key, String> methods) {
        this.methods = Map.copyOf(methods);
    }

    public static ManualImplementations none() {
        return NONE;
    }

    /**
     * Reads entries of the form {@code { context = DISPLAY_FORMAT, expression = "...", method = "com.example.Conv.altitude" }}.
     *
     * @param entries The configured entries.
     * @return The table.
     * @throws IllegalArgumentException if a method reference is malformed or an expression is listed twice.
     * @throws com.typesafe.config.ConfigException if an entry lacks a setting or names an unknown context.
     */
    public static ManualImplementations fromConfig(List<? extends Config> entries) {
        Builder builder = builder();
        for (Config entry : entries) {
            builder.put(entry.getEnum(ExpressionContext.class, "context"),
                    entry.getString("expression"),
                    entry.getString("method"));
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return The fully qualified static method for the expression, if one is registered.
     */
    public Optional<String> lookup(ExpressionContext context, String originalText) {
        return Optional.ofNullable(methods.get(new Key(context, originalText)));
    }

    public int size() {
        return methods.size();
    }

    public static final class Builder {
        private final Map<Key, String> methods = new HashMap<>();

        private Builder() {
        }

        /**
         * @param method A fully qualified method such as {@code com.example.Conversions.gpsAltitude}.
         */
        public Builder put(ExpressionContext context, String originalText, String method) {
            if (method == null || !QUALIFIED_METHOD.matcher(method).matches()) {
                throw new IllegalArgumentException("Not a qualified method name: '" + method + "'");
            }
            if (methods.putIfAbsent(new Key(context, originalText), method) != null) {
                throw new IllegalArgumentException(
                        "Duplicate manual implementation for " + context + " expression '" + originalText + "'");
            }
            return this;
        }

        public ManualImplementations build() {
            return methods.isEmpty() ? NONE : new ManualImplementations(methods);
        }
    }

    private record Key(ExpressionContext context, String originalText) {
    }
}
