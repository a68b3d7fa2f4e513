package org.metaconv.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Data members of the extraction state that boolean gates may read, e.g. {@code $$self{Model}}.
 * Missing members read as undef.
 */
public final class EvalContext {

    private static final EvalContext EMPTY = new EvalContext(Map.of());

    private final Map<String, TagValue> fields;

    private EvalContext(Map<String, TagValue> fields) {
        this.fields = fields;
    }

    public static EvalContext empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param name The data member name, without sigils or braces.
     * @return The member value, or undef when it is not set.
     */
    public TagValue get(String name) {
        TagValue value = fields.get(name);
        return value != null ? value : TagValue.undef();
    }

    public boolean has(String name) {
        return fields.containsKey(name);
    }

    public Map<String, TagValue> fields() {
        return fields;
    }

    @Override
    public String toString() {
        return "EvalContext" + fields;
    }

    public static final class Builder {
        private final Map<String, TagValue> fields = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String name, TagValue value) {
            fields.put(name, value);
            return this;
        }

        public Builder put(String name, String value) {
            return put(name, TagValue.of(value));
        }

        public Builder put(String name, long value) {
            return put(name, TagValue.of(value));
        }

        public EvalContext build() {
            return new EvalContext(Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
        }
    }
}
