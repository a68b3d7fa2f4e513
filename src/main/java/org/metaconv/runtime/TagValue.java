package org.metaconv.runtime;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A tag value with Perl scalar semantics: it stringifies and numifies on demand and has Perl
 * truthiness. Lists model multi-valued tags ({@code @val} / {@code $val[n]}).
 */
public sealed interface TagValue permits TagValue.Undef, TagValue.Int, TagValue.Num, TagValue.Str, TagValue.ListValue {

    /** Numeric strings in the sense of Perl's {@code looks_like_number}. */
    Pattern NUMERIC = Pattern.compile(
            "\\s*[+-]?(?:\\d+\\.?\\d*(?:[eE][+-]?\\d+)?|\\.\\d+(?:[eE][+-]?\\d+)?|(?i:inf(?:inity)?|nan))\\s*");
    Pattern INTEGRAL = Pattern.compile("\\s*[+-]?\\d{1,18}\\s*");

    TagValue TRUE = new Int(1);
    TagValue FALSE = new Str("");

    /**
     * The undefined value.
     */
    record Undef() implements TagValue {
        private static final Undef INSTANCE = new Undef();

        @Override
        public boolean isTrue() {
            return false;
        }

        @Override
        public String asString() {
            return "";
        }

        @Override
        public double toNumber() throws ExpressionException {
            throw new ExpressionException("Use of undefined value in numeric context");
        }
    }

    /**
     * An integer value.
     * @param value The integer.
     */
    record Int(long value) implements TagValue {
        @Override
        public boolean isTrue() {
            return value != 0;
        }

        @Override
        public String asString() {
            return Long.toString(value);
        }

        @Override
        public double toNumber() {
            return value;
        }
    }

    /**
     * A floating point value.
     * @param value The number.
     */
    record Num(double value) implements TagValue {
        @Override
        public boolean isTrue() {
            return value != 0.0;
        }

        @Override
        public String asString() {
            return formatNumber(value);
        }

        @Override
        public double toNumber() {
            return value;
        }
    }

    /**
     * A string value. Binary data is carried as a string of ISO-8859-1 characters.
     * @param value The string.
     */
    record Str(String value) implements TagValue {
        public Str {
            if (value == null) {
                throw new IllegalArgumentException("value must not be null");
            }
        }

        @Override
        public boolean isTrue() {
            return !value.isEmpty() && !value.equals("0");
        }

        @Override
        public String asString() {
            return value;
        }

        @Override
        public double toNumber() throws ExpressionException {
            if (!NUMERIC.matcher(value).matches()) {
                throw new ExpressionException("Argument \"" + value + "\" isn't numeric");
            }
            String trimmed = value.strip().toLowerCase(Locale.ROOT);
            boolean negative = trimmed.startsWith("-");
            String unsigned = trimmed.replaceFirst("^[+-]", "");
            if (unsigned.startsWith("inf")) {
                return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
            }
            if (unsigned.equals("nan")) {
                return Double.NaN;
            }
            return Double.parseDouble(trimmed);
        }

        @Override
        public boolean isInteger() {
            return INTEGRAL.matcher(value).matches();
        }
    }

    /**
     * An ordered list of values.
     * @param elements The elements.
     */
    record ListValue(List<TagValue> elements) implements TagValue {
        public ListValue {
            elements = Collections.unmodifiableList(new ArrayList<>(elements));
        }

        @Override
        public boolean isTrue() {
            return !elements.isEmpty();
        }

        @Override
        public String asString() {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < elements.size(); i++) {
                if (i > 0) {
                    sb.append(' ');
                }
                sb.append(elements.get(i).asString());
            }
            return sb.toString();
        }

        @Override
        public double toNumber() throws ExpressionException {
            if (elements.size() == 1) {
                return elements.get(0).toNumber();
            }
            throw new ExpressionException("List of " + elements.size() + " values used in numeric context");
        }

        @Override
        public TagValue get(int index) {
            int resolved = index < 0 ? elements.size() + index : index;
            return resolved >= 0 && resolved < elements.size() ? elements.get(resolved) : undef();
        }
    }

    static TagValue undef() {
        return Undef.INSTANCE;
    }

    static TagValue of(long value) {
        return new Int(value);
    }

    static TagValue of(double value) {
        return new Num(value);
    }

    static TagValue of(String value) {
        return value == null ? undef() : new Str(value);
    }

    static TagValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    static TagValue list(TagValue... elements) {
        return new ListValue(Arrays.asList(elements));
    }

    static TagValue list(List<TagValue> elements) {
        return new ListValue(elements);
    }

    /**
     * Returns the integer value when {@code value} is integral and exactly representable,
     * otherwise the floating point value.
     */
    static TagValue ofNumber(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 0x1p53) {
            return new Int((long) value);
        }
        return new Num(value);
    }

    /** Perl truthiness. */
    boolean isTrue();

    /** Perl stringification. */
    String asString();

    /**
     * Strict numification.
     * @throws ExpressionException if the value is not numeric.
     */
    double toNumber() throws ExpressionException;

    default boolean isDefined() {
        return !(this instanceof Undef);
    }

    default boolean isInteger() {
        return this instanceof Int;
    }

    default boolean looksLikeNumber() {
        if (this instanceof Int || this instanceof Num) {
            return true;
        }
        return this instanceof Str s && NUMERIC.matcher(s.value()).matches();
    }

    /**
     * Element access for {@code $val[n]}. A scalar is treated as a one-element list.
     */
    default TagValue get(int index) {
        return index == 0 || index == -1 ? this : undef();
    }

    /**
     * Flattens this value into list context.
     */
    default List<TagValue> toList() {
        if (this instanceof ListValue l) {
            return l.elements();
        }
        return List.of(this);
    }

    /**
     * Formats a double the way Perl prints numbers ({@code %.15g}).
     */
    static String formatNumber(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "Inf" : "-Inf";
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        double abs = Math.abs(value);
        if (abs >= 1e-4 && abs < 1e15) {
            return new BigDecimal(value).round(new MathContext(15)).stripTrailingZeros().toPlainString();
        }
        String formatted = String.format(Locale.ROOT, "%.14e", value);
        int e = formatted.indexOf('e');
        String mantissa = formatted.substring(0, e);
        if (mantissa.indexOf('.') >= 0) {
            mantissa = mantissa.replaceAll("0+$", "").replaceAll("\\.$", "");
        }
        return mantissa + formatted.substring(e);
    }
}
