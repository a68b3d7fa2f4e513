package org.metaconv.runtime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Perl-semantic primitives called by generated expression functions.
 * <p>
 * Arithmetic is strict: operands that are not numeric raise an {@link ExpressionException} instead
 * of numifying to zero the way Perl does with warnings enabled.
 */
public final class Builtins {

    private static final Map<String, Pattern> PATTERN_CACHE = new ConcurrentHashMap<>();

    private Builtins() {
    }

    // ---- arithmetic ----

    public static TagValue add(TagValue a, TagValue b) throws ExpressionException {
        return TagValue.ofNumber(a.toNumber() + b.toNumber());
    }

    public static TagValue subtract(TagValue a, TagValue b) throws ExpressionException {
        return TagValue.ofNumber(a.toNumber() - b.toNumber());
    }

    public static TagValue multiply(TagValue a, TagValue b) throws ExpressionException {
        return TagValue.ofNumber(a.toNumber() * b.toNumber());
    }

    public static TagValue divide(TagValue a, TagValue b) throws ExpressionException {
        double divisor = b.toNumber();
        if (divisor == 0.0) {
            throw new ExpressionException("Illegal division by zero");
        }
        return TagValue.ofNumber(a.toNumber() / divisor);
    }

    public static TagValue modulo(TagValue a, TagValue b) throws ExpressionException {
        long divisor = toLong(b);
        if (divisor == 0) {
            throw new ExpressionException("Illegal modulus zero");
        }
        return TagValue.of(Math.floorMod(toLong(a), divisor));
    }

    public static TagValue power(TagValue a, TagValue b) throws ExpressionException {
        return TagValue.ofNumber(Math.pow(a.toNumber(), b.toNumber()));
    }

    public static TagValue negate(TagValue a) throws ExpressionException {
        return TagValue.ofNumber(-a.toNumber());
    }

    // ---- comparison ----

    public static TagValue numEq(TagValue a, TagValue b) throws ExpressionException {
        return TagValue.of(a.toNumber() == b.toNumber());
    }

    public static TagValue numNe(TagValue a, TagValue b) throws ExpressionException {
        return TagValue.of(a.toNumber() != b.toNumber());
    }

    public static TagValue numLt(TagValue a, TagValue b) throws ExpressionException {
        return TagValue.of(a.toNumber() < b.toNumber());
    }

    public static TagValue numGt(TagValue a, TagValue b) throws ExpressionException {
        return TagValue.of(a.toNumber() > b.toNumber());
    }

    public static TagValue numLe(TagValue a, TagValue b) throws ExpressionException {
        return TagValue.of(a.toNumber() <= b.toNumber());
    }

    public static TagValue numGe(TagValue a, TagValue b) throws ExpressionException {
        return TagValue.of(a.toNumber() >= b.toNumber());
    }

    public static TagValue numCmp(TagValue a, TagValue b) throws ExpressionException {
        double x = a.toNumber();
        double y = b.toNumber();
        if (Double.isNaN(x) || Double.isNaN(y)) {
            return TagValue.undef();
        }
        return TagValue.of(Double.compare(x, y) < 0 ? -1L : x == y ? 0L : 1L);
    }

    public static TagValue strEq(TagValue a, TagValue b) {
        return TagValue.of(a.asString().equals(b.asString()));
    }

    public static TagValue strNe(TagValue a, TagValue b) {
        return TagValue.of(!a.asString().equals(b.asString()));
    }

    public static TagValue strLt(TagValue a, TagValue b) {
        return TagValue.of(a.asString().compareTo(b.asString()) < 0);
    }

    public static TagValue strGt(TagValue a, TagValue b) {
        return TagValue.of(a.asString().compareTo(b.asString()) > 0);
    }

    public static TagValue strLe(TagValue a, TagValue b) {
        return TagValue.of(a.asString().compareTo(b.asString()) <= 0);
    }

    public static TagValue strGe(TagValue a, TagValue b) {
        return TagValue.of(a.asString().compareTo(b.asString()) >= 0);
    }

    public static TagValue strCmp(TagValue a, TagValue b) {
        return TagValue.of((long) Integer.signum(a.asString().compareTo(b.asString())));
    }

    // ---- bitwise ----

    public static TagValue bitAnd(TagValue a, TagValue b) throws ExpressionException {
        return TagValue.of(toLong(a) & toLong(b));
    }

    public static TagValue bitOr(TagValue a, TagValue b) throws ExpressionException {
        return TagValue.of(toLong(a) | toLong(b));
    }

    public static TagValue bitXor(TagValue a, TagValue b) throws ExpressionException {
        return TagValue.of(toLong(a) ^ toLong(b));
    }

    public static TagValue shiftLeft(TagValue a, TagValue b) throws ExpressionException {
        return TagValue.of(toLong(a) << toLong(b));
    }

    public static TagValue shiftRight(TagValue a, TagValue b) throws ExpressionException {
        return TagValue.of(toLong(a) >>> toLong(b));
    }

    public static TagValue bitNot(TagValue a) throws ExpressionException {
        return TagValue.of(~toLong(a));
    }

    // ---- logic ----

    public static TagValue not(TagValue a) {
        return TagValue.of(!a.isTrue());
    }

    /** Perl {@code &&}: the left operand if it is false, otherwise the right operand. */
    public static TagValue and(TagValue a, ValueSupplier b) throws ExpressionException {
        return a.isTrue() ? b.get() : a;
    }

    /** Perl {@code ||}: the left operand if it is true, otherwise the right operand. */
    public static TagValue or(TagValue a, ValueSupplier b) throws ExpressionException {
        return a.isTrue() ? a : b.get();
    }

    /** Perl {@code //}: the left operand if it is defined, otherwise the right operand. */
    public static TagValue definedOr(TagValue a, ValueSupplier b) throws ExpressionException {
        return a.isDefined() ? a : b.get();
    }

    public static TagValue xor(TagValue a, TagValue b) {
        return TagValue.of(a.isTrue() ^ b.isTrue());
    }

    public static TagValue defined(TagValue a) {
        return TagValue.of(a.isDefined());
    }

    // ---- strings ----

    /**
     * Concatenates all parts into one string in a single pass.
     */
    public static TagValue concat(TagValue... parts) {
        StringBuilder sb = new StringBuilder();
        for (TagValue part : parts) {
            sb.append(part.asString());
        }
        return new TagValue.Str(sb.toString());
    }

    public static TagValue repeat(TagValue value, TagValue count) throws ExpressionException {
        long times = toLong(count);
        if (times <= 0) {
            return new TagValue.Str("");
        }
        if (times > Integer.MAX_VALUE) {
            throw new ExpressionException("Repeat count too large: " + times);
        }
        return new TagValue.Str(value.asString().repeat((int) times));
    }

    public static TagValue length(TagValue value) {
        if (!value.isDefined()) {
            return TagValue.undef();
        }
        return TagValue.of((long) value.asString().length());
    }

    public static TagValue substr(TagValue value, TagValue offset) throws ExpressionException {
        String s = value.asString();
        int start = resolveOffset(s, toLong(offset));
        if (start < 0) {
            return TagValue.undef();
        }
        return new TagValue.Str(s.substring(start));
    }

    public static TagValue substr(TagValue value, TagValue offset, TagValue length) throws ExpressionException {
        String s = value.asString();
        int start = resolveOffset(s, toLong(offset));
        if (start < 0) {
            return TagValue.undef();
        }
        long len = toLong(length);
        long end = len < 0 ? s.length() + len : start + len;
        end = Math.max(start, Math.min(end, s.length()));
        return new TagValue.Str(s.substring(start, (int) end));
    }

    public static TagValue index(TagValue haystack, TagValue needle) {
        return TagValue.of((long) haystack.asString().indexOf(needle.asString()));
    }

    public static TagValue index(TagValue haystack, TagValue needle, TagValue position) throws ExpressionException {
        String s = haystack.asString();
        long from = Math.max(0, Math.min(toLong(position), s.length()));
        return TagValue.of((long) s.indexOf(needle.asString(), (int) from));
    }

    public static TagValue uc(TagValue value) {
        return new TagValue.Str(value.asString().toUpperCase(Locale.ROOT));
    }

    public static TagValue lc(TagValue value) {
        return new TagValue.Str(value.asString().toLowerCase(Locale.ROOT));
    }

    public static TagValue ucfirst(TagValue value) {
        String s = value.asString();
        return new TagValue.Str(s.isEmpty() ? s : s.substring(0, 1).toUpperCase(Locale.ROOT) + s.substring(1));
    }

    public static TagValue lcfirst(TagValue value) {
        String s = value.asString();
        return new TagValue.Str(s.isEmpty() ? s : s.substring(0, 1).toLowerCase(Locale.ROOT) + s.substring(1));
    }

    public static TagValue ord(TagValue value) {
        String s = value.asString();
        return TagValue.of(s.isEmpty() ? 0L : (long) s.codePointAt(0));
    }

    public static TagValue chr(TagValue value) throws ExpressionException {
        long code = toLong(value);
        if (code < 0 || code > Character.MAX_CODE_POINT) {
            return new TagValue.Str("\uFFFD");
        }
        return new TagValue.Str(new String(Character.toChars((int) code)));
    }

    public static TagValue join(TagValue separator, TagValue... values) {
        String sep = separator.asString();
        StringBuilder sb = new StringBuilder();
        boolean first = true;
        for (TagValue value : flatten(values)) {
            if (!first) {
                sb.append(sep);
            }
            sb.append(value.asString());
            first = false;
        }
        return new TagValue.Str(sb.toString());
    }

    public static TagValue split(TagValue pattern, TagValue value) throws ExpressionException {
        return split(pattern, value, TagValue.of(0L));
    }

    /**
     * Perl {@code split}. A single-space pattern splits on whitespace runs after trimming leading
     * whitespace; a limit of zero drops trailing empty fields.
     */
    public static TagValue split(TagValue pattern, TagValue value, TagValue limit) throws ExpressionException {
        String s = value.asString();
        String regex = pattern.asString();
        if (regex.equals(" ")) {
            s = s.stripLeading();
            regex = "\\s+";
        }
        int max = (int) toLong(limit);
        String[] parts = s.isEmpty() ? new String[0] : compile(regex, "").split(s, max <= 0 ? 0 : max);
        List<TagValue> fields = new ArrayList<>(parts.length);
        for (String part : parts) {
            fields.add(new TagValue.Str(part));
        }
        return TagValue.list(fields);
    }

    public static TagValue sprintf(TagValue format, TagValue... args) throws ExpressionException {
        return new TagValue.Str(PerlFormat.format(format.asString(), flatten(args)));
    }

    public static TagValue pack(TagValue template, TagValue... args) throws ExpressionException {
        return new TagValue.Str(PerlPack.pack(template.asString(), flatten(args)));
    }

    public static TagValue unpack(TagValue template, TagValue value) throws ExpressionException {
        return TagValue.list(PerlPack.unpack(template.asString(), value.asString()));
    }

    // ---- regex ----

    /**
     * Evaluates {@code value =~ /pattern/modifiers}.
     */
    public static TagValue matches(TagValue value, String pattern, String modifiers) throws ExpressionException {
        return TagValue.of(compile(pattern, modifiers).matcher(value.asString()).find());
    }

    // ---- numeric functions ----

    public static TagValue toInt(TagValue value) throws ExpressionException {
        double d = value.toNumber();
        return TagValue.ofNumber(d < 0 ? Math.ceil(d) : Math.floor(d));
    }

    public static TagValue abs(TagValue value) throws ExpressionException {
        return TagValue.ofNumber(Math.abs(value.toNumber()));
    }

    public static TagValue sqrt(TagValue value) throws ExpressionException {
        double d = value.toNumber();
        if (d < 0) {
            throw new ExpressionException("Can't take sqrt of " + value.asString());
        }
        return TagValue.ofNumber(Math.sqrt(d));
    }

    public static TagValue log(TagValue value) throws ExpressionException {
        double d = value.toNumber();
        if (d <= 0) {
            throw new ExpressionException("Can't take log of " + value.asString());
        }
        return TagValue.ofNumber(Math.log(d));
    }

    public static TagValue exp(TagValue value) throws ExpressionException {
        return TagValue.ofNumber(Math.exp(value.toNumber()));
    }

    public static TagValue sin(TagValue value) throws ExpressionException {
        return TagValue.ofNumber(Math.sin(value.toNumber()));
    }

    public static TagValue cos(TagValue value) throws ExpressionException {
        return TagValue.ofNumber(Math.cos(value.toNumber()));
    }

    public static TagValue atan2(TagValue y, TagValue x) throws ExpressionException {
        return TagValue.ofNumber(Math.atan2(y.toNumber(), x.toNumber()));
    }

    public static TagValue hex(TagValue value) throws ExpressionException {
        String digits = value.asString().strip().replace("_", "");
        if (digits.startsWith("0x") || digits.startsWith("0X")) {
            digits = digits.substring(2);
        } else if (digits.startsWith("x") || digits.startsWith("X")) {
            digits = digits.substring(1);
        }
        return parseRadix(digits, 16, value);
    }

    public static TagValue oct(TagValue value) throws ExpressionException {
        String digits = value.asString().strip().replace("_", "");
        String lower = digits.toLowerCase(Locale.ROOT);
        if (lower.startsWith("0x") || lower.startsWith("x")) {
            return parseRadix(digits.substring(lower.indexOf('x') + 1), 16, value);
        }
        if (lower.startsWith("0b") || lower.startsWith("b")) {
            return parseRadix(digits.substring(lower.indexOf('b') + 1), 2, value);
        }
        if (lower.startsWith("0o") || lower.startsWith("o")) {
            return parseRadix(digits.substring(lower.indexOf('o') + 1), 8, value);
        }
        return parseRadix(digits, 8, value);
    }

    // ---- display ----

    /**
     * The display string of a display-format result.
     */
    public static String stringify(TagValue value) {
        return value.asString();
    }

    // ---- helpers ----

    static long toLong(TagValue value) throws ExpressionException {
        double d = value.toNumber();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw new ExpressionException("Integer operand required, got " + value.asString());
        }
        return (long) d;
    }

    static List<TagValue> flatten(TagValue... values) {
        List<TagValue> flat = new ArrayList<>();
        for (TagValue value : Arrays.asList(values)) {
            flat.addAll(value.toList());
        }
        return flat;
    }

    private static int resolveOffset(String s, long offset) {
        long start = offset < 0 ? s.length() + offset : offset;
        if (start < 0 || start > s.length()) {
            return -1;
        }
        return (int) start;
    }

    private static TagValue parseRadix(String digits, int radix, TagValue original) throws ExpressionException {
        if (digits.isEmpty()) {
            return TagValue.of(0L);
        }
        try {
            return TagValue.of(Long.parseUnsignedLong(digits, radix));
        } catch (NumberFormatException e) {
            throw new ExpressionException("Illegal digit in \"" + original.asString() + "\" for base " + radix, e);
        }
    }

    private static Pattern compile(String pattern, String modifiers) throws ExpressionException {
        String key = modifiers + "/" + pattern;
        Pattern cached = PATTERN_CACHE.get(key);
        if (cached != null) {
            return cached;
        }
        int flags = 0;
        for (char c : modifiers.toCharArray()) {
            switch (c) {
                case 'i' -> flags |= Pattern.CASE_INSENSITIVE;
                case 'm' -> flags |= Pattern.MULTILINE;
                case 's' -> flags |= Pattern.DOTALL;
                case 'x' -> flags |= Pattern.COMMENTS;
                default -> {
                    // g and o do not change a boolean match
                }
            }
        }
        try {
            Pattern compiled = Pattern.compile(pattern, flags);
            PATTERN_CACHE.put(key, compiled);
            return compiled;
        } catch (PatternSyntaxException e) {
            throw new ExpressionException("Invalid regular expression /" + pattern + "/", e);
        }
    }
}
