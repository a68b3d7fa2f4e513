package org.metaconv.runtime;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;

/**
 * Perl {@code sprintf}. Supports the flags {@code -+ 0#}, width, precision and the conversions
 * {@code d i u o x X b B e E f F g G s c %}. Vector flags and {@code *} widths are rejected.
 */
final class PerlFormat {

    private PerlFormat() {
    }

    static String format(String format, List<TagValue> args) throws ExpressionException {
        StringBuilder out = new StringBuilder();
        int argIndex = 0;
        int i = 0;
        while (i < format.length()) {
            char c = format.charAt(i);
            if (c != '%') {
                out.append(c);
                i++;
                continue;
            }
            int start = i++;
            StringBuilder flags = new StringBuilder();
            while (i < format.length() && "-+ 0#".indexOf(format.charAt(i)) >= 0) {
                flags.append(format.charAt(i++));
            }
            int width = -1;
            int widthStart = i;
            while (i < format.length() && Character.isDigit(format.charAt(i))) {
                i++;
            }
            if (i > widthStart) {
                width = Integer.parseInt(format.substring(widthStart, i));
            }
            int precision = -1;
            if (i < format.length() && format.charAt(i) == '.') {
                int precisionStart = ++i;
                while (i < format.length() && Character.isDigit(format.charAt(i))) {
                    i++;
                }
                precision = i > precisionStart ? Integer.parseInt(format.substring(precisionStart, i)) : 0;
            }
            // size modifiers are meaningless for 64-bit values
            while (i < format.length() && "hlqLV".indexOf(format.charAt(i)) >= 0) {
                i++;
            }
            if (i >= format.length()) {
                out.append(format, start, format.length());
                break;
            }
            char conversion = format.charAt(i++);
            if (conversion == '%') {
                out.append('%');
                continue;
            }
            if (conversion == '*' || conversion == 'v') {
                throw new ExpressionException("Unsupported sprintf directive in \"" + format + "\"");
            }
            if ("diuoxXbBeEfFgGsc".indexOf(conversion) < 0) {
                // Perl copies invalid conversions through verbatim
                out.append(format, start, i);
                continue;
            }
            if (argIndex >= args.size()) {
                throw new ExpressionException("Missing argument in sprintf \"" + format + "\"");
            }
            TagValue arg = args.get(argIndex++);
            String body = convert(conversion, flags.toString(), precision, arg);
            out.append(pad(body, flags.toString(), width, conversion));
        }
        return out.toString();
    }

    private static String convert(char conversion, String flags, int precision, TagValue arg) throws ExpressionException {
        switch (conversion) {
            case 'd', 'i', 'u' -> {
                long value = truncate(arg);
                String digits = Long.toString(Math.abs(value));
                if (value == Long.MIN_VALUE) {
                    digits = digits.substring(1);
                }
                digits = zeroExtend(digits, precision);
                return sign(value < 0, flags) + digits;
            }
            case 'o' -> {
                String digits = zeroExtend(Long.toOctalString(truncate(arg)), precision);
                return flags.contains("#") && !digits.startsWith("0") ? "0" + digits : digits;
            }
            case 'x', 'X' -> {
                long value = truncate(arg);
                String digits = zeroExtend(Long.toHexString(value), precision);
                String prefixed = flags.contains("#") && value != 0 ? "0x" + digits : digits;
                return conversion == 'X' ? prefixed.toUpperCase(Locale.ROOT) : prefixed;
            }
            case 'b', 'B' -> {
                long value = truncate(arg);
                String digits = zeroExtend(Long.toBinaryString(value), precision);
                return flags.contains("#") && value != 0 ? "0" + conversion + digits : digits;
            }
            case 'e', 'E', 'f', 'F' -> {
                double value = arg.toNumber();
                if (Double.isNaN(value) || Double.isInfinite(value)) {
                    return nonFinite(value, flags);
                }
                if (conversion == 'f' || conversion == 'F') {
                    // exact binary value, ties to even, as C printf rounds
                    String digits = new BigDecimal(Math.abs(value))
                            .setScale(precision < 0 ? 6 : precision, RoundingMode.HALF_EVEN).toPlainString();
                    if (precision == 0 && flags.contains("#")) {
                        digits += ".";
                    }
                    return sign(value < 0 || (value == 0.0 && 1 / value < 0), flags) + digits;
                }
                String javaFlags = flags.replace("-", "").replace("0", "").replace("#", "");
                String formatted = String.format(Locale.ROOT, "%" + javaFlags + "." + (precision < 0 ? 6 : precision)
                        + Character.toLowerCase(conversion), value);
                return Character.isUpperCase(conversion) ? formatted.toUpperCase(Locale.ROOT) : formatted;
            }
            case 'g', 'G' -> {
                double value = arg.toNumber();
                if (Double.isNaN(value) || Double.isInfinite(value)) {
                    return nonFinite(value, flags);
                }
                String formatted = sign(value < 0 || (value == 0.0 && 1 / value < 0), flags)
                        + formatGeneral(Math.abs(value), precision < 0 ? 6 : Math.max(precision, 1), flags.contains("#"));
                return conversion == 'G' ? formatted.toUpperCase(Locale.ROOT) : formatted;
            }
            case 's' -> {
                String s = arg.asString();
                return precision >= 0 && precision < s.length() ? s.substring(0, precision) : s;
            }
            case 'c' -> {
                return Builtins.chr(arg).asString();
            }
            default -> throw new ExpressionException("Unsupported sprintf conversion %" + conversion);
        }
    }

    /**
     * C {@code %g}: scientific notation when the exponent is below -4 or at least the precision,
     * trailing zeros removed unless the {@code #} flag is set.
     */
    private static String formatGeneral(double value, int precision, boolean alternate) {
        if (value == 0.0) {
            return alternate ? "0." + "0".repeat(precision - 1) : "0";
        }
        BigDecimal rounded = new BigDecimal(value).round(new MathContext(precision, RoundingMode.HALF_EVEN));
        int exponent = rounded.precision() - rounded.scale() - 1;
        String formatted;
        if (exponent < -4 || exponent >= precision) {
            formatted = String.format(Locale.ROOT, "%." + (precision - 1) + "e", value);
            if (!alternate) {
                int e = formatted.indexOf('e');
                formatted = stripZeros(formatted.substring(0, e)) + formatted.substring(e);
            }
        } else {
            formatted = String.format(Locale.ROOT, "%." + Math.max(0, precision - 1 - exponent) + "f", value);
            if (!alternate) {
                formatted = stripZeros(formatted);
            }
        }
        return formatted;
    }

    private static String stripZeros(String number) {
        if (number.indexOf('.') < 0) {
            return number;
        }
        return number.replaceAll("0+$", "").replaceAll("\\.$", "");
    }

    private static String nonFinite(double value, String flags) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        return sign(value < 0, flags) + "Inf";
    }

    private static String sign(boolean negative, String flags) {
        if (negative) {
            return "-";
        }
        if (flags.contains("+")) {
            return "+";
        }
        return flags.contains(" ") ? " " : "";
    }

    private static String zeroExtend(String digits, int precision) {
        if (precision == 0 && digits.equals("0")) {
            return "";
        }
        return digits.length() < precision ? "0".repeat(precision - digits.length()) + digits : digits;
    }

    private static long truncate(TagValue arg) throws ExpressionException {
        return Builtins.toLong(arg);
    }

    private static String pad(String body, String flags, int width, char conversion) {
        if (width <= body.length()) {
            return body;
        }
        int missing = width - body.length();
        if (flags.contains("-")) {
            return body + " ".repeat(missing);
        }
        if (flags.contains("0") && conversion != 's' && conversion != 'c') {
            int signLength = !body.isEmpty() && "+- ".indexOf(body.charAt(0)) >= 0 ? 1 : 0;
            if (body.startsWith("0x", signLength) || body.startsWith("0X", signLength)
                    || body.startsWith("0b", signLength) || body.startsWith("0B", signLength)) {
                signLength += 2;
            }
            return body.substring(0, signLength) + "0".repeat(missing) + body.substring(signLength);
        }
        return " ".repeat(missing) + body;
    }
}
