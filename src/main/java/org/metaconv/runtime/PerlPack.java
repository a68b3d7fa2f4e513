package org.metaconv.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Perl {@code pack}/{@code unpack} for the template letters used by tag tables:
 * {@code a A Z H h C c n N v V s S l L x}, each with an optional count or {@code *}.
 * Native-order integers ({@code s S l L}) are little-endian. Binary strings hold one byte per char.
 */
final class PerlPack {

    private PerlPack() {
    }

    private record Directive(char letter, int count, boolean star) {
    }

    static List<TagValue> unpack(String template, String data) throws ExpressionException {
        List<TagValue> out = new ArrayList<>();
        int pos = 0;
        for (Directive d : parse(template)) {
            int remaining = data.length() - pos;
            switch (d.letter()) {
                case 'a', 'A', 'Z' -> {
                    int n = d.star() ? remaining : Math.min(d.count(), remaining);
                    String field = data.substring(pos, pos + n);
                    pos += n;
                    if (d.letter() == 'A') {
                        field = field.replaceAll("[\\x00 \\t\\n\\r]+$", "");
                    } else if (d.letter() == 'Z') {
                        int nul = field.indexOf('\0');
                        field = nul >= 0 ? field.substring(0, nul) : field;
                    }
                    out.add(new TagValue.Str(field));
                }
                case 'H', 'h' -> {
                    int nibbles = d.star() ? remaining * 2 : Math.min(d.count(), remaining * 2);
                    StringBuilder hex = new StringBuilder();
                    for (int k = 0; k < nibbles; k++) {
                        int b = data.charAt(pos + k / 2) & 0xFF;
                        boolean high = (k % 2 == 0) == (d.letter() == 'H');
                        hex.append(Character.forDigit(high ? b >> 4 : b & 0x0F, 16));
                    }
                    pos += (nibbles + 1) / 2;
                    out.add(new TagValue.Str(hex.toString()));
                }
                case 'x' -> {
                    int n = d.star() ? remaining : d.count();
                    if (n > remaining) {
                        throw new ExpressionException("'x' outside of string in unpack");
                    }
                    pos += n;
                }
                default -> {
                    int size = integerSize(d.letter());
                    int n = d.star() ? remaining / size : d.count();
                    for (int k = 0; k < n && data.length() - pos >= size; k++) {
                        out.add(TagValue.of(readInteger(d.letter(), data, pos, size)));
                        pos += size;
                    }
                }
            }
        }
        return out;
    }

    static String pack(String template, List<TagValue> args) throws ExpressionException {
        StringBuilder out = new StringBuilder();
        int argIndex = 0;
        for (Directive d : parse(template)) {
            switch (d.letter()) {
                case 'a', 'A', 'Z' -> {
                    String s = argIndex < args.size() ? args.get(argIndex++).asString() : "";
                    int n = d.star() ? s.length() + (d.letter() == 'Z' ? 1 : 0) : d.count();
                    char padding = d.letter() == 'A' ? ' ' : '\0';
                    for (int k = 0; k < n; k++) {
                        boolean terminator = d.letter() == 'Z' && k == n - 1;
                        out.append(k < s.length() && !terminator ? s.charAt(k) : padding);
                    }
                }
                case 'H', 'h' -> {
                    String hex = argIndex < args.size() ? args.get(argIndex++).asString() : "";
                    int nibbles = d.star() ? hex.length() : Math.min(d.count(), hex.length());
                    for (int k = 0; k < nibbles; k += 2) {
                        int first = nibble(hex, k);
                        int second = k + 1 < nibbles ? nibble(hex, k + 1) : 0;
                        out.append((char) (d.letter() == 'H' ? first << 4 | second : second << 4 | first));
                    }
                }
                case 'x' -> out.append("\0".repeat(d.star() ? 0 : d.count()));
                default -> {
                    int size = integerSize(d.letter());
                    int n = d.star() ? args.size() - argIndex : d.count();
                    for (int k = 0; k < n; k++) {
                        long value = argIndex < args.size() ? Builtins.toLong(args.get(argIndex++)) : 0;
                        writeInteger(d.letter(), value, size, out);
                    }
                }
            }
        }
        return out.toString();
    }

    private static List<Directive> parse(String template) throws ExpressionException {
        List<Directive> directives = new ArrayList<>();
        int i = 0;
        while (i < template.length()) {
            char letter = template.charAt(i++);
            if (Character.isWhitespace(letter)) {
                continue;
            }
            if ("aAZHhCcnNvVsSlLx".indexOf(letter) < 0) {
                throw new ExpressionException("Unsupported pack template letter '" + letter + "' in \"" + template + "\"");
            }
            if (i < template.length() && template.charAt(i) == '*') {
                directives.add(new Directive(letter, 0, true));
                i++;
                continue;
            }
            int start = i;
            while (i < template.length() && Character.isDigit(template.charAt(i))) {
                i++;
            }
            int count = i > start ? Integer.parseInt(template.substring(start, i)) : 1;
            directives.add(new Directive(letter, count, false));
        }
        return directives;
    }

    private static int integerSize(char letter) {
        return switch (letter) {
            case 'C', 'c' -> 1;
            case 'n', 'v', 's', 'S' -> 2;
            default -> 4;
        };
    }

    private static long readInteger(char letter, String data, int pos, int size) {
        boolean bigEndian = letter == 'n' || letter == 'N';
        long value = 0;
        for (int k = 0; k < size; k++) {
            int b = data.charAt(pos + (bigEndian ? k : size - 1 - k)) & 0xFF;
            value = value << 8 | b;
        }
        return switch (letter) {
            case 'c' -> (byte) value;
            case 's' -> (short) value;
            case 'l' -> (int) value;
            default -> value;
        };
    }

    private static void writeInteger(char letter, long value, int size, StringBuilder out) {
        boolean bigEndian = letter == 'n' || letter == 'N';
        for (int k = 0; k < size; k++) {
            int shift = 8 * (bigEndian ? size - 1 - k : k);
            out.append((char) (value >> shift & 0xFF));
        }
    }

    private static int nibble(String hex, int index) throws ExpressionException {
        int digit = Character.digit(hex.toLowerCase(Locale.ROOT).charAt(index), 16);
        if (digit < 0) {
            throw new ExpressionException("Illegal hex digit in \"" + hex + "\"");
        }
        return digit;
    }
}
