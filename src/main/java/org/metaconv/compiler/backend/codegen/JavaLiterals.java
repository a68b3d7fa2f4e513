package org.metaconv.compiler.backend.codegen;

/**
 * Escaping of arbitrary text for Java source.
 */
public final class JavaLiterals {

    private JavaLiterals() {
    }

    /**
     * @return {@code s} as a Java string literal including the quotes.
     */
    public static String quote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                default -> {
                    if (c < 0x20 || (c >= 0x7F && c <= 0xFF)) {
                        sb.append('\\').append(Integer.toOctalString(c | 0x200).substring(1));
                    } else if (c > 0xFF) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }

    /**
     * Makes text safe inside a {@code //} comment: line breaks would end the comment and
     * backslash-u sequences are decoded by javac before lexing.
     */
    public static String commentSafe(String s) {
        String oneLine = s.replaceAll("[\\r\\n\\u2028\\u2029]+", " ");
        StringBuilder sb = new StringBuilder(oneLine.length());
        int i = 0;
        while (i < oneLine.length()) {
            int run = 0;
            while (i + run < oneLine.length() && oneLine.charAt(i + run) == '\\') {
                run++;
            }
            if (run == 0) {
                sb.append(oneLine.charAt(i++));
                continue;
            }
            sb.append("\\".repeat(run));
            // an odd run before 'u' would start a unicode escape
            if (run % 2 == 1 && i + run < oneLine.length() && oneLine.charAt(i + run) == 'u') {
                sb.append('\\');
            }
            i += run;
        }
        return sb.toString();
    }
}
