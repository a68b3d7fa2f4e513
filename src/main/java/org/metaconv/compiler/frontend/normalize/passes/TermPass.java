package org.metaconv.compiler.frontend.normalize.passes;

import org.metaconv.compiler.frontend.ast.AstNode;
import org.metaconv.compiler.frontend.ast.Literal;
import org.metaconv.compiler.frontend.ast.NormalizedNode;
import org.metaconv.compiler.frontend.ast.RawKind;
import org.metaconv.compiler.frontend.ast.RawNode;
import org.metaconv.compiler.frontend.ast.StringConcat;
import org.metaconv.compiler.frontend.ast.Symbol;
import org.metaconv.compiler.frontend.normalize.NodeRuns;
import org.metaconv.compiler.frontend.normalize.NormalizerPass;
import org.metaconv.compiler.frontend.normalize.PerlOperators;
import org.metaconv.compiler.frontend.normalize.PrecedenceTier;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns leaf tokens into terms: variables, numbers, strings (with interpolation), regex literals
 * and barewords. On runs it fuses multi-token variables such as {@code $$self{Make}} and
 * {@code $val[1]}, drops statement separators and a leading {@code return}, and unwraps a
 * parenthesized single expression that is not a call's argument list.
 */
public final class TermPass implements NormalizerPass {

    private static final Pattern CONTEXT_FIELD = Pattern.compile("\\$\\$self\\{['\"]?(\\w+)['\"]?}");
    private static final Pattern SCALAR = Pattern.compile("\\$([A-Za-z_]\\w*)");
    private static final Pattern INTERPOLATED = Pattern.compile(
            "\\$\\$self\\{['\"]?(\\w+)['\"]?}|\\$val\\[(-?\\d+)]|\\$(?:\\{([A-Za-z_]\\w*)}|([A-Za-z_]\\w*))|@(?:\\{val}|val(?!\\w))");
    private static final Pattern REGEX_MODIFIERS = Pattern.compile("[imsxgo]*");
    private static final int UNSUPPORTED = -1;

    @Override
    public PrecedenceTier tier() {
        return PrecedenceTier.HIGH;
    }

    @Override
    public AstNode apply(AstNode node) {
        if (!(node instanceof RawNode raw)) {
            return node;
        }
        if (raw.kind().isToken()) {
            NormalizedNode term = term(raw);
            return term != null ? term : raw;
        }
        if (raw.kind().isSequence() || raw.is(RawKind.DOCUMENT)) {
            return fuse(raw);
        }
        return raw;
    }

    private static NormalizedNode term(RawNode token) {
        String text = token.content();
        switch (token.kind()) {
            case SYMBOL -> {
                return symbol(text);
            }
            case NUMBER -> {
                String canonical = canonicalNumber(text);
                return canonical != null ? Literal.number(canonical) : null;
            }
            case QUOTE_SINGLE -> {
                return Literal.string(unescapeSingle(text));
            }
            case QUOTE_DOUBLE -> {
                return interpolate(text);
            }
            case REGEX_MATCH -> {
                return regex(text);
            }
            default -> {
                return null;
            }
        }
    }

    private static Symbol symbol(String text) {
        if (text.equals("$val")) {
            return Symbol.value();
        }
        if (text.equals("@val")) {
            return Symbol.valueList();
        }
        Matcher field = CONTEXT_FIELD.matcher(text);
        if (field.matches()) {
            return Symbol.contextField(field.group(1));
        }
        Matcher scalar = SCALAR.matcher(text);
        if (scalar.matches()) {
            return Symbol.variable(scalar.group(1));
        }
        return null;
    }

    /**
     * @return The decimal form of a Perl numeric literal, or {@code null} if it cannot be read.
     */
    static String canonicalNumber(String text) {
        String s = text.replace("_", "");
        try {
            String lower = s.toLowerCase(Locale.ROOT);
            if (lower.startsWith("0x")) {
                return Long.toString(Long.parseLong(s.substring(2), 16));
            }
            if (lower.startsWith("0b")) {
                return Long.toString(Long.parseLong(s.substring(2), 2));
            }
            if (s.length() > 1 && s.startsWith("0") && s.chars().allMatch(Character::isDigit)) {
                return Long.toString(Long.parseLong(s.substring(1), 8));
            }
            BigDecimal value = new BigDecimal(s.endsWith(".") ? s.substring(0, s.length() - 1) : s);
            if (value.signum() == 0 || value.stripTrailingZeros().scale() <= 0) {
                try {
                    return Long.toString(value.longValueExact());
                } catch (ArithmeticException tooLarge) {
                    return Double.toString(value.doubleValue());
                }
            }
            return Double.toString(value.doubleValue());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static String unescapeSingle(String body) {
        StringBuilder out = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length() && (body.charAt(i + 1) == '\\' || body.charAt(i + 1) == '\'')) {
                out.append(body.charAt(++i));
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    /**
     * Resolves escapes and splits {@code "...$val..."} into a concatenation.
     *
     * @return The string term, or {@code null} for interpolations that are not supported.
     */
    static NormalizedNode interpolate(String body) {
        List<NormalizedNode> parts = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length()) {
                i = escape(body, i + 1, text);
                if (i == UNSUPPORTED) {
                    return null;
                }
                continue;
            }
            if (c == '$' || c == '@') {
                Matcher m = INTERPOLATED.matcher(body);
                m.region(i, body.length());
                if (!m.lookingAt()) {
                    if (c == '@' || i == body.length() - 1) {
                        text.append(c);
                        i++;
                        continue;
                    }
                    // $1, $_ and friends
                    return null;
                }
                NormalizedNode variable;
                if (m.group(1) != null) {
                    variable = Symbol.contextField(m.group(1));
                } else if (m.group(2) != null) {
                    try {
                        variable = Symbol.element(Integer.parseInt(m.group(2)));
                    } catch (NumberFormatException e) {
                        return null;
                    }
                } else if (m.group(3) != null || m.group(4) != null) {
                    String name = m.group(3) != null ? m.group(3) : m.group(4);
                    variable = name.equals("val") ? Symbol.value() : Symbol.variable(name);
                } else {
                    variable = Symbol.valueList();
                }
                int end = m.end();
                if (end < body.length() && (body.charAt(end) == '[' || body.charAt(end) == '{'
                        || body.startsWith("->", end))) {
                    return null;
                }
                if (!text.isEmpty()) {
                    parts.add(Literal.string(text.toString()));
                    text.setLength(0);
                }
                parts.add(variable);
                i = end;
                continue;
            }
            text.append(c);
            i++;
        }
        if (!text.isEmpty() || parts.isEmpty()) {
            parts.add(Literal.string(text.toString()));
        }
        return parts.size() == 1 && parts.get(0) instanceof Literal ? parts.get(0) : new StringConcat(parts);
    }

    /**
     * Appends the character of the escape whose letter is at {@code i}.
     *
     * @return The index after the escape, or {@link #UNSUPPORTED}.
     */
    private static int escape(String body, int i, StringBuilder out) {
        char c = body.charAt(i);
        switch (c) {
            case 'n' -> out.append('\n');
            case 't' -> out.append('\t');
            case 'r' -> out.append('\r');
            case 'f' -> out.append('\f');
            case 'a' -> out.append('\u0007');
            case 'e' -> out.append('\u001B');
            case 'x' -> {
                int start = i + 1;
                if (start < body.length() && body.charAt(start) == '{') {
                    int close = body.indexOf('}', start);
                    if (close < 0) {
                        return UNSUPPORTED;
                    }
                    int code = bracedHexCode(body.substring(start + 1, close).strip());
                    if (code == UNSUPPORTED) {
                        return UNSUPPORTED;
                    }
                    out.appendCodePoint(code);
                    return close + 1;
                }
                int end = start;
                while (end < body.length() && end < start + 2 && Character.digit(body.charAt(end), 16) >= 0) {
                    end++;
                }
                out.append((char) parseCode(body.substring(start, end), 16));
                return end;
            }
            default -> {
                if (c >= '0' && c <= '7') {
                    int end = i;
                    while (end < body.length() && end < i + 3 && body.charAt(end) >= '0' && body.charAt(end) <= '7') {
                        end++;
                    }
                    out.append((char) parseCode(body.substring(i, end), 8));
                    return end;
                }
                out.append(c);
            }
        }
        return i + 1;
    }

    private static int parseCode(String digits, int radix) {
        return digits.isEmpty() ? 0 : Integer.parseInt(digits, radix);
    }

    /**
     * Reads the leading hex digits of {@code \x{...}} the way Perl does: underscores between digits are
     * skipped and reading stops at the first other character, so {@code \x{zz}} is NUL.
     *
     * @return The code point, or {@link #UNSUPPORTED} beyond the Unicode range.
     */
    static int bracedHexCode(String digits) {
        long code = 0;
        for (int k = 0; k < digits.length(); k++) {
            char d = digits.charAt(k);
            if (d == '_' && k > 0) {
                continue;
            }
            int value = d < 128 ? Character.digit(d, 16) : -1;
            if (value < 0) {
                break;
            }
            code = code * 16 + value;
            if (code > Character.MAX_CODE_POINT) {
                return UNSUPPORTED;
            }
        }
        return (int) code;
    }

    /**
     * Reads {@code /pattern/mods}, {@code m/pattern/mods} or {@code m{pattern}mods}.
     */
    static Literal regex(String text) {
        int i = 0;
        if (text.startsWith("m") && text.length() > 1 && !Character.isLetterOrDigit(text.charAt(1))) {
            i = 1;
        }
        if (i >= text.length()) {
            return null;
        }
        char open = text.charAt(i);
        char close = switch (open) {
            case '(' -> ')';
            case '{' -> '}';
            case '[' -> ']';
            case '<' -> '>';
            default -> open;
        };
        int end = text.lastIndexOf(close);
        if (end <= i) {
            return null;
        }
        String modifiers = text.substring(end + 1);
        if (!REGEX_MODIFIERS.matcher(modifiers).matches()) {
            return null;
        }
        return Literal.regex(text.substring(i + 1, end), modifiers);
    }

    private static RawNode fuse(RawNode raw) {
        List<AstNode> in = raw.children();
        List<AstNode> out = new ArrayList<>(in.size());
        boolean changed = false;
        int i = 0;
        while (i < in.size()) {
            AstNode child = in.get(i);
            if (child instanceof RawNode token && token.is(RawKind.STRUCTURE)) {
                changed = true;
                i++;
                continue;
            }
            if (out.isEmpty() && "return".equals(NodeRuns.word(child)) && raw.is(RawKind.STATEMENT)) {
                changed = true;
                i++;
                continue;
            }
            int consumed = fuseContextField(in, i, out);
            if (consumed == 0) {
                consumed = fuseElement(in, i, out);
            }
            if (consumed == 0) {
                consumed = bareword(in, i, out);
            }
            if (consumed == 0) {
                consumed = unwrapParentheses(in, i, out);
            }
            if (consumed > 0) {
                changed = true;
                i += consumed;
                continue;
            }
            out.add(child);
            i++;
        }
        return changed ? raw.withChildren(out) : raw;
    }

    /**
     * {@code $$self{X}} as {@code CAST $} + {@code $self} + subscript, {@code $$self} + subscript,
     * or {@code $self->{X}}.
     */
    private static int fuseContextField(List<AstNode> in, int i, List<AstNode> out) {
        AstNode first = in.get(i);
        if (first instanceof RawNode cast && cast.is(RawKind.CAST, "$") && isSelf(at(in, i + 1))) {
            String key = hashKey(at(in, i + 2));
            if (key != null) {
                out.add(Symbol.contextField(key));
                return 3;
            }
        }
        if (first instanceof RawNode symbol && symbol.is(RawKind.SYMBOL, "$$self")) {
            String key = hashKey(at(in, i + 1));
            if (key != null) {
                out.add(Symbol.contextField(key));
                return 2;
            }
        }
        if (isSelf(first) && NodeRuns.isOperator(at(in, i + 1), "->")) {
            String key = hashKey(at(in, i + 2));
            if (key != null) {
                out.add(Symbol.contextField(key));
                return 3;
            }
        }
        return 0;
    }

    private static int fuseElement(List<AstNode> in, int i, List<AstNode> out) {
        if (Symbol.value().equals(in.get(i)) && at(in, i + 1) instanceof RawNode subscript
                && subscript.is(RawKind.SUBSCRIPT, "[") && subscript.children().size() == 1
                && subscript.children().get(0) instanceof Literal index && index.kind() == Literal.Kind.NUMBER) {
            try {
                out.add(Symbol.element(Integer.parseInt(index.value())));
                return 2;
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }

    /**
     * A word that is neither a keyword nor a function and is not followed by an argument list is a string.
     */
    private static int bareword(List<AstNode> in, int i, List<AstNode> out) {
        String word = NodeRuns.word(in.get(i));
        if (word == null || isArguments(at(in, i + 1))) {
            return 0;
        }
        if (word.equals("undef")) {
            out.add(Literal.undef());
            return 1;
        }
        if (PerlOperators.isKeyword(word) || PerlOperators.isCallable(word) || !word.matches("[A-Za-z_]\\w*")) {
            return 0;
        }
        out.add(Literal.string(word));
        return 1;
    }

    private static int unwrapParentheses(List<AstNode> in, int i, List<AstNode> out) {
        if (!(in.get(i) instanceof RawNode args) || !args.is(RawKind.ARGUMENTS) || args.children().size() != 1
                || !(args.children().get(0) instanceof NormalizedNode item)) {
            return 0;
        }
        AstNode previous = out.isEmpty() ? null : out.get(out.size() - 1);
        if (previous != null && (NodeRuns.word(previous) != null || NodeRuns.isOperator(previous, "->"))) {
            return 0;
        }
        out.add(item);
        return 1;
    }

    private static boolean isSelf(AstNode node) {
        return Symbol.variable("self").equals(node);
    }

    private static boolean isArguments(AstNode node) {
        return node instanceof RawNode raw && raw.is(RawKind.ARGUMENTS);
    }

    private static String hashKey(AstNode node) {
        if (node instanceof RawNode subscript && subscript.is(RawKind.SUBSCRIPT, "{")
                && subscript.children().size() == 1 && subscript.children().get(0) instanceof Literal key
                && key.kind() == Literal.Kind.STRING && key.value().matches("\\w+")) {
            return key.value();
        }
        return null;
    }

    private static AstNode at(List<AstNode> nodes, int index) {
        return index < nodes.size() ? nodes.get(index) : null;
    }
}
