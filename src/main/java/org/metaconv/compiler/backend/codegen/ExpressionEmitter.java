package org.metaconv.compiler.backend.codegen;

import org.metaconv.compiler.api.ExpressionContext;
import org.metaconv.compiler.api.UnsupportedConstructException;
import org.metaconv.compiler.frontend.ast.BinaryOp;
import org.metaconv.compiler.frontend.ast.ConditionalAssignment;
import org.metaconv.compiler.frontend.ast.FormattedPrint;
import org.metaconv.compiler.frontend.ast.FunctionCall;
import org.metaconv.compiler.frontend.ast.Literal;
import org.metaconv.compiler.frontend.ast.NormalizedNode;
import org.metaconv.compiler.frontend.ast.NormalizedNodeVisitor;
import org.metaconv.compiler.frontend.ast.PostfixConditional;
import org.metaconv.compiler.frontend.ast.SafeDivision;
import org.metaconv.compiler.frontend.ast.StringConcat;
import org.metaconv.compiler.frontend.ast.StringRepeat;
import org.metaconv.compiler.frontend.ast.Symbol;
import org.metaconv.compiler.frontend.ast.Ternary;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Translates a normalized tree into one Java expression of type {@code TagValue}. Statements that
 * must precede the expression (the update of a conditional assignment) are collected in
 * {@link #prelude()}.
 * <p>
 * Not thread-safe; create one per function.
 */
final class ExpressionEmitter implements NormalizedNodeVisitor<String, UnsupportedConstructException> {

    static final String VALUE = "val";
    static final String CONTEXT = "ctx";

    private static final Map<String, String> BINARY_METHODS = Map.ofEntries(
            Map.entry("+", "add"), Map.entry("-", "subtract"), Map.entry("*", "multiply"),
            Map.entry("/", "divide"), Map.entry("%", "modulo"), Map.entry("**", "power"),
            Map.entry("==", "numEq"), Map.entry("!=", "numNe"), Map.entry("<", "numLt"),
            Map.entry(">", "numGt"), Map.entry("<=", "numLe"), Map.entry(">=", "numGe"),
            Map.entry("<=>", "numCmp"),
            Map.entry("eq", "strEq"), Map.entry("ne", "strNe"), Map.entry("lt", "strLt"),
            Map.entry("gt", "strGt"), Map.entry("le", "strLe"), Map.entry("ge", "strGe"),
            Map.entry("cmp", "strCmp"),
            Map.entry("&", "bitAnd"), Map.entry("|", "bitOr"), Map.entry("^", "bitXor"),
            Map.entry("<<", "shiftLeft"), Map.entry(">>", "shiftRight"),
            Map.entry("xor", "xor"), Map.entry(".", "concat"), Map.entry("x", "repeat")
    );

    private static final Map<String, String> LAZY_METHODS = Map.of("&&", "and", "||", "or", "//", "definedOr");

    private static final Pattern INTERPOLATION = Pattern.compile("(?<!\\\\)(?:\\$[A-Za-z_{]|@[A-Za-z_{])");

    private final ExpressionContext context;
    private final List<String> prelude = new ArrayList<>();
    private String valueBinding = VALUE;
    private boolean listPosition;
    private int depth;

    ExpressionEmitter(ExpressionContext context) {
        this.context = context;
    }

    /**
     * Emits the root of a function body. The root is evaluated in list context except for conditions.
     */
    String emitRoot(NormalizedNode root) throws UnsupportedConstructException {
        return emit(root, context != ExpressionContext.BOOLEAN_GATE);
    }

    List<String> prelude() {
        return List.copyOf(prelude);
    }

    private String scalar(NormalizedNode node) throws UnsupportedConstructException {
        return emit(node, false);
    }

    private String list(NormalizedNode node) throws UnsupportedConstructException {
        return emit(node, true);
    }

    private String emit(NormalizedNode node, boolean inList) throws UnsupportedConstructException {
        boolean savedPosition = listPosition;
        listPosition = inList;
        depth++;
        try {
            return node.accept(this);
        } finally {
            depth--;
            listPosition = savedPosition;
        }
    }

    @Override
    public String visit(BinaryOp node) throws UnsupportedConstructException {
        String op = node.operator();
        if (op.equals("=~") || op.equals("!~")) {
            String match = match(node.left(), node.right());
            return op.equals("=~") ? match : "Builtins.not(" + match + ")";
        }
        return binary(op, scalar(node.left()), node.right());
    }

    private String binary(String op, String left, NormalizedNode rightNode) throws UnsupportedConstructException {
        String lazy = LAZY_METHODS.get(op);
        if (lazy != null) {
            return "Builtins." + lazy + "(" + left + ", () -> " + scalar(rightNode) + ")";
        }
        String method = BINARY_METHODS.get(op);
        if (method == null) {
            throw new UnsupportedConstructException("Operator '" + op + "' is not supported");
        }
        return "Builtins." + method + "(" + left + ", " + scalar(rightNode) + ")";
    }

    private String match(NormalizedNode subject, NormalizedNode pattern) throws UnsupportedConstructException {
        if (!(pattern instanceof Literal regex) || regex.kind() != Literal.Kind.REGEX) {
            throw new UnsupportedConstructException("Match against a non-literal pattern");
        }
        if (INTERPOLATION.matcher(regex.value()).find()) {
            throw new UnsupportedConstructException("Interpolating pattern /" + regex.value() + "/");
        }
        String modifiers = regex.modifiers().replaceAll("[^imsx]", "");
        try {
            Pattern.compile(regex.value());
        } catch (PatternSyntaxException e) {
            throw new UnsupportedConstructException("Pattern /" + regex.value() + "/ is not a valid Java pattern: "
                    + e.getDescription());
        }
        return "Builtins.matches(" + scalar(subject) + ", " + JavaLiterals.quote(regex.value()) + ", "
                + JavaLiterals.quote(modifiers) + ")";
    }

    @Override
    public String visit(StringConcat node) throws UnsupportedConstructException {
        List<String> parts = new ArrayList<>();
        for (NormalizedNode part : node.parts()) {
            // "@val" interpolates the whole list
            boolean list = part instanceof Symbol symbol && symbol.kind() == Symbol.Kind.VALUE_LIST;
            parts.add(emit(part, list));
        }
        return "Builtins.concat(" + String.join(", ", parts) + ")";
    }

    @Override
    public String visit(StringRepeat node) throws UnsupportedConstructException {
        return "Builtins.repeat(" + scalar(node.string()) + ", " + scalar(node.count()) + ")";
    }

    @Override
    public String visit(Ternary node) throws UnsupportedConstructException {
        return "(" + scalar(node.condition()) + ".isTrue() ? " + emit(node.ifTrue(), listPosition) + " : "
                + emit(node.ifFalse(), listPosition) + ")";
    }

    @Override
    public String visit(SafeDivision node) throws UnsupportedConstructException {
        String divisor = scalar(node.divisor());
        return "(" + divisor + ".isTrue() ? Builtins.divide(" + scalar(node.numerator()) + ", " + divisor
                + ") : TagValue.of(0L))";
    }

    @Override
    public String visit(FunctionCall node) throws UnsupportedConstructException {
        BuiltinMapping mapping = BuiltinMapping.lookup(node.name()).orElseThrow(
                () -> new UnsupportedConstructException("Function '" + node.name() + "' is not supported"));
        List<NormalizedNode> args = node.args();
        if (!mapping.accepts(args.size())) {
            throw new UnsupportedConstructException(
                    "Function '" + node.name() + "' called with " + args.size() + " argument(s)");
        }
        if (mapping.returnsList() && !listPosition && !node.name().equals("unpack")) {
            throw new UnsupportedConstructException("'" + node.name() + "' in scalar context");
        }
        List<String> code = new ArrayList<>();
        for (int i = 0; i < args.size(); i++) {
            NormalizedNode arg = args.get(i);
            if (i == 0 && node.name().equals("split") && arg instanceof Literal regex
                    && regex.kind() == Literal.Kind.REGEX) {
                code.add("TagValue.of(" + JavaLiterals.quote(regex.value()) + ")");
            } else {
                boolean list = mapping.listFrom() >= 0 && i >= mapping.listFrom();
                code.add(emit(arg, list));
            }
        }
        String call = "Builtins." + mapping.method() + "(" + String.join(", ", code) + ")";
        // unpack in scalar context yields its first value
        return mapping.returnsList() && !listPosition ? call + ".get(0)" : call;
    }

    @Override
    public String visit(FormattedPrint node) throws UnsupportedConstructException {
        StringBuilder sb = new StringBuilder("Builtins.sprintf(").append(scalar(node.format()));
        for (NormalizedNode arg : node.args()) {
            sb.append(", ").append(list(arg));
        }
        return sb.append(')').toString();
    }

    @Override
    public String visit(PostfixConditional node) throws UnsupportedConstructException {
        String condition = scalar(node.condition());
        String test = node.negated() ? "!" + condition + ".isTrue()" : condition + ".isTrue()";
        return "(" + test + " ? " + emit(node.body(), listPosition) + " : TagValue.undef())";
    }

    @Override
    public String visit(ConditionalAssignment node) throws UnsupportedConstructException {
        if (depth != 1 || !valueBinding.equals(VALUE)) {
            throw new UnsupportedConstructException("Conditional assignment inside an expression");
        }
        String condition = scalar(node.condition());
        String updated = node.operator().equals("=")
                ? scalar(node.value())
                : binary(node.operator(), VALUE, node.value());
        String binding = VALUE + "1";
        prelude.add("TagValue " + binding + " = (" + condition + ".isTrue() ? " + updated + " : " + VALUE + ");");
        valueBinding = binding;
        return emit(node.result(), listPosition);
    }

    @Override
    public String visit(Literal node) throws UnsupportedConstructException {
        switch (node.kind()) {
            case NUMBER -> {
                return number(node.value());
            }
            case STRING -> {
                return "TagValue.of(" + JavaLiterals.quote(node.value()) + ")";
            }
            case UNDEF -> {
                return "TagValue.undef()";
            }
            default -> throw new UnsupportedConstructException("Pattern /" + node.value() + "/ used as a value");
        }
    }

    private static String number(String canonical) throws UnsupportedConstructException {
        try {
            return "TagValue.of(" + Long.parseLong(canonical) + "L)";
        } catch (NumberFormatException notIntegral) {
            double value;
            try {
                value = Double.parseDouble(canonical);
            } catch (NumberFormatException e) {
                throw new UnsupportedConstructException("Malformed number " + canonical);
            }
            if (Double.isNaN(value)) {
                return "TagValue.of(Double.NaN)";
            }
            if (Double.isInfinite(value)) {
                return value > 0 ? "TagValue.of(Double.POSITIVE_INFINITY)" : "TagValue.of(Double.NEGATIVE_INFINITY)";
            }
            return "TagValue.of(" + Double.toString(value) + ")";
        }
    }

    @Override
    public String visit(Symbol node) throws UnsupportedConstructException {
        switch (node.kind()) {
            case VALUE -> {
                return valueBinding;
            }
            case VALUE_ELEMENT -> {
                return valueBinding + ".get(" + node.index() + ")";
            }
            case VALUE_LIST -> {
                return listPosition ? valueBinding : "TagValue.of((long) " + valueBinding + ".toList().size())";
            }
            default -> {
                if (context != ExpressionContext.BOOLEAN_GATE) {
                    throw new UnsupportedConstructException("Variable '" + node.name() + "' outside a condition");
                }
                if (node.kind() == Symbol.Kind.VARIABLE && (node.name().equals("self") || node.name().matches("\\d+"))) {
                    throw new UnsupportedConstructException("Variable '$" + node.name() + "' is not a context field");
                }
                return CONTEXT + ".get(" + JavaLiterals.quote(node.name()) + ")";
            }
        }
    }
}
