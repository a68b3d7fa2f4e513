package org.metaconv.compiler.frontend.normalize;

import java.util.Map;
import java.util.Set;

/**
 * Perl operator facts from perlop, highest precedence first:
 * <pre>
 *   22  **                         right
 *   21  ! ~ \ unary+ unary-        right
 *   20  =~ !~
 *   19  * / % x
 *   18  + - .
 *   17  &lt;&lt; &gt;&gt;
 *   16  named unary operators
 *   14  &lt; &gt; &lt;= &gt;= lt gt le ge
 *   13  == != &lt;=&gt; eq ne cmp
 *   12  &amp;
 *   11  | ^
 *   10  &amp;&amp;
 *    9  || //
 *    8  .. ...
 *    7  ?:                         right
 *    6  = += -= *= etc.            right
 *    5  , =&gt;
 *       list operators (rightward)
 *    4  not                        right
 *    3  and
 *    2  or xor
 * </pre>
 */
public final class PerlOperators {

    public static final int UNARY = 21;
    public static final int NAMED_UNARY = 16;
    public static final int CONDITIONAL = 7;

    private static final Map<String, Integer> BINARY = Map.ofEntries(
            Map.entry("**", 22),
            Map.entry("=~", 20), Map.entry("!~", 20),
            Map.entry("*", 19), Map.entry("/", 19), Map.entry("%", 19), Map.entry("x", 19),
            Map.entry("+", 18), Map.entry("-", 18), Map.entry(".", 18),
            Map.entry("<<", 17), Map.entry(">>", 17),
            Map.entry("<", 14), Map.entry(">", 14), Map.entry("<=", 14), Map.entry(">=", 14),
            Map.entry("lt", 14), Map.entry("gt", 14), Map.entry("le", 14), Map.entry("ge", 14),
            Map.entry("==", 13), Map.entry("!=", 13), Map.entry("<=>", 13),
            Map.entry("eq", 13), Map.entry("ne", 13), Map.entry("cmp", 13),
            Map.entry("&", 12),
            Map.entry("|", 11), Map.entry("^", 11),
            Map.entry("&&", 10),
            Map.entry("||", 9), Map.entry("//", 9)
    );

    private static final Set<String> RIGHT_ASSOCIATIVE = Set.of("**");

    private static final Set<String> PREFIX = Set.of("!", "-", "+");

    private static final Set<String> ASSIGNMENT = Set.of(
            "=", "+=", "-=", "*=", "/=", ".=", "x=", "%=", "**=", "&=", "|=", "^=", "<<=", ">>=", "&&=", "||=", "//=");

    private static final Set<String> WORD_LOGICAL = Set.of("not", "and", "or", "xor");

    /** Named unary operators: bind tighter than comparison, looser than arithmetic. */
    private static final Set<String> NAMED_UNARY_FUNCTIONS = Set.of(
            "defined", "length", "uc", "lc", "ucfirst", "lcfirst", "int", "abs", "sqrt", "hex", "oct",
            "ord", "chr", "exp", "log", "sin", "cos", "ref", "quotemeta", "chomp", "chop", "lock", "rand");

    /** Rightward list operators: everything up to the end of the comma list is an argument. */
    private static final Set<String> LIST_FUNCTIONS = Set.of(
            "sprintf", "join", "pack", "unpack", "split", "substr", "index", "rindex", "atan2", "reverse", "sort");

    private static final Set<String> STATEMENT_MODIFIERS = Set.of("if", "unless");

    private static final Set<String> KEYWORDS = Set.of(
            "if", "unless", "return", "my", "local", "our", "else", "elsif", "while", "until", "for", "foreach",
            "qw", "do", "eval", "sub", "last", "next", "undef");

    private PerlOperators() {
    }

    public static boolean isBinary(String op) {
        return BINARY.containsKey(op);
    }

    /**
     * @return The binding strength of a binary operator, or -1 if {@code op} is not one.
     */
    public static int binaryPrecedence(String op) {
        return BINARY.getOrDefault(op, -1);
    }

    public static boolean isRightAssociative(String op) {
        return RIGHT_ASSOCIATIVE.contains(op);
    }

    public static boolean isPrefix(String op) {
        return PREFIX.contains(op);
    }

    public static boolean isAssignment(String op) {
        return ASSIGNMENT.contains(op);
    }

    public static boolean isWordLogical(String op) {
        return WORD_LOGICAL.contains(op);
    }

    public static boolean isNamedUnary(String word) {
        return NAMED_UNARY_FUNCTIONS.contains(word);
    }

    public static boolean isListOperator(String word) {
        return LIST_FUNCTIONS.contains(word);
    }

    public static boolean isStatementModifier(String word) {
        return STATEMENT_MODIFIERS.contains(word);
    }

    /**
     * @return {@code true} for words that can introduce a function call: builtins and package-qualified names.
     */
    public static boolean isCallable(String word) {
        return NAMED_UNARY_FUNCTIONS.contains(word) || LIST_FUNCTIONS.contains(word) || word.contains("::");
    }

    public static boolean isKeyword(String word) {
        return KEYWORDS.contains(word);
    }
}
