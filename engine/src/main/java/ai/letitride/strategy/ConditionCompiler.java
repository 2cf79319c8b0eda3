package ai.letitride.strategy;

import ai.letitride.game.HandAnalysis;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.IntBinaryOperator;
import java.util.function.Predicate;
import java.util.function.ToIntFunction;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiles a rule condition into a predicate over {@link HandAnalysis}.
 *
 * <p>Grammar (keywords and field names are case-insensitive):
 * <pre>
 *   condition  := "default" | or
 *   or         := and ("or" and)*
 *   and        := not ("and" not)*
 *   not        := "not" not | primary
 *   primary    := "(" or ")" | operand [comparator operand]
 *   operand    := field | integer
 *   comparator := "&gt;=" | "&lt;=" | "&gt;" | "&lt;" | "==" | "!="
 * </pre>
 * Boolean fields stand alone; numeric fields and integers only appear in comparisons.
 * Compilation happens once, when the strategy is built.
 */
final class ConditionCompiler {
    static final String DEFAULT = "default";

    private static final Pattern TOKEN = Pattern.compile(
            "\\s*(>=|<=|==|!=|>|<|\\(|\\)|-?\\d+|[A-Za-z_][A-Za-z_0-9]*)");

    private final String source;
    private final List<String> tokens;
    private int pos;

    private ConditionCompiler(String source, List<String> tokens) {
        this.source = source;
        this.tokens = tokens;
    }

    /**
     * @throws ConditionParseException for empty or malformed input and unknown fields
     * @throws InvalidFieldException   when a field is used as the wrong type
     */
    static Predicate<HandAnalysis> compile(String condition) {
        if (condition == null || condition.isBlank()) {
            throw new ConditionParseException("Condition must not be empty");
        }
        ConditionCompiler compiler = new ConditionCompiler(condition, tokenize(condition));
        return compiler.parseCondition();
    }

    private static List<String> tokenize(String condition) {
        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(condition);
        int index = 0;
        while (index < condition.length()) {
            if (condition.substring(index).isBlank()) {
                break;
            }
            if (!matcher.find(index) || matcher.start() != index) {
                throw new ConditionParseException(condition,
                        "unexpected character '" + condition.substring(index).trim().charAt(0) + "'");
            }
            tokens.add(matcher.group(1).toLowerCase(Locale.ROOT));
            index = matcher.end();
        }
        return tokens;
    }

    private Predicate<HandAnalysis> parseCondition() {
        if (tokens.size() == 1 && DEFAULT.equals(tokens.get(0))) {
            return analysis -> true;
        }
        Predicate<HandAnalysis> predicate = parseOr();
        if (pos < tokens.size()) {
            throw new ConditionParseException(source, "unexpected '" + tokens.get(pos) + "'");
        }
        return predicate;
    }

    private Predicate<HandAnalysis> parseOr() {
        Predicate<HandAnalysis> left = parseAnd();
        while (accept("or")) {
            Predicate<HandAnalysis> a = left;
            Predicate<HandAnalysis> b = parseAnd();
            left = analysis -> a.test(analysis) || b.test(analysis);
        }
        return left;
    }

    private Predicate<HandAnalysis> parseAnd() {
        Predicate<HandAnalysis> left = parseNot();
        while (accept("and")) {
            Predicate<HandAnalysis> a = left;
            Predicate<HandAnalysis> b = parseNot();
            left = analysis -> a.test(analysis) && b.test(analysis);
        }
        return left;
    }

    private Predicate<HandAnalysis> parseNot() {
        if (accept("not")) {
            Predicate<HandAnalysis> inner = parseNot();
            return analysis -> !inner.test(analysis);
        }
        return parsePrimary();
    }

    private Predicate<HandAnalysis> parsePrimary() {
        if (accept("(")) {
            Predicate<HandAnalysis> inner = parseOr();
            if (!accept(")")) {
                throw new ConditionParseException(source, "missing ')'");
            }
            return inner;
        }
        String first = next("a field name or number");
        IntBinaryOperator comparator = peekComparator();
        if (comparator == null) {
            return flag(first);
        }
        pos++;
        ToIntFunction<HandAnalysis> left = numeric(first);
        ToIntFunction<HandAnalysis> right = numeric(next("a field name or number"));
        return analysis -> comparator.applyAsInt(left.applyAsInt(analysis), right.applyAsInt(analysis)) != 0;
    }

    private Predicate<HandAnalysis> flag(String token) {
        if (isInteger(token)) {
            throw new ConditionParseException(source, "number " + token + " is not a condition");
        }
        HandField field = field(token);
        if (field.isNumeric()) {
            throw new InvalidFieldException(source, token, "numeric field must be compared with a value");
        }
        return field.flagAccessor();
    }

    private ToIntFunction<HandAnalysis> numeric(String token) {
        if (isInteger(token)) {
            int value = parseInteger(token);
            return analysis -> value;
        }
        HandField field = field(token);
        if (!field.isNumeric()) {
            throw new InvalidFieldException(source, token, "boolean field cannot be compared");
        }
        return field.numericAccessor();
    }

    private int parseInteger(String token) {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new ConditionParseException(source, "number out of range: " + token);
        }
    }

    private HandField field(String token) {
        if (isKeyword(token)) {
            throw new ConditionParseException(source, "unexpected '" + token + "'");
        }
        return HandField.fromName(token)
                .orElseThrow(() -> new ConditionParseException(source, "unknown field '" + token + "'"));
    }

    /** Comparators return 1 for true and 0 for false. */
    private IntBinaryOperator peekComparator() {
        if (pos >= tokens.size()) {
            return null;
        }
        switch (tokens.get(pos)) {
            case ">=":
                return (a, b) -> a >= b ? 1 : 0;
            case "<=":
                return (a, b) -> a <= b ? 1 : 0;
            case ">":
                return (a, b) -> a > b ? 1 : 0;
            case "<":
                return (a, b) -> a < b ? 1 : 0;
            case "==":
                return (a, b) -> a == b ? 1 : 0;
            case "!=":
                return (a, b) -> a != b ? 1 : 0;
            default:
                return null;
        }
    }

    private boolean accept(String token) {
        if (pos < tokens.size() && tokens.get(pos).equals(token)) {
            pos++;
            return true;
        }
        return false;
    }

    private String next(String expected) {
        if (pos >= tokens.size()) {
            throw new ConditionParseException(source, "expected " + expected + " at end of condition");
        }
        String token = tokens.get(pos++);
        if (token.equals("(") || token.equals(")") || isComparator(token)) {
            throw new ConditionParseException(source, "expected " + expected + " but found '" + token + "'");
        }
        return token;
    }

    private static boolean isComparator(String token) {
        return token.equals(">=") || token.equals("<=") || token.equals(">") || token.equals("<")
                || token.equals("==") || token.equals("!=");
    }

    private static boolean isKeyword(String token) {
        return token.equals("and") || token.equals("or") || token.equals("not") || token.equals(DEFAULT);
    }

    private static boolean isInteger(String token) {
        char c = token.charAt(0);
        return Character.isDigit(c) || c == '-';
    }
}
