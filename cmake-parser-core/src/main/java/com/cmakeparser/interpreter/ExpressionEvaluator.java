package com.cmakeparser.interpreter;

import com.cmakeparser.ExprException;
import com.cmakeparser.Token;
import com.cmakeparser.TokenKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates the condition of {@code if()}, {@code elseif()} and {@code while()}.
 *
 * <p>The input must already be variable-resolved. Evaluation is precedence climbing over
 * an explicit stack holding pending operand tokens and reduced booleans. Only
 * {@code AND}, {@code OR} (precedence 1) and {@code NOT} (precedence 2) take part in
 * climbing; predicates and comparisons consume their arguments as soon as they are seen.
 * Both sides of {@code AND} and {@code OR} are always evaluated.
 *
 * <p>Operators are recognized on unquoted tokens only and are case-sensitive.
 */
public final class ExpressionEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(ExpressionEvaluator.class);

    private static final int PREC_OR_AND = 1;
    private static final int PREC_NOT = 2;

    private static final Map<String, Integer> PRECEDENCE = Map.of(
        "AND", PREC_OR_AND,
        "OR", PREC_OR_AND,
        "NOT", PREC_NOT
    );

    private static final Set<String> UNARY = Set.of(
        "DEFINED", "EXISTS", "COMMAND", "IS_ABSOLUTE"
    );

    private static final Set<String> BINARY = Set.of(
        "EQUAL", "LESS", "LESS_EQUAL", "GREATER", "GREATER_EQUAL",
        "STREQUAL", "STRLESS", "STRLESS_EQUAL", "STRGREATER", "STRGREATER_EQUAL",
        "VERSION_EQUAL", "VERSION_LESS", "VERSION_LESS_EQUAL", "VERSION_GREATER", "VERSION_GREATER_EQUAL",
        "PATH_EQUAL", "MATCHES", "IN_LIST"
    );

    private static final Set<String> TRUE_CONSTANTS = Set.of("ON", "YES", "TRUE", "Y");
    private static final Set<String> FALSE_CONSTANTS = Set.of("", "OFF", "NO", "FALSE", "N", "IGNORE", "NOTFOUND");

    private static final Pattern NUMBER = Pattern.compile("[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?");
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern PATH_SEPARATORS = Pattern.compile("[/\\\\]+");
    private static final Pattern ABSOLUTE_PATH = Pattern.compile("(?:[/\\\\~]|[A-Za-z]:[/\\\\]).*", Pattern.DOTALL);

    private final Context context;
    private final List<Token> tokens;
    private int current = 0;

    private ExpressionEvaluator(Context context, List<Token> tokens) {
        this.context = context;
        this.tokens = tokens;
    }

    /**
     * Evaluates a resolved condition. An empty condition, or one that starts with
     * {@code )} before anything was reduced, is false.
     *
     * @throws ExprException if the condition is malformed
     */
    public static boolean evaluate(Context context, List<Token> tokens) {
        ExpressionEvaluator evaluator = new ExpressionEvaluator(context, tokens);
        if (evaluator.isAtEnd() || evaluator.peek().is(TokenKind.RPAREN)) {
            return false;
        }
        boolean result = evaluator.toBoolean(evaluator.parseExpression(PREC_OR_AND));
        if (!evaluator.isAtEnd()) {
            throw new ExprException("Unbalanced parentheses: unexpected ')'", evaluator.peek());
        }
        return result;
    }

    // ========================================================================
    // Precedence climbing
    // ========================================================================

    /**
     * Evaluates tokens until input ends, a {@code )} is reached, or the next operator
     * binds less tightly than {@code precedence}. The closing parenthesis is left for
     * the caller.
     *
     * @return a pending operand {@link Token} or a reduced {@link Boolean}
     */
    private Object parseExpression(int precedence) {
        Deque<Object> stack = new ArrayDeque<>();
        while (!isAtEnd() && !peek().is(TokenKind.RPAREN)) {
            Token token = advance();
            if (token.is(TokenKind.LPAREN)) {
                Object inner = parseExpression(PREC_OR_AND);
                if (isAtEnd()) {
                    throw new ExprException("Unbalanced parentheses: missing ')'", token);
                }
                advance();
                stack.push(toBoolean(inner));
            } else if (isOperator(token, "NOT")) {
                stack.push(!toBoolean(parseOperand(token, PREC_NOT)));
            } else if (isOperator(token, "AND")) {
                boolean lhs = toBoolean(pop(stack, token));
                boolean rhs = toBoolean(parseOperand(token, PREC_NOT));
                stack.push(lhs && rhs);
            } else if (isOperator(token, "OR")) {
                boolean lhs = toBoolean(pop(stack, token));
                boolean rhs = toBoolean(parseOperand(token, PREC_NOT));
                stack.push(lhs || rhs);
            } else if (isUnary(token)) {
                stack.push(evaluateUnary(token.value(), argument(token)));
            } else if (isBinary(token)) {
                Token operand = leftOperand(pop(stack, token), token);
                stack.push(evaluateBinary(token.value(), operand, argument(token)));
            } else {
                stack.push(token);
            }

            if (!isAtEnd()) {
                Token next = peek();
                if (next.is(TokenKind.RAW)
                    && PRECEDENCE.getOrDefault(next.value(), precedence) < precedence) {
                    break;
                }
            }
        }
        if (stack.size() != 1) {
            throw new ExprException("Malformed expression");
        }
        return stack.pop();
    }

    private Object parseOperand(Token operator, int precedence) {
        if (isAtEnd() || peek().is(TokenKind.RPAREN)) {
            throw new ExprException("Missing operand for " + operator.value(), operator);
        }
        return parseExpression(precedence);
    }

    private Object pop(Deque<Object> stack, Token operator) {
        if (stack.isEmpty()) {
            throw new ExprException("Missing left operand for " + operator.value(), operator);
        }
        return stack.pop();
    }

    /**
     * A reduced boolean on the left of a comparison stands for {@code ON} or {@code OFF}.
     * It is quoted so it is never taken for a variable name.
     */
    private static Token leftOperand(Object value, Token operator) {
        if (value instanceof Boolean bool) {
            return new Token(TokenKind.QUOTED, bool ? "ON" : "OFF",
                operator.start(), operator.end(), operator.line(), operator.column());
        }
        return (Token) value;
    }

    /**
     * Consumes the literal argument of a predicate or the right side of a comparison.
     */
    private Token argument(Token operator) {
        if (isAtEnd() || peek().is(TokenKind.LPAREN) || peek().is(TokenKind.RPAREN)) {
            throw new ExprException("Missing argument for " + operator.value(), operator);
        }
        return advance();
    }

    // ========================================================================
    // Predicates and comparisons
    // ========================================================================

    private boolean evaluateUnary(String operator, Token argument) {
        String value = argument.value();
        switch (operator) {
            case "DEFINED":
                return isDefined(value);
            case "EXISTS":
                return context.exists(value);
            case "COMMAND":
                return context.isCommand(value);
            case "IS_ABSOLUTE":
                return ABSOLUTE_PATH.matcher(value).matches();
            default:
                throw new IllegalStateException("Unhandled unary operator " + operator);
        }
    }

    private boolean isDefined(String name) {
        if (name.startsWith("ENV{") && name.endsWith("}")) {
            return context.env().containsKey(name.substring(4, name.length() - 1));
        }
        if (name.startsWith("CACHE{") && name.endsWith("}")) {
            return context.cache().containsKey(name.substring(6, name.length() - 1));
        }
        return context.var().containsKey(name);
    }

    private boolean evaluateBinary(String operator, Token left, Token right) {
        String lhs = operandValue(left);
        switch (operator) {
            case "EQUAL":
            case "LESS":
            case "LESS_EQUAL":
            case "GREATER":
            case "GREATER_EQUAL":
                return compareIntegers(operator, lhs, operandValue(right));
            case "STREQUAL":
                return lhs.equals(operandValue(right));
            case "STRLESS":
                return lhs.compareTo(operandValue(right)) < 0;
            case "STRLESS_EQUAL":
                return lhs.compareTo(operandValue(right)) <= 0;
            case "STRGREATER":
                return lhs.compareTo(operandValue(right)) > 0;
            case "STRGREATER_EQUAL":
                return lhs.compareTo(operandValue(right)) >= 0;
            case "VERSION_EQUAL":
                return compareVersions(lhs, operandValue(right)) == 0;
            case "VERSION_LESS":
                return compareVersions(lhs, operandValue(right)) < 0;
            case "VERSION_LESS_EQUAL":
                return compareVersions(lhs, operandValue(right)) <= 0;
            case "VERSION_GREATER":
                return compareVersions(lhs, operandValue(right)) > 0;
            case "VERSION_GREATER_EQUAL":
                return compareVersions(lhs, operandValue(right)) >= 0;
            case "PATH_EQUAL":
                return normalizePath(lhs).equals(normalizePath(operandValue(right)));
            case "MATCHES":
                return matches(lhs, right);
            case "IN_LIST":
                return VariableResolver.splitList(context.var().getOrDefault(right.value(), "")).contains(lhs);
            default:
                throw new IllegalStateException("Unhandled binary operator " + operator);
        }
    }

    /**
     * An unquoted operand that names a bound variable stands for the variable's value.
     */
    private String operandValue(Token token) {
        if (token.is(TokenKind.RAW) && context.var().containsKey(token.value())) {
            return context.var().get(token.value());
        }
        return token.value();
    }

    private static boolean compareIntegers(String operator, String lhs, String rhs) {
        if (!INTEGER.matcher(lhs).matches() || !INTEGER.matcher(rhs).matches()) {
            LOG.debug("{} on non-integer operands '{}' and '{}' is false", operator, lhs, rhs);
            return false;
        }
        long left;
        long right;
        try {
            left = Long.parseLong(lhs);
            right = Long.parseLong(rhs);
        } catch (NumberFormatException e) {
            LOG.debug("{} operands out of range: '{}' and '{}'", operator, lhs, rhs);
            return false;
        }
        switch (operator) {
            case "EQUAL":
                return left == right;
            case "LESS":
                return left < right;
            case "LESS_EQUAL":
                return left <= right;
            case "GREATER":
                return left > right;
            default:
                return left >= right;
        }
    }

    /**
     * Compares the first four dot-separated components; missing or non-numeric
     * components count as 0.
     */
    static int compareVersions(String lhs, String rhs) {
        long[] left = versionTuple(lhs);
        long[] right = versionTuple(rhs);
        for (int i = 0; i < left.length; i++) {
            int cmp = Long.compare(left[i], right[i]);
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    static long[] versionTuple(String version) {
        long[] tuple = new long[4];
        String[] parts = version.split("\\.", -1);
        for (int i = 0; i < tuple.length && i < parts.length; i++) {
            try {
                tuple[i] = Long.parseLong(parts[i]);
            } catch (NumberFormatException e) {
                tuple[i] = 0;
            }
        }
        return tuple;
    }

    private static String normalizePath(String path) {
        return PATH_SEPARATORS.matcher(path).replaceAll("/");
    }

    private boolean matches(String value, Token regex) {
        try {
            return Pattern.compile(regex.value()).matcher(value).find();
        } catch (PatternSyntaxException e) {
            throw new ExprException("Invalid regular expression '" + regex.value() + "' for MATCHES", e);
        }
    }

    // ========================================================================
    // Truthiness
    // ========================================================================

    /**
     * Coerces a reduced value or a pending operand to a boolean.
     *
     * <p>Quoted and bracketed values are only compared against the boolean constants.
     * An unquoted value that is not a constant is taken as a variable name, and that
     * variable's value decides: a constant gives its truth value, anything else is true.
     */
    private boolean toBoolean(Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        Token token = (Token) value;
        Boolean constant = constantValue(token.value());
        if (constant != null) {
            return constant;
        }
        if (!token.is(TokenKind.RAW)) {
            return false;
        }
        String variable = context.var().getOrDefault(token.value(), "");
        constant = constantValue(variable);
        return constant != null ? constant : true;
    }

    /**
     * Returns the truth value of a CMake boolean constant or number, or {@code null}
     * if {@code value} is neither.
     */
    static Boolean constantValue(String value) {
        if (value == null) {
            return Boolean.FALSE;
        }
        if (NUMBER.matcher(value).matches()) {
            return Double.parseDouble(value) != 0.0;
        }
        String upper = value.toUpperCase(Locale.ROOT);
        if (TRUE_CONSTANTS.contains(upper)) {
            return Boolean.TRUE;
        }
        if (FALSE_CONSTANTS.contains(upper) || upper.endsWith("-NOTFOUND")) {
            return Boolean.FALSE;
        }
        return null;
    }

    // ========================================================================
    // Token cursor
    // ========================================================================

    private static boolean isOperator(Token token, String operator) {
        return token.is(TokenKind.RAW) && token.value().equals(operator);
    }

    private static boolean isUnary(Token token) {
        return token.is(TokenKind.RAW) && UNARY.contains(token.value());
    }

    private static boolean isBinary(Token token) {
        return token.is(TokenKind.RAW) && BINARY.contains(token.value());
    }

    private boolean isAtEnd() {
        return current >= tokens.size();
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token advance() {
        return tokens.get(current++);
    }
}
