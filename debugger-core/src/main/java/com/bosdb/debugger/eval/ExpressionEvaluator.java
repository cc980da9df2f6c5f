package com.bosdb.debugger.eval;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Sandboxed evaluator for breakpoint conditions, log-point messages and client
 * {@code evaluate} requests. Nothing here can reach host code; an expression can only
 * read the variables it is given.
 * Supports:
 * - Variables: statement, lineNumber, myVar (looked up in the context variables)
 * - Literals: 5, 3.14, 'text', "text", true, false, null
 * - Comparisons: <, <=, >, >=, =, ==, <>, !=
 * - Logical: and, or, not, &&, ||, !
 * - Arithmetic: +, -, *, /, mod, %
 * - Property access: row.id, params.limit
 * - Parentheses for grouping
 */
public class ExpressionEvaluator {

    /** Longest expression accepted, in tokens. Bounds the depth of operator chains. */
    static final int MAX_TOKENS = 1024;

    /** Deepest nesting of parentheses and prefix operators accepted. */
    static final int MAX_NESTING = 64;

    /**
     * Variable bindings an expression is evaluated against.
     */
    public record EvaluationContext(Map<String, Object> variables) {
        public EvaluationContext {
            variables = variables != null ? variables : Map.of();
        }

        public static EvaluationContext empty() {
            return new EvaluationContext(Map.of());
        }

        public static EvaluationContext of(Map<String, Object> variables) {
            return new EvaluationContext(variables);
        }

        /**
         * Look up a variable by name. Unknown names are an error, not null.
         */
        public Value lookupVariable(String name) {
            if (!variables.containsKey(name)) {
                throw new EvalException("Unknown variable: " + name);
            }
            return Value.of(variables.get(name));
        }
    }

    /**
     * Result of expression evaluation.
     */
    public sealed interface EvalResult {
        record Success(Value value) implements EvalResult {}
        record Error(String message) implements EvalResult {}

        default boolean isSuccess() {
            return this instanceof Success;
        }
    }

    /**
     * Evaluate an expression and return the result.
     */
    public EvalResult evaluate(String expression, EvaluationContext context) {
        if (expression == null || expression.isBlank()) {
            return new EvalResult.Error("Empty expression");
        }

        try {
            Tokenizer tokenizer = new Tokenizer(expression);
            List<Token> tokens = tokenizer.tokenize();
            if (tokens.size() > MAX_TOKENS) {
                return new EvalResult.Error("Expression too long: more than " + MAX_TOKENS + " tokens");
            }
            Parser parser = new Parser(tokens);
            Expr ast = parser.parseExpression();

            if (!parser.isAtEnd()) {
                return new EvalResult.Error("Unexpected input after expression at position " + parser.peek().position());
            }

            return new EvalResult.Success(evaluateExpr(ast, context));
        } catch (EvalException e) {
            return new EvalResult.Error(e.getMessage());
        } catch (NumberFormatException e) {
            return new EvalResult.Error("Invalid number: " + e.getMessage());
        }
    }

    /**
     * Evaluate a breakpoint condition.
     * @throws IllegalArgumentException if the expression cannot be evaluated
     */
    public boolean evaluateCondition(String expression, EvaluationContext context) {
        EvalResult result = evaluate(expression, context);
        if (result instanceof EvalResult.Success s) {
            return s.value().isTruthy();
        }
        throw new IllegalArgumentException(((EvalResult.Error) result).message());
    }

    /**
     * Interpolate a log message by replacing {expr} with evaluated values.
     */
    public String interpolateLogMessage(String message, EvaluationContext context) {
        if (message == null || !message.contains("{")) {
            return message;
        }

        StringBuilder result = new StringBuilder();
        int i = 0;
        while (i < message.length()) {
            char c = message.charAt(i);
            if (c == '{') {
                int end = message.indexOf('}', i + 1);
                if (end > i) {
                    String expr = message.substring(i + 1, end);
                    EvalResult evalResult = evaluate(expr, context);
                    if (evalResult instanceof EvalResult.Success s) {
                        result.append(s.value().toStr());  // no quotes around strings in log output
                    } else {
                        result.append('<').append(((EvalResult.Error) evalResult).message()).append('>');
                    }
                    i = end + 1;
                    continue;
                }
            }
            result.append(c);
            i++;
        }
        return result.toString();
    }

    // ==================== AST Nodes ====================

    private sealed interface Expr {}

    private record LiteralExpr(Value value) implements Expr {}
    private record VariableExpr(String name) implements Expr {}
    private record PropertyExpr(Expr object, String property) implements Expr {}
    private record UnaryExpr(String operator, Expr operand) implements Expr {}
    private record BinaryExpr(Expr left, String operator, Expr right) implements Expr {}

    // ==================== Tokenizer ====================

    private enum TokenType {
        NUMBER, STRING, IDENTIFIER,
        TRUE, FALSE, NULL,
        LPAREN, RPAREN,
        PLUS, MINUS, STAR, SLASH, MOD,
        LT, LE, GT, GE, EQ, NE,
        AND, OR, NOT,
        DOT,
        EOF
    }

    private record Token(TokenType type, String value, int position) {}

    private static class Tokenizer {
        private final String input;
        private int pos = 0;

        Tokenizer(String input) {
            this.input = input;
        }

        List<Token> tokenize() {
            List<Token> tokens = new ArrayList<>();
            while (!isAtEnd()) {
                skipWhitespace();
                if (isAtEnd()) break;
                tokens.add(scanToken());
            }
            tokens.add(new Token(TokenType.EOF, "", pos));
            return tokens;
        }

        private void skipWhitespace() {
            while (!isAtEnd() && Character.isWhitespace(peek())) {
                pos++;
            }
        }

        private Token scanToken() {
            int start = pos;
            char c = advance();

            switch (c) {
                case '(' -> { return new Token(TokenType.LPAREN, "(", start); }
                case ')' -> { return new Token(TokenType.RPAREN, ")", start); }
                case '+' -> { return new Token(TokenType.PLUS, "+", start); }
                case '-' -> { return new Token(TokenType.MINUS, "-", start); }
                case '*' -> { return new Token(TokenType.STAR, "*", start); }
                case '/' -> { return new Token(TokenType.SLASH, "/", start); }
                case '%' -> { return new Token(TokenType.MOD, "%", start); }
                case '.' -> { return new Token(TokenType.DOT, ".", start); }
                case '<' -> {
                    if (match('=')) return new Token(TokenType.LE, "<=", start);
                    if (match('>')) return new Token(TokenType.NE, "<>", start);
                    return new Token(TokenType.LT, "<", start);
                }
                case '>' -> {
                    if (match('=')) return new Token(TokenType.GE, ">=", start);
                    return new Token(TokenType.GT, ">", start);
                }
                case '=' -> {
                    match('='); // Allow both = and == for equality
                    return new Token(TokenType.EQ, "=", start);
                }
                case '!' -> {
                    if (match('=')) return new Token(TokenType.NE, "!=", start);
                    return new Token(TokenType.NOT, "!", start);
                }
                case '&' -> {
                    if (match('&')) return new Token(TokenType.AND, "&&", start);
                    throw new EvalException("Unexpected character: & at position " + start);
                }
                case '|' -> {
                    if (match('|')) return new Token(TokenType.OR, "||", start);
                    throw new EvalException("Unexpected character: | at position " + start);
                }
                case '"', '\'' -> { return scanString(c); }
                default -> { }
            }

            if (Character.isDigit(c)) {
                pos--;
                return scanNumber();
            }

            if (Character.isLetter(c) || c == '_') {
                pos--;
                return scanIdentifier();
            }

            throw new EvalException("Unexpected character: " + c + " at position " + start);
        }

        private Token scanNumber() {
            int start = pos;
            while (Character.isDigit(peek())) {
                advance();
            }

            // Look for decimal part
            if (peek() == '.' && Character.isDigit(peekNext())) {
                advance(); // consume '.'
                while (Character.isDigit(peek())) {
                    advance();
                }
            }

            return new Token(TokenType.NUMBER, input.substring(start, pos), start);
        }

        private Token scanString(char quote) {
            int start = pos - 1; // include opening quote
            StringBuilder sb = new StringBuilder();

            while (!isAtEnd() && peek() != quote) {
                if (peek() == '\\' && peekNext() == quote) {
                    advance(); // skip backslash
                    sb.append(advance());
                } else {
                    sb.append(advance());
                }
            }

            if (isAtEnd()) {
                throw new EvalException("Unterminated string at position " + start);
            }

            advance(); // consume closing quote
            return new Token(TokenType.STRING, sb.toString(), start);
        }

        private Token scanIdentifier() {
            int start = pos;
            while (Character.isLetterOrDigit(peek()) || peek() == '_') {
                advance();
            }
            String name = input.substring(start, pos);

            return switch (name.toLowerCase()) {
                case "and" -> new Token(TokenType.AND, name, start);
                case "or" -> new Token(TokenType.OR, name, start);
                case "not" -> new Token(TokenType.NOT, name, start);
                case "mod" -> new Token(TokenType.MOD, name, start);
                case "true" -> new Token(TokenType.TRUE, name, start);
                case "false" -> new Token(TokenType.FALSE, name, start);
                case "null" -> new Token(TokenType.NULL, name, start);
                default -> new Token(TokenType.IDENTIFIER, name, start);
            };
        }

        private boolean isAtEnd() {
            return pos >= input.length();
        }

        private char peek() {
            if (isAtEnd()) return '\0';
            return input.charAt(pos);
        }

        private char peekNext() {
            if (pos + 1 >= input.length()) return '\0';
            return input.charAt(pos + 1);
        }

        private char advance() {
            return input.charAt(pos++);
        }

        private boolean match(char expected) {
            if (isAtEnd() || peek() != expected) return false;
            pos++;
            return true;
        }
    }

    // ==================== Parser ====================

    private static class Parser {
        private final List<Token> tokens;
        private int current = 0;
        private int depth = 0;

        Parser(List<Token> tokens) {
            this.tokens = tokens;
        }

        Expr parseExpression() {
            return parseOr();
        }

        private Expr parseOr() {
            Expr left = parseAnd();
            while (match(TokenType.OR)) {
                Expr right = parseAnd();
                left = new BinaryExpr(left, "or", right);
            }
            return left;
        }

        private Expr parseAnd() {
            Expr left = parseNot();
            while (match(TokenType.AND)) {
                Expr right = parseNot();
                left = new BinaryExpr(left, "and", right);
            }
            return left;
        }

        private Expr parseNot() {
            if (match(TokenType.NOT)) {
                enter();
                Expr operand = parseNot();
                depth--;
                return new UnaryExpr("not", operand);
            }
            return parseComparison();
        }

        private Expr parseComparison() {
            Expr left = parseAddition();
            if (match(TokenType.LT)) return new BinaryExpr(left, "<", parseAddition());
            if (match(TokenType.LE)) return new BinaryExpr(left, "<=", parseAddition());
            if (match(TokenType.GT)) return new BinaryExpr(left, ">", parseAddition());
            if (match(TokenType.GE)) return new BinaryExpr(left, ">=", parseAddition());
            if (match(TokenType.EQ)) return new BinaryExpr(left, "=", parseAddition());
            if (match(TokenType.NE)) return new BinaryExpr(left, "<>", parseAddition());
            return left;
        }

        private Expr parseAddition() {
            Expr left = parseMultiplication();
            while (true) {
                if (match(TokenType.PLUS)) {
                    left = new BinaryExpr(left, "+", parseMultiplication());
                } else if (match(TokenType.MINUS)) {
                    left = new BinaryExpr(left, "-", parseMultiplication());
                } else {
                    break;
                }
            }
            return left;
        }

        private Expr parseMultiplication() {
            Expr left = parseUnary();
            while (true) {
                if (match(TokenType.STAR)) {
                    left = new BinaryExpr(left, "*", parseUnary());
                } else if (match(TokenType.SLASH)) {
                    left = new BinaryExpr(left, "/", parseUnary());
                } else if (match(TokenType.MOD)) {
                    left = new BinaryExpr(left, "mod", parseUnary());
                } else {
                    break;
                }
            }
            return left;
        }

        private Expr parseUnary() {
            if (match(TokenType.MINUS)) {
                enter();
                Expr operand = parseUnary();
                depth--;
                return new UnaryExpr("-", operand);
            }
            return parsePostfix();
        }

        private Expr parsePostfix() {
            Expr expr = parsePrimary();

            // Handle property access: obj.property
            while (match(TokenType.DOT)) {
                Token name = consume(TokenType.IDENTIFIER, "Expected property name after '.'");
                expr = new PropertyExpr(expr, name.value());
            }

            return expr;
        }

        private Expr parsePrimary() {
            if (match(TokenType.NUMBER)) {
                String value = previous().value();
                if (value.contains(".")) {
                    return new LiteralExpr(Value.of(Double.parseDouble(value)));
                }
                return new LiteralExpr(Value.of(Long.parseLong(value)));
            }
            if (match(TokenType.STRING)) {
                return new LiteralExpr(Value.of(previous().value()));
            }
            if (match(TokenType.TRUE)) {
                return new LiteralExpr(Value.TRUE);
            }
            if (match(TokenType.FALSE)) {
                return new LiteralExpr(Value.FALSE);
            }
            if (match(TokenType.NULL)) {
                return new LiteralExpr(Value.NULL);
            }
            if (match(TokenType.IDENTIFIER)) {
                return new VariableExpr(previous().value());
            }
            if (match(TokenType.LPAREN)) {
                enter();
                Expr expr = parseExpression();
                consume(TokenType.RPAREN, "Expected ')' after expression");
                depth--;
                return expr;
            }

            throw new EvalException("Expected expression at position " + peek().position());
        }

        private void enter() {
            if (++depth > MAX_NESTING) {
                throw new EvalException("Expression nested too deeply at position " + previous().position());
            }
        }

        private boolean match(TokenType type) {
            if (check(type)) {
                advance();
                return true;
            }
            return false;
        }

        private boolean check(TokenType type) {
            if (isAtEnd()) return false;
            return peek().type() == type;
        }

        private Token advance() {
            if (!isAtEnd()) current++;
            return previous();
        }

        boolean isAtEnd() {
            return peek().type() == TokenType.EOF;
        }

        Token peek() {
            return tokens.get(current);
        }

        private Token previous() {
            return tokens.get(current - 1);
        }

        private Token consume(TokenType type, String message) {
            if (check(type)) return advance();
            throw new EvalException(message + " at position " + peek().position());
        }
    }

    // ==================== Evaluator ====================

    private Value evaluateExpr(Expr expr, EvaluationContext context) {
        if (expr instanceof LiteralExpr e) return e.value();
        if (expr instanceof VariableExpr e) return context.lookupVariable(e.name());
        if (expr instanceof PropertyExpr e) return evaluateProperty(e, context);
        if (expr instanceof UnaryExpr e) return evaluateUnary(e, context);
        return evaluateBinary((BinaryExpr) expr, context);
    }

    private Value evaluateProperty(PropertyExpr expr, EvaluationContext context) {
        Value object = evaluateExpr(expr.object(), context);

        if (object instanceof Value.MapValue map) {
            Value value = map.properties().get(expr.property());
            return value != null ? value : Value.NULL;
        }

        throw new EvalException("Cannot access property '" + expr.property() + "' on " + object.typeName());
    }

    private Value evaluateUnary(UnaryExpr expr, EvaluationContext context) {
        Value operand = evaluateExpr(expr.operand(), context);

        return switch (expr.operator()) {
            case "-" -> {
                if (operand instanceof Value.Int i) yield Value.of(-i.value());
                if (operand instanceof Value.Float f) yield Value.of(-f.value());
                throw new EvalException("Cannot negate " + operand.typeName());
            }
            case "not" -> Value.of(!operand.isTruthy());
            default -> throw new EvalException("Unknown operator: " + expr.operator());
        };
    }

    private Value evaluateBinary(BinaryExpr expr, EvaluationContext context) {
        // Short-circuit evaluation for logical operators
        if (expr.operator().equals("and")) {
            Value left = evaluateExpr(expr.left(), context);
            if (!left.isTruthy()) return Value.FALSE;
            return Value.of(evaluateExpr(expr.right(), context).isTruthy());
        }

        if (expr.operator().equals("or")) {
            Value left = evaluateExpr(expr.left(), context);
            if (left.isTruthy()) return Value.TRUE;
            return Value.of(evaluateExpr(expr.right(), context).isTruthy());
        }

        Value left = evaluateExpr(expr.left(), context);
        Value right = evaluateExpr(expr.right(), context);

        return switch (expr.operator()) {
            case "+" -> evaluateAdd(left, right);
            case "-" -> evaluateSubtract(left, right);
            case "*" -> evaluateMultiply(left, right);
            case "/" -> evaluateDivide(left, right);
            case "mod" -> evaluateMod(left, right);
            case "<" -> Value.of(compare(left, right) < 0);
            case "<=" -> Value.of(compare(left, right) <= 0);
            case ">" -> Value.of(compare(left, right) > 0);
            case ">=" -> Value.of(compare(left, right) >= 0);
            case "=" -> Value.of(compareEqual(left, right));
            case "<>" -> Value.of(!compareEqual(left, right));
            default -> throw new EvalException("Unknown operator: " + expr.operator());
        };
    }

    private Value evaluateAdd(Value left, Value right) {
        // String concatenation
        if (left instanceof Value.Str || right instanceof Value.Str) {
            return Value.of(left.toStr() + right.toStr());
        }
        requireNumbers("+", left, right);
        if (left instanceof Value.Float || right instanceof Value.Float) {
            return Value.of(left.toDouble() + right.toDouble());
        }
        return Value.of(left.toLong() + right.toLong());
    }

    private Value evaluateSubtract(Value left, Value right) {
        requireNumbers("-", left, right);
        if (left instanceof Value.Float || right instanceof Value.Float) {
            return Value.of(left.toDouble() - right.toDouble());
        }
        return Value.of(left.toLong() - right.toLong());
    }

    private Value evaluateMultiply(Value left, Value right) {
        requireNumbers("*", left, right);
        if (left instanceof Value.Float || right instanceof Value.Float) {
            return Value.of(left.toDouble() * right.toDouble());
        }
        return Value.of(left.toLong() * right.toLong());
    }

    private Value evaluateDivide(Value left, Value right) {
        requireNumbers("/", left, right);
        double r = right.toDouble();
        if (r == 0) {
            throw new EvalException("Division by zero");
        }
        return Value.of(left.toDouble() / r);
    }

    private Value evaluateMod(Value left, Value right) {
        requireNumbers("mod", left, right);
        long r = right.toLong();
        if (r == 0) {
            throw new EvalException("Modulo by zero");
        }
        return Value.of(left.toLong() % r);
    }

    private void requireNumbers(String operator, Value left, Value right) {
        if (!left.isNumber() || !right.isNumber()) {
            throw new EvalException("Operator " + operator + " not supported for "
                + left.typeName() + " and " + right.typeName());
        }
    }

    private int compare(Value left, Value right) {
        if (left instanceof Value.Str l && right instanceof Value.Str r) {
            return l.value().compareTo(r.value());
        }
        return Double.compare(left.toDouble(), right.toDouble());
    }

    private boolean compareEqual(Value left, Value right) {
        // Same type comparison
        if (left.getClass() == right.getClass()) {
            return left.equals(right);
        }

        // Numeric comparison (int/float interop)
        if (left.isNumber() && right.isNumber()) {
            return left.toDouble() == right.toDouble();
        }

        if (left.isNull() || right.isNull()) {
            return false;
        }

        // String comparison
        if (left instanceof Value.Str || right instanceof Value.Str) {
            return left.toStr().equals(right.toStr());
        }

        return false;
    }

    // ==================== Exceptions ====================

    private static class EvalException extends RuntimeException {
        EvalException(String message) {
            super(message);
        }
    }
}
