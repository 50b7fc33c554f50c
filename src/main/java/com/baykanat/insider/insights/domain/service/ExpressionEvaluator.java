package com.baykanat.insider.insights.domain.service;

import com.baykanat.insider.insights.domain.model.RawEvent;
import org.springframework.stereotype.Component;
import org.springframework.util.ConcurrentLruCache;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Formula ve hogql ifadeleri için küçük recursive-descent parser ve yorumlayıcı.
 * Aritmetik (+ - * / %), karşılaştırma (= != < <= > >=), and/or/not, abs/round/floor/ceil/lower/upper
 * ve 'string' literal'leri destekler. Parse edilen ifadeler kaynak metne göre sınırlı bir LRU cache'te tutulur.
 */
@Component
public class ExpressionEvaluator {

    private static final Pattern AGGREGATE_PATTERN =
            Pattern.compile("^\\s*(sum|avg|min|max|count)\\s*\\((.*)\\)\\s*$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    /** Parse cache'inin üst sınırı; en az kullanılan ifade önce düşer. */
    static final int CACHE_CAPACITY = 512;

    private final ConcurrentLruCache<String, ParsedExpression> cache =
            new ConcurrentLruCache<>(CACHE_CAPACITY, source -> new Parser(source).parseFull());

    /** Derlenmiş ifade düğümü; referanslar resolver ile çözülür. */
    @FunctionalInterface
    public interface Expression {
        Object evaluate(Function<String, Object> resolver);
    }

    /** Kök ifade + içinde geçen referans isimleri (formula harf doğrulaması için). */
    public static final class ParsedExpression {
        private final Expression root;
        private final Set<String> references;

        ParsedExpression(Expression root, Set<String> references) {
            this.root = root;
            this.references = Collections.unmodifiableSet(references);
        }

        public Set<String> getReferences() {
            return references;
        }

        public Object evaluate(Function<String, Object> resolver) {
            return root.evaluate(resolver);
        }

        /** Sayısal sonuç; sayıya çevrilemezse NaN. */
        public double evaluateNumber(Function<String, Object> resolver) {
            return toDouble(root.evaluate(resolver));
        }
    }

    /** fn(expr) biçimindeki aggregate; count() için argument null olabilir. */
    public static final class AggregateExpression {
        private final String function;
        private final ParsedExpression argument;

        AggregateExpression(String function, ParsedExpression argument) {
            this.function = function;
            this.argument = argument;
        }

        public String getFunction() {
            return function;
        }

        public ParsedExpression getArgument() {
            return argument;
        }
    }

    /** Geçersiz sözdiziminde IllegalArgumentException. */
    public ParsedExpression parse(String source) {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("Expression is empty");
        }
        return cache.get(source);
    }

    int cachedExpressionCount() {
        return cache.size();
    }

    public AggregateExpression parseAggregate(String source) {
        if (source == null) {
            throw new IllegalArgumentException("Aggregate expression is empty");
        }
        Matcher matcher = AGGREGATE_PATTERN.matcher(source);
        if (!matcher.matches()) {
            throw new IllegalArgumentException(
                    "Aggregate expression must have the form sum|avg|min|max|count(expr): " + source);
        }
        String function = matcher.group(1).toLowerCase(Locale.ROOT);
        String inner = matcher.group(2).trim();
        if (inner.isEmpty()) {
            if (!"count".equals(function)) {
                throw new IllegalArgumentException(function + "() requires an argument");
            }
            return new AggregateExpression(function, null);
        }
        return new AggregateExpression(function, parse(inner));
    }

    /**
     * Event alanlarını ifade referanslarına bağlar: event, distinct_id, person_id, timestamp (epoch saniye),
     * properties.x, person.properties.x, session.x.
     */
    public static Function<String, Object> eventResolver(RawEvent event) {
        return name -> {
            if (name.startsWith("properties.")) {
                return event.getProperties().get(name.substring("properties.".length()));
            }
            if (name.startsWith("person.properties.")) {
                return event.getPersonProperties().get(name.substring("person.properties.".length()));
            }
            if (name.startsWith("session.")) {
                return event.getSessionProperties().get(name.substring("session.".length()));
            }
            return switch (name) {
                case "event" -> event.getEvent();
                case "distinct_id" -> event.getDistinctId();
                case "person_id" -> event.getPersonId();
                case "timestamp" -> event.getTimestamp() != null ? event.getTimestamp().getEpochSecond() : null;
                default -> null;
            };
        };
    }

    static double toDouble(Object value) {
        if (value == null) {
            return Double.NaN;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof Boolean bool) {
            return bool ? 1.0 : 0.0;
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return d != 0.0 && !Double.isNaN(d);
        }
        return !value.toString().isEmpty();
    }

    private static int compare(Object left, Object right) {
        double l = toDouble(left);
        double r = toDouble(right);
        if (!Double.isNaN(l) && !Double.isNaN(r)) {
            return Double.compare(l, r);
        }
        return String.valueOf(left).compareTo(String.valueOf(right));
    }

    private static boolean equalValues(Object left, Object right) {
        if (left == null || right == null) {
            return left == right;
        }
        if (left instanceof Number || right instanceof Number) {
            double l = toDouble(left);
            double r = toDouble(right);
            if (!Double.isNaN(l) && !Double.isNaN(r)) {
                return l == r;
            }
        }
        return left.toString().equals(right.toString());
    }

    // --- tokenizer ---

    private enum TokenType { NUMBER, STRING, IDENT, OP, LPAREN, RPAREN, COMMA, END }

    private static final class Token {
        final TokenType type;
        final String text;

        Token(TokenType type, String text) {
            this.type = type;
            this.text = text;
        }
    }

    private static List<Token> tokenize(String source) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (Character.isDigit(c) || (c == '.' && i + 1 < source.length() && Character.isDigit(source.charAt(i + 1)))) {
                int start = i;
                while (i < source.length() && (Character.isDigit(source.charAt(i)) || source.charAt(i) == '.')) {
                    i++;
                }
                tokens.add(new Token(TokenType.NUMBER, source.substring(start, i)));
            } else if (Character.isLetter(c) || c == '_' || c == '$') {
                int start = i;
                while (i < source.length()
                        && (Character.isLetterOrDigit(source.charAt(i)) || "_$.".indexOf(source.charAt(i)) >= 0)) {
                    i++;
                }
                tokens.add(new Token(TokenType.IDENT, source.substring(start, i)));
            } else if (c == '\'') {
                StringBuilder literal = new StringBuilder();
                i++;
                boolean closed = false;
                while (i < source.length()) {
                    char ch = source.charAt(i);
                    if (ch == '\\' && i + 1 < source.length()) {
                        literal.append(source.charAt(i + 1));
                        i += 2;
                    } else if (ch == '\'') {
                        closed = true;
                        i++;
                        break;
                    } else {
                        literal.append(ch);
                        i++;
                    }
                }
                if (!closed) {
                    throw new IllegalArgumentException("Unterminated string literal in: " + source);
                }
                tokens.add(new Token(TokenType.STRING, literal.toString()));
            } else if (c == '(') {
                tokens.add(new Token(TokenType.LPAREN, "("));
                i++;
            } else if (c == ')') {
                tokens.add(new Token(TokenType.RPAREN, ")"));
                i++;
            } else if (c == ',') {
                tokens.add(new Token(TokenType.COMMA, ","));
                i++;
            } else {
                String two = i + 1 < source.length() ? source.substring(i, i + 2) : "";
                if (two.equals("==") || two.equals("!=") || two.equals("<=") || two.equals(">=") || two.equals("<>")) {
                    tokens.add(new Token(TokenType.OP, two.equals("<>") ? "!=" : two.equals("==") ? "=" : two));
                    i += 2;
                } else if ("+-*/%<>=".indexOf(c) >= 0) {
                    tokens.add(new Token(TokenType.OP, String.valueOf(c)));
                    i++;
                } else {
                    throw new IllegalArgumentException("Unexpected character '" + c + "' in: " + source);
                }
            }
        }
        tokens.add(new Token(TokenType.END, ""));
        return tokens;
    }

    // --- parser ---

    private static final class Parser {
        private final String source;
        private final List<Token> tokens;
        private final Set<String> references = new LinkedHashSet<>();
        private int position;

        Parser(String source) {
            this.source = source;
            this.tokens = tokenize(source);
        }

        ParsedExpression parseFull() {
            Expression root = parseOr();
            if (peek().type != TokenType.END) {
                throw new IllegalArgumentException("Unexpected token '" + peek().text + "' in: " + source);
            }
            return new ParsedExpression(root, references);
        }

        private Token peek() {
            return tokens.get(position);
        }

        private Token next() {
            return tokens.get(position++);
        }

        private boolean keyword(String word) {
            Token token = peek();
            if (token.type == TokenType.IDENT && token.text.equalsIgnoreCase(word)) {
                position++;
                return true;
            }
            return false;
        }

        private boolean operator(String op) {
            Token token = peek();
            if (token.type == TokenType.OP && token.text.equals(op)) {
                position++;
                return true;
            }
            return false;
        }

        private Expression parseOr() {
            Expression left = parseAnd();
            while (keyword("or")) {
                Expression l = left;
                Expression r = parseAnd();
                left = resolver -> isTruthy(l.evaluate(resolver)) || isTruthy(r.evaluate(resolver)) ? 1.0 : 0.0;
            }
            return left;
        }

        private Expression parseAnd() {
            Expression left = parseNot();
            while (keyword("and")) {
                Expression l = left;
                Expression r = parseNot();
                left = resolver -> isTruthy(l.evaluate(resolver)) && isTruthy(r.evaluate(resolver)) ? 1.0 : 0.0;
            }
            return left;
        }

        private Expression parseNot() {
            if (keyword("not")) {
                Expression operand = parseNot();
                return resolver -> isTruthy(operand.evaluate(resolver)) ? 0.0 : 1.0;
            }
            return parseComparison();
        }

        private Expression parseComparison() {
            Expression left = parseAdditive();
            Token token = peek();
            if (token.type != TokenType.OP || "+-*/%".contains(token.text)) {
                return left;
            }
            String op = next().text;
            Expression right = parseAdditive();
            return switch (op) {
                case "=" -> resolver -> equalValues(left.evaluate(resolver), right.evaluate(resolver)) ? 1.0 : 0.0;
                case "!=" -> resolver -> equalValues(left.evaluate(resolver), right.evaluate(resolver)) ? 0.0 : 1.0;
                case "<" -> resolver -> compare(left.evaluate(resolver), right.evaluate(resolver)) < 0 ? 1.0 : 0.0;
                case "<=" -> resolver -> compare(left.evaluate(resolver), right.evaluate(resolver)) <= 0 ? 1.0 : 0.0;
                case ">" -> resolver -> compare(left.evaluate(resolver), right.evaluate(resolver)) > 0 ? 1.0 : 0.0;
                case ">=" -> resolver -> compare(left.evaluate(resolver), right.evaluate(resolver)) >= 0 ? 1.0 : 0.0;
                default -> throw new IllegalArgumentException("Unknown operator '" + op + "' in: " + source);
            };
        }

        private Expression parseAdditive() {
            Expression left = parseMultiplicative();
            while (true) {
                if (operator("+")) {
                    Expression l = left;
                    Expression r = parseMultiplicative();
                    left = resolver -> toDouble(l.evaluate(resolver)) + toDouble(r.evaluate(resolver));
                } else if (operator("-")) {
                    Expression l = left;
                    Expression r = parseMultiplicative();
                    left = resolver -> toDouble(l.evaluate(resolver)) - toDouble(r.evaluate(resolver));
                } else {
                    return left;
                }
            }
        }

        private Expression parseMultiplicative() {
            Expression left = parseUnary();
            while (true) {
                if (operator("*")) {
                    Expression l = left;
                    Expression r = parseUnary();
                    left = resolver -> toDouble(l.evaluate(resolver)) * toDouble(r.evaluate(resolver));
                } else if (operator("/")) {
                    Expression l = left;
                    Expression r = parseUnary();
                    left = resolver -> toDouble(l.evaluate(resolver)) / toDouble(r.evaluate(resolver));
                } else if (operator("%")) {
                    Expression l = left;
                    Expression r = parseUnary();
                    left = resolver -> toDouble(l.evaluate(resolver)) % toDouble(r.evaluate(resolver));
                } else {
                    return left;
                }
            }
        }

        private Expression parseUnary() {
            if (operator("-")) {
                Expression operand = parseUnary();
                return resolver -> -toDouble(operand.evaluate(resolver));
            }
            if (operator("+")) {
                return parseUnary();
            }
            return parsePrimary();
        }

        private Expression parsePrimary() {
            Token token = next();
            switch (token.type) {
                case NUMBER -> {
                    double value = parseNumber(token.text);
                    return resolver -> value;
                }
                case STRING -> {
                    String value = token.text;
                    return resolver -> value;
                }
                case LPAREN -> {
                    Expression inner = parseOr();
                    expect(TokenType.RPAREN);
                    return inner;
                }
                case IDENT -> {
                    if (peek().type == TokenType.LPAREN) {
                        return parseCall(token.text);
                    }
                    String lower = token.text.toLowerCase(Locale.ROOT);
                    if (lower.equals("true")) {
                        return resolver -> 1.0;
                    }
                    if (lower.equals("false")) {
                        return resolver -> 0.0;
                    }
                    if (lower.equals("null")) {
                        return resolver -> null;
                    }
                    String name = token.text;
                    references.add(name);
                    return resolver -> resolver.apply(name);
                }
                default -> throw new IllegalArgumentException(
                        "Unexpected token '" + token.text + "' in: " + source);
            }
        }

        private Expression parseCall(String name) {
            expect(TokenType.LPAREN);
            List<Expression> arguments = new ArrayList<>();
            if (peek().type != TokenType.RPAREN) {
                arguments.add(parseOr());
                while (peek().type == TokenType.COMMA) {
                    next();
                    arguments.add(parseOr());
                }
            }
            expect(TokenType.RPAREN);

            String function = name.toLowerCase(Locale.ROOT);
            if (arguments.size() != 1) {
                throw new IllegalArgumentException(function + "() takes exactly one argument in: " + source);
            }
            Expression argument = arguments.get(0);
            return switch (function) {
                case "abs" -> resolver -> Math.abs(toDouble(argument.evaluate(resolver)));
                case "round" -> resolver -> (double) Math.round(toDouble(argument.evaluate(resolver)));
                case "floor" -> resolver -> Math.floor(toDouble(argument.evaluate(resolver)));
                case "ceil" -> resolver -> Math.ceil(toDouble(argument.evaluate(resolver)));
                case "lower" -> resolver -> {
                    Object value = argument.evaluate(resolver);
                    return value == null ? null : value.toString().toLowerCase(Locale.ROOT);
                };
                case "upper" -> resolver -> {
                    Object value = argument.evaluate(resolver);
                    return value == null ? null : value.toString().toUpperCase(Locale.ROOT);
                };
                default -> throw new IllegalArgumentException("Unknown function '" + name + "' in: " + source);
            };
        }

        private double parseNumber(String text) {
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number '" + text + "' in: " + source, e);
            }
        }

        private void expect(TokenType type) {
            Token token = next();
            if (token.type != type) {
                throw new IllegalArgumentException("Expected " + type + " but found '" + token.text + "' in: " + source);
            }
        }
    }
}
