package com.synclab.laddersim.engine.eval;

import com.synclab.laddersim.engine.model.Operand;
import com.synclab.laddersim.engine.state.StateView;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Evaluates CPT and CMP expressions such as {@code (Speed * 2) + Offset} or
 * {@code Level >= Setpoint AND NOT Fault}.
 *
 * <pre>
 * or       := and ( OR and )*
 * and      := not ( (AND | XOR) not )*
 * not      := NOT not | relation
 * relation := sum ( (= | &lt;&gt; | &lt; | &lt;= | &gt; | &gt;=) sum )?
 * sum      := product ( (+ | -) product )*
 * product  := power ( (* | / | MOD) power )*
 * power    := unary ( ** unary )?
 * unary    := - unary | primary
 * primary  := number | tag | FUNC ( or ) | ( or )
 * </pre>
 *
 * Booleans are 1/0. Division or MOD by zero yields 0. Malformed input raises
 * {@link IllegalArgumentException}; callers degrade it to 0 / false.
 */
public final class ExpressionEvaluator {

    private final List<String> tokens;
    private final StateView view;
    private int pos;

    private ExpressionEvaluator(List<String> tokens, StateView view) {
        this.tokens = tokens;
        this.view = view;
    }

    public static double evaluate(String expression, StateView view) {
        String text = Operand.strip(expression);
        if (text.isEmpty()) {
            throw new IllegalArgumentException("empty expression");
        }
        ExpressionEvaluator evaluator = new ExpressionEvaluator(tokenize(text), view);
        double value = evaluator.parseOr();
        if (evaluator.pos != evaluator.tokens.size()) {
            throw new IllegalArgumentException("unexpected '" + evaluator.tokens.get(evaluator.pos)
                    + "' in expression '" + text + "'");
        }
        return OperandResolver.finiteOrZero(value);
    }

    private double parseOr() {
        double left = parseAnd();
        while (acceptWord("OR")) {
            double right = parseAnd();
            left = truth(left) || truth(right) ? 1.0 : 0.0;
        }
        return left;
    }

    private double parseAnd() {
        double left = parseNot();
        while (true) {
            if (acceptWord("AND")) {
                double right = parseNot();
                left = truth(left) && truth(right) ? 1.0 : 0.0;
            } else if (acceptWord("XOR")) {
                double right = parseNot();
                left = truth(left) ^ truth(right) ? 1.0 : 0.0;
            } else {
                return left;
            }
        }
    }

    private double parseNot() {
        if (acceptWord("NOT")) {
            return truth(parseNot()) ? 0.0 : 1.0;
        }
        return parseRelation();
    }

    private double parseRelation() {
        double left = parseSum();
        String op = peek();
        if (op == null) {
            return left;
        }
        switch (op) {
            case "=":
                pos++;
                return left == parseSum() ? 1.0 : 0.0;
            case "<>":
                pos++;
                return left != parseSum() ? 1.0 : 0.0;
            case "<":
                pos++;
                return left < parseSum() ? 1.0 : 0.0;
            case "<=":
                pos++;
                return left <= parseSum() ? 1.0 : 0.0;
            case ">":
                pos++;
                return left > parseSum() ? 1.0 : 0.0;
            case ">=":
                pos++;
                return left >= parseSum() ? 1.0 : 0.0;
            default:
                return left;
        }
    }

    private double parseSum() {
        double left = parseProduct();
        while (true) {
            if (accept("+")) {
                left = left + parseProduct();
            } else if (accept("-")) {
                left = left - parseProduct();
            } else {
                return left;
            }
        }
    }

    private double parseProduct() {
        double left = parsePower();
        while (true) {
            if (accept("*")) {
                left = left * parsePower();
            } else if (accept("/")) {
                double right = parsePower();
                left = right == 0.0 ? 0.0 : left / right;
            } else if (acceptWord("MOD")) {
                double right = parsePower();
                left = right == 0.0 ? 0.0 : left % right;
            } else {
                return left;
            }
        }
    }

    private double parsePower() {
        double base = parseUnary();
        if (accept("**")) {
            return Math.pow(base, parseUnary());
        }
        return base;
    }

    private double parseUnary() {
        if (accept("-")) {
            return -parseUnary();
        }
        if (accept("+")) {
            return parseUnary();
        }
        return parsePrimary();
    }

    private double parsePrimary() {
        String token = next();
        if ("(".equals(token)) {
            double value = parseOr();
            expect(")");
            return value;
        }
        if (Operand.isLiteral(token)) {
            return Operand.parseLiteral(token);
        }
        if (isIdentifier(token)) {
            if ("(".equals(peek())) {
                pos++;
                double argument = parseOr();
                expect(")");
                return applyFunction(token.toUpperCase(Locale.ROOT), argument);
            }
            return OperandResolver.resolve(token, view);
        }
        throw new IllegalArgumentException("unexpected '" + token + "'");
    }

    private static double applyFunction(String name, double argument) {
        switch (name) {
            case "ABS":
                return Math.abs(argument);
            case "SQR":
            case "SQRT":
                return argument < 0 ? 0.0 : Math.sqrt(argument);
            case "NEG":
                return -argument;
            case "TRN":
                return argument < 0 ? Math.ceil(argument) : Math.floor(argument);
            case "LN":
                return argument <= 0 ? 0.0 : Math.log(argument);
            case "LOG":
                return argument <= 0 ? 0.0 : Math.log10(argument);
            case "SIN":
                return Math.sin(argument);
            case "COS":
                return Math.cos(argument);
            case "TAN":
                return Math.tan(argument);
            default:
                throw new IllegalArgumentException("unsupported function " + name);
        }
    }

    private static boolean truth(double value) {
        return value != 0.0;
    }

    private String peek() {
        return pos < tokens.size() ? tokens.get(pos) : null;
    }

    private String next() {
        if (pos >= tokens.size()) {
            throw new IllegalArgumentException("expression ended early");
        }
        return tokens.get(pos++);
    }

    private boolean accept(String symbol) {
        if (symbol.equals(peek())) {
            pos++;
            return true;
        }
        return false;
    }

    private boolean acceptWord(String word) {
        String token = peek();
        if (token != null && token.equalsIgnoreCase(word)) {
            pos++;
            return true;
        }
        return false;
    }

    private void expect(String symbol) {
        if (!accept(symbol)) {
            throw new IllegalArgumentException("expected '" + symbol + "'");
        }
    }

    private static boolean isIdentifier(String token) {
        char first = token.charAt(0);
        return Character.isLetter(first) || first == '_';
    }

    static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (Character.isDigit(c) || (c == '.' && i + 1 < text.length() && Character.isDigit(text.charAt(i + 1)))) {
                int start = i;
                while (i < text.length() && (Character.isDigit(text.charAt(i)) || text.charAt(i) == '.')) {
                    i++;
                }
                if (i < text.length() && (text.charAt(i) == 'e' || text.charAt(i) == 'E')) {
                    int mark = i;
                    i++;
                    if (i < text.length() && (text.charAt(i) == '+' || text.charAt(i) == '-')) {
                        i++;
                    }
                    if (i < text.length() && Character.isDigit(text.charAt(i))) {
                        while (i < text.length() && Character.isDigit(text.charAt(i))) {
                            i++;
                        }
                    } else {
                        i = mark;
                    }
                }
                tokens.add(text.substring(start, i));
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                int depth = 0;
                while (i < text.length()) {
                    char ch = text.charAt(i);
                    if (ch == '[') {
                        depth++;
                    } else if (ch == ']') {
                        depth--;
                    } else if (depth == 0 && !(Character.isLetterOrDigit(ch) || ch == '_' || ch == '.' || ch == ':')) {
                        break;
                    }
                    i++;
                }
                tokens.add(text.substring(start, i));
            } else if (c == '*' && i + 1 < text.length() && text.charAt(i + 1) == '*') {
                tokens.add("**");
                i += 2;
            } else if (c == '<' && i + 1 < text.length() && (text.charAt(i + 1) == '>' || text.charAt(i + 1) == '=')) {
                tokens.add(text.substring(i, i + 2));
                i += 2;
            } else if (c == '>' && i + 1 < text.length() && text.charAt(i + 1) == '=') {
                tokens.add(">=");
                i += 2;
            } else if ("+-*/()<>=".indexOf(c) >= 0) {
                tokens.add(String.valueOf(c));
                i++;
            } else {
                throw new IllegalArgumentException("unexpected character '" + c + "'");
            }
        }
        return tokens;
    }
}
