package me.golemcore.toolrouter.domain.costmodel;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/**
 * Recursive-descent parser for cost expressions.
 *
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := unary (('*' | '/') unary)*
 * unary      := '-' unary | power
 * power      := primary ('^' unary)?
 * primary    := NUMBER | 'N' | IDENT '(' args ')' | '(' expression ')'
 * </pre>
 *
 * Supported functions: ceil, floor, abs, sqrt, log, log2, log10, min, max.
 */
final class CostExpressionParser {

    private final String source;
    private int pos;

    CostExpressionParser(String source) {
        this.source = source;
    }

    CostExpression parse() {
        CostExpression.Node root = expression();
        skipWhitespace();
        if (pos < source.length()) {
            throw error("Unexpected '" + source.charAt(pos) + "'");
        }
        return new CostExpression(source, root);
    }

    private CostExpression.Node expression() {
        CostExpression.Node left = term();
        while (true) {
            if (consume('+')) {
                left = binary(left, term(), Double::sum);
            } else if (consume('-')) {
                left = binary(left, term(), (a, b) -> a - b);
            } else {
                return left;
            }
        }
    }

    private CostExpression.Node term() {
        CostExpression.Node left = unary();
        while (true) {
            if (consume('*')) {
                left = binary(left, unary(), (a, b) -> a * b);
            } else if (consume('/')) {
                left = binary(left, unary(), (a, b) -> a / b);
            } else {
                return left;
            }
        }
    }

    private CostExpression.Node unary() {
        if (consume('-')) {
            CostExpression.Node operand = unary();
            return n -> -operand.eval(n);
        }
        return power();
    }

    private CostExpression.Node power() {
        CostExpression.Node base = primary();
        if (consume('^')) {
            CostExpression.Node exponent = unary();
            return n -> Math.pow(base.eval(n), exponent.eval(n));
        }
        return base;
    }

    private CostExpression.Node primary() {
        skipWhitespace();
        if (pos >= source.length()) {
            throw error("Unexpected end of expression");
        }
        char c = source.charAt(pos);
        if (consume('(')) {
            CostExpression.Node inner = expression();
            expect(')');
            return inner;
        }
        if (Character.isDigit(c) || c == '.') {
            double value = number();
            return n -> value;
        }
        if (Character.isLetter(c)) {
            int start = pos;
            String ident = identifier();
            if ("N".equals(ident) || "n".equals(ident)) {
                return n -> n;
            }
            return function(ident.toLowerCase(Locale.ROOT), start);
        }
        throw error("Unexpected '" + c + "'");
    }

    private CostExpression.Node function(String name, int start) {
        expect('(');
        List<CostExpression.Node> args = new ArrayList<>();
        args.add(expression());
        while (consume(',')) {
            args.add(expression());
        }
        expect(')');

        return switch (name) {
        case "ceil" -> unaryFunction(name, args, start, Math::ceil);
        case "floor" -> unaryFunction(name, args, start, Math::floor);
        case "abs" -> unaryFunction(name, args, start, Math::abs);
        case "sqrt" -> unaryFunction(name, args, start, Math::sqrt);
        case "log" -> unaryFunction(name, args, start, Math::log);
        case "log10" -> unaryFunction(name, args, start, Math::log10);
        case "log2" -> unaryFunction(name, args, start, x -> Math.log(x) / Math.log(2));
        case "min" -> foldFunction(name, args, start, Math::min);
        case "max" -> foldFunction(name, args, start, Math::max);
        default -> throw new CostExpressionException("Unknown function '" + name + "'", start);
        };
    }

    private CostExpression.Node unaryFunction(String name, List<CostExpression.Node> args, int start,
            DoubleUnaryOperator op) {
        if (args.size() != 1) {
            throw new CostExpressionException(name + "() takes exactly one argument", start);
        }
        CostExpression.Node arg = args.get(0);
        return n -> op.applyAsDouble(arg.eval(n));
    }

    private CostExpression.Node foldFunction(String name, List<CostExpression.Node> args, int start,
            DoubleBinaryOperator op) {
        if (args.size() < 2) {
            throw new CostExpressionException(name + "() takes at least two arguments", start);
        }
        List<CostExpression.Node> operands = List.copyOf(args);
        return n -> {
            double acc = operands.get(0).eval(n);
            for (int i = 1; i < operands.size(); i++) {
                acc = op.applyAsDouble(acc, operands.get(i).eval(n));
            }
            return acc;
        };
    }

    private static CostExpression.Node binary(CostExpression.Node left, CostExpression.Node right,
            DoubleBinaryOperator op) {
        return n -> op.applyAsDouble(left.eval(n), right.eval(n));
    }

    private double number() {
        int start = pos;
        while (pos < source.length()
                && (Character.isDigit(source.charAt(pos)) || source.charAt(pos) == '.')) {
            pos++;
        }
        if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
            pos++;
            if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
                pos++;
            }
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                pos++;
            }
        }
        String literal = source.substring(start, pos);
        try {
            return Double.parseDouble(literal);
        } catch (NumberFormatException e) {
            throw new CostExpressionException("Invalid number '" + literal + "'", start);
        }
    }

    private String identifier() {
        int start = pos;
        while (pos < source.length()
                && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            pos++;
        }
        return source.substring(start, pos);
    }

    private boolean consume(char expected) {
        skipWhitespace();
        if (pos < source.length() && source.charAt(pos) == expected) {
            pos++;
            return true;
        }
        return false;
    }

    private void expect(char expected) {
        if (!consume(expected)) {
            throw error("Expected '" + expected + "'");
        }
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private CostExpressionException error(String message) {
        return new CostExpressionException(message + " in '" + source + "'", pos);
    }
}
