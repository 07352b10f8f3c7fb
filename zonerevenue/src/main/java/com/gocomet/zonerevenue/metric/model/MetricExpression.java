package com.gocomet.zonerevenue.metric.model;

import com.gocomet.zonerevenue.common.aggregate.Numbers;
import com.gocomet.zonerevenue.common.exception.MetricConfigurationException;
import com.gocomet.zonerevenue.trip.model.ColumnType;
import com.gocomet.zonerevenue.trip.model.Trip;
import com.gocomet.zonerevenue.trip.model.TripColumn;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Scalar expression over one trip: a column, a numeric literal, or arithmetic
 * ({@code + - * /}, unary minus, parentheses) over numeric ones. A null operand
 * makes the whole result null, as does division by zero. The expression
 * {@code *} stands for the row itself and is only useful for counting.
 */
public final class MetricExpression {

    private static final String ROW = "*";

    private final String text;
    private final Node root;
    private final Set<TripColumn> columns;

    private MetricExpression(String text, Node root, Set<TripColumn> columns) {
        this.text = text;
        this.root = root;
        this.columns = Collections.unmodifiableSet(columns);
    }

    /**
     * @throws MetricConfigurationException for malformed text, unknown columns
     *                                      or arithmetic over non-numeric columns
     */
    public static MetricExpression parse(String metricName, String text) {
        if (text == null || text.isBlank()) {
            throw new MetricConfigurationException(metricName, "expression is empty");
        }
        String trimmed = text.trim();
        if (trimmed.equals(ROW)) {
            return new MetricExpression(trimmed, null, Set.of());
        }
        Parser parser = new Parser(metricName, trimmed);
        Node root = parser.parseExpression();
        parser.expectEnd();
        return new MetricExpression(trimmed, root, parser.columns);
    }

    public boolean isRow() {
        return root == null;
    }

    public ColumnType type() {
        return isRow() ? ColumnType.INTEGER : root.type();
    }

    public Set<TripColumn> columns() {
        return columns;
    }

    /**
     * Numbers come back as {@link BigDecimal}; the row expression yields a
     * non-null marker for every trip.
     */
    public Object evaluate(Trip trip) {
        return isRow() ? BigDecimal.ONE : root.evaluate(trip);
    }

    @Override
    public String toString() {
        return text;
    }

    private interface Node {
        Object evaluate(Trip trip);

        ColumnType type();
    }

    private static final class ColumnNode implements Node {
        private final TripColumn column;

        ColumnNode(TripColumn column) {
            this.column = column;
        }

        @Override
        public Object evaluate(Trip trip) {
            return column.type().normalize(column.read(trip));
        }

        @Override
        public ColumnType type() {
            return column.type();
        }
    }

    private static final class LiteralNode implements Node {
        private final BigDecimal value;

        LiteralNode(BigDecimal value) {
            this.value = value;
        }

        @Override
        public Object evaluate(Trip trip) {
            return value;
        }

        @Override
        public ColumnType type() {
            return ColumnType.NUMERIC;
        }
    }

    private static final class NegateNode implements Node {
        private final Node operand;

        NegateNode(Node operand) {
            this.operand = operand;
        }

        @Override
        public Object evaluate(Trip trip) {
            Object value = operand.evaluate(trip);
            return value == null ? null : Numbers.toBigDecimal(value).negate();
        }

        @Override
        public ColumnType type() {
            return ColumnType.NUMERIC;
        }
    }

    private static final class BinaryNode implements Node {
        private final char operator;
        private final Node left;
        private final Node right;

        BinaryNode(char operator, Node left, Node right) {
            this.operator = operator;
            this.left = left;
            this.right = right;
        }

        @Override
        public Object evaluate(Trip trip) {
            Object l = left.evaluate(trip);
            Object r = right.evaluate(trip);
            if (l == null || r == null) {
                return null;
            }
            BigDecimal a = Numbers.toBigDecimal(l);
            BigDecimal b = Numbers.toBigDecimal(r);
            return switch (operator) {
                case '+' -> a.add(b);
                case '-' -> a.subtract(b);
                case '*' -> a.multiply(b);
                case '/' -> b.signum() == 0 ? null : a.divide(b, MathContext.DECIMAL64);
                default -> throw new IllegalStateException("Unknown operator " + operator);
            };
        }

        @Override
        public ColumnType type() {
            return ColumnType.NUMERIC;
        }
    }

    /**
     * expression := term (('+' | '-') term)*
     * term       := factor (('*' | '/') factor)*
     * factor     := '-' factor | '(' expression ')' | number | column
     */
    private static final class Parser {
        private final String metricName;
        private final String text;
        private final Set<TripColumn> columns = new LinkedHashSet<>();
        private int pos;

        Parser(String metricName, String text) {
            this.metricName = metricName;
            this.text = text;
        }

        Node parseExpression() {
            Node node = parseTerm();
            while (peek() == '+' || peek() == '-') {
                char operator = next();
                node = arithmetic(operator, node, parseTerm());
            }
            return node;
        }

        private Node parseTerm() {
            Node node = parseFactor();
            while (peek() == '*' || peek() == '/') {
                char operator = next();
                node = arithmetic(operator, node, parseFactor());
            }
            return node;
        }

        private Node parseFactor() {
            char c = peek();
            if (c == '-') {
                next();
                return new NegateNode(numeric(parseFactor()));
            }
            if (c == '(') {
                next();
                Node inner = parseExpression();
                if (peek() != ')') {
                    throw error("expected ')'");
                }
                next();
                return inner;
            }
            if (Character.isDigit(c) || c == '.') {
                return parseNumber();
            }
            if (Character.isLetter(c) || c == '_') {
                return parseColumn();
            }
            throw error(c == 0 ? "unexpected end of expression" : "unexpected '" + c + "'");
        }

        private Node parseNumber() {
            int start = pos;
            while (pos < text.length() && (Character.isDigit(text.charAt(pos)) || text.charAt(pos) == '.')) {
                pos++;
            }
            String literal = text.substring(start, pos);
            try {
                return new LiteralNode(new BigDecimal(literal));
            } catch (NumberFormatException e) {
                throw new MetricConfigurationException(metricName, "invalid number '" + literal + "' in expression", e);
            }
        }

        private Node parseColumn() {
            int start = pos;
            while (pos < text.length() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
                pos++;
            }
            String name = text.substring(start, pos);
            TripColumn column = TripColumn.find(name)
                    .orElseThrow(() -> new MetricConfigurationException(metricName,
                            "unknown column '" + name + "' in expression '" + text + "'"));
            columns.add(column);
            return new ColumnNode(column);
        }

        private Node arithmetic(char operator, Node left, Node right) {
            return new BinaryNode(operator, numeric(left), numeric(right));
        }

        private Node numeric(Node node) {
            if (!node.type().isNumeric()) {
                throw error("arithmetic needs numeric operands");
            }
            return node;
        }

        void expectEnd() {
            if (peek() != 0) {
                throw error("unexpected '" + peek() + "'");
            }
        }

        private char peek() {
            while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
            return pos < text.length() ? text.charAt(pos) : 0;
        }

        private char next() {
            char c = peek();
            pos++;
            return c;
        }

        private MetricConfigurationException error(String problem) {
            return new MetricConfigurationException(metricName,
                    String.format("%s at position %d of expression '%s'", problem, pos, text));
        }
    }
}
