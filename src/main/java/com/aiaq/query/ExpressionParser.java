package com.aiaq.query;

import com.aiaq.model.BlockKind;
import com.aiaq.model.BlockTypes;
import com.aiaq.model.TypeCatalog;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Optional;

/**
 * Parses textual filters such as {@code type == logic_compare & ~logically_disabled}.
 * <p>
 * Operators by increasing precedence: {@code |}, {@code &}, {@code ~}/{@code !}, comparisons. Bare identifiers
 * name an attribute ({@code height}, {@code fields.OP}, {@code mutation.component_type},
 * {@code properties.Text}), or else a block type, block category, block kind or component type. An attribute
 * followed by a parenthesized expression is applied to it, e.g. {@code root_block(declaration)}.
 */
public class ExpressionParser {
    private final TypeCatalog catalog;

    public ExpressionParser() {
        this(TypeCatalog.standard());
    }

    public ExpressionParser(TypeCatalog catalog) {
        this.catalog = catalog;
    }

    public Expression parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Empty filter");
        }
        Cursor cursor = new Cursor(tokenize(text), text);
        Object result = parseOr(cursor);
        if (!cursor.atEnd()) {
            throw cursor.error("Unexpected '" + cursor.peek().text() + "'");
        }
        return result instanceof Expression expression ? expression : ComputedAttribute.constant(result);
    }

    private Object parseOr(Cursor cursor) {
        Object left = parseAnd(cursor);
        while (cursor.accept("|")) {
            left = Expressions.or(left, parseAnd(cursor));
        }
        return left;
    }

    private Object parseAnd(Cursor cursor) {
        Object left = parseUnary(cursor);
        while (cursor.accept("&")) {
            left = Expressions.and(left, parseUnary(cursor));
        }
        return left;
    }

    private Object parseUnary(Cursor cursor) {
        if (cursor.accept("~") || cursor.accept("!")) {
            return Expressions.not(parseUnary(cursor));
        }
        return parseComparison(cursor);
    }

    private Object parseComparison(Cursor cursor) {
        Object left = parsePrimary(cursor);
        if (!cursor.atEnd() && cursor.peek().kind() == TokenKind.COMPARISON) {
            Comparison.Operator operator = Comparison.Operator.fromSymbol(cursor.next().text());
            Object right = parsePrimary(cursor);
            return Expressions.compare(operator, left, right);
        }
        return left;
    }

    private Object parsePrimary(Cursor cursor) {
        if (cursor.atEnd()) {
            throw cursor.error("Unexpected end of filter");
        }
        Token token = cursor.next();
        switch (token.kind()) {
            case STRING:
                return token.text();
            case NUMBER:
                return parseNumber(token.text());
            case OPEN:
                Object inner = parseOr(cursor);
                cursor.expect(")");
                return inner;
            case IDENTIFIER:
                return parseIdentifier(token.text(), cursor);
            default:
                throw cursor.error("Unexpected '" + token.text() + "'");
        }
    }

    private Object parseIdentifier(String name, Cursor cursor) {
        switch (name) {
            case "true":
                return Boolean.TRUE;
            case "false":
                return Boolean.FALSE;
            case "null":
                return null;
            case "has_ancestor":
                return Attributes.hasAncestor(optionalArgument(cursor));
            case "has_descendant":
                return Attributes.hasDescendant(optionalArgument(cursor));
            default:
                break;
        }
        Optional<Expression> attribute = attribute(name);
        if (attribute.isPresent()) {
            if (cursor.accept("(")) {
                Object argument = parseOr(cursor);
                cursor.expect(")");
                if (!Values.needsEvaluation(argument)) {
                    throw new IllegalArgumentException("Cannot apply " + name + " to " + Values.repr(argument));
                }
                return attribute.get().apply(argument);
            }
            return attribute.get();
        }
        return constant(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown identifier: " + name));
    }

    private Object optionalArgument(Cursor cursor) {
        if (!cursor.accept("(")) {
            return null;
        }
        if (cursor.accept(")")) {
            return null;
        }
        Object argument = parseOr(cursor);
        cursor.expect(")");
        return argument;
    }

    private Optional<Expression> attribute(String name) {
        int dot = name.indexOf('.');
        if (dot < 0) {
            return Attributes.named(name);
        }
        String map = name.substring(0, dot);
        String key = name.substring(dot + 1);
        return switch (map) {
            case "fields" -> Optional.of(Attributes.field(key));
            case "mutation" -> Optional.of(Attributes.mutation(key));
            case "properties" -> Optional.of(Attributes.property(key));
            default -> throw new IllegalArgumentException("Unknown attribute map: " + map);
        };
    }

    private Optional<Object> constant(String name) {
        Optional<? extends Atom> blockType = catalog.blockType(name);
        if (blockType.isPresent()) {
            return Optional.of(blockType.get());
        }
        Optional<? extends Atom> category = BlockTypes.findCategory(name);
        if (category.isPresent()) {
            return Optional.of(category.get());
        }
        for (BlockKind kind : BlockKind.values()) {
            if (kind.name().equals(name)) {
                return Optional.of(kind);
            }
        }
        return catalog.componentType(name).map(Object.class::cast);
    }

    private static Number parseNumber(String text) {
        if (text.contains(".") || text.contains("e") || text.contains("E")) {
            return Double.parseDouble(text);
        }
        return Long.parseLong(text);
    }

    private enum TokenKind {
        IDENTIFIER, STRING, NUMBER, COMPARISON, OPERATOR, OPEN, CLOSE
    }

    private record Token(TokenKind kind, String text, int position) {
    }

    private static MutableList<Token> tokenize(String text) {
        MutableList<Token> tokens = Lists.mutable.empty();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '(' || c == ')') {
                tokens.add(new Token(c == '(' ? TokenKind.OPEN : TokenKind.CLOSE, String.valueOf(c), i));
                i++;
            } else if (c == '"' || c == '\'') {
                int end = text.indexOf(c, i + 1);
                if (end < 0) {
                    throw new IllegalArgumentException("Unterminated string at position " + i);
                }
                tokens.add(new Token(TokenKind.STRING, text.substring(i + 1, end), i));
                i = end + 1;
            } else if (Character.isDigit(c)
                    || (c == '-' && i + 1 < text.length() && Character.isDigit(text.charAt(i + 1)))) {
                int start = i++;
                while (i < text.length() && (Character.isDigit(text.charAt(i)) || text.charAt(i) == '.'
                        || text.charAt(i) == 'e' || text.charAt(i) == 'E')) {
                    i++;
                }
                tokens.add(new Token(TokenKind.NUMBER, text.substring(start, i), start));
            } else if (Character.isLetter(c) || c == '_') {
                int start = i++;
                while (i < text.length()
                        && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_' || text.charAt(i) == '.')) {
                    i++;
                }
                tokens.add(new Token(TokenKind.IDENTIFIER, text.substring(start, i), start));
            } else if (text.startsWith("==", i) || text.startsWith("!=", i) || text.startsWith("<=", i)
                    || text.startsWith(">=", i)) {
                tokens.add(new Token(TokenKind.COMPARISON, text.substring(i, i + 2), i));
                i += 2;
            } else if (c == '<' || c == '>') {
                tokens.add(new Token(TokenKind.COMPARISON, String.valueOf(c), i));
                i++;
            } else if (c == '=') {
                tokens.add(new Token(TokenKind.COMPARISON, "==", i));
                i++;
            } else if (c == '|' || c == '&' || c == '~' || c == '!') {
                tokens.add(new Token(TokenKind.OPERATOR, String.valueOf(c), i));
                i++;
            } else {
                throw new IllegalArgumentException("Unexpected character '" + c + "' at position " + i);
            }
        }
        return tokens;
    }

    private static final class Cursor {
        private final MutableList<Token> tokens;
        private final String text;
        private int index;

        Cursor(MutableList<Token> tokens, String text) {
            this.tokens = tokens;
            this.text = text;
        }

        boolean atEnd() {
            return index >= tokens.size();
        }

        Token peek() {
            return tokens.get(index);
        }

        Token next() {
            return tokens.get(index++);
        }

        boolean accept(String symbol) {
            if (!atEnd() && peek().kind() != TokenKind.STRING && peek().text().equals(symbol)) {
                index++;
                return true;
            }
            return false;
        }

        void expect(String symbol) {
            if (!accept(symbol)) {
                throw error("Expected '" + symbol + "'");
            }
        }

        IllegalArgumentException error(String message) {
            int position = atEnd() ? text.length() : peek().position();
            return new IllegalArgumentException(message + " at position " + position + " in: " + text);
        }
    }
}
