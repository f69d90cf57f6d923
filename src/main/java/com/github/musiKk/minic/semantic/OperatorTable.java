package com.github.musiKk.minic.semantic;

import static com.github.musiKk.minic.semantic.Type.Builtin.BOOL;
import static com.github.musiKk.minic.semantic.Type.Builtin.CHAR;
import static com.github.musiKk.minic.semantic.Type.Builtin.INT;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.github.musiKk.minic.Tokenizer.TokenType;

/**
 * Typing rules: the implicit coercions and the accepted operand pairs of each
 * binary operator.
 */
public class OperatorTable {

    private static final Set<TokenType> ARITHMETIC = Set.of(
            TokenType.PLUS, TokenType.MINUS, TokenType.STAR, TokenType.SLASH, TokenType.PERCENT);
    private static final Set<TokenType> EQUALITY = Set.of(TokenType.EQUALS_EQUALS, TokenType.NOT_EQUALS);
    private static final Set<TokenType> RELATIONAL = Set.of(TokenType.LT, TokenType.GT, TokenType.LE, TokenType.GE);
    private static final Set<TokenType> LOGICAL = Set.of(TokenType.AND_AND, TokenType.OR_OR);

    private static final Map<TokenType, Map<Operands, Type>> TABLE = new EnumMap<>(TokenType.class);

    static {
        for (var op : ARITHMETIC) {
            accept(op, INT, INT, INT);
            accept(op, CHAR, INT, INT);
            accept(op, INT, CHAR, INT);
            accept(op, CHAR, CHAR, INT);
        }
        for (var op : EQUALITY) {
            accept(op, INT, INT, BOOL);
            accept(op, CHAR, CHAR, BOOL);
            accept(op, BOOL, BOOL, BOOL);
        }
        for (var op : RELATIONAL) {
            accept(op, INT, INT, BOOL);
            accept(op, CHAR, CHAR, BOOL);
            accept(op, BOOL, BOOL, BOOL);
        }
        for (var op : LOGICAL) {
            accept(op, BOOL, BOOL, BOOL);
        }
    }

    private record Operands(Type left, Type right) {}

    private static void accept(TokenType operator, Type left, Type right, Type result) {
        TABLE.computeIfAbsent(operator, k -> new HashMap<>()).put(new Operands(left, right), result);
    }

    /**
     * Looks the pair up as written, then swapped.
     */
    public static Optional<Type> binaryResult(TokenType operator, Type left, Type right) {
        var accepted = TABLE.getOrDefault(operator, Map.of());
        var result = accepted.get(new Operands(left, right));
        if (result == null) {
            result = accepted.get(new Operands(right, left));
        }
        return Optional.ofNullable(result);
    }

    /** Result type assumed when the operands are unknown or rejected. */
    public static Type nominalResult(TokenType operator) {
        return ARITHMETIC.contains(operator) ? INT : BOOL;
    }

    /**
     * Assignment compatibility: identical types, char to int, int to bool.
     */
    public static boolean isAssignable(Type from, Type to) {
        if (from.isAny() || to.isAny()) {
            return true;
        }
        if (from.equals(to)) {
            return true;
        }
        return (from == CHAR && to == INT) || (from == INT && to == BOOL);
    }

    /**
     * Return compatibility: identical types or char to int.
     */
    public static boolean widensTo(Type from, Type to) {
        if (from.isAny() || to.isAny()) {
            return true;
        }
        return from.equals(to) || (from == CHAR && to == INT);
    }

}
