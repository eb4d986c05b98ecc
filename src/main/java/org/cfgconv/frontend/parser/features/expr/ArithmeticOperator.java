package org.cfgconv.frontend.parser.features.expr;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.LongBinaryOperator;

/**
 * The fixed set of operators usable in bracket expressions.
 * All operations are exact: a result outside the 64-bit range throws {@link ArithmeticException}.
 */
public enum ArithmeticOperator {
    ADD("+", Math::addExact),
    SUBTRACT("-", Math::subtractExact),
    MULTIPLY("*", Math::multiplyExact),
    /** Floor division, rounding toward negative infinity. */
    DIVIDE("/", ArithmeticOperator::floorDivide);

    private final String symbol;
    private final LongBinaryOperator operation;

    ArithmeticOperator(String symbol, LongBinaryOperator operation) {
        this.symbol = symbol;
        this.operation = operation;
    }

    /**
     * Applies the operator.
     * @param left The left operand.
     * @param right The right operand.
     * @return The result.
     * @throws ArithmeticException on overflow or division by zero.
     */
    public long apply(long left, long right) {
        return operation.applyAsLong(left, right);
    }

    /**
     * Finds the operator for a symbol.
     * @param symbol One of + - * /.
     * @return The operator, or empty for an unknown symbol.
     */
    public static Optional<ArithmeticOperator> fromSymbol(String symbol) {
        return Arrays.stream(values()).filter(op -> op.symbol.equals(symbol)).findFirst();
    }

    private static long floorDivide(long left, long right) {
        if (left == Long.MIN_VALUE && right == -1) {
            throw new ArithmeticException("long overflow");
        }
        return Math.floorDiv(left, right);
    }
}
