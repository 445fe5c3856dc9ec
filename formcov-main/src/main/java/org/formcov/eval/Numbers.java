package org.formcov.eval;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;

/**
 * Arithmetic over the numeric tower {@code Long < BigInteger < BigDecimal < Double}. The widest operand decides
 * the representation of the result. Long arithmetic is exact and fails on overflow.
 */
public final class Numbers {

    private enum Category { LONG, BIGINT, DECIMAL, DOUBLE }

    private Numbers() {}

    public static Number add(Number a, Number b) {
        switch (category(a, b)) {
            case LONG:
                return Math.addExact(a.longValue(), b.longValue());
            case BIGINT:
                return toBigInteger(a).add(toBigInteger(b));
            case DECIMAL:
                return toBigDecimal(a).add(toBigDecimal(b));
            default:
                return a.doubleValue() + b.doubleValue();
        }
    }

    public static Number subtract(Number a, Number b) {
        switch (category(a, b)) {
            case LONG:
                return Math.subtractExact(a.longValue(), b.longValue());
            case BIGINT:
                return toBigInteger(a).subtract(toBigInteger(b));
            case DECIMAL:
                return toBigDecimal(a).subtract(toBigDecimal(b));
            default:
                return a.doubleValue() - b.doubleValue();
        }
    }

    public static Number multiply(Number a, Number b) {
        switch (category(a, b)) {
            case LONG:
                return Math.multiplyExact(a.longValue(), b.longValue());
            case BIGINT:
                return toBigInteger(a).multiply(toBigInteger(b));
            case DECIMAL:
                return toBigDecimal(a).multiply(toBigDecimal(b));
            default:
                return a.doubleValue() * b.doubleValue();
        }
    }

    /**
     * Integer division stays integral when exact and otherwise falls back to {@link Double}.
     */
    public static Number divide(Number a, Number b) {
        Category category = category(a, b);
        if (category != Category.DOUBLE && isZero(b)) {
            throw new ArithmeticException("Divide by zero");
        }
        switch (category) {
            case LONG:
                long x = a.longValue();
                long y = b.longValue();
                checkDivision(x, y);
                return x % y == 0 ? (Number) Long.valueOf(x / y) : Double.valueOf((double) x / y);
            case BIGINT:
                BigInteger[] qr = toBigInteger(a).divideAndRemainder(toBigInteger(b));
                return qr[1].signum() == 0 ? (Number) qr[0] : Double.valueOf(a.doubleValue() / b.doubleValue());
            case DECIMAL:
                return toBigDecimal(a).divide(toBigDecimal(b), MathContext.DECIMAL128);
            default:
                return a.doubleValue() / b.doubleValue();
        }
    }

    public static Number quotient(Number a, Number b) {
        Category category = category(a, b);
        if (category == Category.DOUBLE) {
            double q = a.doubleValue() / b.doubleValue();
            return q < 0 ? Math.ceil(q) : Math.floor(q);
        }
        if (isZero(b)) {
            throw new ArithmeticException("Divide by zero");
        }
        if (category == Category.LONG) {
            checkDivision(a.longValue(), b.longValue());
            return a.longValue() / b.longValue();
        }
        return toBigInteger(a).divide(toBigInteger(b));
    }

    public static Number remainder(Number a, Number b) {
        Category category = category(a, b);
        if (category == Category.DOUBLE) {
            return a.doubleValue() % b.doubleValue();
        }
        if (isZero(b)) {
            throw new ArithmeticException("Divide by zero");
        }
        if (category == Category.LONG) {
            return a.longValue() % b.longValue();
        }
        return toBigInteger(a).remainder(toBigInteger(b));
    }

    /**
     * Remainder with the sign of the divisor.
     */
    public static Number modulo(Number a, Number b) {
        Category category = category(a, b);
        if (category == Category.DOUBLE) {
            double d = b.doubleValue();
            return ((a.doubleValue() % d) + d) % d;
        }
        if (isZero(b)) {
            throw new ArithmeticException("Divide by zero");
        }
        if (category == Category.LONG) {
            return Math.floorMod(a.longValue(), b.longValue());
        }
        BigInteger m = toBigInteger(a).remainder(toBigInteger(b));
        return m.signum() != 0 && m.signum() != toBigInteger(b).signum() ? m.add(toBigInteger(b)) : m;
    }

    public static int compare(Number a, Number b) {
        switch (category(a, b)) {
            case LONG:
                return Long.compare(a.longValue(), b.longValue());
            case BIGINT:
                return toBigInteger(a).compareTo(toBigInteger(b));
            case DECIMAL:
                return toBigDecimal(a).compareTo(toBigDecimal(b));
            default:
                return Double.compare(a.doubleValue(), b.doubleValue());
        }
    }

    /**
     * Value equality within a kind: integers equal integers, but {@code 1} does not equal {@code 1.0}.
     */
    public static boolean equiv(Number a, Number b) {
        if (isIntegral(a) != isIntegral(b) || (a instanceof BigDecimal) != (b instanceof BigDecimal)) {
            return false;
        }
        return compare(a, b) == 0;
    }

    public static boolean isZero(Number n) {
        switch (category(n, n)) {
            case LONG:
                return n.longValue() == 0;
            case BIGINT:
                return toBigInteger(n).signum() == 0;
            case DECIMAL:
                return toBigDecimal(n).signum() == 0;
            default:
                return n.doubleValue() == 0.0;
        }
    }

    public static int signum(Number n) {
        switch (category(n, n)) {
            case LONG:
                return Long.signum(n.longValue());
            case BIGINT:
                return toBigInteger(n).signum();
            case DECIMAL:
                return toBigDecimal(n).signum();
            default:
                return (int) Math.signum(n.doubleValue());
        }
    }

    public static boolean isIntegral(Number n) {
        return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte
               || n instanceof BigInteger;
    }

    /**
     * An index for positional access. Integers beyond the {@code long} range saturate, so they stay out of range.
     */
    static long toIndex(Number n) {
        if (n instanceof BigInteger integer && integer.bitLength() > 63) {
            return integer.signum() > 0 ? Long.MAX_VALUE : Long.MIN_VALUE;
        }
        return n.longValue();
    }

    static Number toNumber(Object value, String operation) {
        if (value instanceof Number number) {
            return number;
        }
        throw new EvaluatorException(operation + " expects a number but got " + Values.typeName(value));
    }

    private static Category category(Number a, Number b) {
        if (isFloating(a) || isFloating(b)) {
            return Category.DOUBLE;
        }
        if (a instanceof BigDecimal || b instanceof BigDecimal) {
            return Category.DECIMAL;
        }
        if (a instanceof BigInteger || b instanceof BigInteger) {
            return Category.BIGINT;
        }
        return Category.LONG;
    }

    private static boolean isFloating(Number n) {
        return n instanceof Double || n instanceof Float;
    }

    // the one long quotient that does not fit in a long
    private static void checkDivision(long x, long y) {
        if (x == Long.MIN_VALUE && y == -1) {
            throw new ArithmeticException("long overflow");
        }
    }

    private static BigInteger toBigInteger(Number n) {
        return n instanceof BigInteger integer ? integer : BigInteger.valueOf(n.longValue());
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal decimal) {
            return decimal;
        }
        if (n instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        return BigDecimal.valueOf(n.longValue());
    }
}
