package com.olend.math;

import com.olend.exception.ArithmeticOverflowException;
import com.olend.exception.ArithmeticUnderflowException;
import com.olend.exception.DivisionByZeroException;
import java.math.BigInteger;

/**
 * Overflow- and underflow-checked integer arithmetic for amounts, prices and rates.
 *
 * <p>All operands are non-negative {@code long} values (token amounts, raw prices, basis points).
 * Every failure throws; nothing is clamped or saturated, so the enclosing operation aborts as a whole.
 *
 * <p>{@link #mulDiv(long, long, long)} widens to a 128-bit intermediate before dividing, so
 * {@code a * b} may exceed {@code Long.MAX_VALUE} as long as the quotient fits.
 */
public final class SafeMath {

    /** 10 000 bps = 100%. */
    public static final long BPS_DENOMINATOR = 10_000L;

    /** Largest power of ten representable as a long. */
    public static final int MAX_POW10_EXPONENT = 18;

    /** Magnitude limit of the widened intermediate: a signed 128-bit integer. */
    private static final int WIDE_BITS = 127;

    private static final long[] POW10 = new long[MAX_POW10_EXPONENT + 1];

    static {
        long value = 1;
        for (int i = 0; i <= MAX_POW10_EXPONENT; i++) {
            POW10[i] = value;
            value *= 10;
        }
    }

    private SafeMath() {}

    public static long add(long a, long b) {
        requireNonNegative(a, "add");
        requireNonNegative(b, "add");
        long sum = a + b;
        if (sum < 0) {
            throw new ArithmeticOverflowException("Overflow in add: " + a + " + " + b);
        }
        return sum;
    }

    public static long sub(long a, long b) {
        requireNonNegative(a, "sub");
        requireNonNegative(b, "sub");
        if (a < b) {
            throw new ArithmeticUnderflowException("Underflow in sub: " + a + " - " + b);
        }
        return a - b;
    }

    public static long mul(long a, long b) {
        requireNonNegative(a, "mul");
        requireNonNegative(b, "mul");
        try {
            return Math.multiplyExact(a, b);
        } catch (ArithmeticException e) {
            throw new ArithmeticOverflowException("Overflow in mul: " + a + " * " + b);
        }
    }

    public static long div(long a, long b) {
        requireNonNegative(a, "div");
        requireNonNegative(b, "div");
        if (b == 0) {
            throw new DivisionByZeroException("Division by zero: " + a + " / 0");
        }
        return a / b;
    }

    /**
     * Computes {@code floor(a * b / c)} with a widened intermediate.
     *
     * @throws DivisionByZeroException if {@code c == 0}
     * @throws ArithmeticOverflowException if the product exceeds the 128-bit intermediate
     *     or the quotient does not fit in a long
     */
    public static long mulDiv(long a, long b, long c) {
        requireNonNegative(a, "mulDiv");
        requireNonNegative(b, "mulDiv");
        requireNonNegative(c, "mulDiv");
        if (c == 0) {
            throw new DivisionByZeroException("Division by zero in mulDiv: " + a + " * " + b + " / 0");
        }
        return mulDiv(BigInteger.valueOf(a), BigInteger.valueOf(b), BigInteger.valueOf(c));
    }

    /**
     * Wide-operand form of {@link #mulDiv(long, long, long)}, used where an intermediate sum
     * has already been accumulated beyond long range.
     */
    public static long mulDiv(BigInteger a, BigInteger b, BigInteger c) {
        if (a.signum() < 0 || b.signum() < 0 || c.signum() < 0) {
            throw new ArithmeticUnderflowException("Negative operand in mulDiv");
        }
        if (c.signum() == 0) {
            throw new DivisionByZeroException("Division by zero in mulDiv");
        }
        checkWide(a, "mulDiv operand");
        checkWide(b, "mulDiv operand");
        BigInteger product = a.multiply(b);
        checkWide(product, "mulDiv product");
        BigInteger quotient = product.divide(c);
        if (quotient.bitLength() > 63) {
            throw new ArithmeticOverflowException("Overflow in mulDiv: quotient " + quotient + " exceeds long range");
        }
        return quotient.longValueExact();
    }

    /**
     * Applies a basis-point rate: {@code floor(amount * rateBps / 10000)}.
     */
    public static long percentage(long amount, long rateBps) {
        return mulDiv(amount, rateBps, BPS_DENOMINATOR);
    }

    /**
     * Applies a rate against an explicit denominator: {@code floor(amount * rate / denominator)}.
     */
    public static long percentage(long amount, long rate, long denominator) {
        return mulDiv(amount, rate, denominator);
    }

    /**
     * Compares the ratio {@code part / whole} against {@code rateBps / 10000} without rounding:
     * the sign of {@code part * 10000 - rateBps * whole}.
     *
     * @throws DivisionByZeroException if {@code whole == 0}
     */
    public static int compareRatioBps(long part, long whole, long rateBps) {
        requireNonNegative(part, "compareRatioBps");
        requireNonNegative(whole, "compareRatioBps");
        requireNonNegative(rateBps, "compareRatioBps");
        if (whole == 0) {
            throw new DivisionByZeroException("Ratio against zero: " + part + " / 0");
        }
        BigInteger scaledPart = BigInteger.valueOf(part).multiply(BigInteger.valueOf(BPS_DENOMINATOR));
        BigInteger scaledLimit = BigInteger.valueOf(rateBps).multiply(BigInteger.valueOf(whole));
        return scaledPart.compareTo(scaledLimit);
    }

    /** True when {@code part / whole} is strictly above {@code rateBps / 10000}. */
    public static boolean exceedsBps(long part, long whole, long rateBps) {
        return compareRatioBps(part, whole, rateBps) > 0;
    }

    /** True when {@code part / whole} is at or above {@code rateBps / 10000}. */
    public static boolean reachesBps(long part, long whole, long rateBps) {
        return compareRatioBps(part, whole, rateBps) >= 0;
    }

    public static long pow10(int exponent) {
        if (exponent < 0) {
            throw new ArithmeticUnderflowException("Negative power of ten: " + exponent);
        }
        if (exponent > MAX_POW10_EXPONENT) {
            throw new ArithmeticOverflowException("10^" + exponent + " exceeds long range");
        }
        return POW10[exponent];
    }

    public static long absDiff(long a, long b) {
        return a >= b ? sub(a, b) : sub(b, a);
    }

    public static long min(long a, long b) {
        return Math.min(a, b);
    }

    public static long max(long a, long b) {
        return Math.max(a, b);
    }

    /**
     * Clips {@code value} into {@code [lower, upper]}. This is a policy bound, not overflow handling.
     */
    public static long clamp(long value, long lower, long upper) {
        return Math.max(lower, Math.min(upper, value));
    }

    private static void checkWide(BigInteger value, String what) {
        if (value.bitLength() > WIDE_BITS) {
            throw new ArithmeticOverflowException("Overflow: " + what + " exceeds 128-bit intermediate");
        }
    }

    private static void requireNonNegative(long value, String op) {
        if (value < 0) {
            throw new ArithmeticUnderflowException("Negative operand in " + op + ": " + value);
        }
    }
}
