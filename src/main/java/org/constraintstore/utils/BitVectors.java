package org.constraintstore.utils;

import java.math.BigInteger;

/**
 * 定宽位向量的算术辅助方法。
 * 所有值均以无符号形式保存在 [0, 2^size) 之内。
 */
public final class BitVectors {

    private BitVectors() {
    }

    /**
     * 检查位宽是否合法：1 或 8 的正整数倍。
     */
    public static boolean isValidSize(int size) {
        return size == 1 || (size > 0 && size % 8 == 0);
    }

    public static BigInteger modulus(int size) {
        return BigInteger.ONE.shiftLeft(size);
    }

    /**
     * 将任意整数截断到 size 位（按 2 的补码取模）。
     */
    public static BigInteger truncate(BigInteger value, int size) {
        return value.mod(modulus(size));
    }

    /**
     * 把无符号表示解释为有符号整数。
     */
    public static BigInteger toSigned(BigInteger value, int size) {
        if (value.testBit(size - 1)) {
            return value.subtract(modulus(size));
        }
        return value;
    }

    public static BigInteger add(BigInteger a, BigInteger b, int size) {
        return truncate(a.add(b), size);
    }

    public static BigInteger sub(BigInteger a, BigInteger b, int size) {
        return truncate(a.subtract(b), size);
    }

    public static BigInteger mul(BigInteger a, BigInteger b, int size) {
        return truncate(a.multiply(b), size);
    }

    /**
     * 无符号除法。除数为 0 时按 SMT-LIB 语义返回全 1。
     */
    public static BigInteger udiv(BigInteger a, BigInteger b, int size) {
        if (b.signum() == 0) {
            return modulus(size).subtract(BigInteger.ONE);
        }
        return a.divide(b);
    }

    /**
     * 无符号取余。除数为 0 时按 SMT-LIB 语义返回被除数。
     */
    public static BigInteger urem(BigInteger a, BigInteger b, int size) {
        if (b.signum() == 0) {
            return a;
        }
        return a.mod(b);
    }

    public static BigInteger not(BigInteger a, int size) {
        return modulus(size).subtract(BigInteger.ONE).xor(a);
    }

    public static BigInteger neg(BigInteger a, int size) {
        return truncate(a.negate(), size);
    }

    public static BigInteger shl(BigInteger a, BigInteger shift, int size) {
        if (shift.compareTo(BigInteger.valueOf(size)) >= 0) {
            return BigInteger.ZERO;
        }
        return truncate(a.shiftLeft(shift.intValue()), size);
    }

    public static BigInteger lshr(BigInteger a, BigInteger shift, int size) {
        if (shift.compareTo(BigInteger.valueOf(size)) >= 0) {
            return BigInteger.ZERO;
        }
        return a.shiftRight(shift.intValue());
    }
}
