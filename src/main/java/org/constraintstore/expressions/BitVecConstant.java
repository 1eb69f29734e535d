package org.constraintstore.expressions;

import lombok.Getter;
import org.constraintstore.utils.BitVectors;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 位向量常量，值以无符号形式截断到位宽之内。
 */
@Getter
public final class BitVecConstant extends BitVecExpression {

    private final BigInteger value;

    public BitVecConstant(BigInteger value, int size, Set<String> taint) {
        super(size, taint, List.of());
        this.value = BitVectors.truncate(Objects.requireNonNull(value, "BitVecConstant-构造函数: value 不能为 null"), size);
    }

    public static BitVecConstant of(long value, int size) {
        return new BitVecConstant(BigInteger.valueOf(value), size, Set.of());
    }

    public static BitVecConstant of(BigInteger value, int size) {
        return new BitVecConstant(value, size, Set.of());
    }

    /**
     * 有符号解释下的值。
     */
    public BigInteger getSignedValue() {
        return BitVectors.toSigned(value, getSize());
    }

    public boolean isZero() {
        return value.signum() == 0;
    }

    /**
     * 与另一个常量是否表示同一个值（宽度与数值均相同）。
     */
    public boolean sameValue(BitVecConstant other) {
        return getSize() == other.getSize() && value.equals(other.value);
    }

    @Override
    public boolean isConstant() {
        return true;
    }

    @Override
    public Expression withOperands(List<Expression> newOperands) {
        sameOperands(newOperands);
        return this;
    }

    @Override
    public String toString() {
        return "(_ bv" + value + " " + getSize() + ")";
    }
}
