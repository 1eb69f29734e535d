package org.constraintstore.expressions;

import lombok.Getter;

import java.util.List;
import java.util.Set;

/**
 * 定宽位向量表达式。
 */
@Getter
public abstract class BitVecExpression extends Expression {

    private final int size;

    protected BitVecExpression(int size, Set<String> taint, List<Expression> operands) {
        super(taint, operands);
        if (size <= 0) {
            throw new IllegalArgumentException("位向量宽度必须为正数：" + size);
        }
        this.size = size;
    }

    @Override
    public Sort getSort() {
        return Sort.BITVEC;
    }

    static void requireSameSize(BitVecExpression a, BitVecExpression b) {
        if (a.getSize() != b.getSize()) {
            throw new IllegalArgumentException("位向量宽度不一致：" + a.getSize() + " 和 " + b.getSize());
        }
    }

    private BitVecConstant constant(long value) {
        return BitVecConstant.of(value, size);
    }

    private BitVecExpression binary(BitVecOperator operator, BitVecExpression other) {
        requireSameSize(this, other);
        return new BitVecOperation(operator, size, List.of(this, other));
    }

    private BoolExpression compare(BoolOperator operator, BitVecExpression other) {
        return new BoolOperation(operator, List.of(this, other));
    }

    // --- 算术与位运算 ---

    public BitVecExpression add(BitVecExpression other) {
        return binary(BitVecOperator.ADD, other);
    }

    public BitVecExpression add(long value) {
        return add(constant(value));
    }

    public BitVecExpression sub(BitVecExpression other) {
        return binary(BitVecOperator.SUB, other);
    }

    public BitVecExpression sub(long value) {
        return sub(constant(value));
    }

    public BitVecExpression mul(BitVecExpression other) {
        return binary(BitVecOperator.MUL, other);
    }

    public BitVecExpression mul(long value) {
        return mul(constant(value));
    }

    public BitVecExpression udiv(BitVecExpression other) {
        return binary(BitVecOperator.UDIV, other);
    }

    public BitVecExpression urem(BitVecExpression other) {
        return binary(BitVecOperator.UREM, other);
    }

    public BitVecExpression bitAnd(BitVecExpression other) {
        return binary(BitVecOperator.AND, other);
    }

    public BitVecExpression bitOr(BitVecExpression other) {
        return binary(BitVecOperator.OR, other);
    }

    public BitVecExpression bitXor(BitVecExpression other) {
        return binary(BitVecOperator.XOR, other);
    }

    public BitVecExpression bitNot() {
        return new BitVecOperation(BitVecOperator.NOT, size, List.of(this));
    }

    public BitVecExpression neg() {
        return new BitVecOperation(BitVecOperator.NEG, size, List.of(this));
    }

    public BitVecExpression shl(BitVecExpression other) {
        return binary(BitVecOperator.SHL, other);
    }

    public BitVecExpression lshr(BitVecExpression other) {
        return binary(BitVecOperator.LSHR, other);
    }

    // --- 比较 ---

    public BoolExpression eq(BitVecExpression other) {
        requireSameSize(this, other);
        return new BoolOperation(BoolOperator.EQ, List.of(this, other));
    }

    public BoolExpression eq(long value) {
        return eq(constant(value));
    }

    public BoolExpression ne(BitVecExpression other) {
        return eq(other).not();
    }

    public BoolExpression ne(long value) {
        return eq(value).not();
    }

    public BoolExpression ult(BitVecExpression other) {
        return compare(BoolOperator.ULT, other);
    }

    public BoolExpression ult(long value) {
        return ult(constant(value));
    }

    public BoolExpression ule(BitVecExpression other) {
        return compare(BoolOperator.ULE, other);
    }

    public BoolExpression ule(long value) {
        return ule(constant(value));
    }

    public BoolExpression ugt(BitVecExpression other) {
        return compare(BoolOperator.UGT, other);
    }

    public BoolExpression ugt(long value) {
        return ugt(constant(value));
    }

    public BoolExpression uge(BitVecExpression other) {
        return compare(BoolOperator.UGE, other);
    }

    public BoolExpression uge(long value) {
        return uge(constant(value));
    }

    public BoolExpression slt(BitVecExpression other) {
        return compare(BoolOperator.SLT, other);
    }

    public BoolExpression sle(BitVecExpression other) {
        return compare(BoolOperator.SLE, other);
    }

    public BoolExpression sgt(BitVecExpression other) {
        return compare(BoolOperator.SGT, other);
    }

    public BoolExpression sge(BitVecExpression other) {
        return compare(BoolOperator.SGE, other);
    }
}
