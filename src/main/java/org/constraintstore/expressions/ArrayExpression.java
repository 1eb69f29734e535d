package org.constraintstore.expressions;

import lombok.Getter;

import java.util.List;
import java.util.Set;

/**
 * 数组表达式：从 indexBits 位的下标映射到 valueBits 位的值。
 * indexMax 是可选的下标上界，为 null 表示不设上界。
 */
@Getter
public abstract class ArrayExpression extends Expression {

    private final int indexBits;

    private final int valueBits;

    private final Long indexMax;

    protected ArrayExpression(int indexBits, Long indexMax, int valueBits, Set<String> taint, List<Expression> operands) {
        super(taint, operands);
        if (indexBits <= 0 || valueBits <= 0) {
            throw new IllegalArgumentException("数组下标和值的位宽必须为正数：" + indexBits + ", " + valueBits);
        }
        this.indexBits = indexBits;
        this.valueBits = valueBits;
        this.indexMax = indexMax;
    }

    @Override
    public Sort getSort() {
        return Sort.ARRAY;
    }

    public BitVecExpression select(BitVecExpression index) {
        return new ArraySelect(this, index);
    }

    public BitVecExpression select(long index) {
        return select(BitVecConstant.of(index, indexBits));
    }

    public ArrayExpression store(BitVecExpression index, BitVecExpression value) {
        return new ArrayStore(this, index, value);
    }

    public ArrayExpression store(long index, long value) {
        return store(BitVecConstant.of(index, indexBits), BitVecConstant.of(value, valueBits));
    }
}
