package org.constraintstore.expressions;

import java.util.List;
import java.util.Set;

/**
 * 数组读取 (select array index)，结果为 valueBits 位的位向量。
 */
public final class ArraySelect extends BitVecExpression {

    public ArraySelect(ArrayExpression array, BitVecExpression index) {
        super(array.getValueBits(), Set.of(), List.of(array, index));
        if (index.getSize() != array.getIndexBits()) {
            throw new IllegalArgumentException("下标宽度 " + index.getSize() + " 与数组下标宽度 " + array.getIndexBits() + " 不一致");
        }
    }

    public ArrayExpression getArray() {
        return (ArrayExpression) getOperands().get(0);
    }

    public BitVecExpression getIndex() {
        return (BitVecExpression) getOperands().get(1);
    }

    @Override
    public Expression withOperands(List<Expression> newOperands) {
        if (sameOperands(newOperands)) {
            return this;
        }
        return new ArraySelect((ArrayExpression) newOperands.get(0), (BitVecExpression) newOperands.get(1));
    }

    @Override
    public String toString() {
        return render("select", getOperands());
    }
}
