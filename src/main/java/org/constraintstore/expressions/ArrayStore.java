package org.constraintstore.expressions;

import java.util.List;
import java.util.Set;

/**
 * 数组写入 (store array index value)，结果为新的数组。
 */
public final class ArrayStore extends ArrayExpression {

    public ArrayStore(ArrayExpression array, BitVecExpression index, BitVecExpression value) {
        super(array.getIndexBits(), array.getIndexMax(), array.getValueBits(), Set.of(), List.of(array, index, value));
        if (index.getSize() != array.getIndexBits() || value.getSize() != array.getValueBits()) {
            throw new IllegalArgumentException("store 的下标/值宽度与数组不一致：" + index.getSize() + "/" + value.getSize());
        }
    }

    public ArrayExpression getArray() {
        return (ArrayExpression) getOperands().get(0);
    }

    public BitVecExpression getIndex() {
        return (BitVecExpression) getOperands().get(1);
    }

    public BitVecExpression getValue() {
        return (BitVecExpression) getOperands().get(2);
    }

    @Override
    public Expression withOperands(List<Expression> newOperands) {
        if (sameOperands(newOperands)) {
            return this;
        }
        return new ArrayStore((ArrayExpression) newOperands.get(0),
                (BitVecExpression) newOperands.get(1),
                (BitVecExpression) newOperands.get(2));
    }

    @Override
    public String toString() {
        return render("store", getOperands());
    }
}
