package org.constraintstore.expressions;

import lombok.Getter;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 由 {@link BitVecOperator} 组合而成的位向量表达式。
 */
@Getter
public final class BitVecOperation extends BitVecExpression {

    private final BitVecOperator operator;

    public BitVecOperation(BitVecOperator operator, int size, List<Expression> operands) {
        this(operator, size, operands, Set.of());
    }

    public BitVecOperation(BitVecOperator operator, int size, List<Expression> operands, Set<String> taint) {
        super(size, taint, operands);
        this.operator = Objects.requireNonNull(operator, "BitVecOperation-构造函数: operator 不能为 null");
        check();
    }

    private void check() {
        List<Expression> operands = getOperands();
        int first = 0;
        if (operator == BitVecOperator.ITE) {
            if (operands.size() != 3 || operands.get(0).getSort() != Sort.BOOL) {
                throw new IllegalArgumentException("ITE 需要 (Bool, BitVec, BitVec) 三个操作数");
            }
            first = 1;
        } else if (operands.size() != (operator.isUnary() ? 1 : 2)) {
            throw new IllegalArgumentException(operator + " 的操作数个数错误：" + operands.size());
        }
        for (Expression operand : operands.subList(first, operands.size())) {
            if (!(operand instanceof BitVecExpression) || ((BitVecExpression) operand).getSize() != getSize()) {
                throw new IllegalArgumentException(operator + " 的操作数必须是 " + getSize() + " 位的位向量：" + operand);
            }
        }
    }

    @Override
    public Expression withOperands(List<Expression> newOperands) {
        if (sameOperands(newOperands)) {
            return this;
        }
        return new BitVecOperation(operator, getSize(), newOperands, getTaint());
    }

    @Override
    public String toString() {
        return render(operator.getSymbol(), getOperands());
    }
}
