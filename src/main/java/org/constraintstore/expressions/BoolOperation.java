package org.constraintstore.expressions;

import lombok.Getter;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 由 {@link BoolOperator} 组合而成的布尔表达式。
 */
@Getter
public final class BoolOperation extends BoolExpression {

    private final BoolOperator operator;

    public BoolOperation(BoolOperator operator, List<Expression> operands) {
        this(operator, operands, Set.of());
    }

    public BoolOperation(BoolOperator operator, List<Expression> operands, Set<String> taint) {
        super(taint, operands);
        this.operator = Objects.requireNonNull(operator, "BoolOperation-构造函数: operator 不能为 null");
        check(operator, getOperands());
    }

    private static void check(BoolOperator operator, List<Expression> operands) {
        switch (operator) {
            case NOT -> {
                requireArity(operator, operands, 1);
                requireSort(operator, operands.get(0), Sort.BOOL);
            }
            case AND, OR -> {
                if (operands.isEmpty()) {
                    throw new IllegalArgumentException(operator + " 至少需要一个操作数");
                }
                operands.forEach(o -> requireSort(operator, o, Sort.BOOL));
            }
            case XOR, IMPLIES -> {
                requireArity(operator, operands, 2);
                operands.forEach(o -> requireSort(operator, o, Sort.BOOL));
            }
            case ITE -> {
                requireArity(operator, operands, 3);
                operands.forEach(o -> requireSort(operator, o, Sort.BOOL));
            }
            case EQ -> {
                requireArity(operator, operands, 2);
                Expression left = operands.get(0);
                Expression right = operands.get(1);
                if (left.getSort() != right.getSort()) {
                    throw new IllegalArgumentException("EQ 两侧类型不一致：" + left.getSort() + " 和 " + right.getSort());
                }
                if (left instanceof BitVecExpression) {
                    BitVecExpression.requireSameSize((BitVecExpression) left, (BitVecExpression) right);
                }
            }
            default -> {
                requireArity(operator, operands, 2);
                requireSort(operator, operands.get(0), Sort.BITVEC);
                requireSort(operator, operands.get(1), Sort.BITVEC);
                BitVecExpression.requireSameSize((BitVecExpression) operands.get(0), (BitVecExpression) operands.get(1));
            }
        }
    }

    private static void requireArity(BoolOperator operator, List<Expression> operands, int arity) {
        if (operands.size() != arity) {
            throw new IllegalArgumentException(operator + " 需要 " + arity + " 个操作数，实际为 " + operands.size());
        }
    }

    private static void requireSort(BoolOperator operator, Expression operand, Sort sort) {
        if (operand.getSort() != sort) {
            throw new IllegalArgumentException(operator + " 的操作数必须是 " + sort + "，实际为 " + operand.getSort());
        }
    }

    /**
     * 是否为 EQ 运算。
     */
    public boolean isEquality() {
        return operator == BoolOperator.EQ;
    }

    @Override
    public Expression withOperands(List<Expression> newOperands) {
        if (sameOperands(newOperands)) {
            return this;
        }
        return new BoolOperation(operator, newOperands, getTaint());
    }

    @Override
    public String toString() {
        return render(operator.getSymbol(), getOperands());
    }
}
