package org.constraintstore.expressions;

import java.util.List;
import java.util.Set;

/**
 * 布尔类型表达式。约束就是布尔表达式。
 */
public abstract class BoolExpression extends Expression {

    protected BoolExpression(Set<String> taint, List<Expression> operands) {
        super(taint, operands);
    }

    @Override
    public Sort getSort() {
        return Sort.BOOL;
    }

    public BoolExpression not() {
        return new BoolOperation(BoolOperator.NOT, List.of(this));
    }

    public BoolExpression and(BoolExpression other) {
        return new BoolOperation(BoolOperator.AND, List.of(this, other));
    }

    public BoolExpression or(BoolExpression other) {
        return new BoolOperation(BoolOperator.OR, List.of(this, other));
    }

    public BoolExpression xor(BoolExpression other) {
        return new BoolOperation(BoolOperator.XOR, List.of(this, other));
    }

    public BoolExpression implies(BoolExpression other) {
        return new BoolOperation(BoolOperator.IMPLIES, List.of(this, other));
    }

    public BoolExpression eq(BoolExpression other) {
        return new BoolOperation(BoolOperator.EQ, List.of(this, other));
    }

    public BoolExpression ite(BoolExpression whenTrue, BoolExpression whenFalse) {
        return new BoolOperation(BoolOperator.ITE, List.of(this, whenTrue, whenFalse));
    }

    public BitVecExpression ite(BitVecExpression whenTrue, BitVecExpression whenFalse) {
        return new BitVecOperation(BitVecOperator.ITE, whenTrue.getSize(), List.of(this, whenTrue, whenFalse));
    }
}
