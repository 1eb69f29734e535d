package org.constraintstore.expressions;

import lombok.Getter;

import java.util.List;
import java.util.Set;

/**
 * 布尔常量。
 */
@Getter
public final class BoolConstant extends BoolExpression {

    public static final BoolConstant TRUE = new BoolConstant(true, Set.of());
    public static final BoolConstant FALSE = new BoolConstant(false, Set.of());

    private final boolean value;

    public BoolConstant(boolean value, Set<String> taint) {
        super(taint, List.of());
        this.value = value;
    }

    /**
     * 无污点的布尔常量，返回共享实例。
     */
    public static BoolConstant of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static boolean isTrue(Expression expression) {
        return expression instanceof BoolConstant && ((BoolConstant) expression).value;
    }

    public static boolean isFalse(Expression expression) {
        return expression instanceof BoolConstant && !((BoolConstant) expression).value;
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
        return value ? "true" : "false";
    }
}
