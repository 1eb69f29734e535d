package org.constraintstore.core;

import lombok.Getter;
import org.constraintstore.expressions.BitVecExpression;
import org.constraintstore.expressions.Expression;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 定宽位向量符号变量。
 */
@Getter
public final class BitVecVariable extends BitVecExpression implements Variable {

    private final String name;

    public BitVecVariable(int size, String name, Set<String> taint) {
        super(size, taint, List.of());
        this.name = Objects.requireNonNull(name, "BitVecVariable-构造函数: name 不能为 null");
    }

    @Override
    public String getDeclaration() {
        return "(declare-fun " + name + " () (_ BitVec " + getSize() + "))";
    }

    @Override
    public Expression withOperands(List<Expression> newOperands) {
        sameOperands(newOperands);
        return this;
    }

    @Override
    public String toString() {
        return name;
    }
}
