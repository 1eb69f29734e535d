package org.constraintstore.core;

import lombok.Getter;
import org.constraintstore.expressions.BoolExpression;
import org.constraintstore.expressions.Expression;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 布尔符号变量。
 */
@Getter
public final class BoolVariable extends BoolExpression implements Variable {

    private final String name;

    public BoolVariable(String name, Set<String> taint) {
        super(taint, List.of());
        this.name = Objects.requireNonNull(name, "BoolVariable-构造函数: name 不能为 null");
    }

    @Override
    public String getDeclaration() {
        return "(declare-fun " + name + " () Bool)";
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
