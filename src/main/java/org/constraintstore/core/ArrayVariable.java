package org.constraintstore.core;

import lombok.Getter;
import org.constraintstore.expressions.ArrayExpression;
import org.constraintstore.expressions.Expression;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 数组符号变量：下标 indexBits 位、值 valueBits 位，indexMax 可选。
 */
@Getter
public final class ArrayVariable extends ArrayExpression implements Variable {

    private final String name;

    public ArrayVariable(int indexBits, Long indexMax, int valueBits, String name, Set<String> taint) {
        super(indexBits, indexMax, valueBits, taint, List.of());
        this.name = Objects.requireNonNull(name, "ArrayVariable-构造函数: name 不能为 null");
    }

    @Override
    public String getDeclaration() {
        return "(declare-fun " + name + " () (Array (_ BitVec " + getIndexBits() + ") (_ BitVec " + getValueBits() + ")))";
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
