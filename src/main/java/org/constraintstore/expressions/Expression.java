package org.constraintstore.expressions;

import lombok.Getter;

import java.util.*;

/**
 * 符号表达式树的节点基类。
 * 表达式不可变；相等性就是对象同一性，不做结构比较。
 * 同名的两个变量只要不是同一个对象，就是两个不同的未知量。
 */
@Getter
public abstract class Expression {

    /** 污点标签集合，核心只负责传播，不解释其含义 */
    private final Set<String> taint;

    private final List<Expression> operands;

    protected Expression(Set<String> taint, List<Expression> operands) {
        Objects.requireNonNull(taint, "Expression-构造函数: taint 不能为 null");
        Objects.requireNonNull(operands, "Expression-构造函数: operands 不能为 null");
        this.operands = List.copyOf(operands);
        Set<String> merged = new HashSet<>(taint);
        for (Expression operand : this.operands) {
            merged.addAll(operand.getTaint());
        }
        this.taint = Collections.unmodifiableSet(merged);
    }

    public abstract Sort getSort();

    /**
     * 用新的操作数重建同类节点，其余属性保持不变。
     * 叶子节点没有操作数，直接返回自身。
     * @param newOperands 与 {@link #getOperands()} 一一对应的新操作数。
     * @return 新节点；若所有操作数都未改变则返回 this。
     */
    public abstract Expression withOperands(List<Expression> newOperands);

    public boolean isLeaf() {
        return operands.isEmpty();
    }

    /**
     * 是否为常量（布尔常量或位向量常量）。
     */
    public boolean isConstant() {
        return false;
    }

    protected boolean sameOperands(List<Expression> newOperands) {
        if (newOperands.size() != operands.size()) {
            throw new IllegalArgumentException("操作数个数不匹配：期望 " + operands.size() + "，实际 " + newOperands.size());
        }
        for (int i = 0; i < operands.size(); i++) {
            if (operands.get(i) != newOperands.get(i)) {
                return false;
            }
        }
        return true;
    }

    protected static String render(String symbol, List<Expression> operands) {
        StringBuilder sb = new StringBuilder("(").append(symbol);
        for (Expression operand : operands) {
            sb.append(' ').append(operand);
        }
        return sb.append(')').toString();
    }
}
