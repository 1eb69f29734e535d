package org.constraintstore.expressions.visitors;

import org.constraintstore.expressions.Expression;

import java.util.*;

/**
 * 按对象同一性把表达式树中的节点替换为给定的节点。
 * 没有被替换到的子树原样保留（引用相同）。
 */
public final class Replacer {

    private final Map<Expression, Expression> replacements;

    private final Map<Expression, Expression> cache = new IdentityHashMap<>();

    private Replacer(Map<? extends Expression, ? extends Expression> replacements) {
        this.replacements = new IdentityHashMap<>(replacements);
    }

    /**
     * 替换 expression 中所有出现在 replacements 键中的节点。
     * 调用方负责保证替换前后类型一致。
     * @param expression   原表达式。
     * @param replacements 旧节点到新节点的映射，按引用匹配。
     * @return 替换后的表达式；没有发生替换时返回原对象。
     */
    public static Expression replace(Expression expression, Map<? extends Expression, ? extends Expression> replacements) {
        Objects.requireNonNull(expression, "Replacer: expression 不能为 null");
        if (replacements.isEmpty()) {
            return expression;
        }
        return new Replacer(replacements).visit(expression);
    }

    private Expression visit(Expression expression) {
        Expression replacement = replacements.get(expression);
        if (replacement != null) {
            if (replacement.getSort() != expression.getSort()) {
                throw new IllegalArgumentException("替换前后类型不一致：" + expression.getSort() + " -> " + replacement.getSort());
            }
            return replacement;
        }
        if (expression.isLeaf()) {
            return expression;
        }
        Expression cached = cache.get(expression);
        if (cached != null) {
            return cached;
        }
        List<Expression> operands = expression.getOperands();
        List<Expression> newOperands = new ArrayList<>(operands.size());
        for (Expression operand : operands) {
            newOperands.add(visit(operand));
        }
        Expression result = expression.withOperands(newOperands);
        cache.put(expression, result);
        return result;
    }
}
