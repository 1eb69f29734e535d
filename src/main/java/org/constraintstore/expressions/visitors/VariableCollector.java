package org.constraintstore.expressions.visitors;

import org.constraintstore.core.Variable;
import org.constraintstore.expressions.Expression;

import java.util.*;

/**
 * 收集表达式树中出现的自由变量。
 * 以对象同一性去重；迭代遍历，共享子树只访问一次，深表达式不会栈溢出。
 */
public final class VariableCollector {

    private VariableCollector() {
    }

    /**
     * @param expression 待遍历的表达式。
     * @return 按首次出现顺序排列的变量集合（可修改的新集合）。
     */
    public static Set<Variable> collect(Expression expression) {
        Set<Variable> result = new LinkedHashSet<>();
        collectInto(expression, result);
        return result;
    }

    public static Set<Variable> collect(Collection<? extends Expression> expressions) {
        Set<Variable> result = new LinkedHashSet<>();
        for (Expression expression : expressions) {
            collectInto(expression, result);
        }
        return result;
    }

    private static void collectInto(Expression root, Set<Variable> result) {
        Set<Expression> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Expression> stack = new ArrayDeque<>();
        stack.push(Objects.requireNonNull(root, "VariableCollector: expression 不能为 null"));
        while (!stack.isEmpty()) {
            Expression current = stack.pop();
            if (!visited.add(current)) {
                continue;
            }
            if (current instanceof Variable) {
                result.add((Variable) current);
                continue;
            }
            List<Expression> operands = current.getOperands();
            // 逆序压栈，保证按从左到右的顺序访问
            for (int i = operands.size() - 1; i >= 0; i--) {
                stack.push(operands.get(i));
            }
        }
    }
}
