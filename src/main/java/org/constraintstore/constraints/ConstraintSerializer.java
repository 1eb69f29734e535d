package org.constraintstore.constraints;

import org.apache.commons.lang3.tuple.Triple;
import org.constraintstore.core.Variable;
import org.constraintstore.expressions.*;
import org.constraintstore.expressions.visitors.Replacer;
import org.constraintstore.expressions.visitors.Simplifier;
import org.constraintstore.expressions.visitors.SmtlibTranslator;

import java.util.*;

/**
 * 把一组约束渲染为求解器可读的 SMT-LIB 文本。
 * 输出顺序：变量声明，辅助绑定的声明与断言，最后是各条约束的断言。
 */
public class ConstraintSerializer {

    private final ConstraintDiagnostics diagnostics;

    public ConstraintSerializer(ConstraintDiagnostics diagnostics) {
        this.diagnostics = Objects.requireNonNull(diagnostics, "ConstraintSerializer-构造函数: diagnostics 不能为 null");
    }

    /**
     * @param constraints      完整的约束序列。
     * @param target           只输出与之相关的约束；为 null 时输出全部。
     * @param replaceConstants 是否用 {@code 变量 == 常量} 形式的约束替换等式右侧的变量。
     * @return SMT-LIB 文本。
     */
    public String serialize(List<BoolExpression> constraints, Expression target, boolean replaceConstants) {
        RelatedConstraints related = RelatedConstraints.of(constraints, target);

        // 绑定表取自完整约束序列，而不是切片后的子集
        Map<Expression, Expression> constantBindings = new IdentityHashMap<>();
        if (replaceConstants) {
            for (BoolExpression constraint : constraints) {
                if (isConstantBinding(constraint)) {
                    List<Expression> operands = constraint.getOperands();
                    constantBindings.put(operands.get(0), operands.get(1));
                }
            }
        }

        StringBuilder result = new StringBuilder();
        Set<String> declared = new HashSet<>();
        for (Variable variable : related.getVariables()) {
            String declaration = variable.getDeclaration();
            if (!declared.add(declaration)) {
                diagnostics.duplicateDeclaration(variable);
                continue;
            }
            result.append(declaration).append('\n');
        }

        SmtlibTranslator translator = new SmtlibTranslator(true);
        for (BoolExpression constraint : related.getConstraints()) {
            if (replaceConstants) {
                constraint = substituteConstants(constraint, constantBindings);
            }
            translator.visit(constraint);
        }

        for (Triple<String, Expression, String> binding : translator.getBindings()) {
            result.append(declareBinding(binding.getLeft(), binding.getMiddle())).append('\n');
            result.append("(assert (= ").append(binding.getLeft()).append(' ').append(binding.getRight()).append("))\n");
        }

        String assertion = translator.pop();
        while (assertion != null) {
            if (!"true".equals(assertion)) {
                result.append("(assert ").append(assertion).append(")\n");
            }
            assertion = translator.pop();
        }
        return result.toString();
    }

    /**
     * 形如 {@code 变量 == 常量} 的顶层等式。
     */
    static boolean isConstantBinding(Expression constraint) {
        if (!(constraint instanceof BoolOperation) || !((BoolOperation) constraint).isEquality()) {
            return false;
        }
        List<Expression> operands = constraint.getOperands();
        return operands.get(0) instanceof Variable && operands.get(1).isConstant();
    }

    /**
     * 对 {@code 变量 == 表达式} 形式的顶层等式，用绑定表化简右侧，使间接等式也能落到字面量上。
     */
    private static BoolExpression substituteConstants(BoolExpression constraint, Map<Expression, Expression> bindings) {
        if (bindings.isEmpty() || !(constraint instanceof BoolOperation) || !((BoolOperation) constraint).isEquality()) {
            return constraint;
        }
        Expression variable = constraint.getOperands().get(0);
        if (!(variable instanceof Variable)) {
            return constraint;
        }
        Expression value = constraint.getOperands().get(1);
        Expression replaced = Simplifier.simplify(Replacer.replace(value, bindings));
        if (replaced == value) {
            return constraint;
        }
        return new BoolOperation(BoolOperator.EQ, List.of(variable, replaced), constraint.getTaint());
    }

    private static String declareBinding(String name, Expression expression) {
        return switch (expression.getSort()) {
            case BOOL -> "(declare-fun " + name + " () Bool)";
            case BITVEC -> "(declare-fun " + name + " () (_ BitVec " + ((BitVecExpression) expression).getSize() + "))";
            case ARRAY -> {
                ArrayExpression array = (ArrayExpression) expression;
                yield "(declare-fun " + name + " () (Array (_ BitVec " + array.getIndexBits() + ") (_ BitVec " + array.getValueBits() + ")))";
            }
        };
    }
}
