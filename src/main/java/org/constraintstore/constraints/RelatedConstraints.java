package org.constraintstore.constraints;

import lombok.Getter;
import org.constraintstore.core.Variable;
import org.constraintstore.expressions.BoolConstant;
import org.constraintstore.expressions.BoolExpression;
import org.constraintstore.expressions.Expression;
import org.constraintstore.expressions.visitors.VariableCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 与目标表达式相关的约束子集及其变量。
 * <p>
 * 从目标表达式的变量出发做不动点扩展：只要某条约束与当前相关变量有交集，
 * 就把它并入相关约束，并把它的变量并入相关变量，直到不再变化。
 * 没有目标时，所有非平凡约束及其全部变量都相关。
 * 只要约束中出现字面量 false，结果恒为 {false}。
 * 约束和变量都按对象同一性比较，按首次出现顺序保存。
 */
@Getter
public final class RelatedConstraints {

    private static final Logger logger = LoggerFactory.getLogger(RelatedConstraints.class);

    private final Set<Variable> variables;

    private final Set<BoolExpression> constraints;

    private RelatedConstraints(Set<Variable> variables, Set<BoolExpression> constraints) {
        this.variables = Collections.unmodifiableSet(variables);
        this.constraints = Collections.unmodifiableSet(constraints);
    }

    /**
     * @param constraints 完整的约束序列。
     * @param target      目标表达式，可以为 null。
     * @return 相关变量与相关约束。
     */
    public static RelatedConstraints of(List<BoolExpression> constraints, Expression target) {
        Objects.requireNonNull(constraints, "RelatedConstraints: constraints 不能为 null");
        Set<Variable> relatedVariables = target == null ? new LinkedHashSet<>() : VariableCollector.collect(target);

        for (BoolExpression constraint : constraints) {
            if (BoolConstant.isFalse(constraint)) {
                logger.debug("约束中存在 false，相关约束直接化为 {false}");
                return new RelatedConstraints(relatedVariables, new LinkedHashSet<>(List.of(constraint)));
            }
        }

        if (target == null) {
            Set<BoolExpression> all = new LinkedHashSet<>();
            for (BoolExpression constraint : constraints) {
                if (!BoolConstant.isTrue(constraint)) {
                    all.add(constraint);
                }
            }
            return new RelatedConstraints(VariableCollector.collect(all), all);
        }

        Map<BoolExpression, Set<Variable>> remaining = new LinkedHashMap<>();
        for (BoolExpression constraint : constraints) {
            if (!BoolConstant.isTrue(constraint)) {
                remaining.computeIfAbsent(constraint, VariableCollector::collect);
            }
        }
        int total = remaining.size();
        Set<BoolExpression> relatedConstraints = new LinkedHashSet<>();

        boolean added = true;
        while (added) {
            added = false;
            Iterator<Map.Entry<BoolExpression, Set<Variable>>> it = remaining.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<BoolExpression, Set<Variable>> entry = it.next();
                if (!Collections.disjoint(relatedVariables, entry.getValue())) {
                    relatedConstraints.add(entry.getKey());
                    relatedVariables.addAll(entry.getValue());
                    it.remove();
                    added = true;
                }
            }
        }
        logger.debug("约简掉 {} 条无关约束，保留 {} 条", total - relatedConstraints.size(), relatedConstraints.size());
        return new RelatedConstraints(relatedVariables, relatedConstraints);
    }

    public boolean isEmpty() {
        return constraints.isEmpty();
    }
}
