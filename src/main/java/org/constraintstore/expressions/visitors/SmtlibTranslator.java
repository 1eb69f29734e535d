package org.constraintstore.expressions.visitors;

import org.apache.commons.lang3.tuple.Triple;
import org.constraintstore.config.ConstraintStoreConfig;
import org.constraintstore.core.Variable;
import org.constraintstore.expressions.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 把表达式翻译为 SMT-LIB 文本的有状态翻译器。
 * 每次 {@link #visit} 把一条翻译结果压入队列，{@link #pop} 依次取出，取尽时返回 null。
 * 开启 useBindings 后，被多次引用的内部运算节点会被抽成辅助绑定
 * (name, 原表达式, 文本)，由调用方负责声明并断言。
 */
public class SmtlibTranslator {

    private static final Logger logger = LoggerFactory.getLogger(SmtlibTranslator.class);

    private final boolean useBindings;

    private final Deque<String> results = new ArrayDeque<>();

    /** 已经抽成绑定的节点，跨多次 visit 复用 */
    private final Map<Expression, String> bindingNames = new IdentityHashMap<>();

    private final List<Triple<String, Expression, String>> bindings = new ArrayList<>();

    public SmtlibTranslator(boolean useBindings) {
        this.useBindings = useBindings;
    }

    /**
     * 不使用辅助绑定，直接得到一个表达式的完整文本。
     */
    public static String translate(Expression expression) {
        SmtlibTranslator translator = new SmtlibTranslator(false);
        translator.visit(expression);
        return translator.pop();
    }

    public void visit(Expression expression) {
        Objects.requireNonNull(expression, "SmtlibTranslator: expression 不能为 null");
        Map<Expression, Integer> references = useBindings ? countReferences(expression) : Map.of();
        Map<Expression, String> memo = new IdentityHashMap<>();
        results.addLast(translate(expression, true, references, memo));
    }

    /**
     * 取出下一条翻译结果。
     * @return 翻译文本；没有更多结果时返回 null。
     */
    public String pop() {
        return results.pollFirst();
    }

    /**
     * 按创建顺序返回辅助绑定。后创建的绑定可能引用先创建的绑定名。
     */
    public List<Triple<String, Expression, String>> getBindings() {
        return Collections.unmodifiableList(bindings);
    }

    private String translate(Expression expression, boolean root, Map<Expression, Integer> references, Map<Expression, String> memo) {
        if (expression instanceof Variable) {
            return ((Variable) expression).getName();
        }
        if (expression.isLeaf()) {
            return leaf(expression);
        }
        String bound = bindingNames.get(expression);
        if (bound != null) {
            return bound;
        }
        String cached = memo.get(expression);
        if (cached != null) {
            return cached;
        }
        StringBuilder sb = new StringBuilder("(").append(symbol(expression));
        for (Expression operand : expression.getOperands()) {
            sb.append(' ').append(translate(operand, false, references, memo));
        }
        String text = sb.append(')').toString();
        if (useBindings && !root && references.getOrDefault(expression, 0) > 1) {
            String name = String.format(ConstraintStoreConfig.auxBindingFormat, bindings.size() + 1);
            bindingNames.put(expression, name);
            bindings.add(Triple.of(name, expression, text));
            logger.debug("为共享子表达式创建辅助绑定 {}", name);
            return name;
        }
        memo.put(expression, text);
        return text;
    }

    private static String leaf(Expression expression) {
        if (expression instanceof BoolConstant) {
            return ((BoolConstant) expression).isValue() ? "true" : "false";
        }
        if (expression instanceof BitVecConstant) {
            BitVecConstant constant = (BitVecConstant) expression;
            return "(_ bv" + constant.getValue() + " " + constant.getSize() + ")";
        }
        throw new IllegalArgumentException("无法翻译的叶子节点：" + expression.getClass().getSimpleName());
    }

    private static String symbol(Expression expression) {
        if (expression instanceof BoolOperation) {
            return ((BoolOperation) expression).getOperator().getSymbol();
        }
        if (expression instanceof BitVecOperation) {
            return ((BitVecOperation) expression).getOperator().getSymbol();
        }
        if (expression instanceof ArraySelect) {
            return "select";
        }
        if (expression instanceof ArrayStore) {
            return "store";
        }
        throw new IllegalArgumentException("无法翻译的运算节点：" + expression.getClass().getSimpleName());
    }

    /**
     * 统计每个内部节点在 DAG 中被父节点引用的次数。
     */
    private static Map<Expression, Integer> countReferences(Expression root) {
        Map<Expression, Integer> references = new IdentityHashMap<>();
        Deque<Expression> stack = new ArrayDeque<>();
        stack.push(root);
        references.put(root, 1);
        while (!stack.isEmpty()) {
            Expression current = stack.pop();
            for (Expression operand : current.getOperands()) {
                if (operand.isLeaf()) {
                    continue;
                }
                Integer count = references.merge(operand, 1, Integer::sum);
                if (count == 1) {
                    stack.push(operand);
                }
            }
        }
        return references;
    }
}
