package org.constraintstore.constraints;

import org.constraintstore.core.Variable;

/**
 * 非致命异常情况的接收端。默认实现写日志，测试中可以替换成记录型实现。
 */
public interface ConstraintDiagnostics {

    /**
     * 序列化时同一段声明文本出现了两次，说明上游存在重名变量。
     */
    void duplicateDeclaration(Variable variable);

    /**
     * 向约束集添加了恒假约束。
     */
    void unsatisfiableConstraint(ConstraintSet constraintSet);
}
