package org.constraintstore.constraints;

import org.constraintstore.core.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 通过 SLF4J 输出诊断信息。
 */
public class LoggingConstraintDiagnostics implements ConstraintDiagnostics {

    private static final Logger logger = LoggerFactory.getLogger(LoggingConstraintDiagnostics.class);

    @Override
    public void duplicateDeclaration(Variable variable) {
        logger.warn("变量 '{}' 被重复声明，上游某处复制了同名变量", variable.getName());
    }

    @Override
    public void unsatisfiableConstraint(ConstraintSet constraintSet) {
        logger.info("添加了一个恒假约束，约束集已不可满足");
    }
}
