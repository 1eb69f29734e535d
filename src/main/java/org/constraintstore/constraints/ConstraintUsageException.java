package org.constraintstore.constraints;

/**
 * 调用方用错了约束集：向冻结的约束集添加约束、重复 fork、重复声明变量、
 * 迁移映射表与声明表不一致等。属于编程错误，不应重试。
 */
public class ConstraintUsageException extends IllegalStateException {

    public ConstraintUsageException(String message) {
        super(message);
    }
}
