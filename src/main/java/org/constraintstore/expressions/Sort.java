package org.constraintstore.expressions;

/**
 * 表达式的类型（SMT-LIB 中的 sort）。
 * 核心只认识这三种，所有按类型分派的地方都对它做穷尽 switch。
 */
public enum Sort {
    BOOL,
    BITVEC,
    ARRAY
}
