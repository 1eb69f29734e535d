package org.constraintstore.core;

import org.constraintstore.expressions.Sort;

import java.util.Set;

/**
 * 符号变量：有名字、有类型的叶子表达式。
 * 名字只在所属约束集的声明表内唯一；变量的身份是对象引用，而不是名字。
 */
public sealed interface Variable permits BoolVariable, BitVecVariable, ArrayVariable {

    String getName();

    Sort getSort();

    Set<String> getTaint();

    /**
     * 该变量的 SMT-LIB 声明语句，例如 {@code (declare-fun x () (_ BitVec 32))}。
     */
    String getDeclaration();
}
