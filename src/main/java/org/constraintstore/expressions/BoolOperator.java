package org.constraintstore.expressions;

/**
 * 布尔运算符及其 SMT-LIB 符号。
 */
public enum BoolOperator {

    NOT("not"),
    AND("and"),
    OR("or"),
    XOR("xor"),
    IMPLIES("=>"),
    EQ("="),        // 任意同类型操作数的相等
    ITE("ite"),     // (ite cond then else)，三个操作数均为布尔
    ULT("bvult"),
    ULE("bvule"),
    UGT("bvugt"),
    UGE("bvuge"),
    SLT("bvslt"),
    SLE("bvsle"),
    SGT("bvsgt"),
    SGE("bvsge");

    private final String symbol;

    BoolOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
