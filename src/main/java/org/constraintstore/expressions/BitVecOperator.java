package org.constraintstore.expressions;

/**
 * 位向量运算符及其 SMT-LIB 符号。
 */
public enum BitVecOperator {

    ADD("bvadd"),
    SUB("bvsub"),
    MUL("bvmul"),
    UDIV("bvudiv"),
    UREM("bvurem"),
    AND("bvand"),
    OR("bvor"),
    XOR("bvxor"),
    NOT("bvnot"),
    NEG("bvneg"),
    SHL("bvshl"),
    LSHR("bvlshr"),
    ITE("ite");     // (ite cond then else)，cond 为布尔

    private final String symbol;

    BitVecOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isUnary() {
        return this == NOT || this == NEG;
    }
}
