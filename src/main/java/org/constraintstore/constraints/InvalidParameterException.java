package org.constraintstore.constraints;

/**
 * 参数取值非法，例如位向量宽度既不是 1 也不是 8 的倍数。
 */
public class InvalidParameterException extends IllegalArgumentException {

    public InvalidParameterException(String message) {
        super(message);
    }
}
