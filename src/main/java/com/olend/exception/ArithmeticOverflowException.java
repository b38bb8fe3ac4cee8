package com.olend.exception;

public class ArithmeticOverflowException extends BaseException {

    public ArithmeticOverflowException(String message) {
        super(ErrorCode.ARITHMETIC_OVERFLOW, message);
    }
}
