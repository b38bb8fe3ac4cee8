package com.olend.exception;

public class ArithmeticUnderflowException extends BaseException {

    public ArithmeticUnderflowException(String message) {
        super(ErrorCode.ARITHMETIC_UNDERFLOW, message);
    }
}
