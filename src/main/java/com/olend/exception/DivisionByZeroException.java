package com.olend.exception;

public class DivisionByZeroException extends BaseException {

    public DivisionByZeroException(String message) {
        super(ErrorCode.DIVISION_BY_ZERO, message);
    }
}
