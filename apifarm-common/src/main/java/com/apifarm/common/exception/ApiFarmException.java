package com.apifarm.common.exception;

/**
 * 系统基础异常，所有业务异常的父类。
 * <p>
 * {@code errorCode} 会原样出现在接口错误响应中，供调用方做程序化判断。
 */
public class ApiFarmException extends RuntimeException {

    private final String errorCode;

    public ApiFarmException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ApiFarmException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
