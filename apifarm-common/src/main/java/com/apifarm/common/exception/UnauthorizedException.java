package com.apifarm.common.exception;

/**
 * 会话令牌无效：不存在、已注销或已过期。
 */
public class UnauthorizedException extends ApiFarmException {

    public UnauthorizedException(String message) {
        super("UNAUTHORIZED", message);
    }
}
