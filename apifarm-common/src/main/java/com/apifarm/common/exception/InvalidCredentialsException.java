package com.apifarm.common.exception;

/**
 * 用户名不存在或密码错误。两种情况对外不做区分。
 */
public class InvalidCredentialsException extends ApiFarmException {

    public InvalidCredentialsException(String message) {
        super("INVALID_CREDENTIALS", message);
    }
}
