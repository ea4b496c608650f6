package com.apifarm.common.exception;

/**
 * 用户名已被注册。
 */
public class DuplicateUserException extends ApiFarmException {

    public DuplicateUserException(String message) {
        super("DUPLICATE_USER", message);
    }
}
