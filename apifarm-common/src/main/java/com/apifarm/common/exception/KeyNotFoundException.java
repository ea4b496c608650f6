package com.apifarm.common.exception;

/**
 * 当前用户名下不存在该 API Key。
 */
public class KeyNotFoundException extends ApiFarmException {

    public KeyNotFoundException(String message) {
        super("KEY_NOT_FOUND", message);
    }
}
