package com.apifarm.common.exception;

/**
 * API Key 已存在于池中（不区分归属用户）。
 */
public class DuplicateKeyException extends ApiFarmException {

    public DuplicateKeyException(String message) {
        super("DUPLICATE_KEY", message);
    }
}
