package com.apifarm.common.exception;

/**
 * Key 池耗尽异常，没有任何可用凭证时抛出。
 */
public class KeyPoolExhaustedException extends ApiFarmException {

    public KeyPoolExhaustedException(String message) {
        super("KEY_EXHAUSTED", message);
    }
}
