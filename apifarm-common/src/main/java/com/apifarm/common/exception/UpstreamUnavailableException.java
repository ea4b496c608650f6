package com.apifarm.common.exception;

/**
 * 所有候选凭证均尝试失败。
 */
public class UpstreamUnavailableException extends ApiFarmException {

    public UpstreamUnavailableException(String message) {
        super("UPSTREAM_UNAVAILABLE", message);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super("UPSTREAM_UNAVAILABLE", message, cause);
    }
}
