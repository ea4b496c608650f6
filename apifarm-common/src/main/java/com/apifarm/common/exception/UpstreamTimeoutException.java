package com.apifarm.common.exception;

/**
 * 上游暂时性失败：超时、网络错误或 5xx。仅在路由内部使用，重试耗尽后转为 {@link UpstreamUnavailableException}。
 */
public class UpstreamTimeoutException extends ApiFarmException {

    public UpstreamTimeoutException(String message) {
        super("UPSTREAM_TIMEOUT", message);
    }

    public UpstreamTimeoutException(String message, Throwable cause) {
        super("UPSTREAM_TIMEOUT", message, cause);
    }
}
