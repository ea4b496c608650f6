package com.apifarm.common.exception;

/**
 * 上游明确拒绝该凭证（鉴权失败或额度耗尽），该凭证应被停用。仅在路由内部使用。
 */
public class UpstreamRejectedException extends ApiFarmException {

    public UpstreamRejectedException(String message) {
        super("UPSTREAM_REJECTED", message);
    }

    public UpstreamRejectedException(String message, Throwable cause) {
        super("UPSTREAM_REJECTED", message, cause);
    }
}
