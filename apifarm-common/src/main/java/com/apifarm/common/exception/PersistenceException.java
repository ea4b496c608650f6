package com.apifarm.common.exception;

/**
 * 持久化读写失败。启动阶段出现即终止进程，运行期出现表示本次变更未提交。
 */
public class PersistenceException extends ApiFarmException {

    public PersistenceException(String message) {
        super("PERSISTENCE_FAILURE", message);
    }

    public PersistenceException(String message, Throwable cause) {
        super("PERSISTENCE_FAILURE", message, cause);
    }
}
