package com.apifarm.dispatcher.pool;

/**
 * 一次上游调用的结果分类。
 */
public enum Outcome {
    SUCCESS,
    TRANSIENT_FAILURE,
    DEFINITIVE_FAILURE
}
