package com.apifarm.dispatcher.pool;

/**
 * 凭证健康状态。
 */
public enum CredentialStatus {
    /** 可参与轮询 */
    ACTIVE,
    /** 连续暂时性失败后冷却中，冷却结束自动恢复 */
    COOLING_DOWN,
    /** 被上游明确拒绝，只能删除后重新添加 */
    DISABLED
}
