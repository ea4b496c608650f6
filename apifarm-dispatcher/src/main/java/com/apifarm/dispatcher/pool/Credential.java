package com.apifarm.dispatcher.pool;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 池中的一个上游凭证及其健康信息。
 * <p>
 * 池内部持有的实例只在池锁内修改，对外一律返回 {@link #copy()} 得到的副本。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Credential {

    private Long id;

    private Long ownerId;

    /** 实际的 API Key 值，全池唯一 */
    private String value;

    /** 自定义上游地址，为 null 时使用默认地址 */
    private String endpoint;

    @Builder.Default
    private CredentialStatus status = CredentialStatus.ACTIVE;

    /** 连续暂时性失败次数，成功一次即清零 */
    private int failureCount;

    /** 最近一次调用时间（epoch 毫秒） */
    private Long lastUsedAt;

    /** 冷却截止时间（epoch 毫秒），仅 COOLING_DOWN 时有值 */
    private Long cooldownUntil;

    private Long createdAt;

    public Credential copy() {
        return toBuilder().build();
    }

    @Override
    public String toString() {
        return "Credential(id=" + id + ", ownerId=" + ownerId + ", status=" + status
                + ", failureCount=" + failureCount + ")";
    }
}
