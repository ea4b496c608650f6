package com.apifarm.dispatcher.pool;

import java.util.List;
import java.util.Set;

/**
 * 共享凭证池接口。
 * <p>
 * 管理操作（添加/删除/列出）按归属用户隔离，轮询选择面向全池。
 */
public interface CredentialPool {

    /**
     * 添加凭证，写盘成功后才对轮询可见。
     *
     * @param endpoint 可为 null，表示使用默认上游地址
     * @return 凭证 ID
     * @throws com.apifarm.common.exception.DuplicateKeyException 该值已在池中（任意用户）
     */
    Long add(Long ownerId, String value, String endpoint);

    /**
     * 删除凭证，只能删除自己名下的。
     *
     * @throws com.apifarm.common.exception.KeyNotFoundException 不存在或不属于该用户
     */
    void remove(Long ownerId, String value);

    /** 列出用户名下的 Key，按添加顺序 */
    List<String> list(Long ownerId);

    /** 轮询选出一个可用凭证 */
    default Credential selectForUse() {
        return selectForUse(Set.of());
    }

    /**
     * 在排除指定凭证后轮询选出一个可用凭证。
     *
     * @throws com.apifarm.common.exception.KeyPoolExhaustedException 没有可用凭证
     */
    Credential selectForUse(Set<Long> excludedIds);

    /** 上报一次调用结果，驱动健康状态机 */
    void reportOutcome(Long credentialId, Outcome outcome);

    /** 未停用的凭证数量 */
    int size();

    PoolStats stats();
}
