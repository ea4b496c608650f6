package com.apifarm.dispatcher.pool;

import java.util.List;

/**
 * 凭证持久化接口，由 Web 模块基于 SQLite 实现。
 * <p>
 * 所有方法同步写盘，失败时抛出 {@link com.apifarm.common.exception.PersistenceException}。
 */
public interface CredentialStore {

    /** 按添加顺序加载全部凭证 */
    List<Credential> loadAll();

    /**
     * 插入新凭证。
     *
     * @return 带生成 ID 的凭证
     * @throws com.apifarm.common.exception.DuplicateKeyException 唯一约束冲突
     */
    Credential insert(Credential credential);

    void delete(Long credentialId);

    /** 只更新状态、失败计数、冷却与使用时间 */
    void updateHealth(Credential credential);
}
