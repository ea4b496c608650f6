package com.apifarm.web.repository;

import com.apifarm.web.entity.CredentialEntity;
import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;

import java.util.List;

public interface CredentialRepository extends CrudRepository<CredentialEntity, Long> {

    /** 按添加顺序返回全部凭证 */
    @Query("SELECT * FROM t_credential ORDER BY id")
    List<CredentialEntity> findAllInInsertionOrder();

    @Modifying
    @Query("UPDATE t_credential SET status = :status, failure_count = :failureCount, "
            + "last_used_at = :lastUsedAt, cooldown_until = :cooldownUntil WHERE id = :id")
    int updateHealth(Long id, String status, Integer failureCount, Long lastUsedAt, Long cooldownUntil);
}
