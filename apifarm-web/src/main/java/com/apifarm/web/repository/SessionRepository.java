package com.apifarm.web.repository;

import com.apifarm.web.entity.SessionEntity;
import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;

public interface SessionRepository extends CrudRepository<SessionEntity, Long> {

    /** 只会把未注销的会话标记为注销，返回受影响行数 */
    @Modifying
    @Query("UPDATE t_session SET revoked_at = :revokedAt WHERE token = :token AND revoked_at IS NULL")
    int revoke(String token, Long revokedAt);
}
