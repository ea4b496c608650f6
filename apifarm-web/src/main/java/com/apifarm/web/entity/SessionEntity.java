package com.apifarm.web.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * 会话表。注销只标记 revokedAt，记录保留用于审计。
 */
@Table("t_session")
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SessionEntity {

    @Id
    private Long id;

    private String token;
    private Long userId;
    private Long issuedAt;

    /** 为 null 表示未注销 */
    private Long revokedAt;
}
