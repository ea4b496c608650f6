package com.apifarm.web.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * 凭证表，API Key 及其健康状态。
 */
@Table("t_credential")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CredentialEntity {

    @Id
    private Long id;

    private Long ownerId;
    private String apiKey;
    private String endpoint;

    /** ACTIVE / COOLING_DOWN / DISABLED */
    @Builder.Default
    private String status = "ACTIVE";

    @Builder.Default
    private Integer failureCount = 0;

    private Long lastUsedAt;
    private Long cooldownUntil;
    private Long createdAt;
}
