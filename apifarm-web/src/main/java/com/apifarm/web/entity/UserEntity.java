package com.apifarm.web.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * 用户表。注册后不再修改。
 */
@Table("t_user")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserEntity {

    @Id
    private Long id;

    private String username;

    /** BCrypt 哈希（自带盐） */
    private String passwordHash;

    /** epoch 毫秒 */
    private Long createdAt;
}
