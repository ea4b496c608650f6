package com.apifarm.web.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 用户与会话配置项。
 */
@Data
@ConfigurationProperties(prefix = "apifarm.session")
public class SessionProperties {

    /** 会话令牌有效期（小时），从签发时刻算起 */
    private int ttlHours = 168;

    /** BCrypt 计算强度（log2 轮数） */
    private int bcryptRounds = 10;
}
