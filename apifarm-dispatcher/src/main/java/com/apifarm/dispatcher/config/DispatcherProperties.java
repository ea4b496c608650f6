package com.apifarm.dispatcher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 凭证池与路由配置项。
 */
@Data
@ConfigurationProperties(prefix = "apifarm.dispatcher")
public class DispatcherProperties {

    /** 连续暂时性失败达到该次数后进入冷却 */
    private int failureThreshold = 3;

    /** 首次冷却时长（秒），之后每多失败一次翻倍 */
    private int cooldownSeconds = 30;

    /** 冷却时长上限（秒） */
    private int maxCooldownSeconds = 600;
}
