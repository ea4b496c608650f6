package com.apifarm.ai.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 上游调用配置项。
 */
@Data
@ConfigurationProperties(prefix = "apifarm.upstream")
public class UpstreamProperties {

    /** 添加 Key 时未指定地址则使用该默认地址（OpenAI 兼容协议） */
    private String defaultBaseUrl = "https://integrate.api.nvidia.com/v1";

    /** 单次上游调用的总超时（秒），超时按暂时性失败处理并切换下一个 Key */
    private int requestTimeoutSeconds = 60;

    /** 建立连接的超时（秒） */
    private int connectTimeoutSeconds = 10;
}
