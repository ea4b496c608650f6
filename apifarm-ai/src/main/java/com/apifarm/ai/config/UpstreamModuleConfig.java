package com.apifarm.ai.config;

import okhttp3.OkHttpClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * 上游客户端模块配置。
 */
@Configuration
@ComponentScan(basePackages = "com.apifarm.ai")
@EnableConfigurationProperties(UpstreamProperties.class)
public class UpstreamModuleConfig {

    /**
     * callTimeout 覆盖连接、写请求、读响应的全过程，是单次调用的硬上限。
     */
    @Bean
    public OkHttpClient upstreamHttpClient(UpstreamProperties properties) {
        Duration callTimeout = Duration.ofSeconds(properties.getRequestTimeoutSeconds());
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()))
                .readTimeout(callTimeout)
                .writeTimeout(callTimeout)
                .callTimeout(callTimeout)
                .retryOnConnectionFailure(false)
                .build();
    }
}
