package com.apifarm.dispatcher.config;

import com.apifarm.dispatcher.pool.CredentialPool;
import com.apifarm.dispatcher.pool.CredentialStore;
import com.apifarm.dispatcher.pool.RoundRobinCredentialPool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 调度模块配置。
 * <p>
 * 凭证池只有单机内存实现，状态通过 {@link CredentialStore} 同步落盘，
 * 启动时从存储中全量加载。
 */
@Slf4j
@Configuration
@ComponentScan(basePackages = "com.apifarm.dispatcher")
@EnableConfigurationProperties(DispatcherProperties.class)
public class DispatcherModuleConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CredentialPool credentialPool(CredentialStore credentialStore,
                                         DispatcherProperties properties,
                                         Clock clock) {
        RoundRobinCredentialPool pool = new RoundRobinCredentialPool(credentialStore, properties, clock);
        pool.load();
        log.info("凭证池就绪: {}", pool.stats());
        return pool;
    }
}
