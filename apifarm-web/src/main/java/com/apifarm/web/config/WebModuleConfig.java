package com.apifarm.web.config;

import com.apifarm.web.security.SessionAuthInterceptor;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.relational.core.dialect.Dialect;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web 模块配置。
 */
@Configuration
@ComponentScan(basePackages = "com.apifarm.web")
@EnableConfigurationProperties(SessionProperties.class)
@RequiredArgsConstructor
public class WebModuleConfig implements WebMvcConfigurer {

    private final SessionAuthInterceptor sessionAuthInterceptor;

    /**
     * 注册 SQLite 方言。静态方法，避免与拦截器依赖的仓库形成创建环。
     */
    @Bean
    public static Dialect jdbcDialect() {
        return SqliteDialect.INSTANCE;
    }

    /**
     * 除注册、登录和推理接口外，其余接口都需要会话令牌。
     */
    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(sessionAuthInterceptor)
                .addPathPatterns("/users/logout", "/keys", "/keys/**");
    }
}
