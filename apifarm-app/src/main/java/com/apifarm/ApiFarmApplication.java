package com.apifarm;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * API Key 共享池服务 - 启动类。
 */
@SpringBootApplication(scanBasePackages = "com.apifarm")
public class ApiFarmApplication {

    public static void main(String[] args) throws Exception {
        // SQLite 不会自动创建父目录，启动前确保 data/ 存在
        Files.createDirectories(Path.of("data"));
        SpringApplication.run(ApiFarmApplication.class, args);
    }
}
