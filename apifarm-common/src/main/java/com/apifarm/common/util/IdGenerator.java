package com.apifarm.common.util;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.UUID;

/**
 * ID 与令牌生成工具类。
 */
public final class IdGenerator {

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private IdGenerator() {
    }

    /**
     * 生成带前缀的短 ID，如 "req-xxxx"，用于日志关联，不具备安全性。
     */
    public static String withPrefix(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    /**
     * 生成 URL 安全的随机令牌。
     *
     * @param numBytes 随机字节数，32 字节即 256 位熵
     */
    public static String secureToken(int numBytes) {
        byte[] bytes = new byte[numBytes];
        SECURE_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
