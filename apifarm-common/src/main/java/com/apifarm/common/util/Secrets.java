package com.apifarm.common.util;

/**
 * 日志输出时遮蔽敏感值。
 */
public final class Secrets {

    private Secrets() {
    }

    /** 只保留前 8 位，短于 9 位的值完全遮蔽 */
    public static String mask(String secret) {
        if (secret == null || secret.length() <= 8) return "***";
        return secret.substring(0, 8) + "***";
    }
}
