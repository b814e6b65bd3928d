package com.flowgate.common.util;

/**
 * 日志脱敏：凭证只保留前 8 位。
 */
public final class SecretMasker {

    private SecretMasker() {
    }

    public static String mask(String secret) {
        if (secret == null || secret.isEmpty()) {
            return "<empty>";
        }
        if (secret.length() <= 8) {
            return "***";
        }
        return secret.substring(0, 8) + "***";
    }
}
