package com.flowgate.common.util;

import java.util.UUID;

/**
 * 上游请求用到的各类 ID。
 */
public final class IdGenerator {

    private IdGenerator() {
    }

    /**
     * 上游每次调用使用的会话 ID，格式 ";毫秒时间戳"。
     */
    public static String sessionId() {
        return ";" + System.currentTimeMillis();
    }

    /**
     * 视频请求的场景 ID。
     */
    public static String sceneId() {
        return UUID.randomUUID().toString();
    }
}
