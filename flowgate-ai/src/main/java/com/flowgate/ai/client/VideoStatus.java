package com.flowgate.ai.client;

import lombok.Value;

/**
 * 视频任务的一次状态查询结果。
 */
@Value
public class VideoStatus {

    public static final String SUCCESSFUL = "MEDIA_GENERATION_STATUS_SUCCESSFUL";
    public static final String FAILED = "MEDIA_GENERATION_STATUS_FAILED";
    private static final String ERROR_PREFIX = "MEDIA_GENERATION_STATUS_ERROR";

    String status;
    String videoUrl;
    String errorCode;
    String errorMessage;

    public boolean isSuccessful() {
        return SUCCESSFUL.equals(status);
    }

    public boolean isFailed() {
        return FAILED.equals(status) || (status != null && status.startsWith(ERROR_PREFIX));
    }

    /**
     * 用于持久化的错误描述，如 "quota exceeded (code: 8)"。
     */
    public String describeError() {
        String message = errorMessage == null || errorMessage.isBlank() ? status : errorMessage;
        return errorCode == null || errorCode.isBlank() ? message : message + " (code: " + errorCode + ")";
    }
}
