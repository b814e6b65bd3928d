package com.flowgate.common.exception;

/**
 * 系统基础异常，所有业务异常的父类。
 * <p>
 * errorCode 同时作为 OpenAI 错误结构中的 code 字段返回给调用方。
 */
public class FlowgateException extends RuntimeException {

    private final String errorCode;

    public FlowgateException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public FlowgateException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
