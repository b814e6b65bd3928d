package com.flowgate.common.exception;

/**
 * 上游接口调用失败（HTTP 错误、响应格式异常、空结果、网络错误）。
 */
public class UpstreamException extends FlowgateException {

    /** HTTP 状态码，网络错误时为 0 */
    private final int statusCode;

    public UpstreamException(String message) {
        this("upstream_error", message, 0, null);
    }

    public UpstreamException(String message, int statusCode) {
        this("upstream_error", message, statusCode, null);
    }

    public UpstreamException(String message, Throwable cause) {
        this("upstream_error", message, 0, cause);
    }

    protected UpstreamException(String errorCode, String message, int statusCode, Throwable cause) {
        super(errorCode, message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
