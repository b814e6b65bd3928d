package com.flowgate.common.exception;

/**
 * 请求参数不合法（模型不存在、参考图数量不符等），在选择账号之前抛出。
 */
public class ValidationException extends FlowgateException {

    public ValidationException(String message) {
        super("invalid_request", message);
    }
}
