package com.flowgate.common.exception;

/**
 * 账号池耗尽异常，没有可用 Token 时抛出。
 */
public class PoolExhaustedException extends FlowgateException {

    public PoolExhaustedException(String message) {
        super("no_available_token", message);
    }
}
