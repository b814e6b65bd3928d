package com.flowgate.common.exception;

/**
 * 账号并发已满。属于容量信号，不计入账号错误。
 */
public class AdmissionRejectedException extends FlowgateException {

    public AdmissionRejectedException(String message) {
        super("concurrency_limit", message);
    }
}
