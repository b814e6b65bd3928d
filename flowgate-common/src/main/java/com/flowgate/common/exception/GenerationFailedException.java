package com.flowgate.common.exception;

/**
 * 上游明确返回生成失败（终态）。
 */
public class GenerationFailedException extends FlowgateException {

    public GenerationFailedException(String message) {
        super("generation_failed", message);
    }
}
