package com.flowgate.common.exception;

public class PollTimeoutException extends FlowgateException {

    public PollTimeoutException(String message) {
        super("generation_timeout", message);
    }
}
