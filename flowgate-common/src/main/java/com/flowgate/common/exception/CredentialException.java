package com.flowgate.common.exception;

/**
 * Access Token 刷新失败。
 */
public class CredentialException extends FlowgateException {

    public CredentialException(String message) {
        super("credential_error", message);
    }

    public CredentialException(String message, Throwable cause) {
        super("credential_error", message, cause);
    }
}
