package com.flowgate.common.exception;

/**
 * 上游返回 429，账号本身被限流，需立即封禁。
 */
public class UpstreamRateLimitedException extends UpstreamException {

    public UpstreamRateLimitedException(String message) {
        super("upstream_rate_limited", message, 429, null);
    }
}
