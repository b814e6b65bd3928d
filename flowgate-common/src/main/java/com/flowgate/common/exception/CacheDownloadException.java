package com.flowgate.common.exception;

/**
 * 结果缓存下载失败。由编排层吞掉并回退到上游原始 URL。
 */
public class CacheDownloadException extends FlowgateException {

    public CacheDownloadException(String message) {
        super("cache_download_failed", message);
    }

    public CacheDownloadException(String message, Throwable cause) {
        super("cache_download_failed", message, cause);
    }
}
