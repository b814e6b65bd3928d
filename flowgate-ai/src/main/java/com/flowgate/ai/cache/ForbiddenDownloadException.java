package com.flowgate.ai.cache;

import com.flowgate.common.exception.CacheDownloadException;

/**
 * 下载被拒绝（403），整条下载链可以在退避后重试。
 */
public class ForbiddenDownloadException extends CacheDownloadException {

    public ForbiddenDownloadException(String message) {
        super(message);
    }
}
