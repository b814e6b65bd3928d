package com.flowgate.ai.cache;

import com.flowgate.common.exception.CacheDownloadException;

import java.nio.file.Path;

/**
 * 下载方式。下载链按顺序尝试，前一个失败时交给下一个。
 */
public interface Downloader {

    String name();

    /**
     * 将 url 下载到 target。
     *
     * @throws ForbiddenDownloadException 上游返回 403
     * @throws CacheDownloadException     其他失败
     */
    void download(String url, Path target);
}
