package com.flowgate.ai.cache;

import com.flowgate.common.exception.CacheDownloadException;
import lombok.RequiredArgsConstructor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * 调用外部命令下载。
 */
@RequiredArgsConstructor
public abstract class ExternalDownloader implements Downloader {

    private final ProcessRunner processRunner;
    private final int timeoutSeconds;

    protected abstract List<String> command(String url, Path target, int timeoutSeconds);

    /**
     * 命令输出是否表明上游返回 403。
     */
    protected abstract boolean forbidden(ProcessRunner.Result result);

    protected boolean succeeded(ProcessRunner.Result result) {
        return result.isSuccess();
    }

    @Override
    public void download(String url, Path target) {
        ProcessRunner.Result result;
        try {
            // 命令自身有超时，这里多留一些余量
            result = processRunner.run(command(url, target, timeoutSeconds), name(), timeoutSeconds + 30L);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CacheDownloadException(name() + " 被中断", e);
        } catch (IOException | TimeoutException e) {
            throw new CacheDownloadException(name() + " 执行失败: " + e.getMessage(), e);
        }

        if (forbidden(result)) {
            throw new ForbiddenDownloadException(name() + " 返回 403");
        }
        if (!succeeded(result)) {
            throw new CacheDownloadException(name() + " 退出码 " + result.getExitCode());
        }
        try {
            if (!Files.exists(target) || Files.size(target) == 0) {
                throw new CacheDownloadException(name() + " 未生成文件");
            }
        } catch (IOException e) {
            throw new CacheDownloadException(name() + " 无法读取下载结果", e);
        }
    }
}
