package com.flowgate.ai.cache;

import com.flowgate.common.exception.CacheDownloadException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExternalDownloaderTest {

    @TempDir
    Path dir;

    /**
     * 不启动进程，直接返回预设结果。
     */
    private static ProcessRunner returning(int exitCode, String output) {
        return new ProcessRunner() {
            @Override
            public Result run(List<String> command, String taskName, long timeoutSeconds) {
                return new Result(exitCode, output);
            }
        };
    }

    @Test
    @DisplayName("wget 不使用静默模式，输出 ERROR 403 时识别为被拒绝")
    void wgetDetectsForbidden() {
        WgetDownloader wget = new WgetDownloader(
                returning(8, "https://example.com/a.mp4:\n2025-03-01 10:00:00 ERROR 403: Forbidden.\n"), 60);

        assertThat(wget.command("https://example.com/a.mp4", dir.resolve("a.part"), 60)).doesNotContain("-q");
        assertThatThrownBy(() -> wget.download("https://example.com/a.mp4", dir.resolve("a.part")))
                .isInstanceOf(ForbiddenDownloadException.class);
    }

    @Test
    @DisplayName("wget 其他失败按普通下载失败处理")
    void wgetOtherFailure() {
        WgetDownloader wget = new WgetDownloader(returning(4, "unable to resolve host address\n"), 60);

        assertThatThrownBy(() -> wget.download("https://example.com/a.mp4", dir.resolve("a.part")))
                .isInstanceOf(CacheDownloadException.class)
                .isNotInstanceOf(ForbiddenDownloadException.class);
    }

    @Test
    @DisplayName("curl 通过状态码输出识别 403")
    void curlDetectsForbidden() {
        CurlDownloader curl = new CurlDownloader(returning(0, "HTTP 403"), 60);

        assertThatThrownBy(() -> curl.download("https://example.com/a.mp4", dir.resolve("a.part")))
                .isInstanceOf(ForbiddenDownloadException.class);
    }

    @Test
    @DisplayName("curl 返回 2xx 且生成文件时成功")
    void curlSucceeds() throws Exception {
        Path target = dir.resolve("a.part");
        Files.write(target, new byte[]{1});
        CurlDownloader curl = new CurlDownloader(returning(0, "HTTP 200"), 60);

        curl.download("https://example.com/a.mp4", target);

        assertThat(target).exists();
    }
}
