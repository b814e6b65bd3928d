package com.flowgate.ai.cache;

import com.flowgate.ai.config.FlowProperties;
import com.flowgate.common.dto.GenerationType;
import com.flowgate.common.exception.CacheDownloadException;
import com.flowgate.dispatcher.config.DispatcherProperties;
import com.flowgate.dispatcher.registry.InMemoryCredentialRegistry;
import com.flowgate.dispatcher.settings.SettingsStore;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileCacheTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");
    private static final String URL = "https://storage.googleapis.com/video/abc.mp4";

    @TempDir
    Path dir;

    private SettingsStore settingsStore;
    private FlowProperties.FileCacheConfig config;

    @BeforeEach
    void setUp() {
        settingsStore = new SettingsStore(new InMemoryCredentialRegistry(), new DispatcherProperties());
        config = new FlowProperties.FileCacheConfig();
        config.setForbiddenBackoffMillis(0);
        config.setMaxForbiddenAttempts(3);
    }

    private FileCache cache(Downloader... downloaders) {
        return new FileCache(dir, Arrays.asList(downloaders), config, settingsStore,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private Path existing(String fileName, long ageSeconds) throws IOException {
        Path file = dir.resolve(fileName);
        Files.write(file, new byte[]{9, 9});
        Files.setLastModifiedTime(file, FileTime.from(NOW.minusSeconds(ageSeconds)));
        return file;
    }

    @Test
    @DisplayName("文件名为 url 的 md5 加扩展名")
    void fileNameIsMd5OfUrl() {
        String video = FileCache.cacheFileName(URL, GenerationType.VIDEO);
        String image = FileCache.cacheFileName(URL, GenerationType.IMAGE);

        assertThat(video).matches("[0-9a-f]{32}\\.mp4");
        assertThat(image).isEqualTo(video.replace(".mp4", ".jpg"));
    }

    @Test
    @DisplayName("未过期的文件直接命中，不下载")
    void freshFileIsHit() throws IOException {
        ScriptedDownloader downloader = new ScriptedDownloader("browser");
        existing(FileCache.cacheFileName(URL, GenerationType.VIDEO), 7199);

        String name = cache(downloader).fetch(URL, GenerationType.VIDEO);

        assertThat(name).isEqualTo(FileCache.cacheFileName(URL, GenerationType.VIDEO));
        assertThat(downloader.calls).isZero();
    }

    @Test
    @DisplayName("过期文件重新下载")
    void expiredFileIsRedownloaded() throws IOException {
        ScriptedDownloader downloader = new ScriptedDownloader("browser").thenWrite(new byte[]{1, 2, 3});
        Path file = existing(FileCache.cacheFileName(URL, GenerationType.VIDEO), 7201);

        cache(downloader).fetch(URL, GenerationType.VIDEO);

        assertThat(downloader.calls).isEqualTo(1);
        assertThat(Files.readAllBytes(file)).containsExactly(1, 2, 3);
    }

    @Test
    @DisplayName("下载器失败时交给下一个")
    void fallsThroughTheChain() throws IOException {
        ScriptedDownloader browser = new ScriptedDownloader("browser")
                .thenFail(new CacheDownloadException("connection reset"));
        ScriptedDownloader wget = new ScriptedDownloader("wget").thenWrite(new byte[]{7});

        String name = cache(browser, wget).fetch(URL, GenerationType.IMAGE);

        assertThat(browser.calls).isEqualTo(1);
        assertThat(wget.calls).isEqualTo(1);
        assertThat(Files.readAllBytes(dir.resolve(name))).containsExactly(7);
    }

    @Test
    @DisplayName("整条链 403 时重试，直到成功")
    void retriesWholeChainOnForbidden() {
        ScriptedDownloader browser = new ScriptedDownloader("browser")
                .thenFail(new ForbiddenDownloadException("403"))
                .thenFail(new ForbiddenDownloadException("403"))
                .thenWrite(new byte[]{5});

        String name = cache(browser).fetch(URL, GenerationType.VIDEO);

        assertThat(browser.calls).isEqualTo(3);
        assertThat(dir.resolve(name)).exists();
    }

    @Test
    @DisplayName("遇到 403 时中止本轮，不再尝试后续下载器")
    void forbiddenStopsTheChain() {
        ScriptedDownloader browser = new ScriptedDownloader("browser")
                .thenFail(new ForbiddenDownloadException("403"))
                .thenWrite(new byte[]{4});
        ScriptedDownloader wget = new ScriptedDownloader("wget").thenWrite(new byte[]{8});

        String name = cache(browser, wget).fetch(URL, GenerationType.VIDEO);

        assertThat(browser.calls).isEqualTo(2);
        assertThat(wget.calls).isZero();
        assertThat(dir.resolve(name)).exists();
    }

    @Test
    @DisplayName("下载器抛出非预期异常时同样交给下一个")
    void unexpectedExceptionFallsThrough() throws IOException {
        Downloader browser = new BrowserDownloader(new OkHttpClient());
        ScriptedDownloader wget = new ScriptedDownloader("wget").thenWrite(new byte[]{6});
        String ftpUrl = "ftp://example.com/a.mp4";

        String name = cache(browser, wget).fetch(ftpUrl, GenerationType.VIDEO);

        assertThat(wget.calls).isEqualTo(1);
        assertThat(Files.readAllBytes(dir.resolve(name))).containsExactly(6);
    }

    @Test
    @DisplayName("403 重试次数耗尽后失败")
    void forbiddenAttemptsExhausted() {
        ScriptedDownloader browser = new ScriptedDownloader("browser");
        for (int i = 0; i < 5; i++) {
            browser.thenFail(new ForbiddenDownloadException("403"));
        }

        assertThatThrownBy(() -> cache(browser).fetch(URL, GenerationType.VIDEO))
                .isInstanceOf(CacheDownloadException.class)
                .hasMessageContaining("所有下载方式均失败");
        assertThat(browser.calls).isEqualTo(3);
    }

    @Test
    @DisplayName("非 403 失败不重试整条链，也不留下临时文件")
    void plainFailureDoesNotRetry() throws IOException {
        ScriptedDownloader browser = new ScriptedDownloader("browser")
                .thenFail(new CacheDownloadException("timeout"));
        ScriptedDownloader curl = new ScriptedDownloader("curl")
                .thenFail(new CacheDownloadException("exit 7"));

        assertThatThrownBy(() -> cache(browser, curl).fetch(URL, GenerationType.IMAGE))
                .isInstanceOf(CacheDownloadException.class);

        assertThat(browser.calls).isEqualTo(1);
        assertThat(curl.calls).isEqualTo(1);
        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files).isEmpty();
        }
    }

    @Test
    @DisplayName("定时清理只删除过期文件")
    void removeExpiredKeepsFreshFiles() throws IOException {
        existing("old.mp4", 7300);
        existing("new.jpg", 60);

        int removed = cache().removeExpired();

        assertThat(removed).isEqualTo(1);
        assertThat(dir.resolve("old.mp4")).doesNotExist();
        assertThat(dir.resolve("new.jpg")).exists();
    }

    @Test
    @DisplayName("清空缓存删除全部文件")
    void clearAllRemovesEverything() throws IOException {
        existing("a.mp4", 1);
        existing("b.jpg", 99999);

        assertThat(cache().clearAll()).isEqualTo(2);
    }

    @Test
    @DisplayName("访问地址优先使用配置的缓存域名")
    void publicUrlPrefersConfiguredBase() {
        FileCache cache = cache();
        assertThat(cache.publicUrl("x.jpg", "http://localhost:8000")).isEqualTo("http://localhost:8000/tmp/x.jpg");

        settingsStore.update(s -> s.toBuilder().cacheBaseUrl("https://cdn.example.com/").build());
        assertThat(cache.publicUrl("x.jpg", "http://localhost:8000")).isEqualTo("https://cdn.example.com/tmp/x.jpg");
    }

    /**
     * 按脚本依次返回结果的下载器，脚本用完后总是失败。
     */
    private static final class ScriptedDownloader implements Downloader {

        private final String name;
        private final Deque<Object> script = new ArrayDeque<>();
        private int calls;

        private ScriptedDownloader(String name) {
            this.name = name;
        }

        ScriptedDownloader thenWrite(byte[] content) {
            script.add(content);
            return this;
        }

        ScriptedDownloader thenFail(CacheDownloadException failure) {
            script.add(failure);
            return this;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public void download(String url, Path target) {
            calls++;
            Object next = script.poll();
            if (next == null) {
                throw new CacheDownloadException(name + " 脚本已用完");
            }
            if (next instanceof CacheDownloadException) {
                throw (CacheDownloadException) next;
            }
            try {
                Files.write(target, (byte[]) next);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }
}
