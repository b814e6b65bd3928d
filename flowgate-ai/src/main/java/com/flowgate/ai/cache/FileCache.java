package com.flowgate.ai.cache;

import com.flowgate.ai.config.FlowProperties;
import com.flowgate.common.dto.GenerationType;
import com.flowgate.common.exception.CacheDownloadException;
import com.flowgate.dispatcher.settings.SettingsStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.DigestUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 生成结果的本地文件缓存。
 * <p>
 * 文件名为 md5(url) 加扩展名，同一个 URL 只缓存一份；
 * 文件修改时间距今小于缓存有效期视为命中，过期文件在访问或定时清理时删除。
 * 下载依次尝试下载链中的每个下载器，前一个失败时交给下一个；
 * 任一下载器遇到 403 时中止本轮，退避后从链首重试。
 */
@Slf4j
public class FileCache {

    private final Path directory;
    private final List<Downloader> downloaders;
    private final FlowProperties.FileCacheConfig config;
    private final SettingsStore settingsStore;
    private final Clock clock;

    public FileCache(Path directory, List<Downloader> downloaders, FlowProperties.FileCacheConfig config,
                     SettingsStore settingsStore, Clock clock) {
        this.directory = directory;
        this.downloaders = List.copyOf(downloaders);
        this.config = config;
        this.settingsStore = settingsStore;
        this.clock = clock;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("无法创建缓存目录: " + directory, e);
        }
    }

    public static String cacheFileName(String url, GenerationType type) {
        String ext = type == GenerationType.VIDEO ? ".mp4" : ".jpg";
        return DigestUtils.md5DigestAsHex(url.getBytes(StandardCharsets.UTF_8)) + ext;
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * 取得 url 对应的缓存文件，未命中时下载。
     *
     * @return 缓存文件名
     * @throws CacheDownloadException 所有下载方式均失败
     */
    public String fetch(String url, GenerationType type) {
        String fileName = cacheFileName(url, type);
        Path target = directory.resolve(fileName);

        if (isFresh(target)) {
            log.debug("缓存命中: {}", fileName);
            return fileName;
        }
        deleteQuietly(target);

        int maxAttempts = Math.max(1, config.getMaxForbiddenAttempts());
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            boolean forbidden = false;
            for (Downloader downloader : downloaders) {
                try {
                    downloadAtomically(downloader, url, target);
                    log.info("已缓存{}: {} (下载方式: {})", type.getLabel(), fileName, downloader.name());
                    return fileName;
                } catch (ForbiddenDownloadException e) {
                    forbidden = true;
                    log.warn("{} 下载被拒绝 (第 {}/{} 轮): {}", downloader.name(), attempt, maxAttempts, e.getMessage());
                    break;
                } catch (CacheDownloadException e) {
                    log.warn("{} 下载失败: {}", downloader.name(), e.getMessage());
                } catch (RuntimeException e) {
                    log.warn("{} 下载异常: {}", downloader.name(), e.toString());
                }
            }
            if (!forbidden) {
                break;
            }
            if (attempt < maxAttempts) {
                sleep(config.getForbiddenBackoffMillis());
            }
        }
        throw new CacheDownloadException("所有下载方式均失败: " + url);
    }

    /**
     * 拼接缓存文件的访问地址，优先使用配置的缓存域名。
     */
    public String publicUrl(String fileName, String requestOrigin) {
        String base = settingsStore.get().getCacheBaseUrl();
        if (base == null || base.isBlank()) {
            base = requestOrigin == null ? "" : requestOrigin;
        }
        base = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        return base + "/tmp/" + fileName;
    }

    /**
     * 删除过期文件。
     *
     * @return 删除的文件数
     */
    public int removeExpired() {
        int removed = 0;
        for (Path file : listFiles()) {
            if (!isFresh(file) && deleteQuietly(file)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("清理过期缓存文件 {} 个", removed);
        }
        return removed;
    }

    /**
     * 删除全部缓存文件。
     *
     * @return 删除的文件数
     */
    public int clearAll() {
        int removed = 0;
        for (Path file : listFiles()) {
            if (deleteQuietly(file)) {
                removed++;
            }
        }
        log.info("已清空缓存, 删除文件 {} 个", removed);
        return removed;
    }

    private void downloadAtomically(Downloader downloader, String url, Path target) {
        Path temp;
        try {
            temp = Files.createTempFile(directory, "download-", ".part");
        } catch (IOException e) {
            throw new CacheDownloadException("无法创建临时文件", e);
        }
        try {
            downloader.download(url, temp);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new CacheDownloadException("保存缓存文件失败: " + e.getMessage(), e);
        } finally {
            deleteQuietly(temp);
        }
    }

    private boolean isFresh(Path file) {
        if (!Files.isRegularFile(file)) {
            return false;
        }
        try {
            Instant modified = Files.getLastModifiedTime(file).toInstant();
            Duration age = Duration.between(modified, clock.instant());
            return age.getSeconds() < settingsStore.get().getCacheTimeoutSeconds();
        } catch (IOException e) {
            log.warn("读取缓存文件时间失败: {}", file.getFileName());
            return false;
        }
    }

    private List<Path> listFiles() {
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(Files::isRegularFile)
                    .filter(f -> !f.getFileName().toString().endsWith(".part"))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("读取缓存目录失败: {}", e.getMessage());
            return List.of();
        }
    }

    private boolean deleteQuietly(Path file) {
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("删除缓存文件失败: {} - {}", file.getFileName(), e.getMessage());
            return false;
        }
    }

    private void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CacheDownloadException("缓存下载被中断", e);
        }
    }
}
