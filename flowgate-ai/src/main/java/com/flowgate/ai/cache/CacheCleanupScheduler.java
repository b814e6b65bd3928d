package com.flowgate.ai.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 定期清理过期的缓存文件。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CacheCleanupScheduler {

    private final FileCache fileCache;

    @Scheduled(fixedDelayString = "${flowgate.flow.file-cache.cleanup-interval-seconds:300}000",
            initialDelayString = "${flowgate.flow.file-cache.cleanup-interval-seconds:300}000")
    public void sweep() {
        try {
            fileCache.removeExpired();
        } catch (RuntimeException e) {
            log.error("清理缓存文件失败", e);
        }
    }
}
