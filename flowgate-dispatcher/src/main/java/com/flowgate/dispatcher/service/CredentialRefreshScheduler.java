package com.flowgate.dispatcher.service;

import com.flowgate.common.dto.Token;
import com.flowgate.dispatcher.registry.CredentialRegistry;
import com.flowgate.dispatcher.settings.SettingsStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 定时任务：提前刷新即将过期的 AT，减少请求路径上的刷新等待。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CredentialRefreshScheduler {

    private final CredentialRegistry registry;
    private final TokenHealthService healthService;
    private final SettingsStore settingsStore;

    @Scheduled(fixedDelayString = "${flowgate.dispatcher.credential-refresh-interval-seconds:1800}000",
            initialDelayString = "${flowgate.dispatcher.credential-refresh-interval-seconds:1800}000")
    public void refreshExpiring() {
        if (!settingsStore.get().isCredentialAutoRefresh()) {
            return;
        }
        int refreshed = 0;
        int failed = 0;
        for (Token token : registry.findActiveTokens()) {
            if (healthService.hasFreshAccessToken(token)) {
                continue;
            }
            if (healthService.refreshAccessToken(token)) {
                refreshed++;
            } else {
                failed++;
            }
        }
        if (refreshed + failed > 0) {
            log.info("AT 自动刷新完成, 成功: {}, 失败: {}", refreshed, failed);
        }
    }
}
