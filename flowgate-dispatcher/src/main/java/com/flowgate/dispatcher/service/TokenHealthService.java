package com.flowgate.dispatcher.service;

import com.flowgate.common.dto.Token;
import com.flowgate.common.exception.FlowgateException;
import com.flowgate.common.util.SecretMasker;
import com.flowgate.dispatcher.client.AccessGrant;
import com.flowgate.dispatcher.client.AccountClient;
import com.flowgate.dispatcher.client.SessionRenewer;
import com.flowgate.dispatcher.config.DispatcherProperties;
import com.flowgate.dispatcher.registry.CredentialRegistry;
import com.flowgate.dispatcher.settings.RuntimeSettings;
import com.flowgate.dispatcher.settings.SettingsStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

/**
 * 账号健康与封禁引擎。
 * <p>
 * 状态迁移规则：
 * - 普通错误累计连续错误数，达到阈值自动禁用
 * - 上游 429 立即封禁，不经过阈值
 * - 成功或手动启用清零连续错误数，累计错误数只增不减
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TokenHealthService {

    public static final String BAN_REASON_RATE_LIMIT = "429_rate_limit";
    public static final String BAN_REASON_ERROR_THRESHOLD = "error_threshold";

    private final CredentialRegistry registry;
    private final AccountClient accountClient;
    private final SessionRenewer sessionRenewer;
    private final SettingsStore settingsStore;
    private final DispatcherProperties properties;
    private final Clock clock;

    // ==================== 凭证 ====================

    /**
     * AT 是否可用；过期或缺失时用 ST 刷新，刷新失败且开启了自动续期时续期一次后重试。
     */
    public boolean isAccessCredentialValid(long tokenId) {
        Optional<Token> found = registry.findToken(tokenId);
        if (found.isEmpty()) {
            return false;
        }
        Token token = found.get();
        if (hasFreshAccessToken(token)) {
            return true;
        }

        log.info("Token {} 的 AT 缺失或即将过期，开始刷新", tokenId);
        if (refreshAccessToken(token)) {
            return true;
        }

        if (!settingsStore.get().isSessionAutoRenew()) {
            return false;
        }
        return renewSessionAndRefresh(token);
    }

    public boolean hasFreshAccessToken(Token token) {
        if (token.getAccessToken() == null || token.getAccessToken().isBlank()) {
            return false;
        }
        Instant expires = token.getAccessTokenExpires();
        if (expires == null) {
            return false;
        }
        Instant threshold = clock.instant().plusSeconds(properties.getAccessTokenRefreshLeadSeconds());
        return expires.isAfter(threshold);
    }

    /**
     * 用 ST 换取新的 AT 并持久化。
     *
     * @return 是否刷新成功
     */
    public boolean refreshAccessToken(Token token) {
        try {
            AccessGrant grant = accountClient.exchangeSession(token.getSessionToken());
            if (grant.getAccessToken() == null || grant.getAccessToken().isBlank()) {
                log.warn("Token {} 刷新 AT 失败: 上游未返回 access_token", token.getId());
                return false;
            }
            registry.updateAccessToken(token.getId(), grant.getAccessToken(), grant.getExpires());
            log.info("Token {} 的 AT 已刷新, 过期时间: {}", token.getId(), grant.getExpires());
            return true;
        } catch (FlowgateException e) {
            log.warn("Token {} 刷新 AT 失败 (ST: {}): {}",
                    token.getId(), SecretMasker.mask(token.getSessionToken()), e.getMessage());
            return false;
        }
    }

    private boolean renewSessionAndRefresh(Token token) {
        Optional<String> renewed;
        try {
            renewed = sessionRenewer.renew(token);
        } catch (RuntimeException e) {
            log.warn("Token {} 续期 ST 异常: {}", token.getId(), e.getMessage());
            return false;
        }
        if (renewed.isEmpty()) {
            log.warn("Token {} 无法续期 ST", token.getId());
            return false;
        }

        // 续期后重新读取，避免覆盖其他并发修改
        Optional<Token> latest = registry.findToken(token.getId());
        if (latest.isEmpty()) {
            return false;
        }
        Token updated = latest.get().toBuilder().sessionToken(renewed.get()).build();
        registry.updateToken(updated);
        log.info("Token {} 的 ST 已续期, 重试刷新 AT", token.getId());
        return refreshAccessToken(updated);
    }

    // ==================== 结果记录 ====================

    public void recordSuccess(long tokenId) {
        registry.resetConsecutiveErrors(tokenId);
    }

    /**
     * 记录一次普通错误，连续错误数达到阈值时自动禁用。
     */
    public void recordError(long tokenId) {
        RuntimeSettings settings = settingsStore.get();
        Instant now = clock.instant();
        int consecutive = registry.incrementError(tokenId, LocalDate.now(clock), now);

        int threshold = settings.getErrorBanThreshold();
        if (threshold > 0 && consecutive >= threshold) {
            registry.setTokenActive(tokenId, false, BAN_REASON_ERROR_THRESHOLD, now);
            log.warn("Token {} 连续错误 {} 次, 达到阈值 {}, 已自动禁用", tokenId, consecutive, threshold);
        } else {
            log.info("Token {} 记录错误, 连续错误数: {}", tokenId, consecutive);
        }
    }

    /**
     * 上游 429：立即封禁，直到手动启用。
     */
    public void banForRateLimit(long tokenId) {
        registry.setTokenActive(tokenId, false, BAN_REASON_RATE_LIMIT, clock.instant());
        log.warn("Token {} 触发上游 429 限流, 已封禁", tokenId);
    }

    // ==================== 手动操作 ====================

    public void enable(long tokenId) {
        registry.setTokenActive(tokenId, true, null, null);
        registry.resetConsecutiveErrors(tokenId);
        log.info("Token {} 已启用", tokenId);
    }

    public void disable(long tokenId) {
        registry.setTokenActive(tokenId, false, null, null);
        log.info("Token {} 已禁用", tokenId);
    }
}
