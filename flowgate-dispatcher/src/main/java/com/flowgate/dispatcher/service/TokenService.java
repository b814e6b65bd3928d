package com.flowgate.dispatcher.service;

import com.flowgate.common.dto.ProjectBinding;
import com.flowgate.common.dto.Token;
import com.flowgate.common.exception.CredentialException;
import com.flowgate.common.exception.FlowgateException;
import com.flowgate.common.exception.ValidationException;
import com.flowgate.common.util.SecretMasker;
import com.flowgate.dispatcher.client.AccessGrant;
import com.flowgate.dispatcher.client.AccountClient;
import com.flowgate.dispatcher.client.AccountCredits;
import com.flowgate.dispatcher.concurrency.ConcurrencyManager;
import com.flowgate.dispatcher.registry.CredentialRegistry;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 账号生命周期：新增、修改、删除、导入、余额刷新与项目绑定。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TokenService {

    private static final DateTimeFormatter PROJECT_NAME_FMT = DateTimeFormatter.ofPattern("MMM dd - HH:mm");

    private final CredentialRegistry registry;
    private final AccountClient accountClient;
    private final ConcurrencyManager concurrencyManager;
    private final TokenHealthService healthService;
    private final Clock clock;

    /** 每个账号一把锁，避免并发请求重复创建项目 */
    private final Map<Long, Object> projectLocks = new ConcurrentHashMap<>();

    // ==================== 新增 / 导入 ====================

    /**
     * 新增账号：ST 换 AT、查询余额、创建项目、登记并发上限。
     *
     * @param draft 至少包含 sessionToken；其余字段（备注、开关、并发上限）可选
     */
    public Token addToken(Token draft) {
        String st = draft.getSessionToken();
        if (st == null || st.isBlank()) {
            throw new ValidationException("Session Token 不能为空");
        }
        st = st.trim();
        if (registry.findTokenBySessionToken(st).isPresent()) {
            throw new ValidationException("Token 已存在");
        }

        AccessGrant grant = exchange(st);
        Token token = draft.toBuilder()
                .id(null)
                .sessionToken(st)
                .accessToken(grant.getAccessToken())
                .accessTokenExpires(grant.getExpires())
                .email(grant.getEmail())
                .name(grant.getName())
                .active(true)
                .createdAt(clock.instant())
                .build();
        applyCredits(token);

        Token saved = registry.addToken(token);
        log.info("新增 Token {} ({}), ST: {}", saved.getId(), saved.getEmail(), SecretMasker.mask(st));

        try {
            ensureProject(saved);
        } catch (FlowgateException e) {
            // 首次使用时会再次尝试创建
            log.warn("Token {} 创建项目失败: {}", saved.getId(), e.getMessage());
        }
        concurrencyManager.registerToken(saved);
        return registry.findToken(saved.getId()).orElse(saved);
    }

    /**
     * 批量导入 ST：按邮箱去重，已存在的账号更新 ST/AT 并重新启用，否则新增。
     */
    public ImportResult importTokens(List<String> sessionTokens) {
        List<Long> added = new ArrayList<>();
        List<Long> updated = new ArrayList<>();
        List<String> failed = new ArrayList<>();

        for (String raw : sessionTokens) {
            String st = raw == null ? "" : raw.trim();
            if (st.isEmpty()) {
                continue;
            }
            try {
                AccessGrant grant = exchange(st);
                Optional<Token> existing = grant.getEmail() == null
                        ? registry.findTokenBySessionToken(st)
                        : registry.findTokenByEmail(grant.getEmail());
                if (existing.isPresent()) {
                    Token merged = existing.get().toBuilder()
                            .sessionToken(st)
                            .accessToken(grant.getAccessToken())
                            .accessTokenExpires(grant.getExpires())
                            .build();
                    registry.updateToken(merged);
                    healthService.enable(merged.getId());
                    updated.add(merged.getId());
                } else {
                    added.add(addToken(Token.builder().sessionToken(st).build()).getId());
                }
            } catch (FlowgateException e) {
                log.warn("导入 Token 失败 (ST: {}): {}", SecretMasker.mask(st), e.getMessage());
                failed.add(SecretMasker.mask(st));
            }
        }

        log.info("Token 导入完成: 新增 {}, 更新 {}, 失败 {}", added.size(), updated.size(), failed.size());
        return new ImportResult(added, updated, failed);
    }

    // ==================== 修改 / 删除 ====================

    /**
     * 修改可编辑字段：备注、能力开关、并发上限、ST。ST 变化时清空 AT 以触发重新换取。
     */
    public Token updateToken(long tokenId, Token patch) {
        Token current = require(tokenId);
        Token.TokenBuilder builder = current.toBuilder()
                .remark(patch.getRemark() != null ? patch.getRemark() : current.getRemark())
                .imageEnabled(patch.isImageEnabled())
                .videoEnabled(patch.isVideoEnabled())
                .imageConcurrency(patch.getImageConcurrency())
                .videoConcurrency(patch.getVideoConcurrency());

        String newSt = patch.getSessionToken();
        if (newSt != null && !newSt.isBlank() && !newSt.trim().equals(current.getSessionToken())) {
            builder.sessionToken(newSt.trim()).accessToken(null).accessTokenExpires(null);
        }

        Token updated = builder.build();
        registry.updateToken(updated);
        concurrencyManager.registerToken(updated);
        log.info("Token {} 已更新", tokenId);
        return updated;
    }

    public void deleteToken(long tokenId) {
        require(tokenId);
        registry.deleteToken(tokenId);
        concurrencyManager.forgetToken(tokenId);
        projectLocks.remove(tokenId);
        log.info("Token {} 已删除", tokenId);
    }

    // ==================== 凭证 / 余额 ====================

    /**
     * 手动刷新 AT。
     */
    public Token refreshAccessToken(long tokenId) {
        Token token = require(tokenId);
        if (!healthService.refreshAccessToken(token)) {
            throw new CredentialException("AT 刷新失败，请检查 ST 是否有效");
        }
        return require(tokenId);
    }

    public Token refreshCredits(long tokenId) {
        if (!healthService.isAccessCredentialValid(tokenId)) {
            throw new CredentialException("AT 无效或刷新失败");
        }
        Token token = require(tokenId);
        AccountCredits credits = accountClient.getCredits(token.getAccessToken());
        registry.updateCredits(tokenId, credits.getCredits(), credits.getPaygateTier());
        log.info("Token {} 余额: {}, 等级: {}", tokenId, credits.getCredits(), credits.getPaygateTier());
        return require(tokenId);
    }

    // ==================== 项目 ====================

    /**
     * 确保账号已绑定项目，未绑定时在上游创建一个并保存为当前项目。
     *
     * @return 项目 ID
     */
    public String ensureProject(Token token) {
        if (hasProject(token)) {
            return token.getCurrentProjectId();
        }
        Object lock = projectLocks.computeIfAbsent(token.getId(), id -> new Object());
        synchronized (lock) {
            Token latest = require(token.getId());
            if (hasProject(latest)) {
                return latest.getCurrentProjectId();
            }

            String name = LocalDateTime.now(clock).format(PROJECT_NAME_FMT);
            String projectId = accountClient.createProject(latest.getSessionToken(), name);
            registry.addProject(ProjectBinding.builder()
                    .projectId(projectId)
                    .tokenId(latest.getId())
                    .projectName(name)
                    .createdAt(clock.instant())
                    .build());
            registry.updateCurrentProject(latest.getId(), projectId, name);
            log.info("Token {} 已创建项目: {} ({})", latest.getId(), name, projectId);
            return projectId;
        }
    }

    /**
     * 启动时把所有账号的并发上限登记到准入控制器。
     */
    public int registerAllLimits() {
        List<Token> all = registry.findAllTokens();
        all.forEach(concurrencyManager::registerToken);
        return all.size();
    }

    // ==================== 内部方法 ====================

    private AccessGrant exchange(String st) {
        try {
            AccessGrant grant = accountClient.exchangeSession(st);
            if (grant.getAccessToken() == null || grant.getAccessToken().isBlank()) {
                throw new CredentialException("ST 无效: 未能换取 AT");
            }
            return grant;
        } catch (CredentialException e) {
            throw e;
        } catch (FlowgateException e) {
            throw new CredentialException("ST 转 AT 失败: " + e.getMessage(), e);
        }
    }

    private void applyCredits(Token token) {
        try {
            AccountCredits credits = accountClient.getCredits(token.getAccessToken());
            token.setCredits(credits.getCredits());
            token.setPaygateTier(credits.getPaygateTier());
        } catch (FlowgateException e) {
            log.warn("查询余额失败 ({}): {}", token.getEmail(), e.getMessage());
        }
    }

    private Token require(long tokenId) {
        return registry.findToken(tokenId)
                .orElseThrow(() -> new ValidationException("Token 不存在: " + tokenId));
    }

    private boolean hasProject(Token token) {
        return token.getCurrentProjectId() != null && !token.getCurrentProjectId().isBlank();
    }

    /**
     * 批量导入结果。
     */
    @Value
    public static class ImportResult {
        List<Long> added;
        List<Long> updated;
        List<String> failed;
    }
}
