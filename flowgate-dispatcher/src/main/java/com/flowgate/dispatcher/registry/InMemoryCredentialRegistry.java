package com.flowgate.dispatcher.registry;

import com.flowgate.common.dto.GenerationTask;
import com.flowgate.common.dto.GenerationType;
import com.flowgate.common.dto.ProjectBinding;
import com.flowgate.common.dto.ProxyPoolItem;
import com.flowgate.common.dto.RequestLog;
import com.flowgate.common.dto.Token;
import com.flowgate.common.dto.TokenStats;
import com.flowgate.dispatcher.settings.RuntimeSettings;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * 基于内存的注册表实现。
 * <p>
 * 所有方法以 this 为锁串行执行，返回值均为副本，调用方修改不影响内部状态。
 * 适用于单机轻量部署与测试，重启后数据丢失。
 */
@Slf4j
public class InMemoryCredentialRegistry implements CredentialRegistry {

    private static final int MAX_REQUEST_LOGS = 1000;

    private final Map<Long, Token> tokens = new LinkedHashMap<>();
    private final Map<Long, TokenStats> stats = new LinkedHashMap<>();
    private final Map<Long, ProjectBinding> projects = new LinkedHashMap<>();
    private final Map<String, GenerationTask> tasks = new LinkedHashMap<>();
    private final Map<Long, ProxyPoolItem> proxies = new LinkedHashMap<>();
    private final List<RequestLog> requestLogs = new ArrayList<>();
    private RuntimeSettings settings;

    private final AtomicLong tokenSeq = new AtomicLong();
    private final AtomicLong projectSeq = new AtomicLong();
    private final AtomicLong taskSeq = new AtomicLong();
    private final AtomicLong proxySeq = new AtomicLong();
    private final AtomicLong logSeq = new AtomicLong();

    // ==================== Token ====================

    @Override
    public synchronized Token addToken(Token token) {
        Token saved = token.toBuilder()
                .id(tokenSeq.incrementAndGet())
                .createdAt(token.getCreatedAt() != null ? token.getCreatedAt() : Instant.now())
                .build();
        tokens.put(saved.getId(), saved);
        stats.put(saved.getId(), TokenStats.empty(saved.getId()));
        return copy(saved);
    }

    @Override
    public synchronized Optional<Token> findToken(long tokenId) {
        return Optional.ofNullable(tokens.get(tokenId)).map(this::copy);
    }

    @Override
    public synchronized Optional<Token> findTokenBySessionToken(String sessionToken) {
        return tokens.values().stream()
                .filter(t -> t.getSessionToken() != null && t.getSessionToken().equals(sessionToken))
                .findFirst()
                .map(this::copy);
    }

    @Override
    public synchronized Optional<Token> findTokenByEmail(String email) {
        return tokens.values().stream()
                .filter(t -> t.getEmail() != null && t.getEmail().equalsIgnoreCase(email))
                .findFirst()
                .map(this::copy);
    }

    @Override
    public synchronized List<Token> findAllTokens() {
        return tokens.values().stream().map(this::copy).collect(Collectors.toList());
    }

    @Override
    public synchronized List<Token> findActiveTokens() {
        return tokens.values().stream()
                .filter(Token::isActive)
                .map(this::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized void updateToken(Token token) {
        if (token.getId() == null || !tokens.containsKey(token.getId())) {
            throw new IllegalArgumentException("Token 不存在: " + token.getId());
        }
        Token current = tokens.get(token.getId());
        tokens.put(token.getId(), current.toBuilder()
                .sessionToken(token.getSessionToken())
                .accessToken(token.getAccessToken())
                .accessTokenExpires(token.getAccessTokenExpires())
                .remark(token.getRemark())
                .imageEnabled(token.isImageEnabled())
                .videoEnabled(token.isVideoEnabled())
                .imageConcurrency(token.getImageConcurrency())
                .videoConcurrency(token.getVideoConcurrency())
                .build());
    }

    @Override
    public synchronized void deleteToken(long tokenId) {
        tokens.remove(tokenId);
        stats.remove(tokenId);
        projects.values().removeIf(p -> p.getTokenId() != null && p.getTokenId() == tokenId);
    }

    @Override
    public synchronized void updateAccessToken(long tokenId, String accessToken, Instant expires) {
        modify(tokenId, t -> {
            t.setAccessToken(accessToken);
            t.setAccessTokenExpires(expires);
        });
    }

    @Override
    public synchronized void updateCredits(long tokenId, int credits, String paygateTier) {
        modify(tokenId, t -> {
            t.setCredits(credits);
            t.setPaygateTier(paygateTier);
        });
    }

    @Override
    public synchronized void updateCurrentProject(long tokenId, String projectId, String projectName) {
        modify(tokenId, t -> {
            t.setCurrentProjectId(projectId);
            t.setCurrentProjectName(projectName);
        });
    }

    @Override
    public synchronized void setTokenActive(long tokenId, boolean active, String banReason, Instant bannedAt) {
        modify(tokenId, t -> {
            t.setActive(active);
            t.setBanReason(banReason);
            t.setBannedAt(bannedAt);
        });
    }

    @Override
    public synchronized void markTokenUsed(long tokenId, Instant usedAt) {
        modify(tokenId, t -> {
            t.setUseCount(t.getUseCount() + 1);
            t.setLastUsedAt(usedAt);
        });
    }

    // ==================== 统计 ====================

    @Override
    public synchronized TokenStats getStats(long tokenId) {
        TokenStats s = stats.get(tokenId);
        return s != null ? s.toBuilder().build() : TokenStats.empty(tokenId);
    }

    @Override
    public synchronized void incrementUsage(long tokenId, GenerationType type, LocalDate today, Instant now) {
        TokenStats s = rolledOver(tokenId, today);
        if (type == GenerationType.IMAGE) {
            s.setImageCount(s.getImageCount() + 1);
            s.setTodayImageCount(s.getTodayImageCount() + 1);
        } else {
            s.setVideoCount(s.getVideoCount() + 1);
            s.setTodayVideoCount(s.getTodayVideoCount() + 1);
        }
        s.setSuccessCount(s.getSuccessCount() + 1);
        s.setLastSuccessAt(now);
    }

    @Override
    public synchronized int incrementError(long tokenId, LocalDate today, Instant now) {
        TokenStats s = rolledOver(tokenId, today);
        s.setErrorCount(s.getErrorCount() + 1);
        s.setTodayErrorCount(s.getTodayErrorCount() + 1);
        s.setConsecutiveErrorCount(s.getConsecutiveErrorCount() + 1);
        s.setLastErrorAt(now);
        return s.getConsecutiveErrorCount();
    }

    @Override
    public synchronized void resetConsecutiveErrors(long tokenId) {
        TokenStats s = stats.get(tokenId);
        if (s != null) {
            s.setConsecutiveErrorCount(0);
        }
    }

    /**
     * 取统计记录，日期变化时先清零当日计数。
     */
    private TokenStats rolledOver(long tokenId, LocalDate today) {
        TokenStats s = stats.computeIfAbsent(tokenId, TokenStats::empty);
        if (!today.equals(s.getTodayDate())) {
            s.setTodayImageCount(0);
            s.setTodayVideoCount(0);
            s.setTodayErrorCount(0);
            s.setTodayDate(today);
        }
        return s;
    }

    // ==================== 项目 ====================

    @Override
    public synchronized ProjectBinding addProject(ProjectBinding project) {
        ProjectBinding saved = ProjectBinding.builder()
                .id(projectSeq.incrementAndGet())
                .projectId(project.getProjectId())
                .tokenId(project.getTokenId())
                .projectName(project.getProjectName())
                .toolName(project.getToolName())
                .active(project.isActive())
                .createdAt(project.getCreatedAt() != null ? project.getCreatedAt() : Instant.now())
                .build();
        projects.put(saved.getId(), saved);
        return saved;
    }

    @Override
    public synchronized List<ProjectBinding> findProjectsByToken(long tokenId) {
        return projects.values().stream()
                .filter(p -> p.getTokenId() != null && p.getTokenId() == tokenId)
                .collect(Collectors.toList());
    }

    // ==================== 生成任务 ====================

    @Override
    public synchronized GenerationTask createTask(GenerationTask task) {
        GenerationTask saved = task.toBuilder()
                .id(taskSeq.incrementAndGet())
                .resultUrls(new ArrayList<>(task.getResultUrls()))
                .createdAt(task.getCreatedAt() != null ? task.getCreatedAt() : Instant.now())
                .build();
        tasks.put(saved.getTaskId(), saved);
        return saved.toBuilder().build();
    }

    @Override
    public synchronized Optional<GenerationTask> findTask(String taskId) {
        return Optional.ofNullable(tasks.get(taskId))
                .map(t -> t.toBuilder().resultUrls(new ArrayList<>(t.getResultUrls())).build());
    }

    @Override
    public synchronized void updateTask(GenerationTask task) {
        tasks.put(task.getTaskId(), task.toBuilder().resultUrls(new ArrayList<>(task.getResultUrls())).build());
    }

    // ==================== 代理池 ====================

    @Override
    public synchronized ProxyPoolItem addProxy(ProxyPoolItem item) {
        ProxyPoolItem saved = item.toBuilder()
                .id(proxySeq.incrementAndGet())
                .createdAt(item.getCreatedAt() != null ? item.getCreatedAt() : Instant.now())
                .build();
        proxies.put(saved.getId(), saved);
        return saved.toBuilder().build();
    }

    @Override
    public synchronized List<ProxyPoolItem> findAllProxies() {
        return proxies.values().stream()
                .sorted(Comparator.comparing(ProxyPoolItem::getId))
                .map(p -> p.toBuilder().build())
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<ProxyPoolItem> findEnabledProxies() {
        return proxies.values().stream()
                .filter(ProxyPoolItem::isEnabled)
                .sorted(Comparator.comparing(ProxyPoolItem::getId))
                .map(p -> p.toBuilder().build())
                .collect(Collectors.toList());
    }

    @Override
    public synchronized void updateProxy(ProxyPoolItem item) {
        proxies.put(item.getId(), item.toBuilder().build());
    }

    @Override
    public synchronized void deleteProxy(long proxyId) {
        proxies.remove(proxyId);
    }

    @Override
    public synchronized void recordProxyResult(long proxyId, boolean success, Instant usedAt) {
        ProxyPoolItem item = proxies.get(proxyId);
        if (item == null) {
            return;
        }
        if (success) {
            item.setSuccessCount(item.getSuccessCount() + 1);
        } else {
            item.setFailCount(item.getFailCount() + 1);
        }
        item.setLastUsedAt(usedAt);
    }

    // ==================== 请求日志 ====================

    @Override
    public synchronized void addRequestLog(RequestLog requestLog) {
        requestLog.setId(logSeq.incrementAndGet());
        if (requestLog.getCreatedAt() == null) {
            requestLog.setCreatedAt(Instant.now());
        }
        requestLogs.add(requestLog);
        if (requestLogs.size() > MAX_REQUEST_LOGS) {
            requestLogs.remove(0);
        }
    }

    @Override
    public synchronized List<RequestLog> findRecentRequestLogs(int limit) {
        List<RequestLog> recent = new ArrayList<>();
        for (int i = requestLogs.size() - 1; i >= 0 && recent.size() < limit; i--) {
            recent.add(requestLogs.get(i));
        }
        return recent;
    }

    // ==================== 运行配置 ====================

    @Override
    public synchronized Optional<RuntimeSettings> loadSettings() {
        return Optional.ofNullable(settings);
    }

    @Override
    public synchronized void saveSettings(RuntimeSettings settings) {
        this.settings = settings;
    }

    // ==================== 内部方法 ====================

    private void modify(long tokenId, Consumer<Token> mutation) {
        Token token = tokens.get(tokenId);
        if (token == null) {
            log.warn("Token 不存在, 忽略更新: {}", tokenId);
            return;
        }
        mutation.accept(token);
    }

    private Token copy(Token token) {
        return token.toBuilder().build();
    }
}
