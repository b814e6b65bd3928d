package com.flowgate.web.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowgate.common.dto.GenerationTask;
import com.flowgate.common.dto.GenerationType;
import com.flowgate.common.dto.ProjectBinding;
import com.flowgate.common.dto.ProxyPoolItem;
import com.flowgate.common.dto.RequestLog;
import com.flowgate.common.dto.TaskStatus;
import com.flowgate.common.dto.Token;
import com.flowgate.common.dto.TokenStats;
import com.flowgate.dispatcher.registry.CredentialRegistry;
import com.flowgate.dispatcher.settings.RuntimeSettings;
import com.flowgate.web.entity.ProjectEntity;
import com.flowgate.web.entity.ProxyEntity;
import com.flowgate.web.entity.RequestLogEntity;
import com.flowgate.web.entity.SettingsEntity;
import com.flowgate.web.entity.TaskEntity;
import com.flowgate.web.entity.TokenEntity;
import com.flowgate.web.entity.TokenStatsEntity;
import com.flowgate.web.repository.ProjectRepository;
import com.flowgate.web.repository.ProxyRepository;
import com.flowgate.web.repository.RequestLogRepository;
import com.flowgate.web.repository.SettingsRepository;
import com.flowgate.web.repository.TaskRepository;
import com.flowgate.web.repository.TokenRepository;
import com.flowgate.web.repository.TokenStatsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 基于 Spring Data JDBC + SQLite 的账号注册表。
 * <p>
 * 计数类更新都在 SQL 中自增，避免读-改-写覆盖并发请求的结果。
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "flowgate.dispatcher.storage-type", havingValue = "sqlite", matchIfMissing = true)
public class JdbcCredentialRegistry implements CredentialRegistry {

    private static final TypeReference<List<String>> URL_LIST = new TypeReference<>() {
    };

    private final TokenRepository tokenRepo;
    private final TokenStatsRepository statsRepo;
    private final ProjectRepository projectRepo;
    private final TaskRepository taskRepo;
    private final ProxyRepository proxyRepo;
    private final RequestLogRepository requestLogRepo;
    private final SettingsRepository settingsRepo;
    private final ObjectMapper objectMapper;

    // ==================== Token ====================

    @Override
    @Transactional
    public Token addToken(Token token) {
        TokenEntity entity = toEntity(token);
        entity.setId(null);
        if (entity.getCreatedAt() == null) {
            entity.setCreatedAt(System.currentTimeMillis());
        }
        entity = tokenRepo.save(entity);
        statsRepo.save(TokenStatsEntity.builder().tokenId(entity.getId()).build());
        return toToken(entity);
    }

    @Override
    public Optional<Token> findToken(long tokenId) {
        return tokenRepo.findById(tokenId).map(this::toToken);
    }

    @Override
    public Optional<Token> findTokenBySessionToken(String sessionToken) {
        return tokenRepo.findBySessionToken(sessionToken).map(this::toToken);
    }

    @Override
    public Optional<Token> findTokenByEmail(String email) {
        if (email == null) {
            return Optional.empty();
        }
        return tokenRepo.findFirstByEmail(email).map(this::toToken);
    }

    @Override
    public List<Token> findAllTokens() {
        return tokenRepo.findAllOrdered().stream().map(this::toToken).collect(Collectors.toList());
    }

    @Override
    public List<Token> findActiveTokens() {
        return tokenRepo.findActive().stream().map(this::toToken).collect(Collectors.toList());
    }

    @Override
    public void updateToken(Token token) {
        if (token.getId() == null || !tokenRepo.existsById(token.getId())) {
            throw new IllegalArgumentException("Token 不存在: " + token.getId());
        }
        tokenRepo.updateEditable(token.getId(),
                token.getSessionToken(),
                token.getAccessToken(),
                toMillis(token.getAccessTokenExpires()),
                token.getRemark(),
                token.isImageEnabled(),
                token.isVideoEnabled(),
                token.getImageConcurrency(),
                token.getVideoConcurrency());
    }

    @Override
    @Transactional
    public void deleteToken(long tokenId) {
        statsRepo.deleteByTokenId(tokenId);
        projectRepo.deleteByTokenId(tokenId);
        tokenRepo.deleteById(tokenId);
    }

    @Override
    public void updateAccessToken(long tokenId, String accessToken, Instant expires) {
        tokenRepo.updateAccessToken(tokenId, accessToken, toMillis(expires));
    }

    @Override
    public void updateCredits(long tokenId, int credits, String paygateTier) {
        tokenRepo.updateCredits(tokenId, credits, paygateTier);
    }

    @Override
    public void updateCurrentProject(long tokenId, String projectId, String projectName) {
        tokenRepo.updateCurrentProject(tokenId, projectId, projectName);
    }

    @Override
    public void setTokenActive(long tokenId, boolean active, String banReason, Instant bannedAt) {
        tokenRepo.updateActive(tokenId, active, banReason, toMillis(bannedAt));
    }

    @Override
    public void markTokenUsed(long tokenId, Instant usedAt) {
        tokenRepo.markUsed(tokenId, toMillis(usedAt));
    }

    // ==================== 统计 ====================

    @Override
    public TokenStats getStats(long tokenId) {
        return statsRepo.findByTokenId(tokenId).map(this::toStats).orElseGet(() -> TokenStats.empty(tokenId));
    }

    @Override
    public void incrementUsage(long tokenId, GenerationType type, LocalDate today, Instant now) {
        int updated = type == GenerationType.VIDEO
                ? statsRepo.incrementVideo(tokenId, today.toString(), toMillis(now))
                : statsRepo.incrementImage(tokenId, today.toString(), toMillis(now));
        if (updated == 0) {
            log.warn("Token {} 没有统计记录, 使用次数未记录", tokenId);
        }
    }

    @Override
    @Transactional
    public int incrementError(long tokenId, LocalDate today, Instant now) {
        statsRepo.incrementError(tokenId, today.toString(), toMillis(now));
        Integer consecutive = statsRepo.findConsecutiveErrors(tokenId);
        return consecutive == null ? 0 : consecutive;
    }

    @Override
    public void resetConsecutiveErrors(long tokenId) {
        statsRepo.resetConsecutiveErrors(tokenId);
    }

    // ==================== 项目 ====================

    @Override
    public ProjectBinding addProject(ProjectBinding project) {
        ProjectEntity saved = projectRepo.save(ProjectEntity.builder()
                .projectId(project.getProjectId())
                .tokenId(project.getTokenId())
                .projectName(project.getProjectName())
                .toolName(project.getToolName())
                .active(project.isActive())
                .createdAt(toMillis(project.getCreatedAt()))
                .build());
        return project.toBuilder().id(saved.getId()).build();
    }

    @Override
    public List<ProjectBinding> findProjectsByToken(long tokenId) {
        return projectRepo.findByTokenId(tokenId).stream()
                .map(e -> ProjectBinding.builder()
                        .id(e.getId())
                        .projectId(e.getProjectId())
                        .tokenId(e.getTokenId())
                        .projectName(e.getProjectName())
                        .toolName(e.getToolName())
                        .active(Boolean.TRUE.equals(e.getActive()))
                        .createdAt(toInstant(e.getCreatedAt()))
                        .build())
                .collect(Collectors.toList());
    }

    // ==================== 生成任务 ====================

    @Override
    public GenerationTask createTask(GenerationTask task) {
        TaskEntity entity = toEntity(task);
        entity.setId(null);
        return toTask(taskRepo.save(entity));
    }

    @Override
    public Optional<GenerationTask> findTask(String taskId) {
        return taskRepo.findByTaskId(taskId).map(this::toTask);
    }

    @Override
    public void updateTask(GenerationTask task) {
        Optional<TaskEntity> existing = taskRepo.findByTaskId(task.getTaskId());
        if (existing.isEmpty()) {
            log.warn("任务不存在, 无法更新: {}", task.getTaskId());
            return;
        }
        TaskEntity entity = toEntity(task);
        entity.setId(existing.get().getId());
        taskRepo.save(entity);
    }

    // ==================== 代理池 ====================

    @Override
    public ProxyPoolItem addProxy(ProxyPoolItem item) {
        ProxyEntity entity = toEntity(item);
        entity.setId(null);
        if (entity.getCreatedAt() == null) {
            entity.setCreatedAt(System.currentTimeMillis());
        }
        return toProxy(proxyRepo.save(entity));
    }

    @Override
    public List<ProxyPoolItem> findAllProxies() {
        return proxyRepo.findAllOrdered().stream().map(this::toProxy).collect(Collectors.toList());
    }

    @Override
    public List<ProxyPoolItem> findEnabledProxies() {
        return proxyRepo.findEnabled().stream().map(this::toProxy).collect(Collectors.toList());
    }

    @Override
    public void updateProxy(ProxyPoolItem item) {
        if (item.getId() == null || !proxyRepo.existsById(item.getId())) {
            throw new IllegalArgumentException("代理不存在: " + item.getId());
        }
        proxyRepo.save(toEntity(item));
    }

    @Override
    public void deleteProxy(long proxyId) {
        proxyRepo.deleteById(proxyId);
    }

    @Override
    public void recordProxyResult(long proxyId, boolean success, Instant usedAt) {
        if (success) {
            proxyRepo.recordSuccess(proxyId, toMillis(usedAt));
        } else {
            proxyRepo.recordFailure(proxyId, toMillis(usedAt));
        }
    }

    // ==================== 请求日志 ====================

    @Override
    public void addRequestLog(RequestLog requestLog) {
        requestLogRepo.save(RequestLogEntity.builder()
                .tokenId(requestLog.getTokenId())
                .operation(requestLog.getOperation())
                .requestBody(requestLog.getRequestBody())
                .responseBody(requestLog.getResponseBody())
                .statusCode(requestLog.getStatusCode())
                .durationMs(requestLog.getDurationMs())
                .createdAt(toMillis(requestLog.getCreatedAt()))
                .build());
    }

    @Override
    public List<RequestLog> findRecentRequestLogs(int limit) {
        return requestLogRepo.findRecent(limit).stream()
                .map(e -> RequestLog.builder()
                        .id(e.getId())
                        .tokenId(e.getTokenId())
                        .operation(e.getOperation())
                        .requestBody(e.getRequestBody())
                        .responseBody(e.getResponseBody())
                        .statusCode(e.getStatusCode() != null ? e.getStatusCode() : 0)
                        .durationMs(e.getDurationMs() != null ? e.getDurationMs() : 0)
                        .createdAt(toInstant(e.getCreatedAt()))
                        .build())
                .collect(Collectors.toList());
    }

    // ==================== 运行配置 ====================

    @Override
    public Optional<RuntimeSettings> loadSettings() {
        return settingsRepo.findById(SettingsEntity.SINGLETON_ID).flatMap(entity -> {
            try {
                return Optional.of(objectMapper.readValue(entity.getPayload(), RuntimeSettings.class));
            } catch (JsonProcessingException e) {
                log.warn("运行配置解析失败, 使用默认配置: {}", e.getMessage());
                return Optional.empty();
            }
        });
    }

    @Override
    public void saveSettings(RuntimeSettings settings) {
        try {
            settingsRepo.upsert(SettingsEntity.SINGLETON_ID, settings.getVersion(),
                    objectMapper.writeValueAsString(settings), System.currentTimeMillis());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("运行配置序列化失败", e);
        }
    }

    // ==================== 转换 ====================

    private TokenEntity toEntity(Token t) {
        return TokenEntity.builder()
                .id(t.getId())
                .sessionToken(t.getSessionToken())
                .accessToken(t.getAccessToken())
                .accessTokenExpires(toMillis(t.getAccessTokenExpires()))
                .email(t.getEmail())
                .name(t.getName())
                .remark(t.getRemark())
                .active(t.isActive())
                .createdAt(toMillis(t.getCreatedAt()))
                .lastUsedAt(toMillis(t.getLastUsedAt()))
                .useCount((int) t.getUseCount())
                .credits(t.getCredits())
                .paygateTier(t.getPaygateTier())
                .currentProjectId(t.getCurrentProjectId())
                .currentProjectName(t.getCurrentProjectName())
                .imageEnabled(t.isImageEnabled())
                .videoEnabled(t.isVideoEnabled())
                .imageConcurrency(t.getImageConcurrency())
                .videoConcurrency(t.getVideoConcurrency())
                .banReason(t.getBanReason())
                .bannedAt(toMillis(t.getBannedAt()))
                .build();
    }

    private Token toToken(TokenEntity e) {
        return Token.builder()
                .id(e.getId())
                .sessionToken(e.getSessionToken())
                .accessToken(e.getAccessToken())
                .accessTokenExpires(toInstant(e.getAccessTokenExpires()))
                .email(e.getEmail())
                .name(e.getName())
                .remark(e.getRemark())
                .active(Boolean.TRUE.equals(e.getActive()))
                .createdAt(toInstant(e.getCreatedAt()))
                .lastUsedAt(toInstant(e.getLastUsedAt()))
                .useCount(e.getUseCount() != null ? e.getUseCount() : 0)
                .credits(e.getCredits() != null ? e.getCredits() : 0)
                .paygateTier(e.getPaygateTier())
                .currentProjectId(e.getCurrentProjectId())
                .currentProjectName(e.getCurrentProjectName())
                .imageEnabled(!Boolean.FALSE.equals(e.getImageEnabled()))
                .videoEnabled(!Boolean.FALSE.equals(e.getVideoEnabled()))
                .imageConcurrency(e.getImageConcurrency() != null ? e.getImageConcurrency() : Token.UNLIMITED)
                .videoConcurrency(e.getVideoConcurrency() != null ? e.getVideoConcurrency() : Token.UNLIMITED)
                .banReason(e.getBanReason())
                .bannedAt(toInstant(e.getBannedAt()))
                .build();
    }

    private TokenStats toStats(TokenStatsEntity e) {
        return TokenStats.builder()
                .tokenId(e.getTokenId())
                .imageCount(nz(e.getImageCount()))
                .videoCount(nz(e.getVideoCount()))
                .successCount(nz(e.getSuccessCount()))
                .errorCount(nz(e.getErrorCount()))
                .lastSuccessAt(toInstant(e.getLastSuccessAt()))
                .lastErrorAt(toInstant(e.getLastErrorAt()))
                .todayImageCount(nz(e.getTodayImageCount()))
                .todayVideoCount(nz(e.getTodayVideoCount()))
                .todayErrorCount(nz(e.getTodayErrorCount()))
                .todayDate(e.getTodayDate() != null ? LocalDate.parse(e.getTodayDate()) : null)
                .consecutiveErrorCount(nz(e.getConsecutiveErrorCount()))
                .build();
    }

    private TaskEntity toEntity(GenerationTask t) {
        return TaskEntity.builder()
                .id(t.getId())
                .taskId(t.getTaskId())
                .tokenId(t.getTokenId())
                .model(t.getModel())
                .prompt(t.getPrompt())
                .status(t.getStatus().getValue())
                .progress(t.getProgress())
                .resultUrls(writeUrls(t.getResultUrls()))
                .errorMessage(t.getErrorMessage())
                .sceneId(t.getSceneId())
                .createdAt(toMillis(t.getCreatedAt()))
                .completedAt(toMillis(t.getCompletedAt()))
                .build();
    }

    private GenerationTask toTask(TaskEntity e) {
        return GenerationTask.builder()
                .id(e.getId())
                .taskId(e.getTaskId())
                .tokenId(e.getTokenId())
                .model(e.getModel())
                .prompt(e.getPrompt())
                .status(TaskStatus.fromValue(e.getStatus()))
                .progress(nz(e.getProgress()))
                .resultUrls(readUrls(e.getResultUrls()))
                .errorMessage(e.getErrorMessage())
                .sceneId(e.getSceneId())
                .createdAt(toInstant(e.getCreatedAt()))
                .completedAt(toInstant(e.getCompletedAt()))
                .build();
    }

    private ProxyEntity toEntity(ProxyPoolItem p) {
        return ProxyEntity.builder()
                .id(p.getId())
                .proxyUrl(p.getProxyUrl())
                .name(p.getName())
                .enabled(p.isEnabled())
                .successCount((int) p.getSuccessCount())
                .failCount((int) p.getFailCount())
                .lastUsedAt(toMillis(p.getLastUsedAt()))
                .createdAt(toMillis(p.getCreatedAt()))
                .build();
    }

    private ProxyPoolItem toProxy(ProxyEntity e) {
        return ProxyPoolItem.builder()
                .id(e.getId())
                .proxyUrl(e.getProxyUrl())
                .name(e.getName())
                .enabled(Boolean.TRUE.equals(e.getEnabled()))
                .successCount(nz(e.getSuccessCount()))
                .failCount(nz(e.getFailCount()))
                .lastUsedAt(toInstant(e.getLastUsedAt()))
                .createdAt(toInstant(e.getCreatedAt()))
                .build();
    }

    private String writeUrls(List<String> urls) {
        try {
            return objectMapper.writeValueAsString(urls == null ? List.of() : urls);
        } catch (JsonProcessingException e) {
            log.warn("结果地址序列化失败", e);
            return "[]";
        }
    }

    private List<String> readUrls(String json) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(objectMapper.readValue(json, URL_LIST));
        } catch (JsonProcessingException e) {
            log.warn("结果地址解析失败: {}", json);
            return new ArrayList<>();
        }
    }

    private static Long toMillis(Instant instant) {
        return instant == null ? null : instant.toEpochMilli();
    }

    private static Instant toInstant(Long millis) {
        return millis == null ? null : Instant.ofEpochMilli(millis);
    }

    private static int nz(Integer value) {
        return value == null ? 0 : value;
    }
}
