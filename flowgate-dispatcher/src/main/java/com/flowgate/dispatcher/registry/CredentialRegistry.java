package com.flowgate.dispatcher.registry;

import com.flowgate.common.dto.GenerationTask;
import com.flowgate.common.dto.GenerationType;
import com.flowgate.common.dto.ProjectBinding;
import com.flowgate.common.dto.ProxyPoolItem;
import com.flowgate.common.dto.RequestLog;
import com.flowgate.common.dto.Token;
import com.flowgate.common.dto.TokenStats;
import com.flowgate.dispatcher.settings.RuntimeSettings;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * 账号注册表：Token、统计、项目绑定、生成任务、代理池与运行配置的持久化。
 * <p>
 * 纯数据访问，不含任何策略。单个方法在行粒度上保证原子性。
 * 提供两种实现：
 * - {@link InMemoryCredentialRegistry}：内存实现，重启丢失
 * - JDBC 实现（web 模块）：SQLite 持久化，默认
 */
public interface CredentialRegistry {

    // ==================== Token ====================

    /**
     * 新增 Token，同时创建一条空统计记录。
     *
     * @return 带主键的 Token
     */
    Token addToken(Token token);

    Optional<Token> findToken(long tokenId);

    Optional<Token> findTokenBySessionToken(String sessionToken);

    Optional<Token> findTokenByEmail(String email);

    List<Token> findAllTokens();

    /** is_active = true 的 Token */
    List<Token> findActiveTokens();

    /**
     * 更新可编辑字段：ST、AT 及过期时间、备注、能力开关与并发上限。
     * <p>
     * 启用状态、封禁信息、使用记录、余额和当前项目只通过各自的专用方法修改，这里不会覆盖。
     */
    void updateToken(Token token);

    /** 删除 Token 及其统计和项目绑定 */
    void deleteToken(long tokenId);

    void updateAccessToken(long tokenId, String accessToken, Instant expires);

    void updateCredits(long tokenId, int credits, String paygateTier);

    void updateCurrentProject(long tokenId, String projectId, String projectName);

    /**
     * 修改启用状态。启用时 banReason/bannedAt 传 null 以清除封禁信息。
     */
    void setTokenActive(long tokenId, boolean active, String banReason, Instant bannedAt);

    /** use_count + 1，更新 last_used_at */
    void markTokenUsed(long tokenId, Instant usedAt);

    // ==================== 统计 ====================

    /** 不存在时返回全 0 的统计 */
    TokenStats getStats(long tokenId);

    /**
     * 记录一次成功生成：累计与当日的图片/视频计数 +1，成功数 +1。
     * 存储的日期与 today 不同时先清零当日计数。
     */
    void incrementUsage(long tokenId, GenerationType type, LocalDate today, Instant now);

    /**
     * 记录一次错误：累计、当日、连续错误数各 +1（当日计数按日期翻转）。
     *
     * @return 递增后的连续错误数
     */
    int incrementError(long tokenId, LocalDate today, Instant now);

    void resetConsecutiveErrors(long tokenId);

    // ==================== 项目 ====================

    ProjectBinding addProject(ProjectBinding project);

    List<ProjectBinding> findProjectsByToken(long tokenId);

    // ==================== 生成任务 ====================

    GenerationTask createTask(GenerationTask task);

    Optional<GenerationTask> findTask(String taskId);

    void updateTask(GenerationTask task);

    // ==================== 代理池 ====================

    ProxyPoolItem addProxy(ProxyPoolItem item);

    /** 按 id 升序 */
    List<ProxyPoolItem> findAllProxies();

    /** 启用的代理，按 id 升序（轮换顺序） */
    List<ProxyPoolItem> findEnabledProxies();

    void updateProxy(ProxyPoolItem item);

    void deleteProxy(long proxyId);

    void recordProxyResult(long proxyId, boolean success, Instant usedAt);

    // ==================== 请求日志 ====================

    void addRequestLog(RequestLog requestLog);

    List<RequestLog> findRecentRequestLogs(int limit);

    // ==================== 运行配置 ====================

    Optional<RuntimeSettings> loadSettings();

    void saveSettings(RuntimeSettings settings);
}
