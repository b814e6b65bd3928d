package com.flowgate.web.controller;

import com.flowgate.ai.cache.FileCache;
import com.flowgate.common.dto.ApiResponse;
import com.flowgate.common.dto.GenerationTask;
import com.flowgate.common.dto.ProxyPoolItem;
import com.flowgate.common.dto.RequestLog;
import com.flowgate.common.dto.Token;
import com.flowgate.common.exception.ValidationException;
import com.flowgate.dispatcher.registry.CredentialRegistry;
import com.flowgate.dispatcher.service.TokenHealthService;
import com.flowgate.dispatcher.service.TokenService;
import com.flowgate.dispatcher.settings.RuntimeSettings;
import com.flowgate.dispatcher.settings.SettingsStore;
import com.flowgate.web.dto.ProxyRequest;
import com.flowgate.web.dto.TokenRequest;
import com.flowgate.web.dto.TokenView;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 管理接口：账号池、代理池、运行配置、缓存与日志。
 */
@Slf4j
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminController {

    private static final int MAX_LOG_LIMIT = 500;

    private final TokenService tokenService;
    private final TokenHealthService healthService;
    private final CredentialRegistry registry;
    private final SettingsStore settingsStore;
    private final FileCache fileCache;
    private final Clock clock;

    // ======================== 账号 ========================

    @GetMapping("/tokens")
    public ApiResponse<List<TokenView>> listTokens() {
        List<TokenView> views = registry.findAllTokens().stream()
                .map(token -> TokenView.of(token, registry.getStats(token.getId())))
                .collect(Collectors.toList());
        return ApiResponse.ok(views);
    }

    @PostMapping("/tokens")
    public ApiResponse<TokenView> addToken(@RequestBody TokenRequest request) {
        Token saved = tokenService.addToken(request.toDraft(Token.builder().build()));
        return ApiResponse.ok(TokenView.of(saved, registry.getStats(saved.getId())), "Token 添加成功");
    }

    /**
     * 批量导入 ST，请求体为 {"tokens": ["st1", "st2"]}。
     */
    @PostMapping("/tokens/import")
    public ApiResponse<TokenService.ImportResult> importTokens(@RequestBody Map<String, List<String>> body) {
        List<String> tokens = body.get("tokens");
        if (tokens == null || tokens.isEmpty()) {
            throw new ValidationException("tokens 不能为空");
        }
        return ApiResponse.ok(tokenService.importTokens(tokens));
    }

    @PutMapping("/tokens/{id}")
    public ApiResponse<TokenView> updateToken(@PathVariable long id, @RequestBody TokenRequest request) {
        Token current = registry.findToken(id)
                .orElseThrow(() -> new ValidationException("Token 不存在: " + id));
        Token updated = tokenService.updateToken(id, request.toDraft(current));
        return ApiResponse.ok(TokenView.of(updated, registry.getStats(id)), "Token 已更新");
    }

    @DeleteMapping("/tokens/{id}")
    public ApiResponse<Void> deleteToken(@PathVariable long id) {
        tokenService.deleteToken(id);
        return ApiResponse.ok(null, "Token 已删除");
    }

    @PostMapping("/tokens/{id}/enable")
    public ApiResponse<Void> enableToken(@PathVariable long id) {
        requireToken(id);
        healthService.enable(id);
        return ApiResponse.ok(null, "Token 已启用");
    }

    @PostMapping("/tokens/{id}/disable")
    public ApiResponse<Void> disableToken(@PathVariable long id) {
        requireToken(id);
        healthService.disable(id);
        return ApiResponse.ok(null, "Token 已禁用");
    }

    @PostMapping("/tokens/{id}/refresh-at")
    public ApiResponse<TokenView> refreshAccessToken(@PathVariable long id) {
        Token token = tokenService.refreshAccessToken(id);
        return ApiResponse.ok(TokenView.of(token, registry.getStats(id)), "AT 已刷新");
    }

    @PostMapping("/tokens/{id}/refresh-credits")
    public ApiResponse<TokenView> refreshCredits(@PathVariable long id) {
        Token token = tokenService.refreshCredits(id);
        return ApiResponse.ok(TokenView.of(token, registry.getStats(id)), "余额已刷新");
    }

    // ======================== 代理池 ========================

    @GetMapping("/proxies")
    public ApiResponse<List<ProxyPoolItem>> listProxies() {
        return ApiResponse.ok(registry.findAllProxies());
    }

    @PostMapping("/proxies")
    public ApiResponse<ProxyPoolItem> addProxy(@RequestBody ProxyRequest request) {
        String url = request.getProxyUrl() == null ? "" : request.getProxyUrl().trim();
        if (!url.startsWith("http://") && !url.startsWith("https://") && !url.startsWith("socks5://")) {
            throw new ValidationException("代理地址格式错误，仅支持 http/https/socks5");
        }
        ProxyPoolItem saved = registry.addProxy(ProxyPoolItem.builder()
                .proxyUrl(url)
                .name(request.getName())
                .createdAt(clock.instant())
                .build());
        log.info("新增代理 {}: {}", saved.getId(), saved.getName());
        return ApiResponse.ok(saved, "代理已添加");
    }

    @PostMapping("/proxies/{id}/toggle")
    public ApiResponse<ProxyPoolItem> toggleProxy(@PathVariable long id) {
        ProxyPoolItem current = registry.findAllProxies().stream()
                .filter(p -> p.getId() == id)
                .findFirst()
                .orElseThrow(() -> new ValidationException("代理不存在: " + id));
        ProxyPoolItem toggled = current.toBuilder().enabled(!current.isEnabled()).build();
        registry.updateProxy(toggled);
        return ApiResponse.ok(toggled, toggled.isEnabled() ? "代理已启用" : "代理已停用");
    }

    @DeleteMapping("/proxies/{id}")
    public ApiResponse<Void> deleteProxy(@PathVariable long id) {
        registry.deleteProxy(id);
        return ApiResponse.ok(null, "代理已删除");
    }

    // ======================== 运行配置 ========================

    @GetMapping("/settings")
    public ApiResponse<RuntimeSettings> getSettings() {
        return ApiResponse.ok(settingsStore.get());
    }

    @PutMapping("/settings")
    public ApiResponse<RuntimeSettings> replaceSettings(@RequestBody RuntimeSettings settings) {
        if (settings.getMaxPollAttempts() <= 0) {
            throw new ValidationException("maxPollAttempts 必须大于 0");
        }
        if (settings.getCacheTimeoutSeconds() <= 0) {
            throw new ValidationException("cacheTimeoutSeconds 必须大于 0");
        }
        return ApiResponse.ok(settingsStore.replace(settings), "配置已保存");
    }

    @PostMapping("/settings/reload")
    public ApiResponse<RuntimeSettings> reloadSettings() {
        return ApiResponse.ok(settingsStore.reload(), "配置已重新加载");
    }

    // ======================== 缓存 / 日志 / 任务 ========================

    @PostMapping("/cache/clear")
    public ApiResponse<Integer> clearCache() {
        int removed = fileCache.clearAll();
        log.info("手动清空缓存, 删除 {} 个文件", removed);
        return ApiResponse.ok(removed, "缓存已清空");
    }

    @GetMapping("/logs")
    public ApiResponse<List<RequestLog>> recentLogs(@RequestParam(defaultValue = "100") int limit) {
        int capped = Math.max(1, Math.min(limit, MAX_LOG_LIMIT));
        return ApiResponse.ok(registry.findRecentRequestLogs(capped));
    }

    @GetMapping("/tasks/{taskId}")
    public ApiResponse<GenerationTask> getTask(@PathVariable String taskId) {
        return registry.findTask(taskId)
                .map(ApiResponse::ok)
                .orElseThrow(() -> new ValidationException("任务不存在: " + taskId));
    }

    private void requireToken(long id) {
        if (registry.findToken(id).isEmpty()) {
            throw new ValidationException("Token 不存在: " + id);
        }
    }
}
