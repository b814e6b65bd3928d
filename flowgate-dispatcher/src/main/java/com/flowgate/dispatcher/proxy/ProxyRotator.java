package com.flowgate.dispatcher.proxy;

import com.flowgate.common.dto.ProxyPoolItem;
import com.flowgate.dispatcher.registry.CredentialRegistry;
import com.flowgate.dispatcher.settings.RuntimeSettings;
import com.flowgate.dispatcher.settings.SettingsStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 出口代理轮换。
 * <p>
 * 代理池模式：在启用的代理中按 id 顺序轮询，游标受锁保护；
 * 单代理模式：返回静态配置的代理地址；两者由 proxyPoolEnabled 互斥切换。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProxyRotator {

    private final CredentialRegistry registry;
    private final SettingsStore settingsStore;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private int cursor = 0;

    /**
     * 取下一个出口代理，不使用代理时返回 empty。
     */
    public Optional<ProxySelection> next() {
        RuntimeSettings settings = settingsStore.get();
        if (settings.isProxyPoolEnabled()) {
            return nextFromPool();
        }
        if (settings.isProxyEnabled() && settings.getProxyUrl() != null && !settings.getProxyUrl().isBlank()) {
            return Optional.of(new ProxySelection(null, settings.getProxyUrl().trim()));
        }
        return Optional.empty();
    }

    /**
     * 记录代理使用结果，仅对代理池条目生效。
     */
    public void recordResult(ProxySelection selection, boolean success) {
        if (selection == null || !selection.fromPool()) {
            return;
        }
        try {
            registry.recordProxyResult(selection.getPoolItemId(), success, clock.instant());
        } catch (RuntimeException e) {
            log.warn("记录代理使用结果失败: id={}, {}", selection.getPoolItemId(), e.getMessage());
        }
        if (!success) {
            log.warn("代理请求失败: {}", selection.getProxyUrl());
        }
    }

    private Optional<ProxySelection> nextFromPool() {
        lock.lock();
        try {
            List<ProxyPoolItem> enabled = registry.findEnabledProxies();
            if (enabled.isEmpty()) {
                log.warn("代理池模式已开启，但没有启用的代理，直连请求");
                return Optional.empty();
            }
            int index = Math.floorMod(cursor, enabled.size());
            cursor = index + 1;
            ProxyPoolItem item = enabled.get(index);
            log.debug("代理池轮换: #{} {}", item.getId(), item.getName());
            return Optional.of(new ProxySelection(item.getId(), item.getProxyUrl()));
        } finally {
            lock.unlock();
        }
    }
}
