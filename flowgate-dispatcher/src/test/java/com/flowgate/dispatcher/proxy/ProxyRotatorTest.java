package com.flowgate.dispatcher.proxy;

import com.flowgate.common.dto.ProxyPoolItem;
import com.flowgate.dispatcher.config.DispatcherProperties;
import com.flowgate.dispatcher.registry.InMemoryCredentialRegistry;
import com.flowgate.dispatcher.settings.SettingsStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProxyRotatorTest {

    private InMemoryCredentialRegistry registry;
    private SettingsStore settingsStore;
    private ProxyRotator rotator;

    @BeforeEach
    void setUp() {
        registry = new InMemoryCredentialRegistry();
        settingsStore = new SettingsStore(registry, new DispatcherProperties());
        rotator = new ProxyRotator(registry, settingsStore,
                Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC));
    }

    private ProxyPoolItem addProxy(String name) {
        return registry.addProxy(ProxyPoolItem.builder()
                .name(name)
                .proxyUrl("http://" + name + ":8080")
                .build());
    }

    @Test
    @DisplayName("代理池按顺序轮询并回到开头")
    void roundRobinOverEnabledProxies() {
        addProxy("p1");
        addProxy("p2");
        addProxy("p3");
        settingsStore.update(s -> s.toBuilder().proxyPoolEnabled(true).build());

        List<String> picked = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            picked.add(rotator.next().map(ProxySelection::getProxyUrl).orElse(null));
        }

        assertThat(picked).containsExactly("http://p1:8080", "http://p2:8080", "http://p3:8080", "http://p1:8080");
    }

    @Test
    @DisplayName("停用的代理不参与轮询")
    void skipsDisabledProxies() {
        addProxy("p1");
        ProxyPoolItem p2 = addProxy("p2");
        registry.updateProxy(p2.toBuilder().enabled(false).build());
        settingsStore.update(s -> s.toBuilder().proxyPoolEnabled(true).build());

        assertThat(rotator.next().map(ProxySelection::getProxyUrl)).contains("http://p1:8080");
        assertThat(rotator.next().map(ProxySelection::getProxyUrl)).contains("http://p1:8080");
    }

    @Test
    @DisplayName("代理池为空时直连")
    void emptyPoolFallsBackToDirect() {
        settingsStore.update(s -> s.toBuilder().proxyPoolEnabled(true).build());

        assertThat(rotator.next()).isEmpty();
    }

    @Test
    @DisplayName("单代理模式返回静态地址，池模式优先")
    void singleProxyModeAndPoolPrecedence() {
        addProxy("p1");
        settingsStore.update(s -> s.toBuilder().proxyEnabled(true).proxyUrl("socks5://static:1080").build());

        ProxySelection single = rotator.next().orElseThrow();
        assertThat(single.getProxyUrl()).isEqualTo("socks5://static:1080");
        assertThat(single.fromPool()).isFalse();

        settingsStore.update(s -> s.toBuilder().proxyPoolEnabled(true).build());
        assertThat(rotator.next().map(ProxySelection::getProxyUrl)).contains("http://p1:8080");
    }

    @Test
    @DisplayName("记录代理池条目的成功与失败次数")
    void recordsPoolResults() {
        ProxyPoolItem p1 = addProxy("p1");
        settingsStore.update(s -> s.toBuilder().proxyPoolEnabled(true).build());

        ProxySelection selection = rotator.next().orElseThrow();
        rotator.recordResult(selection, true);
        rotator.recordResult(selection, false);
        rotator.recordResult(new ProxySelection(null, "http://static"), false);

        ProxyPoolItem stored = registry.findAllProxies().get(0);
        assertThat(stored.getId()).isEqualTo(p1.getId());
        assertThat(stored.getSuccessCount()).isEqualTo(1);
        assertThat(stored.getFailCount()).isEqualTo(1);
        assertThat(stored.getLastUsedAt()).isEqualTo(Instant.parse("2025-03-01T10:00:00Z"));
    }
}
