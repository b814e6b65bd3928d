package com.flowgate.dispatcher.settings;

import com.flowgate.dispatcher.config.DispatcherProperties;
import com.flowgate.dispatcher.registry.CredentialRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * 运行期配置的唯一持有者。
 * <p>
 * 读操作无锁；写操作串行化，每次替换版本号 +1 并持久化到注册表。
 */
@Slf4j
@Component
public class SettingsStore {

    private final CredentialRegistry registry;
    private final DispatcherProperties properties;
    private final AtomicReference<RuntimeSettings> current;

    public SettingsStore(CredentialRegistry registry, DispatcherProperties properties) {
        this.registry = registry;
        this.properties = properties;
        this.current = new AtomicReference<>(RuntimeSettings.defaults(properties));
    }

    public RuntimeSettings get() {
        return current.get();
    }

    /**
     * 整体替换配置。传入的版本号会被忽略，以当前版本 +1 写入。
     */
    public synchronized RuntimeSettings replace(RuntimeSettings next) {
        RuntimeSettings versioned = next.toBuilder()
                .version(current.get().getVersion() + 1)
                .build();
        registry.saveSettings(versioned);
        current.set(versioned);
        log.info("运行配置已更新, 版本: {}", versioned.getVersion());
        return versioned;
    }

    public synchronized RuntimeSettings update(UnaryOperator<RuntimeSettings> mutation) {
        return replace(mutation.apply(current.get()));
    }

    /**
     * 从注册表重新加载；没有持久化记录时回到启动默认值。
     */
    public synchronized RuntimeSettings reload() {
        RuntimeSettings loaded = registry.loadSettings()
                .orElseGet(() -> RuntimeSettings.defaults(properties));
        current.set(loaded);
        log.info("运行配置已加载, 版本: {}", loaded.getVersion());
        return loaded;
    }
}
