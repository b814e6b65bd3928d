package com.flowgate.dispatcher.config;

import com.flowgate.dispatcher.client.SessionRenewer;
import com.flowgate.dispatcher.concurrency.ConcurrencyManager;
import com.flowgate.dispatcher.concurrency.InMemoryConcurrencyManager;
import com.flowgate.dispatcher.registry.CredentialRegistry;
import com.flowgate.dispatcher.registry.InMemoryCredentialRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Optional;

/**
 * 调度模块自动配置。
 * <p>
 * 通过 {@code flowgate.dispatcher.storage-type} 切换注册表实现：
 * <ul>
 *   <li>{@code sqlite}（默认）：由 web 模块提供 JDBC 实现</li>
 *   <li>{@code memory}：纯内存，重启丢失，适合试用与测试</li>
 * </ul>
 * 并发计数与代理游标始终在本进程内存中。
 */
@Slf4j
@Configuration
@ComponentScan(basePackages = "com.flowgate.dispatcher")
@EnableConfigurationProperties(DispatcherProperties.class)
public class DispatcherModuleConfig {

    @Bean
    @ConditionalOnProperty(name = "flowgate.dispatcher.storage-type", havingValue = "memory")
    public CredentialRegistry inMemoryCredentialRegistry() {
        log.info("使用内存注册表（数据不持久化）");
        return new InMemoryCredentialRegistry();
    }

    @Bean
    public ConcurrencyManager concurrencyManager() {
        return new InMemoryConcurrencyManager();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    @ConditionalOnMissingBean
    public SessionRenewer sessionRenewer() {
        return token -> {
            log.debug("未配置 ST 续期方式, Token {} 无法自动续期", token.getId());
            return Optional.empty();
        };
    }
}
