package com.flowgate.config;

import com.flowgate.dispatcher.registry.CredentialRegistry;
import com.flowgate.dispatcher.service.TokenService;
import com.flowgate.dispatcher.settings.SettingsStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * 启动初始化：加载运行配置、登记账号并发上限，账号池为空时从配置导入 ST。
 * <p>
 * 配置方式（在 application.yml 中）：
 * flowgate.session-tokens=st1,st2
 * <p>
 * 或通过环境变量：FLOWGATE_SESSION_TOKENS=st1,st2
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FlowgateInitializer implements CommandLineRunner {

    private final SettingsStore settingsStore;
    private final TokenService tokenService;
    private final CredentialRegistry registry;

    @Value("${flowgate.session-tokens:}")
    private String sessionTokensConfig;

    @Override
    public void run(String... args) {
        settingsStore.reload();
        int registered = tokenService.registerAllLimits();
        log.info("已登记 {} 个账号的并发上限", registered);

        if (!registry.findAllTokens().isEmpty()) {
            log.info("账号池中已有 {} 个 Token，跳过初始化导入", registered);
            return;
        }
        if (sessionTokensConfig == null || sessionTokensConfig.isBlank()) {
            log.warn("==============================================");
            log.warn("  账号池为空！");
            log.warn("  可通过管理接口 POST /api/admin/tokens 添加，");
            log.warn("  或在 application.yml 中设置 flowgate.session-tokens");
            log.warn("==============================================");
            return;
        }

        List<String> tokens = Arrays.stream(sessionTokensConfig.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
        TokenService.ImportResult result = tokenService.importTokens(tokens);
        log.info("启动导入 Token: 新增 {}, 失败 {}", result.getAdded().size(), result.getFailed().size());
    }
}
