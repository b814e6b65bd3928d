package com.flowgate.ai.config;

import com.flowgate.ai.cache.BrowserDownloader;
import com.flowgate.ai.cache.CurlDownloader;
import com.flowgate.ai.cache.Downloader;
import com.flowgate.ai.cache.FileCache;
import com.flowgate.ai.cache.ProcessRunner;
import com.flowgate.ai.cache.WgetDownloader;
import com.flowgate.ai.captcha.ProofTokenProvider;
import com.flowgate.ai.captcha.YesCaptchaProofTokenProvider;
import com.flowgate.ai.client.ProxiedHttpClients;
import com.flowgate.dispatcher.settings.SettingsStore;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.net.Proxy;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * AI 模块自动配置。
 */
@Slf4j
@Configuration
@ComponentScan(basePackages = "com.flowgate.ai")
@EnableConfigurationProperties(FlowProperties.class)
public class AiModuleConfig {

    @Bean
    public OkHttpClient flowHttpClient(FlowProperties properties) {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .writeTimeout(Duration.ofSeconds(30))
                .build();
    }

    @Bean
    public ProxiedHttpClients proxiedHttpClients(OkHttpClient flowHttpClient) {
        return new ProxiedHttpClients(flowHttpClient);
    }

    @Bean
    public ProofTokenProvider proofTokenProvider(OkHttpClient flowHttpClient, FlowProperties properties) {
        FlowProperties.Captcha captcha = properties.getCaptcha();
        if ("yescaptcha".equalsIgnoreCase(captcha.getMethod())) {
            log.info("人机验证方式: YesCaptcha");
            return new YesCaptchaProofTokenProvider(flowHttpClient, captcha);
        }
        return projectId -> Optional.empty();
    }

    @Bean
    public FileCache fileCache(OkHttpClient flowHttpClient, FlowProperties properties,
                               SettingsStore settingsStore, Clock clock) {
        FlowProperties.FileCacheConfig config = properties.getFileCache();
        int timeout = config.getDownloadTimeoutSeconds();

        // 缓存下载总是直连
        OkHttpClient downloadClient = flowHttpClient.newBuilder()
                .proxy(Proxy.NO_PROXY)
                .followRedirects(true)
                .readTimeout(Duration.ofSeconds(timeout))
                .build();

        List<Downloader> chain = new ArrayList<>();
        chain.add(new BrowserDownloader(downloadClient));
        if (config.isExternalDownloadersEnabled()) {
            ProcessRunner runner = new ProcessRunner();
            chain.add(new WgetDownloader(runner, timeout));
            chain.add(new CurlDownloader(runner, timeout));
        }
        return new FileCache(Paths.get(config.getDir()), chain, config, settingsStore, clock);
    }
}
