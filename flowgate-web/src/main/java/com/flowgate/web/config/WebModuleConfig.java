package com.flowgate.web.config;

import com.flowgate.ai.cache.FileCache;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.relational.core.dialect.Dialect;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web 模块配置。
 */
@Configuration
@ComponentScan(basePackages = "com.flowgate.web")
@RequiredArgsConstructor
public class WebModuleConfig implements WebMvcConfigurer {

    private final ApiKeyInterceptor apiKeyInterceptor;
    private final FileCache fileCache;

    /**
     * Spring Data JDBC 不能识别 SQLite，需手动提供方言。
     */
    @Bean
    public Dialect jdbcDialect() {
        return SqliteDialect.INSTANCE;
    }

    /**
     * 流式生成使用的线程池，单个视频任务可能持续数分钟。
     */
    @Bean
    public ThreadPoolTaskExecutor generationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(32);
        executor.setMaxPoolSize(64);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("generation-");
        return executor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(apiKeyInterceptor)
                .addPathPatterns("/v1/**", "/api/admin/**");
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        String location = fileCache.getDirectory().toAbsolutePath().toUri().toString();
        registry.addResourceHandler("/tmp/**")
                .addResourceLocations(location.endsWith("/") ? location : location + "/");
    }
}
