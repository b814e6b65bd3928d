package com.flowgate.ai.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Flow 上游接口与结果缓存配置项。
 */
@Data
@ConfigurationProperties(prefix = "flowgate.flow")
public class FlowProperties {

    /** 认证、项目接口地址 */
    private String labsBaseUrl = "https://labs.google/fx/api";

    /** 生成接口地址 */
    private String apiBaseUrl = "https://aisandbox-pa.googleapis.com/v1";

    /** 单次上游调用的超时时间（秒） */
    private int requestTimeoutSeconds = 120;

    /** 人机验证 */
    private Captcha captcha = new Captcha();

    /** 结果文件缓存 */
    private FileCacheConfig fileCache = new FileCacheConfig();

    @Data
    public static class Captcha {
        /** none / yescaptcha */
        private String method = "none";
        private String yescaptchaApiKey = "";
        private String yescaptchaBaseUrl = "https://api.yescaptcha.com";
        private String websiteKey = "6LdsFiUsAAAAAIjVDZcuLhaHiDn5nnHVXVRQGeMV";
        private String pageAction = "FLOW_GENERATION";
        /** 查询打码结果的最大次数 */
        private int maxPollAttempts = 40;
        private long pollIntervalMillis = 3000;
    }

    @Data
    public static class FileCacheConfig {
        /** 缓存目录 */
        private String dir = "tmp";
        /** 过期文件清理间隔（秒） */
        private long cleanupIntervalSeconds = 300;
        /** 403 时整条下载链的最大尝试次数 */
        private int maxForbiddenAttempts = 3;
        /** 403 重试前的等待时间（毫秒） */
        private long forbiddenBackoffMillis = 1000;
        /** 单个下载器的超时时间（秒） */
        private int downloadTimeoutSeconds = 60;
        /** 是否启用 wget / curl 外部下载器 */
        private boolean externalDownloadersEnabled = true;
    }
}
