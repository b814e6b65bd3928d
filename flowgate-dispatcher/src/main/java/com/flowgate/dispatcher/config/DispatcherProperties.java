package com.flowgate.dispatcher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 调度中心配置项。
 * <p>
 * 这里是启动时的默认值；运行期可修改的部分由
 * {@link com.flowgate.dispatcher.settings.SettingsStore} 持有，首次启动时以这里为准。
 */
@Data
@ConfigurationProperties(prefix = "flowgate.dispatcher")
public class DispatcherProperties {

    /** 注册表存储类型: sqlite（默认，持久化） / memory（纯内存，重启丢失） */
    private String storageType = "sqlite";

    /** 连续错误达到该次数后自动禁用账号，<=0 表示不自动禁用 */
    private int errorBanThreshold = 3;

    /** AT 距离过期不足该秒数时视为需要刷新 */
    private long accessTokenRefreshLeadSeconds = 3600;

    /** AT 自动刷新任务的执行间隔（秒） */
    private long credentialRefreshIntervalSeconds = 1800;

    /** 是否启用 AT 自动刷新任务 */
    private boolean credentialAutoRefresh = false;

    /** AT 刷新失败时是否尝试自动续期 ST */
    private boolean sessionAutoRenew = false;

    /** 视频轮询间隔（毫秒） */
    private long pollIntervalMillis = 3000;

    /** 视频最大轮询次数 */
    private int maxPollAttempts = 200;

    /** 轮询超时时是否把任务标记为 failed（默认保持 processing） */
    private boolean markTaskFailedOnPollTimeout = false;

    /** 结果缓存 */
    private Cache cache = new Cache();

    /** 出口代理 */
    private Proxy proxy = new Proxy();

    @Data
    public static class Cache {
        private boolean enabled = false;
        /** 缓存有效期（秒） */
        private long timeoutSeconds = 7200;
        /** 对外访问缓存文件的基础地址，为空时使用请求来源地址 */
        private String baseUrl = "";
    }

    @Data
    public static class Proxy {
        /** 单代理模式开关 */
        private boolean enabled = false;
        private String url = "";
        /** 代理池模式开关，开启后忽略单代理配置 */
        private boolean poolEnabled = false;
    }
}
