package com.flowgate.dispatcher.settings;

import com.flowgate.dispatcher.config.DispatcherProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 运行期配置快照（不可变，带版本号）。
 * <p>
 * 所有组件每次使用时通过 {@link SettingsStore#get()} 取最新快照，
 * 修改只能通过 {@link SettingsStore#replace(RuntimeSettings)} 整体替换。
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RuntimeSettings {

    long version;

    int errorBanThreshold;

    boolean proxyEnabled;
    String proxyUrl;
    boolean proxyPoolEnabled;

    boolean cacheEnabled;
    long cacheTimeoutSeconds;
    String cacheBaseUrl;

    long pollIntervalMillis;
    int maxPollAttempts;

    boolean sessionAutoRenew;
    boolean credentialAutoRefresh;
    boolean markTaskFailedOnPollTimeout;

    public static RuntimeSettings defaults(DispatcherProperties properties) {
        return RuntimeSettings.builder()
                .version(0)
                .errorBanThreshold(properties.getErrorBanThreshold())
                .proxyEnabled(properties.getProxy().isEnabled())
                .proxyUrl(properties.getProxy().getUrl())
                .proxyPoolEnabled(properties.getProxy().isPoolEnabled())
                .cacheEnabled(properties.getCache().isEnabled())
                .cacheTimeoutSeconds(properties.getCache().getTimeoutSeconds())
                .cacheBaseUrl(properties.getCache().getBaseUrl())
                .pollIntervalMillis(properties.getPollIntervalMillis())
                .maxPollAttempts(properties.getMaxPollAttempts())
                .sessionAutoRenew(properties.isSessionAutoRenew())
                .credentialAutoRefresh(properties.isCredentialAutoRefresh())
                .markTaskFailedOnPollTimeout(properties.isMarkTaskFailedOnPollTimeout())
                .build();
    }
}
