package com.flowgate.web.service;

import com.flowgate.common.dto.GenerationType;
import com.flowgate.common.dto.Token;
import com.flowgate.common.dto.TokenStats;
import com.flowgate.dispatcher.client.AccountClient;
import com.flowgate.dispatcher.client.SessionRenewer;
import com.flowgate.dispatcher.config.DispatcherProperties;
import com.flowgate.dispatcher.service.TokenHealthService;
import com.flowgate.dispatcher.settings.SettingsStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.jdbc.DataJdbcTest;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

@DataJdbcTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class JdbcCredentialRegistryTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");
    private static final LocalDate DAY1 = LocalDate.of(2025, 3, 1);
    private static final LocalDate DAY2 = DAY1.plusDays(1);

    @DynamicPropertySource
    static void sqlite(DynamicPropertyRegistry properties) throws IOException {
        Path db = Files.createTempFile("flowgate-registry-", ".db");
        db.toFile().deleteOnExit();
        properties.add("spring.datasource.url", () -> "jdbc:sqlite:" + db);
        properties.add("spring.datasource.driver-class-name", () -> "org.sqlite.JDBC");
        properties.add("spring.datasource.hikari.maximum-pool-size", () -> "1");
        properties.add("spring.sql.init.mode", () -> "always");
    }

    @Autowired
    private JdbcCredentialRegistry registry;

    private long newToken(String sessionToken) {
        return registry.addToken(Token.builder().sessionToken(sessionToken).createdAt(NOW).build()).getId();
    }

    @Test
    @DisplayName("新增账号时同时创建统计记录，布尔与并发字段原样读回")
    void addTokenCreatesStatsRow() {
        long id = registry.addToken(Token.builder()
                .sessionToken("st-1")
                .imageEnabled(false)
                .videoConcurrency(2)
                .createdAt(NOW)
                .build()).getId();

        Token token = registry.findToken(id).orElseThrow();
        assertThat(token.isActive()).isTrue();
        assertThat(token.isImageEnabled()).isFalse();
        assertThat(token.isVideoEnabled()).isTrue();
        assertThat(token.getVideoConcurrency()).isEqualTo(2);
        assertThat(token.getImageConcurrency()).isEqualTo(Token.UNLIMITED);
        assertThat(token.getCreatedAt()).isEqualTo(NOW);

        registry.incrementUsage(id, GenerationType.IMAGE, DAY1, NOW);
        assertThat(registry.getStats(id).getImageCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("日期变化时当日计数清零，累计计数保留")
    void dailyCountersRollOver() {
        long id = newToken("st-1");

        registry.incrementUsage(id, GenerationType.IMAGE, DAY1, NOW);
        registry.incrementUsage(id, GenerationType.IMAGE, DAY1, NOW);
        registry.incrementError(id, DAY1, NOW);
        registry.incrementUsage(id, GenerationType.VIDEO, DAY2, NOW);

        TokenStats stats = registry.getStats(id);
        assertThat(stats.getTodayDate()).isEqualTo(DAY2);
        assertThat(stats.getTodayVideoCount()).isEqualTo(1);
        assertThat(stats.getTodayImageCount()).isZero();
        assertThat(stats.getTodayErrorCount()).isZero();
        assertThat(stats.getImageCount()).isEqualTo(2);
        assertThat(stats.getVideoCount()).isEqualTo(1);
        assertThat(stats.getSuccessCount()).isEqualTo(3);
        assertThat(stats.getErrorCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("连续错误数随 incrementError 返回，清零后累计错误数不减少")
    void consecutiveErrorsResetButTotalsOnlyGrow() {
        long id = newToken("st-1");

        assertThat(registry.incrementError(id, DAY1, NOW)).isEqualTo(1);
        assertThat(registry.incrementError(id, DAY1, NOW)).isEqualTo(2);
        registry.resetConsecutiveErrors(id);
        assertThat(registry.getStats(id).getConsecutiveErrorCount()).isZero();
        assertThat(registry.incrementError(id, DAY1, NOW)).isEqualTo(1);

        TokenStats stats = registry.getStats(id);
        assertThat(stats.getErrorCount()).isEqualTo(3);
        assertThat(stats.getTodayErrorCount()).isEqualTo(3);
        assertThat(stats.getLastErrorAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("阈值为 3 时，已有 2 次连续错误的账号再失败一次即被禁用")
    void thresholdBanOnSqlite() {
        DispatcherProperties properties = new DispatcherProperties();
        properties.setErrorBanThreshold(3);
        TokenHealthService healthService = new TokenHealthService(registry, mock(AccountClient.class),
                mock(SessionRenewer.class), new SettingsStore(registry, properties), properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
        long id = newToken("st-1");
        registry.incrementError(id, DAY1, NOW);
        registry.incrementError(id, DAY1, NOW);
        assertThat(registry.findToken(id).orElseThrow().isActive()).isTrue();

        healthService.recordError(id);

        Token token = registry.findToken(id).orElseThrow();
        assertThat(token.isActive()).isFalse();
        assertThat(token.getBanReason()).isEqualTo(TokenHealthService.BAN_REASON_ERROR_THRESHOLD);
        assertThat(token.getBannedAt()).isEqualTo(NOW);
        assertThat(registry.findActiveTokens()).isEmpty();

        healthService.enable(id);
        assertThat(registry.findToken(id).orElseThrow().isActive()).isTrue();
        assertThat(registry.getStats(id).getConsecutiveErrorCount()).isZero();
        assertThat(registry.getStats(id).getErrorCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("更新可编辑字段不会覆盖期间写入的封禁与使用记录")
    void updateTokenKeepsStateColumns() {
        long id = newToken("st-1");
        Token stale = registry.findToken(id).orElseThrow();

        registry.setTokenActive(id, false, TokenHealthService.BAN_REASON_RATE_LIMIT, NOW);
        registry.markTokenUsed(id, NOW);
        registry.updateCredits(id, 50, "PAYGATE_TIER_ONE");
        registry.updateToken(stale.toBuilder()
                .sessionToken("st-2")
                .remark("新备注")
                .videoEnabled(false)
                .build());

        Token token = registry.findToken(id).orElseThrow();
        assertThat(token.getSessionToken()).isEqualTo("st-2");
        assertThat(token.getRemark()).isEqualTo("新备注");
        assertThat(token.isVideoEnabled()).isFalse();
        assertThat(token.isActive()).isFalse();
        assertThat(token.getBanReason()).isEqualTo(TokenHealthService.BAN_REASON_RATE_LIMIT);
        assertThat(token.getLastUsedAt()).isEqualTo(NOW);
        assertThat(token.getUseCount()).isEqualTo(1);
        assertThat(token.getCredits()).isEqualTo(50);
    }

    @Test
    @DisplayName("删除账号同时删除统计记录")
    void deleteRemovesStats() {
        long id = newToken("st-1");
        registry.incrementError(id, DAY1, NOW);

        registry.deleteToken(id);

        assertThat(registry.findToken(id)).isEmpty();
        assertThat(registry.getStats(id).getErrorCount()).isZero();
    }
}
