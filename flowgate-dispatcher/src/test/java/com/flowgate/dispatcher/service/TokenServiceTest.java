package com.flowgate.dispatcher.service;

import com.flowgate.common.dto.GenerationType;
import com.flowgate.common.dto.Token;
import com.flowgate.common.exception.CredentialException;
import com.flowgate.common.exception.UpstreamException;
import com.flowgate.common.exception.ValidationException;
import com.flowgate.dispatcher.client.AccessGrant;
import com.flowgate.dispatcher.client.AccountClient;
import com.flowgate.dispatcher.client.AccountCredits;
import com.flowgate.dispatcher.concurrency.InMemoryConcurrencyManager;
import com.flowgate.dispatcher.registry.InMemoryCredentialRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TokenServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @Mock
    private AccountClient accountClient;

    @Mock
    private TokenHealthService healthService;

    private InMemoryCredentialRegistry registry;
    private InMemoryConcurrencyManager concurrencyManager;
    private TokenService tokenService;

    @BeforeEach
    void setUp() {
        registry = new InMemoryCredentialRegistry();
        concurrencyManager = new InMemoryConcurrencyManager();
        tokenService = new TokenService(registry, accountClient, concurrencyManager, healthService,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static AccessGrant grant(String at, String email) {
        return AccessGrant.builder()
                .accessToken(at)
                .expires(NOW.plus(Duration.ofHours(12)))
                .email(email)
                .name("用户")
                .build();
    }

    @Test
    @DisplayName("新增账号：换取 AT、写入余额、创建项目并登记并发上限")
    void addTokenExchangesAndBindsProject() {
        when(accountClient.exchangeSession("st-1")).thenReturn(grant("at-1", "a@example.com"));
        when(accountClient.getCredits("at-1")).thenReturn(new AccountCredits(120, "PAYGATE_TIER_ONE"));
        when(accountClient.createProject(anyString(), anyString())).thenReturn("proj-1");

        Token saved = tokenService.addToken(Token.builder()
                .sessionToken("  st-1 ")
                .remark("主账号")
                .imageConcurrency(1)
                .build());

        assertThat(saved.getSessionToken()).isEqualTo("st-1");
        assertThat(saved.getAccessToken()).isEqualTo("at-1");
        assertThat(saved.getEmail()).isEqualTo("a@example.com");
        assertThat(saved.getCredits()).isEqualTo(120);
        assertThat(saved.getRemark()).isEqualTo("主账号");
        assertThat(saved.getCurrentProjectId()).isEqualTo("proj-1");
        assertThat(registry.findProjectsByToken(saved.getId())).hasSize(1);

        assertThat(concurrencyManager.acquire(saved.getId(), GenerationType.IMAGE)).isTrue();
        assertThat(concurrencyManager.acquire(saved.getId(), GenerationType.IMAGE)).isFalse();
    }

    @Test
    @DisplayName("重复的 ST 不能再次新增")
    void duplicateSessionTokenRejected() {
        registry.addToken(Token.builder().sessionToken("st-1").build());

        assertThatThrownBy(() -> tokenService.addToken(Token.builder().sessionToken("st-1").build()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("已存在");
    }

    @Test
    @DisplayName("上游未返回 AT 时新增失败")
    void missingAccessTokenFails() {
        when(accountClient.exchangeSession("st-1")).thenReturn(grant("", null));

        assertThatThrownBy(() -> tokenService.addToken(Token.builder().sessionToken("st-1").build()))
                .isInstanceOf(CredentialException.class);
        assertThat(registry.findAllTokens()).isEmpty();
    }

    @Test
    @DisplayName("创建项目失败不影响新增，首次使用时再创建")
    void projectFailureStillSavesToken() {
        when(accountClient.exchangeSession("st-1")).thenReturn(grant("at-1", "a@example.com"));
        when(accountClient.getCredits("at-1")).thenReturn(new AccountCredits(0, null));
        when(accountClient.createProject(anyString(), anyString()))
                .thenThrow(new UpstreamException("项目创建失败", 500))
                .thenReturn("proj-2");

        Token saved = tokenService.addToken(Token.builder().sessionToken("st-1").build());

        assertThat(saved.getCurrentProjectId()).isNull();
        assertThat(tokenService.ensureProject(saved)).isEqualTo("proj-2");
        assertThat(registry.findToken(saved.getId()).get().getCurrentProjectId()).isEqualTo("proj-2");
    }

    @Test
    @DisplayName("已绑定项目时不再请求上游")
    void ensureProjectReusesExisting() {
        Token token = registry.addToken(Token.builder()
                .sessionToken("st-1")
                .currentProjectId("proj-1")
                .build());

        assertThat(tokenService.ensureProject(token)).isEqualTo("proj-1");
        verify(accountClient, never()).createProject(anyString(), anyString());
    }

    @Test
    @DisplayName("批量导入：按邮箱更新已有账号，新增新账号，记录失败项")
    void importMergesByEmail() {
        Token existing = registry.addToken(Token.builder()
                .sessionToken("st-old")
                .email("a@example.com")
                .active(false)
                .build());
        when(accountClient.exchangeSession("st-a")).thenReturn(grant("at-a", "a@example.com"));
        when(accountClient.exchangeSession("st-b")).thenReturn(grant("at-b", "b@example.com"));
        when(accountClient.exchangeSession("st-bad")).thenThrow(new UpstreamException("无效的 ST", 401));
        when(accountClient.getCredits("at-b")).thenReturn(new AccountCredits(10, null));
        when(accountClient.createProject(anyString(), anyString())).thenReturn("proj-b");

        TokenService.ImportResult result = tokenService.importTokens(Arrays.asList("st-a", " ", "st-b", "st-bad", null));

        assertThat(result.getUpdated()).containsExactly(existing.getId());
        assertThat(result.getAdded()).hasSize(1);
        assertThat(result.getFailed()).hasSize(1);
        assertThat(registry.findToken(existing.getId()).get().getSessionToken()).isEqualTo("st-a");
        assertThat(registry.findToken(existing.getId()).get().getAccessToken()).isEqualTo("at-a");
        verify(healthService).enable(existing.getId());
        assertThat(registry.findAllTokens()).hasSize(2);
    }

    @Test
    @DisplayName("修改 ST 时清空 AT，并更新并发上限")
    void updateWithNewSessionTokenClearsAccessToken() {
        Token token = registry.addToken(Token.builder()
                .sessionToken("st-1")
                .accessToken("at-1")
                .accessTokenExpires(NOW.plus(Duration.ofHours(1)))
                .remark("旧备注")
                .build());

        Token updated = tokenService.updateToken(token.getId(), Token.builder()
                .sessionToken("st-2")
                .videoEnabled(false)
                .videoConcurrency(1)
                .build());

        assertThat(updated.getSessionToken()).isEqualTo("st-2");
        assertThat(updated.getAccessToken()).isNull();
        assertThat(updated.getAccessTokenExpires()).isNull();
        assertThat(updated.getRemark()).isEqualTo("旧备注");
        assertThat(updated.isVideoEnabled()).isFalse();
        assertThat(concurrencyManager.acquire(token.getId(), GenerationType.VIDEO)).isTrue();
        assertThat(concurrencyManager.acquire(token.getId(), GenerationType.VIDEO)).isFalse();
    }

    @Test
    @DisplayName("删除账号后注册表与并发登记都被清除")
    void deleteForgetsToken() {
        Token token = registry.addToken(Token.builder().sessionToken("st-1").videoConcurrency(1).build());
        tokenService.registerAllLimits();
        assertThat(concurrencyManager.acquire(token.getId(), GenerationType.VIDEO)).isTrue();

        tokenService.deleteToken(token.getId());

        assertThat(registry.findToken(token.getId())).isEmpty();
        assertThat(concurrencyManager.inFlight(token.getId(), GenerationType.VIDEO)).isZero();
    }

    @Test
    @DisplayName("删除不存在的账号报参数错误")
    void deleteUnknownToken() {
        assertThatThrownBy(() -> tokenService.deleteToken(99L))
                .isInstanceOf(ValidationException.class);
    }
}
