package com.flowgate.ai.generation;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.flowgate.ai.cache.FileCache;
import com.flowgate.ai.client.FlowClient;
import com.flowgate.ai.client.VideoRequest;
import com.flowgate.ai.client.VideoStatus;
import com.flowgate.ai.client.VideoSubmission;
import com.flowgate.ai.model.ModelCatalog;
import com.flowgate.common.dto.GenerationTask;
import com.flowgate.common.dto.GenerationType;
import com.flowgate.common.dto.RequestLog;
import com.flowgate.common.dto.TaskStatus;
import com.flowgate.common.dto.Token;
import com.flowgate.common.exception.AdmissionRejectedException;
import com.flowgate.common.exception.CacheDownloadException;
import com.flowgate.common.exception.CredentialException;
import com.flowgate.common.exception.GenerationFailedException;
import com.flowgate.common.exception.PollTimeoutException;
import com.flowgate.common.exception.PoolExhaustedException;
import com.flowgate.common.exception.UpstreamException;
import com.flowgate.common.exception.UpstreamRateLimitedException;
import com.flowgate.common.exception.ValidationException;
import com.flowgate.dispatcher.concurrency.InMemoryConcurrencyManager;
import com.flowgate.dispatcher.config.DispatcherProperties;
import com.flowgate.dispatcher.registry.InMemoryCredentialRegistry;
import com.flowgate.dispatcher.service.LoadBalancer;
import com.flowgate.dispatcher.service.TokenHealthService;
import com.flowgate.dispatcher.service.TokenService;
import com.flowgate.dispatcher.settings.SettingsStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GenerationHandlerTest {

    private static final String PENDING = "MEDIA_GENERATION_STATUS_PENDING";

    @Mock
    private LoadBalancer loadBalancer;

    @Mock
    private TokenHealthService healthService;

    @Mock
    private TokenService tokenService;

    @Mock
    private FlowClient flowClient;

    @Mock
    private FileCache fileCache;

    private InMemoryCredentialRegistry registry;
    private InMemoryConcurrencyManager concurrencyManager;
    private SettingsStore settingsStore;
    private GenerationHandler handler;
    private Token token;
    private final List<String> progress = new ArrayList<>();

    @BeforeEach
    void setUp() {
        DispatcherProperties properties = new DispatcherProperties();
        properties.setPollIntervalMillis(0);
        properties.setMaxPollAttempts(5);

        registry = new InMemoryCredentialRegistry();
        concurrencyManager = new InMemoryConcurrencyManager();
        settingsStore = new SettingsStore(registry, properties);
        handler = new GenerationHandler(new ModelCatalog(), loadBalancer, concurrencyManager, healthService,
                tokenService, registry, flowClient, fileCache, settingsStore,
                Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC));

        token = registry.addToken(Token.builder()
                .sessionToken("st-1")
                .accessToken("at-1")
                .paygateTier("PAYGATE_TIER_ONE")
                .videoConcurrency(1)
                .build());
        concurrencyManager.registerToken(token);

        lenient().when(loadBalancer.select(any(), anyString())).thenReturn(Optional.of(token));
        lenient().when(healthService.isAccessCredentialValid(anyLong())).thenReturn(true);
        lenient().when(tokenService.ensureProject(any())).thenReturn("proj-1");
        lenient().when(flowClient.submitVideoText(any())).thenReturn(submission());
    }

    private static VideoSubmission submission() {
        return new VideoSubmission("op-1", "scene-1", JsonNodeFactory.instance.arrayNode());
    }

    private static Optional<VideoStatus> status(String status, String url, String message) {
        return Optional.of(new VideoStatus(status, url, null, message));
    }

    private GenerationRequest request(String model, byte[]... images) {
        GenerationRequest.GenerationRequestBuilder builder = GenerationRequest.builder()
                .model(model)
                .prompt("a cat on the moon")
                .requestOrigin("http://localhost:8000");
        for (byte[] image : images) {
            builder.image(image);
        }
        return builder.build();
    }

    @Test
    @DisplayName("图片生成成功：记录用量并返回源链接")
    void imageSuccessWithoutCache() {
        when(flowClient.generateImage(anyString(), anyString(), anyString(), anyString(), anyString(), any()))
                .thenReturn("https://storage/img.jpg");

        GenerationResult result = handler.generate(request("gemini-2.5-flash-image-landscape"), progress::add);

        assertThat(result.getUrl()).isEqualTo("https://storage/img.jpg");
        assertThat(result.isCached()).isFalse();
        assertThat(result.getType()).isEqualTo(GenerationType.IMAGE);
        assertThat(progress).contains("初始化生成环境...", "缓存已关闭,正在返回源链接...");
        assertThat(registry.getStats(token.getId()).getImageCount()).isEqualTo(1);
        assertThat(registry.findToken(token.getId()).get().getUseCount()).isEqualTo(1);
        verify(healthService).recordSuccess(token.getId());
        assertThat(concurrencyManager.inFlight(token.getId(), GenerationType.IMAGE)).isZero();
    }

    @Test
    @DisplayName("缓存开启时返回缓存地址，任务中仍保存源链接")
    void videoSuccessWithCache() {
        settingsStore.update(s -> s.toBuilder().cacheEnabled(true).build());
        when(flowClient.checkVideoStatus(anyString(), any()))
                .thenReturn(status(PENDING, null, null))
                .thenReturn(status(VideoStatus.SUCCESSFUL, "https://storage/v.mp4", null));
        when(fileCache.fetch("https://storage/v.mp4", GenerationType.VIDEO)).thenReturn("abc.mp4");
        when(fileCache.publicUrl("abc.mp4", "http://localhost:8000")).thenReturn("http://localhost:8000/tmp/abc.mp4");

        GenerationResult result = handler.generate(request("veo_3_1_t2v_fast_landscape"), progress::add);

        assertThat(result.getUrl()).isEqualTo("http://localhost:8000/tmp/abc.mp4");
        assertThat(result.getUpstreamUrl()).isEqualTo("https://storage/v.mp4");
        assertThat(result.isCached()).isTrue();
        assertThat(result.getTaskId()).isEqualTo("op-1");

        GenerationTask task = registry.findTask("op-1").orElseThrow();
        assertThat(task.getStatus()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(task.getProgress()).isEqualTo(100);
        assertThat(task.getResultUrls()).containsExactly("https://storage/v.mp4");
        assertThat(progress).contains("✅ 视频缓存成功,准备返回缓存地址...");
    }

    @Test
    @DisplayName("缓存失败时降级返回源链接")
    void cacheFailureFallsBackToUpstreamUrl() {
        settingsStore.update(s -> s.toBuilder().cacheEnabled(true).build());
        when(flowClient.generateImage(anyString(), anyString(), anyString(), anyString(), anyString(), any()))
                .thenReturn("https://storage/img.jpg");
        when(fileCache.fetch(anyString(), any())).thenThrow(new CacheDownloadException("所有下载方式均失败"));

        GenerationResult result = handler.generate(request("imagen-4.0-generate-preview-portrait"), progress::add);

        assertThat(result.getUrl()).isEqualTo("https://storage/img.jpg");
        assertThat(result.isCached()).isFalse();
        assertThat(progress).anyMatch(line -> line.startsWith("⚠️ 缓存失败"));
        verify(healthService).recordSuccess(token.getId());
    }

    @Test
    @DisplayName("第 3 次轮询返回失败：任务标记失败，账号记一次错误")
    void videoFailureOnThirdPoll() {
        when(flowClient.checkVideoStatus(anyString(), any()))
                .thenReturn(status(PENDING, null, null))
                .thenReturn(status(PENDING, null, null))
                .thenReturn(status(VideoStatus.FAILED, null, "quota exceeded"));

        assertThatThrownBy(() -> handler.generate(request("veo_3_1_t2v_fast_landscape"), progress::add))
                .isInstanceOf(GenerationFailedException.class)
                .hasMessageContaining("quota exceeded");

        verify(flowClient, times(3)).checkVideoStatus(anyString(), any());
        GenerationTask task = registry.findTask("op-1").orElseThrow();
        assertThat(task.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(task.getErrorMessage()).contains("quota exceeded");
        verify(healthService).recordError(token.getId());
        verify(healthService, never()).banForRateLimit(anyLong());
        assertThat(concurrencyManager.inFlight(token.getId(), GenerationType.VIDEO)).isZero();
    }

    @Test
    @DisplayName("轮询超时默认保持 processing")
    void pollTimeoutKeepsTaskProcessing() {
        when(flowClient.checkVideoStatus(anyString(), any())).thenReturn(status(PENDING, null, null));

        assertThatThrownBy(() -> handler.generate(request("veo_3_1_t2v_fast_landscape"), progress::add))
                .isInstanceOf(PollTimeoutException.class)
                .hasMessageContaining("已轮询5次");

        verify(flowClient, times(5)).checkVideoStatus(anyString(), any());
        assertThat(registry.findTask("op-1").orElseThrow().getStatus()).isEqualTo(TaskStatus.PROCESSING);
        assertThat(progress).contains("生成进度: 0%");
    }

    @Test
    @DisplayName("开启超时标记后任务标记为失败")
    void pollTimeoutMarksTaskFailedWhenConfigured() {
        settingsStore.update(s -> s.toBuilder().markTaskFailedOnPollTimeout(true).build());
        when(flowClient.checkVideoStatus(anyString(), any())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> handler.generate(request("veo_3_1_t2v_fast_landscape"), progress::add))
                .isInstanceOf(PollTimeoutException.class);

        assertThat(registry.findTask("op-1").orElseThrow().getStatus()).isEqualTo(TaskStatus.FAILED);
    }

    @Test
    @DisplayName("文生视频模型忽略上传的图片")
    void textToVideoDropsImages() {
        when(flowClient.checkVideoStatus(anyString(), any()))
                .thenReturn(status(VideoStatus.SUCCESSFUL, "https://storage/v.mp4", null));

        handler.generate(request("veo_3_1_t2v_fast_portrait", new byte[]{1, 2, 3}), progress::add);

        assertThat(progress).anyMatch(line -> line.contains("文生视频模型不支持上传图片"));
        verify(flowClient, never()).uploadImage(anyString(), any(), anyString());
        verify(flowClient).submitVideoText(any());
    }

    @Test
    @DisplayName("首尾帧模型：两张图走首尾帧接口，一张图走首帧接口")
    void startEndModelChoosesEndpointByImageCount() {
        when(flowClient.uploadImage(anyString(), any(), anyString())).thenReturn("media-a", "media-b", "media-c");
        when(flowClient.submitVideoStartEnd(any())).thenReturn(submission());
        when(flowClient.submitVideoStartImage(any())).thenReturn(submission());
        when(flowClient.checkVideoStatus(anyString(), any()))
                .thenReturn(status(VideoStatus.SUCCESSFUL, "https://storage/v.mp4", null));

        handler.generate(request("veo_2_0_i2v_landscape", new byte[]{1}, new byte[]{2}), progress::add);
        handler.generate(request("veo_2_0_i2v_landscape", new byte[]{3}), progress::add);

        ArgumentCaptor<VideoRequest> startEnd = ArgumentCaptor.forClass(VideoRequest.class);
        verify(flowClient).submitVideoStartEnd(startEnd.capture());
        assertThat(startEnd.getValue().getStartMediaId()).isEqualTo("media-a");
        assertThat(startEnd.getValue().getEndMediaId()).isEqualTo("media-b");

        ArgumentCaptor<VideoRequest> startOnly = ArgumentCaptor.forClass(VideoRequest.class);
        verify(flowClient).submitVideoStartImage(startOnly.capture());
        assertThat(startOnly.getValue().getStartMediaId()).isEqualTo("media-c");
        assertThat(startOnly.getValue().getEndMediaId()).isNull();
    }

    @Test
    @DisplayName("首尾帧模型图片数量不符时在选号前拒绝")
    void startEndModelRejectsWrongImageCount() {
        assertThatThrownBy(() -> handler.generate(
                request("veo_2_0_i2v_landscape", new byte[]{1}, new byte[]{2}, new byte[]{3}), progress::add))
                .isInstanceOf(ValidationException.class)
                .hasMessage("首尾帧模型需要 1-2 张图片,当前提供了 3 张");

        verifyNoInteractions(loadBalancer, flowClient);
    }

    @Test
    @DisplayName("未知模型直接拒绝")
    void unknownModelRejected() {
        assertThatThrownBy(() -> handler.generate(request("dall-e-3"), progress::add))
                .isInstanceOf(ValidationException.class);

        verifyNoInteractions(loadBalancer);
    }

    @Test
    @DisplayName("上游 429 立即封禁账号")
    void rateLimitBansToken() {
        when(flowClient.generateImage(anyString(), anyString(), anyString(), anyString(), anyString(), any()))
                .thenThrow(new UpstreamRateLimitedException("RESOURCE_EXHAUSTED"));

        assertThatThrownBy(() -> handler.generate(request("gemini-3.0-pro-image-portrait"), progress::add))
                .isInstanceOf(UpstreamRateLimitedException.class);

        verify(healthService).banForRateLimit(token.getId());
        verify(healthService, never()).recordError(anyLong());
        assertThat(concurrencyManager.inFlight(token.getId(), GenerationType.IMAGE)).isZero();
    }

    @Test
    @DisplayName("AT 无效时抛出凭证异常并记错误")
    void invalidCredentialRecordsError() {
        when(healthService.isAccessCredentialValid(token.getId())).thenReturn(false);

        assertThatThrownBy(() -> handler.generate(request("gemini-2.5-flash-image-portrait"), progress::add))
                .isInstanceOf(CredentialException.class)
                .hasMessage("Token AT无效或刷新失败");

        verify(healthService).recordError(token.getId());
        verifyNoInteractions(flowClient);
    }

    @Test
    @DisplayName("没有可用账号时报错且不影响任何账号")
    void poolExhausted() {
        when(loadBalancer.select(any(), anyString())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> handler.generate(request("veo_3_1_t2v_fast_landscape"), progress::add))
                .isInstanceOf(PoolExhaustedException.class)
                .hasMessage("没有可用的Token进行视频生成");

        verify(healthService, never()).recordError(anyLong());
    }

    @Test
    @DisplayName("并发已满时拒绝且不计错误")
    void admissionRejected() {
        assertThat(concurrencyManager.acquire(token.getId(), GenerationType.VIDEO)).isTrue();

        assertThatThrownBy(() -> handler.generate(request("veo_3_1_t2v_fast_landscape"), progress::add))
                .isInstanceOf(AdmissionRejectedException.class)
                .hasMessage("视频并发限制已达上限");

        verifyNoInteractions(flowClient);
        verify(healthService, never()).recordError(anyLong());
        assertThat(concurrencyManager.inFlight(token.getId(), GenerationType.VIDEO)).isEqualTo(1);
    }

    @Test
    @DisplayName("每次生成写一条请求日志")
    void writesRequestLog() {
        when(flowClient.generateImage(anyString(), anyString(), anyString(), anyString(), anyString(), any()))
                .thenThrow(new UpstreamException("boom", 500));

        assertThatThrownBy(() -> handler.generate(request("gemini-2.5-flash-image-landscape"), progress::add))
                .isInstanceOf(UpstreamException.class);

        List<RequestLog> logs = registry.findRecentRequestLogs(10);
        assertThat(logs).hasSize(1);
        assertThat(logs.get(0).getOperation()).isEqualTo("generate_image");
        assertThat(logs.get(0).getStatusCode()).isEqualTo(500);
        assertThat(logs.get(0).getResponseBody()).contains("boom");
    }
}
