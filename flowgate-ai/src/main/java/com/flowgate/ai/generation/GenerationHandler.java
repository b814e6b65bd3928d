package com.flowgate.ai.generation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowgate.ai.cache.FileCache;
import com.flowgate.ai.client.FlowClient;
import com.flowgate.ai.client.VideoRequest;
import com.flowgate.ai.client.VideoStatus;
import com.flowgate.ai.client.VideoSubmission;
import com.flowgate.ai.model.ModelCatalog;
import com.flowgate.ai.model.ModelSpec;
import com.flowgate.ai.model.VideoKind;
import com.flowgate.common.dto.GenerationTask;
import com.flowgate.common.dto.GenerationType;
import com.flowgate.common.dto.RequestLog;
import com.flowgate.common.dto.TaskStatus;
import com.flowgate.common.dto.Token;
import com.flowgate.common.exception.AdmissionRejectedException;
import com.flowgate.common.exception.CacheDownloadException;
import com.flowgate.common.exception.CredentialException;
import com.flowgate.common.exception.FlowgateException;
import com.flowgate.common.exception.GenerationFailedException;
import com.flowgate.common.exception.PollTimeoutException;
import com.flowgate.common.exception.PoolExhaustedException;
import com.flowgate.common.exception.UpstreamException;
import com.flowgate.common.exception.UpstreamRateLimitedException;
import com.flowgate.common.exception.ValidationException;
import com.flowgate.dispatcher.concurrency.ConcurrencyManager;
import com.flowgate.dispatcher.registry.CredentialRegistry;
import com.flowgate.dispatcher.service.LoadBalancer;
import com.flowgate.dispatcher.service.TokenHealthService;
import com.flowgate.dispatcher.service.TokenService;
import com.flowgate.dispatcher.settings.RuntimeSettings;
import com.flowgate.dispatcher.settings.SettingsStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * 生成编排：校验模型 → 选号 → 占用并发槽位 → 校验 AT → 确保项目 → 上传参考图 →
 * 提交生成（视频需轮询）→ 缓存结果 → 记录结果。
 * <p>
 * 进度文字通过 progress 回调推送，流式调用方转成 reasoning_content，非流式调用方直接丢弃。
 * 选号之前的失败不影响账号健康度；选号之后的失败计入错误数，上游 429 直接封禁。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GenerationHandler {

    /** 每隔多少次轮询推送一次进度 */
    private static final int PROGRESS_EVERY_ATTEMPTS = 7;

    private final ModelCatalog modelCatalog;
    private final LoadBalancer loadBalancer;
    private final ConcurrencyManager concurrencyManager;
    private final TokenHealthService healthService;
    private final TokenService tokenService;
    private final CredentialRegistry registry;
    private final FlowClient flowClient;
    private final FileCache fileCache;
    private final SettingsStore settingsStore;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * 执行一次生成。
     *
     * @param progress 进度回调，每条一行
     * @throws FlowgateException 任一环节失败
     */
    public GenerationResult generate(GenerationRequest request, Consumer<String> progress) {
        ModelSpec spec = modelCatalog.find(request.getModel())
                .orElseThrow(() -> new ValidationException("不支持的模型: " + request.getModel()));
        if (request.getPrompt() == null || request.getPrompt().isBlank()) {
            throw new ValidationException("提示词不能为空");
        }
        List<byte[]> images = acceptedImages(spec, request.getImages(), progress);
        GenerationType type = spec.getType();

        log.info("开始生成 - 模型: {}, 类型: {}, 图片: {} 张, Prompt: {}",
                spec.getId(), type.getLabel(), images.size(), abbreviate(request.getPrompt(), 50));

        Token token = loadBalancer.select(type, spec.getId())
                .orElseThrow(() -> new PoolExhaustedException(
                        "没有可用的Token进行" + type.getLabel() + "生成"));
        long tokenId = token.getId();

        if (!concurrencyManager.acquire(tokenId, type)) {
            throw new AdmissionRejectedException(type.getLabel() + "并发限制已达上限");
        }
        registry.markTokenUsed(tokenId, clock.instant());

        long start = System.currentTimeMillis();
        String failure = null;
        try {
            progress.accept("初始化生成环境...");
            if (!healthService.isAccessCredentialValid(tokenId)) {
                throw new CredentialException("Token AT无效或刷新失败");
            }
            // AT 可能已刷新
            token = registry.findToken(tokenId)
                    .orElseThrow(() -> new CredentialException("Token 不存在: " + tokenId));
            String projectId = tokenService.ensureProject(token);

            GenerationResult result = type == GenerationType.IMAGE
                    ? generateImage(token, projectId, spec, request, images, progress)
                    : generateVideo(token, projectId, spec, request, images, progress);

            registry.incrementUsage(tokenId, type, LocalDate.now(clock), clock.instant());
            healthService.recordSuccess(tokenId);
            log.info("生成成功 - Token {}, 模型: {}", tokenId, spec.getId());
            return result;

        } catch (FlowgateException e) {
            failure = e.getMessage();
            recordFailure(tokenId, e);
            throw e;
        } catch (RuntimeException e) {
            failure = e.getMessage();
            log.error("生成过程出现未预期的异常 - Token {}", tokenId, e);
            recordFailure(tokenId, e);
            throw new UpstreamException("生成失败: " + e.getMessage(), e);
        } finally {
            concurrencyManager.release(tokenId, type);
            writeRequestLog(tokenId, spec, request, images.size(), failure, System.currentTimeMillis() - start);
        }
    }

    // ======================== 图片 ========================

    private GenerationResult generateImage(Token token, String projectId, ModelSpec spec,
                                           GenerationRequest request, List<byte[]> images,
                                           Consumer<String> progress) {
        List<String> mediaIds = new ArrayList<>();
        if (!images.isEmpty()) {
            progress.accept("上传 " + images.size() + " 张参考图片...");
            for (int i = 0; i < images.size(); i++) {
                mediaIds.add(flowClient.uploadImage(token.getAccessToken(), images.get(i), spec.getAspectRatio()));
                progress.accept("已上传第 " + (i + 1) + "/" + images.size() + " 张图片");
            }
        }

        progress.accept("正在生成图片...");
        String imageUrl = flowClient.generateImage(token.getAccessToken(), projectId, request.getPrompt(),
                spec.getUpstreamModel(), spec.getAspectRatio(), mediaIds);

        return materialize(spec, token.getId(), imageUrl, null, request.getRequestOrigin(), progress);
    }

    // ======================== 视频 ========================

    private GenerationResult generateVideo(Token token, String projectId, ModelSpec spec,
                                           GenerationRequest request, List<byte[]> images,
                                           Consumer<String> progress) {
        String at = token.getAccessToken();
        VideoRequest.VideoRequestBuilder video = VideoRequest.builder()
                .accessToken(at)
                .projectId(projectId)
                .prompt(request.getPrompt())
                .modelKey(spec.getUpstreamModel())
                .aspectRatio(spec.getAspectRatio())
                .paygateTier(token.getPaygateTier());

        VideoSubmission submission;
        if (spec.getVideoKind() == VideoKind.START_END) {
            if (images.size() == 1) {
                progress.accept("上传首帧图片...");
                video.startMediaId(flowClient.uploadImage(at, images.get(0), spec.getAspectRatio()));
                progress.accept("提交视频生成任务...");
                submission = flowClient.submitVideoStartImage(video.build());
            } else {
                progress.accept("上传首帧和尾帧图片...");
                video.startMediaId(flowClient.uploadImage(at, images.get(0), spec.getAspectRatio()));
                video.endMediaId(flowClient.uploadImage(at, images.get(1), spec.getAspectRatio()));
                progress.accept("提交视频生成任务...");
                submission = flowClient.submitVideoStartEnd(video.build());
            }
        } else if (spec.getVideoKind() == VideoKind.REFERENCES && !images.isEmpty()) {
            progress.accept("上传 " + images.size() + " 张参考图片...");
            for (byte[] image : images) {
                video.referenceMediaId(flowClient.uploadImage(at, image, spec.getAspectRatio()));
            }
            progress.accept("提交视频生成任务...");
            submission = flowClient.submitVideoReferences(video.build());
        } else {
            progress.accept("提交视频生成任务...");
            submission = flowClient.submitVideoText(video.build());
        }

        GenerationTask task = registry.createTask(GenerationTask.builder()
                .taskId(submission.getOperationName())
                .tokenId(token.getId())
                .model(spec.getUpstreamModel())
                .prompt(request.getPrompt())
                .status(TaskStatus.PROCESSING)
                .sceneId(submission.getSceneId())
                .createdAt(clock.instant())
                .build());
        log.info("视频任务已提交: {} (Token {})", task.getTaskId(), token.getId());

        progress.accept("视频生成中...");
        String videoUrl = pollVideo(at, submission, task, progress);
        return materialize(spec, token.getId(), videoUrl, task.getTaskId(), request.getRequestOrigin(), progress);
    }

    private String pollVideo(String accessToken, VideoSubmission submission, GenerationTask task,
                             Consumer<String> progress) {
        RuntimeSettings settings = settingsStore.get();
        int maxAttempts = settings.getMaxPollAttempts();

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            sleep(settings.getPollIntervalMillis());

            Optional<VideoStatus> checked;
            try {
                checked = flowClient.checkVideoStatus(accessToken, submission.getOperations());
            } catch (UpstreamRateLimitedException e) {
                throw e;
            } catch (FlowgateException e) {
                log.warn("查询视频状态失败 (第 {} 次): {}", attempt + 1, e.getMessage());
                continue;
            }
            if (checked.isEmpty()) {
                continue;
            }

            VideoStatus status = checked.get();
            if (status.isSuccessful()) {
                if (status.getVideoUrl() == null || status.getVideoUrl().isBlank()) {
                    throw new UpstreamException("视频URL为空");
                }
                List<String> urls = new ArrayList<>();
                urls.add(status.getVideoUrl());
                registry.updateTask(task.toBuilder()
                        .status(TaskStatus.COMPLETED)
                        .progress(100)
                        .resultUrls(urls)
                        .completedAt(clock.instant())
                        .build());
                log.info("视频任务完成: {} (轮询 {} 次)", task.getTaskId(), attempt + 1);
                return status.getVideoUrl();
            }
            if (status.isFailed()) {
                registry.updateTask(task.toBuilder()
                        .status(TaskStatus.FAILED)
                        .errorMessage(status.describeError())
                        .completedAt(clock.instant())
                        .build());
                log.warn("视频任务失败: {} - {}", task.getTaskId(), status.describeError());
                String message = status.getErrorMessage() != null ? status.getErrorMessage() : status.getStatus();
                throw new GenerationFailedException("视频生成失败: " + message + "，请重试");
            }

            if (attempt % PROGRESS_EVERY_ATTEMPTS == 0) {
                int percent = Math.min(attempt * 100 / Math.max(maxAttempts, 1), 95);
                progress.accept("生成进度: " + percent + "%");
            }
        }

        if (settings.isMarkTaskFailedOnPollTimeout()) {
            registry.updateTask(task.toBuilder()
                    .status(TaskStatus.FAILED)
                    .errorMessage("轮询超时")
                    .completedAt(clock.instant())
                    .build());
        }
        log.warn("视频任务超时: {} (已轮询 {} 次)", task.getTaskId(), maxAttempts);
        throw new PollTimeoutException("视频生成超时 (已轮询" + maxAttempts + "次)");
    }

    // ======================== 缓存 ========================

    private GenerationResult materialize(ModelSpec spec, long tokenId, String upstreamUrl, String taskId,
                                         String requestOrigin, Consumer<String> progress) {
        GenerationResult.GenerationResultBuilder result = GenerationResult.builder()
                .model(spec.getId())
                .type(spec.getType())
                .tokenId(tokenId)
                .upstreamUrl(upstreamUrl)
                .taskId(taskId)
                .url(upstreamUrl)
                .cached(false);

        if (!settingsStore.get().isCacheEnabled()) {
            progress.accept("缓存已关闭,正在返回源链接...");
            return result.build();
        }

        String label = spec.getType().getLabel();
        progress.accept(spec.isImage() ? "缓存图片中..." : "正在缓存视频文件...");
        try {
            String fileName = fileCache.fetch(upstreamUrl, spec.getType());
            progress.accept("✅ " + label + "缓存成功,准备返回缓存地址...");
            return result.url(fileCache.publicUrl(fileName, requestOrigin)).cached(true).build();
        } catch (CacheDownloadException e) {
            log.warn("缓存{}失败, 返回源链接: {}", label, e.getMessage());
            progress.accept("⚠️ 缓存失败: " + e.getMessage() + "\n正在返回源链接...");
            return result.build();
        }
    }

    // ======================== 校验与记录 ========================

    private List<byte[]> acceptedImages(ModelSpec spec, List<byte[]> supplied, Consumer<String> progress) {
        List<byte[]> images = supplied == null ? Collections.emptyList() : supplied;
        if (spec.getVideoKind() == VideoKind.TEXT) {
            if (!images.isEmpty()) {
                progress.accept("⚠️ 文生视频模型不支持上传图片,将忽略图片仅使用文本提示词生成");
                log.warn("模型 {} 不支持图片, 已忽略 {} 张图片", spec.getId(), images.size());
            }
            return Collections.emptyList();
        }
        if (images.size() < spec.getMinImages() || images.size() > spec.getMaxImages()) {
            throw new ValidationException("首尾帧模型需要 " + spec.getMinImages() + "-" + spec.getMaxImages()
                    + " 张图片,当前提供了 " + images.size() + " 张");
        }
        return images;
    }

    private void recordFailure(long tokenId, RuntimeException e) {
        if (isRateLimited(e)) {
            healthService.banForRateLimit(tokenId);
        } else {
            healthService.recordError(tokenId);
        }
    }

    static boolean isRateLimited(Throwable e) {
        if (e instanceof UpstreamRateLimitedException) {
            return true;
        }
        if (e instanceof UpstreamException && ((UpstreamException) e).getStatusCode() == 429) {
            return true;
        }
        return e.getMessage() != null && e.getMessage().contains("429");
    }

    private void writeRequestLog(long tokenId, ModelSpec spec, GenerationRequest request, int imageCount,
                                 String failure, long durationMs) {
        try {
            ObjectNode requestBody = objectMapper.createObjectNode();
            requestBody.put("model", spec.getId());
            requestBody.put("prompt", abbreviate(request.getPrompt(), 100));
            requestBody.put("has_images", imageCount > 0);

            ObjectNode responseBody = objectMapper.createObjectNode();
            if (failure == null) {
                responseBody.put("status", "success");
            } else {
                responseBody.put("error", failure);
            }

            registry.addRequestLog(RequestLog.builder()
                    .tokenId(tokenId)
                    .operation("generate_" + spec.getType().name().toLowerCase())
                    .requestBody(requestBody.toString())
                    .responseBody(responseBody.toString())
                    .statusCode(failure == null ? 200 : 500)
                    .durationMs(durationMs)
                    .createdAt(clock.instant())
                    .build());
        } catch (RuntimeException e) {
            log.warn("写入请求日志失败: {}", e.getMessage());
        }
    }

    private void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamException("视频轮询被中断", e);
        }
    }

    private static String abbreviate(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() > max ? text.substring(0, max) + "..." : text;
    }
}
