package com.flowgate.ai.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowgate.ai.captcha.ProofTokenProvider;
import com.flowgate.ai.config.FlowProperties;
import com.flowgate.common.exception.UpstreamException;
import com.flowgate.common.exception.UpstreamRateLimitedException;
import com.flowgate.common.util.IdGenerator;
import com.flowgate.common.util.ImageUtils;
import com.flowgate.dispatcher.client.AccessGrant;
import com.flowgate.dispatcher.client.AccountClient;
import com.flowgate.dispatcher.client.AccountCredits;
import com.flowgate.dispatcher.proxy.ProxyRotator;
import com.flowgate.dispatcher.proxy.ProxySelection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Consumer;

/**
 * Flow（VideoFX / Veo）上游接口客户端。
 * <p>
 * 认证与项目接口使用 ST（Cookie），生成接口使用 AT（Bearer）。
 * 每次调用都经过 {@link ProxyRotator} 选择出口，并携带按账号固定的 User-Agent。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FlowClient implements AccountClient {

    private static final MediaType JSON_MEDIA = MediaType.parse("application/json; charset=utf-8");
    private static final String SESSION_COOKIE = "__Secure-next-auth.session-token=";
    private static final String TOOL_NAME = "PINHOLE";
    private static final String DEFAULT_TIER = "PAYGATE_TIER_ONE";

    private final ProxiedHttpClients httpClients;
    private final ProxyRotator proxyRotator;
    private final UserAgentGenerator userAgentGenerator;
    private final ProofTokenProvider proofTokenProvider;
    private final FlowProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper();

    // ======================== 认证 / 项目（ST） ========================

    @Override
    public AccessGrant exchangeSession(String sessionToken) {
        Request.Builder request = new Request.Builder()
                .url(properties.getLabsBaseUrl() + "/auth/session")
                .get();
        JsonNode json = execute("st_to_at", withSession(request, sessionToken), sessionToken);

        String accessToken = json.path("access_token").asText("");
        if (accessToken.isEmpty()) {
            throw new UpstreamException("ST 转 AT 失败: 响应中没有 access_token");
        }
        JsonNode user = json.path("user");
        return AccessGrant.builder()
                .accessToken(accessToken)
                .expires(parseExpiry(json.path("expires").asText(null)))
                .email(textOrNull(user.path("email")))
                .name(textOrNull(user.path("name")))
                .build();
    }

    @Override
    public String createProject(String sessionToken, String title) {
        ObjectNode inner = objectMapper.createObjectNode();
        inner.put("projectTitle", title);
        inner.put("toolName", TOOL_NAME);
        ObjectNode body = objectMapper.createObjectNode();
        body.set("json", inner);

        Request.Builder request = new Request.Builder()
                .url(properties.getLabsBaseUrl() + "/trpc/project.createProject")
                .post(jsonBody(body));
        JsonNode json = execute("create_project", withSession(request, sessionToken), sessionToken);

        String projectId = json.path("result").path("data").path("json").path("result").path("projectId").asText("");
        if (projectId.isEmpty()) {
            throw new UpstreamException("创建项目失败: 响应中没有 projectId");
        }
        return projectId;
    }

    @Override
    public void deleteProject(String sessionToken, String projectId) {
        ObjectNode inner = objectMapper.createObjectNode();
        inner.put("projectToDeleteId", projectId);
        ObjectNode body = objectMapper.createObjectNode();
        body.set("json", inner);

        Request.Builder request = new Request.Builder()
                .url(properties.getLabsBaseUrl() + "/trpc/project.deleteProject")
                .post(jsonBody(body));
        execute("delete_project", withSession(request, sessionToken), sessionToken);
    }

    // ======================== 余额 / 上传（AT） ========================

    @Override
    public AccountCredits getCredits(String accessToken) {
        Request.Builder request = new Request.Builder()
                .url(properties.getApiBaseUrl() + "/credits")
                .get();
        JsonNode json = execute("get_credits", withAccess(request, accessToken), accessToken);
        return new AccountCredits(json.path("credits").asInt(0), textOrNull(json.path("userPaygateTier")));
    }

    /**
     * 上传参考图。
     *
     * @param aspectRatio 图片或视频宽高比，视频比例会转换为对应的图片比例
     * @return mediaGenerationId
     */
    public String uploadImage(String accessToken, byte[] imageBytes, String aspectRatio) {
        String imageAspect = aspectRatio.startsWith("VIDEO_") ? aspectRatio.replace("VIDEO_", "IMAGE_") : aspectRatio;

        ObjectNode body = objectMapper.createObjectNode();
        ObjectNode imageInput = body.putObject("imageInput");
        imageInput.put("rawImageBytes", ImageUtils.toBase64(imageBytes));
        imageInput.put("mimeType", "image/jpeg");
        imageInput.put("isUserUploaded", true);
        imageInput.put("aspectRatio", imageAspect);
        ObjectNode context = body.putObject("clientContext");
        context.put("sessionId", IdGenerator.sessionId());
        context.put("tool", "ASSET_MANAGER");

        Request.Builder request = new Request.Builder()
                .url(properties.getApiBaseUrl() + ":uploadUserImage")
                .post(jsonBody(body));
        JsonNode json = execute("upload_image", withAccess(request, accessToken), accessToken);

        String mediaId = json.path("mediaGenerationId").path("mediaGenerationId").asText("");
        if (mediaId.isEmpty()) {
            throw new UpstreamException("图片上传失败: 响应中没有 mediaGenerationId");
        }
        return mediaId;
    }

    // ======================== 图片生成（同步） ========================

    /**
     * 生成图片。
     *
     * @param referenceMediaIds 已上传的参考图，可为空
     * @return 生成图片的 URL
     */
    public String generateImage(String accessToken, String projectId, String prompt, String modelName,
                                String aspectRatio, List<String> referenceMediaIds) {
        String proofToken = proofToken(projectId);
        String sessionId = IdGenerator.sessionId();

        ObjectNode item = objectMapper.createObjectNode();
        ObjectNode itemContext = item.putObject("clientContext");
        itemContext.put("recaptchaToken", proofToken);
        itemContext.put("projectId", projectId);
        itemContext.put("sessionId", sessionId);
        itemContext.put("tool", TOOL_NAME);
        item.put("seed", randomSeed());
        item.put("imageModelName", modelName);
        item.put("imageAspectRatio", aspectRatio);
        item.put("prompt", prompt);
        ArrayNode inputs = item.putArray("imageInputs");
        for (String mediaId : referenceMediaIds) {
            ObjectNode input = inputs.addObject();
            input.put("name", mediaId);
            input.put("imageInputType", "IMAGE_INPUT_TYPE_REFERENCE");
        }

        ObjectNode body = objectMapper.createObjectNode();
        ObjectNode context = body.putObject("clientContext");
        context.put("recaptchaToken", proofToken);
        context.put("sessionId", sessionId);
        body.putArray("requests").add(item);

        Request.Builder request = new Request.Builder()
                .url(properties.getApiBaseUrl() + "/projects/" + projectId + "/flowMedia:batchGenerateImages")
                .post(jsonBody(body));
        JsonNode json = execute("generate_image", withAccess(request, accessToken), accessToken);

        String url = json.path("media").path(0).path("image").path("generatedImage").path("fifeUrl").asText("");
        if (url.isEmpty()) {
            throw new UpstreamException("生成结果为空");
        }
        return url;
    }

    // ======================== 视频生成（异步） ========================

    /** 文生视频 */
    public VideoSubmission submitVideoText(VideoRequest video) {
        return submitVideo("video:batchAsyncGenerateVideoText", video, item -> { });
    }

    /** 首尾帧生成视频 */
    public VideoSubmission submitVideoStartEnd(VideoRequest video) {
        return submitVideo("video:batchAsyncGenerateVideoStartAndEndImage", video, item -> {
            item.putObject("startImage").put("mediaId", video.getStartMediaId());
            item.putObject("endImage").put("mediaId", video.getEndMediaId());
        });
    }

    /** 仅首帧生成视频 */
    public VideoSubmission submitVideoStartImage(VideoRequest video) {
        return submitVideo("video:batchAsyncGenerateVideoStartImage", video,
                item -> item.putObject("startImage").put("mediaId", video.getStartMediaId()));
    }

    /** 多图参考生成视频 */
    public VideoSubmission submitVideoReferences(VideoRequest video) {
        return submitVideo("video:batchAsyncGenerateVideoReferenceImages", video, item -> {
            ArrayNode references = item.putArray("referenceImages");
            for (String mediaId : video.getReferenceMediaIds()) {
                ObjectNode reference = references.addObject();
                reference.put("imageUsageType", "IMAGE_USAGE_TYPE_ASSET");
                reference.put("mediaId", mediaId);
            }
        });
    }

    /**
     * 查询视频任务状态，只关心第一个 operation。
     *
     * @return 响应中没有 operation 时返回 empty
     */
    public Optional<VideoStatus> checkVideoStatus(String accessToken, ArrayNode operations) {
        ObjectNode body = objectMapper.createObjectNode();
        body.set("operations", operations);

        Request.Builder request = new Request.Builder()
                .url(properties.getApiBaseUrl() + "/video:batchCheckAsyncVideoGenerationStatus")
                .post(jsonBody(body));
        JsonNode json = execute("check_video_status", withAccess(request, accessToken), accessToken);

        JsonNode first = json.path("operations").path(0);
        if (first.isMissingNode()) {
            return Optional.empty();
        }
        JsonNode operation = first.path("operation");
        return Optional.of(new VideoStatus(
                first.path("status").asText(""),
                textOrNull(operation.path("metadata").path("video").path("fifeUrl")),
                textOrNull(operation.path("error").path("code")),
                textOrNull(operation.path("error").path("message"))));
    }

    private VideoSubmission submitVideo(String endpoint, VideoRequest video,
                                        Consumer<ObjectNode> customizer) {
        String sceneId = IdGenerator.sceneId();

        ObjectNode body = objectMapper.createObjectNode();
        ObjectNode context = body.putObject("clientContext");
        context.put("recaptchaToken", proofToken(video.getProjectId()));
        context.put("sessionId", IdGenerator.sessionId());
        context.put("projectId", video.getProjectId());
        context.put("tool", TOOL_NAME);
        context.put("userPaygateTier", video.getPaygateTier() != null ? video.getPaygateTier() : DEFAULT_TIER);

        ObjectNode item = body.putArray("requests").addObject();
        item.put("aspectRatio", video.getAspectRatio());
        item.put("seed", randomSeed());
        item.putObject("textInput").put("prompt", video.getPrompt());
        item.put("videoModelKey", video.getModelKey());
        customizer.accept(item);
        item.putObject("metadata").put("sceneId", sceneId);

        Request.Builder request = new Request.Builder()
                .url(properties.getApiBaseUrl() + "/" + endpoint)
                .post(jsonBody(body));
        JsonNode json = execute(endpoint, withAccess(request, video.getAccessToken()), video.getAccessToken());

        JsonNode operations = json.path("operations");
        if (!operations.isArray() || operations.isEmpty()) {
            throw new UpstreamException("生成任务创建失败");
        }
        JsonNode first = operations.get(0);
        String name = first.path("operation").path("name").asText("");
        if (name.isEmpty()) {
            throw new UpstreamException("生成任务创建失败: 响应中没有 operation name");
        }
        return new VideoSubmission(name, first.path("sceneId").asText(sceneId), (ArrayNode) operations);
    }

    // ======================== 请求执行 ========================

    /**
     * 执行请求：选择代理、附加 UA，非 2xx 转为领域异常，429 转为限流异常。
     */
    private JsonNode execute(String operation, Request.Builder builder, String credential) {
        Optional<ProxySelection> proxy = proxyRotator.next();
        Request request = builder
                .header("Content-Type", "application/json")
                .header("User-Agent", userAgentGenerator.forAccount(UserAgentGenerator.accountIdOf(credential)))
                .build();

        long start = System.currentTimeMillis();
        String text;
        int code;
        try (Response response = httpClients.forSelection(proxy).newCall(request).execute()) {
            text = response.body() != null ? response.body().string() : "";
            code = response.code();
        } catch (IOException e) {
            proxy.ifPresent(p -> proxyRotator.recordResult(p, false));
            throw new UpstreamException("调用 Flow API 时发生网络错误 (" + operation + "): " + e.getMessage(), e);
        }
        proxy.ifPresent(p -> proxyRotator.recordResult(p, true));
        log.debug("Flow API {} -> {} ({} ms)", operation, code, System.currentTimeMillis() - start);

        if (code < 200 || code >= 300) {
            log.error("Flow API {} 调用失败: {} - {}", operation, code, abbreviate(text));
            if (code == 429 || text.contains("RESOURCE_EXHAUSTED")) {
                throw new UpstreamRateLimitedException("Flow API 限流 (429): " + abbreviate(text));
            }
            throw new UpstreamException("Flow API 返回错误: " + code + " " + abbreviate(text), code);
        }

        try {
            return objectMapper.readTree(text.isEmpty() ? "{}" : text);
        } catch (JsonProcessingException e) {
            throw new UpstreamException("Flow API 响应格式异常 (" + operation + ")", e);
        }
    }

    private Request.Builder withSession(Request.Builder builder, String sessionToken) {
        return builder.header("Cookie", SESSION_COOKIE + sessionToken);
    }

    private Request.Builder withAccess(Request.Builder builder, String accessToken) {
        return builder.header("Authorization", "Bearer " + accessToken);
    }

    private RequestBody jsonBody(ObjectNode body) {
        try {
            return RequestBody.create(objectMapper.writeValueAsString(body), JSON_MEDIA);
        } catch (JsonProcessingException e) {
            throw new UpstreamException("请求体序列化失败", e);
        }
    }

    private String proofToken(String projectId) {
        try {
            return proofTokenProvider.getProofToken(projectId).orElse("");
        } catch (RuntimeException e) {
            log.warn("获取 reCAPTCHA 令牌失败, 使用空令牌: {}", e.getMessage());
            return "";
        }
    }

    private static int randomSeed() {
        return ThreadLocalRandom.current().nextInt(1, 100000);
    }

    private static Instant parseExpiry(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.warn("无法解析 AT 过期时间: {}", value);
            return null;
        }
    }

    private static String textOrNull(JsonNode node) {
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }

    private static String abbreviate(String text) {
        return text.length() > 300 ? text.substring(0, 300) + "..." : text;
    }
}
