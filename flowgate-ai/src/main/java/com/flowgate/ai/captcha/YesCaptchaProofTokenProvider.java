package com.flowgate.ai.captcha;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowgate.ai.config.FlowProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;
import java.util.Optional;

/**
 * 通过 YesCaptcha 任务接口获取 reCAPTCHA v3 令牌（createTask + getTaskResult 轮询）。
 */
@Slf4j
@RequiredArgsConstructor
public class YesCaptchaProofTokenProvider implements ProofTokenProvider {

    private static final MediaType JSON_MEDIA = MediaType.parse("application/json; charset=utf-8");

    private final OkHttpClient httpClient;
    private final FlowProperties.Captcha config;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public Optional<String> getProofToken(String projectId) {
        if (config.getYescaptchaApiKey() == null || config.getYescaptchaApiKey().isBlank()) {
            log.debug("未配置 YesCaptcha API Key, 跳过打码");
            return Optional.empty();
        }

        try {
            ObjectNode task = objectMapper.createObjectNode();
            task.put("websiteURL", "https://labs.google/fx/tools/flow/project/" + projectId);
            task.put("websiteKey", config.getWebsiteKey());
            task.put("type", "RecaptchaV3TaskProxylessM1");
            task.put("pageAction", config.getPageAction());

            ObjectNode create = objectMapper.createObjectNode();
            create.put("clientKey", config.getYescaptchaApiKey());
            create.set("task", task);

            String taskId = post("/createTask", create).path("taskId").asText("");
            if (taskId.isEmpty()) {
                log.warn("YesCaptcha 创建任务失败");
                return Optional.empty();
            }

            ObjectNode query = objectMapper.createObjectNode();
            query.put("clientKey", config.getYescaptchaApiKey());
            query.put("taskId", taskId);

            for (int i = 0; i < config.getMaxPollAttempts(); i++) {
                String token = post("/getTaskResult", query)
                        .path("solution").path("gRecaptchaResponse").asText("");
                if (!token.isEmpty()) {
                    return Optional.of(token);
                }
                Thread.sleep(config.getPollIntervalMillis());
            }
            log.warn("YesCaptcha 任务 {} 超时", taskId);
            return Optional.empty();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (IOException e) {
            log.warn("YesCaptcha 调用失败: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private JsonNode post(String path, ObjectNode body) throws IOException {
        Request request = new Request.Builder()
                .url(config.getYescaptchaBaseUrl() + path)
                .post(RequestBody.create(objectMapper.writeValueAsString(body), JSON_MEDIA))
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            String text = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                throw new IOException("HTTP " + response.code());
            }
            return objectMapper.readTree(text.isEmpty() ? "{}" : text);
        }
    }
}
