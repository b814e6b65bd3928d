package com.flowgate.web.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowgate.ai.generation.CompletionFormatter;
import com.flowgate.ai.generation.GenerationHandler;
import com.flowgate.ai.generation.GenerationRequest;
import com.flowgate.ai.generation.GenerationResult;
import com.flowgate.ai.model.ModelCatalog;
import com.flowgate.ai.model.ModelSpec;
import com.flowgate.common.exception.FlowgateException;
import com.flowgate.common.exception.ValidationException;
import com.flowgate.web.dto.ChatRequest;
import com.flowgate.web.service.ChatRequestParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * OpenAI 兼容接口。
 * <p>
 * stream=true 时返回 SSE：
 * - 首个 chunk 带 role=assistant，提示任务已启动
 * - 进度 chunk 放在 delta.reasoning_content
 * - 最终 chunk 在 delta.content 中给出图片 Markdown 或 video 标签，finish_reason=stop
 * - 最后发送 [DONE]
 * 失败时先推送一行失败提示，再推送错误结构。
 */
@Slf4j
@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class ChatCompletionController {

    /** 视频最长轮询约 10 分钟，留出余量 */
    private static final long SSE_TIMEOUT_MILLIS = 30 * 60 * 1000L;

    private static final MediaType UTF8_TEXT = new MediaType("text", "plain", StandardCharsets.UTF_8);

    private final GenerationHandler generationHandler;
    private final CompletionFormatter formatter;
    private final ChatRequestParser parser;
    private final ModelCatalog modelCatalog;
    private final ThreadPoolTaskExecutor generationExecutor;

    @GetMapping("/models")
    public ObjectNode listModels() {
        return formatter.models(modelCatalog.all());
    }

    @PostMapping("/chat/completions")
    public Object chatCompletions(@RequestBody JsonNode body) {
        ChatRequest chat = parser.parse(body);
        ModelSpec spec = modelCatalog.find(chat.getModel())
                .orElseThrow(() -> new ValidationException("不支持的模型: " + chat.getModel()));

        GenerationRequest request = GenerationRequest.builder()
                .model(chat.getModel())
                .prompt(chat.getPrompt())
                .images(chat.getImages())
                .requestOrigin(ServletUriComponentsBuilder.fromCurrentContextPath().build().toUriString())
                .build();

        log.info("收到生成请求, 模型: {}, 流式: {}, 图片: {} 张", chat.getModel(), chat.isStream(), chat.getImages().size());

        if (!chat.isStream()) {
            GenerationResult result = generationHandler.generate(request, line -> log.debug("[{}] {}", chat.getModel(), line));
            return formatter.completion(result);
        }

        SseEmitter emitter = new SseEmitter(SSE_TIMEOUT_MILLIS);
        generationExecutor.execute(() -> stream(emitter, spec, request));
        return emitter;
    }

    private void stream(SseEmitter emitter, ModelSpec spec, GenerationRequest request) {
        String model = spec.getId();
        try {
            send(emitter, formatter.startChunk(model, spec.getType()).toString());
            GenerationResult result = generationHandler.generate(request,
                    line -> send(emitter, formatter.progressChunk(model, line).toString()));
            send(emitter, formatter.finalChunk(result).toString());
            send(emitter, CompletionFormatter.DONE);
        } catch (FlowgateException e) {
            log.warn("流式生成失败: [{}] {}", e.getErrorCode(), e.getMessage());
            send(emitter, formatter.progressChunk(model, "❌ " + e.getMessage()).toString());
            send(emitter, formatter.error(e.getMessage(), e.getErrorCode()).toString());
        } catch (RuntimeException e) {
            log.error("流式生成异常", e);
            send(emitter, formatter.progressChunk(model, "❌ 生成失败: " + e.getMessage()).toString());
            send(emitter, formatter.error("生成失败: " + e.getMessage(), "generation_failed").toString());
        }
        emitter.complete();
    }

    private void send(SseEmitter emitter, String data) {
        try {
            emitter.send(SseEmitter.event().data(data, UTF8_TEXT));
        } catch (IOException | IllegalStateException e) {
            log.warn("SSE 发送失败 (客户端可能已断开): {}", e.getMessage());
        }
    }
}
