package com.flowgate.web.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.flowgate.common.exception.ValidationException;
import com.flowgate.common.util.ImageUtils;
import com.flowgate.web.dto.ChatRequest;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 解析 OpenAI Chat Completions 请求。
 * <p>
 * 只取最后一条 user 消息：文本部分拼接为提示词，image_url 部分作为参考图（仅支持 base64 data URI）。
 */
@Component
public class ChatRequestParser {

    public ChatRequest parse(JsonNode body) {
        if (body == null || !body.isObject()) {
            throw new ValidationException("请求体必须是 JSON 对象");
        }
        String model = body.path("model").asText("");
        if (model.isBlank()) {
            throw new ValidationException("缺少 model 参数");
        }

        JsonNode message = lastUserMessage(body.path("messages"))
                .orElseThrow(() -> new ValidationException("messages 中没有 user 消息"));

        ChatRequest.ChatRequestBuilder request = ChatRequest.builder()
                .model(model)
                .stream(body.path("stream").asBoolean(false));

        JsonNode content = message.path("content");
        if (content.isTextual()) {
            return request.prompt(content.asText().trim()).build();
        }
        if (!content.isArray()) {
            throw new ValidationException("不支持的消息内容格式");
        }

        StringBuilder prompt = new StringBuilder();
        for (JsonNode part : content) {
            String type = part.path("type").asText("");
            if ("text".equals(type)) {
                if (prompt.length() > 0) {
                    prompt.append('\n');
                }
                prompt.append(part.path("text").asText(""));
            } else if ("image_url".equals(type)) {
                request.image(decodeImage(part.path("image_url").path("url").asText("")));
            }
        }
        return request.prompt(prompt.toString().trim()).build();
    }

    private Optional<JsonNode> lastUserMessage(JsonNode messages) {
        if (!messages.isArray()) {
            return Optional.empty();
        }
        for (int i = messages.size() - 1; i >= 0; i--) {
            JsonNode message = messages.get(i);
            if ("user".equals(message.path("role").asText())) {
                return Optional.of(message);
            }
        }
        return Optional.empty();
    }

    private byte[] decodeImage(String url) {
        byte[] bytes;
        try {
            bytes = ImageUtils.decodeDataUri(url)
                    .orElseThrow(() -> new ValidationException("仅支持 base64 data URI 格式的图片"));
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage());
        }
        if (bytes.length == 0) {
            throw new ValidationException("图片数据为空");
        }
        return bytes;
    }
}
