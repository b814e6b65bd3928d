package com.flowgate.ai.generation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowgate.ai.model.ModelSpec;
import com.flowgate.common.dto.GenerationType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * OpenAI Chat Completions 格式的响应构造。
 * <p>
 * 流式：进度放在 delta.reasoning_content，最终媒体放在 delta.content 并带 finish_reason=stop；
 * 非流式：一个 chat.completion 对象。
 */
@Component
@RequiredArgsConstructor
public class CompletionFormatter {

    public static final String DONE = "[DONE]";

    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();

    // ======================== 流式 ========================

    public ObjectNode startChunk(String model, GenerationType type) {
        ObjectNode chunk = chunk(model, null);
        ObjectNode delta = delta(chunk);
        delta.put("role", "assistant");
        delta.put("reasoning_content", "✨ " + type.getLabel() + "生成任务已启动\n");
        return chunk;
    }

    public ObjectNode progressChunk(String model, String text) {
        ObjectNode chunk = chunk(model, null);
        delta(chunk).put("reasoning_content", text.endsWith("\n") ? text : text + "\n");
        return chunk;
    }

    public ObjectNode finalChunk(GenerationResult result) {
        ObjectNode chunk = chunk(result.getModel(), "stop");
        delta(chunk).put("content", streamMarkup(result.getType(), result.getUrl()));
        return chunk;
    }

    // ======================== 非流式 ========================

    public ObjectNode completion(GenerationResult result) {
        ObjectNode completion = objectMapper.createObjectNode();
        completion.put("id", completionId());
        completion.put("object", "chat.completion");
        completion.put("created", clock.instant().getEpochSecond());
        completion.put("model", result.getModel());

        ObjectNode choice = completion.putArray("choices").addObject();
        choice.put("index", 0);
        ObjectNode message = choice.putObject("message");
        message.put("role", "assistant");
        message.put("content", blockingMarkup(result.getType(), result.getUrl()));
        choice.put("finish_reason", "stop");
        return completion;
    }

    public ObjectNode error(String message, String code) {
        ObjectNode envelope = objectMapper.createObjectNode();
        ObjectNode error = envelope.putObject("error");
        error.put("message", message);
        error.put("type", "invalid_request_error");
        error.put("code", code);
        return envelope;
    }

    public ObjectNode models(List<ModelSpec> models) {
        ObjectNode list = objectMapper.createObjectNode();
        list.put("object", "list");
        ArrayNode data = list.putArray("data");
        long created = clock.instant().getEpochSecond();
        for (ModelSpec spec : models) {
            ObjectNode model = data.addObject();
            model.put("id", spec.getId());
            model.put("object", "model");
            model.put("created", created);
            model.put("owned_by", "flowgate");
            model.put("description", spec.getType().getLabel() + " - " + spec.getUpstreamModel());
        }
        return list;
    }

    // ======================== 媒体标记 ========================

    public static String streamMarkup(GenerationType type, String url) {
        if (type == GenerationType.VIDEO) {
            return "<video src='" + url + "' controls style='max-width:100%'></video>";
        }
        return "![Generated Image](" + url + ")";
    }

    public static String blockingMarkup(GenerationType type, String url) {
        if (type == GenerationType.VIDEO) {
            return "```html\n<video src='" + url + "' controls></video>\n```";
        }
        return "![Generated Image](" + url + ")";
    }

    private ObjectNode chunk(String model, String finishReason) {
        ObjectNode chunk = objectMapper.createObjectNode();
        chunk.put("id", completionId());
        chunk.put("object", "chat.completion.chunk");
        chunk.put("created", clock.instant().getEpochSecond());
        chunk.put("model", model);
        ObjectNode choice = chunk.putArray("choices").addObject();
        choice.put("index", 0);
        choice.putObject("delta");
        if (finishReason == null) {
            choice.putNull("finish_reason");
        } else {
            choice.put("finish_reason", finishReason);
        }
        return chunk;
    }

    private static ObjectNode delta(ObjectNode chunk) {
        return (ObjectNode) chunk.path("choices").path(0).path("delta");
    }

    private String completionId() {
        return "chatcmpl-" + clock.instant().getEpochSecond();
    }
}
