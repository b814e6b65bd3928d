package com.flowgate.web.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 从 OpenAI 格式请求中解析出的生成参数。
 */
@Value
@Builder
public class ChatRequest {

    String model;
    String prompt;
    boolean stream;

    @Singular
    List<byte[]> images;
}
