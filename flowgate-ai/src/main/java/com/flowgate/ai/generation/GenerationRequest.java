package com.flowgate.ai.generation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 一次生成请求。
 */
@Value
@Builder
public class GenerationRequest {

    String model;
    String prompt;

    /** 参考图原始字节，按请求中的顺序 */
    @Singular
    List<byte[]> images;

    /** 请求来源地址，未配置缓存域名时用于拼接缓存文件地址 */
    String requestOrigin;
}
