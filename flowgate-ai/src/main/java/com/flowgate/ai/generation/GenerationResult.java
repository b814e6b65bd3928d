package com.flowgate.ai.generation;

import com.flowgate.common.dto.GenerationType;
import lombok.Builder;
import lombok.Value;

/**
 * 生成结果。
 */
@Value
@Builder
public class GenerationResult {

    String model;
    GenerationType type;
    long tokenId;

    /** 返回给调用方的地址：缓存成功时为本地地址，否则为上游地址 */
    String url;

    String upstreamUrl;
    boolean cached;

    /** 视频任务的上游 operation name，图片为 null */
    String taskId;
}
