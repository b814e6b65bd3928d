package com.flowgate.ai.client;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 一次视频提交所需的参数。
 */
@Value
@Builder
public class VideoRequest {

    String accessToken;
    String projectId;
    String prompt;
    String modelKey;
    String aspectRatio;
    String paygateTier;

    /** 首帧 mediaId（首尾帧模型） */
    String startMediaId;

    /** 尾帧 mediaId（首尾帧模型，可空） */
    String endMediaId;

    /** 参考图 mediaId（多图参考模型） */
    @Singular
    List<String> referenceMediaIds;
}
