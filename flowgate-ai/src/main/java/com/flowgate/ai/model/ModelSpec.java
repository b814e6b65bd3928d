package com.flowgate.ai.model;

import com.flowgate.common.dto.GenerationType;
import lombok.Builder;
import lombok.Value;

/**
 * 对外模型与上游模型参数的对应关系。
 */
@Value
@Builder
public class ModelSpec {

    public static final int UNBOUNDED = Integer.MAX_VALUE;

    String id;
    GenerationType type;

    /** 图片为 imageModelName，视频为 videoModelKey */
    String upstreamModel;

    String aspectRatio;

    /** 仅视频模型有值 */
    VideoKind videoKind;

    int minImages;
    int maxImages;

    public boolean isImage() {
        return type == GenerationType.IMAGE;
    }
}
