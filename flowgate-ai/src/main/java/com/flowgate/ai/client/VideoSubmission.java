package com.flowgate.ai.client;

import com.fasterxml.jackson.databind.node.ArrayNode;
import lombok.Value;

/**
 * 视频提交后的操作句柄。operations 原样用于后续状态查询。
 */
@Value
public class VideoSubmission {

    /** operation name，同时作为任务 ID */
    String operationName;

    String sceneId;

    ArrayNode operations;
}
