package com.flowgate.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 一次提交到上游的视频生成任务。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class GenerationTask {

    private Long id;

    /** 上游 operation name */
    private String taskId;

    private Long tokenId;
    private String model;
    private String prompt;

    @Builder.Default
    private TaskStatus status = TaskStatus.PROCESSING;

    @Builder.Default
    private int progress = 0;

    @Builder.Default
    private List<String> resultUrls = new ArrayList<>();

    private String errorMessage;
    private String sceneId;
    private Instant createdAt;
    private Instant completedAt;
}
