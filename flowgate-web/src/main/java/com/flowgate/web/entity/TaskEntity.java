package com.flowgate.web.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * 视频生成任务表。result_urls 存 JSON 数组。
 */
@Table("t_task")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskEntity {

    @Id
    private Long id;

    private String taskId;
    private Long tokenId;
    private String model;
    private String prompt;
    private String status;

    @Builder.Default
    private Integer progress = 0;

    private String resultUrls;
    private String errorMessage;
    private String sceneId;
    private Long createdAt;
    private Long completedAt;
}
