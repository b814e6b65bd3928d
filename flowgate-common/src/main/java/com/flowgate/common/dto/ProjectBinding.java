package com.flowgate.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 账号与上游项目的绑定关系。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ProjectBinding {

    private Long id;
    private String projectId;
    private Long tokenId;
    private String projectName;

    @Builder.Default
    private String toolName = "PINHOLE";

    @Builder.Default
    private boolean active = true;

    private Instant createdAt;
}
