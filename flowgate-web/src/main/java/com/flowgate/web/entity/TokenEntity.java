package com.flowgate.web.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * 上游账号表。时间字段统一存毫秒时间戳。
 */
@Table("t_token")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenEntity {

    @Id
    private Long id;

    private String sessionToken;
    private String accessToken;
    private Long accessTokenExpires;
    private String email;
    private String name;
    private String remark;

    @Builder.Default
    private Boolean active = true;

    private Long createdAt;
    private Long lastUsedAt;

    @Builder.Default
    private Integer useCount = 0;

    @Builder.Default
    private Integer credits = 0;

    private String paygateTier;
    private String currentProjectId;
    private String currentProjectName;

    @Builder.Default
    private Boolean imageEnabled = true;

    @Builder.Default
    private Boolean videoEnabled = true;

    @Builder.Default
    private Integer imageConcurrency = -1;

    @Builder.Default
    private Integer videoConcurrency = -1;

    private String banReason;
    private Long bannedAt;
}
