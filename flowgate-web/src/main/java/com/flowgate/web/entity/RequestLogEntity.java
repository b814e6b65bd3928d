package com.flowgate.web.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * 生成请求日志，排查账号健康度。
 */
@Table("t_request_log")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RequestLogEntity {

    @Id
    private Long id;

    private Long tokenId;
    private String operation;
    private String requestBody;
    private String responseBody;
    private Integer statusCode;
    private Long durationMs;
    private Long createdAt;
}
