package com.flowgate.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 上游调用日志，用于排查账号健康度。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RequestLog {

    private Long id;
    private Long tokenId;
    private String operation;
    private String requestBody;
    private String responseBody;
    private int statusCode;
    private long durationMs;
    private Instant createdAt;
}
