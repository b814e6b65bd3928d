package com.flowgate.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * 账号用量与错误计数。
 * <p>
 * 累计计数从不清零；today 前缀的计数在日期变化时重置；
 * consecutiveErrorCount 在成功或手动启用时清零。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TokenStats {

    private Long tokenId;

    private long imageCount;
    private long videoCount;
    private long successCount;
    private long errorCount;

    private Instant lastSuccessAt;
    private Instant lastErrorAt;

    private long todayImageCount;
    private long todayVideoCount;
    private long todayErrorCount;

    /** today 计数所属日期 */
    private LocalDate todayDate;

    private int consecutiveErrorCount;

    public static TokenStats empty(Long tokenId) {
        return TokenStats.builder().tokenId(tokenId).build();
    }
}
