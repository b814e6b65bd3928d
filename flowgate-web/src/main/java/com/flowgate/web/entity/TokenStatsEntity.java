package com.flowgate.web.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * 账号统计表，today_* 字段按 today_date 翻转。
 */
@Table("t_token_stats")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenStatsEntity {

    @Id
    private Long id;

    private Long tokenId;

    @Builder.Default
    private Integer imageCount = 0;
    @Builder.Default
    private Integer videoCount = 0;
    @Builder.Default
    private Integer successCount = 0;
    @Builder.Default
    private Integer errorCount = 0;

    private Long lastSuccessAt;
    private Long lastErrorAt;

    @Builder.Default
    private Integer todayImageCount = 0;
    @Builder.Default
    private Integer todayVideoCount = 0;
    @Builder.Default
    private Integer todayErrorCount = 0;

    /** yyyy-MM-dd */
    private String todayDate;

    @Builder.Default
    private Integer consecutiveErrorCount = 0;
}
