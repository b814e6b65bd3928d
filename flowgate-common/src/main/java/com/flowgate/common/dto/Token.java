package com.flowgate.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 上游账号凭证（Token）。
 * <p>
 * 一个 Token 对应一个借用的上游账号：长期有效的 Session Token（ST）
 * 与由其换取的短期 Access Token（AT）。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Token {

    /** 不限制并发 */
    public static final int UNLIMITED = -1;

    private Long id;

    /** Session Token（长期凭证，唯一） */
    private String sessionToken;

    /** Access Token（短期凭证） */
    private String accessToken;

    /** AT 过期时间 */
    private Instant accessTokenExpires;

    /** 账号邮箱，解析成功后唯一 */
    private String email;

    private String name;

    private String remark;

    @Builder.Default
    private boolean active = true;

    private Instant createdAt;

    private Instant lastUsedAt;

    @Builder.Default
    private long useCount = 0;

    /** 剩余积分 */
    @Builder.Default
    private int credits = 0;

    /** 账号等级，如 PAYGATE_TIER_ONE */
    private String paygateTier;

    /** 当前绑定的项目 */
    private String currentProjectId;

    private String currentProjectName;

    @Builder.Default
    private boolean imageEnabled = true;

    @Builder.Default
    private boolean videoEnabled = true;

    /** 图片并发上限，-1 表示不限 */
    @Builder.Default
    private int imageConcurrency = UNLIMITED;

    /** 视频并发上限，-1 表示不限 */
    @Builder.Default
    private int videoConcurrency = UNLIMITED;

    /** 封禁原因，如 429_rate_limit */
    private String banReason;

    private Instant bannedAt;

    public boolean isEnabledFor(GenerationType type) {
        return type == GenerationType.IMAGE ? imageEnabled : videoEnabled;
    }

    public int concurrencyLimitFor(GenerationType type) {
        return type == GenerationType.IMAGE ? imageConcurrency : videoConcurrency;
    }
}
