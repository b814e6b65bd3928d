package com.flowgate.web.dto;

import com.flowgate.common.dto.Token;
import com.flowgate.common.dto.TokenStats;
import com.flowgate.common.util.SecretMasker;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * 管理接口返回的账号信息，凭证脱敏。
 */
@Data
@Builder
public class TokenView {

    private Long id;
    private String st;
    private String at;
    private Instant atExpires;
    private String email;
    private String name;
    private String remark;
    private boolean active;
    private String banReason;
    private Instant bannedAt;
    private int credits;
    private String paygateTier;
    private String currentProjectId;
    private String currentProjectName;
    private boolean imageEnabled;
    private boolean videoEnabled;
    private int imageConcurrency;
    private int videoConcurrency;
    private long useCount;
    private Instant lastUsedAt;
    private Instant createdAt;
    private TokenStats stats;

    public static TokenView of(Token token, TokenStats stats) {
        return TokenView.builder()
                .id(token.getId())
                .st(SecretMasker.mask(token.getSessionToken()))
                .at(SecretMasker.mask(token.getAccessToken()))
                .atExpires(token.getAccessTokenExpires())
                .email(token.getEmail())
                .name(token.getName())
                .remark(token.getRemark())
                .active(token.isActive())
                .banReason(token.getBanReason())
                .bannedAt(token.getBannedAt())
                .credits(token.getCredits())
                .paygateTier(token.getPaygateTier())
                .currentProjectId(token.getCurrentProjectId())
                .currentProjectName(token.getCurrentProjectName())
                .imageEnabled(token.isImageEnabled())
                .videoEnabled(token.isVideoEnabled())
                .imageConcurrency(token.getImageConcurrency())
                .videoConcurrency(token.getVideoConcurrency())
                .useCount(token.getUseCount())
                .lastUsedAt(token.getLastUsedAt())
                .createdAt(token.getCreatedAt())
                .stats(stats)
                .build();
    }
}
