package com.flowgate.web.dto;

import com.flowgate.common.dto.Token;
import lombok.Data;

/**
 * 新增或修改账号的请求体。
 */
@Data
public class TokenRequest {

    private String st;
    private String remark;
    private Boolean imageEnabled;
    private Boolean videoEnabled;
    private Integer imageConcurrency;
    private Integer videoConcurrency;

    /**
     * 转为账号草稿，未填写的字段取 base 中的值。
     */
    public Token toDraft(Token base) {
        return base.toBuilder()
                .sessionToken(st)
                .remark(remark != null ? remark : base.getRemark())
                .imageEnabled(imageEnabled != null ? imageEnabled : base.isImageEnabled())
                .videoEnabled(videoEnabled != null ? videoEnabled : base.isVideoEnabled())
                .imageConcurrency(imageConcurrency != null ? imageConcurrency : base.getImageConcurrency())
                .videoConcurrency(videoConcurrency != null ? videoConcurrency : base.getVideoConcurrency())
                .build();
    }
}
