package com.flowgate.common.dto;

/**
 * 生成媒体类型，同时作为账号能力开关与并发槽位的维度。
 */
public enum GenerationType {

    IMAGE("图片"),
    VIDEO("视频");

    private final String label;

    GenerationType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
