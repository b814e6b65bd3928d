package com.flowgate.ai.model;

/**
 * 视频模型的输入方式。
 */
public enum VideoKind {

    /** 文生视频，不接受图片 */
    TEXT,

    /** 首尾帧，1-2 张图片 */
    START_END,

    /** 多图参考，0..n 张图片 */
    REFERENCES
}
