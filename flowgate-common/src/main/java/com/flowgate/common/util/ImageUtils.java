package com.flowgate.common.util;

import java.util.Base64;
import java.util.Optional;

/**
 * 图片数据处理工具类。
 */
public final class ImageUtils {

    private static final String DATA_URI_PREFIX = "data:";
    private static final String BASE64_MARKER = ";base64,";

    private ImageUtils() {
    }

    /**
     * 解析 data URI（data:image/png;base64,xxxx），非 data URI 返回 empty。
     */
    public static Optional<byte[]> decodeDataUri(String uri) {
        if (uri == null || !uri.startsWith(DATA_URI_PREFIX)) {
            return Optional.empty();
        }
        int idx = uri.indexOf(BASE64_MARKER);
        if (idx < 0) {
            return Optional.empty();
        }
        String payload = uri.substring(idx + BASE64_MARKER.length());
        try {
            return Optional.of(Base64.getMimeDecoder().decode(payload));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("图片 base64 数据格式错误", e);
        }
    }

    /**
     * 字节数组转 Base64 字符串。
     */
    public static String toBase64(byte[] bytes) {
        return Base64.getEncoder().encodeToString(bytes);
    }
}
