package com.flowgate.ai.model;

import com.flowgate.common.dto.GenerationType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 支持的模型列表。
 */
@Component
public class ModelCatalog {

    private static final String IMAGE_LANDSCAPE = "IMAGE_ASPECT_RATIO_LANDSCAPE";
    private static final String IMAGE_PORTRAIT = "IMAGE_ASPECT_RATIO_PORTRAIT";
    private static final String VIDEO_LANDSCAPE = "VIDEO_ASPECT_RATIO_LANDSCAPE";
    private static final String VIDEO_PORTRAIT = "VIDEO_ASPECT_RATIO_PORTRAIT";

    private final Map<String, ModelSpec> models = new LinkedHashMap<>();

    public ModelCatalog() {
        image("gemini-2.5-flash-image-landscape", "GEM_PIX", IMAGE_LANDSCAPE);
        image("gemini-2.5-flash-image-portrait", "GEM_PIX", IMAGE_PORTRAIT);
        image("gemini-3.0-pro-image-landscape", "GEM_PIX_2", IMAGE_LANDSCAPE);
        image("gemini-3.0-pro-image-portrait", "GEM_PIX_2", IMAGE_PORTRAIT);
        image("imagen-4.0-generate-preview-landscape", "IMAGEN_3_5", IMAGE_LANDSCAPE);
        image("imagen-4.0-generate-preview-portrait", "IMAGEN_3_5", IMAGE_PORTRAIT);

        video("veo_3_1_t2v_fast_portrait", "veo_3_1_t2v_fast_portrait", VIDEO_PORTRAIT, VideoKind.TEXT);
        video("veo_3_1_t2v_fast_landscape", "veo_3_1_t2v_fast", VIDEO_LANDSCAPE, VideoKind.TEXT);
        video("veo_2_1_fast_d_15_t2v_portrait", "veo_2_1_fast_d_15_t2v", VIDEO_PORTRAIT, VideoKind.TEXT);
        video("veo_2_1_fast_d_15_t2v_landscape", "veo_2_1_fast_d_15_t2v", VIDEO_LANDSCAPE, VideoKind.TEXT);
        video("veo_2_0_t2v_portrait", "veo_2_0_t2v", VIDEO_PORTRAIT, VideoKind.TEXT);
        video("veo_2_0_t2v_landscape", "veo_2_0_t2v", VIDEO_LANDSCAPE, VideoKind.TEXT);

        video("veo_3_1_i2v_s_fast_fl_portrait", "veo_3_1_i2v_s_fast_portrait_fl_ultra_relaxed",
                VIDEO_PORTRAIT, VideoKind.START_END);
        video("veo_3_1_i2v_s_fast_fl_landscape", "veo_3_1_i2v_s_fast_landscape_fl_ultra_relaxed",
                VIDEO_LANDSCAPE, VideoKind.START_END);
        video("veo_2_1_fast_d_15_i2v_portrait", "veo_2_1_fast_d_15_i2v", VIDEO_PORTRAIT, VideoKind.START_END);
        video("veo_2_1_fast_d_15_i2v_landscape", "veo_2_1_fast_d_15_i2v", VIDEO_LANDSCAPE, VideoKind.START_END);
        video("veo_2_0_i2v_portrait", "veo_2_0_i2v", VIDEO_PORTRAIT, VideoKind.START_END);
        video("veo_2_0_i2v_landscape", "veo_2_0_i2v", VIDEO_LANDSCAPE, VideoKind.START_END);

        video("veo_3_0_r2v_fast_portrait", "veo_3_0_r2v_fast", VIDEO_PORTRAIT, VideoKind.REFERENCES);
        video("veo_3_0_r2v_fast_landscape", "veo_3_0_r2v_fast", VIDEO_LANDSCAPE, VideoKind.REFERENCES);
    }

    public Optional<ModelSpec> find(String modelId) {
        return modelId == null ? Optional.empty() : Optional.ofNullable(models.get(modelId));
    }

    /** 按注册顺序 */
    public List<ModelSpec> all() {
        return Collections.unmodifiableList(new ArrayList<>(models.values()));
    }

    private void image(String id, String modelName, String aspectRatio) {
        register(ModelSpec.builder()
                .id(id)
                .type(GenerationType.IMAGE)
                .upstreamModel(modelName)
                .aspectRatio(aspectRatio)
                .minImages(0)
                .maxImages(ModelSpec.UNBOUNDED)
                .build());
    }

    private void video(String id, String modelKey, String aspectRatio, VideoKind kind) {
        int min = kind == VideoKind.START_END ? 1 : 0;
        int max;
        switch (kind) {
            case TEXT:
                max = 0;
                break;
            case START_END:
                max = 2;
                break;
            default:
                max = ModelSpec.UNBOUNDED;
        }
        register(ModelSpec.builder()
                .id(id)
                .type(GenerationType.VIDEO)
                .upstreamModel(modelKey)
                .aspectRatio(aspectRatio)
                .videoKind(kind)
                .minImages(min)
                .maxImages(max)
                .build());
    }

    private void register(ModelSpec spec) {
        models.put(spec.getId(), spec);
    }
}
