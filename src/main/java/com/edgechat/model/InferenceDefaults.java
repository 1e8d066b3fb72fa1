package com.edgechat.model;

/**
 * Sampling and placement values used when a model does not configure its own.
 */
public record InferenceDefaults(
        int maxTokens,
        int topK,
        float topP,
        float temperature,
        String accelerator) {

    public static final int DEFAULT_MAX_TOKEN = 1024;
    public static final int DEFAULT_TOPK = 40;
    public static final float DEFAULT_TOPP = 0.9f;
    public static final float DEFAULT_TEMPERATURE = 1.0f;

    public static InferenceDefaults standard() {
        return new InferenceDefaults(
                DEFAULT_MAX_TOKEN,
                DEFAULT_TOPK,
                DEFAULT_TOPP,
                DEFAULT_TEMPERATURE,
                Accelerator.GPU.label());
    }
}
