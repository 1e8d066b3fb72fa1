package com.edgechat.inference.task;

import java.util.Objects;

public record EngineOptions(
        String modelPath,
        int maxTokens,
        PreferredBackend preferredBackend,
        int maxNumImages) {

    public EngineOptions {
        if (modelPath == null || modelPath.isBlank()) {
            throw new IllegalArgumentException("modelPath must not be blank");
        }
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive: " + maxTokens);
        }
        if (maxNumImages < 0) {
            throw new IllegalArgumentException("maxNumImages must not be negative: " + maxNumImages);
        }
        Objects.requireNonNull(preferredBackend, "preferredBackend");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String modelPath;
        private int maxTokens = 512;
        private PreferredBackend preferredBackend = PreferredBackend.GPU;
        private int maxNumImages = 0;

        private Builder() {
        }

        public Builder setModelPath(String modelPath) {
            this.modelPath = modelPath;
            return this;
        }

        public Builder setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder setPreferredBackend(PreferredBackend preferredBackend) {
            this.preferredBackend = preferredBackend;
            return this;
        }

        public Builder setMaxNumImages(int maxNumImages) {
            this.maxNumImages = maxNumImages;
            return this;
        }

        public EngineOptions build() {
            return new EngineOptions(modelPath, maxTokens, preferredBackend, maxNumImages);
        }
    }
}
