package com.edgechat.inference.task;

public record SessionOptions(
        int topK,
        float topP,
        float temperature,
        boolean enableVisionModality) {

    public SessionOptions {
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive: " + topK);
        }
        if (topP < 0.0f || topP > 1.0f) {
            throw new IllegalArgumentException("topP must be within [0, 1]: " + topP);
        }
        if (temperature < 0.0f) {
            throw new IllegalArgumentException("temperature must not be negative: " + temperature);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int topK = 40;
        private float topP = 1.0f;
        private float temperature = 0.8f;
        private boolean enableVisionModality;

        private Builder() {
        }

        public Builder setTopK(int topK) {
            this.topK = topK;
            return this;
        }

        public Builder setTopP(float topP) {
            this.topP = topP;
            return this;
        }

        public Builder setTemperature(float temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder setEnableVisionModality(boolean enableVisionModality) {
            this.enableVisionModality = enableVisionModality;
            return this;
        }

        public SessionOptions build() {
            return new SessionOptions(topK, topP, temperature, enableVisionModality);
        }
    }
}
