package com.edgechat.model;

import java.util.Arrays;
import java.util.Optional;

public enum ConfigKey {
    MAX_TOKENS("Max tokens", "maxTokens"),
    TOPK("TopK", "topK"),
    TOPP("TopP", "topP"),
    TEMPERATURE("Temperature", "temperature"),
    ACCELERATOR("Choose accelerator", "accelerator");

    private final String label;
    private final String id;

    ConfigKey(String label, String id) {
        this.label = label;
        this.id = id;
    }

    public String label() {
        return label;
    }

    public String id() {
        return id;
    }

    public static Optional<ConfigKey> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(key -> key.id.equalsIgnoreCase(id.trim()))
                .findFirst();
    }
}
