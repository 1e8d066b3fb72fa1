package com.edgechat.model;

import java.util.Arrays;
import java.util.Optional;

public enum Accelerator {
    CPU("CPU"),
    GPU("GPU"),
    GENIE("Genie");

    private final String label;

    Accelerator(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Optional<Accelerator> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(accelerator -> accelerator.label.equalsIgnoreCase(label.trim()))
                .findFirst();
    }
}
