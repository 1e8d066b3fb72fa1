package com.edgechat.model;

import java.util.Objects;

import com.edgechat.inference.genie.GenieEngine;

public record GenieModelInstance(GenieEngine engine) implements ModelInstance {
    public GenieModelInstance {
        Objects.requireNonNull(engine, "engine");
    }
}
