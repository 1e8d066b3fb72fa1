package com.edgechat.model;

import java.util.Objects;

import com.edgechat.inference.task.LlmEngine;
import com.edgechat.inference.task.LlmSession;

public final class TaskModelInstance implements ModelInstance {
    private final LlmEngine engine;
    private volatile LlmSession session;

    public TaskModelInstance(LlmEngine engine, LlmSession session) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.session = session;
    }

    public LlmEngine engine() {
        return engine;
    }

    public LlmSession session() {
        return session;
    }

    public void replaceSession(LlmSession session) {
        this.session = session;
    }
}
