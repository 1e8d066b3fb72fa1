package com.edgechat.inference.task;

/**
 * Service provider interface of an on-device LLM task runtime. Implementations are discovered with
 * {@link java.util.ServiceLoader} through {@link LlmTaskRuntimes#load()}.
 */
public interface LlmTaskRuntime {
    String name();

    LlmEngine createEngine(EngineOptions options);

    LlmSession createSession(LlmEngine engine, SessionOptions options);
}
