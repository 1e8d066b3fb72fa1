package com.edgechat.inference.task;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.net.URL;
import java.net.URLClassLoader;

import org.junit.jupiter.api.Test;

class LlmTaskRuntimesTest {

    @Test
    void shouldDiscoverRegisteredRuntime() {
        LlmTaskRuntime runtime = LlmTaskRuntimes.load(getClass().getClassLoader());

        assertInstanceOf(FakeLlmTaskRuntime.class, runtime);
        assertEquals("fake", runtime.name());
    }

    @Test
    void shouldFallBackToUnavailableRuntimeWhenNothingIsRegistered() throws Exception {
        try (URLClassLoader empty = new URLClassLoader(new URL[0], null)) {
            LlmTaskRuntime runtime = LlmTaskRuntimes.load(empty);

            assertEquals("unavailable", runtime.name());
            LlmTaskException ex = assertThrows(LlmTaskException.class, () -> runtime.createEngine(
                    EngineOptions.builder().setModelPath("/models/a.task").build()));
            assertEquals("No LLM task runtime is registered", ex.getMessage());
        }
    }
}
