package com.edgechat.inference.task;

import java.util.Iterator;
import java.util.ServiceLoader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LlmTaskRuntimes {
    private static final Logger log = LoggerFactory.getLogger(LlmTaskRuntimes.class);

    private LlmTaskRuntimes() {
    }

    public static LlmTaskRuntime load() {
        return load(Thread.currentThread().getContextClassLoader());
    }

    public static LlmTaskRuntime load(ClassLoader classLoader) {
        Iterator<LlmTaskRuntime> providers = ServiceLoader.load(LlmTaskRuntime.class, classLoader).iterator();
        if (!providers.hasNext()) {
            log.warn("No LLM task runtime registered; task-runtime models will fail to initialize");
            return unavailable();
        }
        LlmTaskRuntime runtime = providers.next();
        if (providers.hasNext()) {
            log.warn("Several LLM task runtimes registered; using {}", runtime.name());
        } else {
            log.debug("Using LLM task runtime {}", runtime.name());
        }
        return runtime;
    }

    public static LlmTaskRuntime unavailable() {
        return new UnavailableRuntime();
    }

    private static final class UnavailableRuntime implements LlmTaskRuntime {
        @Override
        public String name() {
            return "unavailable";
        }

        @Override
        public LlmEngine createEngine(EngineOptions options) {
            throw new LlmTaskException("No LLM task runtime is registered");
        }

        @Override
        public LlmSession createSession(LlmEngine engine, SessionOptions options) {
            throw new LlmTaskException("No LLM task runtime is registered");
        }
    }
}
