package com.edgechat.inference.task;

/**
 * A loaded model inside the task runtime. Sessions are created against an engine and must be
 * closed before it.
 */
public interface LlmEngine extends AutoCloseable {
    @Override
    void close();
}
