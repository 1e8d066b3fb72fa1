package com.edgechat.inference.task;

import java.awt.image.BufferedImage;

import com.edgechat.inference.ResultListener;

/**
 * One conversation with an {@link LlmEngine}. Query chunks and images accumulate until
 * {@link #generateResponseAsync(ResultListener)} is called; the runtime then streams the answer to
 * the listener from its own threads.
 */
public interface LlmSession extends AutoCloseable {
    void addQueryChunk(String inputText);

    void addImage(BufferedImage image);

    void generateResponseAsync(ResultListener resultListener);

    @Override
    void close();
}
