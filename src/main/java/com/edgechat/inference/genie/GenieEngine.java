package com.edgechat.inference.genie;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns one model loaded by the Genie native engine.
 *
 * <p>The native handle is nonzero from construction until {@link #close()}; after that every
 * generation request is rejected. Closing is explicit and idempotent.
 */
public class GenieEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(GenieEngine.class);

    private final GenieBindings bindings;
    private long nativeHandle;

    /**
     * Loads a model bundle through the default JNI bindings.
     *
     * @param modelDirPath directory holding the model bundle
     * @param htpConfigPath HTP backend config file
     */
    public GenieEngine(String modelDirPath, String htpConfigPath) {
        this(modelDirPath, htpConfigPath, new JniGenieBindings());
    }

    public GenieEngine(String modelDirPath, String htpConfigPath, GenieBindings bindings) {
        this.bindings = Objects.requireNonNull(bindings, "bindings");
        nativeHandle = bindings.loadModel(modelDirPath, htpConfigPath);
        if (nativeHandle == 0) {
            throw new GenieException("Failed to load Genie model. Handle: " + nativeHandle);
        }
        log.debug("Loaded Genie model from {} with HTP config {}", modelDirPath, htpConfigPath);
    }

    /**
     * Streams the response for {@code userInput} to {@code callback}.
     *
     * @throws IllegalStateException if the engine was closed
     */
    public synchronized void getResponseForPrompt(String userInput, StringCallback callback) {
        if (nativeHandle == 0) {
            throw new IllegalStateException("Genie model not loaded or handle is invalid.");
        }
        bindings.getResponseForPrompt(nativeHandle, userInput, callback);
    }

    public synchronized boolean isLoaded() {
        return nativeHandle != 0;
    }

    @Override
    public synchronized void close() {
        if (nativeHandle != 0) {
            bindings.freeModel(nativeHandle);
            nativeHandle = 0;
        }
    }
}
