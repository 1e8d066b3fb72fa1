package com.edgechat.inference.genie;

/**
 * The three entry points of the Genie wrapper library. Handles are opaque; zero means no model.
 */
public interface GenieBindings {
    /**
     * @return handle of the loaded model, or 0 on failure
     */
    long loadModel(String modelDirPath, String htpConfigPath);

    void getResponseForPrompt(long nativeHandle, String userInput, StringCallback callback);

    void freeModel(long nativeHandle);
}
