package com.edgechat.inference.genie;

/**
 * Token sink handed to the native engine. Called from the engine's own thread.
 */
public interface StringCallback {
    void onResponse(String token);

    void onError(String errorMessage);

    void onComplete();
}
