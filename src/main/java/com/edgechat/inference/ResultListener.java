package com.edgechat.inference;

/**
 * Receives generated text as it streams. The invocation with {@code done == true} is the terminal
 * one; its text may be empty or an error message.
 */
@FunctionalInterface
public interface ResultListener {
    void onResult(String partialResult, boolean done);
}
