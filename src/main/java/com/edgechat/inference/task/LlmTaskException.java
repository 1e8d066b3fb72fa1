package com.edgechat.inference.task;

public class LlmTaskException extends RuntimeException {
    public LlmTaskException(String message) {
        super(message);
    }

    public LlmTaskException(String message, Throwable cause) {
        super(message, cause);
    }
}
