package com.edgechat.inference.genie;

public class GenieException extends RuntimeException {
    public GenieException(String message) {
        super(message);
    }

    public GenieException(String message, Throwable cause) {
        super(message, cause);
    }
}
