package com.edgechat.inference.task;

public final class TaskErrorMessages {
    static final String SOURCE_TRACE_MARKER = "=== Source Location Trace";
    static final String UNKNOWN_ERROR = "Unknown error initializing LLM task runtime";

    private TaskErrorMessages() {
    }

    /**
     * Drops the native source-location trace the runtime appends to its error messages.
     */
    public static String cleanUp(String message) {
        if (message == null || message.isBlank()) {
            return UNKNOWN_ERROR;
        }
        int index = message.indexOf(SOURCE_TRACE_MARKER);
        if (index < 0) {
            return message;
        }
        String trimmed = message.substring(0, index).trim();
        return trimmed.isEmpty() ? UNKNOWN_ERROR : trimmed;
    }
}
