package com.dotplatform.realtime.message;

/**
 * Wire envelope: {@code {"type": "...", "data": {...}}}.
 */
public record RealtimeMessage(MessageType type, Object data) {

    public static RealtimeMessage error(String message) {
        return new RealtimeMessage(MessageType.ERROR, new ErrorPayload(message));
    }

    public record ErrorPayload(String message) {}
}
