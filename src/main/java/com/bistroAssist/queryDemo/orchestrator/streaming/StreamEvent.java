package com.bistroAssist.queryDemo.orchestrator.streaming;

import java.util.Map;

/**
 * One event of a streamed answer: text chunks, then exactly one {@code done} or {@code error}.
 */
public record StreamEvent(Type type, Object data) {

    public enum Type {
        CHUNK("chunk"),
        DONE("done"),
        ERROR("error");

        private final String eventName;

        Type(String eventName) {
            this.eventName = eventName;
        }

        public String getEventName() {
            return eventName;
        }
    }

    public static StreamEvent chunk(String text) {
        return new StreamEvent(Type.CHUNK, Map.of("text", text));
    }

    public static StreamEvent done(Object summary) {
        return new StreamEvent(Type.DONE, summary);
    }

    public static StreamEvent error(String code, String message) {
        return new StreamEvent(Type.ERROR, Map.of("code", code, "message", message));
    }

    public boolean isTerminal() {
        return type != Type.CHUNK;
    }
}
