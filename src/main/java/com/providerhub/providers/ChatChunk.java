package com.providerhub.providers;

/**
 * One streaming delta. A non-null {@code finishReason} marks the last chunk.
 */
public record ChatChunk(String id, String model, long created, String content, String finishReason) {

    public static final String FINISH_ERROR = "error";

    public static ChatChunk delta(String id, String model, long created, String content) {
        return new ChatChunk(id, model, created, content, null);
    }

    public static ChatChunk finish(String id, String model, long created, String finishReason) {
        return new ChatChunk(id, model, created, null, finishReason);
    }

    public boolean isTerminal() {
        return finishReason != null;
    }
}
