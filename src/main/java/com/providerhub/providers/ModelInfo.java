package com.providerhub.providers;

public record ModelInfo(
    String id,
    String name,
    int contextWindow,
    boolean supportsImages
) {
    public ModelInfo(String id) {
        this(id, id, 0, false);
    }
}
