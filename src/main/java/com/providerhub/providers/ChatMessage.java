package com.providerhub.providers;

import java.util.List;

public record ChatMessage(String role, List<ContentPart> content, String toolCallId) {

    public ChatMessage {
        content = content == null ? List.of() : List.copyOf(content);
    }

    public ChatMessage(String role, String text) {
        this(role, List.of(ContentPart.text(text)), null);
    }

    public static ChatMessage system(String text) {
        return new ChatMessage("system", text);
    }

    public static ChatMessage user(String text) {
        return new ChatMessage("user", text);
    }

    public static ChatMessage assistant(String text) {
        return new ChatMessage("assistant", text);
    }

    /** Concatenated text of all text parts. */
    public String text() {
        var sb = new StringBuilder();
        for (var part : content) {
            if (part.text() != null) sb.append(part.text());
        }
        return sb.toString();
    }

    public boolean hasImages() {
        return content.stream().anyMatch(ContentPart::isImage);
    }
}
