package com.providerhub.providers;

/**
 * One part of a structured message: {@code type} is "text" or "image_url".
 */
public record ContentPart(String type, String text, String imageUrl) {

    public static final String TEXT = "text";
    public static final String IMAGE_URL = "image_url";

    public static ContentPart text(String text) {
        return new ContentPart(TEXT, text, null);
    }

    public static ContentPart image(String url) {
        return new ContentPart(IMAGE_URL, null, url);
    }

    public boolean isImage() {
        return IMAGE_URL.equals(type);
    }
}
