package com.llmbridge.shared.model;

public record ContentPart(
    Type type,
    String text,
    String imageUrl
) {
    public enum Type { TEXT, IMAGE }

    public static ContentPart text(String text) {
        return new ContentPart(Type.TEXT, text, null);
    }

    public static ContentPart image(String url) {
        return new ContentPart(Type.IMAGE, null, url);
    }

    public boolean isImage() {
        return type == Type.IMAGE;
    }
}
