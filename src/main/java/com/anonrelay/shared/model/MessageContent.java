package com.anonrelay.shared.model;

/**
 * Body of a relayed message: plain text or a reference to media already held by the transport.
 */
public sealed interface MessageContent permits MessageContent.Text, MessageContent.Media {

    /** Text fed to the classifier and shown to moderators; caption for media, empty when absent. */
    String plainText();

    record Text(String text) implements MessageContent {
        public Text {
            if (text == null || text.isBlank()) {
                throw new IllegalArgumentException("Text content cannot be empty");
            }
        }

        @Override
        public String plainText() {
            return text;
        }
    }

    record Media(MediaKind kind, String fileRef, String caption) implements MessageContent {
        public Media {
            if (kind == null) throw new IllegalArgumentException("Media kind is required");
            if (fileRef == null || fileRef.isBlank()) {
                throw new IllegalArgumentException("Media file reference is required");
            }
        }

        @Override
        public String plainText() {
            return caption != null ? caption : "";
        }
    }

    static MessageContent text(String text) {
        return new Text(text);
    }

    static MessageContent media(MediaKind kind, String fileRef, String caption) {
        return new Media(kind, fileRef, caption);
    }
}
