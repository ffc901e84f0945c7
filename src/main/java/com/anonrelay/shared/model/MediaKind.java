package com.anonrelay.shared.model;

import java.util.Locale;

public enum MediaKind {
    PHOTO,
    VIDEO,
    VOICE,
    VIDEO_NOTE,
    AUDIO,
    DOCUMENT,
    STICKER,
    ANIMATION;

    /** Stickers and video notes are sent without a caption; text has to follow as a separate message. */
    public boolean supportsCaption() {
        return this != STICKER && this != VIDEO_NOTE;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MediaKind fromCode(String code) {
        return valueOf(code.toUpperCase(Locale.ROOT));
    }
}
