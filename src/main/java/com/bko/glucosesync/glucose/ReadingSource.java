package com.bko.glucosesync.glucose;

public enum ReadingSource {
    OFFICIAL("dexcomOfficial"),
    SHARE("dexcomShare");

    private final String tag;

    ReadingSource(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static ReadingSource fromTag(String tag) {
        for (ReadingSource source : values()) {
            if (source.tag.equalsIgnoreCase(tag) || source.name().equalsIgnoreCase(tag)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown reading source: " + tag);
    }
}
