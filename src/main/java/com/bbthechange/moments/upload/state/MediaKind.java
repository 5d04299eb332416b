package com.bbthechange.moments.upload.state;

/**
 * Kind of media a batch file carries. The wire value is what the record store keeps in
 * its contentType attribute.
 */
public enum MediaKind {
    PHOTO("photo"),
    VIDEO("video");

    private final String value;

    MediaKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
