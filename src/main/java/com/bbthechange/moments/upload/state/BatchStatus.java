package com.bbthechange.moments.upload.state;

public enum BatchStatus {
    IDLE("idle"),
    UPLOADING("uploading"),
    PAUSED("paused"),
    COMPLETE("complete");

    private final String value;

    BatchStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
