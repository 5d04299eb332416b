package com.bbthechange.moments.client;

/**
 * Receives transfer progress as a percentage of the file's bytes confirmed by the remote side.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = percent -> { };

    void onProgress(int percent);
}
