package com.bbthechange.moments.upload.state;

/**
 * Notified on the batch's mailbox thread after every action that changed the state.
 */
@FunctionalInterface
public interface BatchStateListener {

    void onStateChanged(BatchUploadState previous, BatchUploadState current, UploadAction action);
}
