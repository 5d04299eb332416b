package com.bbthechange.moments.upload.state;

import com.bbthechange.moments.upload.media.PreviewRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The single authoritative holder of a batch's state.
 *
 * <p>State is only replaced through {@link #dispatch}, which the orchestrator calls from the
 * batch's mailbox thread. Readers on any thread see the latest published snapshot through
 * {@link #getState()}; nobody keeps a snapshot across a suspension point.
 */
public class BatchStateStore {

    private static final Logger logger = LoggerFactory.getLogger(BatchStateStore.class);

    private final BatchUploadReducer reducer;
    private final PreviewRegistry previewRegistry;
    private final List<BatchStateListener> listeners = new CopyOnWriteArrayList<>();

    private volatile BatchUploadState state;

    public BatchStateStore(BatchUploadState initial, BatchUploadReducer reducer, PreviewRegistry previewRegistry) {
        this.state = Objects.requireNonNull(initial, "initial state");
        this.reducer = reducer;
        this.previewRegistry = previewRegistry;
    }

    public BatchUploadState getState() {
        return state;
    }

    public void addListener(BatchStateListener listener) {
        listeners.add(listener);
    }

    public void removeListener(BatchStateListener listener) {
        listeners.remove(listener);
    }

    /**
     * Apply an action and publish the result.
     *
     * @return true when the action changed the state, false when it was a no-op
     */
    public synchronized boolean dispatch(UploadAction action) {
        BatchUploadState previous = state;
        BatchUploadState next = reducer.reduce(previous, action);
        if (next == previous) {
            logger.trace("Ignored {} for batch {}", action.getClass().getSimpleName(), previous.getBatchId());
            return false;
        }
        state = next;
        revokeDroppedPreviews(previous, next);
        for (BatchStateListener listener : listeners) {
            try {
                listener.onStateChanged(previous, next, action);
            } catch (RuntimeException e) {
                logger.error("State listener failed after {} in batch {}",
                        action.getClass().getSimpleName(), next.getBatchId(), e);
            }
        }
        return true;
    }

    private void revokeDroppedPreviews(BatchUploadState previous, BatchUploadState next) {
        Set<String> live = new HashSet<>();
        next.getFiles().values().forEach(file -> live.add(file.getPreviewRef()));
        for (FileUploadState file : previous.getFiles().values()) {
            String ref = file.getPreviewRef();
            if (ref != null && !live.contains(ref)) {
                previewRegistry.revoke(ref);
            }
        }
    }
}
