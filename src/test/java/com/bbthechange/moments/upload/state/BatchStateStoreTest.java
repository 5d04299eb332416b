package com.bbthechange.moments.upload.state;

import com.bbthechange.moments.upload.media.InMemoryMediaSource;
import com.bbthechange.moments.upload.media.MediaSource;
import com.bbthechange.moments.upload.media.PreviewRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BatchStateStoreTest {

    private PreviewRegistry previewRegistry;
    private BatchStateStore store;

    @BeforeEach
    void setUp() {
        previewRegistry = new PreviewRegistry();
        store = new BatchStateStore(
                BatchUploadState.initial("batch-1", "11111111-1111-1111-1111-111111111111", "user-1", 2),
                new BatchUploadReducer(),
                previewRegistry);
    }

    private FileUploadState addFile(String id) {
        MediaSource source = new InMemoryMediaSource(id + ".png", "image/png", new byte[]{9});
        FileUploadState file = FileUploadState.builder()
                .id(id)
                .source(source)
                .name(source.getName())
                .sizeBytes(1)
                .mediaKind(MediaKind.PHOTO)
                .previewRef(previewRegistry.register(source))
                .build();
        store.dispatch(new UploadAction.AddFiles(List.of(file)));
        return file;
    }

    @Test
    @DisplayName("a no-op action reports false and does not notify listeners")
    void dispatch_NoOp_NoNotification() {
        List<UploadAction> seen = new ArrayList<>();
        store.addListener((previous, current, action) -> seen.add(action));

        boolean changed = store.dispatch(new UploadAction.PauseUpload());

        assertThat(changed).isFalse();
        assertThat(seen).isEmpty();
    }

    @Test
    @DisplayName("listeners see the previous and current snapshot")
    void dispatch_Change_NotifiesWithSnapshots() {
        List<BatchStatus> transitions = new ArrayList<>();
        store.addListener((previous, current, action) -> {
            transitions.add(previous.getStatus());
            transitions.add(current.getStatus());
        });

        assertThat(store.dispatch(new UploadAction.StartUpload())).isTrue();

        assertThat(transitions).containsExactly(BatchStatus.IDLE, BatchStatus.UPLOADING);
        assertThat(store.getState().getStatus()).isEqualTo(BatchStatus.UPLOADING);
    }

    @Test
    @DisplayName("removing a file revokes its preview handle")
    void remove_RevokesPreview() {
        FileUploadState file = addFile("a");
        assertThat(previewRegistry.isLive(file.getPreviewRef())).isTrue();

        store.dispatch(new UploadAction.RemoveFile("a"));

        assertThat(previewRegistry.isLive(file.getPreviewRef())).isFalse();
    }

    @Test
    @DisplayName("replacing a preview revokes the old handle only")
    void previewReplaced_RevokesOldHandle() {
        FileUploadState file = addFile("a");
        String replacement = previewRegistry.register(new InMemoryMediaSource("a.jpg", "image/jpeg", new byte[]{1}));

        store.dispatch(new UploadAction.PreviewReplaced("a", replacement, MediaKind.PHOTO));

        assertThat(previewRegistry.isLive(file.getPreviewRef())).isFalse();
        assertThat(previewRegistry.isLive(replacement)).isTrue();
    }

    @Test
    @DisplayName("reset revokes every preview of the batch")
    void reset_RevokesAll() {
        addFile("a");
        addFile("b");
        assertThat(previewRegistry.liveCount()).isEqualTo(2);

        store.dispatch(new UploadAction.Reset("batch-2"));

        assertThat(previewRegistry.liveCount()).isZero();
        assertThat(store.getState().getBatchId()).isEqualTo("batch-2");
    }

    @Test
    @DisplayName("a failing listener does not stop later listeners or the state change")
    void listenerFailure_Isolated() {
        List<String> calls = new ArrayList<>();
        store.addListener((previous, current, action) -> {
            throw new IllegalStateException("listener broke");
        });
        store.addListener((previous, current, action) -> calls.add("second"));

        boolean changed = store.dispatch(new UploadAction.StartUpload());

        assertThat(changed).isTrue();
        assertThat(calls).containsExactly("second");
    }

    @Test
    @DisplayName("a removed listener is no longer notified")
    void removeListener() {
        List<UploadAction> seen = new ArrayList<>();
        BatchStateListener listener = (previous, current, action) -> seen.add(action);
        store.addListener(listener);
        store.removeListener(listener);

        store.dispatch(new UploadAction.StartUpload());

        assertThat(seen).isEmpty();
    }
}
