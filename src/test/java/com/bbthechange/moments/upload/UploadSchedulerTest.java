package com.bbthechange.moments.upload;

import com.bbthechange.moments.testutil.ManualExecutor;
import com.bbthechange.moments.testutil.VirtualUploadTimer;
import com.bbthechange.moments.upload.media.InMemoryMediaSource;
import com.bbthechange.moments.upload.media.PreviewRegistry;
import com.bbthechange.moments.upload.state.BatchStateStore;
import com.bbthechange.moments.upload.state.BatchUploadReducer;
import com.bbthechange.moments.upload.state.BatchUploadState;
import com.bbthechange.moments.upload.state.FileStatus;
import com.bbthechange.moments.upload.state.FileUploadState;
import com.bbthechange.moments.upload.state.MediaKind;
import com.bbthechange.moments.upload.state.UploadAction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class UploadSchedulerTest {

    private static final Duration STAGGER = Duration.ofMillis(200);

    private VirtualUploadTimer timer;
    private ManualExecutor io;
    private List<String> started;

    @BeforeEach
    void setUp() {
        timer = new VirtualUploadTimer();
        io = new ManualExecutor();
        started = new ArrayList<>();
    }

    private BatchStateStore storeWith(int limit, String... ids) {
        BatchStateStore store = new BatchStateStore(
                BatchUploadState.initial("batch-1", "11111111-1111-1111-1111-111111111111", "user-1", limit),
                new BatchUploadReducer(), new PreviewRegistry());
        List<FileUploadState> files = Stream.of(ids)
                .map(id -> FileUploadState.builder()
                        .id(id)
                        .source(new InMemoryMediaSource(id + ".jpg", "image/jpeg", new byte[]{1}))
                        .name(id + ".jpg")
                        .sizeBytes(1)
                        .mediaKind(MediaKind.PHOTO)
                        .hashChecked(true)
                        .build())
                .collect(Collectors.toList());
        store.dispatch(new UploadAction.AddFiles(files));
        return store;
    }

    private UploadScheduler schedulerFor(BatchStateStore store) {
        return new UploadScheduler(store, timer, STAGGER, fileId -> {
            started.add(fileId);
            store.dispatch(new UploadAction.StatusChanged(fileId, FileStatus.VALIDATING));
        });
    }

    @Test
    @DisplayName("a pass fills free slots one start per stagger interval, in intake order")
    void runPass_StaggersStartsUpToLimit() {
        BatchStateStore store = storeWith(2, "a", "b", "c");
        store.dispatch(new UploadAction.StartUpload());
        UploadScheduler scheduler = schedulerFor(store);

        scheduler.runPass();
        assertThat(started).containsExactly("a");
        assertThat(scheduler.isProcessing()).isTrue();

        timer.advance(Duration.ofMillis(199), io);
        assertThat(started).containsExactly("a");

        timer.advance(Duration.ofMillis(1), io);
        assertThat(started).containsExactly("a", "b");
        assertThat(scheduler.isProcessing()).isFalse();

        timer.advance(Duration.ofSeconds(5), io);
        assertThat(started).containsExactly("a", "b");
        assertThat(store.getState().file("c").getStatus()).isEqualTo(FileStatus.QUEUED);
    }

    @Test
    @DisplayName("nothing is started unless the batch is uploading")
    void runPass_NotUploading_NoStarts() {
        BatchStateStore store = storeWith(2, "a");
        UploadScheduler scheduler = schedulerFor(store);

        scheduler.runPass();

        assertThat(started).isEmpty();
        assertThat(scheduler.isProcessing()).isFalse();
    }

    @Test
    @DisplayName("a pause between staggered starts ends the pass")
    void pauseMidPass_StopsDispatch() {
        BatchStateStore store = storeWith(3, "a", "b", "c");
        store.dispatch(new UploadAction.StartUpload());
        UploadScheduler scheduler = schedulerFor(store);

        scheduler.runPass();
        store.dispatch(new UploadAction.PauseUpload());
        timer.advance(Duration.ofSeconds(1), io);

        assertThat(started).containsExactly("a");
        assertThat(scheduler.isProcessing()).isFalse();
    }

    @Test
    @DisplayName("requests during a pass are coalesced instead of starting a parallel pass")
    void runPass_WhileProcessing_Coalesced() {
        BatchStateStore store = storeWith(3, "a", "b", "c");
        store.dispatch(new UploadAction.StartUpload());
        UploadScheduler scheduler = schedulerFor(store);

        scheduler.runPass();
        scheduler.runPass();
        scheduler.requestPass();
        timer.runReady();

        assertThat(started).containsExactly("a");

        timer.advance(STAGGER, io);
        assertThat(started).containsExactly("a", "b");

        timer.advance(STAGGER, io);
        assertThat(started).containsExactly("a", "b", "c");
        assertThat(scheduler.isProcessing()).isFalse();
    }

    @Test
    @DisplayName("a new pass fills the slot freed by a failed file")
    void followUpPass_FillsFreedSlot() {
        BatchStateStore store = storeWith(1, "a", "b");
        store.dispatch(new UploadAction.StartUpload());
        UploadScheduler scheduler = schedulerFor(store);

        scheduler.runPass();
        assertThat(started).containsExactly("a");

        store.dispatch(new UploadAction.FileFailed("a", "rejected"));
        scheduler.runPass();

        assertThat(started).containsExactly("a", "b");
    }

    @Test
    @DisplayName("cancel drops the pending staggered start")
    void cancel_DropsPendingStep() {
        BatchStateStore store = storeWith(2, "a", "b");
        store.dispatch(new UploadAction.StartUpload());
        UploadScheduler scheduler = schedulerFor(store);

        scheduler.runPass();
        scheduler.cancel();
        timer.advance(Duration.ofSeconds(1), io);

        assertThat(started).containsExactly("a");
        assertThat(scheduler.isProcessing()).isFalse();
    }

    @Test
    @DisplayName("a file that does not leave queued ends the pass instead of looping")
    void starterLeavesFileQueued_PassEnds() {
        BatchStateStore store = storeWith(2, "a", "b");
        store.dispatch(new UploadAction.StartUpload());
        UploadScheduler scheduler = new UploadScheduler(store, timer, STAGGER, started::add);

        scheduler.runPass();
        timer.advance(Duration.ofSeconds(1), io);

        assertThat(started).containsExactly("a");
        assertThat(scheduler.isProcessing()).isFalse();
    }
}
