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
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StallWatchdogTest {

    private static final Duration INTERVAL = Duration.ofSeconds(2);

    private VirtualUploadTimer timer;
    private ManualExecutor io;
    private SimpleMeterRegistry meterRegistry;
    private BatchStateStore store;
    private UploadScheduler scheduler;
    private StallWatchdog watchdog;
    private List<String> started;

    @BeforeEach
    void setUp() {
        timer = new VirtualUploadTimer();
        io = new ManualExecutor();
        meterRegistry = new SimpleMeterRegistry();
        started = new ArrayList<>();
        store = new BatchStateStore(
                BatchUploadState.initial("batch-1", "11111111-1111-1111-1111-111111111111", "user-1", 2),
                new BatchUploadReducer(), new PreviewRegistry());
        scheduler = new UploadScheduler(store, timer, Duration.ofMillis(200), fileId -> {
            started.add(fileId);
            store.dispatch(new UploadAction.StatusChanged(fileId, FileStatus.VALIDATING));
        });
        watchdog = new StallWatchdog(store, scheduler, timer, INTERVAL, meterRegistry);
    }

    private void addHashedFile(String id) {
        store.dispatch(new UploadAction.AddFiles(List.of(FileUploadState.builder()
                .id(id)
                .source(new InMemoryMediaSource(id + ".jpg", "image/jpeg", new byte[]{1}))
                .name(id + ".jpg")
                .sizeBytes(1)
                .mediaKind(MediaKind.PHOTO)
                .hashChecked(true)
                .build())));
    }

    private double restarts() {
        return meterRegistry.counter("moments.upload.watchdog.restarts").count();
    }

    @Test
    @DisplayName("queued work with nothing active and no pass running forces a pass")
    void stalledBatch_Restarted() {
        addHashedFile("a");
        store.dispatch(new UploadAction.StartUpload());
        watchdog.start();

        timer.advance(INTERVAL, io);

        assertThat(started).containsExactly("a");
        assertThat(restarts()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("no restart while a file is active")
    void activeFile_NoRestart() {
        addHashedFile("a");
        addHashedFile("b");
        store.dispatch(new UploadAction.StartUpload());
        store.dispatch(new UploadAction.StatusChanged("a", FileStatus.VALIDATING));
        watchdog.start();

        timer.advance(INTERVAL.multipliedBy(3), io);

        assertThat(started).isEmpty();
        assertThat(restarts()).isZero();
    }

    @Test
    @DisplayName("no restart while a pass is already running")
    void passRunning_NoRestart() {
        addHashedFile("a");
        addHashedFile("b");
        store.dispatch(new UploadAction.StartUpload());
        scheduler.runPass();
        store.dispatch(new UploadAction.FileFailed("a", "rejected"));

        assertThat(scheduler.isProcessing()).isTrue();
        watchdog.check();

        assertThat(started).containsExactly("a");
        assertThat(restarts()).isZero();
    }

    @Test
    @DisplayName("the watchdog stops itself once the batch is no longer uploading")
    void notUploading_StopsItself() {
        addHashedFile("a");
        store.dispatch(new UploadAction.StartUpload());
        watchdog.start();
        store.dispatch(new UploadAction.PauseUpload());

        timer.advance(INTERVAL, io);

        assertThat(watchdog.isRunning()).isFalse();
        assertThat(started).isEmpty();
        assertThat(timer.scheduledCount()).isZero();
    }

    @Test
    @DisplayName("start is idempotent and stop cancels the periodic check")
    void startStop() {
        watchdog.start();
        watchdog.start();
        assertThat(timer.scheduledCount()).isEqualTo(1);

        watchdog.stop();
        assertThat(watchdog.isRunning()).isFalse();
        assertThat(timer.scheduledCount()).isZero();
    }
}
