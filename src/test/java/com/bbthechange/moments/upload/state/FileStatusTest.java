package com.bbthechange.moments.upload.state;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

class FileStatusTest {

    @Test
    @DisplayName("hashing does not hold a concurrency slot")
    void activeSet() {
        assertThat(FileStatus.HASHING.isActive()).isFalse();
        assertThat(FileStatus.QUEUED.isActive()).isFalse();
        assertThat(FileStatus.VALIDATING.isActive()).isTrue();
        assertThat(FileStatus.CONVERTING.isActive()).isTrue();
        assertThat(FileStatus.UPLOADING.isActive()).isTrue();
        assertThat(FileStatus.SAVING.isActive()).isTrue();
        assertThat(FileStatus.RETRYING.isActive()).isTrue();
    }

    @ParameterizedTest
    @EnumSource(value = FileStatus.class, names = {"COMPLETE", "SKIPPED"})
    @DisplayName("complete and skipped are final")
    void finalStatuses_NoTransitions(FileStatus status) {
        assertThat(status.isTerminal()).isTrue();
        for (FileStatus next : FileStatus.values()) {
            assertThat(status.canTransitionTo(next)).isFalse();
        }
    }

    @Test
    @DisplayName("error is terminal but can be requeued")
    void error_Requeueable() {
        assertThat(FileStatus.ERROR.isTerminal()).isTrue();
        assertThat(FileStatus.ERROR.canTransitionTo(FileStatus.QUEUED)).isTrue();
        assertThat(FileStatus.ERROR.canTransitionTo(FileStatus.UPLOADING)).isFalse();
    }

    @Test
    @DisplayName("a retryable transfer failure never passes through error")
    void uploading_ToRetrying() {
        assertThat(FileStatus.UPLOADING.canTransitionTo(FileStatus.RETRYING)).isTrue();
        assertThat(FileStatus.RETRYING.canTransitionTo(FileStatus.QUEUED)).isTrue();
        assertThat(FileStatus.RETRYING.canTransitionTo(FileStatus.ERROR)).isFalse();
    }

    @Test
    @DisplayName("a stored but undrafted file resumes straight at saving")
    void validating_ToSaving() {
        assertThat(FileStatus.VALIDATING.canTransitionTo(FileStatus.SAVING)).isTrue();
    }

    @Test
    @DisplayName("wire values are lower case")
    void wireValues() {
        assertThat(FileStatus.RETRYING.getValue()).isEqualTo("retrying");
        assertThat(BatchStatus.PAUSED.getValue()).isEqualTo("paused");
    }
}
