package com.bbthechange.moments.upload.media;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileMediaSourceTest {

    @TempDir
    Path tempDir;

    @Test
    void readsSizeAndBytesFromDisk() throws IOException {
        Path file = Files.write(tempDir.resolve("upload.tmp"), new byte[]{1, 2, 3, 4, 5});
        FileMediaSource source = new FileMediaSource(file, "beach.jpg", "image/jpeg", true);

        assertThat(source.getName()).isEqualTo("beach.jpg");
        assertThat(source.getSizeBytes()).isEqualTo(5);
        try (InputStream in = source.openStream()) {
            assertThat(in.readAllBytes()).containsExactly(1, 2, 3, 4, 5);
        }
    }

    @Test
    void release_DeletesTemporaryFileOnly() throws IOException {
        Path temporary = Files.write(tempDir.resolve("a.tmp"), new byte[]{1});
        Path kept = Files.write(tempDir.resolve("b.jpg"), new byte[]{1});

        new FileMediaSource(temporary, "a.jpg", "image/jpeg", true).release();
        FileMediaSource.of(kept, "image/jpeg").release();

        assertThat(temporary).doesNotExist();
        assertThat(kept).exists();
    }

    @Test
    void nullContentType_BecomesEmpty() throws IOException {
        Path file = Files.write(tempDir.resolve("IMG_1.HEIC"), new byte[]{1});

        FileMediaSource source = FileMediaSource.of(file, null);

        assertThat(source.getContentType()).isEmpty();
        assertThat(source.getName()).isEqualTo("IMG_1.HEIC");
    }

    @Test
    void missingFile_Throws() {
        assertThatThrownBy(() -> FileMediaSource.of(tempDir.resolve("missing"), "image/jpeg"))
                .isInstanceOf(UncheckedIOException.class);
    }
}
