package com.bbthechange.moments.upload.pipeline;

import com.bbthechange.moments.config.ThumbnailProperties;
import com.bbthechange.moments.upload.media.FileMediaSource;
import com.bbthechange.moments.upload.media.MediaSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Grabs the frame at one second with an ffmpeg process, scaled to 640 px wide. Clips shorter
 * than that yield no thumbnail.
 */
@Component
public class FfmpegVideoThumbnailGenerator implements VideoThumbnailGenerator {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegVideoThumbnailGenerator.class);

    private final ThumbnailProperties properties;

    public FfmpegVideoThumbnailGenerator(ThumbnailProperties properties) {
        this.properties = properties;
    }

    @Override
    public Optional<MediaSource> generate(MediaSource video) {
        Path input = null;
        boolean copiedInput = false;
        Path output = null;
        try {
            if (video instanceof FileMediaSource) {
                input = ((FileMediaSource) video).getPath();
            } else {
                input = Files.createTempFile("moment-video-", ".bin");
                copiedInput = true;
                try (InputStream in = video.openStream()) {
                    Files.copy(in, input, StandardCopyOption.REPLACE_EXISTING);
                }
            }
            output = Files.createTempFile("moment-thumb-", ".jpg");

            ProcessBuilder pb = new ProcessBuilder(command(input, output));
            pb.redirectErrorStream(true);
            pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
            Process process = pb.start();

            if (!process.waitFor(properties.getTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                logger.warn("ffmpeg timed out generating a thumbnail for {}", video.getName());
                deleteQuietly(output);
                return Optional.empty();
            }
            if (process.exitValue() != 0 || Files.size(output) == 0) {
                logger.warn("ffmpeg exited with {} for {}", process.exitValue(), video.getName());
                deleteQuietly(output);
                return Optional.empty();
            }
            return Optional.of(new FileMediaSource(output, FormatNormalizer.jpegName(video.getName()),
                    "image/jpeg", true));

        } catch (IOException e) {
            logger.warn("Thumbnail generation for {} failed: {}", video.getName(), e.getMessage());
            deleteQuietly(output);
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted generating a thumbnail for {}", video.getName());
            deleteQuietly(output);
            return Optional.empty();
        } finally {
            if (copiedInput) {
                deleteQuietly(input);
            }
        }
    }

    List<String> command(Path input, Path output) {
        return List.of(
                properties.getFfmpegPath(),
                "-y",
                "-ss", "1",
                "-i", input.toAbsolutePath().toString(),
                "-frames:v", "1",
                "-vf", "scale=640:-2",
                "-update", "1",
                output.toAbsolutePath().toString()
        );
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.debug("Could not delete temporary file {}: {}", path, e.getMessage());
        }
    }
}
