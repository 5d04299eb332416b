package com.bbthechange.moments.upload.pipeline;

import com.bbthechange.moments.config.MediaUploadProperties;
import com.bbthechange.moments.exception.MediaConversionException;
import com.bbthechange.moments.upload.media.InMemoryMediaSource;
import com.bbthechange.moments.upload.media.MediaSource;
import com.bbthechange.moments.upload.media.MediaTypes;
import com.bbthechange.moments.upload.state.MediaKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.Optional;

/**
 * Converts proprietary photo containers and compresses oversized photos with ImageIO.
 *
 * <p>A convertible photo is decoded locally when an ImageIO reader for it is installed, otherwise
 * it is uploaded untouched and converted server-side. Videos are never touched here; legacy
 * containers are normalised by the transcoding service.
 */
@Component
public class FormatNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(FormatNormalizer.class);

    static final float CONVERSION_QUALITY = 0.9f;
    static final float QUALITY_STEP = 0.1f;
    static final float MIN_QUALITY = 0.5f;
    private static final String JPEG_TYPE = "image/jpeg";

    private final long compressionThresholdBytes;
    private final long compressionTargetBytes;
    private final int maxDimension;
    private final float initialQuality;

    @Autowired
    public FormatNormalizer(MediaUploadProperties properties) {
        this(properties.getCompressionThreshold().toBytes(),
                properties.getCompressionTargetSize().toBytes(),
                properties.getMaxImageDimension(),
                properties.getCompressionQuality());
    }

    public FormatNormalizer(long compressionThresholdBytes, long compressionTargetBytes,
                            int maxDimension, float initialQuality) {
        this.compressionThresholdBytes = compressionThresholdBytes;
        this.compressionTargetBytes = compressionTargetBytes;
        this.maxDimension = maxDimension;
        this.initialQuality = initialQuality;
    }

    /**
     * Whether {@link #normalize} will do any work for this source, so the caller can report the
     * converting status.
     */
    public boolean requiresWork(MediaSource source) {
        if (MediaTypes.kindOf(source) != MediaKind.PHOTO) {
            return false;
        }
        return MediaTypes.isConvertibleImage(source) || needsCompression(source);
    }

    /**
     * Blocking. Runs off the batch's mailbox.
     *
     * @throws MediaConversionException if a convertible photo has a reader but cannot be decoded
     */
    public NormalizationResult normalize(MediaSource source) {
        if (MediaTypes.kindOf(source) != MediaKind.PHOTO) {
            return new NormalizationResult(source, NormalizationPlan.NONE, false);
        }

        MediaSource current = source;
        NormalizationPlan plan = NormalizationPlan.NONE;

        if (MediaTypes.isConvertibleImage(source)) {
            Optional<MediaSource> converted = convertToJpeg(source);
            if (converted.isEmpty()) {
                logger.info("No local decoder for {}, deferring conversion to the server", source.getName());
                return new NormalizationResult(source, NormalizationPlan.SERVER_CONVERT, false);
            }
            current = converted.get();
            plan = NormalizationPlan.CLIENT_CONVERT;
        }

        if (needsCompression(current)) {
            Optional<MediaSource> compressed = compress(current);
            if (compressed.isPresent()) {
                return new NormalizationResult(compressed.get(), plan, true);
            }
        }
        return new NormalizationResult(current, plan, false);
    }

    boolean needsCompression(MediaSource source) {
        return !MediaTypes.isGif(source)
                && !MediaTypes.isConvertibleImage(source)
                && source.getSizeBytes() > compressionThresholdBytes;
    }

    Optional<MediaSource> convertToJpeg(MediaSource source) {
        BufferedImage image;
        try {
            image = read(source);
        } catch (IOException e) {
            throw new MediaConversionException("Could not convert " + source.getName() + ": " + e.getMessage(), e);
        }
        if (image == null) {
            return Optional.empty();
        }
        try {
            byte[] jpeg = encodeJpeg(flatten(image), CONVERSION_QUALITY);
            return Optional.of(new InMemoryMediaSource(jpegName(source.getName()), JPEG_TYPE, jpeg));
        } catch (IOException e) {
            throw new MediaConversionException("Could not encode " + source.getName() + " as JPEG", e);
        }
    }

    /**
     * Re-encode as JPEG, stepping quality down until the target size is met or the floor is
     * reached. A failure is not fatal: the original is uploaded.
     */
    Optional<MediaSource> compress(MediaSource source) {
        try {
            BufferedImage image = read(source);
            if (image == null) {
                logger.warn("No decoder for {}, uploading uncompressed", source.getName());
                return Optional.empty();
            }
            BufferedImage prepared = flatten(downscale(image));

            byte[] best = null;
            float quality = initialQuality;
            while (true) {
                best = encodeJpeg(prepared, quality);
                if (best.length <= compressionTargetBytes || quality - QUALITY_STEP < MIN_QUALITY - 0.001f) {
                    break;
                }
                quality -= QUALITY_STEP;
            }

            if (best.length >= source.getSizeBytes()) {
                logger.debug("Compression did not shrink {}, keeping original", source.getName());
                return Optional.empty();
            }
            logger.info("Compressed {} from {} to {} bytes (quality {})",
                    source.getName(), source.getSizeBytes(), best.length, String.format("%.2f", quality));
            return Optional.of(new InMemoryMediaSource(jpegName(source.getName()), JPEG_TYPE, best));

        } catch (IOException | RuntimeException e) {
            logger.warn("Compression of {} failed, uploading original: {}", source.getName(), e.getMessage());
            return Optional.empty();
        }
    }

    private BufferedImage read(MediaSource source) throws IOException {
        try (InputStream in = source.openStream()) {
            return ImageIO.read(in);
        }
    }

    private BufferedImage downscale(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        int longest = Math.max(width, height);
        if (longest <= maxDimension) {
            return image;
        }
        double scale = (double) maxDimension / longest;
        int targetWidth = Math.max(1, (int) Math.round(width * scale));
        int targetHeight = Math.max(1, (int) Math.round(height * scale));
        BufferedImage scaled = new BufferedImage(targetWidth, targetHeight, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = scaled.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(image, 0, 0, targetWidth, targetHeight, Color.WHITE, null);
        } finally {
            g.dispose();
        }
        return scaled;
    }

    // JPEG has no alpha channel
    private BufferedImage flatten(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.drawImage(image, 0, 0, Color.WHITE, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    private byte[] encodeJpeg(BufferedImage image, float quality) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IOException("No JPEG writer available");
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            writer.setOutput(ios);
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(Math.max(MIN_QUALITY, Math.min(1f, quality)));
            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
        }
        return out.toByteArray();
    }

    static String jpegName(String name) {
        if (name == null || name.isEmpty()) {
            return "upload.jpg";
        }
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return base + ".jpg";
    }
}
