package com.bbthechange.moments.upload.media;

import com.bbthechange.moments.upload.state.MediaKind;

import java.util.Locale;
import java.util.Set;

/**
 * MIME type and extension rules for gallery media. Browsers and phones routinely send a wrong
 * or empty MIME type for HEIC and MOV files, so the extension is always checked as well.
 */
public final class MediaTypes {

    public static final Set<String> RASTER_IMAGE_TYPES = Set.of("image/jpeg", "image/png", "image/webp");
    public static final String GIF_TYPE = "image/gif";
    public static final Set<String> VIDEO_TYPES = Set.of("video/mp4", "video/webm", "video/quicktime");
    public static final Set<String> CONVERTIBLE_IMAGE_TYPES = Set.of("image/heic", "image/heif");
    public static final String LEGACY_VIDEO_TYPE = "video/quicktime";

    private static final Set<String> CONVERTIBLE_IMAGE_EXTENSIONS = Set.of("heic", "heif");
    private static final String LEGACY_VIDEO_EXTENSION = "mov";

    private MediaTypes() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static String extension(String fileName) {
        if (fileName == null) {
            return "";
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    public static String normalizedType(String contentType) {
        return contentType == null ? "" : contentType.toLowerCase(Locale.ROOT).trim();
    }

    public static boolean isConvertibleImage(MediaSource source) {
        return CONVERTIBLE_IMAGE_TYPES.contains(normalizedType(source.getContentType()))
                || CONVERTIBLE_IMAGE_EXTENSIONS.contains(extension(source.getName()));
    }

    public static boolean isLegacyVideo(MediaSource source) {
        return LEGACY_VIDEO_TYPE.equals(normalizedType(source.getContentType()))
                || LEGACY_VIDEO_EXTENSION.equals(extension(source.getName()));
    }

    public static boolean isGif(MediaSource source) {
        return GIF_TYPE.equals(normalizedType(source.getContentType()));
    }

    public static boolean isVideo(MediaSource source) {
        return effectiveContentType(source).startsWith("video/")
                || LEGACY_VIDEO_EXTENSION.equals(extension(source.getName()));
    }

    public static MediaKind kindOf(MediaSource source) {
        return isVideo(source) ? MediaKind.VIDEO : MediaKind.PHOTO;
    }

    /**
     * MIME type to store the object under, falling back on the extension when the client sent none.
     */
    public static String effectiveContentType(MediaSource source) {
        String type = normalizedType(source.getContentType());
        if (!type.isEmpty()) {
            return type;
        }
        switch (extension(source.getName())) {
            case "jpg":
            case "jpeg":
                return "image/jpeg";
            case "png":
                return "image/png";
            case "webp":
                return "image/webp";
            case "gif":
                return GIF_TYPE;
            case "heic":
                return "image/heic";
            case "heif":
                return "image/heif";
            case "mp4":
                return "video/mp4";
            case "webm":
                return "video/webm";
            case "mov":
                return LEGACY_VIDEO_TYPE;
            default:
                return "application/octet-stream";
        }
    }
}
