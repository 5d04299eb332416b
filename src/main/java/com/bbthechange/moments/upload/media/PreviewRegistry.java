package com.bbthechange.moments.upload.media;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Issues locally renderable preview handles for media that has not reached remote storage yet.
 * A handle stays live until it is revoked; the batch state store revokes every handle that
 * drops out of the state (replacement, removal, reset).
 */
@Component
public class PreviewRegistry {

    private static final Logger logger = LoggerFactory.getLogger(PreviewRegistry.class);
    public static final String HANDLE_PREFIX = "preview:";

    private final Map<String, MediaSource> previews = new ConcurrentHashMap<>();

    public String register(MediaSource source) {
        String handle = HANDLE_PREFIX + UUID.randomUUID();
        previews.put(handle, source);
        return handle;
    }

    public Optional<MediaSource> resolve(String handle) {
        if (handle == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(previews.get(handle));
    }

    /**
     * Revoke a handle. Remote URLs and unknown handles are ignored.
     *
     * @return true when a live local handle was revoked
     */
    public boolean revoke(String handle) {
        if (handle == null || !handle.startsWith(HANDLE_PREFIX)) {
            return false;
        }
        boolean revoked = previews.remove(handle) != null;
        if (revoked) {
            logger.debug("Revoked preview handle {}", handle);
        }
        return revoked;
    }

    public boolean isLive(String handle) {
        return handle != null && previews.containsKey(handle);
    }

    public int liveCount() {
        return previews.size();
    }
}
