package com.bbthechange.moments.util;

import com.bbthechange.moments.exception.InvalidKeyException;

import java.util.regex.Pattern;

/**
 * Type-safe key factory for the MomentsTable single-table design.
 */
public final class MomentsKeyFactory {
    private static final String DELIMITER = "#";
    private static final Pattern UUID_PATTERN = Pattern.compile(
        "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}",
        Pattern.CASE_INSENSITIVE
    );

    public static final String EVENT_PREFIX = "EVENT";
    public static final String MOMENT_PREFIX = "MOMENT";

    // Status constants
    public static final String STATUS_DRAFT = "DRAFT";
    public static final String STATUS_PUBLISHED = "PUBLISHED";

    private MomentsKeyFactory() {
        throw new UnsupportedOperationException("Utility class");
    }

    private static void validateId(String id, String type) {
        if (id == null || id.trim().isEmpty()) {
            throw new InvalidKeyException(type + " ID cannot be null or empty");
        }
        if (!UUID_PATTERN.matcher(id).matches()) {
            throw new InvalidKeyException("Invalid " + type + " ID format: " + id);
        }
    }

    public static void validateEventId(String eventId) {
        validateId(eventId, "Event");
    }

    public static String getEventPk(String eventId) {
        validateId(eventId, "Event");
        return EVENT_PREFIX + DELIMITER + eventId;
    }

    public static String getMomentSk(String momentId) {
        validateId(momentId, "Moment");
        return MOMENT_PREFIX + DELIMITER + momentId;
    }

    public static String getMomentSkPrefix() {
        return MOMENT_PREFIX + DELIMITER;
    }

    public static boolean isMomentItem(String sk) {
        return sk != null && sk.startsWith(MOMENT_PREFIX + DELIMITER);
    }
}
