package com.bbthechange.moments.util;

import com.bbthechange.moments.exception.InvalidKeyException;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class MomentsKeyFactoryTest {

    @Test
    void getEventPk_PrefixesValidId() {
        String eventId = UUID.randomUUID().toString();

        assertEquals("EVENT#" + eventId, MomentsKeyFactory.getEventPk(eventId));
    }

    @Test
    void getMomentSk_PrefixesValidId() {
        String momentId = UUID.randomUUID().toString();

        String sk = MomentsKeyFactory.getMomentSk(momentId);

        assertEquals("MOMENT#" + momentId, sk);
        assertTrue(MomentsKeyFactory.isMomentItem(sk));
        assertTrue(sk.startsWith(MomentsKeyFactory.getMomentSkPrefix()));
    }

    @Test
    void uppercaseUuid_IsAccepted() {
        assertDoesNotThrow(() -> MomentsKeyFactory.validateEventId(UUID.randomUUID().toString().toUpperCase()));
    }

    @Test
    void invalidIds_AreRejected() {
        InvalidKeyException blank = assertThrows(InvalidKeyException.class,
            () -> MomentsKeyFactory.getEventPk("  "));
        assertEquals("Event ID cannot be null or empty", blank.getMessage());

        InvalidKeyException malformed = assertThrows(InvalidKeyException.class,
            () -> MomentsKeyFactory.getMomentSk("moment-1"));
        assertEquals("Invalid Moment ID format: moment-1", malformed.getMessage());

        assertThrows(InvalidKeyException.class, () -> MomentsKeyFactory.validateEventId(null));
    }

    @Test
    void isMomentItem_RejectsOtherKeys() {
        assertFalse(MomentsKeyFactory.isMomentItem("EVENT#x"));
        assertFalse(MomentsKeyFactory.isMomentItem(null));
    }
}
