package com.bbthechange.moments.upload.pipeline;

import com.bbthechange.moments.exception.RepositoryException;
import com.bbthechange.moments.repository.MomentDraftRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DuplicateCheckerTest {

    private static final String EVENT_ID = "11111111-1111-1111-1111-111111111111";

    @Mock
    private MomentDraftRepository momentDraftRepository;

    @InjectMocks
    private DuplicateChecker duplicateChecker;

    @Test
    void existsInEvent_HashPresent_ReturnsTrue() {
        when(momentDraftRepository.findExistingContentHashes(EVENT_ID, Set.of("abc"))).thenReturn(Set.of("abc"));

        assertTrue(duplicateChecker.existsInEvent(EVENT_ID, "abc"));
    }

    @Test
    void existsInEvent_HashAbsent_ReturnsFalse() {
        when(momentDraftRepository.findExistingContentHashes(EVENT_ID, Set.of("abc"))).thenReturn(Set.of());

        assertFalse(duplicateChecker.existsInEvent(EVENT_ID, "abc"));
    }

    @Test
    void existsInEvent_LookupFails_TreatedAsAbsent() {
        when(momentDraftRepository.findExistingContentHashes(anyString(), any()))
                .thenThrow(new RepositoryException("Failed to check for duplicate media"));

        assertFalse(duplicateChecker.existsInEvent(EVENT_ID, "abc"));
    }
}
