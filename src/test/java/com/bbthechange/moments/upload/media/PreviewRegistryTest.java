package com.bbthechange.moments.upload.media;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PreviewRegistryTest {

    private final PreviewRegistry registry = new PreviewRegistry();

    @Test
    void register_IssuesDistinctLiveHandles() {
        MediaSource source = new InMemoryMediaSource("a.jpg", "image/jpeg", new byte[]{1});

        String first = registry.register(source);
        String second = registry.register(source);

        assertThat(first).startsWith(PreviewRegistry.HANDLE_PREFIX).isNotEqualTo(second);
        assertThat(registry.resolve(first)).containsSame(source);
        assertThat(registry.liveCount()).isEqualTo(2);
    }

    @Test
    void revoke_RemovesHandleOnce() {
        String handle = registry.register(new InMemoryMediaSource("a.jpg", "image/jpeg", new byte[]{1}));

        assertThat(registry.revoke(handle)).isTrue();
        assertThat(registry.revoke(handle)).isFalse();
        assertThat(registry.isLive(handle)).isFalse();
        assertThat(registry.resolve(handle)).isEmpty();
    }

    @Test
    void revoke_IgnoresRemoteUrlsAndNull() {
        assertThat(registry.revoke("https://cdn.test/a.jpg")).isFalse();
        assertThat(registry.revoke(null)).isFalse();
        assertThat(registry.resolve(null)).isEmpty();
    }
}
