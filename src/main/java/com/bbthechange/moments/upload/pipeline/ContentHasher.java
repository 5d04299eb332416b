package com.bbthechange.moments.upload.pipeline;

import com.bbthechange.moments.upload.media.MediaSource;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * Content-addressed fingerprint of a file's bytes: lowercase hex SHA-256.
 */
@Component
public class ContentHasher {

    public String hash(MediaSource source) throws IOException {
        try (InputStream in = source.openStream()) {
            return DigestUtils.sha256Hex(in);
        }
    }
}
