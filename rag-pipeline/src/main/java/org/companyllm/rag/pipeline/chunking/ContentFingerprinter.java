package org.companyllm.rag.pipeline.chunking;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Change-detection digest of chunk text. MD5 is enough to notice edits; it is not
 * a deduplication key for untrusted input.
 */
public class ContentFingerprinter {
    public static final String DIGEST_ALGORITHM = "MD5";

    public String fingerprint(String text) {
        try {
            var digest = MessageDigest.getInstance(DIGEST_ALGORITHM);
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(DIGEST_ALGORITHM + " digest is not available", e);
        }
    }
}
