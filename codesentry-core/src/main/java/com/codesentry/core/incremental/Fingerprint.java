package com.codesentry.core.incremental;

import net.jpountz.xxhash.XXHash64;
import net.jpountz.xxhash.XXHashFactory;

import java.nio.charset.StandardCharsets;

/**
 * Fast, non-cryptographic content fingerprint used for change detection.
 *
 * <p>Computes xxHash64 over the UTF-8 bytes of the content and renders it as
 * lowercase hex. Collisions are an accepted correctness risk; fingerprints are
 * never used for anything security-sensitive.</p>
 */
public final class Fingerprint {

    static final long SEED = 0xabcdL;

    private static final XXHash64 HASH = XXHashFactory.fastestInstance().hash64();

    private Fingerprint() {
        // Utility class
    }

    /**
     * Fingerprints a file's content.
     *
     * @param content text to hash; {@code null} hashes like the empty string
     * @return 16 hex digit fingerprint
     */
    public static String of(String content) {
        byte[] bytes = (content == null ? "" : content).getBytes(StandardCharsets.UTF_8);
        long hash = HASH.hash(bytes, 0, bytes.length, SEED);
        return String.format("%016x", hash);
    }
}
