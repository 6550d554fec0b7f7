package com.syntex.natiq.quran;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.syntex.natiq.error.IntegrityException;

/**
 * Checks raw corpus bytes against the digest of an approved source release.
 */
public final class SourceValidator {

    private static final Logger LOG = LoggerFactory.getLogger(SourceValidator.class);

    /** SHA-256 of the approved Tanzil Uthmani XML release. */
    public static final String TANZIL_QURAN_SHA256 =
            "a22c0d515c37a5667160765c2d1d171fa4b9d7d8778e47161bb0fe894cf61c1d";

    private SourceValidator() {
    }

    /** Lowercase hex SHA-256 of the bytes as given, with no decoding. */
    public static String digest(byte[] raw) {
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha256.digest(raw));
        } catch (NoSuchAlgorithmException e) {
            // every Java platform is required to ship SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static boolean validate(byte[] raw, String expectedDigest) {
        if (expectedDigest == null || expectedDigest.isBlank()) {
            return false;
        }
        return digest(raw).equals(expectedDigest.strip().toLowerCase(Locale.ROOT));
    }

    /**
     * Same check as {@link #validate} but fails with a diagnostic naming the
     * file and both digests.
     */
    public static void requireValid(byte[] raw, String expectedDigest, String file) throws IntegrityException {
        String actual = digest(raw);
        if (!validate(raw, expectedDigest)) {
            throw new IntegrityException(file, expectedDigest, actual);
        }
        LOG.debug("{} matches digest {}", file, actual);
    }
}
