package com.syntex.natiq.error;

/**
 * The raw corpus bytes do not hash to the pinned reference digest. Always
 * fatal: nothing may be written from an unverified source.
 */
public class IntegrityException extends ConversionException {

    private final String expectedDigest;
    private final String actualDigest;

    public IntegrityException(String file, String expectedDigest, String actualDigest) {
        super(Stage.VALIDATE, file, "SHA-256 mismatch, expected " + expectedDigest + " but was " + actualDigest
                + " (use the original Tanzil Quran source)");
        this.expectedDigest = expectedDigest;
        this.actualDigest = actualDigest;
    }

    public String getExpectedDigest() {
        return expectedDigest;
    }

    public String getActualDigest() {
        return actualDigest;
    }
}
