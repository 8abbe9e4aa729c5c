package com.xapo.sdk.crypto;

import com.xapo.sdk.exception.PayloadEncodingException;

import java.util.Arrays;

/**
 * PKCS#7 padding over raw bytes.
 *
 * <p>The pad length is always between 1 and the block size: input that already
 * fills whole blocks receives one extra block whose bytes all equal the block size.
 */
public final class Pkcs7Padding {

    public static final int AES_BLOCK_SIZE = 16;

    private Pkcs7Padding() {}

    /** Returns a new array holding {@code data} followed by its PKCS#7 padding. */
    public static byte[] pad(byte[] data, int blockSize) {
        checkBlockSize(blockSize);
        int pad = blockSize - (data.length % blockSize);
        byte[] padded = Arrays.copyOf(data, data.length + pad);
        Arrays.fill(padded, data.length, padded.length, (byte) pad);
        return padded;
    }

    /**
     * Strips PKCS#7 padding.
     *
     * @throws PayloadEncodingException if the input is not a whole number of blocks
     *         or the trailing bytes are not valid padding
     */
    public static byte[] unpad(byte[] padded, int blockSize) {
        checkBlockSize(blockSize);
        if (padded.length == 0 || padded.length % blockSize != 0) {
            throw new PayloadEncodingException(
                    "Padded length " + padded.length + " is not a positive multiple of " + blockSize);
        }
        int pad = padded[padded.length - 1] & 0xff;
        if (pad < 1 || pad > blockSize) {
            throw new PayloadEncodingException("Invalid padding value " + pad);
        }
        for (int i = padded.length - pad; i < padded.length; i++) {
            if ((padded[i] & 0xff) != pad) {
                throw new PayloadEncodingException("Inconsistent padding bytes");
            }
        }
        return Arrays.copyOf(padded, padded.length - pad);
    }

    private static void checkBlockSize(int blockSize) {
        // pad values must fit in one unsigned byte
        if (blockSize < 1 || blockSize > 255) {
            throw new IllegalArgumentException("Block size out of range: " + blockSize);
        }
    }
}
