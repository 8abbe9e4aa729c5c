package com.xapo.sdk.crypto;

import com.xapo.sdk.exception.PayloadEncodingException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class Pkcs7PaddingTest {

    @Test
    void padAlwaysAddsBetweenOneAndSixteenBytes() {
        for (int n = 0; n <= 100; n++) {
            byte[] data = new byte[n];
            Arrays.fill(data, (byte) 'a');

            byte[] padded = Pkcs7Padding.pad(data, 16);
            int p = padded.length - n;

            assertTrue(p >= 1 && p <= 16, "pad length " + p + " for n=" + n);
            assertEquals(0, padded.length % 16);
            for (int i = n; i < padded.length; i++) {
                assertEquals(p, padded[i], "pad byte at " + i + " for n=" + n);
            }
            assertArrayEquals(data, Arrays.copyOf(padded, n));
        }
    }

    @Test
    void fullBlockInputGetsExtraBlockOfSixteens() {
        byte[] padded = Pkcs7Padding.pad(new byte[32], 16);

        assertEquals(48, padded.length);
        for (int i = 32; i < 48; i++) {
            assertEquals(16, padded[i]);
        }
    }

    @Test
    void emptyInputIsOneFullPadBlock() {
        byte[] padded = Pkcs7Padding.pad(new byte[0], 16);

        assertEquals(16, padded.length);
        assertEquals(16, padded[0]);
    }

    @Test
    void unpadReversesPad() {
        for (int n = 0; n <= 40; n++) {
            byte[] data = new byte[n];
            for (int i = 0; i < n; i++) {
                data[i] = (byte) i;
            }
            assertArrayEquals(data, Pkcs7Padding.unpad(Pkcs7Padding.pad(data, 16), 16));
        }
    }

    @Test
    void unpadRejectsUnalignedInput() {
        assertThrows(PayloadEncodingException.class, () -> Pkcs7Padding.unpad(new byte[15], 16));
        assertThrows(PayloadEncodingException.class, () -> Pkcs7Padding.unpad(new byte[0], 16));
    }

    @Test
    void unpadRejectsBadPadValues() {
        byte[] zero = new byte[16];
        assertThrows(PayloadEncodingException.class, () -> Pkcs7Padding.unpad(zero, 16));

        byte[] tooLarge = new byte[16];
        tooLarge[15] = 17;
        assertThrows(PayloadEncodingException.class, () -> Pkcs7Padding.unpad(tooLarge, 16));

        // last byte says 3 but the byte before it disagrees
        byte[] inconsistent = new byte[16];
        inconsistent[13] = 3;
        inconsistent[14] = 2;
        inconsistent[15] = 3;
        assertThrows(PayloadEncodingException.class, () -> Pkcs7Padding.unpad(inconsistent, 16));
    }

    @Test
    void rejectsBlockSizeThatDoesNotFitInAByte() {
        assertThrows(IllegalArgumentException.class, () -> Pkcs7Padding.pad(new byte[1], 0));
        assertThrows(IllegalArgumentException.class, () -> Pkcs7Padding.pad(new byte[1], 256));
    }
}
