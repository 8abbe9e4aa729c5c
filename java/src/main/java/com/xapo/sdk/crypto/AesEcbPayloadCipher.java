package com.xapo.sdk.crypto;

import com.xapo.sdk.exception.InvalidKeyLengthException;
import com.xapo.sdk.exception.PayloadEncodingException;

import javax.crypto.Cipher;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/**
 * AES-128 in ECB mode over PKCS#7-padded UTF-8 bytes, base64 encoded with the
 * standard alphabet.
 *
 * <p>This is the provider's wire contract: each 16-byte block is encrypted on its
 * own, no IV is used, and the same input always yields the same token. Instances
 * are stateless and safe to share between threads.
 */
public class AesEcbPayloadCipher implements PayloadCipher {

    public static final int KEY_LENGTH = 16;

    private static final String TRANSFORMATION = "AES/ECB/NoPadding";

    @Override
    public String encrypt(String payload, byte[] secret) {
        SecretKeySpec key = keyOf(secret);
        byte[] padded = Pkcs7Padding.pad(utf8(payload), Pkcs7Padding.AES_BLOCK_SIZE);
        byte[] encrypted = apply(Cipher.ENCRYPT_MODE, key, padded);
        return Base64.getEncoder().encodeToString(encrypted);
    }

    /**
     * Reverses {@link #encrypt(String, byte[])}.
     *
     * @param token the base64 text produced by {@code encrypt}
     * @param secret the key the token was encrypted with
     * @return the original payload
     * @throws InvalidKeyLengthException if the secret has the wrong size
     * @throws PayloadEncodingException if the token is not valid base64, is not
     *         block aligned, carries bad padding or does not decode as UTF-8
     */
    public String decrypt(String token, byte[] secret) {
        SecretKeySpec key = keyOf(secret);
        byte[] encrypted;
        try {
            encrypted = Base64.getDecoder().decode(token);
        } catch (IllegalArgumentException e) {
            throw new PayloadEncodingException("Token is not valid base64", e);
        }
        if (encrypted.length == 0 || encrypted.length % Pkcs7Padding.AES_BLOCK_SIZE != 0) {
            throw new PayloadEncodingException(
                    "Ciphertext length " + encrypted.length + " is not block aligned");
        }
        byte[] padded = apply(Cipher.DECRYPT_MODE, key, encrypted);
        return fromUtf8(Pkcs7Padding.unpad(padded, Pkcs7Padding.AES_BLOCK_SIZE));
    }

    private static SecretKeySpec keyOf(byte[] secret) {
        Objects.requireNonNull(secret, "secret");
        if (secret.length != KEY_LENGTH) {
            throw new InvalidKeyLengthException(KEY_LENGTH, secret.length);
        }
        return new SecretKeySpec(Arrays.copyOf(secret, KEY_LENGTH), "AES");
    }

    private static byte[] apply(int mode, SecretKeySpec key, byte[] input) {
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(mode, key);
            return cipher.doFinal(input);
        } catch (GeneralSecurityException e) {
            throw new PayloadEncodingException("AES/ECB operation failed", e);
        }
    }

    private static byte[] utf8(String text) {
        CharsetEncoder encoder = StandardCharsets.UTF_8.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            ByteBuffer buffer = encoder.encode(CharBuffer.wrap(text));
            byte[] bytes = new byte[buffer.remaining()];
            buffer.get(bytes);
            return bytes;
        } catch (CharacterCodingException e) {
            throw new PayloadEncodingException("Payload is not representable as UTF-8", e);
        }
    }

    private static String fromUtf8(byte[] bytes) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            throw new PayloadEncodingException("Decrypted payload is not valid UTF-8", e);
        }
    }
}
