package com.xapo.sdk.crypto;

/** Minimal abstraction for turning a serialized payload into a transport-safe token.
 *  The provider decrypts the token with the same pre-shared secret.
 */
public interface PayloadCipher {
    /**
     * Encrypts the given payload with the application secret.
     *
     * @param payload the serialized configuration, usually JSON
     * @param secret the raw key bytes shared with the provider
     * @return the encrypted payload, base64 encoded
     * @throws com.xapo.sdk.exception.InvalidKeyLengthException if the secret has the wrong size
     * @throws com.xapo.sdk.exception.PayloadEncodingException if the payload cannot be encoded
     */
    String encrypt(String payload, byte[] secret);
}
