package com.xapo.sdk.exception;

/**
 * Raised when a payload cannot be converted between text and bytes, or when
 * padding, cipher or base64 handling fails on the byte level.
 */
public class PayloadEncodingException extends MicroPaymentException {

    public PayloadEncodingException(String message) {
        super(message);
    }

    public PayloadEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
