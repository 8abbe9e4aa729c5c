package com.xapo.sdk.exception;

/** Raised when a configuration record cannot be written as JSON. */
public class PayloadSerializationException extends MicroPaymentException {

    public PayloadSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
