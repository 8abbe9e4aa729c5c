package com.xapo.sdk.exception;

/** Base type for every failure raised while building a payment widget. */
public class MicroPaymentException extends RuntimeException {

    public MicroPaymentException(String message) {
        super(message);
    }

    public MicroPaymentException(String message, Throwable cause) {
        super(message, cause);
    }
}
