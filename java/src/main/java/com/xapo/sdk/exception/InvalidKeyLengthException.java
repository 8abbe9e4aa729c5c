package com.xapo.sdk.exception;

/** Raised when the application secret is not the size the cipher requires. */
public class InvalidKeyLengthException extends MicroPaymentException {

    private final int actualLength;

    public InvalidKeyLengthException(int expectedLength, int actualLength) {
        super("Application secret must be " + expectedLength + " bytes, got " + actualLength);
        this.actualLength = actualLength;
    }

    /** Length in bytes of the rejected secret. */
    public int getActualLength() {
        return actualLength;
    }
}
