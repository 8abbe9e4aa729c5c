package com.xapo.sdk.model;

/**
 * Payment types the provider knows how to label.
 *
 * <p>The library does not restrict {@link MicroPaymentConfig#payType} to these
 * values; callers that need the restriction check it themselves.
 */
public enum PayType {
    TIP("Tip"),
    PAY("Pay"),
    DEPOSIT("Deposit"),
    DONATE("Donate");

    private final String label;

    PayType(String label) {
        this.label = label;
    }

    /** Text sent on the wire and shown on the button. */
    public String label() {
        return label;
    }

    /** Returns true if {@code label} matches one of the known types exactly. */
    public static boolean isKnown(String label) {
        for (PayType type : values()) {
            if (type.label.equals(label)) {
                return true;
            }
        }
        return false;
    }
}
