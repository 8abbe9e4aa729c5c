package com.xapo.sdk.widget;

/** Where the payment type travels in the widget URL. */
public enum PayTypePlacement {
    /** Inside the encrypted payload and in {@code customization}. The default. */
    REQUEST_AND_CUSTOMIZATION,

    /** Only in {@code customization}; the encrypted payload has no {@code pay_type} key. */
    CUSTOMIZATION_ONLY
}
