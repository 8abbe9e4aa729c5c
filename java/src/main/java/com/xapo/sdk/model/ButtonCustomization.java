package com.xapo.sdk.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

/** Display hints sent in clear as the {@code customization} query parameter. */
public class ButtonCustomization {
    /** Text shown on the button, normally the payment type. */
    @JsonProperty("button_text")
    @JsonSerialize(nullsUsing = NullAsEmptyStringSerializer.class)
    public String buttonText;

    /** Default constructor for Jackson. */
    public ButtonCustomization() {}

    public ButtonCustomization(String buttonText) {
        this.buttonText = buttonText;
    }
}
