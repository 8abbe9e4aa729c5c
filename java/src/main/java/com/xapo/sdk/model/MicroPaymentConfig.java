package com.xapo.sdk.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.math.BigDecimal;
import java.time.Clock;

/**
 * Configuration of one payment button, serialized verbatim into the encrypted
 * {@code button_request}.
 *
 * <p>Every field is always written; optional fields left untouched, or set to
 * {@code null}, go out as empty strings because the provider expects all keys
 * to be present.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({
        "sender_user_id", "sender_user_email", "sender_user_cellphone",
        "receiver_user_id", "receiver_user_email", "pay_object_id",
        "amount", "timestamp", "pay_type"})
public class MicroPaymentConfig {
    /** Id of the user sending the payment (optional). */
    @JsonProperty("sender_user_id")
    @JsonSerialize(nullsUsing = NullAsEmptyStringSerializer.class)
    public String senderUserId = "";

    /** Email of the user sending the payment (optional). */
    @JsonProperty("sender_user_email")
    @JsonSerialize(nullsUsing = NullAsEmptyStringSerializer.class)
    public String senderUserEmail = "";

    /** Cellphone of the user sending the payment (optional). */
    @JsonProperty("sender_user_cellphone")
    @JsonSerialize(nullsUsing = NullAsEmptyStringSerializer.class)
    public String senderUserCellphone = "";

    /** Id of the user receiving the payment. */
    @JsonProperty("receiver_user_id")
    @JsonSerialize(nullsUsing = NullAsEmptyStringSerializer.class)
    public String receiverUserId = "";

    /** Email of the user receiving the payment. */
    @JsonProperty("receiver_user_email")
    @JsonSerialize(nullsUsing = NullAsEmptyStringSerializer.class)
    public String receiverUserEmail = "";

    /** Identifier of the paid object in the application's own terms. */
    @JsonProperty("pay_object_id")
    @JsonSerialize(nullsUsing = NullAsEmptyStringSerializer.class)
    public String payObjectId = "";

    /** Amount to pay; zero lets the user enter it when paying. */
    public BigDecimal amount = BigDecimal.ZERO;

    /** Creation time in milliseconds since the epoch. */
    public long timestamp;

    /** One of the {@link PayType} labels, not validated here. */
    @JsonProperty("pay_type")
    @JsonSerialize(nullsUsing = NullAsEmptyStringSerializer.class)
    public String payType = "";

    /** Captures the timestamp from the system UTC clock. */
    public MicroPaymentConfig() {
        this(Clock.systemUTC());
    }

    /** Captures the timestamp from the given clock. */
    public MicroPaymentConfig(Clock clock) {
        this(clock.millis());
    }

    /** Uses an explicit timestamp in epoch milliseconds. */
    public MicroPaymentConfig(long timestamp) {
        this.timestamp = timestamp;
    }

    /** Sets {@link #payType} from a known type and returns this config. */
    public MicroPaymentConfig payType(PayType type) {
        this.payType = type.label();
        return this;
    }
}
