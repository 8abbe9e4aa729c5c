package com.xapo.sdk.widget;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import java.util.Properties;

/**
 * Provider endpoint and application credentials used by a {@link WidgetBuilder}.
 *
 * <p>The secret is only used locally to encrypt payloads and is never sent. Its
 * length is checked when a payload is encrypted, not here.
 */
public final class WidgetIdentity {

    public static final String SERVICE_URL_KEY = "xapo.service-url";
    public static final String APP_ID_KEY = "xapo.app-id";
    public static final String APP_SECRET_KEY = "xapo.app-secret";

    private final String serviceUrl;
    private final String appId;
    private final byte[] appSecret;

    public WidgetIdentity(String serviceUrl, String appId, byte[] appSecret) {
        this.serviceUrl = Objects.requireNonNull(serviceUrl, "serviceUrl");
        this.appId = Objects.requireNonNull(appId, "appId");
        this.appSecret = Objects.requireNonNull(appSecret, "appSecret").clone();
    }

    /** Uses the UTF-8 bytes of {@code appSecret} as the key. */
    public WidgetIdentity(String serviceUrl, String appId, String appSecret) {
        this(serviceUrl, appId,
                Objects.requireNonNull(appSecret, "appSecret").getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Reads {@value #SERVICE_URL_KEY}, {@value #APP_ID_KEY} and {@value #APP_SECRET_KEY}.
     *
     * @throws IllegalArgumentException if a key is missing or blank
     */
    public static WidgetIdentity fromProperties(Properties properties) {
        return new WidgetIdentity(
                required(properties, SERVICE_URL_KEY),
                required(properties, APP_ID_KEY),
                required(properties, APP_SECRET_KEY));
    }

    private static String required(Properties properties, String key) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing property " + key);
        }
        return value.trim();
    }

    public String getServiceUrl() {
        return serviceUrl;
    }

    public String getAppId() {
        return appId;
    }

    /** Returns a copy of the raw key bytes. */
    public byte[] getAppSecret() {
        return appSecret.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WidgetIdentity)) return false;
        WidgetIdentity that = (WidgetIdentity) o;
        return serviceUrl.equals(that.serviceUrl)
                && appId.equals(that.appId)
                && Arrays.equals(appSecret, that.appSecret);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(serviceUrl, appId) + Arrays.hashCode(appSecret);
    }

    @Override
    public String toString() {
        return "WidgetIdentity{serviceUrl=" + serviceUrl + ", appId=" + appId + ", appSecret=***}";
    }
}
