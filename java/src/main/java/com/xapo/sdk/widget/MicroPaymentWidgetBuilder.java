package com.xapo.sdk.widget;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xapo.sdk.crypto.AesEcbPayloadCipher;
import com.xapo.sdk.crypto.PayloadCipher;
import com.xapo.sdk.exception.PayloadSerializationException;
import com.xapo.sdk.model.ButtonCustomization;
import com.xapo.sdk.model.MicroPaymentConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Builds payment button snippets for one application.
 *
 * <p>The configuration is written as JSON, encrypted with the application
 * secret and sent as {@code button_request}; the app id and the button text
 * travel in clear. Instances hold no mutable state and can be shared.
 */
public class MicroPaymentWidgetBuilder implements WidgetBuilder {

    private static final Logger log = LoggerFactory.getLogger(MicroPaymentWidgetBuilder.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Writes the config without {@code pay_type}, for {@link PayTypePlacement#CUSTOMIZATION_ONLY}. */
    private static final ObjectMapper WITHOUT_PAY_TYPE =
            MAPPER.copy().addMixIn(MicroPaymentConfig.class, WithoutPayType.class);

    @JsonIgnoreProperties("pay_type")
    private abstract static class WithoutPayType {}

    private final WidgetIdentity identity;
    private final PayTypePlacement placement;
    private final PayloadCipher cipher;

    public MicroPaymentWidgetBuilder(WidgetIdentity identity) {
        this(identity, PayTypePlacement.REQUEST_AND_CUSTOMIZATION);
    }

    public MicroPaymentWidgetBuilder(WidgetIdentity identity, PayTypePlacement placement) {
        this(identity, placement, new AesEcbPayloadCipher());
    }

    public MicroPaymentWidgetBuilder(WidgetIdentity identity, PayTypePlacement placement,
                                     PayloadCipher cipher) {
        this.identity = Objects.requireNonNull(identity, "identity");
        this.placement = Objects.requireNonNull(placement, "placement");
        this.cipher = Objects.requireNonNull(cipher, "cipher");
    }

    /** Convenience constructor mirroring the provider's documented setup. */
    public MicroPaymentWidgetBuilder(String serviceUrl, String appId, String appSecret) {
        this(new WidgetIdentity(serviceUrl, appId, appSecret));
    }

    @Override
    public String buildUrl(MicroPaymentConfig config) {
        Objects.requireNonNull(config, "config");
        String buttonRequest = cipher.encrypt(serializeRequest(config), identity.getAppSecret());

        Map<String, String> query = new LinkedHashMap<>();
        query.put("app_id", identity.getAppId());
        query.put("button_request", buttonRequest);
        query.put("customization", toJson(new ButtonCustomization(config.payType)));

        String url = identity.getServiceUrl() + "?" + encodeQuery(query);
        log.debug("Built widget URL for app {} ({} placement)", identity.getAppId(), placement);
        return url;
    }

    @Override
    public String buildIframeWidget(MicroPaymentConfig config) {
        String html = WidgetTemplates.iframe(buildUrl(config));
        log.debug("Rendered iframe widget for app {}", identity.getAppId());
        return html;
    }

    @Override
    public String buildDivWidget(MicroPaymentConfig config) {
        String html = WidgetTemplates.div(buildUrl(config));
        log.debug("Rendered div widget for app {}", identity.getAppId());
        return html;
    }

    public WidgetIdentity getIdentity() {
        return identity;
    }

    public PayTypePlacement getPlacement() {
        return placement;
    }

    /** JSON text that gets encrypted into {@code button_request}. */
    String serializeRequest(MicroPaymentConfig config) {
        ObjectMapper mapper = placement == PayTypePlacement.CUSTOMIZATION_ONLY ? WITHOUT_PAY_TYPE : MAPPER;
        return toJson(mapper, config);
    }

    private static String toJson(Object value) {
        return toJson(MAPPER, value);
    }

    private static String toJson(ObjectMapper mapper, Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PayloadSerializationException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private static String encodeQuery(Map<String, String> params) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> e : params.entrySet()) {
            if (sb.length() > 0) {
                sb.append('&');
            }
            sb.append(URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8))
              .append('=')
              .append(URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8));
        }
        return sb.toString();
    }
}
