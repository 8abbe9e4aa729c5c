package com.xapo.sdk.widget;

import com.xapo.sdk.model.MicroPaymentConfig;

/** Contract for producing embeddable payment button snippets. */
public interface WidgetBuilder {
    /**
     * Builds the provider URL carrying the encrypted configuration.
     *
     * @param config the button configuration
     * @return {@code service_url?app_id=..&button_request=..&customization=..}
     * @throws com.xapo.sdk.exception.PayloadSerializationException if the config cannot be written as JSON
     * @throws com.xapo.sdk.exception.InvalidKeyLengthException if the application secret has the wrong size
     * @throws com.xapo.sdk.exception.PayloadEncodingException if the payload cannot be encoded
     */
    String buildUrl(MicroPaymentConfig config);

    /**
     * Builds an {@code iframe} snippet whose {@code src} is {@link #buildUrl(MicroPaymentConfig)}.
     *
     * @param config the button configuration
     * @return the HTML snippet
     */
    String buildIframeWidget(MicroPaymentConfig config);

    /**
     * Builds a pair of {@code div}s plus a script that loads the widget URL into
     * the first one. The page must provide jQuery ({@code $(document).ready} and
     * {@code .load}).
     *
     * @param config the button configuration
     * @return the HTML snippet
     */
    String buildDivWidget(MicroPaymentConfig config);
}
