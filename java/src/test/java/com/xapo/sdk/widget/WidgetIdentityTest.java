package com.xapo.sdk.widget;

import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class WidgetIdentityTest {

    @Test
    void loadsFromPropertiesFile() throws Exception {
        Properties props = new Properties();
        try (InputStream in = getClass().getResourceAsStream("/xapo-test.properties")) {
            assertNotNull(in);
            props.load(in);
        }

        WidgetIdentity identity = WidgetIdentity.fromProperties(props);

        assertEquals("http://example.com/pay_button/show", identity.getServiceUrl());
        assertEquals("b91014cc28c94841", identity.getAppId());
        assertArrayEquals("c533a6e606fb62cc".getBytes(StandardCharsets.UTF_8), identity.getAppSecret());
    }

    @Test
    void missingPropertyIsNamed() {
        Properties props = new Properties();
        props.setProperty(WidgetIdentity.SERVICE_URL_KEY, "http://example.com");
        props.setProperty(WidgetIdentity.APP_SECRET_KEY, "c533a6e606fb62cc");

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> WidgetIdentity.fromProperties(props));
        assertTrue(ex.getMessage().contains(WidgetIdentity.APP_ID_KEY));
    }

    @Test
    void secretIsCopiedAndHidden() {
        byte[] secret = "c533a6e606fb62cc".getBytes(StandardCharsets.UTF_8);
        WidgetIdentity identity = new WidgetIdentity("http://example.com", "app", secret);

        secret[0] = 'x';
        identity.getAppSecret()[1] = 'y';

        assertArrayEquals("c533a6e606fb62cc".getBytes(StandardCharsets.UTF_8), identity.getAppSecret());
        assertFalse(identity.toString().contains("c533a6e606fb62cc"));
    }

    @Test
    void equalByValue() {
        WidgetIdentity a = new WidgetIdentity("http://example.com", "app", "c533a6e606fb62cc");
        WidgetIdentity b = new WidgetIdentity("http://example.com", "app",
                "c533a6e606fb62cc".getBytes(StandardCharsets.UTF_8));

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    void keyLengthIsNotCheckedAtConstruction() {
        assertDoesNotThrow(() -> new WidgetIdentity("http://example.com", "app", "short"));
    }
}
