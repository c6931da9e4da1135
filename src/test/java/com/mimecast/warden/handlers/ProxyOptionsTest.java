package com.mimecast.warden.handlers;

import com.mimecast.warden.config.ProxyConfig;
import com.mimecast.warden.transform.TransformOptions;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProxyOptionsTest {

    private final ProxyConfig config = new ProxyConfig(Map.of(
            "sendFrom", "proxy@home.example",
            "kindleSendFrom", "kindle-from@home.example",
            "kindleSendTo", "reader@kindle.example"
    ));

    @Test
    void testPlainAddress() {
        ProxyOptions options = ProxyOptions.parse("proxy@home.example", config, "me@home.example");

        assertFalse(options.isText());
        assertFalse(options.isSendUsingSmtp());
        assertEquals("proxy@home.example", options.getSendFrom());
        assertEquals("me@home.example", options.getSendTo());
    }

    @Test
    void testFlagsAreCaseInsensitive() {
        ProxyOptions options = ProxyOptions.parse("TXT+Bleach+Images+WOLinks+Inline@home.example", config, "me@home.example");

        assertTrue(options.isText());
        assertTrue(options.isBleach());
        assertTrue(options.isImages());
        assertTrue(options.isWithoutLinks());
        assertTrue(options.isInline());

        TransformOptions transform = options.toTransformOptions();
        assertTrue(transform.isText());
        assertTrue(transform.isWithoutLinks());
    }

    @Test
    void testKindleSwitchesAddresses() {
        ProxyOptions options = ProxyOptions.parse("kindle@home.example", config, "me@home.example");

        assertTrue(options.isSendUsingSmtp());
        assertEquals("kindle-from@home.example", options.getSendFrom());
        assertEquals("reader@kindle.example", options.getSendTo());
    }

    @Test
    void testMissingToHeader() {
        ProxyOptions options = ProxyOptions.parse(null, config, "me@home.example");

        assertFalse(options.isInline());
        assertEquals("me@home.example", options.getSendTo());
    }
}
