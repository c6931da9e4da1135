package com.mimecast.warden.handlers;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LanguageResolverTest {

    private static final List<String> AVAILABLE = List.of("en", "de");

    @Test
    void testResolve() {
        assertEquals("de", LanguageResolver.resolve("DE-de", AVAILABLE, "en"));
        assertEquals("en", LanguageResolver.resolve("fr", AVAILABLE, "en"));
        assertEquals("en", LanguageResolver.resolve(null, AVAILABLE, "en"));
    }

    @Test
    void testFirstConfiguredWins() {
        assertEquals("en", LanguageResolver.resolve("de, en", AVAILABLE, "de"));
    }

    @Test
    void testTemplateFallback() {
        Map<String, String> templates = new LinkedHashMap<>();
        templates.put("en", "Away");

        assertEquals("Away", LanguageResolver.template(templates, "de", "en"));
        assertEquals("", LanguageResolver.template(templates, "de", "fr"));
    }
}
