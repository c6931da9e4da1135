package com.mimecast.warden.transform;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SiteTransformTest {

    @Test
    void testFromName() {
        assertEquals(SiteTransform.UNSHIFT_OBFUSCATED, SiteTransform.fromName("unshift-obfuscated"));
        assertEquals(SiteTransform.NONE, SiteTransform.fromName("none"));
        assertThrows(IllegalArgumentException.class, () -> SiteTransform.fromName("rot13"));
        assertThrows(IllegalArgumentException.class, () -> SiteTransform.fromName(null));
    }

    @Test
    void testForHost() {
        Map<String, SiteTransform> mappings = new LinkedHashMap<>();
        mappings.put("spiegel.de", SiteTransform.UNSHIFT_OBFUSCATED);

        assertEquals(SiteTransform.UNSHIFT_OBFUSCATED, SiteTransform.forHost("spiegel.de", mappings));
        assertEquals(SiteTransform.UNSHIFT_OBFUSCATED, SiteTransform.forHost("WWW.Spiegel.de", mappings));
        assertEquals(SiteTransform.NONE, SiteTransform.forHost("notspiegel.de", mappings));
        assertEquals(SiteTransform.NONE, SiteTransform.forHost(null, mappings));
    }

    @Test
    void testUnshift() {
        assertEquals("Hello, World", SiteTransform.unshift("Ifmmp- Xpsme"));
        assertEquals("ä", SiteTransform.unshift("å"));
    }

    @Test
    void testApplySkipsLinksAndNestedElements() {
        Document document = Jsoup.parse("<p class=\"obfuscated\">Ufyu <a href=\"#\">Link</a> "
                + "<span class=\"obfuscated\">Joofs</span></p><p>Ifmmp</p>");

        SiteTransform.UNSHIFT_OBFUSCATED.apply(document);

        assertEquals("Text Link Inner", document.select("p").first().text());
        assertEquals("Ifmmp", document.select("p").last().text());
    }
}
