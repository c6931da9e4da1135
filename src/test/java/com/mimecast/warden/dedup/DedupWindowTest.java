package com.mimecast.warden.dedup;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DedupWindowTest {

    @Test
    void testScopeSeesBothGenerations() {
        DedupWindow window = new DedupWindow();
        Set<String> seen = window.openRuleScope();
        seen.add("<a>");
        window.closeRuleScope(seen);

        window.rotate();
        seen = window.openRuleScope();
        seen.add("<b>");
        window.closeRuleScope(seen);

        Set<String> scope = window.openRuleScope();
        assertTrue(scope.contains("<a>"));
        assertTrue(scope.contains("<b>"));
    }

    @Test
    void testCloseKeepsOnlyNewIdentifiers() {
        DedupWindow window = new DedupWindow();
        Set<String> seen = window.openRuleScope();
        seen.add("<a>");
        window.closeRuleScope(seen);
        window.rotate();

        seen = window.openRuleScope();
        seen.add("<b>");
        window.closeRuleScope(seen);

        assertEquals(Set.of("<a>"), window.getPrevious());
        assertEquals(Set.of("<b>"), window.getCurrent());
    }

    @Test
    void testRotateForgetsAfterTwoWakeUps() {
        DedupWindow window = new DedupWindow();
        Set<String> seen = window.openRuleScope();
        seen.add("<a>");
        window.closeRuleScope(seen);

        window.rotate();
        assertTrue(window.isHandled("<a>"));
        assertTrue(window.getCurrent().isEmpty());

        window.rotate();
        assertFalse(window.isHandled("<a>"));
    }

    @Test
    void testLaterRuleSeesEarlierRuleInSameWakeUp() {
        DedupWindow window = new DedupWindow();
        window.rotate();

        Set<String> first = window.openRuleScope();
        first.add("<x>");
        window.closeRuleScope(first);

        assertTrue(window.openRuleScope().contains("<x>"));
    }

    @Test
    void testCanonicalIdPrefersMessageId() {
        assertEquals("<m1@example.com>", CanonicalId.of("  <m1@example.com> ", new byte[0]));
    }

    @Test
    void testCanonicalIdFallsBackToDigest() {
        byte[] raw = "Subject: x\r\n\r\nbody".getBytes(StandardCharsets.UTF_8);
        String id = CanonicalId.of(null, raw);

        assertTrue(id.startsWith("sha256:"));
        assertEquals(id, CanonicalId.of("", raw));
        assertNotEquals(id, CanonicalId.of(null, "other".getBytes(StandardCharsets.UTF_8)));
    }
}
