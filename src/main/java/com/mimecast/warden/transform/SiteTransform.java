package com.mimecast.warden.transform;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;

import java.util.Locale;
import java.util.Map;

/**
 * Per-site document fix-ups applied before the generic transformation.
 */
public enum SiteTransform {

    /**
     * Leaves the document untouched.
     */
    NONE {
        @Override
        public void apply(Document document) {
            // Nothing to do.
        }
    },

    /**
     * Reverses text obfuscated by shifting characters one code point up.
     * <p>Only text inside elements carrying the {@code obfuscated} class is touched.
     * <br>Link text is left alone.
     */
    UNSHIFT_OBFUSCATED {
        @Override
        public void apply(Document document) {
            for (Element element : document.getElementsByClass("obfuscated")) {
                if (hasObfuscatedAncestor(element)) {
                    continue;
                }
                NodeTraversor.traverse((node, depth) -> {
                    if (node instanceof TextNode && !"a".equals(((Element) node.parent()).normalName())) {
                        TextNode text = (TextNode) node;
                        text.text(unshift(text.getWholeText()));
                    }
                }, element);
            }
        }
    };

    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789"
            + "!\"#$%&'()*+,-./:;<=>?@[\\]^_`{|}~" + "\u00e4\u00f6\u00fc\u00c4\u00d6\u00dc\u00df";

    /**
     * Applies the transform to the document in place.
     *
     * @param document Jsoup document.
     */
    public abstract void apply(Document document);

    /**
     * Resolves a transform by its configured name.
     *
     * @param name Name, case-insensitive, dashes allowed in place of underscores.
     * @return SiteTransform instance.
     * @throws IllegalArgumentException Unknown name.
     */
    public static SiteTransform fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Site transform name missing");
        }
        String normalized = name.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (SiteTransform transform : values()) {
            if (transform.name().equals(normalized)) {
                return transform;
            }
        }
        throw new IllegalArgumentException("Unknown site transform: " + name);
    }

    /**
     * Picks the transform whose domain suffix matches the host.
     * <p>First match in map order wins.
     *
     * @param host     Host name.
     * @param mappings Domain suffix to transform.
     * @return SiteTransform, NONE when nothing matches.
     */
    public static SiteTransform forHost(String host, Map<String, SiteTransform> mappings) {
        if (host == null) {
            return NONE;
        }
        String lower = host.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, SiteTransform> entry : mappings.entrySet()) {
            String suffix = entry.getKey().toLowerCase(Locale.ROOT);
            if (lower.equals(suffix) || lower.endsWith("." + suffix)) {
                return entry.getValue();
            }
        }
        return NONE;
    }

    /**
     * Maps every shifted alphabet character back to its original.
     *
     * @param text Obfuscated text.
     * @return Plain text.
     */
    static String unshift(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            char original = (char) (c - 1);
            sb.append(c > 0 && ALPHABET.indexOf(original) >= 0 ? original : c);
        }
        return sb.toString();
    }

    private static boolean hasObfuscatedAncestor(Element element) {
        for (Element parent : element.parents()) {
            if (parent.hasClass("obfuscated")) {
                return true;
            }
        }
        return false;
    }
}
