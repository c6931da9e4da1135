package com.mimecast.warden.handlers;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;

/**
 * Picks the reply language from a Content-Language header.
 */
public class LanguageResolver {

    private LanguageResolver() {
        throw new IllegalStateException("Static utility class");
    }

    /**
     * Gets the first available language contained in the lower-cased header.
     *
     * @param contentLanguage Content-Language header, may be null.
     * @param available       Template languages in configuration order.
     * @param defaultLanguage Fallback.
     * @return Language tag.
     */
    public static String resolve(String contentLanguage, Collection<String> available, String defaultLanguage) {
        if (contentLanguage != null) {
            String header = contentLanguage.toLowerCase(Locale.ROOT);
            for (String language : available) {
                if (header.contains(language)) {
                    return language;
                }
            }
        }
        return defaultLanguage;
    }

    /**
     * Gets the template for a language, falling back to the default language, then to empty.
     *
     * @param templates       Language to text.
     * @param language        Wanted language.
     * @param defaultLanguage Fallback language.
     * @return Template text.
     */
    public static String template(Map<String, String> templates, String language, String defaultLanguage) {
        String text = templates.get(language);
        if (text == null) {
            text = templates.get(defaultLanguage);
        }
        return text != null ? text : "";
    }
}
