package com.deepansh.pawsagent.session;

import java.util.Locale;

/**
 * Canonical form of an identity: "whatsapp:+54 9 11-2233-4455" → "+5491122334455".
 */
public final class IdentityNormalizer {

    private static final String WHATSAPP_PREFIX = "whatsapp:";

    private IdentityNormalizer() {
    }

    public static String normalize(String identity) {
        if (identity == null) {
            throw new IllegalArgumentException("identity must not be null");
        }
        String trimmed = identity.trim();
        String withoutPrefix = trimmed.toLowerCase(Locale.ROOT).startsWith(WHATSAPP_PREFIX)
                ? trimmed.substring(WHATSAPP_PREFIX.length())
                : trimmed;
        String digits = withoutPrefix.replaceAll("[^\\d+]", "");
        return digits.isEmpty() ? trimmed.toLowerCase(Locale.ROOT) : digits;
    }
}
