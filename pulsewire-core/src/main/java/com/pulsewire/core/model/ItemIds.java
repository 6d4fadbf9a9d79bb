package com.pulsewire.core.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Stable item identifiers. The same logical item maps to the same id on every run.
 */
public final class ItemIds {

    private static final int ID_LENGTH = 16;

    private ItemIds() {
    }

    /**
     * Id for an item with a canonical URL. Scheme, case of the host, fragments and
     * trailing slashes are ignored so feeds and search APIs agree on the same article.
     */
    public static String forUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must not be blank");
        }
        return digest(normalizeUrl(url));
    }

    /** Id for an item without a URL, derived from the given content parts. */
    public static String forContent(String... parts) {
        return digest(String.join("|", parts));
    }

    /** SHA-256 of the input, truncated to 16 lowercase hex characters. */
    public static String digest(String input) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, ID_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static String normalizeUrl(String url) {
        String u = url.trim();
        int hash = u.indexOf('#');
        if (hash >= 0) {
            u = u.substring(0, hash);
        }
        int scheme = u.indexOf("://");
        if (scheme >= 0) {
            u = u.substring(scheme + 3);
        }
        int slash = u.indexOf('/');
        String host = slash >= 0 ? u.substring(0, slash) : u;
        String rest = slash >= 0 ? u.substring(slash) : "";
        host = host.toLowerCase(Locale.ROOT);
        if (host.startsWith("www.")) {
            host = host.substring(4);
        }
        while (rest.endsWith("/")) {
            rest = rest.substring(0, rest.length() - 1);
        }
        return host + rest;
    }
}
