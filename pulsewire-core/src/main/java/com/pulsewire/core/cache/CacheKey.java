package com.pulsewire.core.cache;

import com.pulsewire.core.model.ItemIds;

import java.util.Objects;

/**
 * Cache key: a per-source namespace plus a digest of the query parameters and date window.
 */
public record CacheKey(String namespace, String digest) {

    public CacheKey {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(digest, "digest");
        if (!namespace.matches("[A-Za-z0-9_.-]+")) {
            throw new IllegalArgumentException("Invalid cache namespace: " + namespace);
        }
    }

    public static CacheKey of(String namespace, Object... parts) {
        StringBuilder sb = new StringBuilder();
        for (Object part : parts) {
            if (sb.length() > 0) {
                sb.append('|');
            }
            sb.append(part);
        }
        return new CacheKey(namespace, ItemIds.digest(sb.toString()));
    }

    /** Relative file name for file-backed caches. */
    public String fileName() {
        return namespace + "_" + digest + ".json";
    }
}
