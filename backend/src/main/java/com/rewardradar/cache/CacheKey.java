package com.rewardradar.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * SHA-256 fingerprint of a logical request. Identity is the digest alone; homeId and kind ride along
 * so entries can be invalidated by home and given a TTL.
 */
public record CacheKey(String digest, String homeId, CacheKind kind) {

    public CacheKey {
        Objects.requireNonNull(digest, "digest");
        Objects.requireNonNull(kind, "kind");
    }

    /**
     * Key for {@code query} with the given parameters. Parameter order does not matter.
     */
    public static CacheKey of(String query, String homeId, CacheKind kind, Map<String, ?> params) {
        Map<String, String> sorted = new TreeMap<>();
        if (homeId != null) {
            sorted.put("homeId", homeId);
        }
        if (params != null) {
            params.forEach((k, v) -> sorted.put(k, String.valueOf(v)));
        }
        String canonical = query + "?" + sorted.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("&"));
        return new CacheKey(sha256(canonical), homeId, kind);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CacheKey other && digest.equals(other.digest);
    }

    @Override
    public int hashCode() {
        return digest.hashCode();
    }

    private static String sha256(String value) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
