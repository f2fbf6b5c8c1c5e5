package com.product.resolution.cluster;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;

/**
 * Derives golden-record ids from member ids only: {@code "GR-"} followed by the first
 * 24 hex characters of the SHA-256 of the sorted member ids joined with {@code '\n'}.
 */
public final class GoldenRecordIds {

    public static final String PREFIX = "GR-";
    private static final int HEX_LENGTH = 24;

    private GoldenRecordIds() {
    }

    public static String idFor(Collection<String> memberIds) {
        if (memberIds.isEmpty()) {
            throw new IllegalArgumentException("A golden record id needs at least one member id");
        }
        List<String> sorted = new ArrayList<>(memberIds);
        Collections.sort(sorted);
        byte[] digest = sha256().digest(String.join("\n", sorted).getBytes(StandardCharsets.UTF_8));
        return PREFIX + HexFormat.of().formatHex(digest).substring(0, HEX_LENGTH);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // every JDK ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
