package com.product.resolution.api;

/**
 * Validation of caller-supplied identifiers, applied before any lookup or computation.
 */
public final class InputValidator {

    /** Maximum allowed length for record and golden-record ids. */
    public static final int MAX_ID_LENGTH = 256;

    private InputValidator() {
        // utility class
    }

    /**
     * Rejects null, blank, overly long, or control-character-containing ids.
     *
     * @param id   the id to validate
     * @param name parameter name used in the error message
     * @throws IllegalArgumentException if the id is malformed
     */
    public static void validateId(String id, String name) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
        if (id.length() > MAX_ID_LENGTH) {
            throw new IllegalArgumentException(
                    name + " exceeds maximum length of " + MAX_ID_LENGTH + " characters (was " + id.length() + ")");
        }
        if (containsControlCharacters(id)) {
            throw new IllegalArgumentException(name + " must not contain control characters");
        }
    }

    /**
     * Checks whether a string contains ASCII control characters (0x00-0x1F, 0x7F).
     */
    private static boolean containsControlCharacters(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < 0x20 || c == 0x7F) {
                return true;
            }
        }
        return false;
    }
}
