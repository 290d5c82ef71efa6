package io.smellscan.suppress;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Stable identity of a finding, used to match it against suppressions and the baseline.
 * <p>
 * Combines the rule id, the structural signature of the offending element and its source text
 * with all whitespace removed. Line numbers are not part of it, so edits elsewhere in the file
 * leave the fingerprint unchanged.
 *
 * @param value lowercase hex SHA-256 digest
 */
public record Fingerprint(String value) {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final char SEPARATOR = '\u0000';

    public Fingerprint {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Fingerprint value cannot be null or blank");
        }
    }

    public static Fingerprint compute(String ruleId, String entitySignature, String snippet) {
        String input = ruleId + SEPARATOR + entitySignature + SEPARATOR + normalize(snippet);
        return new Fingerprint(HexFormat.of().formatHex(sha256().digest(input.getBytes(StandardCharsets.UTF_8))));
    }

    /**
     * Removes all whitespace so that reformatting does not change the fingerprint.
     */
    static String normalize(String snippet) {
        return snippet == null ? "" : WHITESPACE.matcher(snippet).replaceAll("");
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is required by every Java platform", e);
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
