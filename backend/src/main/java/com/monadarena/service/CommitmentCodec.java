package com.monadarena.service;

import org.bouncycastle.jcajce.provider.digest.Keccak;

import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Commit-reveal digest codec: {@code keccak256(move || salt)} with a 32-byte salt.
 * Digests, moves and salts travel as 0x-prefixed lower-case hex.
 */
public final class CommitmentCodec {

    private static final Pattern HEX_64 = Pattern.compile("^[0-9a-f]{64}$");
    private static final Pattern HEX_EVEN = Pattern.compile("^([0-9a-f]{2})*$");

    public static final int SALT_BYTES = 32;

    private CommitmentCodec() {
    }

    public static String computeCommitment(byte[] move, byte[] salt) {
        if (move == null || move.length == 0) {
            throw new IllegalArgumentException("Move payload is required");
        }
        if (salt == null || salt.length != SALT_BYTES) {
            throw new IllegalArgumentException("Salt must be " + SALT_BYTES + " bytes");
        }

        byte[] preimage = Arrays.copyOf(move, move.length + salt.length);
        System.arraycopy(salt, 0, preimage, move.length, salt.length);

        Keccak.Digest256 digest = new Keccak.Digest256();
        return "0x" + toHex(digest.digest(preimage));
    }

    public static String normalizeCommitment(String commitment) {
        if (commitment == null) {
            throw new IllegalArgumentException("Commitment is required");
        }

        String withoutPrefix = stripPrefix(commitment);
        if (!HEX_64.matcher(withoutPrefix).matches()) {
            throw new IllegalArgumentException("Commitment must be 64 hex characters");
        }
        if (withoutPrefix.chars().allMatch(c -> c == '0')) {
            throw new IllegalArgumentException("Commitment must not be empty");
        }
        return "0x" + withoutPrefix;
    }

    public static byte[] decodeHex(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Hex value is required");
        }

        String withoutPrefix = stripPrefix(value);
        if (!HEX_EVEN.matcher(withoutPrefix).matches()) {
            throw new IllegalArgumentException("Value must be an even number of hex characters");
        }

        byte[] out = new byte[withoutPrefix.length() / 2];
        for (int i = 0; i < out.length; i++) {
            int high = Character.digit(withoutPrefix.charAt(i * 2), 16);
            int low = Character.digit(withoutPrefix.charAt(i * 2 + 1), 16);
            out[i] = (byte) ((high << 4) | low);
        }
        return out;
    }

    public static String encodeHex(byte[] bytes) {
        return "0x" + toHex(bytes);
    }

    private static String stripPrefix(String value) {
        String trimmed = value.trim().toLowerCase(Locale.ROOT);
        return trimmed.startsWith("0x") ? trimmed.substring(2) : trimmed;
    }

    private static String toHex(byte[] bytes) {
        StringBuilder out = new StringBuilder(bytes.length * 2);
        for (byte value : bytes) {
            out.append(Character.forDigit((value >>> 4) & 0x0f, 16));
            out.append(Character.forDigit(value & 0x0f, 16));
        }
        return out.toString();
    }
}
