package com.monadarena.service;

import org.bouncycastle.jcajce.provider.digest.Keccak;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class CommitmentCodecTest {

    @Test
    void computeCommitment_hashesMoveFollowedBySalt() {
        byte[] move = {0x0a, 0x0b};
        byte[] salt = new byte[CommitmentCodec.SALT_BYTES];
        Arrays.fill(salt, (byte) 0x11);
        byte[] preimage = new byte[move.length + salt.length];
        System.arraycopy(move, 0, preimage, 0, move.length);
        System.arraycopy(salt, 0, preimage, move.length, salt.length);

        String expected = CommitmentCodec.encodeHex(new Keccak.Digest256().digest(preimage));

        assertEquals(expected, CommitmentCodec.computeCommitment(move, salt));
        assertTrue(expected.matches("^0x[0-9a-f]{64}$"));
    }

    @Test
    void encodeHex_matchesKnownKeccakVector() {
        byte[] digest = new Keccak.Digest256().digest("abc".getBytes(StandardCharsets.US_ASCII));
        assertEquals(
                "0x4e03657aea45a94fc7d47ba826c8d667c0d1e6e33a64a036ec44f58fa12d6c45",
                CommitmentCodec.encodeHex(digest)
        );
    }

    @Test
    void computeCommitment_differentSaltChangesDigest() {
        byte[] move = {0x01};
        byte[] saltA = new byte[CommitmentCodec.SALT_BYTES];
        byte[] saltB = new byte[CommitmentCodec.SALT_BYTES];
        saltB[31] = 1;

        assertNotEquals(CommitmentCodec.computeCommitment(move, saltA), CommitmentCodec.computeCommitment(move, saltB));
    }

    @Test
    void computeCommitment_rejectsEmptyMoveAndWrongSaltLength() {
        assertThrows(IllegalArgumentException.class, () ->
                CommitmentCodec.computeCommitment(new byte[0], new byte[CommitmentCodec.SALT_BYTES]));
        assertThrows(IllegalArgumentException.class, () ->
                CommitmentCodec.computeCommitment(new byte[]{1}, new byte[31]));
    }

    @Test
    void normalizeCommitment_acceptsPrefixedAndUnprefixedDigests() {
        String digest = "ABCD".repeat(16);
        assertEquals("0x" + digest.toLowerCase(), CommitmentCodec.normalizeCommitment("0x" + digest));
        assertEquals("0x" + digest.toLowerCase(), CommitmentCodec.normalizeCommitment(digest));
    }

    @Test
    void normalizeCommitment_rejectsZeroAndMalformedDigests() {
        assertThrows(IllegalArgumentException.class, () -> CommitmentCodec.normalizeCommitment("0x" + "0".repeat(64)));
        assertThrows(IllegalArgumentException.class, () -> CommitmentCodec.normalizeCommitment("0x1234"));
        assertThrows(IllegalArgumentException.class, () -> CommitmentCodec.normalizeCommitment("0x" + "g".repeat(64)));
    }

    @Test
    void decodeHex_rejectsOddLength() {
        assertArrayEquals(new byte[]{0x01, (byte) 0xff}, CommitmentCodec.decodeHex("0x01FF"));
        assertThrows(IllegalArgumentException.class, () -> CommitmentCodec.decodeHex("0x123"));
    }
}
