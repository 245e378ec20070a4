package com.rxguard.app.crypto;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class ChunkCodecTest {

    private static final MasterKey KEY = MasterKey.of(new byte[32]);

    @Test
    void encryptDecrypt_roundTrip_preservesBytes() throws Exception {
        ChunkCodec codec = new ChunkCodec(MasterKey.generate());
        Random rnd = new Random(42);
        for (int size : new int[] {0, 1, 15, 16, 17, 1024, 65_537}) {
            byte[] plain = new byte[size];
            rnd.nextBytes(plain);

            EncryptedChunk enc = codec.encryptChunk(plain);
            assertEquals(size + ChunkCodec.TAG_LEN, enc.ciphertext().length, "ciphertext = plaintext + tag");
            assertArrayEquals(plain, codec.decryptChunk(enc.hash(), enc.ciphertext()), "size=" + size);
        }
    }

    @Test
    void encrypt_isDeterministic_sameHashSameCiphertext() {
        ChunkCodec codec = new ChunkCodec(KEY);
        byte[] plain = "prontuario 123".getBytes(StandardCharsets.UTF_8);

        EncryptedChunk a = codec.encryptChunk(plain);
        EncryptedChunk b = codec.encryptChunk(plain.clone());

        assertEquals(a.hash(), b.hash());
        assertArrayEquals(a.ciphertext(), b.ciphertext());
    }

    @Test
    void encrypt_rangeOfBuffer_matchesStandaloneArray() {
        ChunkCodec codec = new ChunkCodec(KEY);
        byte[] buf = "xxABCDEFyy".getBytes(StandardCharsets.US_ASCII);
        byte[] middle = "ABCDEF".getBytes(StandardCharsets.US_ASCII);

        EncryptedChunk fromRange = codec.encryptChunk(buf, 2, 6);
        EncryptedChunk whole = codec.encryptChunk(middle);

        assertEquals(whole.hash(), fromRange.hash());
        assertArrayEquals(whole.ciphertext(), fromRange.ciphertext());
    }

    @Test
    void decrypt_anyFlippedBit_failsWithIntegrityException() {
        ChunkCodec codec = new ChunkCodec(KEY);
        EncryptedChunk enc = codec.encryptChunk("dados clinicos".getBytes(StandardCharsets.UTF_8));

        for (int bit = 0; bit < enc.ciphertext().length * 8; bit++) {
            byte[] tampered = enc.ciphertext().clone();
            tampered[bit / 8] ^= (byte) (1 << (bit % 8));
            assertThrows(IntegrityException.class, () -> codec.decryptChunk(enc.hash(), tampered), "bit=" + bit);
        }
    }

    @Test
    void decrypt_withWrongKey_fails() {
        EncryptedChunk enc = new ChunkCodec(KEY).encryptChunk("secret".getBytes(StandardCharsets.UTF_8));
        ChunkCodec other = new ChunkCodec(MasterKey.generate());

        assertThrows(IntegrityException.class, () -> other.decryptChunk(enc.hash(), enc.ciphertext()));
    }

    @Test
    void decrypt_ciphertextReboundToOtherHash_fails() {
        ChunkCodec codec = new ChunkCodec(KEY);
        EncryptedChunk a = codec.encryptChunk("a".getBytes(StandardCharsets.UTF_8));
        EncryptedChunk b = codec.encryptChunk("b".getBytes(StandardCharsets.UTF_8));

        assertThrows(IntegrityException.class, () -> codec.decryptChunk(b.hash(), a.ciphertext()));
    }

    @Test
    void decrypt_truncatedCiphertext_fails() {
        ChunkCodec codec = new ChunkCodec(KEY);
        EncryptedChunk enc = codec.encryptChunk("abc".getBytes(StandardCharsets.UTF_8));

        assertThrows(IntegrityException.class, () -> codec.decryptChunk(enc.hash(), new byte[5]));
    }

    @Test
    void computeHash_isXxh64Hex() {
        // XXH64("", seed 0)
        assertEquals("ef46db3751d8e999", ChunkCodec.computeHash(new byte[0]));
        assertEquals(16, ChunkCodec.computeHash("x".getBytes(StandardCharsets.UTF_8)).length());
    }

    @Test
    void deriveChunkKeyAndNonce_isDeterministicAndSeparatedPerHash() {
        byte[] mk = KEY.bytes();
        ChunkCodec.ChunkKeyMaterial a1 = ChunkCodec.deriveChunkKeyAndNonce(mk, "0011223344556677");
        ChunkCodec.ChunkKeyMaterial a2 = ChunkCodec.deriveChunkKeyAndNonce(mk, "0011223344556677");
        ChunkCodec.ChunkKeyMaterial b = ChunkCodec.deriveChunkKeyAndNonce(mk, "8899aabbccddeeff");

        assertEquals(ChunkCodec.KEY_LEN, a1.key().length);
        assertEquals(ChunkCodec.NONCE_LEN, a1.nonce().length);
        assertArrayEquals(a1.key(), a2.key());
        assertArrayEquals(a1.nonce(), a2.nonce());
        assertFalse(java.util.Arrays.equals(a1.key(), b.key()));
        assertFalse(java.util.Arrays.equals(a1.nonce(), b.nonce()));
    }

    @Test
    void hkdf_matchesRfc5869_testCase3() {
        HexFormat hex = HexFormat.of();
        byte[] ikm = hex.parseHex("0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b");

        byte[] okm = ChunkCodec.hkdfSha256(ikm, new byte[0], new byte[0], 42);

        assertEquals(
                "8da4e775a563c18f715f802a063c5a31b8a11f5c5ee1879ec3454e5f3c738d2d9d201395faa4b61a96c8",
                hex.formatHex(okm));
    }
}
