package com.rxguard.app.crypto;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;

import net.openhft.hashing.LongHashFunction;

/**
 * Criptografia determinística (convergente) de chunks.
 * <p>
 * Cada chunk é identificado pelo XXH64 do texto claro. Chave e nonce são
 * derivados da chave mestra via HKDF-SHA256 com info {@code "rxguard:chunk:" + hash},
 * e o próprio hash entra como AAD. O mesmo texto claro sempre gera o mesmo
 * ciphertext, o que viabiliza a deduplicação ao custo de revelar igualdade
 * entre chunks.
 */
public final class ChunkCodec {

    public static final int KEY_LEN = 32;
    public static final int NONCE_LEN = 12;
    public static final int TAG_LEN = 16;

    private static final String CIPHER = "ChaCha20-Poly1305";
    private static final String HMAC = "HmacSHA256";
    private static final String INFO_PREFIX = "rxguard:chunk:";

    // XXH64, seed 0. 64 bits: colisões deixam de ser desprezíveis perto de 2^32 chunks.
    private static final LongHashFunction XXH64 = LongHashFunction.xx();
    private static final HexFormat HEX = HexFormat.of();

    private final MasterKey masterKey;

    public ChunkCodec(MasterKey masterKey) {
        this.masterKey = Objects.requireNonNull(masterKey, "masterKey");
    }

    public record ChunkKeyMaterial(byte[] key, byte[] nonce) {}

    public static String computeHash(byte[] plaintext) {
        return computeHash(plaintext, 0, plaintext.length);
    }

    public static String computeHash(byte[] buf, int off, int len) {
        return HEX.toHexDigits(XXH64.hashBytes(buf, off, len));
    }

    public static ChunkKeyMaterial deriveChunkKeyAndNonce(byte[] masterKey, String hash) {
        byte[] info = (INFO_PREFIX + hash).getBytes(StandardCharsets.UTF_8);
        byte[] okm = hkdfSha256(masterKey, null, info, KEY_LEN + NONCE_LEN);
        return new ChunkKeyMaterial(
                Arrays.copyOfRange(okm, 0, KEY_LEN),
                Arrays.copyOfRange(okm, KEY_LEN, KEY_LEN + NONCE_LEN)
        );
    }

    public EncryptedChunk encryptChunk(byte[] plaintext) {
        return encryptChunk(plaintext, 0, plaintext.length);
    }

    public EncryptedChunk encryptChunk(byte[] buf, int off, int len) {
        String hash = computeHash(buf, off, len);
        Cipher cipher = initCipher(Cipher.ENCRYPT_MODE, hash);
        try {
            return new EncryptedChunk(hash, cipher.doFinal(buf, off, len));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Falha ao criptografar chunk " + hash, e);
        }
    }

    /**
     * @throws IntegrityException se a tag não conferir; nunca devolve texto claro alterado
     */
    public byte[] decryptChunk(String hash, byte[] ciphertext) throws IntegrityException {
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(ciphertext, "ciphertext");
        Cipher cipher = initCipher(Cipher.DECRYPT_MODE, hash);
        try {
            return cipher.doFinal(ciphertext);
        } catch (GeneralSecurityException e) {
            // AEADBadTagException e também ciphertext curto demais para conter a tag
            throw new IntegrityException(hash, e);
        }
    }

    // Um Cipher novo por chamada: o provider recusa reinit com a mesma chave/nonce.
    private Cipher initCipher(int mode, String hash) {
        ChunkKeyMaterial km = deriveChunkKeyAndNonce(masterKey.rawBytes(), hash);
        try {
            Cipher cipher = Cipher.getInstance(CIPHER);
            cipher.init(mode, new SecretKeySpec(km.key(), "ChaCha20"), new IvParameterSpec(km.nonce()));
            cipher.updateAAD(hash.getBytes(StandardCharsets.UTF_8));
            return cipher;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("ChaCha20-Poly1305 indisponível", e);
        }
    }

    /**
     * HKDF (RFC 5869) com HMAC-SHA256. Salt ausente equivale a 32 bytes zero.
     */
    static byte[] hkdfSha256(byte[] ikm, byte[] salt, byte[] info, int length) {
        try {
            byte[] prk = hkdfExtract(salt, ikm);
            return hkdfExpand(prk, info, length);
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HMAC-SHA256 indisponível", e);
        }
    }

    private static byte[] hkdfExtract(byte[] salt, byte[] ikm) throws NoSuchAlgorithmException, InvalidKeyException {
        Mac hmac = Mac.getInstance(HMAC);
        byte[] s = (salt == null || salt.length == 0) ? new byte[hmac.getMacLength()] : salt;
        hmac.init(new SecretKeySpec(s, HMAC));
        return hmac.doFinal(ikm);
    }

    private static byte[] hkdfExpand(byte[] prk, byte[] info, int length) throws NoSuchAlgorithmException, InvalidKeyException {
        Mac hmac = Mac.getInstance(HMAC);
        hmac.init(new SecretKeySpec(prk, HMAC));

        int hashLen = hmac.getMacLength();
        int n = (length + hashLen - 1) / hashLen;
        if (n > 255) throw new IllegalArgumentException("HKDF: tamanho de saída grande demais: " + length);

        byte[] okm = new byte[length];
        byte[] t = new byte[0];
        for (int i = 1; i <= n; i++) {
            hmac.reset();
            hmac.update(t);
            if (info != null) hmac.update(info);
            hmac.update((byte) i);
            t = hmac.doFinal();

            int copyLen = Math.min(hashLen, length - (i - 1) * hashLen);
            System.arraycopy(t, 0, okm, (i - 1) * hashLen, copyLen);
        }
        return okm;
    }
}
