package org.alertingupgrade.migrations.secrets;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

import com.google.common.hash.Hashing;

/** AES-256-GCM keyed by the SHA-256 of the secret; payloads are the 12 byte nonce followed by the ciphertext */
public class AesGcmEncryptionService implements EncryptionService {
    static final String TRANSFORMATION = "AES/GCM/NoPadding";
    static final int NONCE_LENGTH = 12;
    static final int TAG_LENGTH_BITS = 128;

    private final SecretKeySpec key;
    private final SecureRandom random = new SecureRandom();

    public AesGcmEncryptionService(String secretKey) {
        if (secretKey == null || secretKey.isEmpty()) {
            throw new IllegalArgumentException("secret key must not be empty");
        }
        var keyBytes = Hashing.sha256().hashString(secretKey, StandardCharsets.UTF_8).asBytes();
        this.key = new SecretKeySpec(keyBytes, "AES");
    }

    @Override
    public byte[] encrypt(byte[] plaintext) {
        var nonce = new byte[NONCE_LENGTH];
        random.nextBytes(nonce);
        try {
            var cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, nonce));
            var ciphertext = cipher.doFinal(plaintext);
            return ByteBuffer.allocate(NONCE_LENGTH + ciphertext.length).put(nonce).put(ciphertext).array();
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("failed to encrypt payload", e);
        }
    }

    @Override
    public byte[] decrypt(byte[] payload) {
        if (payload == null || payload.length <= NONCE_LENGTH) {
            throw new EncryptionException("payload too short to decrypt", null);
        }
        var nonce = Arrays.copyOfRange(payload, 0, NONCE_LENGTH);
        try {
            var cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, nonce));
            return cipher.doFinal(payload, NONCE_LENGTH, payload.length - NONCE_LENGTH);
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("failed to decrypt payload", e);
        }
    }
}
