package org.alertingupgrade.migrations.secrets;

/** Symmetric encryption of secure settings; the same key serves every org */
public interface EncryptionService {
    /**
     * @throws EncryptionException when encryption fails
     */
    byte[] encrypt(byte[] plaintext);

    /**
     * @throws EncryptionException when the payload was not produced by this key or is corrupt
     */
    byte[] decrypt(byte[] payload);
}
