package org.alertingupgrade.migrations.testutils;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import org.alertingupgrade.migrations.secrets.AesGcmEncryptionService;
import org.alertingupgrade.migrations.secrets.EncryptionService;

import lombok.experimental.UtilityClass;

@UtilityClass
public class SecureSettings {
    public static final EncryptionService ENCRYPTION = new AesGcmEncryptionService("test-secret");

    public static String encrypt(String plain) {
        return Base64.getEncoder().encodeToString(ENCRYPTION.encrypt(plain.getBytes(StandardCharsets.UTF_8)));
    }

    public static String decrypt(String encoded) {
        return new String(ENCRYPTION.decrypt(Base64.getDecoder().decode(encoded)), StandardCharsets.UTF_8);
    }
}
