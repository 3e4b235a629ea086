package org.alertingupgrade.migrations.secrets;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AesGcmEncryptionServiceTest {

    private final AesGcmEncryptionService service = new AesGcmEncryptionService("test-secret");

    @Test
    void decryptReturnsWhatWasEncrypted() {
        var plain = "hunter2".getBytes(StandardCharsets.UTF_8);
        var cipher = service.encrypt(plain);
        assertThat(cipher.length, equalTo(AesGcmEncryptionService.NONCE_LENGTH + plain.length + 16));
        assertThat(new String(service.decrypt(cipher), StandardCharsets.UTF_8), equalTo("hunter2"));
    }

    @Test
    void noncesDifferPerCall() {
        var plain = "same".getBytes(StandardCharsets.UTF_8);
        assertThat(service.encrypt(plain), not(equalTo(service.encrypt(plain))));
    }

    @Test
    void otherKeysAndCorruptPayloadsFail() {
        var cipher = service.encrypt("value".getBytes(StandardCharsets.UTF_8));
        var other = new AesGcmEncryptionService("another-secret");
        assertThrows(EncryptionException.class, () -> other.decrypt(cipher));

        cipher[cipher.length - 1] ^= 1;
        assertThrows(EncryptionException.class, () -> service.decrypt(cipher));
        assertThrows(EncryptionException.class, () -> service.decrypt(new byte[4]));
    }

    @Test
    void emptySecretIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new AesGcmEncryptionService(""));
    }
}
