package com.drautomation.api.security;

import com.drautomation.api.config.AutomationProperties;
import com.drautomation.api.exception.AutomationException;
import com.drautomation.api.model.enums.ErrorCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BackupEncryptor")
class BackupEncryptorTest {

    private BackupEncryptor encryptor;

    @BeforeEach
    void setUp() {
        encryptor = encryptorWithKey(key((byte) 1));
    }

    private static String key(byte seed) {
        byte[] key = new byte[32];
        for (int i = 0; i < 32; i++) key[i] = (byte) (seed + i);
        return Base64.getEncoder().encodeToString(key);
    }

    private static BackupEncryptor encryptorWithKey(String base64Key) {
        AutomationProperties properties = new AutomationProperties();
        properties.getBackup().getEncryption().setKey(base64Key);
        BackupEncryptor e = new BackupEncryptor(properties);
        e.init();
        return e;
    }

    @Nested
    @DisplayName("init")
    class Init {

        @Test
        @DisplayName("should stay unconfigured without a key")
        void shouldStayUnconfigured() {
            BackupEncryptor e = encryptorWithKey(null);

            assertThat(e.isConfigured()).isFalse();
            assertThatThrownBy(() -> e.encrypt(new byte[]{1}))
                    .isInstanceOf(AutomationException.class)
                    .hasMessageContaining("automation.backup.encryption.key");
        }

        @Test
        @DisplayName("should throw when key is not 32 bytes")
        void shouldThrowWhenKeyWrongLength() {
            String shortKey = Base64.getEncoder().encodeToString(new byte[16]);

            assertThatThrownBy(() -> encryptorWithKey(shortKey))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("32 bytes");
        }

        @Test
        @DisplayName("should throw when key is invalid base64")
        void shouldThrowWhenKeyInvalidBase64() {
            assertThatThrownBy(() -> encryptorWithKey("not-valid-base64!!!"))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("base64");
        }
    }

    @Nested
    @DisplayName("encrypt and decrypt")
    class EncryptDecrypt {

        @Test
        @DisplayName("should decrypt what it encrypted")
        void shouldRoundTrip() {
            byte[] plaintext = "{\"tables\":[\"users\"]}".getBytes(StandardCharsets.UTF_8);

            byte[] encrypted = encryptor.encrypt(plaintext);

            assertThat(encrypted).isNotEqualTo(plaintext);
            assertThat(encryptor.decrypt(encrypted)).isEqualTo(plaintext);
        }

        @Test
        @DisplayName("should use a fresh IV for every encryption")
        void shouldUseFreshIv() {
            byte[] plaintext = "same input".getBytes(StandardCharsets.UTF_8);

            assertThat(encryptor.encrypt(plaintext)).isNotEqualTo(encryptor.encrypt(plaintext));
        }

        @Test
        @DisplayName("should reject tampered ciphertext as an integrity failure")
        void shouldRejectTampered() {
            byte[] encrypted = encryptor.encrypt("payload".getBytes(StandardCharsets.UTF_8));
            encrypted[encrypted.length - 1] ^= 0x01;

            assertThatThrownBy(() -> encryptor.decrypt(encrypted))
                    .isInstanceOf(AutomationException.class)
                    .satisfies(e -> assertThat(((AutomationException) e).getCategory())
                            .isEqualTo(ErrorCategory.INTEGRITY));
        }

        @Test
        @DisplayName("should reject data encrypted under another key")
        void shouldRejectOtherKey() {
            byte[] encrypted = encryptorWithKey(key((byte) 50)).encrypt("payload".getBytes(StandardCharsets.UTF_8));

            assertThatThrownBy(() -> encryptor.decrypt(encrypted))
                    .isInstanceOf(AutomationException.class)
                    .hasMessage("Failed to decrypt backup");
        }

        @Test
        @DisplayName("should reject truncated input")
        void shouldRejectTruncated() {
            assertThatThrownBy(() -> encryptor.decrypt(new byte[8]))
                    .isInstanceOf(AutomationException.class)
                    .hasMessageContaining("truncated");
        }
    }
}
