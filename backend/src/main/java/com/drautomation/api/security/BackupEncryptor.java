package com.drautomation.api.security;

import com.drautomation.api.config.AutomationProperties;
import com.drautomation.api.exception.AutomationException;
import com.drautomation.api.model.enums.ErrorCategory;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * AES-256-GCM encryption of backup artifacts.
 * Output layout: IV (12 bytes) || ciphertext || auth tag.
 */
@Slf4j
@Component
public class BackupEncryptor {

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 128;
    private static final int KEY_LENGTH_BYTES = 32;

    private final AutomationProperties properties;
    private final SecureRandom secureRandom = new SecureRandom();

    private SecretKey secretKey;

    public BackupEncryptor(AutomationProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        String base64Key = properties.getBackup().getEncryption().getKey();
        if (base64Key == null || base64Key.isBlank()) {
            log.warn("Backup encryption key not configured - encrypted backups and restores are unavailable");
            return;
        }
        this.secretKey = new SecretKeySpec(decodeKey(base64Key), "AES");
        log.info("Backup encryptor initialized (keyId={})", properties.getBackup().getEncryption().getKeyId());
    }

    /**
     * Decodes and checks a base64 key, failing on anything other than 32 bytes.
     */
    public static byte[] decodeKey(String base64Key) {
        byte[] decodedKey;
        try {
            decodedKey = Base64.getDecoder().decode(base64Key);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Backup encryption key must be valid base64", e);
        }
        if (decodedKey.length != KEY_LENGTH_BYTES) {
            throw new IllegalStateException(
                    "Backup encryption key must be exactly 32 bytes (256 bits) when decoded. " +
                    "Current length: " + decodedKey.length + " bytes");
        }
        return decodedKey;
    }

    public boolean isConfigured() {
        return secretKey != null;
    }

    public String getKeyId() {
        return properties.getBackup().getEncryption().getKeyId();
    }

    public byte[] encrypt(byte[] plaintext) {
        checkConfigured();
        try {
            byte[] iv = new byte[GCM_IV_LENGTH];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            byte[] ciphertext = cipher.doFinal(plaintext);

            ByteBuffer byteBuffer = ByteBuffer.allocate(iv.length + ciphertext.length);
            byteBuffer.put(iv);
            byteBuffer.put(ciphertext);
            return byteBuffer.array();
        } catch (GeneralSecurityException e) {
            throw new AutomationException(AutomationException.CODE_ENCRYPTION_ERROR, ErrorCategory.INTERNAL,
                    "Failed to encrypt backup", e);
        }
    }

    public byte[] decrypt(byte[] encrypted) {
        checkConfigured();
        if (encrypted.length <= GCM_IV_LENGTH) {
            throw AutomationException.integrity(AutomationException.CODE_ENCRYPTION_ERROR,
                    "Encrypted backup is truncated");
        }
        try {
            ByteBuffer byteBuffer = ByteBuffer.wrap(encrypted);
            byte[] iv = new byte[GCM_IV_LENGTH];
            byteBuffer.get(iv);
            byte[] ciphertext = new byte[byteBuffer.remaining()];
            byteBuffer.get(ciphertext);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            return cipher.doFinal(ciphertext);
        } catch (GeneralSecurityException e) {
            throw new AutomationException(AutomationException.CODE_ENCRYPTION_ERROR, ErrorCategory.INTEGRITY,
                    "Failed to decrypt backup", e);
        }
    }

    private void checkConfigured() {
        if (!isConfigured()) {
            throw AutomationException.validation(AutomationException.CODE_PREREQUISITE_FAILED,
                    "Backup encryption key is not configured. Set automation.backup.encryption.key.");
        }
    }
}
