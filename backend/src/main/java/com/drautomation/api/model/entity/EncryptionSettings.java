package com.drautomation.api.model.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EncryptionSettings {

    public static final String ALGORITHM_AES_256_GCM = "AES-256-GCM";

    @Column(name = "encryption_enabled")
    private boolean enabled;

    @Column(name = "encryption_algorithm", length = 30)
    private String algorithm;

    @Column(name = "encryption_key_id", length = 100)
    private String keyId;
}
