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
public class StorageLocation {

    @Column(name = "storage_region", length = 50)
    private String region;

    @Column(name = "storage_bucket", length = 100)
    private String bucket;

    @Column(name = "storage_prefix", length = 200)
    private String prefix;
}
