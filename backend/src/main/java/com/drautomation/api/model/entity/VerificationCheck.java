package com.drautomation.api.model.entity;

import com.drautomation.api.model.enums.CheckStatus;
import com.drautomation.api.model.enums.VerificationCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerificationCheck {

    private VerificationCategory category;
    private String name;
    private CheckStatus status;
    private String message;
    private String expected;
    private String actual;
}
