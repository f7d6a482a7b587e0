package com.drautomation.api.model.entity;

import com.drautomation.api.model.enums.CheckStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Post-restore verification outcome. Passes only when no check failed; warnings do not fail it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerificationResult {

    @Builder.Default
    private List<VerificationCheck> checks = new ArrayList<>();
    private int totalChecks;
    private int passedChecks;
    private int failedChecks;
    private int warnings;
    private boolean passed;

    public static VerificationResult of(List<VerificationCheck> checks) {
        int passed = 0;
        int failed = 0;
        int warnings = 0;
        for (VerificationCheck check : checks) {
            if (check.getStatus() == CheckStatus.PASSED) {
                passed++;
            } else if (check.getStatus() == CheckStatus.FAILED) {
                failed++;
            } else {
                warnings++;
            }
        }
        return VerificationResult.builder()
                .checks(new ArrayList<>(checks))
                .totalChecks(checks.size())
                .passedChecks(passed)
                .failedChecks(failed)
                .warnings(warnings)
                .passed(failed == 0)
                .build();
    }
}
