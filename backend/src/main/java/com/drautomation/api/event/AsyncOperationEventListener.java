package com.drautomation.api.event;

import com.drautomation.api.service.BackupService;
import com.drautomation.api.service.DisasterRecoveryService;
import com.drautomation.api.service.RecoveryTestService;
import com.drautomation.api.service.RestoreService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Starts long-running work once the transaction that created its record has committed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AsyncOperationEventListener {

    private final BackupService backupService;
    private final RestoreService restoreService;
    private final RecoveryTestService recoveryTestService;
    private final DisasterRecoveryService disasterRecoveryService;

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleBackupRequested(BackupRequestedEvent event) {
        log.debug("Handling BackupRequestedEvent for job: {}", event.getJobId());
        backupService.executeBackup(event.getJobId());
    }

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleRestoreRequested(RestoreRequestedEvent event) {
        log.debug("Handling RestoreRequestedEvent for job: {}", event.getRestoreJobId());
        restoreService.executeRestore(event.getRestoreJobId());
    }

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleRecoveryTestRequested(RecoveryTestRequestedEvent event) {
        log.debug("Handling RecoveryTestRequestedEvent for test: {}", event.getTestId());
        recoveryTestService.executeTest(event.getTestId());
    }

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleDisasterRecoveryRequested(DisasterRecoveryRequestedEvent event) {
        log.debug("Handling DisasterRecoveryRequestedEvent for execution: {}", event.getExecutionId());
        disasterRecoveryService.executeRecovery(event.getExecutionId());
    }
}
