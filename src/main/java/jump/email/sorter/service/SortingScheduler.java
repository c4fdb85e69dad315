package jump.email.sorter.service;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drives the scan cycles. A failed cycle is logged and retried on the next tick; the process
 * only stops on shutdown.
 */
@Slf4j
@Component
public class SortingScheduler {
    private final ScanCoordinator scanCoordinator;
    private final CancellationToken cancellationToken;

    public SortingScheduler(ScanCoordinator scanCoordinator, CancellationToken cancellationToken) {
        this.scanCoordinator = scanCoordinator;
        this.cancellationToken = cancellationToken;
    }

    @Scheduled(fixedDelayString = "${sorter.poll-interval-ms:60000}")
    public void runScheduledCycle() {
        if (cancellationToken.isCancelled()) {
            return;
        }
        try {
            scanCoordinator.runCycle();
        } catch (Exception e) {
            log.error("Error in sorting cycle: {}", e.getMessage(), e);
            try {
                scanCoordinator.persistState();
            } catch (RuntimeException saveError) {
                log.error("Could not save state after failed cycle: {}", saveError.getMessage(), saveError);
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutdown requested, saving state");
        cancellationToken.cancel();
        scanCoordinator.persistState();
    }
}
