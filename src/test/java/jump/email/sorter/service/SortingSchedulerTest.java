package jump.email.sorter.service;

import jump.email.sorter.mail.MailStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SortingSchedulerTest {

    @Mock
    private ScanCoordinator scanCoordinator;

    private CancellationToken cancellationToken;
    private SortingScheduler scheduler;

    @BeforeEach
    void setUp() {
        cancellationToken = new CancellationToken();
        scheduler = new SortingScheduler(scanCoordinator, cancellationToken);
    }

    @Test
    void runScheduledCycle_ShouldRunOneCycle() throws MailStoreException {
        // When
        scheduler.runScheduledCycle();

        // Then
        verify(scanCoordinator).runCycle();
        verify(scanCoordinator, never()).persistState();
    }

    @Test
    void runScheduledCycle_WhenCycleFails_ShouldSaveStateAndNotThrow() throws MailStoreException {
        // Given
        when(scanCoordinator.runCycle()).thenThrow(new MailStoreException("connection refused"));

        // When
        assertDoesNotThrow(() -> scheduler.runScheduledCycle());

        // Then
        verify(scanCoordinator).persistState();
    }

    @Test
    void runScheduledCycle_AfterShutdown_ShouldNotStartCycle() throws MailStoreException {
        // When
        scheduler.shutdown();
        scheduler.runScheduledCycle();

        // Then
        assertTrue(cancellationToken.isCancelled());
        verify(scanCoordinator, never()).runCycle();
        verify(scanCoordinator).persistState();
    }
}
